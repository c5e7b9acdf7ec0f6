package com.phillippitts.retroauto.presentation.controller;

import com.phillippitts.retroauto.dsl.Parser;
import com.phillippitts.retroauto.exception.ParseException;
import com.phillippitts.retroauto.service.engine.Breakpoints;
import com.phillippitts.retroauto.service.engine.EngineState;
import com.phillippitts.retroauto.service.engine.ExecutionSnapshot;
import com.phillippitts.retroauto.service.session.ScriptSessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(EngineController.class)
class EngineControllerTest {

    private static final String SCRIPT = """
            @main:
              log("hi")
            """;

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ScriptSessionService sessions;

    private Breakpoints breakpoints;

    @BeforeEach
    void setUp() {
        breakpoints = new Breakpoints();
        when(sessions.breakpoints()).thenReturn(breakpoints);
        when(sessions.state()).thenReturn(EngineState.IDLE);
        when(sessions.activeSession()).thenReturn(Optional.empty());
        when(sessions.lastSession()).thenReturn(Optional.empty());
    }

    @Test
    void startsPlainTextScript() throws Exception {
        // Arrange
        when(sessions.start(SCRIPT, null)).thenReturn("session-1");
        when(sessions.state()).thenReturn(EngineState.RUNNING);

        // Act + Assert
        mvc.perform(post("/api/engine/start").contentType(MediaType.TEXT_PLAIN).content(SCRIPT))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.sessionId").value("session-1"))
                .andExpect(jsonPath("$.state").value("RUNNING"));
    }

    @Test
    void startsJsonScriptWithRules() throws Exception {
        when(sessions.start(anyString(), anyString())).thenReturn("session-2");

        mvc.perform(post("/api/engine/start").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"script\":\"@main:\\n  log(\\\"x\\\")\\n\",\"rules\":\"[]\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.sessionId").value("session-2"));

        verify(sessions).start("@main:\n  log(\"x\")\n", "[]");
    }

    @Test
    void blankJsonScriptIsRejected() throws Exception {
        mvc.perform(post("/api/engine/start").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"script\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ValidationFailed"));
    }

    @Test
    void busyEngineReturnsConflict() throws Exception {
        when(sessions.start(anyString(), isNull()))
                .thenThrow(new IllegalStateException("A script is already running"));

        mvc.perform(post("/api/engine/start").contentType(MediaType.TEXT_PLAIN).content(SCRIPT))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details").value("A script is already running"));
    }

    @Test
    void parseErrorCarriesLocation() throws Exception {
        when(sessions.start(anyString(), isNull()))
                .thenThrow(new ParseException("unknown action 'jump'", 2, 3));

        mvc.perform(post("/api/engine/start").contentType(MediaType.TEXT_PLAIN).content("@main:\n  jump()\n"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ParseException"))
                .andExpect(jsonPath("$.line").value(2))
                .andExpect(jsonPath("$.column").value(3));
    }

    @Test
    void validateDescribesProgram() throws Exception {
        when(sessions.load(anyString())).thenAnswer(inv -> Parser.parseSource(inv.getArgument(0)));

        mvc.perform(post("/api/engine/validate").contentType(MediaType.TEXT_PLAIN).content(SCRIPT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.entry").value("main"))
                .andExpect(jsonPath("$.flows[0]").value("main"))
                .andExpect(jsonPath("$.interrupts").value(0));
    }

    @Test
    void controlEndpointsReportWhetherStateChanged() throws Exception {
        when(sessions.pause()).thenReturn(true);
        when(sessions.state()).thenReturn(EngineState.PAUSED);
        when(sessions.activeSession()).thenReturn(Optional.of("session-3"));

        mvc.perform(post("/api/engine/pause"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(true))
                .andExpect(jsonPath("$.state").value("PAUSED"))
                .andExpect(jsonPath("$.sessionId").value("session-3"));

        mvc.perform(post("/api/engine/stop"))
                .andExpect(jsonPath("$.changed").value(false));
    }

    @Test
    void snapshotExposesCallStackAndVariables() throws Exception {
        when(sessions.snapshot()).thenReturn(new ExecutionSnapshot(true, false, "helper", 2, "click(1, 2)",
                List.of(new ExecutionSnapshot.FrameView("main", 4, null),
                        new ExecutionSnapshot.FrameView("helper", 2, "popup")),
                Map.of("count", "3"), Instant.parse("2026-01-01T00:00:00Z")));

        mvc.perform(get("/api/engine/snapshot"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeFlow").value("helper"))
                .andExpect(jsonPath("$.instructionPointer").value(2))
                .andExpect(jsonPath("$.callStack[1].interruptRuleId").value("popup"))
                .andExpect(jsonPath("$.variables.count").value("3"));
    }

    @Test
    void breakpointsCanBeAddedAndRemoved() throws Exception {
        mvc.perform(post("/api/engine/breakpoints").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"flow\":\"main\",\"instructionIndex\":3}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$[0].flow").value("main"))
                .andExpect(jsonPath("$[0].instructionIndex").value(3));
        assertThat(breakpoints.contains("main", 3)).isTrue();

        mvc.perform(delete("/api/engine/breakpoints").param("flow", "main").param("index", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
        assertThat(breakpoints.list()).isEmpty();
    }

    @Test
    void removingOneBreakpointNeedsFlowAndIndex() throws Exception {
        breakpoints.add("main", 1);

        mvc.perform(delete("/api/engine/breakpoints").param("flow", "main"))
                .andExpect(status().isBadRequest());
        mvc.perform(delete("/api/engine/breakpoints"))
                .andExpect(status().isOk());

        assertThat(breakpoints.list()).isEmpty();
    }
}
