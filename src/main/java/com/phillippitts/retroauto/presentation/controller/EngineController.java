package com.phillippitts.retroauto.presentation.controller;

import com.phillippitts.retroauto.dsl.ast.Program;
import com.phillippitts.retroauto.service.engine.Breakpoints;
import com.phillippitts.retroauto.service.engine.ExecutionSnapshot;
import com.phillippitts.retroauto.service.session.ScriptSessionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Control and debugger surface for the script engine.
 *
 * <ul>
 *   <li>{@code POST /start}: script text ({@code text/plain}) or {@code {"script":..,"rules":..}}</li>
 *   <li>{@code POST /validate}: parse only</li>
 *   <li>{@code POST /stop}, {@code /pause}, {@code /resume}</li>
 *   <li>{@code GET /snapshot}, {@code GET /state}</li>
 *   <li>{@code GET|POST|DELETE /breakpoints}</li>
 * </ul>
 * Errors are mapped by {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/engine")
class EngineController {

    private static final Logger LOG = LogManager.getLogger(EngineController.class);

    private final ScriptSessionService sessions;

    EngineController(ScriptSessionService sessions) {
        this.sessions = sessions;
    }

    record StartRequest(@NotBlank String script, String rules) {}

    record BreakpointRequest(@NotBlank String flow, @Min(0) int instructionIndex) {}

    @PostMapping(path = "/start", consumes = MediaType.TEXT_PLAIN_VALUE)
    ResponseEntity<Map<String, Object>> startText(@RequestBody String script) {
        return started(sessions.start(script, null));
    }

    @PostMapping(path = "/start", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<Map<String, Object>> startJson(@Valid @RequestBody StartRequest request) {
        return started(sessions.start(request.script(), request.rules()));
    }

    @PostMapping(path = "/validate", consumes = MediaType.TEXT_PLAIN_VALUE)
    ResponseEntity<Map<String, Object>> validate(@RequestBody String script) {
        Program program = sessions.load(script);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("valid", true);
        body.put("entry", program.entryFlow());
        body.put("flows", List.copyOf(program.flows().keySet()));
        body.put("interrupts", program.interrupts().size());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/stop")
    ResponseEntity<Map<String, Object>> stop() {
        return ResponseEntity.ok(status(sessions.stop()));
    }

    @PostMapping("/pause")
    ResponseEntity<Map<String, Object>> pause() {
        return ResponseEntity.ok(status(sessions.pause()));
    }

    @PostMapping("/resume")
    ResponseEntity<Map<String, Object>> resume() {
        return ResponseEntity.ok(status(sessions.resume()));
    }

    @GetMapping("/snapshot")
    ExecutionSnapshot snapshot() {
        return sessions.snapshot();
    }

    @GetMapping("/state")
    Map<String, Object> state() {
        Map<String, Object> body = status(false);
        body.remove("changed");
        sessions.lastSession().ifPresent(s -> body.put("lastSession", s));
        return body;
    }

    @GetMapping("/breakpoints")
    List<Breakpoints.Breakpoint> breakpoints() {
        return sessions.breakpoints().list();
    }

    @PostMapping("/breakpoints")
    ResponseEntity<List<Breakpoints.Breakpoint>> addBreakpoint(@Valid @RequestBody BreakpointRequest request) {
        sessions.breakpoints().add(request.flow(), request.instructionIndex());
        LOG.info("Breakpoint added at {}:{}", request.flow(), request.instructionIndex());
        return ResponseEntity.status(HttpStatus.CREATED).body(sessions.breakpoints().list());
    }

    /** Without parameters clears every breakpoint. */
    @DeleteMapping("/breakpoints")
    List<Breakpoints.Breakpoint> removeBreakpoints(@RequestParam(required = false) String flow,
                                                   @RequestParam(required = false) Integer index) {
        if (flow == null && index == null) {
            sessions.breakpoints().clear();
        } else if (flow == null || index == null) {
            throw new IllegalArgumentException("Both flow and index are required to remove one breakpoint");
        } else {
            sessions.breakpoints().remove(flow, index);
        }
        return sessions.breakpoints().list();
    }

    private ResponseEntity<Map<String, Object>> started(String sessionId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", sessionId);
        body.put("state", sessions.state());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    private Map<String, Object> status(boolean changed) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("changed", changed);
        body.put("state", sessions.state());
        sessions.activeSession().ifPresent(id -> body.put("sessionId", id));
        return body;
    }
}
