package com.phillippitts.retroauto.service.session;

import com.phillippitts.retroauto.config.properties.EngineProperties;
import com.phillippitts.retroauto.config.properties.SupervisorProperties;
import com.phillippitts.retroauto.domain.ErrorPolicy;
import com.phillippitts.retroauto.exception.ParseException;
import com.phillippitts.retroauto.service.engine.EngineState;
import com.phillippitts.retroauto.service.events.EngineStateChangedEvent;
import com.phillippitts.retroauto.service.events.InterruptFiredEvent;
import com.phillippitts.retroauto.service.hotkey.HotkeyAction;
import com.phillippitts.retroauto.service.hotkey.ScriptHotkeyManager;
import com.phillippitts.retroauto.service.hotkey.event.HotkeyPressedEvent;
import com.phillippitts.retroauto.testutil.EventCapturingPublisher;
import com.phillippitts.retroauto.testutil.FakeVisionMatcher;
import com.phillippitts.retroauto.testutil.RecordingActionExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ScriptSessionServiceTest {

    private static final String ENDLESS = "@main:\n  loop:\n    delay(10ms)\n  end\n";

    private FakeVisionMatcher vision;
    private RecordingActionExecutor input;
    private EventCapturingPublisher events;
    private ThreadPoolTaskExecutor engineExecutor;
    private ThreadPoolTaskScheduler scheduler;
    private ScriptSessionService service;

    @BeforeEach
    void setUp() {
        vision = new FakeVisionMatcher();
        input = new RecordingActionExecutor();
        events = new EventCapturingPublisher();

        engineExecutor = new ThreadPoolTaskExecutor();
        engineExecutor.setCorePoolSize(1);
        engineExecutor.setMaxPoolSize(1);
        engineExecutor.setQueueCapacity(0);
        engineExecutor.initialize();
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.initialize();

        service = newService(new EngineProperties(null, ErrorPolicy.ABORT, 1000L, 10L, false, null, null, null));
    }

    @SuppressWarnings("unchecked")
    private ScriptSessionService newService(EngineProperties props) {
        ObjectProvider<ScriptHotkeyManager> noHotkeys = mock(ObjectProvider.class);
        return new ScriptSessionService(props, new SupervisorProperties(true, 50L), vision, input,
                engineExecutor, scheduler, events, noHotkeys, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        service.stop();
        await().atMost(Duration.ofSeconds(2)).until(() -> service.state() == EngineState.IDLE);
        engineExecutor.shutdown();
        scheduler.shutdown();
    }

    private void awaitIdle() {
        await().atMost(Duration.ofSeconds(5)).until(() -> service.state() == EngineState.IDLE);
    }

    @Test
    void runsScriptToCompletion() {
        // Act
        String sessionId = service.start("@main:\n  type(\"hello\")\n", null);
        awaitIdle();

        // Assert
        assertThat(input.typed()).containsExactly("hello");
        assertThat(service.lastSession()).get().satisfies(summary -> {
            assertThat(summary.sessionId()).isEqualTo(sessionId);
            assertThat(summary.outcome()).isEqualTo(SessionSummary.Outcome.COMPLETED);
            assertThat(summary.error()).isNull();
        });
        assertThat(events.ofType(EngineStateChangedEvent.class))
                .extracting(EngineStateChangedEvent::to, EngineStateChangedEvent::reason)
                .containsExactly(
                        tuple(EngineState.RUNNING, "start"),
                        tuple(EngineState.IDLE, "completed"));
        assertThat(service.activeSession()).isEmpty();
    }

    @Test
    void rejectsSecondStartWhileRunning() {
        service.start(ENDLESS, null);

        assertThatThrownBy(() -> service.start(ENDLESS, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already running");
    }

    @Test
    void stopEndsSessionAsStopped() {
        service.start(ENDLESS, null);
        await().atMost(Duration.ofSeconds(2)).until(() -> service.snapshot().running());

        assertThat(service.stop()).isTrue();
        awaitIdle();

        assertThat(service.lastSession()).get()
                .extracting(SessionSummary::outcome).isEqualTo(SessionSummary.Outcome.STOPPED);
        assertThat(events.ofType(EngineStateChangedEvent.class)).extracting(EngineStateChangedEvent::to)
                .containsSubsequence(EngineState.RUNNING, EngineState.STOPPING, EngineState.IDLE);
        assertThat(service.stop()).isFalse();
    }

    @Test
    void pauseAndResumeAreReflectedInState() {
        service.start(ENDLESS, null);

        assertThat(service.pause()).isTrue();
        assertThat(service.state()).isEqualTo(EngineState.PAUSED);
        assertThat(service.pause()).isFalse();

        assertThat(service.togglePause()).isTrue();
        assertThat(service.state()).isEqualTo(EngineState.RUNNING);
    }

    @Test
    void fatalErrorEndsSessionAsFailed() {
        service.start("@main:\n  run main\n", null);
        awaitIdle();

        assertThat(service.lastSession()).get().satisfies(summary -> {
            assertThat(summary.outcome()).isEqualTo(SessionSummary.Outcome.FAILED);
            assertThat(summary.error()).contains("main");
        });
    }

    @Test
    void invalidScriptNeverStarts() {
        assertThatThrownBy(() -> service.start("@main:\n  fly()\n", null)).isInstanceOf(ParseException.class);
        assertThat(service.state()).isEqualTo(EngineState.IDLE);
        assertThat(events.events).isEmpty();
    }

    @Test
    void invalidRuleFileNeverStarts() {
        String rules = "[{\"id\":\"r\",\"triggerAssetId\":\"a.png\",\"targetFlow\":\"missing\"}]";

        assertThatThrownBy(() -> service.start("@main:\n  type(\"x\")\n", rules))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown flow");
        assertThat(service.state()).isEqualTo(EngineState.IDLE);
    }

    @Test
    @SuppressWarnings("unchecked")
    void failureWhileStartingReturnsEngineToIdle() {
        // Arrange
        TaskScheduler failing = mock(TaskScheduler.class);
        when(failing.scheduleAtFixedRate(any(Runnable.class), any(Duration.class)))
                .thenThrow(new IllegalStateException("scheduler unavailable"));
        ScriptSessionService broken = new ScriptSessionService(
                new EngineProperties(null, ErrorPolicy.ABORT, 1000L, 10L, false, null, null, null),
                new SupervisorProperties(true, 50L), vision, input, engineExecutor, failing, events,
                mock(ObjectProvider.class), Clock.systemUTC());
        String withRule = """
                @interrupts
                  popup: popup -> dismiss

                @main:
                  type("main")

                @dismiss:
                  type("dismissed")
                """;

        // Act
        assertThatThrownBy(() -> broken.start(withRule, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("scheduler unavailable");

        // Assert
        assertThat(broken.state()).isEqualTo(EngineState.IDLE);
        assertThat(broken.activeSession()).isEmpty();
        assertThat(input.typed()).isEmpty();
        assertThat(events.ofType(EngineStateChangedEvent.class))
                .extracting(EngineStateChangedEvent::to, EngineStateChangedEvent::reason)
                .containsExactly(
                        tuple(EngineState.RUNNING, "start"),
                        tuple(EngineState.IDLE, "failed"));

        broken.start("@main:\n  type(\"again\")\n", null);
        await().atMost(Duration.ofSeconds(5)).until(() -> broken.state() == EngineState.IDLE);
        assertThat(input.typed()).containsExactly("again");
    }

    @Test
    void zeroTickIntervalIsRejectedBeforeStarting() {
        assertThatThrownBy(() -> service.start("@config\n  tick_interval = 0ms\n@main:\n  type(\"x\")\n", null))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("tick_interval must be at least 50ms");

        assertThat(service.state()).isEqualTo(EngineState.IDLE);
        assertThat(events.ofType(EngineStateChangedEvent.class)).isEmpty();
    }

    @Test
    void ruleFromFileInterruptsScript() {
        // Arrange
        vision.show("popup.png");
        String script = """
                @config
                  tick_interval = 50ms

                @main:
                  loop 30:
                    delay(10ms)
                  end
                  type("done")

                @dismiss:
                  type("dismissed")
                """;
        String rules = "[{\"id\":\"popup\",\"triggerAssetId\":\"popup.png\",\"targetFlow\":\"dismiss\","
                + "\"cooldownMs\":60000}]";

        // Act
        service.start(script, rules);
        awaitIdle();

        // Assert
        assertThat(input.typed()).containsExactly("dismissed", "done");
        assertThat(events.ofType(InterruptFiredEvent.class)).singleElement()
                .extracting(InterruptFiredEvent::ruleId).isEqualTo("popup");
    }

    @Test
    void breakpointPausesSessionUntilResumed() {
        service.breakpoints().add("main", 1);
        service.start("@main:\n  type(\"a\")\n  type(\"b\")\n", null);

        await().atMost(Duration.ofSeconds(2)).until(() -> service.state() == EngineState.PAUSED);
        assertThat(service.snapshot().instructionPointer()).isEqualTo(1);
        assertThat(input.typed()).containsExactly("a");

        service.resume();
        awaitIdle();
        assertThat(input.typed()).containsExactly("a", "b");
        assertThat(service.snapshot().running()).isFalse();
    }

    @Test
    void startsConfiguredScriptFromFile(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("job.retro");
        Files.writeString(script, "@main:\n  type(\"from file\")\n");
        service = newService(new EngineProperties(null, null, null, null, null, script.toString(), null, null));

        Optional<String> sessionId = service.startConfiguredScript();
        awaitIdle();

        assertThat(sessionId).isPresent();
        assertThat(input.typed()).containsExactly("from file");
    }

    @Test
    void startHotkeyWithoutConfiguredScriptIsIgnored() {
        service.onHotkey(new HotkeyPressedEvent(HotkeyAction.START, Instant.now()));

        assertThat(service.state()).isEqualTo(EngineState.IDLE);
        assertThat(service.startConfiguredScript()).isEmpty();
    }

    @Test
    void stopHotkeyStopsRunningSession() {
        service.start(ENDLESS, null);

        service.onHotkey(new HotkeyPressedEvent(HotkeyAction.STOP, Instant.now()));
        awaitIdle();

        assertThat(service.lastSession()).get()
                .extracting(SessionSummary::outcome).isEqualTo(SessionSummary.Outcome.STOPPED);
    }
}
