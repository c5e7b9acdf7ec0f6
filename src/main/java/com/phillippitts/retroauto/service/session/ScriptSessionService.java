package com.phillippitts.retroauto.service.session;

import com.phillippitts.retroauto.config.properties.EngineProperties;
import com.phillippitts.retroauto.config.properties.SupervisorProperties;
import com.phillippitts.retroauto.domain.InterruptRule;
import com.phillippitts.retroauto.dsl.Parser;
import com.phillippitts.retroauto.dsl.ast.Program;
import com.phillippitts.retroauto.exception.ParseException;
import com.phillippitts.retroauto.exception.ScriptExecutionException;
import com.phillippitts.retroauto.service.engine.Breakpoints;
import com.phillippitts.retroauto.service.engine.EngineState;
import com.phillippitts.retroauto.service.engine.ExecutionControl;
import com.phillippitts.retroauto.service.engine.ExecutionSettings;
import com.phillippitts.retroauto.service.engine.ExecutionSnapshot;
import com.phillippitts.retroauto.service.engine.FlowCompiler;
import com.phillippitts.retroauto.service.engine.FlowRegistry;
import com.phillippitts.retroauto.service.engine.MainExecutor;
import com.phillippitts.retroauto.service.engine.PreemptionSlot;
import com.phillippitts.retroauto.service.events.EngineStateChangedEvent;
import com.phillippitts.retroauto.service.hotkey.HotkeyAction;
import com.phillippitts.retroauto.service.hotkey.ScriptHotkeyManager;
import com.phillippitts.retroauto.service.hotkey.event.HotkeyPressedEvent;
import com.phillippitts.retroauto.service.input.ActionExecutor;
import com.phillippitts.retroauto.service.supervisor.InterruptRuleLoader;
import com.phillippitts.retroauto.service.supervisor.InterruptSupervisor;
import com.phillippitts.retroauto.service.vision.VisionMatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads scripts and runs one session at a time: the {@link MainExecutor} on the engine
 * executor thread and its {@link InterruptSupervisor} on the supervisor scheduler.
 *
 * <p>Start, stop and pause arrive from REST, global hotkeys or the startup launcher.
 * Pauses raised inside the executor (breakpoints, {@code on_error=pause}) reach the state
 * machine through the {@link ExecutionControl} listener, so every path publishes the same
 * {@link EngineStateChangedEvent}s.
 *
 * <p><b>Thread Safety:</b> lifecycle transitions go through {@link EngineStateMachine};
 * the running session is published through an {@link AtomicReference}.
 */
@Service
public class ScriptSessionService {

    private static final Logger LOG = LogManager.getLogger(ScriptSessionService.class);

    private final EngineProperties engineProps;
    private final SupervisorProperties supervisorProps;
    private final VisionMatcher visionMatcher;
    private final ActionExecutor actionExecutor;
    private final TaskExecutor engineExecutor;
    private final TaskScheduler supervisorScheduler;
    private final ApplicationEventPublisher publisher;
    private final ObjectProvider<ScriptHotkeyManager> hotkeys;
    private final Clock clock;

    private final EngineStateMachine stateMachine = new EngineStateMachine();
    private final Breakpoints breakpoints = new Breakpoints();
    private final AtomicReference<Session> current = new AtomicReference<>();
    private final AtomicReference<ExecutionSnapshot> lastSnapshot = new AtomicReference<>(ExecutionSnapshot.EMPTY);
    private final AtomicReference<SessionSummary> lastSummary = new AtomicReference<>();

    public ScriptSessionService(EngineProperties engineProps,
                                SupervisorProperties supervisorProps,
                                VisionMatcher visionMatcher,
                                ActionExecutor actionExecutor,
                                @Qualifier("engineExecutor") TaskExecutor engineExecutor,
                                @Qualifier("supervisorScheduler") TaskScheduler supervisorScheduler,
                                ApplicationEventPublisher publisher,
                                ObjectProvider<ScriptHotkeyManager> hotkeys,
                                Clock clock) {
        this.engineProps = Objects.requireNonNull(engineProps, "engineProps");
        this.supervisorProps = Objects.requireNonNull(supervisorProps, "supervisorProps");
        this.visionMatcher = Objects.requireNonNull(visionMatcher, "visionMatcher");
        this.actionExecutor = Objects.requireNonNull(actionExecutor, "actionExecutor");
        this.engineExecutor = Objects.requireNonNull(engineExecutor, "engineExecutor");
        this.supervisorScheduler = Objects.requireNonNull(supervisorScheduler, "supervisorScheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.hotkeys = hotkeys;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Parses and validates a script without running it.
     *
     * @throws ParseException on the first syntax or validation error
     */
    public Program load(String source) {
        return Parser.parseSource(source);
    }

    /**
     * Parses {@code source} and starts it.
     *
     * @param rulesJson optional JSON rule array registered after the script's own rules
     * @return the new session id
     * @throws ParseException if the script is invalid
     * @throws IllegalArgumentException if the rule file is invalid
     * @throws IllegalStateException if a session is already active
     */
    public String start(String source, String rulesJson) {
        Program program = load(source);
        List<InterruptRule> fileRules = rulesJson == null ? List.of() : InterruptRuleLoader.parse(rulesJson);
        return start(program, fileRules);
    }

    /** Reads the script (and the optional rule file) from disk and starts it. */
    public String startFromFile(Path script, Path rules) {
        String source;
        try {
            source = Files.readString(script, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read script " + script, e);
        }
        List<InterruptRule> fileRules = rules == null ? List.of() : InterruptRuleLoader.load(rules);
        LOG.info("Loaded script {}", script);
        return start(load(source), fileRules);
    }

    public String start(Program program, List<InterruptRule> fileRules) {
        FlowRegistry registry = FlowCompiler.compile(program);
        List<InterruptRule> rules = InterruptRuleLoader.merge(program.interrupts(), fileRules, registry.names());
        ExecutionSettings settings = ExecutionSettings.from(engineProps).withOverrides(program);

        String sessionId = UUID.randomUUID().toString();
        if (!stateMachine.begin(sessionId)) {
            throw new IllegalStateException("A script is already running (session "
                    + stateMachine.activeSession() + ")");
        }

        InterruptSupervisor supervisor = null;
        Session session = null;
        boolean announced = false;
        try {
            ExecutionControl control = new ExecutionControl();
            PreemptionSlot slot = new PreemptionSlot();
            supervisor = new InterruptSupervisor(sessionId, rules, visionMatcher, slot, control, clock, publisher);
            MainExecutor executor = MainExecutor.builder()
                    .sessionId(sessionId)
                    .registry(registry)
                    .entryFlow(program.entryFlow())
                    .settings(settings)
                    .visionMatcher(visionMatcher)
                    .actionExecutor(actionExecutor)
                    .control(control)
                    .preemptionSlot(slot)
                    .preemptionListener(supervisor)
                    .breakpoints(breakpoints)
                    .publisher(publisher)
                    .clock(clock)
                    .build();
            session = new Session(sessionId, executor, supervisor, control, Instant.now(clock));
            control.setListener(new StateSync(sessionId));
            current.set(session);
            publishState(sessionId, EngineState.IDLE, EngineState.RUNNING, "start");
            announced = true;

            ScriptHotkeyManager hk = hotkeys.getIfAvailable();
            if (hk != null) {
                try {
                    hk.rebind(program.hotkeys());
                } catch (IllegalArgumentException e) {
                    LOG.warn("Ignoring script hotkeys: {}", e.getMessage());
                }
            }

            if (supervisorProps.isEnabled()) {
                Duration tick = settings.tickInterval() != null
                        ? settings.tickInterval()
                        : Duration.ofMillis(supervisorProps.getTickPeriodMs());
                supervisor.start(supervisorScheduler, tick);
            }
            Session started = session;
            try {
                engineExecutor.execute(() -> runSession(started));
            } catch (TaskRejectedException e) {
                throw new IllegalStateException("Engine executor is busy", e);
            }
        } catch (RuntimeException e) {
            abortStart(sessionId, supervisor, session, announced, e);
            throw e;
        }

        LOG.info("Session {} started: entry={}, flows={}, rules={}", sessionId, program.entryFlow(),
                registry.names().size(), rules.size());
        return sessionId;
    }

    /** @return {@code false} if nothing is running */
    public boolean stop() {
        Session session = current.get();
        if (session == null) {
            return false;
        }
        EngineState previous = stateMachine.stopping(session.id());
        if (previous == null) {
            return false;
        }
        publishState(session.id(), previous, EngineState.STOPPING, "stop");
        session.supervisor().stop();
        session.control().requestStop();
        LOG.info("Stop requested for session {}", session.id());
        return true;
    }

    /** @return {@code false} if nothing is running or already paused */
    public boolean pause() {
        Session session = current.get();
        return session != null && session.control().pause("user");
    }

    /** @return {@code false} if nothing is paused */
    public boolean resume() {
        Session session = current.get();
        return session != null && session.control().resume();
    }

    public boolean togglePause() {
        return stateMachine.state() == EngineState.PAUSED ? resume() : pause();
    }

    public EngineState state() {
        return stateMachine.state();
    }

    public Optional<String> activeSession() {
        return Optional.ofNullable(stateMachine.activeSession());
    }

    public Optional<SessionSummary> lastSession() {
        return Optional.ofNullable(lastSummary.get());
    }

    /** Live snapshot of the running session, else the final one of the last session. */
    public ExecutionSnapshot snapshot() {
        Session session = current.get();
        return session != null ? session.executor().snapshot() : lastSnapshot.get();
    }

    public Breakpoints breakpoints() {
        return breakpoints;
    }

    @EventListener
    public void onHotkey(HotkeyPressedEvent event) {
        HotkeyAction action = event.action();
        LOG.debug("Hotkey action {}", action);
        switch (action) {
            case START -> startConfiguredScript();
            case STOP -> stop();
            case PAUSE -> togglePause();
        }
    }

    /** Starts {@code engine.script-path} if set and nothing is running. */
    public Optional<String> startConfiguredScript() {
        if (engineProps.getScriptPath().isBlank()) {
            LOG.warn("No engine.script-path configured; start hotkey ignored");
            return Optional.empty();
        }
        if (stateMachine.state() != EngineState.IDLE) {
            LOG.debug("Start ignored: session {} is {}", stateMachine.activeSession(), stateMachine.state());
            return Optional.empty();
        }
        Path rules = engineProps.getRulesPath().isBlank() ? null : Path.of(engineProps.getRulesPath());
        try {
            return Optional.of(startFromFile(Path.of(engineProps.getScriptPath()), rules));
        } catch (ParseException e) {
            LOG.error("Script {} is invalid: {}", engineProps.getScriptPath(), e.getMessage());
        } catch (IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            LOG.error("Cannot start {}: {}", engineProps.getScriptPath(), e.getMessage());
        }
        return Optional.empty();
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    private void runSession(Session session) {
        ThreadContext.put(MainExecutor.MDC_SESSION, session.id());
        SessionSummary.Outcome outcome;
        String error = null;
        try {
            outcome = session.executor().run() == MainExecutor.Outcome.COMPLETED
                    ? SessionSummary.Outcome.COMPLETED
                    : SessionSummary.Outcome.STOPPED;
        } catch (ScriptExecutionException e) {
            outcome = SessionSummary.Outcome.FAILED;
            error = e.getMessage();
        } catch (RuntimeException e) {
            LOG.error("Session {} crashed", session.id(), e);
            outcome = SessionSummary.Outcome.FAILED;
            error = e.toString();
        } finally {
            session.supervisor().stop();
            ScriptHotkeyManager hk = hotkeys.getIfAvailable();
            if (hk != null) {
                hk.resetBindings();
            }
            ThreadContext.remove(MainExecutor.MDC_SESSION);
        }
        lastSnapshot.set(session.executor().snapshot());
        lastSummary.set(new SessionSummary(session.id(), outcome, error, session.startedAt(), Instant.now(clock)));
        current.compareAndSet(session, null);
        EngineState previous = stateMachine.finish(session.id());
        if (previous != null) {
            publishState(session.id(), previous, EngineState.IDLE, outcome.name().toLowerCase(Locale.ROOT));
        }
        LOG.info("Session {} ended: {}", session.id(), outcome);
    }

    /** Releases everything a failed {@link #start} acquired so the engine returns to IDLE. */
    private void abortStart(String sessionId, InterruptSupervisor supervisor, Session session, boolean announced,
                            RuntimeException cause) {
        LOG.warn("Session {} failed to start: {}", sessionId, cause.toString());
        if (supervisor != null) {
            supervisor.stop();
        }
        if (session != null) {
            current.compareAndSet(session, null);
        }
        ScriptHotkeyManager hk = hotkeys.getIfAvailable();
        if (hk != null) {
            hk.resetBindings();
        }
        stateMachine.finish(sessionId);
        if (announced) {
            publishState(sessionId, EngineState.RUNNING, EngineState.IDLE,
                    cause.getCause() instanceof TaskRejectedException ? "rejected" : "failed");
        }
    }

    private void publishState(String sessionId, EngineState from, EngineState to, String reason) {
        publisher.publishEvent(new EngineStateChangedEvent(sessionId, from, to, reason, null));
    }

    /** Mirrors executor-side pause and resume into the state machine. */
    private final class StateSync implements ExecutionControl.Listener {
        private final String sessionId;

        StateSync(String sessionId) {
            this.sessionId = sessionId;
        }

        @Override
        public void onPaused(String reason) {
            EngineState previous = stateMachine.pause(sessionId);
            if (previous != null) {
                publishState(sessionId, previous, EngineState.PAUSED, reason);
            }
        }

        @Override
        public void onResumed() {
            EngineState previous = stateMachine.resume(sessionId);
            if (previous != null) {
                publishState(sessionId, previous, EngineState.RUNNING, "resume");
            }
        }
    }

    private record Session(String id, MainExecutor executor, InterruptSupervisor supervisor,
                           ExecutionControl control, Instant startedAt) {
    }
}
