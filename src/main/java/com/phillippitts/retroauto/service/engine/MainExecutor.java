package com.phillippitts.retroauto.service.engine;

import com.phillippitts.retroauto.domain.ActionKind;
import com.phillippitts.retroauto.domain.ErrorPolicy;
import com.phillippitts.retroauto.domain.ResolvedArgs;
import com.phillippitts.retroauto.domain.Value;
import com.phillippitts.retroauto.domain.ValueType;
import com.phillippitts.retroauto.dsl.ScriptRenderer;
import com.phillippitts.retroauto.dsl.ast.ActionCall;
import com.phillippitts.retroauto.dsl.ast.Expression;
import com.phillippitts.retroauto.exception.ActionFailedException;
import com.phillippitts.retroauto.exception.AssetMissingException;
import com.phillippitts.retroauto.exception.ExecutionExceptionBuilder;
import com.phillippitts.retroauto.exception.ImageNotFoundException;
import com.phillippitts.retroauto.exception.InterruptConflictException;
import com.phillippitts.retroauto.exception.RecursionLimitException;
import com.phillippitts.retroauto.exception.RetroAutoException;
import com.phillippitts.retroauto.exception.ScriptExecutionException;
import com.phillippitts.retroauto.service.events.ActionExecutedEvent;
import com.phillippitts.retroauto.service.events.FlowEnteredEvent;
import com.phillippitts.retroauto.service.events.FlowExitedEvent;
import com.phillippitts.retroauto.service.events.InterruptCompletedEvent;
import com.phillippitts.retroauto.service.events.InterruptFiredEvent;
import com.phillippitts.retroauto.service.events.ScriptErrorEvent;
import com.phillippitts.retroauto.service.input.ActionExecutor;
import com.phillippitts.retroauto.service.vision.VisionMatcher;
import com.phillippitts.retroauto.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sequential interpreter over compiled flows.
 *
 * <p>Each iteration of the step loop is a safe point: stop and pause are honoured, finished
 * frames are popped, and a pending {@link PreemptionRequest} is applied by pushing the rule's
 * flow above the current frame without touching its instruction pointer. Nothing else ever
 * mutates the call stack or the variable store, so neither needs locking.
 *
 * <p>{@link #run()} blocks the calling thread until the entry flow finishes, stop is requested
 * or a fatal error occurs. An executor runs once.
 *
 * <p><b>Error handling:</b>
 * <ul>
 *   <li>{@link RecursionLimitException} and unexpected failures are fatal.</li>
 *   <li>{@link ImageNotFoundException} follows the action's {@code on_error}, else the session policy.</li>
 *   <li>{@link AssetMissingException} is fatal unless missing assets are tolerated.</li>
 *   <li>{@link ActionFailedException} is fatal unless the action carries an explicit {@code on_error}.</li>
 * </ul>
 * Policy {@code pause} keeps the instruction pointer, so resuming retries the failed statement.
 */
public final class MainExecutor {

    private static final Logger LOG = LogManager.getLogger(MainExecutor.class);

    public static final String MDC_SESSION = "session";
    public static final String MDC_FLOW = "flow";

    public enum Outcome { COMPLETED, STOPPED }

    private final String sessionId;
    private final FlowRegistry registry;
    private final String entryFlow;
    private final ExecutionSettings settings;
    private final VariableStore variables;
    private final ExecutionControl control;
    private final PreemptionSlot slot;
    private final PreemptionListener preemptionListener;
    private final Breakpoints breakpoints;
    private final ApplicationEventPublisher publisher;

    private final CallStack callStack;
    private final ExpressionEvaluator evaluator;
    private final ActionDispatcher dispatcher;
    private final AtomicReference<ExecutionSnapshot> snapshot = new AtomicReference<>(ExecutionSnapshot.EMPTY);
    private final AtomicBoolean started = new AtomicBoolean();

    // interrupt flow currently running, at most one
    private PreemptionRequest servicing;
    private ExecutionFrame servicingFrame;

    // position that must not break again when execution resumes there
    private ExecutionFrame resumeFrame;
    private int resumeIp = -1;

    private MainExecutor(Builder b) {
        this.sessionId = b.sessionId;
        this.registry = Objects.requireNonNull(b.registry, "registry");
        this.entryFlow = Objects.requireNonNull(b.entryFlow, "entryFlow");
        this.settings = b.settings;
        this.variables = b.variables;
        this.control = b.control;
        this.slot = b.slot;
        this.preemptionListener = b.preemptionListener;
        this.breakpoints = b.breakpoints;
        this.publisher = b.publisher;
        this.callStack = new CallStack(settings.maxDepth());

        VisionQueries vision = new VisionQueries(
                Objects.requireNonNull(b.visionMatcher, "visionMatcher"), control, b.clock);
        this.evaluator = new ExpressionEvaluator(variables, vision);
        this.dispatcher = new ActionDispatcher(
                Objects.requireNonNull(b.actionExecutor, "actionExecutor"), vision, control, settings);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Outcome run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Executor already ran for session " + sessionId);
        }
        String previousSession = ThreadContext.get(MDC_SESSION);
        ThreadContext.put(MDC_SESSION, sessionId);
        try {
            LOG.info("Script started: entry={}, maxDepth={}", entryFlow, settings.maxDepth());
            enter(ExecutionFrame.of(registry.require(entryFlow)), null);

            while (!callStack.isEmpty()) {
                if (control.isStopRequested()) {
                    abandon("stop requested");
                    return Outcome.STOPPED;
                }
                if (control.isPaused()) {
                    publishSnapshot(true);
                    control.awaitIfPaused();
                    continue;
                }
                ExecutionFrame frame = callStack.peek();
                if (frame.isFinished()) {
                    exit(frame);
                    continue;
                }
                PreemptionRequest request = slot.poll();
                if (request != null) {
                    applyPreemption(request, frame);
                    continue;
                }
                int ip = frame.instructionPointer();
                if (hitBreakpoint(frame, ip)) {
                    continue;
                }
                publishSnapshot(true);
                step(frame, ip);
            }
            LOG.info("Script completed");
            return Outcome.COMPLETED;
        } finally {
            PreemptionRequest leftover = slot.poll();
            if (leftover != null) {
                preemptionListener.onPreemptionDropped(leftover);
            }
            publishSnapshot(false);
            ThreadContext.remove(MDC_FLOW);
            if (previousSession == null) {
                ThreadContext.remove(MDC_SESSION);
            } else {
                ThreadContext.put(MDC_SESSION, previousSession);
            }
        }
    }

    public String sessionId() {
        return sessionId;
    }

    public ExecutionControl control() {
        return control;
    }

    public Breakpoints breakpoints() {
        return breakpoints;
    }

    /** Latest state published at a statement boundary; safe to call from any thread. */
    public ExecutionSnapshot snapshot() {
        return snapshot.get();
    }

    /** Executor-owned store; read it from another thread only after {@link #run()} returned. */
    public VariableStore variables() {
        return variables;
    }

    // ================= step =================

    private void step(ExecutionFrame frame, int ip) {
        Instruction instruction = frame.current();
        try {
            execute(frame, instruction);
            resumeFrame = null;
        } catch (ScriptExecutionException e) {
            fail(e);
        } catch (ImageNotFoundException e) {
            recover(e, frame, ip, instruction, true);
        } catch (AssetMissingException e) {
            recover(e, frame, ip, instruction, settings.tolerateMissingAssets());
        } catch (ActionFailedException e) {
            recover(e, frame, ip, instruction, false);
        } catch (RuntimeException e) {
            fail(ExecutionExceptionBuilder.create(describe(e))
                    .location(frame.flowName(), ip)
                    .cause(e)
                    .metadata("instruction", instruction.describe())
                    .build());
        }
    }

    private void execute(ExecutionFrame frame, Instruction instruction) {
        if (instruction instanceof Instruction.Action action) {
            executeAction(frame, action.call());
        } else if (instruction instanceof Instruction.Assign assign) {
            variables.set(assign.variable(), evaluator.evaluate(assign.value()));
            frame.advance();
        } else if (instruction instanceof Instruction.Label) {
            frame.advance();
        } else if (instruction instanceof Instruction.Jump jump) {
            frame.jump(jump.target());
        } else if (instruction instanceof Instruction.BranchIfFalse branch) {
            if (evaluator.isTrue(branch.condition())) {
                frame.advance();
            } else {
                frame.jump(branch.target());
            }
        } else if (instruction instanceof Instruction.LoopInit init) {
            frame.clearLoopCounter(init.slot());
            frame.advance();
        } else if (instruction instanceof Instruction.LoopCheck check) {
            loopCheck(frame, check);
        } else if (instruction instanceof Instruction.RunFlow run) {
            enter(ExecutionFrame.of(registry.require(run.flowName())), frame);
        } else {
            throw new IllegalStateException("Unsupported instruction: " + instruction);
        }
    }

    private void executeAction(ExecutionFrame frame, ActionCall call) {
        ResolvedArgs args = resolve(call);
        long start = System.nanoTime();
        dispatcher.dispatch(call.kind(), args);
        if (control.isStopRequested()) {
            // cut short by stop; the stack is discarded at the next boundary
            return;
        }
        int ip = frame.instructionPointer();
        frame.advance();
        LOG.debug("{} done in {}ms", call.kind().keyword(), TimeUtils.elapsedMillis(start));
        publisher.publishEvent(new ActionExecutedEvent(sessionId, frame.flowName(), ip, call.kind(),
                TimeUtils.elapsedMillis(start), null));
    }

    private ResolvedArgs resolve(ActionCall call) {
        List<Value> positional = new ArrayList<>(call.args().size());
        for (Expression arg : call.args()) {
            positional.add(evaluator.evaluate(arg));
        }
        Map<String, Value> named = new LinkedHashMap<>();
        call.options().forEach((name, expr) -> named.put(name, evaluator.evaluate(expr)));
        return new ResolvedArgs(positional, named);
    }

    private void loopCheck(ExecutionFrame frame, Instruction.LoopCheck check) {
        OptionalLong counter = frame.loopCounter(check.slot());
        long remaining;
        if (counter.isPresent()) {
            remaining = counter.getAsLong();
        } else if (check.count() == null) {
            remaining = -1;
        } else {
            Value count = evaluator.evaluate(check.count());
            if (count.type() != ValueType.INT) {
                throw new IllegalArgumentException("Loop count must be an integer, got " + count);
            }
            if (count.asLong() < 0) {
                throw new IllegalArgumentException("Loop count must not be negative: " + count.asLong());
            }
            // 0 means loop until stopped
            remaining = count.asLong() == 0 ? -1 : count.asLong();
        }

        if (remaining < 0) {
            frame.setLoopCounter(check.slot(), -1);
            frame.advance();
        } else if (remaining == 0) {
            frame.clearLoopCounter(check.slot());
            frame.jump(check.exit());
        } else {
            frame.setLoopCounter(check.slot(), remaining - 1);
            frame.advance();
        }
    }

    // ================= frames =================

    /** Pushes {@code frame}; {@code caller} moves past its run instruction only once the push succeeded. */
    private void enter(ExecutionFrame frame, ExecutionFrame caller) {
        callStack.push(frame);
        if (caller != null) {
            caller.advance();
        }
        ThreadContext.put(MDC_FLOW, frame.flowName());
        LOG.debug("Entered flow {} (depth {})", frame.flowName(), callStack.depth());
        publisher.publishEvent(new FlowEnteredEvent(sessionId, frame.flowName(), callStack.depth(),
                frame.interruptRuleId(), null));
    }

    private void exit(ExecutionFrame frame) {
        int depth = callStack.depth();
        callStack.pop();
        LOG.debug("Exited flow {} (depth {})", frame.flowName(), depth);
        publisher.publishEvent(new FlowExitedEvent(sessionId, frame.flowName(), depth, null));

        if (frame == servicingFrame) {
            PreemptionRequest done = servicing;
            servicing = null;
            servicingFrame = null;
            LOG.info("Interrupt {} completed, resuming {}", done.ruleId(),
                    callStack.isEmpty() ? "-" : callStack.peek());
            publisher.publishEvent(new InterruptCompletedEvent(sessionId, done.ruleId(), done.targetFlow(), null));
            preemptionListener.onPreemptionCompleted(done);
        }
        if (!callStack.isEmpty()) {
            ThreadContext.put(MDC_FLOW, callStack.peek().flowName());
        }
    }

    private void applyPreemption(PreemptionRequest request, ExecutionFrame preempted) {
        if (servicing != null) {
            InterruptConflictException conflict = new InterruptConflictException(
                    "Rule " + request.ruleId() + " requested preemption while " + servicing.ruleId() + " is running");
            LOG.error(conflict.getMessage());
            publishError(preempted.flowName(), preempted.instructionPointer(), conflict, "drop", false);
            preemptionListener.onPreemptionDropped(request);
            return;
        }
        ExecutionFrame frame = ExecutionFrame.forInterrupt(registry.require(request.targetFlow()), request.ruleId());
        try {
            enter(frame, null);
        } catch (RecursionLimitException e) {
            preemptionListener.onPreemptionDropped(request);
            fail(e);
        }
        servicing = request;
        servicingFrame = frame;
        LOG.info("Interrupt {} preempted {} -> flow {}", request.ruleId(), preempted, request.targetFlow());
        publisher.publishEvent(new InterruptFiredEvent(sessionId, request.ruleId(), request.targetFlow(),
                preempted.flowName(), preempted.instructionPointer(), null));
        preemptionListener.onPreemptionApplied(request);
    }

    private void abandon(String reason) {
        LOG.info("Discarding call stack ({} frames): {}", callStack.depth(), reason);
        if (servicing != null) {
            preemptionListener.onPreemptionDropped(servicing);
            servicing = null;
            servicingFrame = null;
        }
        callStack.clear();
    }

    // ================= errors =================

    private void recover(RetroAutoException error, ExecutionFrame frame, int ip, Instruction instruction,
                         boolean recoverableByDefault) {
        ErrorPolicy explicit;
        try {
            explicit = explicitPolicy(instruction);
        } catch (RuntimeException e) {
            fail(ExecutionExceptionBuilder.create("Invalid on_error option: " + describe(e))
                    .location(frame.flowName(), ip)
                    .cause(e)
                    .metadata("instruction", instruction.describe())
                    .metadata("error", error.getMessage())
                    .build());
            return;
        }
        ErrorPolicy policy = explicit != null && (recoverableByDefault || !(error instanceof AssetMissingException))
                ? explicit
                : (recoverableByDefault ? settings.onError() : ErrorPolicy.ABORT);

        switch (policy) {
            case SKIP -> {
                LOG.warn("{} at {}:{}, skipping", error.getMessage(), frame.flowName(), ip);
                publishError(frame.flowName(), ip, error, policy.keyword(), false);
                resumeFrame = null;
                if (instruction instanceof Instruction.BranchIfFalse branch) {
                    // an unanswerable condition counts as false
                    frame.jump(branch.target());
                } else {
                    frame.advance();
                }
            }
            case PAUSE -> {
                LOG.warn("{} at {}:{}, pausing (resume retries)", error.getMessage(), frame.flowName(), ip);
                publishError(frame.flowName(), ip, error, policy.keyword(), false);
                resumeFrame = frame;
                resumeIp = ip;
                control.pause("error at " + frame.flowName() + ":" + ip);
            }
            case ABORT -> fail(ExecutionExceptionBuilder.create(error.getMessage())
                    .location(frame.flowName(), ip)
                    .cause(error)
                    .metadata("instruction", instruction.describe())
                    .build());
        }
    }

    /** {@code on_error} given on the failing action itself, or {@code null}. */
    private ErrorPolicy explicitPolicy(Instruction instruction) {
        if (instruction instanceof Instruction.Action action) {
            Expression option = action.call().options().get(ActionKind.ON_ERROR_OPTION);
            if (option != null) {
                return ErrorPolicy.parse(evaluator.evaluate(option).asText());
            }
        }
        return null;
    }

    private void fail(ScriptExecutionException error) {
        LOG.error("Script halted: {}", error.getMessage());
        publishError(error.getFlowName(), error.getInstructionIndex(), error, "abort", true);
        abandon("fatal error");
        throw error;
    }

    private void publishError(String flow, int ip, RuntimeException error, String resolution, boolean fatal) {
        Throwable root = error instanceof ScriptExecutionException && error.getCause() != null ? error.getCause() : error;
        publisher.publishEvent(new ScriptErrorEvent(sessionId, flow, ip, root.getClass().getSimpleName(),
                error.getMessage(), resolution, fatal, null));
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    // ================= debugger =================

    private boolean hitBreakpoint(ExecutionFrame frame, int ip) {
        if (!breakpoints.contains(frame.flowName(), ip)) {
            return false;
        }
        if (frame == resumeFrame && ip == resumeIp) {
            return false;
        }
        resumeFrame = frame;
        resumeIp = ip;
        LOG.info("Breakpoint hit at {}:{}", frame.flowName(), ip);
        control.pause("breakpoint " + frame.flowName() + ":" + ip);
        return true;
    }

    private void publishSnapshot(boolean running) {
        List<ExecutionSnapshot.FrameView> frames = new ArrayList<>(callStack.depth());
        for (ExecutionFrame f : callStack.frames()) {
            frames.add(new ExecutionSnapshot.FrameView(f.flowName(), f.instructionPointer(), f.interruptRuleId()));
        }
        Map<String, String> vars = new LinkedHashMap<>();
        variables.snapshot().forEach((name, value) -> vars.put(name, ScriptRenderer.value(value)));

        ExecutionFrame top = callStack.peek();
        String instruction = top == null || top.isFinished() ? null : top.current().describe();
        snapshot.set(new ExecutionSnapshot(running && top != null, control.isPaused(),
                top == null ? null : top.flowName(),
                top == null ? -1 : top.instructionPointer(),
                instruction, frames, vars, Instant.now()));
    }

    /**
     * Assembles an executor. Registry, entry flow, vision matcher and action executor are required.
     */
    public static final class Builder {
        private String sessionId = UUID.randomUUID().toString();
        private FlowRegistry registry;
        private String entryFlow;
        private ExecutionSettings settings = ExecutionSettings.defaults();
        private VariableStore variables = new VariableStore();
        private ExecutionControl control = new ExecutionControl();
        private PreemptionSlot slot = new PreemptionSlot();
        private PreemptionListener preemptionListener = PreemptionListener.NO_OP;
        private Breakpoints breakpoints = new Breakpoints();
        private ApplicationEventPublisher publisher = event -> { };
        private VisionMatcher visionMatcher;
        private ActionExecutor actionExecutor;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = Objects.requireNonNull(sessionId);
            return this;
        }

        public Builder registry(FlowRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder entryFlow(String entryFlow) {
            this.entryFlow = entryFlow;
            return this;
        }

        public Builder settings(ExecutionSettings settings) {
            this.settings = Objects.requireNonNull(settings);
            return this;
        }

        public Builder variables(VariableStore variables) {
            this.variables = Objects.requireNonNull(variables);
            return this;
        }

        public Builder control(ExecutionControl control) {
            this.control = Objects.requireNonNull(control);
            return this;
        }

        public Builder preemptionSlot(PreemptionSlot slot) {
            this.slot = Objects.requireNonNull(slot);
            return this;
        }

        public Builder preemptionListener(PreemptionListener listener) {
            this.preemptionListener = Objects.requireNonNull(listener);
            return this;
        }

        public Builder breakpoints(Breakpoints breakpoints) {
            this.breakpoints = Objects.requireNonNull(breakpoints);
            return this;
        }

        public Builder publisher(ApplicationEventPublisher publisher) {
            this.publisher = Objects.requireNonNull(publisher);
            return this;
        }

        public Builder visionMatcher(VisionMatcher visionMatcher) {
            this.visionMatcher = visionMatcher;
            return this;
        }

        public Builder actionExecutor(ActionExecutor actionExecutor) {
            this.actionExecutor = actionExecutor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public MainExecutor build() {
            return new MainExecutor(this);
        }
    }
}
