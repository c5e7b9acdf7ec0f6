package com.phillippitts.retroauto.service.engine;

import com.phillippitts.retroauto.domain.ActionKind;
import com.phillippitts.retroauto.domain.Value;
import com.phillippitts.retroauto.dsl.Parser;
import com.phillippitts.retroauto.dsl.ast.Program;
import com.phillippitts.retroauto.exception.AssetMissingException;
import com.phillippitts.retroauto.exception.RecursionLimitException;
import com.phillippitts.retroauto.exception.ScriptExecutionException;
import com.phillippitts.retroauto.service.events.FlowEnteredEvent;
import com.phillippitts.retroauto.service.events.InterruptCompletedEvent;
import com.phillippitts.retroauto.service.events.InterruptFiredEvent;
import com.phillippitts.retroauto.service.events.ScriptErrorEvent;
import com.phillippitts.retroauto.testutil.EventCapturingPublisher;
import com.phillippitts.retroauto.testutil.FakeVisionMatcher;
import com.phillippitts.retroauto.testutil.RecordingActionExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class MainExecutorTest {

    private FakeVisionMatcher vision;
    private RecordingActionExecutor input;
    private EventCapturingPublisher events;
    private ExecutionControl control;
    private PreemptionSlot slot;
    private Breakpoints breakpoints;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        vision = new FakeVisionMatcher();
        input = new RecordingActionExecutor();
        events = new EventCapturingPublisher();
        control = new ExecutionControl();
        slot = new PreemptionSlot();
        breakpoints = new Breakpoints();
        listener = new RecordingListener();
    }

    private MainExecutor executor(String source) {
        Program program = Parser.parseSource(source);
        return MainExecutor.builder()
                .sessionId("test")
                .registry(FlowCompiler.compile(program))
                .entryFlow(program.entryFlow())
                .settings(ExecutionSettings.defaults().withOverrides(program))
                .control(control)
                .preemptionSlot(slot)
                .preemptionListener(listener)
                .breakpoints(breakpoints)
                .publisher(events)
                .visionMatcher(vision)
                .actionExecutor(input)
                .build();
    }

    private static PreemptionRequest request(String ruleId, String flow) {
        return new PreemptionRequest(ruleId, flow, 1, Instant.EPOCH);
    }

    // ================= flow control =================

    @Test
    void countedLoopRunsSubflowExactlyThreeTimes() {
        // Arrange
        MainExecutor executor = executor("@main:\n  loop 3:\n    run a\n  end\n@a:\n  type(\"x\")\n");

        // Act
        MainExecutor.Outcome outcome = executor.run();

        // Assert
        assertThat(outcome).isEqualTo(MainExecutor.Outcome.COMPLETED);
        assertThat(input.typed()).containsExactly("x", "x", "x");
        assertThat(events.ofType(FlowEnteredEvent.class)).extracting(FlowEnteredEvent::flow)
                .containsExactly("main", "a", "a", "a");
    }

    @Test
    void nestedLoopsKeepIndependentCounters() {
        MainExecutor executor = executor("@main:\n  loop 2:\n    loop 3:\n      type(\"i\")\n    end\n"
                + "    type(\"o\")\n  end\n");

        executor.run();

        assertThat(input.typed()).containsExactly("i", "i", "i", "o", "i", "i", "i", "o");
    }

    @Test
    void loopCountIsEvaluatedOnceOnEntry() {
        MainExecutor executor = executor("@main:\n  $n = 2\n  loop $n:\n    $n = $n + 10\n    type(\"x\")\n  end\n");

        executor.run();

        assertThat(input.typed()).hasSize(2);
        assertThat(executor.variables().get("n")).contains(Value.ofInt(22));
    }

    @Test
    void whileLoopWithBreakAndContinue() {
        String script = """
                @main:
                  $i = 0
                  while true:
                    $i = $i + 1
                    if $i == 2:
                      continue
                    end
                    if $i > 4:
                      break
                    end
                    type("n" + $i)
                  end
                """;

        executor(script).run();

        assertThat(input.typed()).containsExactly("n1", "n3", "n4");
    }

    @Test
    void gotoJumpsBackwardToLabel() {
        String script = """
                @main:
                  $i = 0
                  label top
                  $i = $i + 1
                  type("t")
                  if $i < 3:
                    goto top
                  end
                """;

        executor(script).run();

        assertThat(input.typed()).containsExactly("t", "t", "t");
    }

    @Test
    void variablesAreGlobalAcrossFlows() {
        MainExecutor executor = executor("@main:\n  run setter\n  type(\"v\" + $shared)\n@setter:\n  $shared = 7\n");

        executor.run();

        assertThat(input.typed()).containsExactly("v7");
        assertThat(executor.variables().get("shared")).contains(Value.ofInt(7));
    }

    @Test
    void runningTwiceIsRejected() {
        MainExecutor executor = executor("@main:\n  type(\"x\")\n");
        executor.run();

        assertThatThrownBy(executor::run).isInstanceOf(IllegalStateException.class);
    }

    // ================= recursion =================

    @Test
    void unboundedRecursionFailsAtMaxDepthPlusOne() {
        // Arrange
        MainExecutor executor = executor("@main:\n  run main\n");

        // Act + Assert
        assertThatThrownBy(executor::run)
                .isInstanceOf(RecursionLimitException.class)
                .satisfies(e -> assertThat(((RecursionLimitException) e).getMaxDepth()).isEqualTo(100));
        assertThat(events.ofType(FlowEnteredEvent.class)).hasSize(100);
        assertThat(events.ofType(ScriptErrorEvent.class)).singleElement().satisfies(error -> {
            assertThat(error.fatal()).isTrue();
            assertThat(error.errorType()).isEqualTo("RecursionLimitException");
        });
        assertThat(executor.snapshot().callStack()).isEmpty();
    }

    @Test
    void configuredMaxDepthOverridesDefault() {
        MainExecutor executor = executor("@config\n  max_depth = 5\n@main:\n  run main\n");

        assertThatThrownBy(executor::run).isInstanceOf(RecursionLimitException.class);
        assertThat(events.ofType(FlowEnteredEvent.class)).hasSize(5);
    }

    @Test
    void boundedRecursionCompletes() {
        String script = """
                @main:
                  $depth = 0
                  run down

                @down:
                  $depth = $depth + 1
                  if $depth < 99:
                    run down
                  end
                """;

        assertThat(executor(script).run()).isEqualTo(MainExecutor.Outcome.COMPLETED);
        assertThat(events.ofType(FlowEnteredEvent.class)).hasSize(100);
    }

    // ================= preemption =================

    @Test
    void interruptResumesAtExactInstructionAndSharesVariables() {
        // Arrange
        String script = """
                @main:
                  type("one")
                  type("two" + $flag)
                  type("three")

                @handler:
                  type("h")
                  $flag = "!"
                """;
        MainExecutor executor = executor(script);
        input.onPerform(call -> {
            if (call.kind() == ActionKind.TYPE && "one".equals(call.firstText())) {
                slot.offer(request("popup", "handler"));
            }
        });

        // Act
        executor.run();

        // Assert
        assertThat(input.typed()).containsExactly("one", "h", "two!", "three");
        assertThat(events.ofType(InterruptFiredEvent.class)).singleElement().satisfies(fired -> {
            assertThat(fired.preemptedFlow()).isEqualTo("main");
            assertThat(fired.preemptedInstruction()).isEqualTo(1);
        });
        assertThat(events.ofType(InterruptCompletedEvent.class)).hasSize(1);
        assertThat(listener.applied).extracting(PreemptionRequest::ruleId).containsExactly("popup");
        assertThat(listener.completed).extracting(PreemptionRequest::ruleId).containsExactly("popup");
        assertThat(listener.dropped).isEmpty();
    }

    @Test
    void interruptInsideLoopKeepsIterationCount() {
        MainExecutor executor = executor("@main:\n  loop 3:\n    type(\"x\")\n  end\n@handler:\n  type(\"h\")\n");
        input.onPerform(call -> {
            if ("x".equals(call.firstText()) && input.typed().isEmpty()) {
                slot.offer(request("r", "handler"));
            }
        });

        executor.run();

        assertThat(input.typed()).containsExactly("x", "h", "x", "x");
    }

    @Test
    void inFlightActionCompletesBeforePreemption() throws Exception {
        // Arrange
        MainExecutor executor = executor("@main:\n  type(\"slow\")\n  type(\"after\")\n@handler:\n  type(\"h\")\n");
        input.blockOn(ActionKind.TYPE);
        CompletableFuture<MainExecutor.Outcome> run = CompletableFuture.supplyAsync(executor::run);
        assertThat(input.awaitBlocked(2000)).isTrue();

        // Act
        slot.offer(request("r", "handler"));
        assertThat(input.typed()).containsExactly("slow");
        input.release();

        // Assert
        assertThat(run.get(5, TimeUnit.SECONDS)).isEqualTo(MainExecutor.Outcome.COMPLETED);
        assertThat(input.typed()).containsExactly("slow", "h", "after");
    }

    @Test
    void secondRequestWhileServicingIsDropped() {
        MainExecutor executor = executor(
                "@main:\n  type(\"a\")\n  type(\"b\")\n@handler:\n  type(\"h\")\n  type(\"h2\")\n");
        input.onPerform(call -> {
            if ("a".equals(call.firstText())) {
                slot.offer(request("first", "handler"));
            } else if ("h".equals(call.firstText())) {
                slot.offer(request("second", "handler"));
            }
        });

        executor.run();

        assertThat(input.typed()).containsExactly("a", "h", "h2", "b");
        assertThat(listener.dropped).extracting(PreemptionRequest::ruleId).containsExactly("second");
        assertThat(events.ofType(ScriptErrorEvent.class)).singleElement().satisfies(error -> {
            assertThat(error.errorType()).isEqualTo("InterruptConflictException");
            assertThat(error.resolution()).isEqualTo("drop");
            assertThat(error.fatal()).isFalse();
        });
    }

    @Test
    void interruptFlowCountsTowardDepthLimit() {
        MainExecutor executor = executor("@config\n  max_depth = 1\n@main:\n  type(\"a\")\n  type(\"b\")\n"
                + "@handler:\n  type(\"h\")\n");
        input.onPerform(call -> {
            if ("a".equals(call.firstText())) {
                slot.offer(request("r", "handler"));
            }
        });

        assertThatThrownBy(executor::run).isInstanceOf(RecursionLimitException.class);
        assertThat(listener.dropped).extracting(PreemptionRequest::ruleId).containsExactly("r");
    }

    // ================= error policies =================

    @Test
    void imageTimeoutAbortsByDefault() {
        MainExecutor executor = executor("@main:\n  wait_image(\"absent.png\", timeout=0ms)\n  type(\"after\")\n");

        assertThatThrownBy(executor::run)
                .isInstanceOf(ScriptExecutionException.class)
                .satisfies(e -> {
                    ScriptExecutionException error = (ScriptExecutionException) e;
                    assertThat(error.getFlowName()).isEqualTo("main");
                    assertThat(error.getInstructionIndex()).isZero();
                });
        assertThat(input.typed()).isEmpty();
        assertThat(events.ofType(ScriptErrorEvent.class)).singleElement()
                .satisfies(error -> assertThat(error.errorType()).isEqualTo("ImageNotFoundException"));
    }

    @Test
    void actionLevelSkipContinuesWithNextStatement() {
        MainExecutor executor = executor(
                "@main:\n  wait_image(\"absent.png\", timeout=0ms, on_error=skip)\n  type(\"after\")\n");

        assertThat(executor.run()).isEqualTo(MainExecutor.Outcome.COMPLETED);
        assertThat(input.typed()).containsExactly("after");
        assertThat(events.ofType(ScriptErrorEvent.class)).singleElement().satisfies(error -> {
            assertThat(error.resolution()).isEqualTo("skip");
            assertThat(error.fatal()).isFalse();
        });
    }

    @Test
    void invalidDynamicPolicyFailsWithLocatedError() {
        MainExecutor executor = executor(
                "@main:\n  $p = \"bogus\"\n  wait_image(\"absent.png\", timeout=0ms, on_error=$p)\n  type(\"after\")\n");

        assertThatThrownBy(executor::run)
                .isInstanceOf(ScriptExecutionException.class)
                .hasMessageStartingWith("Invalid on_error option")
                .satisfies(e -> {
                    ScriptExecutionException error = (ScriptExecutionException) e;
                    assertThat(error.getFlowName()).isEqualTo("main");
                    assertThat(error.getInstructionIndex()).isEqualTo(1);
                });
        assertThat(input.typed()).isEmpty();
        assertThat(events.ofType(ScriptErrorEvent.class)).singleElement().satisfies(error -> {
            assertThat(error.fatal()).isTrue();
            assertThat(error.resolution()).isEqualTo("abort");
            assertThat(error.errorType()).isEqualTo("IllegalArgumentException");
        });
        assertThat(executor.snapshot().callStack()).isEmpty();
    }

    @Test
    void sessionPolicyAppliesWhenActionHasNone() {
        MainExecutor executor = executor(
                "@config\n  on_error = skip\n@main:\n  click_image(\"absent.png\", timeout=0ms)\n  type(\"after\")\n");

        executor.run();

        assertThat(input.typed()).containsExactly("after");
        assertThat(input.calls).extracting(RecordingActionExecutor.Call::kind).doesNotContain(ActionKind.CLICK);
    }

    @Test
    void skippedConditionTakesFalseBranch() {
        vision.failWith("gone.png", new AssetMissingException("gone.png"));
        String script = """
                @config
                  on_error = skip
                  tolerate_missing_assets = true

                @main:
                  if image("gone.png"):
                    type("then")
                  else:
                    type("else")
                  end
                """;

        executor(script).run();

        assertThat(input.typed()).containsExactly("else");
    }

    @Test
    void missingAssetIsFatalUnlessTolerated() {
        vision.failWith("gone.png", new AssetMissingException("gone.png"));
        MainExecutor executor = executor(
                "@config\n  on_error = skip\n@main:\n  wait_image(\"gone.png\", on_error=skip)\n  type(\"after\")\n");

        assertThatThrownBy(executor::run).isInstanceOf(ScriptExecutionException.class);
        assertThat(input.typed()).isEmpty();
    }

    @Test
    void actionFailureIsFatalWithoutExplicitPolicy() {
        input.failOn(ActionKind.HOTKEY);
        MainExecutor executor = executor("@config\n  on_error = skip\n@main:\n  hotkey(\"F1\")\n  type(\"after\")\n");

        assertThatThrownBy(executor::run).isInstanceOf(ScriptExecutionException.class);
        assertThat(input.typed()).isEmpty();
    }

    @Test
    void actionFailureFollowsExplicitPolicy() {
        input.failOn(ActionKind.HOTKEY);
        MainExecutor executor = executor("@main:\n  hotkey(\"F1\", on_error=skip)\n  type(\"after\")\n");

        assertThat(executor.run()).isEqualTo(MainExecutor.Outcome.COMPLETED);
        assertThat(input.typed()).containsExactly("after");
    }

    @Test
    void pausePolicyRetriesStatementOnResume() throws Exception {
        // Arrange
        MainExecutor executor = executor(
                "@main:\n  wait_image(\"late.png\", timeout=0ms, on_error=pause)\n  type(\"after\")\n");
        CompletableFuture<MainExecutor.Outcome> run = CompletableFuture.supplyAsync(executor::run);
        await().atMost(Duration.ofSeconds(2)).until(() -> executor.snapshot().paused());
        assertThat(executor.snapshot().instructionPointer()).isZero();

        // Act
        vision.show("late.png");
        control.resume();

        // Assert
        assertThat(run.get(5, TimeUnit.SECONDS)).isEqualTo(MainExecutor.Outcome.COMPLETED);
        assertThat(input.typed()).containsExactly("after");
        assertThat(vision.queryCount("late.png")).isEqualTo(2);
    }

    @Test
    void runtimeErrorReportsLocation() {
        MainExecutor executor = executor("@main:\n  type(\"ok\")\n  type($undefined)\n");

        assertThatThrownBy(executor::run)
                .isInstanceOf(ScriptExecutionException.class)
                .hasMessageContaining("Undefined variable $undefined")
                .satisfies(e -> assertThat(((ScriptExecutionException) e).getInstructionIndex()).isEqualTo(1));
    }

    @Test
    void negativeLoopCountIsFatal() {
        MainExecutor executor = executor("@main:\n  $n = 0 - 1\n  loop $n:\n    type(\"x\")\n  end\n");

        assertThatThrownBy(executor::run)
                .isInstanceOf(ScriptExecutionException.class)
                .hasMessageContaining("must not be negative");
    }

    // ================= vision-driven actions =================

    @Test
    void clickWithoutCoordinatesTargetsLastMatch() {
        vision.show("btn.png");
        MainExecutor executor = executor("@main:\n  wait_image(\"btn.png\")\n  click()\n");

        executor.run();

        assertThat(input.calls).singleElement().satisfies(call -> {
            assertThat(call.kind()).isEqualTo(ActionKind.CLICK);
            assertThat(call.args().intAt(0)).isEqualTo(110);
            assertThat(call.args().intAt(1)).isEqualTo(205);
        });
    }

    @Test
    void clickImageAppliesOffsets() {
        vision.show("btn.png");
        MainExecutor executor = executor("@main:\n  click_image(\"btn.png\", offset_x=5, offset_y=-5)\n");

        executor.run();

        assertThat(input.calls).singleElement().satisfies(call -> {
            assertThat(call.args().intAt(0)).isEqualTo(115);
            assertThat(call.args().intAt(1)).isEqualTo(200);
        });
    }

    // ================= debugger and control =================

    @Test
    void breakpointPausesBeforeInstructionAndResumes() throws Exception {
        // Arrange
        breakpoints.add("main", 1);
        MainExecutor executor = executor("@main:\n  type(\"one\")\n  type(\"two\")\n");

        // Act
        CompletableFuture<MainExecutor.Outcome> run = CompletableFuture.supplyAsync(executor::run);
        await().atMost(Duration.ofSeconds(2)).until(() -> executor.snapshot().paused());

        // Assert
        assertThat(input.typed()).containsExactly("one");
        ExecutionSnapshot snapshot = executor.snapshot();
        assertThat(snapshot.paused()).isTrue();
        assertThat(snapshot.activeFlow()).isEqualTo("main");
        assertThat(snapshot.instructionPointer()).isEqualTo(1);

        control.resume();
        assertThat(run.get(5, TimeUnit.SECONDS)).isEqualTo(MainExecutor.Outcome.COMPLETED);
        assertThat(input.typed()).containsExactly("one", "two");
    }

    @Test
    void stopEndsInfiniteLoop() throws Exception {
        MainExecutor executor = executor("@main:\n  loop 0:\n    delay(20ms)\n  end\n");
        CompletableFuture<MainExecutor.Outcome> run = CompletableFuture.supplyAsync(executor::run);
        await().atMost(Duration.ofSeconds(2)).until(() -> executor.snapshot().running());

        control.requestStop();

        assertThat(run.get(5, TimeUnit.SECONDS)).isEqualTo(MainExecutor.Outcome.STOPPED);
        assertThat(executor.snapshot().running()).isFalse();
        assertThat(executor.snapshot().callStack()).isEmpty();
    }

    @Test
    void stopDuringInterruptAbandonsIt() {
        MainExecutor executor = executor(
                "@main:\n  type(\"a\")\n  type(\"b\")\n@handler:\n  type(\"h\")\n  type(\"h2\")\n");
        input.onPerform(call -> {
            if ("a".equals(call.firstText())) {
                slot.offer(request("r", "handler"));
            } else if ("h".equals(call.firstText())) {
                control.requestStop();
            }
        });

        assertThat(executor.run()).isEqualTo(MainExecutor.Outcome.STOPPED);
        assertThat(input.typed()).containsExactly("a", "h");
        assertThat(listener.completed).isEmpty();
        assertThat(listener.dropped).extracting(PreemptionRequest::ruleId).containsExactly("r");
    }

    /** Records listener callbacks in order. */
    static class RecordingListener implements PreemptionListener {
        final List<PreemptionRequest> applied = new CopyOnWriteArrayList<>();
        final List<PreemptionRequest> completed = new CopyOnWriteArrayList<>();
        final List<PreemptionRequest> dropped = new CopyOnWriteArrayList<>();

        @Override
        public void onPreemptionApplied(PreemptionRequest request) {
            applied.add(request);
        }

        @Override
        public void onPreemptionCompleted(PreemptionRequest request) {
            completed.add(request);
        }

        @Override
        public void onPreemptionDropped(PreemptionRequest request) {
            dropped.add(request);
        }
    }
}
