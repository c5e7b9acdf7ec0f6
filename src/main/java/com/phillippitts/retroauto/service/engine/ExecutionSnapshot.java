package com.phillippitts.retroauto.service.engine;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of executor state for the debugger, published at statement boundaries.
 *
 * @param activeFlow flow of the top frame, {@code null} when nothing runs
 * @param instructionPointer index about to execute in the active flow, -1 when nothing runs
 * @param instruction rendered form of that instruction
 * @param callStack frames bottom to top
 * @param variables variable name to source-form value, in assignment order
 */
public record ExecutionSnapshot(boolean running,
                                boolean paused,
                                String activeFlow,
                                int instructionPointer,
                                String instruction,
                                List<FrameView> callStack,
                                Map<String, String> variables,
                                Instant at) {

    public static final ExecutionSnapshot EMPTY =
            new ExecutionSnapshot(false, false, null, -1, null, List.of(), Map.of(), Instant.EPOCH);

    public ExecutionSnapshot {
        callStack = List.copyOf(callStack);
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    /** One call stack entry. {@code interruptRuleId} is set for frames pushed by preemption. */
    public record FrameView(String flow, int instructionPointer, String interruptRuleId) {
    }
}
