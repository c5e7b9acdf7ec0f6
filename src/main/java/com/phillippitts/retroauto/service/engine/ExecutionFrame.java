package com.phillippitts.retroauto.service.engine;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Activation of one flow: the flow plus an instruction pointer into it.
 * Owned and mutated only by the main executor.
 */
public final class ExecutionFrame {

    private final CompiledFlow flow;
    private final String interruptRuleId;
    private final Map<Integer, Long> loopCounters = new HashMap<>();
    private int instructionPointer;

    ExecutionFrame(CompiledFlow flow, String interruptRuleId) {
        this.flow = flow;
        this.interruptRuleId = interruptRuleId;
    }

    public static ExecutionFrame of(CompiledFlow flow) {
        return new ExecutionFrame(flow, null);
    }

    /** Frame pushed by preemption for the given rule. */
    public static ExecutionFrame forInterrupt(CompiledFlow flow, String ruleId) {
        return new ExecutionFrame(flow, ruleId);
    }

    public CompiledFlow flow() {
        return flow;
    }

    public String flowName() {
        return flow.name();
    }

    public int instructionPointer() {
        return instructionPointer;
    }

    public boolean isFinished() {
        return instructionPointer >= flow.size();
    }

    public Instruction current() {
        return flow.at(instructionPointer);
    }

    public boolean isInterrupt() {
        return interruptRuleId != null;
    }

    /** Rule that pushed this frame, or {@code null} for ordinary frames. */
    public String interruptRuleId() {
        return interruptRuleId;
    }

    void advance() {
        instructionPointer++;
    }

    void jump(int target) {
        instructionPointer = target;
    }

    OptionalLong loopCounter(int slot) {
        Long remaining = loopCounters.get(slot);
        return remaining == null ? OptionalLong.empty() : OptionalLong.of(remaining);
    }

    void setLoopCounter(int slot, long remaining) {
        loopCounters.put(slot, remaining);
    }

    void clearLoopCounter(int slot) {
        loopCounters.remove(slot);
    }

    @Override
    public String toString() {
        return flow.name() + "@" + instructionPointer + (isInterrupt() ? " [interrupt " + interruptRuleId + "]" : "");
    }
}
