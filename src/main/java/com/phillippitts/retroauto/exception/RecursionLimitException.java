package com.phillippitts.retroauto.exception;

/**
 * Thrown when a flow call or an interrupt preemption would push the call stack past
 * its maximum depth. Always fatal: the stack is discarded.
 */
public class RecursionLimitException extends ScriptExecutionException {

    private final int maxDepth;

    public RecursionLimitException(String targetFlow, int maxDepth, String flowName, int instructionIndex) {
        super("Call depth limit " + maxDepth + " exceeded entering flow '" + targetFlow + "'",
                flowName, instructionIndex);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
