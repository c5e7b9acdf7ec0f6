package com.phillippitts.retroauto.exception;

/**
 * Fatal runtime failure that halts the script.
 * Carries the location (flow name + instruction index) where execution stopped.
 */
public class ScriptExecutionException extends RetroAutoException {

    private final String flowName;
    private final int instructionIndex;

    public ScriptExecutionException(String message, String flowName, int instructionIndex) {
        super(message + " (flow: " + flowName + ", instruction: " + instructionIndex + ")");
        this.flowName = flowName;
        this.instructionIndex = instructionIndex;
    }

    public ScriptExecutionException(String message, String flowName, int instructionIndex, Throwable cause) {
        super(message + " (flow: " + flowName + ", instruction: " + instructionIndex + ")", cause);
        this.flowName = flowName;
        this.instructionIndex = instructionIndex;
    }

    public String getFlowName() {
        return flowName;
    }

    public int getInstructionIndex() {
        return instructionIndex;
    }
}
