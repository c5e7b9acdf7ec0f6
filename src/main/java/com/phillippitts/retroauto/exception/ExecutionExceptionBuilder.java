package com.phillippitts.retroauto.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ScriptExecutionException} with location and diagnostic metadata.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw ExecutionExceptionBuilder.create("Action failed")
 *         .location("main", 4)
 *         .cause(ex)
 *         .metadata("action", "click")
 *         .build();
 * </pre>
 */
public final class ExecutionExceptionBuilder {

    private final String message;
    private String flowName = "unknown";
    private int instructionIndex = -1;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ExecutionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ExecutionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ExecutionExceptionBuilder(message);
    }

    public ExecutionExceptionBuilder location(String flowName, int instructionIndex) {
        this.flowName = flowName;
        this.instructionIndex = instructionIndex;
        return this;
    }

    public ExecutionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public ExecutionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public ScriptExecutionException build() {
        String detailed = buildDetailedMessage();
        if (cause != null) {
            return new ScriptExecutionException(detailed, flowName, instructionIndex, cause);
        }
        return new ScriptExecutionException(detailed, flowName, instructionIndex);
    }

    private String buildDetailedMessage() {
        if (metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" [");
        boolean first = true;
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(']').toString();
    }
}
