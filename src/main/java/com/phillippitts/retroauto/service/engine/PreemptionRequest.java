package com.phillippitts.retroauto.service.engine;

import java.time.Instant;
import java.util.Objects;

/**
 * Message from the supervisor to the executor: run {@code targetFlow} at the next safe point.
 */
public record PreemptionRequest(String ruleId, String targetFlow, int priority, Instant requestedAt) {
    public PreemptionRequest {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(targetFlow, "targetFlow");
        if (requestedAt == null) {
            requestedAt = Instant.now();
        }
    }
}
