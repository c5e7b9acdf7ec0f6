package com.phillippitts.retroauto.service.events;

import java.time.Instant;

/**
 * Published when a frame is pushed for a flow.
 *
 * @param interruptRuleId rule that preempted into this flow, {@code null} for ordinary calls
 */
public record FlowEnteredEvent(String sessionId, String flow, int depth, String interruptRuleId, Instant at) {
    public FlowEnteredEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
