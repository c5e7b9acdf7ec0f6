package com.phillippitts.retroauto.service.events;

import java.time.Instant;

/** Published when an interrupt flow has run to completion and its frame was popped. */
public record InterruptCompletedEvent(String sessionId, String ruleId, String targetFlow, Instant at) {
    public InterruptCompletedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
