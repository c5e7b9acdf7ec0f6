package com.phillippitts.retroauto.service.events;

import java.time.Instant;

/** Published when a flow's frame is popped after running to its end. */
public record FlowExitedEvent(String sessionId, String flow, int depth, Instant at) {
    public FlowExitedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
