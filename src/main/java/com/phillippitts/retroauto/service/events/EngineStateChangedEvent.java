package com.phillippitts.retroauto.service.events;

import com.phillippitts.retroauto.service.engine.EngineState;

import java.time.Instant;

/** Published on every session lifecycle transition. */
public record EngineStateChangedEvent(String sessionId, EngineState from, EngineState to, String reason, Instant at) {
    public EngineStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
