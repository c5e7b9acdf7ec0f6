package com.phillippitts.retroauto.service.events;

import java.time.Instant;

/**
 * Published for every error raised while a script runs.
 *
 * @param errorType simple class name of the exception
 * @param resolution what the executor did: abort, skip or pause
 * @param fatal whether the script halted
 */
public record ScriptErrorEvent(String sessionId,
                               String flow,
                               int instruction,
                               String errorType,
                               String message,
                               String resolution,
                               boolean fatal,
                               Instant at) {
    public ScriptErrorEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
