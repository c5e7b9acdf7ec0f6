package com.phillippitts.retroauto.service.events;

import com.phillippitts.retroauto.domain.ActionKind;

import java.time.Instant;

/**
 * Published after a primitive action completes successfully.
 *
 * <p>PII note: arguments are not included; typed text must never reach the log stream.
 */
public record ActionExecutedEvent(String sessionId,
                                  String flow,
                                  int instruction,
                                  ActionKind kind,
                                  long durationMs,
                                  Instant at) {
    public ActionExecutedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
