package com.phillippitts.retroauto.service.session;

import java.time.Instant;

/**
 * How a finished session ended.
 *
 * @param outcome COMPLETED, STOPPED or FAILED
 * @param error message of the fatal error, {@code null} unless FAILED
 */
public record SessionSummary(String sessionId, Outcome outcome, String error, Instant startedAt, Instant endedAt) {

    public enum Outcome { COMPLETED, STOPPED, FAILED }
}
