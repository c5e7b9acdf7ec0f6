package com.phillippitts.retroauto.domain;

import java.util.Locale;

/**
 * What the executor does when a wait-style action times out.
 */
public enum ErrorPolicy {
    /** Pause the engine; resuming retries the failed statement. */
    PAUSE,
    /** Log and continue with the next statement. */
    SKIP,
    /** Halt the script as a fatal error. */
    ABORT;

    public static ErrorPolicy parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("on_error policy must not be blank");
        }
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown on_error policy '" + text + "' (expected pause, skip or abort)");
        }
    }

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
