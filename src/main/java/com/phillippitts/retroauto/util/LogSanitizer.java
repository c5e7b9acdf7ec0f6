package com.phillippitts.retroauto.util;

/** Utility for privacy-safe logging of typed text and variable values. */
public final class LogSanitizer {

    /** Preview length used when no explicit limit is given. */
    public static final int DEFAULT_PREVIEW = 16;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters, marking the cut with an ellipsis;
     * returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "…(" + s.length() + " chars)";
    }

    public static String truncate(String s) {
        return truncate(s, DEFAULT_PREVIEW);
    }
}
