package com.phillippitts.retroauto.domain;

import java.util.Objects;

/**
 * Parameters of a single template lookup.
 *
 * @param templateId asset id of the template
 * @param region optional search region, {@code null} for the whole screen
 * @param threshold minimum score in [0, 1]
 * @param colorMode pixel comparison mode
 */
public record MatchRequest(String templateId, Region region, double threshold, ColorMode colorMode) {

    public static final double DEFAULT_THRESHOLD = 0.8;

    public MatchRequest {
        Objects.requireNonNull(templateId, "templateId");
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [0, 1]: " + threshold);
        }
        if (colorMode == null) {
            colorMode = ColorMode.GRAYSCALE;
        }
    }

    public static MatchRequest of(String templateId) {
        return new MatchRequest(templateId, null, DEFAULT_THRESHOLD, ColorMode.GRAYSCALE);
    }
}
