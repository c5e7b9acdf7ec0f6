package com.phillippitts.retroauto.domain;

/**
 * Location and score of a successful template match.
 */
public record Match(int x, int y, int width, int height, double score) {

    public int centerX() {
        return x + width / 2;
    }

    public int centerY() {
        return y + height / 2;
    }
}
