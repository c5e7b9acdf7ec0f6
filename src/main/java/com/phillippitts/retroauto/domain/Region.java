package com.phillippitts.retroauto.domain;

/**
 * Region of interest restricting where a template is searched.
 */
public record Region(int x, int y, int width, int height) {

    public Region {
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Region origin must be non-negative: " + x + "," + y);
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Region size must be positive: " + width + "x" + height);
        }
    }

    public boolean contains(int px, int py) {
        return px >= x && px < x + width && py >= y && py < y + height;
    }
}
