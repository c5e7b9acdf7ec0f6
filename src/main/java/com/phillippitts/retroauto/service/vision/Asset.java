package com.phillippitts.retroauto.service.vision;

import java.awt.image.BufferedImage;
import java.util.Map;
import java.util.Objects;

/**
 * Template bitmap plus free-form metadata (source path, size).
 */
public record Asset(String id, BufferedImage image, Map<String, String> metadata) {
    public Asset {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(image, "image");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
