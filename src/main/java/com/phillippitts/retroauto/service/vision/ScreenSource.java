package com.phillippitts.retroauto.service.vision;

import com.phillippitts.retroauto.domain.Region;

import java.awt.image.BufferedImage;

/**
 * Captures pixels for matching. {@code null} region means the full screen.
 */
public interface ScreenSource {

    BufferedImage capture(Region region);
}
