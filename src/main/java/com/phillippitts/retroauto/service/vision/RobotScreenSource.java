package com.phillippitts.retroauto.service.vision;

import com.phillippitts.retroauto.domain.Region;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.Toolkit;
import java.awt.image.BufferedImage;

/**
 * Screen capture through {@link Robot}. Unavailable in headless environments, where every
 * capture fails with {@link IllegalStateException}.
 */
@Component
public class RobotScreenSource implements ScreenSource {

    private static final Logger LOG = LogManager.getLogger(RobotScreenSource.class);

    private final Robot robot;

    public RobotScreenSource() {
        this.robot = createRobot();
    }

    private static Robot createRobot() {
        if (GraphicsEnvironment.isHeadless()) {
            LOG.info("Headless environment: screen capture disabled");
            return null;
        }
        try {
            return new Robot();
        } catch (AWTException | SecurityException e) {
            LOG.warn("Screen capture unavailable: {}", e.toString());
            return null;
        }
    }

    @Override
    public BufferedImage capture(Region region) {
        if (robot == null) {
            throw new IllegalStateException("Screen capture is not available");
        }
        Rectangle bounds = region == null
                ? new Rectangle(Toolkit.getDefaultToolkit().getScreenSize())
                : new Rectangle(region.x(), region.y(), region.width(), region.height());
        return robot.createScreenCapture(bounds);
    }
}
