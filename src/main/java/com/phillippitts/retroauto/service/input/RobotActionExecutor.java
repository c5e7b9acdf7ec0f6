package com.phillippitts.retroauto.service.input;

import com.phillippitts.retroauto.config.properties.InputProperties;
import com.phillippitts.retroauto.domain.ActionKind;
import com.phillippitts.retroauto.domain.ResolvedArgs;
import com.phillippitts.retroauto.exception.ActionFailedException;
import com.phillippitts.retroauto.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.Robot;
import java.awt.Toolkit;
import java.awt.datatransfer.StringSelection;
import java.awt.event.InputEvent;
import java.awt.event.KeyEvent;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Input simulation via java.awt.Robot. Requires Accessibility permission on macOS.
 *
 * For hermetic tests, RobotFacade can be replaced.
 */
@Component
public class RobotActionExecutor implements ActionExecutor {
    private static final Logger LOG = LogManager.getLogger(RobotActionExecutor.class);

    interface RobotFacade {
        void keyPress(int keyCode);
        void keyRelease(int keyCode);
        void mouseMove(int x, int y);
        void mousePress(int buttons);
        void mouseRelease(int buttons);
        void mouseWheel(int amount);
        void delay(int ms);
    }

    static final class AwtRobotFacade implements RobotFacade {
        private final Robot robot;

        AwtRobotFacade() throws AWTException {
            this.robot = new Robot();
        }

        @Override
        public void keyPress(int keyCode) {
            robot.keyPress(keyCode);
        }

        @Override
        public void keyRelease(int keyCode) {
            robot.keyRelease(keyCode);
        }

        @Override
        public void mouseMove(int x, int y) {
            robot.mouseMove(x, y);
        }

        @Override
        public void mousePress(int buttons) {
            robot.mousePress(buttons);
        }

        @Override
        public void mouseRelease(int buttons) {
            robot.mouseRelease(buttons);
        }

        @Override
        public void mouseWheel(int amount) {
            robot.mouseWheel(amount);
        }

        @Override
        public void delay(int ms) {
            robot.delay(ms);
        }
    }

    private final InputProperties props;
    private final RobotFacade robot;

    @Autowired
    public RobotActionExecutor(InputProperties props) {
        this(props, createRobotFacade());
    }

    // Package-private for tests
    RobotActionExecutor(InputProperties props, RobotFacade facade) {
        this.props = Objects.requireNonNull(props);
        this.robot = facade; // may be a fake in tests
    }

    private static RobotFacade createRobotFacade() {
        if (GraphicsEnvironment.isHeadless()) {
            return null;
        }
        try {
            return new AwtRobotFacade();
        } catch (AWTException | SecurityException e) {
            LOG.warn("Robot unavailable: {}", e.toString());
            return null;
        }
    }

    @Override
    public boolean isAvailable() {
        return props.isEnableRobot() && robot != null;
    }

    @Override
    public void perform(ActionKind kind, ResolvedArgs args) {
        if (kind.category() != ActionKind.Category.INPUT) {
            throw new ActionFailedException(kind, "not an input action");
        }
        if (!isAvailable()) {
            throw new ActionFailedException(kind, "input simulation is not available");
        }
        try {
            if (props.getFocusDelayMs() > 0) {
                robot.delay(props.getFocusDelayMs());
            }
            switch (kind) {
                case CLICK -> click(args);
                case MOVE -> robot.mouseMove(args.intAt(0), args.intAt(1));
                case DRAG -> drag(args);
                case SCROLL -> scroll(args);
                case TYPE -> type(args);
                case HOTKEY -> hotkey(args);
                default -> throw new ActionFailedException(kind, "unsupported input action");
            }
        } catch (ActionFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ActionFailedException(kind, e.getMessage(), e);
        }
    }

    private void click(ResolvedArgs args) {
        if (args.size() >= 2) {
            robot.mouseMove(args.intAt(0), args.intAt(1));
        }
        int mask = buttonMask(ActionKind.CLICK, args.textOption("button", "left"));
        int clicks = Math.max(1, args.intOption("clicks", 1));
        int interval = (int) args.durationOption("interval",
                Duration.ofMillis(props.getClickIntervalMs())).toMillis();
        for (int i = 0; i < clicks; i++) {
            if (i > 0 && interval > 0) {
                robot.delay(interval);
            }
            robot.mousePress(mask);
            robot.mouseRelease(mask);
        }
    }

    private void drag(ResolvedArgs args) {
        int x1 = args.intAt(0);
        int y1 = args.intAt(1);
        int x2 = args.intAt(2);
        int y2 = args.intAt(3);
        int mask = buttonMask(ActionKind.DRAG, args.textOption("button", "left"));
        int steps = props.getDragSteps();
        long totalMs = args.durationOption("duration", Duration.ofMillis(300)).toMillis();
        int stepDelay = (int) Math.max(0, totalMs / steps);

        robot.mouseMove(x1, y1);
        robot.mousePress(mask);
        try {
            for (int i = 1; i <= steps; i++) {
                int x = x1 + (int) Math.round((x2 - x1) * (double) i / steps);
                int y = y1 + (int) Math.round((y2 - y1) * (double) i / steps);
                if (stepDelay > 0) {
                    robot.delay(stepDelay);
                }
                robot.mouseMove(x, y);
            }
        } finally {
            robot.mouseRelease(mask);
        }
    }

    private void scroll(ResolvedArgs args) {
        if (args.size() >= 3) {
            robot.mouseMove(args.intAt(1), args.intAt(2));
        }
        robot.mouseWheel(args.intAt(0));
    }

    private void type(ResolvedArgs args) {
        String text = args.textAt(0);
        LOG.debug("type {}", LogSanitizer.truncate(text));
        if (args.boolOption("paste", false)) {
            Toolkit.getDefaultToolkit().getSystemClipboard().setContents(new StringSelection(text), null);
            pasteShortcut(robot, props.getPasteShortcut());
        } else {
            for (char c : text.toCharArray()) {
                typeChar(c);
            }
        }
        if (args.boolOption("enter", false)) {
            tap(KeyEvent.VK_ENTER);
        }
    }

    private void typeChar(char c) {
        if (c == '\n') {
            tap(KeyEvent.VK_ENTER);
            return;
        }
        int code = KeyEvent.getExtendedKeyCodeForChar(c);
        if (code == KeyEvent.VK_UNDEFINED) {
            throw new ActionFailedException(ActionKind.TYPE,
                    "cannot type character U+" + String.format("%04X", (int) c) + " (use paste=true)");
        }
        boolean shift = Character.isUpperCase(c);
        if (shift) {
            robot.keyPress(KeyEvent.VK_SHIFT);
        }
        try {
            tap(code);
        } finally {
            if (shift) {
                robot.keyRelease(KeyEvent.VK_SHIFT);
            }
        }
        if (props.getTypeDelayMs() > 0) {
            robot.delay(props.getTypeDelayMs());
        }
    }

    private void hotkey(ResolvedArgs args) {
        List<Integer> codes = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            String name = args.textAt(i);
            codes.add(KeyCodes.resolve(name)
                    .orElseThrow(() -> new ActionFailedException(ActionKind.HOTKEY, "unknown key '" + name + "'")));
        }
        for (int code : codes) {
            robot.keyPress(code);
        }
        for (int i = codes.size() - 1; i >= 0; i--) {
            robot.keyRelease(codes.get(i));
        }
    }

    private void tap(int code) {
        robot.keyPress(code);
        robot.keyRelease(code);
    }

    static int buttonMask(ActionKind kind, String button) {
        return switch (button.toLowerCase(Locale.ROOT)) {
            case "left" -> InputEvent.BUTTON1_DOWN_MASK;
            case "middle" -> InputEvent.BUTTON2_DOWN_MASK;
            case "right" -> InputEvent.BUTTON3_DOWN_MASK;
            default -> throw new ActionFailedException(kind, "unknown mouse button '" + button + "'");
        };
    }

    static void pasteShortcut(RobotFacade robot, String mode) {
        boolean mac = System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("mac");
        int modKey = mac ? KeyEvent.VK_META : KeyEvent.VK_CONTROL;
        if ("META+V".equalsIgnoreCase(mode)) {
            modKey = KeyEvent.VK_META;
        } else if ("CONTROL+V".equalsIgnoreCase(mode)) {
            modKey = KeyEvent.VK_CONTROL;
        }
        robot.keyPress(modKey);
        robot.keyPress(KeyEvent.VK_V);
        robot.keyRelease(KeyEvent.VK_V);
        robot.keyRelease(modKey);
    }
}
