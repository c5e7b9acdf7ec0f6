package com.phillippitts.retroauto.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties controlling simulated mouse and keyboard input.
 *
 * Privacy defaults: INFO logs never include full typed text.
 */
@Validated
@ConfigurationProperties(prefix = "input")
public class InputProperties {

    /** Enable Robot-based input. If false, every input action fails. */
    private final boolean enableRobot;

    /** Delay before the first event of an action (ms). */
    @Min(0)
    @Max(1000)
    private final int focusDelayMs;

    /** Default pause between clicks of a multi-click (ms). */
    @Min(0)
    @Max(2000)
    private final int clickIntervalMs;

    /** Intermediate mouse positions emitted during a drag. */
    @Min(1)
    @Max(500)
    private final int dragSteps;

    /** Delay between typed characters (ms). */
    @Min(0)
    @Max(500)
    private final int typeDelayMs;

    /** Paste shortcut used by {@code type(..., paste=true)}: os-default | META+V | CONTROL+V. */
    private final String pasteShortcut;

    @ConstructorBinding
    public InputProperties(Boolean enableRobot,
                           Integer focusDelayMs,
                           Integer clickIntervalMs,
                           Integer dragSteps,
                           Integer typeDelayMs,
                           String pasteShortcut) {
        this.enableRobot = enableRobot == null || enableRobot;
        this.focusDelayMs = focusDelayMs == null ? 0 : focusDelayMs;
        this.clickIntervalMs = clickIntervalMs == null ? 50 : clickIntervalMs;
        this.dragSteps = dragSteps == null ? 20 : dragSteps;
        this.typeDelayMs = typeDelayMs == null ? 5 : typeDelayMs;
        this.pasteShortcut = (pasteShortcut == null || pasteShortcut.isBlank()) ? "os-default" : pasteShortcut;
    }

    public boolean isEnableRobot() { return enableRobot; }
    public int getFocusDelayMs() { return focusDelayMs; }
    public int getClickIntervalMs() { return clickIntervalMs; }
    public int getDragSteps() { return dragSteps; }
    public int getTypeDelayMs() { return typeDelayMs; }
    public String getPasteShortcut() { return pasteShortcut; }
}
