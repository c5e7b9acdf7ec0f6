package com.phillippitts.retroauto.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Global start / stop / pause key bindings. Key names follow {@code KeyNameMapper}
 * (e.g. F5, ESCAPE, CTRL+F6). A script's {@code @hotkeys} block overrides them.
 *
 * Values are validated on startup for fail-fast behavior.
 */
@Validated
@ConfigurationProperties(prefix = "hotkey")
public class HotkeyProperties {

    /** Registers the native hook when true. Tests and headless runs turn it off. */
    private final boolean enabled;

    @NotBlank
    private final String start;

    @NotBlank
    private final String stop;

    @NotBlank
    private final String pause;

    /** Reserved OS shortcuts that bindings must not collide with (e.g., META+TAB, META+L). */
    private final List<String> reserved;

    @ConstructorBinding
    public HotkeyProperties(Boolean enabled,
                            String start,
                            String stop,
                            String pause,
                            List<String> reserved) {
        this.enabled = enabled == null || enabled;
        this.start = start == null ? "F5" : start;
        this.stop = stop == null ? "F6" : stop;
        this.pause = pause == null ? "F7" : pause;
        this.reserved = (reserved == null || reserved.isEmpty())
                ? List.of("META+TAB", "META+L")
                : List.copyOf(reserved);
    }

    public boolean isEnabled() { return enabled; }
    public String getStart() { return start; }
    public String getStop() { return stop; }
    public String getPause() { return pause; }
    public List<String> getReserved() { return reserved; }
}
