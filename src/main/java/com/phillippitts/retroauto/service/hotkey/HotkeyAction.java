package com.phillippitts.retroauto.service.hotkey;

import java.util.Locale;
import java.util.Optional;

/**
 * Global session controls bound to keys.
 */
public enum HotkeyAction {
    START, STOP, PAUSE;

    /** Name used in {@code hotkey.*} properties and script {@code @hotkeys} blocks. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<HotkeyAction> fromKey(String key) {
        for (HotkeyAction a : values()) {
            if (a.key().equalsIgnoreCase(key)) {
                return Optional.of(a);
            }
        }
        return Optional.empty();
    }
}
