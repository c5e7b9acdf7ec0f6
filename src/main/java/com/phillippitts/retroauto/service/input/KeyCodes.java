package com.phillippitts.retroauto.service.input;

import java.awt.event.KeyEvent;
import java.lang.reflect.Field;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves script key names ({@code "ctrl"}, {@code "F5"}, {@code "a"}) to AWT virtual key codes.
 */
final class KeyCodes {

    private static final Map<String, Integer> ALIASES = Map.ofEntries(
            Map.entry("CTRL", KeyEvent.VK_CONTROL),
            Map.entry("CONTROL", KeyEvent.VK_CONTROL),
            Map.entry("CMD", KeyEvent.VK_META),
            Map.entry("COMMAND", KeyEvent.VK_META),
            Map.entry("META", KeyEvent.VK_META),
            Map.entry("WIN", KeyEvent.VK_WINDOWS),
            Map.entry("OPTION", KeyEvent.VK_ALT),
            Map.entry("ESC", KeyEvent.VK_ESCAPE),
            Map.entry("RETURN", KeyEvent.VK_ENTER),
            Map.entry("DEL", KeyEvent.VK_DELETE),
            Map.entry("PGUP", KeyEvent.VK_PAGE_UP),
            Map.entry("PGDN", KeyEvent.VK_PAGE_DOWN),
            Map.entry("INS", KeyEvent.VK_INSERT)
    );

    private KeyCodes() {
    }

    static Optional<Integer> resolve(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String upper = name.trim().toUpperCase(Locale.ROOT);
        Integer alias = ALIASES.get(upper);
        if (alias != null) {
            return Optional.of(alias);
        }
        try {
            Field field = KeyEvent.class.getField("VK_" + upper);
            return Optional.of(field.getInt(null));
        } catch (NoSuchFieldException | IllegalAccessException e) {
            return Optional.empty();
        }
    }
}
