package com.phillippitts.retroauto.service.hotkey;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Canonical key and modifier names shared by configuration, script {@code @hotkeys}
 * blocks and the native hook adapter.
 */
public final class KeyNameMapper {

    private static final Set<String> MODIFIERS = Set.of("META", "SHIFT", "CONTROL", "ALT");

    private static final Set<String> ALLOWED_KEYS;

    static {
        Set<String> keys = new HashSet<>();
        for (char c = 'A'; c <= 'Z'; c++) {
            keys.add(String.valueOf(c));
        }
        for (char c = '0'; c <= '9'; c++) {
            keys.add(String.valueOf(c));
        }
        IntStream.rangeClosed(1, 24).forEach(i -> keys.add("F" + i));
        keys.addAll(List.of("ESCAPE", "ENTER", "TAB", "SPACE", "BACKSPACE", "PAUSE", "INSERT",
                "DELETE", "HOME", "END", "PAGE_UP", "PAGE_DOWN", "SCROLL_LOCK"));
        ALLOWED_KEYS = Set.copyOf(keys);
    }

    private KeyNameMapper() {}

    /** Canonicalize a key name (case-insensitive, spaces to underscores, aliases). */
    public static String normalizeKey(String keyText) {
        if (keyText == null) {
            return "UNKNOWN";
        }
        String k = keyText.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        return switch (k) {
            case "ESC" -> "ESCAPE";
            case "RETURN" -> "ENTER";
            case "PGUP" -> "PAGE_UP";
            case "PGDN" -> "PAGE_DOWN";
            case "DEL" -> "DELETE";
            default -> k;
        };
    }

    /** Normalize a modifier alias, including left/right variants, to its canonical form. */
    public static String normalizeModifier(String mod) {
        if (mod == null) {
            return "";
        }
        String m = mod.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        if (m.startsWith("LEFT_") || m.startsWith("RIGHT_")) {
            m = m.substring(m.indexOf('_') + 1);
        }
        return switch (m) {
            case "CTRL" -> "CONTROL";
            case "CMD", "COMMAND", "WIN", "SUPER" -> "META";
            case "OPTION" -> "ALT";
            default -> m;
        };
    }

    public static Set<String> normalizeModifiers(List<String> mods) {
        if (mods == null) {
            return Set.of();
        }
        return mods.stream()
                .map(KeyNameMapper::normalizeModifier)
                .collect(Collectors.toUnmodifiableSet());
    }

    public static boolean isValidKey(String key) {
        return ALLOWED_KEYS.contains(normalizeKey(key));
    }

    public static boolean isValidModifier(String mod) {
        return MODIFIERS.contains(normalizeModifier(mod));
    }

    /**
     * Compare a configured binding (mods + key) against a reserved combo string
     * like "META+TAB".
     */
    public static boolean matchesReserved(Set<String> configuredMods, String configuredKey, String reservedSpec) {
        if (reservedSpec == null || reservedSpec.isBlank()) {
            return false;
        }
        Set<String> rmods = new HashSet<>();
        String rkey = null;
        for (String p : reservedSpec.split("\\+")) {
            String n = p.trim();
            if (n.isEmpty()) {
                continue;
            }
            if (isValidModifier(n)) {
                rmods.add(normalizeModifier(n));
            } else {
                rkey = normalizeKey(n);
            }
        }
        Set<String> cmods = configuredMods.stream()
                .map(KeyNameMapper::normalizeModifier)
                .collect(Collectors.toSet());
        return normalizeKey(configuredKey).equals(rkey) && cmods.equals(rmods);
    }
}
