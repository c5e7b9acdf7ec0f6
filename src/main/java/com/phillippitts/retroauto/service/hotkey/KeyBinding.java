package com.phillippitts.retroauto.service.hotkey;

import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A parsed key combination such as {@code CONTROL+F6}. Matches a press whose key is the
 * primary key and whose modifiers are exactly the configured ones.
 */
public record KeyBinding(Set<String> modifiers, String key) {

    public KeyBinding {
        modifiers = Set.copyOf(modifiers);
    }

    /**
     * @throws IllegalArgumentException for an unknown key or modifier, or a missing primary key
     */
    public static KeyBinding parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Key binding must not be blank");
        }
        String key = null;
        Set<String> mods = new HashSet<>();
        for (String part : spec.split("\\+")) {
            String p = part.trim();
            if (p.isEmpty()) {
                continue;
            }
            if (KeyNameMapper.isValidModifier(p)) {
                mods.add(KeyNameMapper.normalizeModifier(p));
            } else if (KeyNameMapper.isValidKey(p)) {
                if (key != null) {
                    throw new IllegalArgumentException("Key binding has two primary keys: " + spec);
                }
                key = KeyNameMapper.normalizeKey(p);
            } else {
                throw new IllegalArgumentException("Unknown key '" + p + "' in binding " + spec);
            }
        }
        if (key == null) {
            throw new IllegalArgumentException("Key binding has no primary key: " + spec);
        }
        return new KeyBinding(mods, key);
    }

    public boolean matches(NormalizedKeyEvent e) {
        return e.key().equals(key) && e.modifiers().equals(modifiers);
    }

    public boolean conflictsWith(String reservedSpec) {
        return KeyNameMapper.matchesReserved(modifiers, key, reservedSpec);
    }

    @Override
    public String toString() {
        if (modifiers.isEmpty()) {
            return key;
        }
        return modifiers.stream().sorted().collect(Collectors.joining("+")) + "+" + key;
    }
}
