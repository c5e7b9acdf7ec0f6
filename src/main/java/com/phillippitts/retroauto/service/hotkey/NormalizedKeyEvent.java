package com.phillippitts.retroauto.service.hotkey;

import java.util.Locale;
import java.util.Set;

/**
 * Library-neutral keyboard event. Key and modifier names are canonical upper case
 * as produced by {@link KeyNameMapper}.
 */
public record NormalizedKeyEvent(Type type, String key, Set<String> modifiers, long whenMillis) {

    public enum Type { PRESSED, RELEASED }

    public NormalizedKeyEvent {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        key = key.toUpperCase(Locale.ROOT);
        modifiers = modifiers == null ? Set.of() : Set.copyOf(modifiers.stream()
                .map(KeyNameMapper::normalizeModifier)
                .toList());
    }
}
