package com.phillippitts.retroauto.domain;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Arguments of an action after every expression has been evaluated.
 * Typed accessors convert values and report type mismatches as {@link IllegalArgumentException}.
 */
public record ResolvedArgs(List<Value> positional, Map<String, Value> named) {

    public ResolvedArgs {
        positional = List.copyOf(positional);
        named = Map.copyOf(named);
    }

    public static ResolvedArgs of(List<Value> positional) {
        return new ResolvedArgs(positional, Map.of());
    }

    public int size() {
        return positional.size();
    }

    public Value at(int index) {
        if (index >= positional.size()) {
            throw new IllegalArgumentException("Missing argument #" + (index + 1));
        }
        return positional.get(index);
    }

    public int intAt(int index) {
        return Math.toIntExact(at(index).asLong());
    }

    public String textAt(int index) {
        return at(index).asText();
    }

    public Optional<Value> option(String name) {
        return Optional.ofNullable(named.get(name));
    }

    public int intOption(String name, int fallback) {
        return option(name).map(v -> Math.toIntExact(v.asLong())).orElse(fallback);
    }

    public double doubleOption(String name, double fallback) {
        return option(name).map(Value::asDouble).orElse(fallback);
    }

    public boolean boolOption(String name, boolean fallback) {
        return option(name).map(Value::asBoolean).orElse(fallback);
    }

    public String textOption(String name, String fallback) {
        return option(name).map(Value::asText).orElse(fallback);
    }

    public Duration durationOption(String name, Duration fallback) {
        return option(name).map(Value::asDuration).orElse(fallback);
    }

    /** Reads a 4-tuple option {@code (x, y, w, h)} as a region. */
    public Optional<Region> regionOption(String name) {
        return option(name).map(v -> {
            List<Value> parts = v.asList();
            if (parts.size() != 4) {
                throw new IllegalArgumentException(name + " must be a tuple (x, y, w, h)");
            }
            return new Region(Math.toIntExact(parts.get(0).asLong()), Math.toIntExact(parts.get(1).asLong()),
                    Math.toIntExact(parts.get(2).asLong()), Math.toIntExact(parts.get(3).asLong()));
        });
    }
}
