package com.phillippitts.retroauto.service.engine;

import com.phillippitts.retroauto.domain.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Single global namespace shared by every flow, interrupt flows included.
 *
 * <p>Not thread-safe: only the main executor thread writes. Other threads read the copies
 * published in {@link ExecutionSnapshot}.
 */
public final class VariableStore {

    private final Map<String, Value> values = new LinkedHashMap<>();

    public Optional<Value> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * @throws IllegalArgumentException if the variable was never assigned
     */
    public Value require(String name) {
        Value value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Undefined variable $" + name);
        }
        return value;
    }

    public void set(String name, Value value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        values.put(name, value);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public int size() {
        return values.size();
    }

    public void clear() {
        values.clear();
    }

    /** Detached copy in assignment order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
