package com.phillippitts.retroauto.service.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup of compiled flows by name, shared by every frame of a session.
 */
public final class FlowRegistry {

    private final Map<String, CompiledFlow> flows;

    public FlowRegistry(Map<String, CompiledFlow> flows) {
        this.flows = Collections.unmodifiableMap(new LinkedHashMap<>(flows));
    }

    public Optional<CompiledFlow> find(String name) {
        return Optional.ofNullable(flows.get(name));
    }

    /**
     * @throws IllegalArgumentException if no flow has that name
     */
    public CompiledFlow require(String name) {
        CompiledFlow flow = flows.get(name);
        if (flow == null) {
            throw new IllegalArgumentException("Unknown flow '" + name + "'");
        }
        return flow;
    }

    public boolean contains(String name) {
        return flows.containsKey(name);
    }

    public Set<String> names() {
        return flows.keySet();
    }
}
