package com.phillippitts.retroauto.dsl.ast;

import com.phillippitts.retroauto.domain.InterruptRule;
import com.phillippitts.retroauto.domain.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed script. Immutable after parse.
 *
 * @param flows flows by name, in declaration order
 * @param entryFlow name of the flow the executor starts with
 * @param config {@code @config} block values
 * @param hotkeys {@code @hotkeys} block bindings (start, stop, pause)
 * @param interrupts {@code @interrupts} block rules, in registration order
 */
public record Program(Map<String, Flow> flows,
                      String entryFlow,
                      Map<String, Value> config,
                      Map<String, String> hotkeys,
                      List<InterruptRule> interrupts) {

    public static final String DEFAULT_ENTRY = "main";

    public Program {
        flows = Collections.unmodifiableMap(new LinkedHashMap<>(flows));
        config = Collections.unmodifiableMap(new LinkedHashMap<>(config));
        hotkeys = Collections.unmodifiableMap(new LinkedHashMap<>(hotkeys));
        interrupts = List.copyOf(interrupts);
    }

    public Optional<Flow> flow(String name) {
        return Optional.ofNullable(flows.get(name));
    }

    public Optional<Value> configValue(String key) {
        return Optional.ofNullable(config.get(key));
    }
}
