package com.phillippitts.retroauto.service.engine;

import com.phillippitts.retroauto.config.properties.EngineProperties;
import com.phillippitts.retroauto.domain.ErrorPolicy;
import com.phillippitts.retroauto.domain.Value;
import com.phillippitts.retroauto.dsl.ast.Program;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Effective per-session settings: engine defaults overridden by the script's {@code @config}.
 *
 * @param maxDepth call stack bound, entry frame included
 * @param onError default policy for recoverable errors
 * @param waitTimeout default timeout of wait-style actions
 * @param pollInterval default polling period of wait-style actions
 * @param tolerateMissingAssets treat missing assets like recoverable errors
 * @param tickInterval supervisor period override, {@code null} to keep the configured one
 */
public record ExecutionSettings(int maxDepth,
                                ErrorPolicy onError,
                                Duration waitTimeout,
                                Duration pollInterval,
                                boolean tolerateMissingAssets,
                                Duration tickInterval) {

    public ExecutionSettings {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1: " + maxDepth);
        }
        Objects.requireNonNull(onError, "onError");
        Objects.requireNonNull(waitTimeout, "waitTimeout");
        Objects.requireNonNull(pollInterval, "pollInterval");
    }

    public static ExecutionSettings defaults() {
        return new ExecutionSettings(CallStack.DEFAULT_MAX_DEPTH, ErrorPolicy.ABORT,
                Duration.ofSeconds(10), Duration.ofMillis(100), false, null);
    }

    public static ExecutionSettings from(EngineProperties props) {
        return new ExecutionSettings(props.getMaxCallDepth(), props.getOnError(),
                Duration.ofMillis(props.getWaitTimeoutMs()), Duration.ofMillis(props.getPollIntervalMs()),
                props.isTolerateMissingAssets(), null);
    }

    /** Applies {@code @config} overrides. Values were type-checked by the parser. */
    public ExecutionSettings withOverrides(Program program) {
        Map<String, Value> config = program.config();
        return new ExecutionSettings(
                config.containsKey("max_depth") ? Math.toIntExact(config.get("max_depth").asLong()) : maxDepth,
                config.containsKey("on_error") ? ErrorPolicy.parse(config.get("on_error").asText()) : onError,
                config.containsKey("wait_timeout") ? config.get("wait_timeout").asDuration() : waitTimeout,
                config.containsKey("poll_interval") ? config.get("poll_interval").asDuration() : pollInterval,
                config.containsKey("tolerate_missing_assets")
                        ? config.get("tolerate_missing_assets").asBoolean() : tolerateMissingAssets,
                config.containsKey("tick_interval") ? config.get("tick_interval").asDuration() : tickInterval);
    }
}
