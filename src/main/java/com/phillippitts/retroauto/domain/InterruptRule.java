package com.phillippitts.retroauto.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Trigger condition plus the flow to run when it fires.
 * Immutable; the last-fired timestamp is owned by the interrupt supervisor.
 *
 * @param id unique rule id
 * @param triggerAssetId template watched on screen
 * @param region optional search region
 * @param threshold match threshold in [0, 1]
 * @param targetFlow flow pushed onto the call stack when the rule fires
 * @param priority higher wins when several rules trigger in one tick
 * @param cooldown minimum time between completion of one firing and the next
 */
public record InterruptRule(String id,
                            String triggerAssetId,
                            Region region,
                            double threshold,
                            String targetFlow,
                            int priority,
                            Duration cooldown) {

    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(2);

    public InterruptRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(triggerAssetId, "triggerAssetId");
        Objects.requireNonNull(targetFlow, "targetFlow");
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [0, 1]: " + threshold);
        }
        if (cooldown == null) {
            cooldown = DEFAULT_COOLDOWN;
        }
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative: " + cooldown);
        }
    }

    public MatchRequest trigger() {
        return new MatchRequest(triggerAssetId, region, threshold, ColorMode.GRAYSCALE);
    }
}
