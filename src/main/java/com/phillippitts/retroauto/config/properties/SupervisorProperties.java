package com.phillippitts.retroauto.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Interrupt supervisor scheduling.
 */
@Validated
@ConfigurationProperties(prefix = "supervisor")
public class SupervisorProperties {

    private final boolean enabled;

    /** Period between rule evaluations (ms). */
    @Min(50)
    @Max(60_000)
    private final long tickPeriodMs;

    @ConstructorBinding
    public SupervisorProperties(Boolean enabled, Long tickPeriodMs) {
        this.enabled = enabled == null || enabled;
        this.tickPeriodMs = tickPeriodMs == null ? 500 : tickPeriodMs;
    }

    public boolean isEnabled() { return enabled; }
    public long getTickPeriodMs() { return tickPeriodMs; }
}
