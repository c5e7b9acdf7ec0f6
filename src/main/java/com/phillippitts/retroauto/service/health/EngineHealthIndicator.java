package com.phillippitts.retroauto.service.health;

import com.phillippitts.retroauto.service.input.ActionExecutor;
import com.phillippitts.retroauto.service.session.ScriptSessionService;
import com.phillippitts.retroauto.service.session.SessionSummary;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports engine state for monitoring:
 * <ul>
 *   <li>UP: input automation available</li>
 *   <li>DEGRADED: no input backend (headless or Robot disabled); scripts would fail on the first action</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class EngineHealthIndicator implements HealthIndicator {

    private final ScriptSessionService sessions;
    private final ActionExecutor actionExecutor;

    public EngineHealthIndicator(ScriptSessionService sessions, ActionExecutor actionExecutor) {
        this.sessions = sessions;
        this.actionExecutor = actionExecutor;
    }

    @Override
    public Health health() {
        Health.Builder builder = actionExecutor.isAvailable()
                ? Health.up()
                : Health.status("DEGRADED").withDetail("input", "unavailable");
        builder.withDetail("state", sessions.state().name());
        sessions.activeSession().ifPresent(id -> builder.withDetail("session", id));
        sessions.lastSession().map(SessionSummary::outcome)
                .ifPresent(outcome -> builder.withDetail("lastOutcome", outcome.name()));
        return builder.build();
    }
}
