package com.phillippitts.retroauto.service.metrics;

import com.phillippitts.retroauto.service.engine.EngineState;
import com.phillippitts.retroauto.service.events.ActionExecutedEvent;
import com.phillippitts.retroauto.service.events.EngineStateChangedEvent;
import com.phillippitts.retroauto.service.events.InterruptFiredEvent;
import com.phillippitts.retroauto.service.events.ScriptErrorEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation fed from the script event stream.
 *
 * <p>Provides:
 * <ul>
 *   <li>Action latency per action kind</li>
 *   <li>Interrupt firings per rule</li>
 *   <li>Script errors per type and resolution</li>
 *   <li>Session outcomes</li>
 * </ul>
 */
@Component
public class EngineMetrics {

    private static final String METRIC_PREFIX = "retroauto.engine";

    private final MeterRegistry registry;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @EventListener
    public void onAction(ActionExecutedEvent e) {
        Timer.builder(METRIC_PREFIX + ".action.latency")
                .description("Time taken by a script action")
                .tag("kind", e.kind().keyword())
                .register(registry)
                .record(e.durationMs(), TimeUnit.MILLISECONDS);
    }

    @EventListener
    public void onInterrupt(InterruptFiredEvent e) {
        Counter.builder(METRIC_PREFIX + ".interrupts")
                .description("Number of interrupt flows started")
                .tag("rule", e.ruleId())
                .register(registry)
                .increment();
    }

    @EventListener
    public void onError(ScriptErrorEvent e) {
        Counter.builder(METRIC_PREFIX + ".errors")
                .description("Number of script errors")
                .tag("type", e.errorType())
                .tag("resolution", e.resolution())
                .register(registry)
                .increment();
    }

    @EventListener
    public void onStateChanged(EngineStateChangedEvent e) {
        if (e.to() != EngineState.IDLE) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".sessions")
                .description("Number of finished sessions by outcome")
                .tag("outcome", e.reason())
                .register(registry)
                .increment();
    }
}
