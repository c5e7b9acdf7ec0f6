package com.phillippitts.retroauto.service.metrics;

import com.phillippitts.retroauto.domain.ActionKind;
import com.phillippitts.retroauto.service.engine.EngineState;
import com.phillippitts.retroauto.service.events.ActionExecutedEvent;
import com.phillippitts.retroauto.service.events.EngineStateChangedEvent;
import com.phillippitts.retroauto.service.events.InterruptFiredEvent;
import com.phillippitts.retroauto.service.events.ScriptErrorEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class EngineMetricsTest {

    private MeterRegistry registry;
    private EngineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new EngineMetrics(registry);
    }

    @Test
    void shouldRecordActionLatencyPerKind() {
        metrics.onAction(new ActionExecutedEvent("s", "main", 0, ActionKind.CLICK, 40, Instant.now()));
        metrics.onAction(new ActionExecutedEvent("s", "main", 1, ActionKind.CLICK, 60, Instant.now()));

        Timer timer = registry.find("retroauto.engine.action.latency").tag("kind", "click").timer();

        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(100.0);
    }

    @Test
    void shouldCountInterruptsPerRule() {
        metrics.onInterrupt(new InterruptFiredEvent("s", "popup", "close_popup", "main", 3, Instant.now()));
        metrics.onInterrupt(new InterruptFiredEvent("s", "popup", "close_popup", "main", 7, Instant.now()));

        Counter counter = registry.find("retroauto.engine.interrupts").tag("rule", "popup").counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(2.0);
    }

    @Test
    void shouldCountErrorsByTypeAndResolution() {
        metrics.onError(new ScriptErrorEvent("s", "main", 2, "ImageNotFoundException", "x", "skip", false,
                Instant.now()));

        Counter counter = registry.find("retroauto.engine.errors")
                .tag("type", "ImageNotFoundException")
                .tag("resolution", "skip")
                .counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountOnlyFinishedSessions() {
        metrics.onStateChanged(new EngineStateChangedEvent("s", EngineState.IDLE, EngineState.RUNNING, "start",
                Instant.now()));
        metrics.onStateChanged(new EngineStateChangedEvent("s", EngineState.STOPPING, EngineState.IDLE, "completed",
                Instant.now()));

        assertThat(registry.find("retroauto.engine.sessions").counters()).hasSize(1);
        assertThat(registry.find("retroauto.engine.sessions").tag("outcome", "completed").counter().count())
                .isEqualTo(1.0);
    }
}
