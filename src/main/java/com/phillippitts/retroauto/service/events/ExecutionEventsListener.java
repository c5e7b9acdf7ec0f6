package com.phillippitts.retroauto.service.events;

import com.phillippitts.retroauto.service.hotkey.event.HotkeyPermissionDeniedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes the script log stream. Flow and action traffic goes to DEBUG; interrupts and state
 * changes to INFO. Recoverable errors are throttled per (flow, instruction, type) so a
 * {@code skip} inside a tight loop does not flood the log; fatal errors are always logged.
 */
@Component
class ExecutionEventsListener {
    private static final Logger LOG = LogManager.getLogger(ExecutionEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofSeconds(30);

    @EventListener
    void onFlowEntered(FlowEnteredEvent e) {
        if (e.interruptRuleId() != null) {
            LOG.debug("[{}] enter {} (depth {}, rule {})", e.sessionId(), e.flow(), e.depth(), e.interruptRuleId());
        } else {
            LOG.debug("[{}] enter {} (depth {})", e.sessionId(), e.flow(), e.depth());
        }
    }

    @EventListener
    void onFlowExited(FlowExitedEvent e) {
        LOG.debug("[{}] exit {} (depth {})", e.sessionId(), e.flow(), e.depth());
    }

    @EventListener
    void onActionExecuted(ActionExecutedEvent e) {
        LOG.debug("[{}] {}@{} {} in {}ms", e.sessionId(), e.flow(), e.instruction(), e.kind().keyword(), e.durationMs());
    }

    @EventListener
    void onInterruptFired(InterruptFiredEvent e) {
        LOG.info("[{}] interrupt {} -> {} (preempted {}@{})", e.sessionId(), e.ruleId(), e.targetFlow(),
                e.preemptedFlow(), e.preemptedInstruction());
    }

    @EventListener
    void onInterruptCompleted(InterruptCompletedEvent e) {
        LOG.info("[{}] interrupt {} done", e.sessionId(), e.ruleId());
    }

    @EventListener
    void onStateChanged(EngineStateChangedEvent e) {
        LOG.info("[{}] {} -> {} ({})", e.sessionId(), e.from(), e.to(), e.reason());
    }

    @EventListener
    void onScriptError(ScriptErrorEvent e) {
        if (e.fatal()) {
            LOG.error("[{}] fatal {} at {}@{}: {}", e.sessionId(), e.errorType(), e.flow(), e.instruction(), e.message());
            return;
        }
        if (shouldLog(e.flow() + '@' + e.instruction() + '-' + e.errorType())) {
            LOG.warn("[{}] {} at {}@{} ({}): {}", e.sessionId(), e.errorType(), e.flow(), e.instruction(),
                    e.resolution(), e.message());
        }
    }

    @EventListener
    void onHotkeyPermissionDenied(HotkeyPermissionDeniedEvent e) {
        if (shouldLog("hotkey-permission")) {
            LOG.warn("Hotkey permission denied. On macOS grant Accessibility: "
                    + "System Settings → Privacy & Security → Accessibility (then restart app)");
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
