package com.phillippitts.retroauto.service.supervisor;

import com.phillippitts.retroauto.domain.InterruptRule;
import com.phillippitts.retroauto.exception.InterruptConflictException;
import com.phillippitts.retroauto.service.engine.ExecutionControl;
import com.phillippitts.retroauto.service.engine.PreemptionListener;
import com.phillippitts.retroauto.service.engine.PreemptionRequest;
import com.phillippitts.retroauto.service.engine.PreemptionSlot;
import com.phillippitts.retroauto.service.events.ScriptErrorEvent;
import com.phillippitts.retroauto.service.vision.VisionMatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodic evaluator of interrupt rules for one script session.
 *
 * <p>Each tick checks every rule whose cooldown has elapsed, picks the highest-priority rule
 * that triggered (earliest registered on ties) and offers a {@link PreemptionRequest} to the
 * executor. The supervisor never touches the call stack or variables; it stays
 * {@link SupervisorState#SUSPENDED} until the executor reports the request completed or
 * dropped through {@link PreemptionListener}. Rules that also triggered in that tick are
 * only reconsidered on a later tick.
 *
 * <p>Cooldowns are measured from the completion of a rule's flow. A matcher failure for one
 * rule is logged and that rule sits out the tick; it never reaches the main script.
 *
 * <p><b>Thread Safety:</b> {@link #tick()} runs on the scheduler thread and the listener
 * callbacks on the executor thread; state transitions are guarded by a {@link ReentrantLock}.
 */
public final class InterruptSupervisor implements PreemptionListener {

    private static final Logger LOG = LogManager.getLogger(InterruptSupervisor.class);

    private final String sessionId;
    private final List<InterruptRule> rules;
    private final VisionMatcher matcher;
    private final PreemptionSlot slot;
    private final ExecutionControl control;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;

    private final ReentrantLock lock = new ReentrantLock();
    private final ConcurrentMap<String, Instant> lastFired = new ConcurrentHashMap<>();
    private SupervisorState state = SupervisorState.IDLE;
    private PreemptionRequest inFlight;

    private volatile boolean stopped;
    private volatile ScheduledFuture<?> schedule;

    public InterruptSupervisor(String sessionId,
                               List<InterruptRule> rules,
                               VisionMatcher matcher,
                               PreemptionSlot slot,
                               ExecutionControl control,
                               Clock clock,
                               ApplicationEventPublisher publisher) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.rules = List.copyOf(rules);
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.slot = Objects.requireNonNull(slot, "slot");
        this.control = Objects.requireNonNull(control, "control");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Schedules {@link #tick()} every {@code period}. No-op when there are no rules.
     */
    public void start(TaskScheduler scheduler, Duration period) {
        if (stopped || rules.isEmpty()) {
            LOG.debug("No interrupt rules registered; supervisor not scheduled");
            return;
        }
        schedule = scheduler.scheduleAtFixedRate(this::safeTick, period);
        LOG.info("Interrupt supervisor started: {} rules, tick={}ms", rules.size(), period.toMillis());
    }

    /** Cancels the timer. Idempotent. */
    public void stop() {
        stopped = true;
        ScheduledFuture<?> s = schedule;
        if (s != null) {
            s.cancel(false);
            schedule = null;
            LOG.info("Interrupt supervisor stopped");
        }
    }

    /**
     * Runs one evaluation cycle. Skipped while stopped, paused or suspended.
     *
     * @return the request offered in this tick, if any
     */
    public Optional<PreemptionRequest> tick() {
        if (stopped || control.isStopRequested()) {
            stop();
            return Optional.empty();
        }
        if (control.isPaused()) {
            return Optional.empty();
        }
        if (!transition(SupervisorState.IDLE, SupervisorState.SCANNING)) {
            LOG.trace("Tick skipped in state {}", state());
            return Optional.empty();
        }

        Instant now = clock.instant();
        InterruptRule winner = null;
        for (InterruptRule rule : rules) {
            if (!cooledDown(rule, now)) {
                continue;
            }
            if (triggered(rule) && (winner == null || rule.priority() > winner.priority())) {
                winner = rule;
            }
        }
        if (winner == null) {
            transition(SupervisorState.SCANNING, SupervisorState.IDLE);
            return Optional.empty();
        }

        transition(SupervisorState.SCANNING, SupervisorState.REQUESTING_PREEMPTION);
        PreemptionRequest request = new PreemptionRequest(winner.id(), winner.targetFlow(), winner.priority(), now);
        // suspend before offering: the executor may complete the request before offer() returns
        lock.lock();
        try {
            inFlight = request;
            state = SupervisorState.SUSPENDED;
        } finally {
            lock.unlock();
        }
        if (!slot.offer(request)) {
            InterruptConflictException conflict = new InterruptConflictException(
                    "Preemption slot already holds a request; dropping rule " + winner.id());
            LOG.error(conflict.getMessage());
            reset(request);
            return Optional.empty();
        }
        LOG.info("Rule {} triggered (priority {}), requesting flow {}", winner.id(), winner.priority(),
                winner.targetFlow());
        return Optional.of(request);
    }

    @Override
    public void onPreemptionApplied(PreemptionRequest request) {
        LOG.debug("Preemption for rule {} applied", request.ruleId());
    }

    @Override
    public void onPreemptionCompleted(PreemptionRequest request) {
        lastFired.put(request.ruleId(), clock.instant());
        reset(request);
    }

    @Override
    public void onPreemptionDropped(PreemptionRequest request) {
        LOG.debug("Preemption for rule {} dropped", request.ruleId());
        reset(request);
    }

    public SupervisorState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Instant> lastFired(String ruleId) {
        return Optional.ofNullable(lastFired.get(ruleId));
    }

    public List<InterruptRule> rules() {
        return rules;
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            // an exception would cancel the fixed-rate schedule
            LOG.error("Supervisor tick failed: {}", e.toString(), e);
            lock.lock();
            try {
                if (state == SupervisorState.SCANNING || state == SupervisorState.REQUESTING_PREEMPTION) {
                    state = SupervisorState.IDLE;
                }
            } finally {
                lock.unlock();
            }
        }
    }

    private boolean cooledDown(InterruptRule rule, Instant now) {
        Instant last = lastFired.get(rule.id());
        return last == null || Duration.between(last, now).compareTo(rule.cooldown()) >= 0;
    }

    private boolean triggered(InterruptRule rule) {
        try {
            return matcher.match(rule.trigger()).isPresent();
        } catch (RuntimeException e) {
            LOG.warn("Rule {} skipped this tick: {}", rule.id(), e.getMessage());
            publisher.publishEvent(new ScriptErrorEvent(sessionId, rule.targetFlow(), -1,
                    e.getClass().getSimpleName(), e.getMessage(), "skip-rule", false, null));
            return false;
        }
    }

    private boolean transition(SupervisorState from, SupervisorState to) {
        lock.lock();
        try {
            if (state != from) {
                return false;
            }
            state = to;
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void reset(PreemptionRequest request) {
        lock.lock();
        try {
            if (inFlight != null && !inFlight.equals(request)) {
                LOG.warn("Ignoring completion of {} while {} is in flight", request.ruleId(), inFlight.ruleId());
                return;
            }
            inFlight = null;
            state = SupervisorState.IDLE;
        } finally {
            lock.unlock();
        }
    }
}
