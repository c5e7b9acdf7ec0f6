package com.phillippitts.retroauto.service.session;

import com.phillippitts.retroauto.service.engine.EngineState;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe lifecycle of the single script session.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → RUNNING (via begin)
 * RUNNING ⇄ PAUSED (via pause / resume)
 * RUNNING | PAUSED → STOPPING (via stopping)
 * any → IDLE (via finish, when the executor thread returns)
 * </pre>
 *
 * <p>Every transition names the session it applies to; calls for a session that is no longer
 * active return {@code null} and change nothing.
 *
 * <p><b>Thread Safety:</b> all public methods use a {@link ReentrantLock}.
 */
public final class EngineStateMachine {

    private static final Set<EngineState> STOPPABLE = EnumSet.of(EngineState.RUNNING, EngineState.PAUSED);

    private final Lock lock = new ReentrantLock();
    private EngineState state = EngineState.IDLE;
    private String activeSession;

    /**
     * @return {@code true} if the session became active, {@code false} if another one is
     */
    public boolean begin(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId cannot be null");
        lock.lock();
        try {
            if (state != EngineState.IDLE) {
                return false;
            }
            activeSession = sessionId;
            state = EngineState.RUNNING;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** @return the previous state, or {@code null} if the transition does not apply */
    public EngineState pause(String sessionId) {
        return move(sessionId, EnumSet.of(EngineState.RUNNING), EngineState.PAUSED);
    }

    /** @return the previous state, or {@code null} if the transition does not apply */
    public EngineState resume(String sessionId) {
        return move(sessionId, EnumSet.of(EngineState.PAUSED), EngineState.RUNNING);
    }

    /** @return the previous state, or {@code null} if the transition does not apply */
    public EngineState stopping(String sessionId) {
        return move(sessionId, STOPPABLE, EngineState.STOPPING);
    }

    /** @return the previous state, or {@code null} if {@code sessionId} is not active */
    public EngineState finish(String sessionId) {
        lock.lock();
        try {
            if (activeSession == null || !activeSession.equals(sessionId)) {
                return null;
            }
            EngineState previous = state;
            state = EngineState.IDLE;
            activeSession = null;
            return previous;
        } finally {
            lock.unlock();
        }
    }

    public EngineState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /** @return the active session id, or {@code null} when idle */
    public String activeSession() {
        lock.lock();
        try {
            return activeSession;
        } finally {
            lock.unlock();
        }
    }

    private EngineState move(String sessionId, Set<EngineState> from, EngineState to) {
        lock.lock();
        try {
            if (activeSession == null || !activeSession.equals(sessionId) || !from.contains(state)) {
                return null;
            }
            EngineState previous = state;
            state = to;
            return previous;
        } finally {
            lock.unlock();
        }
    }
}
