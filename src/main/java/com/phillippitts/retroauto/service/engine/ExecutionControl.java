package com.phillippitts.retroauto.service.engine;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Stop and pause signals shared between the executor thread and its controllers
 * (hotkeys, REST, supervisor).
 *
 * <p>Stop is terminal for a session. Pause is resumable; the executor honours it at
 * statement boundaries and every blocking wait wakes up early on stop.
 *
 * <p><b>Thread Safety:</b> all methods are thread-safe; flags are guarded by a
 * {@link ReentrantLock} whose condition wakes sleeping and paused executors.
 */
public final class ExecutionControl {

    /** Notified after pause and resume transitions, outside the lock. */
    public interface Listener {
        void onPaused(String reason);

        void onResumed();
    }

    private static final Listener NO_OP = new Listener() {
        @Override
        public void onPaused(String reason) {
        }

        @Override
        public void onResumed() {
        }
    };

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private volatile boolean stopRequested;
    private volatile boolean paused;
    private volatile Listener listener = NO_OP;

    public void setListener(Listener listener) {
        this.listener = listener == null ? NO_OP : listener;
    }

    public void requestStop() {
        lock.lock();
        try {
            stopRequested = true;
            paused = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code false} if already paused or stopping
     */
    public boolean pause(String reason) {
        lock.lock();
        try {
            if (stopRequested || paused) {
                return false;
            }
            paused = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        listener.onPaused(reason);
        return true;
    }

    /**
     * @return {@code false} if not paused
     */
    public boolean resume() {
        lock.lock();
        try {
            if (!paused) {
                return false;
            }
            paused = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        listener.onResumed();
        return true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public boolean isPaused() {
        return paused;
    }

    /**
     * Blocks while paused. Returns immediately once stop is requested. Thread interruption
     * is treated as a stop request.
     */
    public void awaitIfPaused() {
        lock.lock();
        try {
            while (paused && !stopRequested) {
                changed.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sleeps for {@code duration} unless stop is requested first.
     *
     * @return {@code true} if the full duration elapsed, {@code false} if cut short by stop
     */
    public boolean sleep(Duration duration) {
        long remaining = duration.toNanos();
        lock.lock();
        try {
            while (!stopRequested && remaining > 0) {
                remaining = changed.awaitNanos(remaining);
            }
            return !stopRequested;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
            return false;
        } finally {
            lock.unlock();
        }
    }
}
