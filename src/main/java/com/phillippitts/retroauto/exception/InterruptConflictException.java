package com.phillippitts.retroauto.exception;

/**
 * Signals that interrupt arbitration produced an inconsistent outcome, such as a second
 * preemption request while one is still being serviced. Arbitration is built so that
 * this never happens; tests assert it stays unreachable.
 */
public class InterruptConflictException extends RetroAutoException {

    public InterruptConflictException(String message) {
        super(message);
    }
}
