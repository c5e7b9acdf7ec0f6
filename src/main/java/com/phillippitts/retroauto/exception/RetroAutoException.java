package com.phillippitts.retroauto.exception;

/**
 * Base exception for all RetroAuto engine errors.
 * All domain exceptions extend this class so the step loop and the REST boundary
 * can handle them uniformly.
 */
public class RetroAutoException extends RuntimeException {

    public RetroAutoException(String message) {
        super(message);
    }

    public RetroAutoException(String message, Throwable cause) {
        super(message, cause);
    }

    public RetroAutoException(Throwable cause) {
        super(cause);
    }
}
