package com.phillippitts.retroauto.exception;

import com.phillippitts.retroauto.domain.ActionKind;

/**
 * Thrown when a primitive action cannot be performed (input device unavailable,
 * missing coordinates, bad argument at runtime).
 */
public class ActionFailedException extends RetroAutoException {

    private final ActionKind actionKind;

    public ActionFailedException(ActionKind actionKind, String message) {
        super(actionKind.keyword() + ": " + message);
        this.actionKind = actionKind;
    }

    public ActionFailedException(ActionKind actionKind, String message, Throwable cause) {
        super(actionKind.keyword() + ": " + message, cause);
        this.actionKind = actionKind;
    }

    public ActionKind getActionKind() {
        return actionKind;
    }
}
