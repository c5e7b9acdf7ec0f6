package com.phillippitts.retroauto.service.input;

import com.phillippitts.retroauto.domain.ActionKind;
import com.phillippitts.retroauto.domain.ResolvedArgs;
import com.phillippitts.retroauto.exception.ActionFailedException;

/**
 * Performs primitive input operations with already-resolved arguments. No decision logic:
 * coordinates come from the script or from a prior match.
 *
 * <p>Only {@link ActionKind.Category#INPUT} kinds are accepted.
 */
public interface ActionExecutor {

    /**
     * @throws ActionFailedException if the operation could not be performed
     */
    void perform(ActionKind kind, ResolvedArgs args);

    /** Whether input can currently be simulated (e.g. false when headless). */
    boolean isAvailable();
}
