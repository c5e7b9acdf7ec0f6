package com.phillippitts.retroauto.service.engine;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-entry hand-off between the supervisor (writer) and the executor (consumer).
 * This is the only state the two activities share besides the control flags.
 */
public final class PreemptionSlot {

    private final AtomicReference<PreemptionRequest> pending = new AtomicReference<>();

    /**
     * @return {@code false} if a request is already pending
     */
    public boolean offer(PreemptionRequest request) {
        return pending.compareAndSet(null, request);
    }

    /** Takes the pending request, or returns {@code null}. */
    public PreemptionRequest poll() {
        return pending.getAndSet(null);
    }

    public Optional<PreemptionRequest> peek() {
        return Optional.ofNullable(pending.get());
    }

    public boolean isPending() {
        return pending.get() != null;
    }
}
