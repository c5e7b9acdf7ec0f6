package com.phillippitts.retroauto.service.supervisor;

/**
 * Interrupt supervisor cycle.
 * <pre>
 * IDLE → SCANNING → REQUESTING_PREEMPTION → SUSPENDED → IDLE
 * SCANNING → IDLE (nothing triggered)
 * </pre>
 */
public enum SupervisorState {
    IDLE, SCANNING, REQUESTING_PREEMPTION, SUSPENDED
}
