package com.phillippitts.retroauto.service.engine;

/**
 * Session lifecycle state.
 * <pre>
 * IDLE → RUNNING ⇄ PAUSED
 * RUNNING | PAUSED → STOPPING → IDLE
 * </pre>
 */
public enum EngineState {
    IDLE, RUNNING, PAUSED, STOPPING
}
