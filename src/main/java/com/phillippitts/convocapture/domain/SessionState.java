package com.phillippitts.convocapture.domain;

/**
 * Lifecycle states of a conversation session.
 *
 * <pre>
 * CREATED → STARTING → RUNNING → STOPPING → STOPPED
 *              ↓          ↓
 *            FAILED     FAILED
 * </pre>
 *
 * <p>{@link #STOPPED} and {@link #FAILED} are terminal.
 */
public enum SessionState {
    CREATED,
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED,
    FAILED;

    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }
}
