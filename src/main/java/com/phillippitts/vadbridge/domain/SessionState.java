package com.phillippitts.vadbridge.domain;

/**
 * Lifecycle states of a VAD session.
 *
 * <pre>
 * CREATED → INITIALIZED → LISTENING ⇄ STOPPED
 *    any state → DESTROYED (terminal)
 * </pre>
 */
public enum SessionState {
    CREATED,
    INITIALIZED,
    LISTENING,
    STOPPED,
    DESTROYED;

    /**
     * Returns whether an engine is attached, i.e. {@code init} has succeeded.
     */
    public boolean hasEngine() {
        return this == INITIALIZED || this == LISTENING || this == STOPPED;
    }
}
