package com.phillippitts.vadbridge.exception;

import com.phillippitts.vadbridge.domain.SessionState;

/**
 * Thrown when an operation is not legal in the session's current state,
 * e.g. {@code start} before {@code init}, or a second {@code init}.
 */
public class SessionStateException extends VadBridgeException {

    private final SessionState state;

    private SessionStateException(ErrorCode errorCode, String message, SessionState state) {
        super(errorCode, message);
        this.state = state;
    }

    public static SessionStateException notInitialized(SessionState state) {
        return new SessionStateException(ErrorCode.NOT_INITIALIZED, "VAD not initialized", state);
    }

    public static SessionStateException alreadyInitialized(SessionState state) {
        return new SessionStateException(ErrorCode.ALREADY_INITIALIZED,
                "VAD already initialized (state: " + state + ")", state);
    }

    public SessionState getState() {
        return state;
    }
}
