package com.phillippitts.vadbridge.exception;

/**
 * Thrown when the calling thread cannot be attached to the host runtime, or the runtime
 * has not been bootstrapped or has already shut down.
 */
public class HostUnavailableException extends VadBridgeException {

    public HostUnavailableException(String message) {
        super(ErrorCode.HOST_UNAVAILABLE, message);
    }

    public HostUnavailableException(String message, Throwable cause) {
        super(ErrorCode.HOST_UNAVAILABLE, message, cause);
    }
}
