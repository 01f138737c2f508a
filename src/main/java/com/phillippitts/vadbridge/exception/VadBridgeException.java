package com.phillippitts.vadbridge.exception;

import java.util.Objects;

/**
 * Base exception for all vad-bridge specific errors.
 * Every subclass carries the {@link ErrorCode} the boundary reports for it, so a single
 * catch block can turn any failure into a return code.
 */
public class VadBridgeException extends RuntimeException {

    private final ErrorCode errorCode;

    public VadBridgeException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }

    public VadBridgeException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
