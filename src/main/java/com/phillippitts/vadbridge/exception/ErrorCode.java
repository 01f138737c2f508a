package com.phillippitts.vadbridge.exception;

/**
 * Numeric result codes returned across the boundary.
 *
 * <p>Zero means success; every failure is negative. {@link #PLATFORM_UNSUPPORTED} ({@code -100})
 * is reserved for builds without a detection engine. {@link #PROCESSING_FAILED} doubles as the
 * code carried by {@code Error} events raised while processing audio.
 */
public enum ErrorCode {

    OK(0),
    HANDLE_NOT_FOUND(-1),
    NOT_INITIALIZED(-2),
    ENGINE_INITIALIZATION_FAILED(-3),
    CONFIGURATION_REJECTED(-4),
    ALREADY_INITIALIZED(-5),
    INVALID_ARGUMENT(-6),
    HOST_UNAVAILABLE(-7),
    ALLOCATION_FAILED(-8),
    PROCESSING_FAILED(-10),
    PLATFORM_UNSUPPORTED(-100);

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
