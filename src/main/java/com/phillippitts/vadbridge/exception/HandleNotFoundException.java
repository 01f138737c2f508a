package com.phillippitts.vadbridge.exception;

/**
 * Thrown when a handle is null, was never issued, or belongs to a destroyed session.
 */
public class HandleNotFoundException extends VadBridgeException {

    private final long handle;

    public HandleNotFoundException(long handle) {
        super(ErrorCode.HANDLE_NOT_FOUND, "Handle not found: " + handle);
        this.handle = handle;
    }

    public long getHandle() {
        return handle;
    }
}
