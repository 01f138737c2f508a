package com.phillippitts.vadbridge.exception;

/**
 * Thrown when a new session cannot be allocated: the registry is at capacity or
 * has run out of identifiers.
 */
public class AllocationFailedException extends VadBridgeException {

    public AllocationFailedException(String message) {
        super(ErrorCode.ALLOCATION_FAILED, message);
    }
}
