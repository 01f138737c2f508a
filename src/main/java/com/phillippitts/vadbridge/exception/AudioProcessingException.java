package com.phillippitts.vadbridge.exception;

/**
 * Thrown when the engine fails while processing audio or changing its listening state.
 */
public class AudioProcessingException extends VadBridgeException {

    public AudioProcessingException(String message) {
        super(ErrorCode.PROCESSING_FAILED, message);
    }

    public AudioProcessingException(String message, Throwable cause) {
        super(ErrorCode.PROCESSING_FAILED, message, cause);
    }
}
