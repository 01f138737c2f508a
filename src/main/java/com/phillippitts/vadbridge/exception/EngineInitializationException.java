package com.phillippitts.vadbridge.exception;

/**
 * Thrown when a detection engine fails to initialize.
 * This may occur because the model cannot be loaded or the engine itself faults.
 */
public class EngineInitializationException extends VadBridgeException {

    private final String engineName;

    public EngineInitializationException(String message) {
        super(ErrorCode.ENGINE_INITIALIZATION_FAILED, message);
        this.engineName = "unknown";
    }

    public EngineInitializationException(String message, String engineName) {
        super(ErrorCode.ENGINE_INITIALIZATION_FAILED, message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public EngineInitializationException(String message, Throwable cause) {
        super(ErrorCode.ENGINE_INITIALIZATION_FAILED, message, cause);
        this.engineName = "unknown";
    }

    public EngineInitializationException(String message, String engineName, Throwable cause) {
        super(ErrorCode.ENGINE_INITIALIZATION_FAILED, message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
