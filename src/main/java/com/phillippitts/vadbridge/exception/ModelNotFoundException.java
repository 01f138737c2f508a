package com.phillippitts.vadbridge.exception;

/**
 * Thrown when a speech-probability model cannot be found at the requested path.
 * Reported at the boundary as an engine initialization failure.
 */
public class ModelNotFoundException extends EngineInitializationException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath) {
        super("VAD model not found at path: " + modelPath);
        this.modelPath = modelPath;
    }

    public ModelNotFoundException(String modelPath, Throwable cause) {
        super("VAD model not found at path: " + modelPath, cause);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
