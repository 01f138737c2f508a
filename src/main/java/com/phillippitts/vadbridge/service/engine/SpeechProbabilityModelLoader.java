package com.phillippitts.vadbridge.service.engine;

import com.phillippitts.vadbridge.domain.VadConfig;

/**
 * Loads a {@link SpeechProbabilityModel} for an engine being initialized.
 */
@FunctionalInterface
public interface SpeechProbabilityModelLoader {

    /**
     * @param modelPath model location, or null/blank for the built-in model
     * @param config the validated detector configuration
     * @return a ready model
     * @throws com.phillippitts.vadbridge.exception.ModelNotFoundException if {@code modelPath} does not exist
     * @throws com.phillippitts.vadbridge.exception.EngineInitializationException if loading fails otherwise
     */
    SpeechProbabilityModel load(String modelPath, VadConfig config);
}
