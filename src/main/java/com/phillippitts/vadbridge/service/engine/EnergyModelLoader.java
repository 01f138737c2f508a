package com.phillippitts.vadbridge.service.engine;

import com.phillippitts.vadbridge.domain.VadConfig;
import com.phillippitts.vadbridge.exception.EngineExceptionBuilder;
import com.phillippitts.vadbridge.exception.ModelNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Model loader backed by {@link EnergySpeechProbabilityModel}.
 *
 * <p>A model path, when given, must point at a readable regular file; its contents are not parsed
 * (model formats are handled by inference back ends, which plug in through
 * {@link SpeechProbabilityModelLoader}). Without a path the energy estimator is used directly.
 */
public class EnergyModelLoader implements SpeechProbabilityModelLoader {

    private static final Logger LOG = LogManager.getLogger(EnergyModelLoader.class);

    private final float energyThreshold;

    public EnergyModelLoader(float energyThreshold) {
        this.energyThreshold = energyThreshold;
    }

    @Override
    public SpeechProbabilityModel load(String modelPath, VadConfig config) {
        if (modelPath != null && !modelPath.isBlank()) {
            validateModelFile(modelPath, config);
            LOG.info("Model file present at '{}'; using energy estimator (threshold={})",
                    modelPath, energyThreshold);
        } else {
            LOG.debug("No model path given; using energy estimator (threshold={})", energyThreshold);
        }
        return new EnergySpeechProbabilityModel(energyThreshold);
    }

    private static void validateModelFile(String modelPath, VadConfig config) {
        Path path;
        try {
            path = Paths.get(modelPath);
        } catch (InvalidPathException e) {
            throw EngineExceptionBuilder.create("Invalid VAD model path")
                    .engine(FrameVadEngine.ENGINE_NAME)
                    .cause(e)
                    .metadata("modelPath", modelPath)
                    .build();
        }
        if (!Files.exists(path)) {
            throw new ModelNotFoundException(modelPath);
        }
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw EngineExceptionBuilder.create("VAD model is not a readable file")
                    .engine(FrameVadEngine.ENGINE_NAME)
                    .metadata("modelPath", modelPath)
                    .metadata("sampleRate", config.sampleRate())
                    .build();
        }
    }
}
