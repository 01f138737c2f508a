package com.phillippitts.vadbridge.service.engine;

/**
 * Opaque speech-probability model: maps one frame of audio to a probability of speech.
 *
 * <p>Implementations may keep recurrent state between frames; {@link #reset()} clears it.
 */
public interface SpeechProbabilityModel {

    /**
     * @param frame exactly {@code frameSamples} float samples
     * @return probability of speech in [0.0, 1.0]
     */
    float predict(float[] frame);

    default void reset() {
    }
}
