package com.phillippitts.vadbridge.service.engine;

/**
 * Speech probability estimated from frame energy.
 *
 * <p>Computes the RMS (Root Mean Square) amplitude of the frame and maps it linearly so that the
 * configured energy threshold yields probability 0.5, saturating at 1.0 for twice the threshold.
 * No inference engine is involved; this keeps the detector usable when no model is installed.
 *
 * <p>Stateless and thread-safe.
 */
public final class EnergySpeechProbabilityModel implements SpeechProbabilityModel {

    /**
     * Default RMS threshold for float samples, equivalent to 800 on the 16-bit PCM scale.
     */
    public static final float DEFAULT_ENERGY_THRESHOLD = 800f / 32768f;

    private final float energyThreshold;

    public EnergySpeechProbabilityModel() {
        this(DEFAULT_ENERGY_THRESHOLD);
    }

    /**
     * @param energyThreshold RMS amplitude (0.0 - 1.0) treated as the speech/silence midpoint
     */
    public EnergySpeechProbabilityModel(float energyThreshold) {
        if (!(energyThreshold > 0f) || energyThreshold > 1f) {
            throw new IllegalArgumentException("energyThreshold must be in (0, 1]: " + energyThreshold);
        }
        this.energyThreshold = energyThreshold;
    }

    @Override
    public float predict(float[] frame) {
        double rms = calculateRms(frame);
        double probability = rms / (2.0 * energyThreshold);
        return (float) Math.min(1.0, probability);
    }

    public float getEnergyThreshold() {
        return energyThreshold;
    }

    static double calculateRms(float[] frame) {
        if (frame == null || frame.length == 0) {
            return 0;
        }
        double sumSquares = 0;
        for (float sample : frame) {
            sumSquares += (double) sample * sample;
        }
        return Math.sqrt(sumSquares / frame.length);
    }
}
