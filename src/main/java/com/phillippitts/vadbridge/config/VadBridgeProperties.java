package com.phillippitts.vadbridge.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the VAD bridge ({@code vad.bridge.*}).
 *
 * <p>Note: Bean created via {@link com.phillippitts.vadbridge.VadBridgeApplication}'s
 * {@code @EnableConfigurationProperties}.
 */
@ConfigurationProperties(prefix = "vad.bridge")
@Validated
public class VadBridgeProperties {

    /** When false the bridge reports PLATFORM_UNSUPPORTED for every engine operation. */
    private boolean enabled = true;

    /** Maximum number of concurrently open sessions. */
    @Positive(message = "Maximum sessions must be positive")
    private int maxSessions = 64;

    /** Model used when init is called without a model path; unset means the built-in estimator. */
    private String defaultModelPath;

    /**
     * RMS amplitude (0-1) at which the built-in energy estimator reports probability 0.5.
     * Default 0.0244 is roughly 800 on the 16-bit PCM scale.
     */
    @DecimalMin(value = "0.0", inclusive = false, message = "Energy threshold must be positive")
    @DecimalMax(value = "1.0", message = "Energy threshold must not exceed 1.0")
    private float energyThreshold = 0.0244f;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    public void setMaxSessions(int maxSessions) {
        this.maxSessions = maxSessions;
    }

    public String getDefaultModelPath() {
        return defaultModelPath;
    }

    public void setDefaultModelPath(String defaultModelPath) {
        this.defaultModelPath = defaultModelPath;
    }

    public float getEnergyThreshold() {
        return energyThreshold;
    }

    public void setEnergyThreshold(float energyThreshold) {
        this.energyThreshold = energyThreshold;
    }
}
