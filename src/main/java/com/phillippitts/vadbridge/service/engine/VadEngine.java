package com.phillippitts.vadbridge.service.engine;

import com.phillippitts.vadbridge.domain.VadConfig;

/**
 * A voice activity detector driven through a session.
 *
 * <p>Calls on one engine are serialized by the owning session; {@link #isSpeaking()} is the only
 * method that may be called concurrently with the others.
 *
 * <p><b>Lifecycle:</b> {@link #initialize} once, then any mix of {@link #start}, {@link #stop},
 * {@link #processAudio}, {@link #reset} and {@link #forceEndSpeech}; finally {@link #close()}.
 * {@link #close()} is idempotent.
 */
public interface VadEngine extends AutoCloseable {

    /**
     * Validates the configuration and loads the model. Emits nothing: {@code Initialized} is
     * signalled by the owner after the engine has been attached to its session.
     *
     * @param config detector configuration
     * @param modelPath model location, or null for the default model
     * @param sink receiver of all later detection signals
     * @throws com.phillippitts.vadbridge.exception.ConfigurationRejectedException if the config is invalid
     * @throws com.phillippitts.vadbridge.exception.EngineInitializationException if the model cannot be loaded
     */
    void initialize(VadConfig config, String modelPath, DetectionSink sink);

    void start();

    /**
     * Resets detection state and emits {@code Stopped}.
     */
    void stop();

    /**
     * Feeds samples to the detector. Events are emitted synchronously on the calling thread.
     *
     * @param samples mono float samples in [-1.0, 1.0]
     */
    void processAudio(float[] samples);

    void reset();

    /**
     * Ends an ongoing speech segment immediately, emitting {@code SpeechEnd} if it was long enough.
     */
    void forceEndSpeech();

    boolean isSpeaking();

    String getEngineName();

    @Override
    void close();
}
