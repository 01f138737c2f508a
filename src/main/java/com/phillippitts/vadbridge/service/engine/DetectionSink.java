package com.phillippitts.vadbridge.service.engine;

/**
 * Receiver of raw detection signals emitted by a {@link VadEngine}.
 *
 * <p>Signals carry plain engine data. The dispatch layer turns each one into a boundary event,
 * allocating transferred payloads or lending the frame as needed. All methods are called on the
 * engine's producing thread and must not block for long.
 */
public interface DetectionSink {

    /**
     * Sent by the session owner, not the engine, once {@code init} has taken effect.
     */
    void initialized();

    void speechStart();

    void realSpeechStart();

    void misfire();

    void stopped();

    /**
     * @param probability speech probability of the frame
     * @param speech whether the probability reached the positive threshold
     * @param frame frame samples, lent for the duration of this call only
     */
    void frameProcessed(float probability, boolean speech, float[] frame);

    /**
     * @param samples the speech segment as float samples; the sink copies what it keeps
     * @param sampleRate sample rate of the segment, for the duration calculation
     */
    void speechEnd(float[] samples, int sampleRate);

    void error(String message, int code);
}
