package com.phillippitts.vadbridge.domain;

/**
 * Detection thresholds and framing parameters handed to {@code init}.
 *
 * <p>The bridge only transports this record; the engine decides whether to accept it.
 *
 * @param positiveSpeechThreshold probability at or above which a frame counts as speech
 * @param negativeSpeechThreshold probability below which a frame counts as silence
 * @param preSpeechPadFrames frames kept before speech start and prepended to the segment
 * @param redemptionFrames consecutive silent frames that end a speech segment
 * @param minSpeechFrames speech frames required for a segment to count as real speech
 * @param sampleRate audio sample rate in Hz (16000 or 8000)
 * @param frameSamples samples per frame (512 at 16 kHz, 256 at 8 kHz)
 * @param endSpeechPadFrames frames of padding after speech end
 * @param debug enables frame-level debug logging in the engine
 */
public record VadConfig(
        float positiveSpeechThreshold,
        float negativeSpeechThreshold,
        int preSpeechPadFrames,
        int redemptionFrames,
        int minSpeechFrames,
        int sampleRate,
        int frameSamples,
        int endSpeechPadFrames,
        boolean debug
) {

    public static final float DEFAULT_POSITIVE_SPEECH_THRESHOLD = 0.5f;
    public static final float DEFAULT_NEGATIVE_SPEECH_THRESHOLD = 0.35f;
    public static final int DEFAULT_PRE_SPEECH_PAD_FRAMES = 3;
    public static final int DEFAULT_REDEMPTION_FRAMES = 24;
    public static final int DEFAULT_MIN_SPEECH_FRAMES = 9;
    public static final int DEFAULT_SAMPLE_RATE = 16_000;
    public static final int DEFAULT_FRAME_SAMPLES = 512;
    public static final int DEFAULT_END_SPEECH_PAD_FRAMES = 3;

    /**
     * Returns the default configuration for the v6 Silero-style model at 16 kHz.
     */
    public static VadConfig defaults() {
        return new VadConfig(
                DEFAULT_POSITIVE_SPEECH_THRESHOLD,
                DEFAULT_NEGATIVE_SPEECH_THRESHOLD,
                DEFAULT_PRE_SPEECH_PAD_FRAMES,
                DEFAULT_REDEMPTION_FRAMES,
                DEFAULT_MIN_SPEECH_FRAMES,
                DEFAULT_SAMPLE_RATE,
                DEFAULT_FRAME_SAMPLES,
                DEFAULT_END_SPEECH_PAD_FRAMES,
                false);
    }

    public VadConfig withDebug(boolean debug) {
        return new VadConfig(positiveSpeechThreshold, negativeSpeechThreshold, preSpeechPadFrames,
                redemptionFrames, minSpeechFrames, sampleRate, frameSamples, endSpeechPadFrames, debug);
    }

    public VadConfig withFrameSamples(int frameSamples) {
        return new VadConfig(positiveSpeechThreshold, negativeSpeechThreshold, preSpeechPadFrames,
                redemptionFrames, minSpeechFrames, sampleRate, frameSamples, endSpeechPadFrames, debug);
    }

    public VadConfig withFrameCounts(int preSpeechPadFrames, int redemptionFrames, int minSpeechFrames) {
        return new VadConfig(positiveSpeechThreshold, negativeSpeechThreshold, preSpeechPadFrames,
                redemptionFrames, minSpeechFrames, sampleRate, frameSamples, endSpeechPadFrames, debug);
    }
}
