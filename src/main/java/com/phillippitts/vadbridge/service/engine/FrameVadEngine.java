package com.phillippitts.vadbridge.service.engine;

import com.phillippitts.vadbridge.domain.VadConfig;
import com.phillippitts.vadbridge.exception.AudioProcessingException;
import com.phillippitts.vadbridge.exception.ConfigurationRejectedException;
import com.phillippitts.vadbridge.exception.EngineExceptionBuilder;
import com.phillippitts.vadbridge.exception.EngineInitializationException;
import com.phillippitts.vadbridge.exception.ErrorCode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Frame-based voice activity detector.
 *
 * <p>Audio fed through {@link #processAudio(float[])} is cut into frames of
 * {@code frameSamples} samples; each frame is scored by a {@link SpeechProbabilityModel} and the
 * resulting probability drives a small state machine:
 * <ol>
 *   <li>Every frame emits {@code FrameProcessed}.</li>
 *   <li>Not speaking and probability &ge; positive threshold: speech starts. The speech buffer is
 *       seeded with the last {@code preSpeechPadFrames} frames (ending with the current one) and
 *       {@code SpeechStart} is emitted.</li>
 *   <li>Speaking: each frame is appended. Probability &ge; positive threshold counts a speech frame
 *       and clears the silence run; {@code RealSpeechStart} fires once when the speech frame count
 *       reaches {@code minSpeechFrames}. Probability &lt; negative threshold extends the silence
 *       run. Probabilities in between change nothing.</li>
 *   <li>When the silence run reaches {@code redemptionFrames} the segment ends: {@code SpeechEnd}
 *       if it had at least {@code minSpeechFrames} speech frames, {@code Misfire} otherwise.</li>
 * </ol>
 *
 * <p>The pre-speech window already ends with the start frame, so a segment holds every frame once.
 * Detectors that append the start frame after the window repeat it; segments here are one frame
 * shorter than theirs.
 *
 * <p>{@code Initialized} is not emitted here: the owner signals it once the engine is attached.
 *
 * <p><b>Thread Safety:</b> lifecycle transitions are synchronized on an internal lock. Audio
 * processing is expected to be serialized by the caller (one session, one producer at a time);
 * {@link #isSpeaking()} may be read from any thread.
 */
public class FrameVadEngine implements VadEngine {

    private static final Logger LOG = LogManager.getLogger(FrameVadEngine.class);

    public static final String ENGINE_NAME = "frame";

    private static final int SAMPLE_RATE_8K = 8_000;
    private static final int SAMPLE_RATE_16K = 16_000;

    private final SpeechProbabilityModelLoader modelLoader;

    /**
     * Guards {@link #initialized} and {@link #closed}.
     */
    private final Object lock = new Object();
    private boolean initialized = false;
    private boolean closed = false;

    private VadConfig config;
    private SpeechProbabilityModel model;
    private DetectionSink sink;

    // Frame assembly
    private float[] pending;
    private int pendingCount;

    // Speech state
    private final Deque<float[]> preSpeechFrames = new ArrayDeque<>();
    private float[] speechBuffer = new float[0];
    private int speechLength;
    private int speechFrameCount;
    private int silenceFrameCount;
    private boolean realStartEmitted;
    private volatile boolean speaking;
    private volatile boolean listening;

    public FrameVadEngine(SpeechProbabilityModelLoader modelLoader) {
        this.modelLoader = Objects.requireNonNull(modelLoader, "modelLoader");
    }

    @Override
    public void initialize(VadConfig config, String modelPath, DetectionSink sink) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(sink, "sink");
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException(ENGINE_NAME + " engine is closed");
            }
            if (initialized) {
                throw new IllegalStateException(ENGINE_NAME + " engine already initialized");
            }
            validate(config);

            long startNanos = System.nanoTime();
            SpeechProbabilityModel loaded;
            try {
                loaded = modelLoader.load(modelPath, config);
            } catch (EngineInitializationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw EngineExceptionBuilder.create("Failed to load speech model")
                        .engine(ENGINE_NAME)
                        .cause(e)
                        .durationMs((System.nanoTime() - startNanos) / 1_000_000)
                        .metadata("modelPath", modelPath)
                        .metadata("sampleRate", config.sampleRate())
                        .build();
            }

            this.config = config;
            this.model = loaded;
            this.sink = sink;
            this.pending = new float[config.frameSamples()];
            resetSpeechState();
            initialized = true;
            LOG.info("VAD engine initialized: engine={}, sampleRate={}, frameSamples={}, thresholds={}/{}",
                    ENGINE_NAME, config.sampleRate(), config.frameSamples(),
                    config.positiveSpeechThreshold(), config.negativeSpeechThreshold());
        }
    }

    /**
     * Checks every constraint and reports all violations at once.
     *
     * @throws ConfigurationRejectedException if any constraint is violated
     */
    static void validate(VadConfig config) {
        List<String> violations = new ArrayList<>();
        checkThreshold("positiveSpeechThreshold", config.positiveSpeechThreshold(), violations);
        checkThreshold("negativeSpeechThreshold", config.negativeSpeechThreshold(), violations);
        if (config.negativeSpeechThreshold() > config.positiveSpeechThreshold()) {
            violations.add("negativeSpeechThreshold must not exceed positiveSpeechThreshold");
        }
        if (config.sampleRate() != SAMPLE_RATE_8K && config.sampleRate() != SAMPLE_RATE_16K) {
            violations.add("sampleRate must be 8000 or 16000, was " + config.sampleRate());
        }
        if (config.frameSamples() <= 0) {
            violations.add("frameSamples must be positive, was " + config.frameSamples());
        }
        checkCount("preSpeechPadFrames", config.preSpeechPadFrames(), violations);
        checkCount("redemptionFrames", config.redemptionFrames(), violations);
        checkCount("minSpeechFrames", config.minSpeechFrames(), violations);
        checkCount("endSpeechPadFrames", config.endSpeechPadFrames(), violations);
        if (!violations.isEmpty()) {
            throw new ConfigurationRejectedException(violations);
        }
    }

    private static void checkThreshold(String name, float value, List<String> violations) {
        if (!(value >= 0f && value <= 1f)) {
            violations.add(name + " must be within [0, 1], was " + value);
        }
    }

    private static void checkCount(String name, int value, List<String> violations) {
        if (value < 0) {
            violations.add(name + " must not be negative, was " + value);
        }
    }

    @Override
    public void start() {
        ensureInitialized();
        listening = true;
        LOG.debug("VAD engine listening");
    }

    @Override
    public void stop() {
        ensureInitialized();
        listening = false;
        if (speaking && speechLength > 0) {
            emitSpeechEnd();
        }
        resetSpeechState();
        pendingCount = 0;
        sink.stopped();
    }

    @Override
    public void processAudio(float[] samples) {
        ensureInitialized();
        if (samples == null) {
            throw new IllegalArgumentException("samples must not be null");
        }
        int frameSamples = config.frameSamples();
        int offset = 0;
        while (offset < samples.length) {
            int n = Math.min(frameSamples - pendingCount, samples.length - offset);
            System.arraycopy(samples, offset, pending, pendingCount, n);
            pendingCount += n;
            offset += n;
            if (pendingCount == frameSamples) {
                float[] frame = Arrays.copyOf(pending, frameSamples);
                pendingCount = 0;
                processFrame(frame);
            }
        }
    }

    private void processFrame(float[] frame) {
        float probability;
        try {
            probability = model.predict(frame);
        } catch (RuntimeException e) {
            String message = "Speech model failed on frame: " + e.getMessage();
            LOG.error("{} (engine={})", message, ENGINE_NAME, e);
            sink.error(message, ErrorCode.PROCESSING_FAILED.code());
            return;
        }

        boolean speech = probability >= config.positiveSpeechThreshold();
        sink.frameProcessed(probability, speech, frame);
        if (config.debug()) {
            LOG.debug("frame: p={}, speech={}, listening={}, speaking={}, speechFrames={}, silenceFrames={}",
                    probability, speech, listening, speaking, speechFrameCount, silenceFrameCount);
        }
        applySpeechLogic(frame, probability);
    }

    private void applySpeechLogic(float[] frame, float probability) {
        int prePad = config.preSpeechPadFrames();
        preSpeechFrames.addLast(frame);
        while (preSpeechFrames.size() > prePad) {
            preSpeechFrames.removeFirst();
        }

        if (!speaking) {
            if (probability >= config.positiveSpeechThreshold()) {
                speaking = true;
                speechFrameCount = 1;
                silenceFrameCount = 0;
                realStartEmitted = false;
                for (float[] padFrame : preSpeechFrames) {
                    appendSpeech(padFrame);
                }
                if (prePad == 0) {
                    appendSpeech(frame);
                }
                sink.speechStart();
                maybeEmitRealStart();
            }
            return;
        }

        appendSpeech(frame);
        if (probability >= config.positiveSpeechThreshold()) {
            speechFrameCount++;
            silenceFrameCount = 0;
            maybeEmitRealStart();
        } else if (probability < config.negativeSpeechThreshold()) {
            silenceFrameCount++;
            if (silenceFrameCount >= config.redemptionFrames()) {
                if (speechFrameCount >= config.minSpeechFrames()) {
                    emitSpeechEnd();
                } else {
                    if (config.debug()) {
                        LOG.debug("misfire: speechFrames={} < minSpeechFrames={}",
                                speechFrameCount, config.minSpeechFrames());
                    }
                    sink.misfire();
                }
                endSegment();
            }
        }
    }

    private void maybeEmitRealStart() {
        if (!realStartEmitted && speechFrameCount >= config.minSpeechFrames()) {
            realStartEmitted = true;
            sink.realSpeechStart();
        }
    }

    @Override
    public void reset() {
        ensureInitialized();
        resetSpeechState();
        pendingCount = 0;
        model.reset();
    }

    @Override
    public void forceEndSpeech() {
        ensureInitialized();
        if (speaking && speechLength > 0 && speechFrameCount >= config.minSpeechFrames()) {
            emitSpeechEnd();
        }
        endSegment();
    }

    @Override
    public boolean isSpeaking() {
        return speaking;
    }

    @Override
    public String getEngineName() {
        return ENGINE_NAME;
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            initialized = false;
            listening = false;
            speaking = false;
            model = null;
            sink = null;
            LOG.debug("VAD engine closed");
        }
    }

    private void emitSpeechEnd() {
        float[] segment = Arrays.copyOf(speechBuffer, speechLength);
        if (config.debug()) {
            LOG.debug("speech end: samples={}, speechFrames={}", segment.length, speechFrameCount);
        }
        sink.speechEnd(segment, config.sampleRate());
    }

    private void appendSpeech(float[] frame) {
        int required = speechLength + frame.length;
        if (required > speechBuffer.length) {
            speechBuffer = Arrays.copyOf(speechBuffer, Math.max(required, speechBuffer.length * 2));
        }
        System.arraycopy(frame, 0, speechBuffer, speechLength, frame.length);
        speechLength = required;
    }

    /**
     * Clears the current segment. The pre-speech window survives so back-to-back segments keep
     * their padding.
     */
    private void endSegment() {
        speaking = false;
        speechFrameCount = 0;
        silenceFrameCount = 0;
        realStartEmitted = false;
        speechLength = 0;
        speechBuffer = new float[0];
    }

    private void resetSpeechState() {
        endSegment();
        preSpeechFrames.clear();
    }

    private void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw new AudioProcessingException(ENGINE_NAME + " engine not initialized or closed");
            }
        }
    }
}
