package com.phillippitts.vadbridge.service.event;

import java.util.Objects;

/**
 * One detection event delivered to a session's callback.
 *
 * <p>Events are never persisted. Payload-free kinds are shared singletons. Payload accessors
 * ({@link #frame()}, {@link #speechEnd()}, {@link #error()}) fail with
 * {@link IllegalStateException} when called on the wrong kind.
 *
 * <p>Ownership of payloads follows the payload type: {@link BorrowedFrame} is only valid during
 * the callback, {@link TransferredBuffer} must be released by the receiver.
 */
public final class VadEvent {

    private static final VadEvent INITIALIZED = new VadEvent(VadEventType.INITIALIZED, null);
    private static final VadEvent SPEECH_START = new VadEvent(VadEventType.SPEECH_START, null);
    private static final VadEvent REAL_SPEECH_START = new VadEvent(VadEventType.REAL_SPEECH_START, null);
    private static final VadEvent MISFIRE = new VadEvent(VadEventType.MISFIRE, null);
    private static final VadEvent STOPPED = new VadEvent(VadEventType.STOPPED, null);

    private final VadEventType type;
    private final Object payload;

    private VadEvent(VadEventType type, Object payload) {
        this.type = type;
        this.payload = payload;
    }

    public static VadEvent initialized() {
        return INITIALIZED;
    }

    public static VadEvent speechStart() {
        return SPEECH_START;
    }

    public static VadEvent realSpeechStart() {
        return REAL_SPEECH_START;
    }

    public static VadEvent misfire() {
        return MISFIRE;
    }

    public static VadEvent stopped() {
        return STOPPED;
    }

    public static VadEvent frameProcessed(float probability, boolean speech, BorrowedFrame frame) {
        Objects.requireNonNull(frame, "frame");
        return new VadEvent(VadEventType.FRAME_PROCESSED, new FrameData(probability, speech, frame));
    }

    public static VadEvent speechEnd(TransferredPcm16 audio, int durationMs) {
        Objects.requireNonNull(audio, "audio");
        return new VadEvent(VadEventType.SPEECH_END, new SpeechEndData(audio, durationMs));
    }

    public static VadEvent error(TransferredMessage message, int code) {
        Objects.requireNonNull(message, "message");
        return new VadEvent(VadEventType.ERROR, new ErrorData(message, code));
    }

    public VadEventType type() {
        return type;
    }

    public FrameData frame() {
        return payload(VadEventType.FRAME_PROCESSED, FrameData.class);
    }

    public SpeechEndData speechEnd() {
        return payload(VadEventType.SPEECH_END, SpeechEndData.class);
    }

    public ErrorData error() {
        return payload(VadEventType.ERROR, ErrorData.class);
    }

    /**
     * Returns the transferred payload of a {@code SpeechEnd} or {@code Error} event, or null.
     */
    public TransferredBuffer transferredPayload() {
        if (payload instanceof SpeechEndData data) {
            return data.audio();
        }
        if (payload instanceof ErrorData data) {
            return data.message();
        }
        return null;
    }

    /**
     * Returns the borrowed frame of a {@code FrameProcessed} event, or null.
     */
    public BorrowedFrame borrowedPayload() {
        return payload instanceof FrameData data ? data.frame() : null;
    }

    private <T> T payload(VadEventType expected, Class<T> payloadType) {
        if (type != expected) {
            throw new IllegalStateException("Event " + type + " has no " + expected + " payload");
        }
        return payloadType.cast(payload);
    }

    @Override
    public String toString() {
        return "VadEvent{" + type + '}';
    }
}
