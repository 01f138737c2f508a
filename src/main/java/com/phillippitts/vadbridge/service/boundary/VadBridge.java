package com.phillippitts.vadbridge.service.boundary;

import com.phillippitts.vadbridge.domain.VadConfig;
import com.phillippitts.vadbridge.service.audio.AudioCodec;
import com.phillippitts.vadbridge.service.event.VadEventCallback;

/**
 * Flat operation surface through which a host drives VAD sessions.
 *
 * <p>Sessions are referred to by opaque {@code long} handles; {@link #NULL_HANDLE} never refers to
 * a session. No method throws: failures come back as negative codes from
 * {@link com.phillippitts.vadbridge.exception.ErrorCode}, as {@code false}, or as a no-op, and the
 * human-readable cause is available from {@link #getLastError(long)}.
 *
 * <p>All methods are synchronous on the calling thread. Detection events are delivered to the
 * registered {@link VadEventCallback} on the thread that produced them, typically the one inside
 * {@link #processAudio(long, float[])}.
 *
 * <p>Session lifecycle:
 * <pre>
 * create → CREATED --init--> INITIALIZED --start--> LISTENING ⇄ STOPPED
 * destroy: any state → DESTROYED (handle no longer resolves)
 * </pre>
 */
public interface VadBridge {

    long NULL_HANDLE = 0L;

    /**
     * {@link #getLastError(long)} result for {@link #NULL_HANDLE}.
     */
    String INVALID_HANDLE_ERROR = "Invalid handle";

    /**
     * {@link #getLastError(long)} result for unknown or destroyed handles.
     */
    String HANDLE_NOT_FOUND_ERROR = "Handle not found";

    static VadConfig configDefault() {
        return VadConfig.defaults();
    }

    /**
     * @return a new session handle, or {@link #NULL_HANDLE} if no session could be allocated
     */
    long create();

    /**
     * Destroys the session. Idempotent; unknown handles are ignored. In-flight deliveries for the
     * session finish safely, later ones are dropped.
     */
    void destroy(long handle);

    /**
     * Initializes the session's engine. Legal only once, from {@code CREATED}.
     *
     * @param modelPath model location, or null for the configured default
     * @return 0, or a negative error code; on failure the state is unchanged
     */
    int init(long handle, VadConfig config, String modelPath);

    default int init(long handle, VadConfig config) {
        return init(handle, config, null);
    }

    /**
     * Registers the callback and user data for later deliveries. A null callback clears the registration.
     */
    void setCallback(long handle, VadEventCallback callback, Object userData);

    /**
     * Clears the registration. Deliveries starting afterwards are dropped; one already past its
     * callback read may still complete.
     */
    void invalidateCallback(long handle);

    /**
     * @return 0 (also when already listening), or a negative error code
     */
    int start(long handle);

    void stop(long handle);

    /**
     * Feeds samples to the session's detector; events are delivered before this returns.
     *
     * @param samples mono float samples, not null or empty
     * @return 0, or a negative error code
     */
    int processAudio(long handle, float[] samples);

    void reset(long handle);

    void forceEndSpeech(long handle);

    boolean isSpeaking(long handle);

    /**
     * @return the last failure recorded for the session, {@code ""} if none, or a fixed sentinel
     *         for null and unknown handles; never null
     */
    String getLastError(long handle);

    /**
     * Converts {@code min(in.length, out.length)} samples. Null buffers are ignored.
     */
    default void floatToPcm16(float[] in, short[] out) {
        if (in == null || out == null) {
            return;
        }
        AudioCodec.floatToPcm16(in, 0, out, 0, Math.min(in.length, out.length));
    }

    /**
     * Converts {@code min(in.length, out.length)} samples. Null buffers are ignored.
     */
    default void pcm16ToFloat(short[] in, float[] out) {
        if (in == null || out == null) {
            return;
        }
        AudioCodec.pcm16ToFloat(in, 0, out, 0, Math.min(in.length, out.length));
    }
}
