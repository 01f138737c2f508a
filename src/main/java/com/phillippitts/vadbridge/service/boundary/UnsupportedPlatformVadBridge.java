package com.phillippitts.vadbridge.service.boundary;

import com.phillippitts.vadbridge.domain.VadConfig;
import com.phillippitts.vadbridge.exception.ErrorCode;
import com.phillippitts.vadbridge.service.event.VadEventCallback;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link VadBridge} for deployments without a detection engine ({@code vad.bridge.enabled=false}).
 *
 * <p>{@link #create()} hands out a fixed non-null handle so callers reach the point where the
 * failure is reported; every operation needing an engine returns
 * {@link ErrorCode#PLATFORM_UNSUPPORTED}. The codec utilities still work.
 */
public class UnsupportedPlatformVadBridge implements VadBridge {

    private static final Logger LOG = LogManager.getLogger(UnsupportedPlatformVadBridge.class);

    public static final long PLACEHOLDER_HANDLE = 1L;
    public static final String UNSUPPORTED_ERROR = "VAD not supported on this platform";

    public UnsupportedPlatformVadBridge() {
        LOG.info("VAD bridge disabled; all engine operations report PLATFORM_UNSUPPORTED");
    }

    @Override
    public long create() {
        return PLACEHOLDER_HANDLE;
    }

    @Override
    public void destroy(long handle) {
    }

    @Override
    public int init(long handle, VadConfig config, String modelPath) {
        return ErrorCode.PLATFORM_UNSUPPORTED.code();
    }

    @Override
    public void setCallback(long handle, VadEventCallback callback, Object userData) {
    }

    @Override
    public void invalidateCallback(long handle) {
    }

    @Override
    public int start(long handle) {
        return ErrorCode.PLATFORM_UNSUPPORTED.code();
    }

    @Override
    public void stop(long handle) {
    }

    @Override
    public int processAudio(long handle, float[] samples) {
        return ErrorCode.PLATFORM_UNSUPPORTED.code();
    }

    @Override
    public void reset(long handle) {
    }

    @Override
    public void forceEndSpeech(long handle) {
    }

    @Override
    public boolean isSpeaking(long handle) {
        return false;
    }

    @Override
    public String getLastError(long handle) {
        return UNSUPPORTED_ERROR;
    }
}
