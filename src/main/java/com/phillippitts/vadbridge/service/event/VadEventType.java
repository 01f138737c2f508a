package com.phillippitts.vadbridge.service.event;

/**
 * Kinds of detection events, with the stable numeric codes used across the boundary.
 */
public enum VadEventType {
    INITIALIZED(0),
    SPEECH_START(1),
    SPEECH_END(2),
    FRAME_PROCESSED(3),
    REAL_SPEECH_START(4),
    MISFIRE(5),
    ERROR(6),
    STOPPED(7);

    private final int code;

    VadEventType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Metric/log tag form, e.g. {@code speech_end}.
     */
    public String tag() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
