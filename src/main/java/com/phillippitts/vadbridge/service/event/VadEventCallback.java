package com.phillippitts.vadbridge.service.event;

/**
 * Caller-supplied receiver of detection events.
 *
 * <p>Invoked synchronously on the thread that produced the event (usually the thread calling
 * {@code processAudio}). Implementations must release transferred payloads exactly once and must
 * not retain borrowed frames past return. Exceptions thrown here are logged and counted by the
 * dispatcher; they never reach the engine.
 */
@FunctionalInterface
public interface VadEventCallback {

    /**
     * @param event the event
     * @param userData the opaque value registered together with this callback (may be null)
     */
    void onEvent(VadEvent event, Object userData);
}
