package com.phillippitts.vadbridge.service.events;

import com.phillippitts.vadbridge.exception.ErrorCode;

import java.time.Instant;
import java.util.Objects;

/**
 * Published when a boundary operation fails inside the engine or the bridge
 * (e.g. model missing, configuration rejected, host unavailable).
 *
 * <p>Carries diagnostics only, never audio.
 *
 * @param engine engine that failed, or {@code vad-bridge} for failures outside an engine
 * @param handle session handle, 0 when the failure precedes a session (e.g. {@code create})
 * @param operation boundary operation that failed
 * @param code code returned to the caller
 * @param at failure time; null means now
 * @param message human-readable cause, as recorded for {@code getLastError}
 * @param cause underlying exception (may be null)
 */
public record EngineFailureEvent(
        String engine,
        long handle,
        String operation,
        ErrorCode code,
        Instant at,
        String message,
        Throwable cause
) {
    public EngineFailureEvent {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(code, "code");
        if (at == null) {
            at = Instant.now();
        }
    }
}
