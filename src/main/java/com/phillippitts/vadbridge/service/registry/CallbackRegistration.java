package com.phillippitts.vadbridge.service.registry;

import com.phillippitts.vadbridge.service.event.VadEventCallback;

import java.util.Objects;

/**
 * A callback together with the opaque user data registered alongside it.
 * Swapped atomically as one value, so a delivery never sees a callback paired with stale data.
 */
public record CallbackRegistration(VadEventCallback callback, Object userData) {

    public CallbackRegistration {
        Objects.requireNonNull(callback, "callback");
    }
}
