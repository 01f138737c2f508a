package com.phillippitts.vadbridge.service.event;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Payload whose ownership passes to the callback's receiver.
 *
 * <p>Ownership rule: once the dispatcher has invoked the callback with an event carrying this
 * buffer, the receiver owns it and must call {@link #release()} exactly once. The dispatcher never
 * touches it again. If no callback is reached, the dispatcher releases it itself.
 *
 * <p>Releasing twice is a programming error and fails with {@link IllegalStateException}, as does
 * reading the contents after release.
 */
public abstract class TransferredBuffer {

    private final PayloadLedger ledger;
    private final AtomicBoolean released = new AtomicBoolean(false);

    protected TransferredBuffer(PayloadLedger ledger) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        ledger.onAllocate();
    }

    /**
     * Releases the payload. Must be called exactly once by the current owner.
     *
     * @throws IllegalStateException if already released
     */
    public final void release() {
        if (!released.compareAndSet(false, true)) {
            throw new IllegalStateException(getClass().getSimpleName() + " already released");
        }
        clear();
        ledger.onRelease();
    }

    public final boolean isReleased() {
        return released.get();
    }

    /**
     * Number of elements (samples or characters) in the payload.
     */
    public abstract int length();

    protected final void ensureLive() {
        if (released.get()) {
            throw new IllegalStateException(getClass().getSimpleName() + " accessed after release");
        }
    }

    /**
     * Drops the reference to the contents. Called once, from {@link #release()}.
     */
    protected abstract void clear();
}
