package com.phillippitts.vadbridge.service.event;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts transferred payloads that have been allocated but not yet released.
 *
 * <p>Every {@link TransferredBuffer} registers itself on construction and deregisters on
 * {@link TransferredBuffer#release()}. A non-zero {@link #outstanding()} after all receivers have
 * finished means a leak; it is exported as a gauge and checked by tests.
 *
 * <p>Thread-safe.
 */
public class PayloadLedger {

    private final AtomicLong allocated = new AtomicLong();
    private final AtomicLong released = new AtomicLong();

    void onAllocate() {
        allocated.incrementAndGet();
    }

    void onRelease() {
        released.incrementAndGet();
    }

    public long allocated() {
        return allocated.get();
    }

    public long released() {
        return released.get();
    }

    public long outstanding() {
        return allocated.get() - released.get();
    }
}
