package com.phillippitts.vadbridge.service.event;

import java.util.Objects;

/**
 * Transferred PCM16 sample buffer carried by {@code SpeechEnd} events.
 * The array is a fresh copy made for this event; the owner may keep or mutate it until release.
 */
public final class TransferredPcm16 extends TransferredBuffer {

    private short[] samples;
    private final int length;

    public TransferredPcm16(PayloadLedger ledger, short[] samples) {
        super(ledger);
        this.samples = Objects.requireNonNull(samples, "samples");
        this.length = samples.length;
    }

    /**
     * Returns the owned sample array.
     *
     * @throws IllegalStateException if already released
     */
    public short[] samples() {
        ensureLive();
        return samples;
    }

    @Override
    public int length() {
        return length;
    }

    @Override
    protected void clear() {
        samples = null;
    }
}
