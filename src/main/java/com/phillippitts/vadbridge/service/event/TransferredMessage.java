package com.phillippitts.vadbridge.service.event;

import java.util.Objects;

/**
 * Transferred error message carried by {@code Error} events.
 */
public final class TransferredMessage extends TransferredBuffer {

    private String text;
    private final int length;

    public TransferredMessage(PayloadLedger ledger, String text) {
        super(ledger);
        this.text = Objects.requireNonNull(text, "text");
        this.length = text.length();
    }

    public String text() {
        ensureLive();
        return text;
    }

    @Override
    public int length() {
        return length;
    }

    @Override
    protected void clear() {
        text = null;
    }
}
