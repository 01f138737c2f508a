package com.phillippitts.vadbridge.service.event;

import java.util.Arrays;
import java.util.Objects;

/**
 * Frame samples lent to a callback for the duration of one invocation.
 *
 * <p>The receiver may read or {@link #copy()} the samples while the callback runs. Once the
 * callback returns the dispatcher calls {@link #expire()}; any later access fails with
 * {@link IllegalStateException}. The receiver never releases a borrowed frame.
 */
public final class BorrowedFrame {

    private final float[] samples;
    private volatile boolean expired;

    public BorrowedFrame(float[] samples) {
        this.samples = Objects.requireNonNull(samples, "samples");
    }

    public int length() {
        return samples.length;
    }

    public float get(int index) {
        ensureValid();
        return samples[index];
    }

    /**
     * Copies the samples into a new array the caller may keep.
     */
    public float[] copy() {
        ensureValid();
        return Arrays.copyOf(samples, samples.length);
    }

    public boolean isExpired() {
        return expired;
    }

    /**
     * Ends the borrow. Called by the dispatcher after the callback returns.
     */
    public void expire() {
        expired = true;
    }

    private void ensureValid() {
        if (expired) {
            throw new IllegalStateException("Borrowed frame accessed after the callback returned");
        }
    }
}
