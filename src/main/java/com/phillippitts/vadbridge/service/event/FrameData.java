package com.phillippitts.vadbridge.service.event;

/**
 * Payload of a {@code FrameProcessed} event.
 *
 * @param probability speech probability of the frame (0.0 - 1.0)
 * @param speech whether the probability reached the positive threshold
 * @param frame borrowed frame samples, valid only during the callback
 */
public record FrameData(float probability, boolean speech, BorrowedFrame frame) {
}
