package com.phillippitts.vadbridge.service.event;

/**
 * Payload of a {@code SpeechEnd} event.
 *
 * @param audio transferred PCM16 samples of the speech segment
 * @param durationMs segment duration in milliseconds
 */
public record SpeechEndData(TransferredPcm16 audio, int durationMs) {
}
