package com.phillippitts.vadbridge.service.event;

/**
 * Payload of an {@code Error} event.
 *
 * @param message transferred error message
 * @param code numeric error code
 */
public record ErrorData(TransferredMessage message, int code) {
}
