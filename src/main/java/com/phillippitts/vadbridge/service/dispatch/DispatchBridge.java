package com.phillippitts.vadbridge.service.dispatch;

import com.phillippitts.vadbridge.service.audio.AudioCodec;
import com.phillippitts.vadbridge.service.engine.DetectionSink;
import com.phillippitts.vadbridge.service.event.BorrowedFrame;
import com.phillippitts.vadbridge.service.event.PayloadLedger;
import com.phillippitts.vadbridge.service.event.TransferredBuffer;
import com.phillippitts.vadbridge.service.event.TransferredMessage;
import com.phillippitts.vadbridge.service.event.TransferredPcm16;
import com.phillippitts.vadbridge.service.event.VadEvent;
import com.phillippitts.vadbridge.service.host.ThreadAttachmentManager;
import com.phillippitts.vadbridge.service.registry.CallbackRegistration;
import com.phillippitts.vadbridge.service.registry.VadSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Turns engine detection signals into boundary events and hands them to the session's callback.
 *
 * <p><b>Delivery rules:</b>
 * <ol>
 *   <li>The registration (callback and user data) is read once per delivery. A delivery that
 *       passed this read may still complete after the callback is invalidated; one that starts
 *       afterwards never fires.</li>
 *   <li>No registration, or a destroyed session: the event is dropped and any transferred payload
 *       is released here.</li>
 *   <li>Otherwise the callback runs synchronously on the producing thread, so per-session order
 *       equals signal order. Transferred payloads then belong to the receiver; borrowed frames are
 *       expired when the callback returns.</li>
 *   <li>A callback that throws is logged and counted. The exception never reaches the engine.</li>
 * </ol>
 *
 * <p>Every delivery runs in host context via {@link ThreadAttachmentManager}. Payloads are
 * allocated only after attachment succeeded, so a failed attach leaks nothing.
 */
public class DispatchBridge {

    private static final Logger LOG = LogManager.getLogger(DispatchBridge.class);

    private final ThreadAttachmentManager attachments;
    private final PayloadLedger ledger;
    private final DispatchMetrics metrics;

    public DispatchBridge(ThreadAttachmentManager attachments, PayloadLedger ledger, DispatchMetrics metrics) {
        this.attachments = Objects.requireNonNull(attachments, "attachments");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Returns a sink delivering the signals of one session's engine.
     */
    public DetectionSink sinkFor(VadSession session) {
        return new SessionSink(Objects.requireNonNull(session, "session"));
    }

    /**
     * Delivers an already-built event to the session's current callback.
     */
    public void deliver(VadSession session, VadEvent event) {
        CallbackRegistration registration = session.callbackSnapshot();
        BorrowedFrame frame = event.borrowedPayload();
        try {
            if (registration == null || session.isDestroyed()) {
                drop(session, event, registration == null
                        ? DispatchMetrics.REASON_NO_CALLBACK
                        : DispatchMetrics.REASON_SESSION_DESTROYED);
                return;
            }
            invoke(session, event, registration);
        } finally {
            if (frame != null) {
                frame.expire();
            }
        }
    }

    private void invoke(VadSession session, VadEvent event, CallbackRegistration registration) {
        try {
            registration.callback().onEvent(event, registration.userData());
            metrics.incrementDelivered(event.type());
        } catch (RuntimeException e) {
            metrics.incrementCallbackFailure(event.type());
            LOG.warn("Callback threw while handling {} for session {}: {}",
                    event.type(), session.getId(), e.toString(), e);
        }
    }

    private void drop(VadSession session, VadEvent event, String reason) {
        TransferredBuffer payload = event.transferredPayload();
        if (payload != null) {
            payload.release();
        }
        metrics.incrementDropped(event.type(), reason);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Dropped {} for session {} ({})", event.type(), session.getId(), reason);
        }
    }

    public PayloadLedger getLedger() {
        return ledger;
    }

    private final class SessionSink implements DetectionSink {

        private final VadSession session;

        private SessionSink(VadSession session) {
            this.session = session;
        }

        @Override
        public void initialized() {
            attachments.runInHostContext(() -> deliver(session, VadEvent.initialized()));
        }

        @Override
        public void speechStart() {
            attachments.runInHostContext(() -> deliver(session, VadEvent.speechStart()));
        }

        @Override
        public void realSpeechStart() {
            attachments.runInHostContext(() -> deliver(session, VadEvent.realSpeechStart()));
        }

        @Override
        public void misfire() {
            attachments.runInHostContext(() -> deliver(session, VadEvent.misfire()));
        }

        @Override
        public void stopped() {
            attachments.runInHostContext(() -> deliver(session, VadEvent.stopped()));
        }

        @Override
        public void frameProcessed(float probability, boolean speech, float[] frame) {
            attachments.runInHostContext(() ->
                    deliver(session, VadEvent.frameProcessed(probability, speech, new BorrowedFrame(frame))));
        }

        @Override
        public void speechEnd(float[] samples, int sampleRate) {
            attachments.runInHostContext(() -> {
                short[] pcm = AudioCodec.floatToPcm16(samples);
                int durationMs = AudioCodec.durationMillis(pcm.length, sampleRate);
                deliver(session, VadEvent.speechEnd(new TransferredPcm16(ledger, pcm), durationMs));
            });
        }

        @Override
        public void error(String message, int code) {
            String text = message == null ? "" : message;
            session.recordError(text);
            attachments.runInHostContext(() ->
                    deliver(session, VadEvent.error(new TransferredMessage(ledger, text), code)));
        }
    }
}
