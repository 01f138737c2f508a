package com.phillippitts.vadbridge.service.dispatch;

import com.phillippitts.vadbridge.service.event.PayloadLedger;
import com.phillippitts.vadbridge.service.event.VadEventType;
import com.phillippitts.vadbridge.service.registry.SessionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Metrics for event dispatch.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Events delivered to callbacks, per event type</li>
 *   <li>Events dropped before reaching a callback, per type and reason</li>
 *   <li>Callbacks that threw, per event type</li>
 *   <li>Open sessions and outstanding transferred payloads (gauges)</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
public class DispatchMetrics {

    private static final String METRIC_PREFIX = "vad.bridge";

    public static final String REASON_NO_CALLBACK = "no_callback";
    public static final String REASON_SESSION_DESTROYED = "session_destroyed";

    private final MeterRegistry registry;

    public DispatchMetrics(MeterRegistry registry, PayloadLedger ledger, SessionRegistry sessions) {
        this.registry = registry;
        Gauge.builder(METRIC_PREFIX + ".sessions.active", sessions, SessionRegistry::size)
                .description("Number of open VAD sessions")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + ".payloads.outstanding", ledger, PayloadLedger::outstanding)
                .description("Transferred payloads allocated but not yet released")
                .register(registry);
    }

    /**
     * Increments the delivered counter for an event type.
     *
     * @param type event type that reached a callback
     */
    public void incrementDelivered(VadEventType type) {
        Counter.builder(METRIC_PREFIX + ".events.delivered")
                .description("Number of events delivered to callbacks")
                .tag("type", type.tag())
                .register(registry)
                .increment();
    }

    /**
     * Increments the dropped counter.
     *
     * @param type event type that was dropped
     * @param reason why it was dropped ({@link #REASON_NO_CALLBACK}, {@link #REASON_SESSION_DESTROYED})
     */
    public void incrementDropped(VadEventType type, String reason) {
        Counter.builder(METRIC_PREFIX + ".events.dropped")
                .description("Number of events dropped before reaching a callback")
                .tag("type", type.tag())
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementCallbackFailure(VadEventType type) {
        Counter.builder(METRIC_PREFIX + ".callback.failures")
                .description("Number of callback invocations that threw")
                .tag("type", type.tag())
                .register(registry)
                .increment();
    }
}
