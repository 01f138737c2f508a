package com.phillippitts.vadbridge.service.health;

import com.phillippitts.vadbridge.config.VadBridgeProperties;
import com.phillippitts.vadbridge.service.event.PayloadLedger;
import com.phillippitts.vadbridge.service.host.ThreadAttachmentManager;
import com.phillippitts.vadbridge.service.registry.SessionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the VAD bridge.
 *
 * <ul>
 *   <li>UP: host runtime available and the bridge is enabled</li>
 *   <li>OUT_OF_SERVICE: bridge disabled by configuration</li>
 *   <li>DOWN: host runtime unavailable</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class VadBridgeHealthIndicator implements HealthIndicator {

    private final ThreadAttachmentManager attachments;
    private final SessionRegistry sessions;
    private final PayloadLedger ledger;
    private final VadBridgeProperties properties;

    public VadBridgeHealthIndicator(ThreadAttachmentManager attachments,
                                    SessionRegistry sessions,
                                    PayloadLedger ledger,
                                    VadBridgeProperties properties) {
        this.attachments = attachments;
        this.sessions = sessions;
        this.ledger = ledger;
        this.properties = properties;
    }

    @Override
    public Health health() {
        Health.Builder builder;
        if (!properties.isEnabled()) {
            builder = Health.outOfService().withDetail("status", "VAD bridge disabled");
        } else if (attachments.isHostAvailable()) {
            builder = Health.up().withDetail("status", "Host runtime available");
        } else {
            builder = Health.down().withDetail("status", "Host runtime unavailable");
        }
        return builder
                .withDetail("host", attachments.getHostName())
                .withDetail("sessions", sessions.size())
                .withDetail("maxSessions", sessions.getMaxSessions())
                .withDetail("payloadsOutstanding", ledger.outstanding())
                .withDetail("threadAttachments", attachments.getAttachCount())
                .build();
    }
}
