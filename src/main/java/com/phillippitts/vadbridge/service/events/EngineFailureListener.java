package com.phillippitts.vadbridge.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central handler for engine failure events. Throttled per engine and error code to avoid log
 * spam when a host keeps retrying a failing operation.
 */
@Component
class EngineFailureListener {
    private static final Logger LOG = LogManager.getLogger(EngineFailureListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onEngineFailure(EngineFailureEvent e) {
        String key = e.engine() + '-' + e.code().code();
        if (shouldLog(key)) {
            LOG.warn("VAD engine failure: engine={}, code={} ({}), operation={}, handle={}, message={}",
                    e.engine(), e.code().code(), e.code(), e.operation(), e.handle(), e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
