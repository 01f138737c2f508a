package com.phillippitts.vadbridge.service.host;

import com.phillippitts.vadbridge.exception.HostUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Makes sure the calling thread is attached to the {@link HostRuntime} before running an action.
 *
 * <p>Every boundary operation and every event delivery funnels through here. A thread is attached
 * on first use and left attached; later calls only pay a thread-local check. Nesting is allowed.
 */
public class ThreadAttachmentManager {

    private static final Logger LOG = LogManager.getLogger(ThreadAttachmentManager.class);

    private final HostRuntime host;
    private final AtomicLong attachCount = new AtomicLong();

    public ThreadAttachmentManager(HostRuntime host) {
        this.host = Objects.requireNonNull(host, "host");
    }

    /**
     * Runs {@code action} on the calling thread with host context.
     *
     * @throws HostUnavailableException if the thread cannot be attached
     */
    public <T> T withHostContext(Supplier<T> action) {
        ensureAttached();
        return action.get();
    }

    public void runInHostContext(Runnable action) {
        ensureAttached();
        action.run();
    }

    private void ensureAttached() {
        if (host.isCurrentThreadAttached()) {
            return;
        }
        if (!host.isAvailable()) {
            throw new HostUnavailableException("Host runtime '" + host.name() + "' is not available");
        }
        try {
            host.attachCurrentThread();
        } catch (HostUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new HostUnavailableException(
                    "Failed to attach thread '" + Thread.currentThread().getName() + "' to host runtime", e);
        }
        attachCount.incrementAndGet();
        LOG.debug("Attached thread '{}' to host runtime '{}'", Thread.currentThread().getName(), host.name());
    }

    /**
     * Number of attachments this manager has performed.
     */
    public long getAttachCount() {
        return attachCount.get();
    }

    public boolean isHostAvailable() {
        return host.isAvailable();
    }

    public String getHostName() {
        return host.name();
    }
}
