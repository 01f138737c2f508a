package com.phillippitts.vadbridge.service.host;

import com.phillippitts.vadbridge.exception.HostUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process host runtime: the embedding JVM itself.
 *
 * <p>Process-wide entry points are resolved once in {@link #bootstrap()} (wired as the bean's
 * init method). Until then, and after {@link #shutdown()}, the runtime reports itself unavailable
 * and attaching fails loudly.
 *
 * <p>Attachment is tracked per thread together with the bootstrap generation, so threads attached
 * before a restart attach again afterwards.
 */
public class JvmHostRuntime implements HostRuntime {

    private static final Logger LOG = LogManager.getLogger(JvmHostRuntime.class);

    private static final long NOT_RUNNING = 0L;

    private final AtomicLong generation = new AtomicLong(NOT_RUNNING);
    private final AtomicLong generations = new AtomicLong();
    private final AtomicLong attachedThreads = new AtomicLong();
    private final ThreadLocal<Long> attachedGeneration = ThreadLocal.withInitial(() -> NOT_RUNNING);

    /**
     * Resolves the runtime. Calling it again while running is a no-op.
     */
    public void bootstrap() {
        long next = generations.incrementAndGet();
        if (generation.compareAndSet(NOT_RUNNING, next)) {
            LOG.info("Host runtime bootstrapped: name={}, java={}", name(), Runtime.version());
        }
    }

    public void shutdown() {
        if (generation.getAndSet(NOT_RUNNING) != NOT_RUNNING) {
            LOG.info("Host runtime shut down after {} thread attachment(s)", attachedThreads.get());
        }
    }

    @Override
    public boolean isAvailable() {
        return generation.get() != NOT_RUNNING;
    }

    @Override
    public boolean isCurrentThreadAttached() {
        long current = generation.get();
        return current != NOT_RUNNING && attachedGeneration.get() == current;
    }

    @Override
    public void attachCurrentThread() {
        long current = generation.get();
        if (current == NOT_RUNNING) {
            throw new HostUnavailableException(
                    "Host runtime unavailable: not bootstrapped or already shut down");
        }
        if (attachedGeneration.get() != current) {
            attachedGeneration.set(current);
            attachedThreads.incrementAndGet();
        }
    }

    @Override
    public String name() {
        return "jvm";
    }
}
