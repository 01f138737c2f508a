package com.phillippitts.vadbridge.service.registry;

import com.phillippitts.vadbridge.exception.AllocationFailedException;
import com.phillippitts.vadbridge.exception.HandleNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Maps opaque session handles to {@link VadSession} records.
 *
 * <p>Handles are positive {@code long}s handed out in increasing order and never reused while the
 * registry lives; {@code 0} is the null handle and never resolves. Callers only ever hold the
 * handle, never the record.
 *
 * <p><b>Thread Safety:</b> one registry-wide lock serializes insert, lookup and removal. It is
 * never held while an engine or callback runs: lookups return a retained reference that the caller
 * uses after the lock has been dropped, then releases.
 */
public class SessionRegistry implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    public static final long NULL_HANDLE = 0L;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, VadSession> sessions = new HashMap<>();
    private final int maxSessions;

    /**
     * Guarded by {@link #lock}.
     */
    private long nextId = 1L;

    public SessionRegistry(int maxSessions) {
        if (maxSessions <= 0) {
            throw new IllegalArgumentException("maxSessions must be positive: " + maxSessions);
        }
        this.maxSessions = maxSessions;
    }

    /**
     * Creates a session in {@code CREATED} state under a fresh handle.
     *
     * @return the new session's handle
     * @throws AllocationFailedException if the capacity is reached or handles are exhausted
     */
    public long create() {
        long id;
        lock.lock();
        try {
            if (sessions.size() >= maxSessions) {
                throw new AllocationFailedException(
                        "Session capacity reached (maxSessions=" + maxSessions + ")");
            }
            if (nextId == Long.MAX_VALUE) {
                throw new AllocationFailedException("Session handles exhausted");
            }
            id = nextId++;
            sessions.put(id, new VadSession(id));
        } finally {
            lock.unlock();
        }
        LOG.info("Session created: handle={}", id);
        return id;
    }

    /**
     * Looks up a session and retains it. The caller must pass a present result to
     * {@link #release(VadSession)} once done.
     */
    public Optional<VadSession> acquire(long id) {
        if (id == NULL_HANDLE) {
            return Optional.empty();
        }
        lock.lock();
        try {
            VadSession session = sessions.get(id);
            if (session == null || !session.retain()) {
                return Optional.empty();
            }
            return Optional.of(session);
        } finally {
            lock.unlock();
        }
    }

    public void release(VadSession session) {
        session.release();
    }

    /**
     * Runs {@code action} against a retained session and releases it afterwards.
     *
     * @throws HandleNotFoundException if the handle is null, unknown or destroyed
     */
    public <T> T withSession(long id, Function<VadSession, T> action) {
        VadSession session = acquire(id).orElseThrow(() -> new HandleNotFoundException(id));
        try {
            return action.apply(session);
        } finally {
            session.release();
        }
    }

    /**
     * Marks the session destroyed, clears its callback and erases the mapping. Idempotent.
     *
     * <p>The engine is closed by whichever holder releases the session last: immediately if no
     * operation is in flight, otherwise when the last in-flight operation finishes.
     *
     * @return true if a session was removed
     */
    public boolean remove(long id) {
        if (id == NULL_HANDLE) {
            return false;
        }
        VadSession removed;
        lock.lock();
        try {
            removed = sessions.remove(id);
            if (removed != null) {
                removed.markDestroyed();
                removed.clearCallback();
            }
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            return false;
        }
        removed.release();
        LOG.info("Session destroyed: handle={}", id);
        return true;
    }

    public int size() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    /**
     * Removes every remaining session. Invoked on container shutdown.
     */
    @Override
    public void close() {
        List<Long> ids;
        lock.lock();
        try {
            ids = new ArrayList<>(sessions.keySet());
        } finally {
            lock.unlock();
        }
        if (!ids.isEmpty()) {
            LOG.info("Closing session registry: {} session(s) still open", ids.size());
        }
        for (Long id : ids) {
            remove(id);
        }
    }
}
