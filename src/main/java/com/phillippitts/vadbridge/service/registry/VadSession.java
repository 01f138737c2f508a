package com.phillippitts.vadbridge.service.registry;

import com.phillippitts.vadbridge.domain.SessionState;
import com.phillippitts.vadbridge.service.engine.VadEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Registry-owned record of one VAD session.
 *
 * <p><b>Reference counting:</b> the registry holds one reference from creation until removal;
 * every operation working on the session holds another between {@link #retain()} and
 * {@link #release()}. The engine is closed when the count drops to zero, so a concurrent
 * {@code destroy} never closes an engine another thread is still using.
 *
 * <p><b>Thread Safety:</b> state, callback and last error are atomics and may be read without
 * locks. The engine is guarded by the per-session engine lock; see {@link #withEngineLock}.
 */
public final class VadSession {

    private static final Logger LOG = LogManager.getLogger(VadSession.class);

    private final long id;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CREATED);
    private final AtomicReference<CallbackRegistration> callback = new AtomicReference<>();
    private final AtomicInteger refCount = new AtomicInteger(1);
    private final ReentrantLock engineLock = new ReentrantLock();
    private volatile String lastError = "";

    /**
     * Written only under {@link #engineLock}; volatile for the lock-free {@link #isSpeaking()}.
     */
    private volatile VadEngine engine;

    VadSession(long id) {
        this.id = id;
    }

    public long getId() {
        return id;
    }

    public SessionState getState() {
        return state.get();
    }

    public boolean isDestroyed() {
        return state.get() == SessionState.DESTROYED;
    }

    /**
     * Moves from {@code expected} to {@code next} atomically.
     *
     * @return false if the session was not in {@code expected}
     */
    public boolean transition(SessionState expected, SessionState next) {
        return state.compareAndSet(expected, next);
    }

    void markDestroyed() {
        state.set(SessionState.DESTROYED);
    }

    /**
     * Returns the current registration, read once. Null when no callback is set.
     */
    public CallbackRegistration callbackSnapshot() {
        return callback.get();
    }

    public void setCallback(CallbackRegistration registration) {
        callback.set(registration);
    }

    public void clearCallback() {
        callback.set(null);
    }

    public String getLastError() {
        return lastError;
    }

    public void recordError(String message) {
        this.lastError = message == null ? "" : message;
    }

    /**
     * Runs {@code action} while holding the engine lock.
     */
    public <T> T withEngineLock(Supplier<T> action) {
        engineLock.lock();
        try {
            return action.get();
        } finally {
            engineLock.unlock();
        }
    }

    /**
     * Current engine; callers must hold the engine lock.
     */
    public VadEngine getEngine() {
        return engine;
    }

    /**
     * Installs the engine; callers must hold the engine lock.
     */
    public void attachEngine(VadEngine engine) {
        this.engine = engine;
    }

    /**
     * Reads {@code isSpeaking} without the engine lock so it can be queried during delivery.
     */
    public boolean isSpeaking() {
        VadEngine current = engine;
        return current != null && current.isSpeaking();
    }

    /**
     * Adds a reference unless the session has already been fully released.
     *
     * @return false if the count had reached zero
     */
    boolean retain() {
        while (true) {
            int current = refCount.get();
            if (current <= 0) {
                return false;
            }
            if (refCount.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Drops a reference; the last release closes the engine.
     */
    void release() {
        int remaining = refCount.decrementAndGet();
        if (remaining == 0) {
            closeEngine();
        } else if (remaining < 0) {
            throw new IllegalStateException("Session " + id + " released more often than retained");
        }
    }

    int refCount() {
        return refCount.get();
    }

    private void closeEngine() {
        engineLock.lock();
        try {
            if (engine != null) {
                try {
                    engine.close();
                } catch (RuntimeException e) {
                    LOG.warn("Failed to close engine for session {}: {}", id, e.getMessage(), e);
                }
                engine = null;
            }
        } finally {
            engineLock.unlock();
        }
        LOG.debug("Session {} released", id);
    }

    @Override
    public String toString() {
        return "VadSession{id=" + id + ", state=" + state.get() + '}';
    }
}
