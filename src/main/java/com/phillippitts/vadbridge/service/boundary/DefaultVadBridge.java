package com.phillippitts.vadbridge.service.boundary;

import com.phillippitts.vadbridge.domain.SessionState;
import com.phillippitts.vadbridge.domain.VadConfig;
import com.phillippitts.vadbridge.exception.EngineInitializationException;
import com.phillippitts.vadbridge.exception.ErrorCode;
import com.phillippitts.vadbridge.exception.HandleNotFoundException;
import com.phillippitts.vadbridge.exception.SessionStateException;
import com.phillippitts.vadbridge.exception.VadBridgeException;
import com.phillippitts.vadbridge.service.dispatch.DispatchBridge;
import com.phillippitts.vadbridge.service.engine.DetectionSink;
import com.phillippitts.vadbridge.service.engine.VadEngine;
import com.phillippitts.vadbridge.service.engine.VadEngineFactory;
import com.phillippitts.vadbridge.service.event.VadEventCallback;
import com.phillippitts.vadbridge.service.events.EngineFailureEvent;
import com.phillippitts.vadbridge.service.host.ThreadAttachmentManager;
import com.phillippitts.vadbridge.service.registry.CallbackRegistration;
import com.phillippitts.vadbridge.service.registry.SessionRegistry;
import com.phillippitts.vadbridge.service.registry.VadSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@link VadBridge} backed by the session registry, a per-session {@link VadEngine} and the
 * dispatch bridge.
 *
 * <p>Every operation runs in host context, resolves the handle to a retained session, performs
 * the state check and engine call under the session's engine lock, and releases the session. Any
 * exception is caught here: it is mapped to an {@link ErrorCode}, recorded as the session's last
 * error, logged, and, for engine and host failures, published as an
 * {@link EngineFailureEvent}.
 */
public class DefaultVadBridge implements VadBridge {

    private static final Logger LOG = LogManager.getLogger(DefaultVadBridge.class);

    private static final String BRIDGE_NAME = "vad-bridge";

    private final SessionRegistry registry;
    private final ThreadAttachmentManager attachments;
    private final DispatchBridge dispatch;
    private final VadEngineFactory engineFactory;
    private final ApplicationEventPublisher publisher;
    private final String defaultModelPath;

    /**
     * @param publisher Spring event publisher for failure events (may be null)
     * @param defaultModelPath model used when {@code init} is given none (may be null)
     */
    public DefaultVadBridge(SessionRegistry registry,
                            ThreadAttachmentManager attachments,
                            DispatchBridge dispatch,
                            VadEngineFactory engineFactory,
                            ApplicationEventPublisher publisher,
                            String defaultModelPath) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.attachments = Objects.requireNonNull(attachments, "attachments");
        this.dispatch = Objects.requireNonNull(dispatch, "dispatch");
        this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory");
        this.publisher = publisher;
        this.defaultModelPath = defaultModelPath;
    }

    @Override
    public long create() {
        try {
            return attachments.withHostContext(registry::create);
        } catch (RuntimeException e) {
            fail(NULL_HANDLE, "create", ErrorCode.ALLOCATION_FAILED, e);
            return NULL_HANDLE;
        }
    }

    @Override
    public void destroy(long handle) {
        if (handle == NULL_HANDLE) {
            return;
        }
        try {
            attachments.runInHostContext(() -> registry.remove(handle));
        } catch (RuntimeException e) {
            fail(handle, "destroy", ErrorCode.HOST_UNAVAILABLE, e);
        }
    }

    @Override
    public int init(long handle, VadConfig config, String modelPath) {
        return execute(handle, "init", ErrorCode.ENGINE_INITIALIZATION_FAILED, session -> {
            if (config == null) {
                throw new IllegalArgumentException("config must not be null");
            }
            SessionState state = requireLive(session);
            if (state != SessionState.CREATED) {
                throw SessionStateException.alreadyInitialized(state);
            }
            String path = modelPath != null && !modelPath.isBlank() ? modelPath : defaultModelPath;
            DetectionSink sink = dispatch.sinkFor(session);
            VadEngine engine = engineFactory.create();
            try {
                engine.initialize(config, path, sink);
            } catch (RuntimeException e) {
                engine.close();
                throw e;
            }
            session.attachEngine(engine);
            if (!session.transition(SessionState.CREATED, SessionState.INITIALIZED)) {
                // Destroyed meanwhile; the last release closes the attached engine
                throw new HandleNotFoundException(handle);
            }
            LOG.info("Session {} initialized: engine={}, model={}", handle, engine.getEngineName(),
                    path == null ? "<built-in>" : path);
            // After the transition, so a receiver may call start or processAudio from the callback
            sink.initialized();
        });
    }

    @Override
    public void setCallback(long handle, VadEventCallback callback, Object userData) {
        executeUnlocked(handle, "setCallback", session -> {
            if (callback == null) {
                session.clearCallback();
            } else {
                session.setCallback(new CallbackRegistration(callback, userData));
            }
        });
    }

    @Override
    public void invalidateCallback(long handle) {
        executeUnlocked(handle, "invalidateCallback", VadSession::clearCallback);
    }

    @Override
    public int start(long handle) {
        return execute(handle, "start", ErrorCode.PROCESSING_FAILED, session -> {
            SessionState state = requireLive(session);
            switch (state) {
                case CREATED -> throw SessionStateException.notInitialized(state);
                case LISTENING -> LOG.debug("Session {} already listening", handle);
                default -> {
                    session.getEngine().start();
                    session.transition(state, SessionState.LISTENING);
                }
            }
        });
    }

    @Override
    public void stop(long handle) {
        execute(handle, "stop", ErrorCode.PROCESSING_FAILED, session -> {
            if (requireLive(session) == SessionState.LISTENING) {
                session.getEngine().stop();
                session.transition(SessionState.LISTENING, SessionState.STOPPED);
            }
        });
    }

    @Override
    public int processAudio(long handle, float[] samples) {
        return execute(handle, "processAudio", ErrorCode.PROCESSING_FAILED, session -> {
            if (samples == null || samples.length == 0) {
                throw new IllegalArgumentException("samples must not be null or empty");
            }
            SessionState state = requireLive(session);
            if (!state.hasEngine()) {
                throw SessionStateException.notInitialized(state);
            }
            session.getEngine().processAudio(samples);
        });
    }

    @Override
    public void reset(long handle) {
        execute(handle, "reset", ErrorCode.PROCESSING_FAILED, session -> {
            if (requireLive(session).hasEngine()) {
                session.getEngine().reset();
            }
        });
    }

    @Override
    public void forceEndSpeech(long handle) {
        execute(handle, "forceEndSpeech", ErrorCode.PROCESSING_FAILED, session -> {
            if (requireLive(session).hasEngine()) {
                session.getEngine().forceEndSpeech();
            }
        });
    }

    @Override
    public boolean isSpeaking(long handle) {
        Optional<VadSession> acquired = registry.acquire(handle);
        if (acquired.isEmpty()) {
            return false;
        }
        VadSession session = acquired.get();
        try {
            return !session.isDestroyed() && session.isSpeaking();
        } finally {
            registry.release(session);
        }
    }

    /**
     * Reads only session fields, so it answers even when the host runtime is down.
     */
    @Override
    public String getLastError(long handle) {
        if (handle == NULL_HANDLE) {
            return INVALID_HANDLE_ERROR;
        }
        Optional<VadSession> acquired = registry.acquire(handle);
        if (acquired.isEmpty()) {
            return HANDLE_NOT_FOUND_ERROR;
        }
        VadSession session = acquired.get();
        try {
            return session.getLastError();
        } finally {
            registry.release(session);
        }
    }

    private int execute(long handle, String operation, ErrorCode fallback, Consumer<VadSession> action) {
        try {
            return attachments.withHostContext(() -> registry.withSession(handle, session ->
                    session.withEngineLock(() -> {
                        action.accept(session);
                        return ErrorCode.OK.code();
                    })));
        } catch (RuntimeException e) {
            return fail(handle, operation, fallback, e);
        }
    }

    /**
     * Like {@link #execute} but without the engine lock, which a delivering thread holds for a
     * whole {@code processAudio} batch. Only for operations touching atomically updated fields.
     */
    private void executeUnlocked(long handle, String operation, Consumer<VadSession> action) {
        try {
            attachments.runInHostContext(() -> registry.withSession(handle, session -> {
                requireLive(session);
                action.accept(session);
                return null;
            }));
        } catch (RuntimeException e) {
            fail(handle, operation, ErrorCode.INVALID_ARGUMENT, e);
        }
    }

    private static SessionState requireLive(VadSession session) {
        SessionState state = session.getState();
        if (state == SessionState.DESTROYED) {
            throw new HandleNotFoundException(session.getId());
        }
        return state;
    }

    private int fail(long handle, String operation, ErrorCode fallback, RuntimeException e) {
        ErrorCode code = errorCodeFor(e, fallback);
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();

        if (code != ErrorCode.HANDLE_NOT_FOUND) {
            recordLastError(handle, message);
        }

        switch (code) {
            case HANDLE_NOT_FOUND -> LOG.debug("{} on handle {}: {}", operation, handle, message);
            case NOT_INITIALIZED, ALREADY_INITIALIZED, INVALID_ARGUMENT ->
                    LOG.warn("{} rejected for handle {}: {}", operation, handle, message);
            case HOST_UNAVAILABLE, ALLOCATION_FAILED -> {
                LOG.warn("{} failed for handle {}: {}", operation, handle, message);
                publishFailure(handle, operation, code, message, e);
            }
            default -> {
                LOG.error("{} failed for handle {} (code={}): {}", operation, handle, code.code(), message, e);
                publishFailure(handle, operation, code, message, e);
            }
        }
        return code.code();
    }

    static ErrorCode errorCodeFor(RuntimeException e, ErrorCode fallback) {
        if (e instanceof VadBridgeException vbe) {
            return vbe.getErrorCode();
        }
        if (e instanceof IllegalArgumentException) {
            return ErrorCode.INVALID_ARGUMENT;
        }
        return fallback;
    }

    private void recordLastError(long handle, String message) {
        registry.acquire(handle).ifPresent(session -> {
            try {
                session.recordError(message);
            } finally {
                registry.release(session);
            }
        });
    }

    private void publishFailure(long handle, String operation, ErrorCode code, String message, Throwable cause) {
        if (publisher == null) {
            return;
        }
        String engine = cause instanceof EngineInitializationException eie ? eie.getEngineName() : BRIDGE_NAME;
        publisher.publishEvent(new EngineFailureEvent(engine, handle, operation, code, null, message, cause));
    }
}
