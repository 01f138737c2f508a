package com.phillippitts.vadbridge.service.boundary;

import com.phillippitts.vadbridge.domain.SessionState;
import com.phillippitts.vadbridge.domain.VadConfig;
import com.phillippitts.vadbridge.exception.AllocationFailedException;
import com.phillippitts.vadbridge.exception.ErrorCode;
import com.phillippitts.vadbridge.service.dispatch.DispatchBridge;
import com.phillippitts.vadbridge.service.dispatch.DispatchMetrics;
import com.phillippitts.vadbridge.service.engine.EnergyModelLoader;
import com.phillippitts.vadbridge.service.engine.FrameVadEngine;
import com.phillippitts.vadbridge.service.engine.SpeechProbabilityModel;
import com.phillippitts.vadbridge.service.event.PayloadLedger;
import com.phillippitts.vadbridge.service.event.VadEventType;
import com.phillippitts.vadbridge.service.events.EngineFailureEvent;
import com.phillippitts.vadbridge.service.host.JvmHostRuntime;
import com.phillippitts.vadbridge.service.host.ThreadAttachmentManager;
import com.phillippitts.vadbridge.service.registry.SessionRegistry;
import com.phillippitts.vadbridge.service.registry.VadSession;
import com.phillippitts.vadbridge.testutil.EventCapturingPublisher;
import com.phillippitts.vadbridge.testutil.RecordingCallback;
import com.phillippitts.vadbridge.testutil.ScriptedProbabilityModel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class DefaultVadBridgeTest {

    private static final int FRAME = 4;
    private static final VadConfig CONFIG = VadConfig.defaults().withFrameSamples(FRAME).withFrameCounts(0, 1, 1);

    private JvmHostRuntime runtime;
    private SessionRegistry registry;
    private PayloadLedger ledger;
    private EventCapturingPublisher publisher;
    private DefaultVadBridge bridge;
    private SpeechProbabilityModel nextModel;

    @BeforeEach
    void setUp() {
        runtime = new JvmHostRuntime();
        runtime.bootstrap();
        ThreadAttachmentManager attachments = new ThreadAttachmentManager(runtime);
        registry = new SessionRegistry(4);
        ledger = new PayloadLedger();
        DispatchBridge dispatch = new DispatchBridge(attachments, ledger,
                new DispatchMetrics(new SimpleMeterRegistry(), ledger, registry));
        publisher = new EventCapturingPublisher();
        nextModel = ScriptedProbabilityModel.of();

        EnergyModelLoader fileLoader = new EnergyModelLoader(0.05f);
        bridge = new DefaultVadBridge(registry, attachments, dispatch,
                () -> new FrameVadEngine((path, config) ->
                        path == null ? nextModel : fileLoader.load(path, config)),
                publisher, null);
    }

    @AfterEach
    void tearDown() {
        registry.close();
        runtime.shutdown();
    }

    private SessionState stateOf(long handle) {
        VadSession session = registry.acquire(handle).orElseThrow();
        try {
            return session.getState();
        } finally {
            registry.release(session);
        }
    }

    @Test
    void drivesFullLifecycle() {
        nextModel = ScriptedProbabilityModel.of(0.9f, 0.1f);
        RecordingCallback callback = new RecordingCallback();
        long handle = bridge.create();
        bridge.setCallback(handle, callback, "user-data");

        assertThat(bridge.init(handle, CONFIG)).isZero();
        assertThat(bridge.start(handle)).isZero();
        assertThat(bridge.processAudio(handle, new float[]{0.5f, 0.5f, 0.5f, 0.5f})).isZero();
        assertThat(bridge.isSpeaking(handle)).isTrue();
        assertThat(bridge.processAudio(handle, new float[FRAME])).isZero();
        assertThat(bridge.isSpeaking(handle)).isFalse();
        bridge.stop(handle);

        assertThat(callback.detectionTypes()).containsExactly(
                VadEventType.INITIALIZED,
                VadEventType.SPEECH_START,
                VadEventType.REAL_SPEECH_START,
                VadEventType.SPEECH_END,
                VadEventType.STOPPED);
        assertThat(callback.ofType(VadEventType.FRAME_PROCESSED)).hasSize(2);
        assertThat(callback.received()).allSatisfy(r -> assertThat(r.userData()).isEqualTo("user-data"));
        RecordingCallback.Received speechEnd = callback.ofType(VadEventType.SPEECH_END).get(0);
        assertThat(speechEnd.pcm()).hasSize(2 * FRAME);
        assertThat(speechEnd.durationMs()).isZero();
        assertThat(stateOf(handle)).isEqualTo(SessionState.STOPPED);
        assertThat(bridge.getLastError(handle)).isEmpty();
        assertThat(ledger.outstanding()).isZero();
    }

    @Test
    void lastErrorSentinels() {
        assertThat(bridge.getLastError(VadBridge.NULL_HANDLE)).isEqualTo("Invalid handle");
        assertThat(bridge.getLastError(999)).isEqualTo("Handle not found");
        assertThat(bridge.getLastError(bridge.create())).isEmpty();
    }

    @Test
    void startBeforeInitIsRejected() {
        long handle = bridge.create();

        assertThat(bridge.start(handle)).isEqualTo(ErrorCode.NOT_INITIALIZED.code());
        assertThat(bridge.processAudio(handle, new float[FRAME])).isEqualTo(ErrorCode.NOT_INITIALIZED.code());
        assertThat(stateOf(handle)).isEqualTo(SessionState.CREATED);
        assertThat(bridge.getLastError(handle)).isEqualTo("VAD not initialized");
    }

    @Test
    void secondInitIsRejected() {
        long handle = bridge.create();
        assertThat(bridge.init(handle, CONFIG)).isZero();

        assertThat(bridge.init(handle, CONFIG)).isEqualTo(ErrorCode.ALREADY_INITIALIZED.code());
        assertThat(stateOf(handle)).isEqualTo(SessionState.INITIALIZED);
        assertThat(bridge.getLastError(handle)).contains("already initialized");
    }

    @Test
    void invalidArgumentsAreRejected() {
        long handle = bridge.create();

        assertThat(bridge.init(handle, null)).isEqualTo(ErrorCode.INVALID_ARGUMENT.code());
        assertThat(bridge.init(handle, CONFIG)).isZero();
        assertThat(bridge.processAudio(handle, null)).isEqualTo(ErrorCode.INVALID_ARGUMENT.code());
        assertThat(bridge.processAudio(handle, new float[0])).isEqualTo(ErrorCode.INVALID_ARGUMENT.code());
        assertThat(bridge.getLastError(handle)).isEqualTo("samples must not be null or empty");
    }

    @Test
    void unknownHandlesReportNotFound() {
        assertThat(bridge.init(VadBridge.NULL_HANDLE, CONFIG)).isEqualTo(ErrorCode.HANDLE_NOT_FOUND.code());
        assertThat(bridge.start(42)).isEqualTo(ErrorCode.HANDLE_NOT_FOUND.code());
        assertThat(bridge.processAudio(42, new float[FRAME])).isEqualTo(ErrorCode.HANDLE_NOT_FOUND.code());
        assertThat(bridge.isSpeaking(42)).isFalse();
        bridge.stop(42);
        bridge.reset(42);
        bridge.forceEndSpeech(42);
        bridge.setCallback(42, new RecordingCallback(), null);
        bridge.invalidateCallback(42);
        bridge.destroy(42);

        assertThat(publisher.failureEvents()).isEmpty();
    }

    @Test
    void rejectedConfigurationKeepsSessionCreated() {
        long handle = bridge.create();
        VadConfig invalid = CONFIG.withFrameSamples(0);

        assertThat(bridge.init(handle, invalid)).isEqualTo(ErrorCode.CONFIGURATION_REJECTED.code());
        assertThat(stateOf(handle)).isEqualTo(SessionState.CREATED);
        assertThat(bridge.getLastError(handle)).startsWith("Configuration rejected: frameSamples must be positive");

        assertThat(bridge.init(handle, CONFIG)).isZero();
    }

    @Test
    void missingModelFailsInitAndPublishesFailure() {
        long handle = bridge.create();

        int result = bridge.init(handle, CONFIG, "/nonexistent/silero_vad.onnx");

        assertThat(result).isEqualTo(ErrorCode.ENGINE_INITIALIZATION_FAILED.code());
        assertThat(stateOf(handle)).isEqualTo(SessionState.CREATED);
        assertThat(bridge.getLastError(handle)).contains("VAD model not found at path");
        assertThat(publisher.failureEvents()).hasSize(1);
        EngineFailureEvent event = publisher.failureEvents().get(0);
        assertThat(event.handle()).isEqualTo(handle);
        assertThat(event.operation()).isEqualTo("init");
        assertThat(event.code()).isEqualTo(ErrorCode.ENGINE_INITIALIZATION_FAILED);
        assertThat(event.engine()).isEqualTo("frame");
    }

    @Test
    void hostUnavailableIsReported() {
        long handle = bridge.create();
        runtime.shutdown();

        assertThat(bridge.start(handle)).isEqualTo(ErrorCode.HOST_UNAVAILABLE.code());
        assertThat(bridge.create()).isEqualTo(VadBridge.NULL_HANDLE);
        assertThat(bridge.getLastError(handle)).startsWith("Host runtime unavailable");
        assertThat(publisher.failureEvents())
                .extracting(EngineFailureEvent::code)
                .containsOnly(ErrorCode.HOST_UNAVAILABLE);
    }

    @Test
    void capacityExhaustionReturnsNullHandle() {
        long first = bridge.create();
        for (int i = 1; i < registry.getMaxSessions(); i++) {
            assertThat(bridge.create()).isNotEqualTo(VadBridge.NULL_HANDLE);
        }

        assertThat(bridge.create()).isEqualTo(VadBridge.NULL_HANDLE);
        assertThat(publisher.failureEvents()).singleElement()
                .satisfies(e -> assertThat(e.cause()).isInstanceOf(AllocationFailedException.class));

        bridge.destroy(first);
        assertThat(bridge.create()).isNotEqualTo(VadBridge.NULL_HANDLE);
    }

    @Test
    void handlesAreNeverReused() {
        long first = bridge.create();
        bridge.destroy(first);

        assertThat(bridge.create()).isGreaterThan(first);
    }

    @Test
    void destroyIsIdempotent() {
        long handle = bridge.create();
        assertThat(bridge.init(handle, CONFIG)).isZero();

        bridge.destroy(handle);
        bridge.destroy(handle);
        bridge.destroy(VadBridge.NULL_HANDLE);

        assertThat(bridge.start(handle)).isEqualTo(ErrorCode.HANDLE_NOT_FOUND.code());
        assertThat(bridge.getLastError(handle)).isEqualTo("Handle not found");
        assertThat(registry.size()).isZero();
    }

    @Test
    void startWhileListeningAndStopWhileIdleAreNoOps() {
        RecordingCallback callback = new RecordingCallback();
        long handle = bridge.create();
        bridge.setCallback(handle, callback, null);
        assertThat(bridge.init(handle, CONFIG)).isZero();

        bridge.stop(handle);
        assertThat(stateOf(handle)).isEqualTo(SessionState.INITIALIZED);

        assertThat(bridge.start(handle)).isZero();
        assertThat(bridge.start(handle)).isZero();
        assertThat(stateOf(handle)).isEqualTo(SessionState.LISTENING);

        bridge.stop(handle);
        bridge.stop(handle);
        assertThat(callback.ofType(VadEventType.STOPPED)).hasSize(1);

        assertThat(bridge.start(handle)).isZero();
        assertThat(stateOf(handle)).isEqualTo(SessionState.LISTENING);
    }

    @Test
    void processingIsAllowedBeforeStart() {
        nextModel = ScriptedProbabilityModel.of(0.9f);
        RecordingCallback callback = new RecordingCallback();
        long handle = bridge.create();
        bridge.setCallback(handle, callback, null);
        assertThat(bridge.init(handle, CONFIG)).isZero();

        assertThat(bridge.processAudio(handle, new float[FRAME])).isZero();

        assertThat(callback.detectionTypes()).contains(VadEventType.SPEECH_START);
    }

    @Test
    void resetAndForceEndBeforeInitAreNoOps() {
        long handle = bridge.create();

        bridge.reset(handle);
        bridge.forceEndSpeech(handle);

        assertThat(bridge.getLastError(handle)).isEmpty();
        assertThat(stateOf(handle)).isEqualTo(SessionState.CREATED);
    }

    @Test
    void forceEndSpeechDeliversSegment() {
        nextModel = ScriptedProbabilityModel.of(0.9f, 0.9f);
        RecordingCallback callback = new RecordingCallback();
        long handle = bridge.create();
        bridge.setCallback(handle, callback, null);
        bridge.init(handle, VadConfig.defaults().withFrameSamples(FRAME).withFrameCounts(0, 10, 1));
        bridge.processAudio(handle, new float[2 * FRAME]);

        bridge.forceEndSpeech(handle);

        assertThat(callback.ofType(VadEventType.SPEECH_END)).hasSize(1);
        assertThat(bridge.isSpeaking(handle)).isFalse();
    }

    @Test
    void modelFailureIsDeliveredAsErrorEvent() {
        nextModel = ScriptedProbabilityModel.of(0.1f).failOnFrame(0);
        RecordingCallback callback = new RecordingCallback();
        long handle = bridge.create();
        bridge.setCallback(handle, callback, null);
        bridge.init(handle, CONFIG);

        assertThat(bridge.processAudio(handle, new float[FRAME])).isZero();

        RecordingCallback.Received error = callback.ofType(VadEventType.ERROR).get(0);
        assertThat(error.code()).isEqualTo(-10);
        assertThat(bridge.getLastError(handle)).isEqualTo(error.message());
        assertThat(ledger.outstanding()).isZero();
    }

    @Test
    void clearedCallbackReceivesNothing() {
        nextModel = ScriptedProbabilityModel.of(0.9f, 0.1f);
        RecordingCallback callback = new RecordingCallback();
        long handle = bridge.create();
        bridge.setCallback(handle, callback, null);
        bridge.init(handle, CONFIG);

        bridge.invalidateCallback(handle);
        bridge.processAudio(handle, new float[2 * FRAME]);
        bridge.setCallback(handle, callback, null);
        bridge.setCallback(handle, null, null);
        bridge.stop(handle);

        assertThat(callback.types()).containsExactly(VadEventType.INITIALIZED);
        assertThat(ledger.outstanding()).isZero();
    }

    @Test
    void startFromInitializedCallbackSucceeds() {
        AtomicReference<Integer> startResult = new AtomicReference<>();
        AtomicReference<SessionState> stateSeen = new AtomicReference<>();
        long handle = bridge.create();
        bridge.setCallback(handle, (event, userData) -> {
            if (event.type() == VadEventType.INITIALIZED) {
                stateSeen.set(stateOf(handle));
                startResult.set(bridge.start(handle));
            }
        }, null);

        assertThat(bridge.init(handle, CONFIG)).isZero();

        assertThat(stateSeen.get()).isEqualTo(SessionState.INITIALIZED);
        assertThat(startResult.get()).isZero();
        assertThat(stateOf(handle)).isEqualTo(SessionState.LISTENING);
        assertThat(bridge.getLastError(handle)).isEmpty();
    }

    @Test
    void callbackCanBeReplacedWhileOneIsRunning() throws Exception {
        nextModel = ScriptedProbabilityModel.of(0.1f, 0.1f, 0.1f);
        long handle = bridge.create();
        assertThat(bridge.init(handle, CONFIG)).isZero();

        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger blockedFrames = new AtomicInteger();
        bridge.setCallback(handle, (event, userData) -> {
            if (event.type() != VadEventType.FRAME_PROCESSED) {
                return;
            }
            blockedFrames.incrementAndGet();
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, null);

        AtomicReference<Integer> processResult = new AtomicReference<>();
        Thread producer = new Thread(() -> processResult.set(bridge.processAudio(handle, new float[3 * FRAME])),
                "audio-producer");
        producer.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        RecordingCallback replacement = new RecordingCallback();
        try {
            // both return while the delivering thread is still inside the callback
            CompletableFuture.runAsync(() -> bridge.setCallback(handle, replacement, null))
                    .get(1, TimeUnit.SECONDS);
            CompletableFuture.runAsync(() -> bridge.invalidateCallback(handle))
                    .get(1, TimeUnit.SECONDS);
        } finally {
            release.countDown();
        }

        producer.join(5_000);
        assertThat(producer.isAlive()).isFalse();
        assertThat(processResult.get()).isZero();
        assertThat(blockedFrames.get()).isEqualTo(1);
        assertThat(replacement.count()).isZero();
        assertThat(ledger.outstanding()).isZero();
    }

    @Test
    void errorCodeMapping() {
        assertThat(DefaultVadBridge.errorCodeFor(new AllocationFailedException("full"), ErrorCode.PROCESSING_FAILED))
                .isEqualTo(ErrorCode.ALLOCATION_FAILED);
        assertThat(DefaultVadBridge.errorCodeFor(new IllegalArgumentException("bad"), ErrorCode.PROCESSING_FAILED))
                .isEqualTo(ErrorCode.INVALID_ARGUMENT);
        assertThat(DefaultVadBridge.errorCodeFor(new IllegalStateException("odd"), ErrorCode.PROCESSING_FAILED))
                .isEqualTo(ErrorCode.PROCESSING_FAILED);
    }

    @Test
    void destroyDuringProcessingIsSafe() throws Exception {
        AtomicInteger frames = new AtomicInteger();
        nextModel = frame -> frames.getAndIncrement() % 4 < 2 ? 0.9f : 0.1f;
        RecordingCallback callback = new RecordingCallback();
        long handle = bridge.create();
        bridge.setCallback(handle, callback, null);
        assertThat(bridge.init(handle, CONFIG)).isZero();
        assertThat(bridge.start(handle)).isZero();

        CountDownLatch processing = new CountDownLatch(1);
        AtomicReference<Integer> unexpected = new AtomicReference<>();
        Thread producer = new Thread(() -> {
            float[] chunk = new float[3 * FRAME];
            while (true) {
                int rc = bridge.processAudio(handle, chunk);
                processing.countDown();
                if (rc == ErrorCode.HANDLE_NOT_FOUND.code()) {
                    return;
                }
                if (rc != 0) {
                    unexpected.set(rc);
                    return;
                }
            }
        }, "audio-producer");
        producer.start();

        processing.await();
        bridge.destroy(handle);

        await().atMost(Duration.ofSeconds(10)).until(() -> !producer.isAlive());
        assertThat(unexpected.get()).isNull();
        assertThat(callback.ofType(VadEventType.SPEECH_END)).isNotEmpty();
        assertThat(registry.size()).isZero();
        assertThat(ledger.outstanding()).isZero();
    }
}
