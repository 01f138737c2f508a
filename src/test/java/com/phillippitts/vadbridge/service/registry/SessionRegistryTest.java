package com.phillippitts.vadbridge.service.registry;

import com.phillippitts.vadbridge.domain.SessionState;
import com.phillippitts.vadbridge.exception.AllocationFailedException;
import com.phillippitts.vadbridge.exception.HandleNotFoundException;
import com.phillippitts.vadbridge.service.engine.VadEngine;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SessionRegistryTest {

    @Test
    void handlesStartAtOneAndIncrease() {
        SessionRegistry registry = new SessionRegistry(8);

        long first = registry.create();
        long second = registry.create();

        assertThat(first).isEqualTo(1L);
        assertThat(second).isEqualTo(2L);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void newSessionStartsCreatedWithoutErrorOrCallback() {
        SessionRegistry registry = new SessionRegistry(8);
        long id = registry.create();

        registry.withSession(id, session -> {
            assertThat(session.getState()).isEqualTo(SessionState.CREATED);
            assertThat(session.getLastError()).isEmpty();
            assertThat(session.callbackSnapshot()).isNull();
            return null;
        });
    }

    @Test
    void concurrentCreatesYieldDistinctHandles() throws Exception {
        int threads = 8;
        int perThread = 250;
        SessionRegistry registry = new SessionRegistry(threads * perThread);
        Set<Long> ids = ConcurrentHashMap.newKeySet();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        ids.add(registry.create());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(ids).hasSize(threads * perThread);
        assertThat(ids).doesNotContain(SessionRegistry.NULL_HANDLE);
    }

    @Test
    void capacityLimitsOpenSessionsAndHandlesAreNotReused() {
        SessionRegistry registry = new SessionRegistry(2);
        long a = registry.create();
        registry.create();

        assertThatThrownBy(registry::create)
                .isInstanceOf(AllocationFailedException.class)
                .hasMessageContaining("maxSessions=2");

        registry.remove(a);
        assertThat(registry.create()).isEqualTo(3L);
    }

    @Test
    void removeIsIdempotent() {
        SessionRegistry registry = new SessionRegistry(4);
        long id = registry.create();

        assertThat(registry.remove(id)).isTrue();
        assertThat(registry.remove(id)).isFalse();
        assertThat(registry.remove(12345L)).isFalse();
        assertThat(registry.remove(SessionRegistry.NULL_HANDLE)).isFalse();
        assertThat(registry.size()).isZero();
    }

    @Test
    void removedOrUnknownHandlesDoNotResolve() {
        SessionRegistry registry = new SessionRegistry(4);
        long id = registry.create();
        registry.remove(id);

        assertThat(registry.acquire(id)).isEmpty();
        assertThat(registry.acquire(SessionRegistry.NULL_HANDLE)).isEmpty();
        assertThatThrownBy(() -> registry.withSession(id, s -> null))
                .isInstanceOf(HandleNotFoundException.class)
                .hasMessage("Handle not found: " + id);
    }

    @Test
    void removeMarksDestroyedAndClearsCallback() {
        SessionRegistry registry = new SessionRegistry(4);
        long id = registry.create();
        VadSession session = registry.acquire(id).orElseThrow();
        session.setCallback(new CallbackRegistration((event, data) -> { }, "user"));

        registry.remove(id);

        assertThat(session.isDestroyed()).isTrue();
        assertThat(session.callbackSnapshot()).isNull();
        registry.release(session);
    }

    @Test
    void engineClosedImmediatelyWhenNotInUse() {
        SessionRegistry registry = new SessionRegistry(4);
        long id = registry.create();
        VadEngine engine = mock(VadEngine.class);
        registry.withSession(id, session -> session.withEngineLock(() -> {
            session.attachEngine(engine);
            return null;
        }));

        registry.remove(id);

        verify(engine, times(1)).close();
    }

    @Test
    void engineClosedByLastHolderAfterConcurrentRemove() {
        SessionRegistry registry = new SessionRegistry(4);
        long id = registry.create();
        VadEngine engine = mock(VadEngine.class);
        VadSession held = registry.acquire(id).orElseThrow();
        held.withEngineLock(() -> {
            held.attachEngine(engine);
            return null;
        });

        registry.remove(id);
        verify(engine, never()).close();
        assertThat(held.getEngine()).isSameAs(engine);

        registry.release(held);
        verify(engine, times(1)).close();
        assertThat(held.getEngine()).isNull();
    }

    @Test
    void withSessionReleasesEvenWhenActionThrows() {
        SessionRegistry registry = new SessionRegistry(4);
        long id = registry.create();
        VadSession session = registry.acquire(id).orElseThrow();
        registry.release(session);

        assertThatThrownBy(() -> registry.withSession(id, s -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(session.refCount()).isEqualTo(1);
    }

    @Test
    void closeRemovesEverySession() {
        SessionRegistry registry = new SessionRegistry(4);
        long a = registry.create();
        long b = registry.create();

        registry.close();

        assertThat(registry.size()).isZero();
        assertThat(registry.acquire(a)).isEmpty();
        assertThat(registry.acquire(b)).isEmpty();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new SessionRegistry(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
