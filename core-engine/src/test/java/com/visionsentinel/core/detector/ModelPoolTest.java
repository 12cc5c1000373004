package com.visionsentinel.core.detector;

import com.visionsentinel.core.error.ErrorKind;
import com.visionsentinel.core.error.SentinelException;
import com.visionsentinel.core.model.Detection;
import com.visionsentinel.core.source.Frame;
import com.visionsentinel.core.support.FakeDetector;
import com.visionsentinel.core.support.TestFrame;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ModelPool}.
 */
class ModelPoolTest {

    @Test
    @DisplayName("Should load a shared model exactly once under concurrent requests")
    void shouldLoadOnceUnderConcurrency() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger loads = new AtomicInteger();
        ModelPool pool = new ModelPool(modelId -> {
            loads.incrementAndGet();
            awaitQuietly(release);
            return new FakeDetector();
        }, PoolMode.SHARED);

        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            List<Future<Detector>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                String session = "cam-" + i;
                futures.add(callers.submit(() -> pool.getDetector("models/person.pt", session)));
            }
            Thread.sleep(100);
            release.countDown();

            Detector first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<Detector> f : futures) {
                assertThat(f.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            callers.shutdownNow();
        }
        assertThat(loads.get()).isEqualTo(1);
        assertThat(pool.size()).isEqualTo(1);
        assertThat(pool.getLoadCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not cache a failed load")
    void shouldRetryAfterFailure() {
        AtomicInteger attempts = new AtomicInteger();
        ModelPool pool = new ModelPool(modelId -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IOException("file not found");
            }
            return new FakeDetector();
        }, PoolMode.SHARED);

        assertThatThrownBy(() -> pool.getDetector("models/fire.pt", "cam-1"))
                .isInstanceOf(SentinelException.class)
                .hasMessageContaining("file not found")
                .satisfies(e -> assertThat(((SentinelException) e).getKind()).isEqualTo(ErrorKind.MODEL_LOAD));
        assertThat(pool.size()).isZero();

        assertThat(pool.getDetector("models/fire.pt", "cam-1")).isNotNull();
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should fail waiting callers and allow a retry when the loader throws an Error")
    void shouldNotHangWhenLoaderThrowsError() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger attempts = new AtomicInteger();
        ModelPool pool = new ModelPool(modelId -> {
            if (attempts.incrementAndGet() == 1) {
                entered.countDown();
                awaitQuietly(release);
                throw new UnsatisfiedLinkError("no native inference backend");
            }
            return new FakeDetector();
        }, PoolMode.SHARED);

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<Detector> loading = callers.submit(() -> pool.getDetector("models/person.pt", "cam-1"));
            entered.await(5, TimeUnit.SECONDS);
            Future<Detector> waiting = callers.submit(() -> pool.getDetector("models/person.pt", "cam-2"));
            Thread.sleep(100);
            release.countDown();

            assertThatThrownBy(() -> loading.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(UnsatisfiedLinkError.class);
            assertThatThrownBy(() -> waiting.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(SentinelException.class)
                    .hasRootCauseInstanceOf(UnsatisfiedLinkError.class);
        } finally {
            callers.shutdownNow();
        }
        assertThat(pool.size()).isZero();

        assertThat(pool.getDetector("models/person.pt", "cam-1")).isNotNull();
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should treat a loader returning null as a load failure")
    void shouldRejectNullDetector() {
        ModelPool pool = new ModelPool(modelId -> null, PoolMode.SHARED);

        assertThatThrownBy(() -> pool.getDetector("models/x.pt", "cam-1"))
                .isInstanceOf(SentinelException.class)
                .hasMessageContaining("loader returned no detector");
    }

    @Test
    @DisplayName("Should give each session its own instance in dedicated mode and close it on release")
    void shouldIsolateDedicatedInstances() {
        List<FakeDetector> created = new ArrayList<>();
        ModelPool pool = new ModelPool(modelId -> {
            FakeDetector d = new FakeDetector();
            created.add(d);
            return d;
        }, PoolMode.DEDICATED);

        Detector a = pool.getDetector("models/person.pt", "cam-1");
        Detector b = pool.getDetector("models/person.pt", "cam-2");
        Detector again = pool.getDetector("models/person.pt", "cam-1");

        assertThat(a).isNotSameAs(b).isSameAs(again);
        assertThat(pool.size()).isEqualTo(2);

        pool.release("models/person.pt", "cam-1");

        assertThat(created.get(0).isClosed()).isTrue();
        assertThat(created.get(1).isClosed()).isFalse();
        assertThat(pool.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep shared instances on release and close them with the pool")
    void shouldKeepSharedInstancesUntilClose() {
        FakeDetector backing = new FakeDetector();
        ModelPool pool = new ModelPool(modelId -> backing, PoolMode.SHARED);
        pool.getDetector("models/person.pt", "cam-1");

        pool.release("models/person.pt", "cam-1");
        assertThat(backing.isClosed()).isFalse();
        assertThat(pool.size()).isEqualTo(1);

        pool.close();
        assertThat(backing.isClosed()).isTrue();
        assertThat(pool.size()).isZero();
    }

    @Test
    @DisplayName("Should serialize inference on a shared instance")
    void shouldSerializeSharedInference() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        FakeDetector backing = new FakeDetector().respondWith((Frame frame) -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            sleepQuietly(5);
            inFlight.decrementAndGet();
            return List.<Detection>of();
        });
        ModelPool pool = new ModelPool(modelId -> backing, PoolMode.SHARED);
        Detector shared = pool.getDetector("models/person.pt", "cam-1");

        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(callers.submit(() -> {
                    for (int j = 0; j < 5; j++) {
                        shared.infer(TestFrame.vga(), 0.5, 0.45, 640);
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            callers.shutdownNow();
        }
        assertThat(maxInFlight.get()).isEqualTo(1);
        assertThat(backing.calls()).isEqualTo(20);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
