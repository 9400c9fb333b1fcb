package fr.lapetina.scheduler.worker;

import fr.lapetina.scheduler.domain.model.ErrorType;
import fr.lapetina.scheduler.domain.model.RequestStatus;
import fr.lapetina.scheduler.domain.model.ScheduledRequest;
import fr.lapetina.scheduler.domain.model.SchedulingOutcome;
import fr.lapetina.scheduler.domain.model.TenantQuery;
import fr.lapetina.scheduler.domain.model.TenantTier;
import fr.lapetina.scheduler.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.scheduler.support.MutableClock;
import fr.lapetina.scheduler.support.StubRagPipeline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class LocalWorkerPoolTest {

    private MutableClock clock;
    private StubRagPipeline rag;
    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        rag = new StubRagPipeline();
        metrics = new MetricsRegistry("pool_test");
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    private ScheduledRequest request(String tenantId) {
        return ScheduledRequest.admit(TenantQuery.of(tenantId, TenantTier.PROFESSIONAL, Map.of()),
                clock.instant(), Duration.ofSeconds(30), 1);
    }

    @Test
    @DisplayName("concurrent dispatches should never exceed the slot count")
    void shouldBoundConcurrency() throws Exception {
        rag.setMode(StubRagPipeline.Mode.HOLD);
        LocalWorkerPool pool = new LocalWorkerPool(3, rag, metrics, clock);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> attempts = new ArrayList<>();
        try {
            for (int i = 0; i < 20; i++) {
                ScheduledRequest request = request("t" + i);
                attempts.add(executor.submit(() -> {
                    start.await();
                    return pool.dispatch(request);
                }));
            }
            start.countDown();
            int accepted = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(5, TimeUnit.SECONDS)) {
                    accepted++;
                }
            }

            assertThat(accepted).isEqualTo(3);
            assertThat(pool.busySlots()).isEqualTo(3);
            assertThat(pool.isOverloaded()).isTrue();
            assertThat(rag.maxInFlight()).isEqualTo(3);
            assertThat(pool.inFlightRequestIds()).hasSize(3);
        } finally {
            executor.shutdownNow();
            rag.releaseAll();
        }
        assertThat(pool.busySlots()).isZero();
    }

    @Test
    @DisplayName("a completed call should free the slot and notify listeners")
    void completionShouldFreeSlot() {
        rag.setMode(StubRagPipeline.Mode.HOLD);
        LocalWorkerPool pool = new LocalWorkerPool(1, rag, metrics, clock);
        List<String> released = new CopyOnWriteArrayList<>();
        pool.addListener(released::add);
        ScheduledRequest request = request("acme");

        assertThat(pool.dispatch(request)).isTrue();
        assertThat(pool.dispatch(request("other"))).isFalse();
        assertThat(request.status()).isEqualTo(RequestStatus.DISPATCHED);

        clock.advanceMillis(250);
        rag.release(request.requestId());

        SchedulingOutcome outcome = request.outcome().getNow(null);
        assertThat(outcome.status()).isEqualTo(RequestStatus.COMPLETED);
        assertThat(outcome.result()).isNotNull();
        assertThat(pool.freeSlots()).isEqualTo(1);
        assertThat(released).containsExactly(request.requestId());
    }

    @Test
    @DisplayName("a failed pipeline call should resolve as a dispatch failure")
    void failureShouldResolveAsDispatchFailure() {
        rag.setMode(StubRagPipeline.Mode.FAIL);
        LocalWorkerPool pool = new LocalWorkerPool(2, rag, metrics, clock);
        ScheduledRequest request = request("acme");

        assertThat(pool.dispatch(request)).isTrue();

        SchedulingOutcome outcome = request.outcome().getNow(null);
        assertThat(outcome.status()).isEqualTo(RequestStatus.FAILED);
        assertThat(outcome.errorType()).isEqualTo(ErrorType.DISPATCH_FAILURE);
        assertThat(outcome.errorMessage()).isEqualTo("pipeline unavailable");
        assertThat(pool.busySlots()).isZero();
    }

    @Test
    @DisplayName("a request that left QUEUED should not take a slot")
    void nonQueuedRequestShouldBeRefused() {
        LocalWorkerPool pool = new LocalWorkerPool(1, rag, metrics, clock);
        ScheduledRequest request = request("acme");
        request.transition(RequestStatus.QUEUED, RequestStatus.CANCELLED);

        assertThat(pool.dispatch(request)).isFalse();
        assertThat(pool.freeSlots()).isEqualTo(1);
        assertThat(rag.executed()).isEmpty();
    }

    @Test
    @DisplayName("awaitIdle should return once held calls complete")
    void awaitIdleShouldReturnWhenIdle() throws Exception {
        rag.setMode(StubRagPipeline.Mode.HOLD);
        LocalWorkerPool pool = new LocalWorkerPool(2, rag, metrics, clock);
        pool.dispatch(request("a"));

        assertThat(pool.awaitIdle(Duration.ofMillis(50))).isFalse();

        rag.releaseAll();
        assertThat(pool.awaitIdle(Duration.ofSeconds(1))).isTrue();
    }
}
