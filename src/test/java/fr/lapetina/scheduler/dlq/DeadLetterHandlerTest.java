package fr.lapetina.scheduler.dlq;

import fr.lapetina.scheduler.domain.model.DlqEntry;
import fr.lapetina.scheduler.domain.model.ErrorType;
import fr.lapetina.scheduler.domain.model.RequestStatus;
import fr.lapetina.scheduler.domain.model.ScheduledRequest;
import fr.lapetina.scheduler.domain.model.SchedulingOutcome;
import fr.lapetina.scheduler.domain.model.TenantQuery;
import fr.lapetina.scheduler.domain.model.TenantTier;
import fr.lapetina.scheduler.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.scheduler.queue.GlobalPriorityQueue;
import fr.lapetina.scheduler.queue.InMemoryQueueStore;
import fr.lapetina.scheduler.queue.LocalClaimBuffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DeadLetterHandlerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private GlobalPriorityQueue queue;
    private LocalClaimBuffer buffer;
    private DeadLetterQueue dlq;
    private MetricsRegistry metrics;
    private DeadLetterHandler handler;

    @BeforeEach
    void setUp() {
        queue = new GlobalPriorityQueue(new InMemoryQueueStore(), () -> 100);
        buffer = new LocalClaimBuffer(4);
        dlq = new DeadLetterQueue(10);
        metrics = new MetricsRegistry("dlq_test");
        handler = new DeadLetterHandler(queue, buffer, dlq, metrics);
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    private ScheduledRequest enqueue(String tenantId, Instant arrival) {
        ScheduledRequest request = ScheduledRequest.admit(
                TenantQuery.of(tenantId, TenantTier.STARTER, Map.of("q", "x")),
                arrival, Duration.ofSeconds(30), queue.nextSequence());
        queue.enqueue(request);
        return request;
    }

    @Test
    @DisplayName("a request queued past its 30s deadline should land in the DLQ exactly once")
    void expiredRequestShouldLandInDlq() {
        ScheduledRequest request = enqueue("acme", T0);

        assertThat(handler.scanAndExpire(T0.plusSeconds(30))).isEmpty();

        List<DlqEntry> entries = handler.scanAndExpire(T0.plusSeconds(31));
        List<DlqEntry> again = handler.scanAndExpire(T0.plusSeconds(32));

        assertThat(entries).hasSize(1);
        assertThat(again).isEmpty();
        assertThat(dlq.size()).isEqualTo(1);
        assertThat(entries.get(0).request().requestId()).isEqualTo(request.requestId());
        assertThat(entries.get(0).recordedAt()).isEqualTo(T0.plusSeconds(31));
        assertThat(request.status()).isEqualTo(RequestStatus.TIMED_OUT);
        assertThat(queue.size()).isZero();

        SchedulingOutcome outcome = request.outcome().getNow(null);
        assertThat(outcome).isNotNull();
        assertThat(outcome.errorType()).isEqualTo(ErrorType.QUEUE_TIMEOUT);
        assertThat(outcome.queueWait()).isEqualTo(Duration.ofSeconds(31));
        assertThat(metrics.scrape()).contains("dlq_test_rejections_total{reason=\"timed_out\"");
    }

    @Test
    @DisplayName("expired claims in the local buffer should be expired as well")
    void expiredClaimsShouldExpire() {
        ScheduledRequest request = enqueue("acme", T0);
        queue.dequeueForTier(TenantTier.STARTER, 1);
        buffer.offer(request);

        List<DlqEntry> entries = handler.scanAndExpire(T0.plusSeconds(31));

        assertThat(entries).hasSize(1);
        assertThat(buffer.size()).isZero();
    }

    @Test
    @DisplayName("a claimed request cancelled before its deadline should leave the buffer without a DLQ entry")
    void cancelledClaimShouldNotEnterDlq() {
        ScheduledRequest request = enqueue("acme", T0);
        queue.dequeueForTier(TenantTier.STARTER, 1);
        buffer.offer(request);
        request.transition(RequestStatus.QUEUED, RequestStatus.CANCELLED);
        request.resolve(SchedulingOutcome.cancelled(request, T0.plusSeconds(1)));

        assertThat(handler.scanAndExpire(T0.plusSeconds(31))).isEmpty();

        assertThat(buffer.size()).isZero();
        assertThat(request.status()).isEqualTo(RequestStatus.CANCELLED);
        assertThat(request.outcome().getNow(null).errorType()).isEqualTo(ErrorType.CANCELLED);
        assertThat(dlq.size()).isZero();
    }

    @Test
    @DisplayName("a request that is no longer queued should be left alone")
    void dispatchedRequestShouldBeSkipped() {
        ScheduledRequest request = enqueue("acme", T0);
        queue.dequeueForTier(TenantTier.STARTER, 1);
        request.markDispatched(T0.plusSeconds(1));

        assertThat(handler.expire(request, T0.plusSeconds(60))).isEmpty();
        assertThat(request.status()).isEqualTo(RequestStatus.DISPATCHED);
        assertThat(request.outcome()).isNotDone();
    }
}
