package fr.lapetina.scheduler.dlq;

import fr.lapetina.scheduler.domain.model.DlqEntry;
import fr.lapetina.scheduler.domain.model.ErrorType;
import fr.lapetina.scheduler.domain.model.RequestStatus;
import fr.lapetina.scheduler.domain.model.ScheduledRequest;
import fr.lapetina.scheduler.domain.model.SchedulingOutcome;
import fr.lapetina.scheduler.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.scheduler.queue.GlobalPriorityQueue;
import fr.lapetina.scheduler.queue.LocalClaimBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves requests that waited past their deadline without being dispatched.
 *
 * Runs once per tick before allocation. Dispatched requests are never touched: worker-side
 * timeouts belong to the pipeline.
 */
public final class DeadLetterHandler {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterHandler.class);

    private final GlobalPriorityQueue queue;
    private final LocalClaimBuffer localBuffer;
    private final DeadLetterQueue deadLetterQueue;
    private final MetricsRegistry metrics;

    public DeadLetterHandler(
            GlobalPriorityQueue queue,
            LocalClaimBuffer localBuffer,
            DeadLetterQueue deadLetterQueue,
            MetricsRegistry metrics
    ) {
        this.queue = queue;
        this.localBuffer = localBuffer;
        this.deadLetterQueue = deadLetterQueue;
        this.metrics = metrics;
    }

    /**
     * Removes every expired request from the global queue and this replica's claim buffer.
     *
     * @return the DLQ entries written by this scan
     */
    public List<DlqEntry> scanAndExpire(Instant now) {
        List<ScheduledRequest> expired = new ArrayList<>(queue.removeExpired(now));
        expired.addAll(localBuffer.removeExpired(now));

        List<DlqEntry> entries = new ArrayList<>();
        for (ScheduledRequest request : expired) {
            expire(request, now).ifPresent(entries::add);
        }
        if (!entries.isEmpty()) {
            log.warn("Expired requests moved to DLQ: count={}, dlqSize={}", entries.size(), deadLetterQueue.size());
        }
        return entries;
    }

    /**
     * Terminates a request the caller of this method already removed from the queue.
     *
     * @return the DLQ entry, empty if the request already left the QUEUED status
     */
    public Optional<DlqEntry> expire(ScheduledRequest request, Instant now) {
        if (!request.transition(RequestStatus.QUEUED, RequestStatus.TIMED_OUT)) {
            log.debug("Expiry skipped, request no longer queued: requestId={}, status={}",
                    request.requestId(), request.status());
            return Optional.empty();
        }

        Duration deadlineWindow = Duration.between(request.arrivalTimestamp(), request.deadline());
        DlqEntry entry = new DlqEntry(
                request.snapshot(),
                "Queued longer than " + deadlineWindow.toMillis() + "ms without dispatch",
                now
        );
        deadLetterQueue.append(entry);
        request.resolve(SchedulingOutcome.timedOut(request, now));

        metrics.incrementRejection(ErrorType.QUEUE_TIMEOUT);
        metrics.incrementOutcome(request.tier(), RequestStatus.TIMED_OUT);
        metrics.recordQueueWait(request.tier(), request.waitedUntil(now));

        log.warn("Request timed out: requestId={}, tenantId={}, tier={}, waited={}ms",
                request.requestId(), request.tenantId(), request.tier(), request.waitedUntil(now).toMillis());
        return Optional.of(entry);
    }
}
