package fr.lapetina.scheduler.admission;

import fr.lapetina.scheduler.domain.model.AdmitResult;
import fr.lapetina.scheduler.domain.model.ErrorType;
import fr.lapetina.scheduler.domain.model.RequestStatus;
import fr.lapetina.scheduler.domain.model.ScheduledRequest;
import fr.lapetina.scheduler.domain.model.SchedulingOutcome;
import fr.lapetina.scheduler.domain.model.TenantQuery;
import fr.lapetina.scheduler.exception.AdmissionRejectedException;
import fr.lapetina.scheduler.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.scheduler.limiter.TokenBucketLimiter;
import fr.lapetina.scheduler.queue.GlobalPriorityQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Synchronous front door of a replica: validates the query, takes a token, and enqueues.
 *
 * Every rejection is immediate and thrown as {@link AdmissionRejectedException}; a
 * rejected query never occupies queue space. Admitted requests are tracked until they
 * reach a terminal status so the caller can cancel them.
 */
public final class AdmissionController {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    static final int MAX_TENANT_ID_LENGTH = 256;

    private final TokenBucketLimiter limiter;
    private final GlobalPriorityQueue queue;
    private final Supplier<Duration> maxQueueWait;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private final ConcurrentHashMap<String, ScheduledRequest> pending = new ConcurrentHashMap<>();

    public AdmissionController(
            TokenBucketLimiter limiter,
            GlobalPriorityQueue queue,
            Supplier<Duration> maxQueueWait,
            MetricsRegistry metrics,
            Clock clock
    ) {
        this.limiter = limiter;
        this.queue = queue;
        this.maxQueueWait = maxQueueWait;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Admits and enqueues a query.
     *
     * @return the queued request
     * @throws AdmissionRejectedException if the query is malformed, the tenant has no token,
     *                                    or the queue is full
     */
    public ScheduledRequest admit(TenantQuery query) {
        validate(query);

        AdmitResult decision = limiter.admit(query.tenantId(), query.tier());
        if (!decision.allowed()) {
            metrics.incrementRejection(decision.reason());
            log.warn("Admission rejected: tenantId={}, tier={}, reason={}, retryAfterMs={}",
                    query.tenantId(), query.tier(), decision.reason(), decision.retryAfter().toMillis());
            throw new AdmissionRejectedException(decision.reason(), decision.retryAfter(),
                    "tenant " + query.tenantId() + " has no token available");
        }

        Instant now = clock.instant();
        ScheduledRequest request = ScheduledRequest.admit(query, now, maxQueueWait.get(), queue.nextSequence());
        pending.put(request.requestId(), request);
        request.outcome().whenComplete((outcome, error) -> pending.remove(request.requestId()));

        try {
            queue.enqueue(request);
        } catch (AdmissionRejectedException e) {
            pending.remove(request.requestId());
            metrics.incrementRejection(e.getReason());
            metrics.incrementOutcome(request.tier(), RequestStatus.REJECTED);
            throw e;
        }

        log.debug("Request admitted: requestId={}, tenantId={}, tier={}, tokensRemaining={}",
                request.requestId(), request.tenantId(), request.tier(), decision.tokensRemaining());
        return request;
    }

    private void validate(TenantQuery query) {
        String reason = null;
        if (query == null) {
            reason = "Query is null";
        } else if (query.tenantId() == null || query.tenantId().isBlank()) {
            reason = "Tenant ID is required";
        } else if (query.tenantId().length() > MAX_TENANT_ID_LENGTH) {
            reason = "Tenant ID exceeds maximum length of " + MAX_TENANT_ID_LENGTH;
        }
        if (reason != null) {
            metrics.incrementRejection(ErrorType.VALIDATION_ERROR);
            log.warn("Validation failed: tenantId={}, reason={}",
                    query != null ? query.tenantId() : "null", reason);
            throw new AdmissionRejectedException(ErrorType.VALIDATION_ERROR, reason);
        }
    }

    /**
     * Cancels a request that has not been dispatched yet. The QUEUED to CANCELLED transition
     * races the dispatcher's own transition, so exactly one of them wins. A request already
     * claimed into a replica buffer stays there until the dispatcher drops it.
     *
     * @return true if this call moved the request to CANCELLED
     */
    public boolean cancel(String requestId) {
        ScheduledRequest request = pending.get(requestId);
        if (request == null || !request.transition(RequestStatus.QUEUED, RequestStatus.CANCELLED)) {
            return false;
        }
        boolean inQueue = queue.remove(requestId) != null;
        request.resolve(SchedulingOutcome.cancelled(request, clock.instant()));
        metrics.incrementOutcome(request.tier(), RequestStatus.CANCELLED);
        log.info("Request cancelled: requestId={}, tenantId={}, inQueue={}", requestId, request.tenantId(), inQueue);
        return true;
    }

    /**
     * Withdraws every request admitted here that is still waiting for a slot. Used on
     * shutdown, once claimed work is back in the global queue: the callers' futures live in
     * this process, so their requests leave the queue with a CANCELLED outcome.
     *
     * @return number of requests withdrawn
     */
    public int withdrawPending(String reason) {
        Instant now = clock.instant();
        int withdrawn = 0;
        for (ScheduledRequest request : pending.values()) {
            if (!request.transition(RequestStatus.QUEUED, RequestStatus.CANCELLED)) {
                continue;
            }
            queue.remove(request.requestId());
            request.resolve(SchedulingOutcome.cancelled(request, reason, now));
            metrics.incrementOutcome(request.tier(), RequestStatus.CANCELLED);
            withdrawn++;
        }
        if (withdrawn > 0) {
            log.info("Withdrew waiting requests: count={}, reason={}", withdrawn, reason);
        }
        return withdrawn;
    }

    public int pendingCount() {
        return pending.size();
    }
}
