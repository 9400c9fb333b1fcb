package fr.lapetina.scheduler.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Terminal outcome delivered to the caller of a queued request.
 * Immutable and thread-safe.
 *
 * @param queueWait time spent queued, from arrival to dispatch (or to the terminal decision)
 */
public record SchedulingOutcome(
        String requestId,
        String tenantId,
        TenantTier tier,
        RequestStatus status,
        PipelineResult result,
        ErrorType errorType,
        String errorMessage,
        Duration queueWait,
        Instant resolvedAt
) {
    public boolean isSuccess() {
        return errorType == null;
    }

    public static SchedulingOutcome completed(ScheduledRequest request, PipelineResult result, Instant at) {
        return new SchedulingOutcome(
                request.requestId(), request.tenantId(), request.tier(),
                RequestStatus.COMPLETED, result, null, null,
                queueWaitOf(request, at), at
        );
    }

    public static SchedulingOutcome failed(ScheduledRequest request, String message, Instant at) {
        return new SchedulingOutcome(
                request.requestId(), request.tenantId(), request.tier(),
                RequestStatus.FAILED, null, ErrorType.DISPATCH_FAILURE, message,
                queueWaitOf(request, at), at
        );
    }

    public static SchedulingOutcome timedOut(ScheduledRequest request, Instant at) {
        return new SchedulingOutcome(
                request.requestId(), request.tenantId(), request.tier(),
                RequestStatus.TIMED_OUT, null, ErrorType.QUEUE_TIMEOUT,
                "Queued past deadline " + request.deadline(),
                request.waitedUntil(at), at
        );
    }

    public static SchedulingOutcome cancelled(ScheduledRequest request, Instant at) {
        return cancelled(request, "Cancelled by caller", at);
    }

    public static SchedulingOutcome cancelled(ScheduledRequest request, String message, Instant at) {
        return new SchedulingOutcome(
                request.requestId(), request.tenantId(), request.tier(),
                RequestStatus.CANCELLED, null, ErrorType.CANCELLED, message,
                request.waitedUntil(at), at
        );
    }

    private static Duration queueWaitOf(ScheduledRequest request, Instant fallback) {
        Instant dispatchedAt = request.dispatchedAt();
        return request.waitedUntil(dispatchedAt != null ? dispatchedAt : fallback);
    }
}
