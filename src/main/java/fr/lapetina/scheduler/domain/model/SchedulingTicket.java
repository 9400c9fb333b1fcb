package fr.lapetina.scheduler.domain.model;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Handle returned to the caller once a query is admitted and queued.
 * The future completes normally with the terminal outcome.
 */
public record SchedulingTicket(
        String requestId,
        String tenantId,
        TenantTier tier,
        Instant deadline,
        CompletableFuture<SchedulingOutcome> outcome
) {
    public static SchedulingTicket of(ScheduledRequest request) {
        return new SchedulingTicket(
                request.requestId(),
                request.tenantId(),
                request.tier(),
                request.deadline(),
                request.outcome()
        );
    }
}
