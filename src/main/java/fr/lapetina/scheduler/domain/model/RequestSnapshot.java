package fr.lapetina.scheduler.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable copy of a {@link ScheduledRequest} taken at a point in time.
 */
public record RequestSnapshot(
        String requestId,
        String tenantId,
        TenantTier tier,
        Instant arrivalTimestamp,
        Instant deadline,
        RequestStatus status,
        Map<String, Object> payload
) {
}
