package fr.lapetina.scheduler.governor;

import fr.lapetina.scheduler.domain.model.TenantTier;

import java.time.Instant;
import java.util.Map;

/**
 * Shared, per-second bucketed record of dispatches and granted capacity, read by the
 * noisy-neighbor governor over a sliding window.
 */
public interface ConsumptionLedger {

    void recordDispatch(String tenantId, TenantTier tier, Instant at);

    /**
     * Records the dispatch credits one replica offered during one tick.
     */
    void recordCapacity(long credits, Instant at);

    long dispatches(String tenantId, Instant since);

    long totalDispatches(Instant since);

    long capacity(Instant since);

    /**
     * Tenants with at least one dispatch since the instant, with their tier.
     */
    Map<String, TenantTier> tenantsSince(Instant since);

    /**
     * Drops buckets strictly older than the instant.
     */
    void prune(Instant before);
}
