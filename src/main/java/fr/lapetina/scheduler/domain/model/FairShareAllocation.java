package fr.lapetina.scheduler.domain.model;

import java.time.Instant;

/**
 * Credits granted to and consumed by one tier during one scheduling tick.
 */
public record FairShareAllocation(
        TenantTier tier,
        int creditsGranted,
        int creditsConsumed,
        Instant tickTimestamp
) {
    public double utilization() {
        return creditsGranted == 0 ? 0.0 : (double) creditsConsumed / creditsGranted;
    }
}
