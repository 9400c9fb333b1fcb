package fr.lapetina.scheduler.domain.model;

import java.util.Objects;

/**
 * Configured scheduling policy of one tier.
 *
 * @param tier             the tier this policy applies to
 * @param fairSharePercent target share of dispatch capacity under contention
 * @param hardCapPercent   ceiling for any single tick (tier) and any single tenant (governor)
 * @param sustainedRate    token refill rate in tokens per second
 * @param burstCapacity    maximum number of tokens a bucket may hold
 */
public record TierPolicy(
        TenantTier tier,
        int fairSharePercent,
        int hardCapPercent,
        double sustainedRate,
        long burstCapacity
) {
    public TierPolicy {
        Objects.requireNonNull(tier, "Tier is required");
        if (fairSharePercent < 0 || fairSharePercent > 100) {
            throw new IllegalArgumentException(tier + ": fairSharePercent must be within [0, 100]");
        }
        if (hardCapPercent < fairSharePercent || hardCapPercent > 100) {
            throw new IllegalArgumentException(tier + ": hardCapPercent must be within [fairSharePercent, 100]");
        }
        if (!(sustainedRate > 0.0)) {
            throw new IllegalArgumentException(tier + ": sustainedRate must be > 0");
        }
        if (burstCapacity < 1) {
            throw new IllegalArgumentException(tier + ": burstCapacity must be >= 1");
        }
    }
}
