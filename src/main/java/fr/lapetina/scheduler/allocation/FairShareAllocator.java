package fr.lapetina.scheduler.allocation;

import fr.lapetina.scheduler.domain.model.TenantTier;
import fr.lapetina.scheduler.domain.model.TierPolicies;
import fr.lapetina.scheduler.domain.model.TierPolicy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Pure per-tick credit computation. No I/O, no clock, no shared state.
 *
 * <ol>
 *   <li>Each backlogged tier gets {@code floor(capacity * share / 100)}, never more than its
 *       depth and never less than one credit.</li>
 *   <li>If the one-credit floors overshoot the capacity, credits are taken back one at a
 *       time from the largest grant above one. Starvation freedom wins over the bound.</li>
 *   <li>Leftover capacity is water-filled proportionally to fair share over tiers that still
 *       have backlog and room under their ceiling, highest share first, ties by rank.</li>
 * </ol>
 */
public final class FairShareAllocator {

    private final TierPolicies policies;
    private final RedistributionPolicy redistribution;

    public FairShareAllocator(TierPolicies policies, RedistributionPolicy redistribution) {
        this.policies = policies;
        this.redistribution = redistribution;
    }

    public TierPolicies policies() {
        return policies;
    }

    public RedistributionPolicy redistribution() {
        return redistribution;
    }

    /**
     * @param depths   observed backlog per tier; missing tiers count as empty
     * @param capacity dispatch credits available this tick
     * @return credits per tier, every tier present
     */
    public Map<TenantTier, Integer> computeAllocation(Map<TenantTier, Integer> depths, int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must be >= 0");
        }
        Map<TenantTier, Integer> grants = new EnumMap<>(TenantTier.class);
        List<TenantTier> backlogged = new ArrayList<>();
        for (TenantTier tier : TenantTier.values()) {
            grants.put(tier, 0);
            if (depthOf(depths, tier) > 0) {
                backlogged.add(tier);
            }
        }
        if (backlogged.isEmpty() || capacity == 0) {
            return grants;
        }

        int total = 0;
        for (TenantTier tier : backlogged) {
            int base = (int) ((long) capacity * share(tier) / 100);
            int grant = Math.max(1, Math.min(base, depthOf(depths, tier)));
            grants.put(tier, grant);
            total += grant;
        }

        while (total > capacity) {
            TenantTier largest = null;
            for (TenantTier tier : backlogged) {
                int grant = grants.get(tier);
                // ties go to the lower-priority tier
                if (grant > 1 && (largest == null || grant >= grants.get(largest))) {
                    largest = tier;
                }
            }
            if (largest == null) {
                break;
            }
            grants.merge(largest, -1, Integer::sum);
            total--;
        }

        int leftover = capacity - total;
        while (leftover > 0) {
            List<TenantTier> eligible = new ArrayList<>();
            long shareSum = 0;
            for (TenantTier tier : backlogged) {
                if (room(tier, grants, depths, capacity) > 0) {
                    eligible.add(tier);
                    shareSum += share(tier);
                }
            }
            if (eligible.isEmpty()) {
                break;
            }
            eligible.sort(Comparator.comparingInt(this::share).reversed()
                    .thenComparingInt(TenantTier::rank));

            int distributed = 0;
            if (shareSum > 0) {
                for (TenantTier tier : eligible) {
                    int portion = (int) ((long) leftover * share(tier) / shareSum);
                    int give = Math.min(portion, room(tier, grants, depths, capacity));
                    grants.merge(tier, give, Integer::sum);
                    distributed += give;
                }
            }
            for (TenantTier tier : eligible) {
                if (distributed >= leftover) {
                    break;
                }
                if (room(tier, grants, depths, capacity) > 0) {
                    grants.merge(tier, 1, Integer::sum);
                    distributed++;
                }
            }
            if (distributed == 0) {
                break;
            }
            leftover -= distributed;
        }
        return grants;
    }

    /**
     * Most credits a tier can hold in one tick under the configured redistribution policy.
     */
    public int ceiling(TenantTier tier, int capacity) {
        if (redistribution == RedistributionPolicy.WORK_CONSERVING) {
            return capacity;
        }
        TierPolicy policy = policies.get(tier);
        return Math.max(1, (int) ((long) capacity * policy.hardCapPercent() / 100));
    }

    private int room(TenantTier tier, Map<TenantTier, Integer> grants, Map<TenantTier, Integer> depths, int capacity) {
        int limit = Math.min(depthOf(depths, tier), ceiling(tier, capacity));
        return Math.max(0, limit - grants.get(tier));
    }

    private int share(TenantTier tier) {
        return policies.get(tier).fairSharePercent();
    }

    private static int depthOf(Map<TenantTier, Integer> depths, TenantTier tier) {
        Integer depth = depths.get(tier);
        return depth != null ? depth : 0;
    }
}
