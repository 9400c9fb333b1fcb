package fr.lapetina.scheduler.domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable set of tier policies covering every {@link TenantTier}.
 *
 * Invariant: fair shares sum to exactly 100.
 */
public final class TierPolicies {

    private final Map<TenantTier, TierPolicy> policies;

    private TierPolicies(Map<TenantTier, TierPolicy> policies) {
        this.policies = Collections.unmodifiableMap(policies);
    }

    public static TierPolicies of(Collection<TierPolicy> policies) {
        EnumMap<TenantTier, TierPolicy> byTier = new EnumMap<>(TenantTier.class);
        for (TierPolicy policy : policies) {
            if (byTier.put(policy.tier(), policy) != null) {
                throw new IllegalArgumentException("Duplicate policy for tier " + policy.tier());
            }
        }
        for (TenantTier tier : TenantTier.values()) {
            if (!byTier.containsKey(tier)) {
                throw new IllegalArgumentException("Missing policy for tier " + tier);
            }
        }
        int shareSum = byTier.values().stream().mapToInt(TierPolicy::fairSharePercent).sum();
        if (shareSum != 100) {
            throw new IllegalArgumentException("Fair shares must sum to 100 but sum to " + shareSum);
        }
        return new TierPolicies(byTier);
    }

    /**
     * 50/30/15/5 split with caps and rates matching the shipped config.yaml.
     */
    public static TierPolicies defaults() {
        return of(java.util.List.of(
                new TierPolicy(TenantTier.ENTERPRISE, 50, 60, 100, 200),
                new TierPolicy(TenantTier.PROFESSIONAL, 30, 40, 50, 100),
                new TierPolicy(TenantTier.STARTER, 15, 25, 20, 40),
                new TierPolicy(TenantTier.FREE, 5, 10, 5, 10)
        ));
    }

    public TierPolicy get(TenantTier tier) {
        return policies.get(tier);
    }

    public Collection<TierPolicy> all() {
        return policies.values();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return policies.equals(((TierPolicies) o).policies);
    }

    @Override
    public int hashCode() {
        return policies.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TierPolicies{");
        policies.values().forEach(p -> sb.append(p.tier()).append('=')
                .append(p.fairSharePercent()).append('/').append(p.hardCapPercent()).append(' '));
        return sb.append('}').toString();
    }
}
