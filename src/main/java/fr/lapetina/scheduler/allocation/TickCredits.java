package fr.lapetina.scheduler.allocation;

import fr.lapetina.scheduler.domain.model.FairShareAllocation;
import fr.lapetina.scheduler.domain.model.TenantTier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Credits of one scheduling tick on this replica.
 *
 * Grants are fixed when the tick opens; consumption is counted as requests are claimed.
 * Unused credits are dropped when the next tick replaces this one.
 */
public final class TickCredits {

    private final Instant tickTimestamp;
    private final int capacity;
    private final Map<TenantTier, Integer> granted;
    private final Map<TenantTier, AtomicInteger> consumed = new EnumMap<>(TenantTier.class);
    private final ConcurrentHashMap<String, AtomicInteger> tenantClaims = new ConcurrentHashMap<>();

    public TickCredits(Instant tickTimestamp, int capacity, Map<TenantTier, Integer> granted) {
        this.tickTimestamp = tickTimestamp;
        this.capacity = capacity;
        Map<TenantTier, Integer> copy = new EnumMap<>(TenantTier.class);
        for (TenantTier tier : TenantTier.values()) {
            Integer value = granted.get(tier);
            copy.put(tier, value != null ? value : 0);
            consumed.put(tier, new AtomicInteger(0));
        }
        this.granted = Collections.unmodifiableMap(copy);
    }

    /**
     * Credits placeholder used before the first tick: nothing may be claimed.
     */
    public static TickCredits none(Instant now) {
        return new TickCredits(now, 0, Map.of());
    }

    public Instant tickTimestamp() {
        return tickTimestamp;
    }

    public int capacity() {
        return capacity;
    }

    public int granted(TenantTier tier) {
        return granted.get(tier);
    }

    public int consumed(TenantTier tier) {
        return consumed.get(tier).get();
    }

    public int remaining(TenantTier tier) {
        return granted(tier) - consumed(tier);
    }

    public int totalGranted() {
        return granted.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int totalConsumed() {
        int total = 0;
        for (AtomicInteger count : consumed.values()) {
            total += count.get();
        }
        return total;
    }

    /**
     * Takes one credit of the tier.
     * @return false if the tier has no credit left this tick
     */
    public boolean tryConsume(TenantTier tier) {
        AtomicInteger count = consumed.get(tier);
        int limit = granted(tier);
        while (true) {
            int current = count.get();
            if (current >= limit) {
                return false;
            }
            if (count.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Returns a credit taken by {@link #tryConsume} that did not lead to a claim.
     */
    public void refund(TenantTier tier) {
        consumed.get(tier).updateAndGet(c -> Math.max(0, c - 1));
    }

    public void recordTenantClaim(String tenantId) {
        tenantClaims.computeIfAbsent(tenantId, k -> new AtomicInteger()).incrementAndGet();
    }

    public int tenantClaims(String tenantId) {
        AtomicInteger count = tenantClaims.get(tenantId);
        return count != null ? count.get() : 0;
    }

    /**
     * Picks the tier that should draw the next credit: the lowest consumed/granted ratio
     * among tiers with credit left, ties broken by rank.
     */
    public Optional<TenantTier> nextTier(Collection<TenantTier> excluded) {
        TenantTier best = null;
        for (TenantTier tier : TenantTier.values()) {
            if (excluded.contains(tier) || remaining(tier) <= 0) {
                continue;
            }
            if (best == null) {
                best = tier;
                continue;
            }
            // consumed(t)/granted(t) < consumed(best)/granted(best), cross-multiplied
            long lhs = (long) consumed(tier) * granted(best);
            long rhs = (long) consumed(best) * granted(tier);
            if (lhs < rhs) {
                best = tier;
            }
        }
        return Optional.ofNullable(best);
    }

    public List<FairShareAllocation> toAllocations() {
        List<FairShareAllocation> allocations = new ArrayList<>();
        for (TenantTier tier : TenantTier.values()) {
            allocations.add(new FairShareAllocation(tier, granted(tier), consumed(tier), tickTimestamp));
        }
        return allocations;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TickCredits{at=").append(tickTimestamp);
        for (TenantTier tier : TenantTier.values()) {
            sb.append(", ").append(tier).append('=').append(consumed(tier)).append('/').append(granted(tier));
        }
        return sb.append('}').toString();
    }
}
