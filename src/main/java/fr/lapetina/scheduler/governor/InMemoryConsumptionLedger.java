package fr.lapetina.scheduler.governor;

import fr.lapetina.scheduler.domain.model.TenantTier;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Ledger keeping one bucket per epoch second in a concurrent skip list.
 * Several replicas in one JVM can share an instance.
 */
public final class InMemoryConsumptionLedger implements ConsumptionLedger {

    private final ConcurrentSkipListMap<Long, SecondBucket> buckets = new ConcurrentSkipListMap<>();

    @Override
    public void recordDispatch(String tenantId, TenantTier tier, Instant at) {
        SecondBucket bucket = bucket(at);
        bucket.dispatches.computeIfAbsent(tenantId, k -> new LongAdder()).increment();
        bucket.tiers.putIfAbsent(tenantId, tier);
        bucket.total.increment();
    }

    @Override
    public void recordCapacity(long credits, Instant at) {
        bucket(at).capacity.add(credits);
    }

    @Override
    public long dispatches(String tenantId, Instant since) {
        long sum = 0;
        for (SecondBucket bucket : window(since).values()) {
            LongAdder count = bucket.dispatches.get(tenantId);
            if (count != null) {
                sum += count.sum();
            }
        }
        return sum;
    }

    @Override
    public long totalDispatches(Instant since) {
        long sum = 0;
        for (SecondBucket bucket : window(since).values()) {
            sum += bucket.total.sum();
        }
        return sum;
    }

    @Override
    public long capacity(Instant since) {
        long sum = 0;
        for (SecondBucket bucket : window(since).values()) {
            sum += bucket.capacity.sum();
        }
        return sum;
    }

    @Override
    public Map<String, TenantTier> tenantsSince(Instant since) {
        Map<String, TenantTier> tenants = new HashMap<>();
        for (SecondBucket bucket : window(since).values()) {
            tenants.putAll(bucket.tiers);
        }
        return tenants;
    }

    @Override
    public void prune(Instant before) {
        buckets.headMap(before.getEpochSecond()).clear();
    }

    int bucketCount() {
        return buckets.size();
    }

    private Map<Long, SecondBucket> window(Instant since) {
        return buckets.tailMap(since.getEpochSecond(), true);
    }

    private SecondBucket bucket(Instant at) {
        return buckets.computeIfAbsent(at.getEpochSecond(), k -> new SecondBucket());
    }

    private static final class SecondBucket {
        private final LongAdder capacity = new LongAdder();
        private final LongAdder total = new LongAdder();
        private final ConcurrentHashMap<String, LongAdder> dispatches = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, TenantTier> tiers = new ConcurrentHashMap<>();
    }
}
