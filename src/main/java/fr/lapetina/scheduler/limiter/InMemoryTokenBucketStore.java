package fr.lapetina.scheduler.limiter;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket store backed by a {@link ConcurrentHashMap}.
 * Several replicas in one JVM can share an instance.
 */
public final class InMemoryTokenBucketStore implements TokenBucketStore {

    private final ConcurrentHashMap<String, TokenBucketState> buckets = new ConcurrentHashMap<>();

    @Override
    public TokenBucketState get(String tenantId) {
        return buckets.get(tenantId);
    }

    @Override
    public TokenBucketState putIfAbsent(String tenantId, TokenBucketState initial) {
        return buckets.putIfAbsent(tenantId, initial);
    }

    @Override
    public boolean compareAndSet(String tenantId, TokenBucketState expected, TokenBucketState updated) {
        return buckets.replace(tenantId, expected, updated);
    }

    @Override
    public int size() {
        return buckets.size();
    }
}
