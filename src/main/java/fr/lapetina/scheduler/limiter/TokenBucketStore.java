package fr.lapetina.scheduler.limiter;

/**
 * Shared store holding token bucket state for every tenant.
 *
 * Implementations must make {@link #compareAndSet} atomic per tenant so that replicas
 * can admit concurrently without a lock spanning tenants.
 */
public interface TokenBucketStore {

    /**
     * @return the current state, or null if the tenant has no bucket yet
     */
    TokenBucketState get(String tenantId);

    /**
     * Stores the state if the tenant has none.
     * @return the existing state, or null if {@code initial} was stored
     */
    TokenBucketState putIfAbsent(String tenantId, TokenBucketState initial);

    /**
     * Replaces {@code expected} with {@code updated} atomically.
     * @return false if the stored state is no longer {@code expected}
     */
    boolean compareAndSet(String tenantId, TokenBucketState expected, TokenBucketState updated);

    int size();
}
