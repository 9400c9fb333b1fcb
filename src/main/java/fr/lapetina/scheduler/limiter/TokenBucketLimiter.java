package fr.lapetina.scheduler.limiter;

import fr.lapetina.scheduler.domain.model.AdmitResult;
import fr.lapetina.scheduler.domain.model.ErrorType;
import fr.lapetina.scheduler.domain.model.TenantTier;
import fr.lapetina.scheduler.domain.model.TierPolicies;
import fr.lapetina.scheduler.domain.model.TierPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-tenant admission gate.
 *
 * Each tenant's bucket refills continuously at its tier's sustained rate, capped at the
 * tier's burst capacity. A throttle factor applied by the noisy-neighbor governor scales
 * the refill rate down until it is cleared.
 *
 * Bucket updates are optimistic: read, compute, compare-and-set, retry on conflict.
 */
public final class TokenBucketLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketLimiter.class);

    private final TokenBucketStore store;
    private final Supplier<TierPolicies> policies;
    private final Clock clock;
    private final Map<String, Double> throttleFactors = new ConcurrentHashMap<>();

    public TokenBucketLimiter(TokenBucketStore store, Supplier<TierPolicies> policies, Clock clock) {
        this.store = store;
        this.policies = policies;
        this.clock = clock;
    }

    /**
     * Attempts to take one token for the tenant.
     */
    public AdmitResult admit(String tenantId, TenantTier tier) {
        TierPolicy policy = policies.get().get(tier);
        Double factor = throttleFactors.get(tenantId);
        double rate = factor != null ? policy.sustainedRate() * factor : policy.sustainedRate();
        long burst = policy.burstCapacity();
        Instant now = clock.instant();

        int attempts = 0;
        while (true) {
            attempts++;
            TokenBucketState current = store.get(tenantId);
            if (current == null) {
                TokenBucketState initial = TokenBucketState.full(burst, rate, now);
                TokenBucketState existing = store.putIfAbsent(tenantId, initial);
                current = existing != null ? existing : initial;
            }

            TokenBucketState refilled = current.refill(now, rate, burst);
            if (!refilled.hasToken()) {
                ErrorType reason = factor != null ? ErrorType.NOISY_NEIGHBOR_THROTTLED : ErrorType.RATE_LIMITED;
                log.debug("Token bucket empty: tenantId={}, tier={}, reason={}, tokens={}",
                        tenantId, tier, reason, refilled.tokensAvailable());
                return AdmitResult.rejected(reason, refilled.timeUntilNextToken(), refilled.tokensAvailable());
            }

            TokenBucketState updated = refilled.consumeOne();
            if (store.compareAndSet(tenantId, current, updated)) {
                if (attempts > 1) {
                    log.debug("Token taken after contention: tenantId={}, attempts={}", tenantId, attempts);
                }
                return AdmitResult.allowed(updated.tokensAvailable());
            }
        }
    }

    /**
     * Scales the tenant's refill rate by {@code factor} until {@link #clearThrottle} is called.
     */
    public void applyThrottle(String tenantId, double factor) {
        if (!(factor > 0.0) || factor > 1.0) {
            throw new IllegalArgumentException("Throttle factor must be within (0, 1]: " + factor);
        }
        Double previous = throttleFactors.put(tenantId, factor);
        if (previous == null) {
            log.info("Throttle applied: tenantId={}, rateFactor={}", tenantId, factor);
        }
    }

    public void clearThrottle(String tenantId) {
        if (throttleFactors.remove(tenantId) != null) {
            log.info("Throttle cleared: tenantId={}", tenantId);
        }
    }

    public boolean isThrottled(String tenantId) {
        return throttleFactors.containsKey(tenantId);
    }

    /**
     * Current token count without consuming, for diagnostics.
     */
    public double tokensAvailable(String tenantId, TenantTier tier) {
        TokenBucketState state = store.get(tenantId);
        TierPolicy policy = policies.get().get(tier);
        if (state == null) {
            return policy.burstCapacity();
        }
        Double factor = throttleFactors.get(tenantId);
        double rate = factor != null ? policy.sustainedRate() * factor : policy.sustainedRate();
        return state.refill(clock.instant(), rate, policy.burstCapacity()).tokensAvailable();
    }
}
