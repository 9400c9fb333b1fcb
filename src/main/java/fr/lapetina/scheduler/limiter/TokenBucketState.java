package fr.lapetina.scheduler.limiter;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Persisted per-tenant bucket state.
 *
 * Tokens are held as a fixed-point count of nano-tokens (one token = 10^9) so that
 * refill and deduction are exact integer arithmetic. Invariant:
 * {@code 0 <= nanoTokens <= burstCapacity * 10^9}.
 */
public record TokenBucketState(
        long nanoTokens,
        Instant lastRefillTimestamp,
        double sustainedRate,
        long burstCapacity
) {
    static final long NANOS_PER_TOKEN = 1_000_000_000L;

    public TokenBucketState {
        Objects.requireNonNull(lastRefillTimestamp, "Last refill timestamp is required");
        if (nanoTokens < 0 || nanoTokens > burstCapacity * NANOS_PER_TOKEN) {
            throw new IllegalArgumentException("nanoTokens out of range: " + nanoTokens);
        }
    }

    public static TokenBucketState full(long burstCapacity, double sustainedRate, Instant now) {
        return new TokenBucketState(burstCapacity * NANOS_PER_TOKEN, now, sustainedRate, burstCapacity);
    }

    public double tokensAvailable() {
        return (double) nanoTokens / NANOS_PER_TOKEN;
    }

    /**
     * Returns the state after continuous refill up to {@code now}.
     * A clock that moved backwards adds nothing and keeps the later timestamp.
     */
    public TokenBucketState refill(Instant now, double rate, long burst) {
        long capNanos = burst * NANOS_PER_TOKEN;
        long current = Math.min(nanoTokens, capNanos);
        if (!now.isAfter(lastRefillTimestamp)) {
            return new TokenBucketState(current, lastRefillTimestamp, rate, burst);
        }
        long missing = capNanos - current;
        long elapsed = Duration.between(lastRefillTimestamp, now).toNanos();
        // rate tokens/s is rate nano-tokens/ns; bound elapsed so the product stays exact
        long fillNanos = (long) Math.ceil(missing / rate);
        long added = elapsed >= fillNanos ? missing : (long) Math.floor(elapsed * rate);
        return new TokenBucketState(Math.min(capNanos, current + added), now, rate, burst);
    }

    public boolean hasToken() {
        return nanoTokens >= NANOS_PER_TOKEN;
    }

    public TokenBucketState consumeOne() {
        return new TokenBucketState(nanoTokens - NANOS_PER_TOKEN, lastRefillTimestamp, sustainedRate, burstCapacity);
    }

    /**
     * Time until one full token is available at the current rate.
     */
    public Duration timeUntilNextToken() {
        if (hasToken()) {
            return Duration.ZERO;
        }
        long missing = NANOS_PER_TOKEN - nanoTokens;
        return Duration.ofNanos((long) Math.ceil(missing / sustainedRate));
    }
}
