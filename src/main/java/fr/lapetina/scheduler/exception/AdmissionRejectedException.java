package fr.lapetina.scheduler.exception;

import fr.lapetina.scheduler.domain.model.ErrorType;

import java.time.Duration;

/**
 * Exception thrown when a query is refused before it enters the queue.
 *
 * This occurs when:
 * - The tenant's token bucket is empty (rate limited or noisy-neighbor throttled)
 * - The global queue is at its hard size ceiling
 * - The query is malformed
 */
public final class AdmissionRejectedException extends RuntimeException {

    private final ErrorType reason;
    private final Duration retryAfter;

    public AdmissionRejectedException(ErrorType reason, Duration retryAfter, String details) {
        super("Admission rejected: " + reason + " - " + details);
        this.reason = reason;
        this.retryAfter = retryAfter != null ? retryAfter : Duration.ZERO;
    }

    public AdmissionRejectedException(ErrorType reason, String details) {
        this(reason, Duration.ZERO, details);
    }

    public ErrorType getReason() {
        return reason;
    }

    /**
     * Hint for the caller's backoff, zero when no hint applies.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    /**
     * Rate-limit style rejections can be retried after {@link #getRetryAfter()}.
     */
    public boolean isRetryable() {
        return reason == ErrorType.RATE_LIMITED
                || reason == ErrorType.NOISY_NEIGHBOR_THROTTLED
                || reason == ErrorType.CAPACITY_EXHAUSTED;
    }
}
