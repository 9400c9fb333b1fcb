package fr.lapetina.scheduler.domain.model;

import java.util.Locale;

/**
 * Error taxonomy for scheduling outcomes.
 * Provides clear categorization for client retry logic and metrics.
 */
public enum ErrorType {
    /** Token bucket empty, retry after the advertised delay */
    RATE_LIMITED,

    /** Token bucket empty while the tenant is throttled by the noisy-neighbor governor */
    NOISY_NEIGHBOR_THROTTLED,

    /** Global queue at its hard size ceiling */
    CAPACITY_EXHAUSTED,

    /** Waited past the deadline without being dispatched */
    QUEUE_TIMEOUT,

    /** Withdrawn by the caller before dispatch */
    CANCELLED,

    /** The downstream pipeline reported an error */
    DISPATCH_FAILURE,

    /** Request rejected before admission because it is malformed */
    VALIDATION_ERROR,

    /** Internal scheduler error */
    INTERNAL_ERROR;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
