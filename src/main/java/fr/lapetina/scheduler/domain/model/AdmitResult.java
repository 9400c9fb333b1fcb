package fr.lapetina.scheduler.domain.model;

import java.time.Duration;

/**
 * Decision of the token bucket limiter.
 *
 * @param allowed         whether a token was taken
 * @param retryAfter      time until at least one token is available, zero when allowed
 * @param reason          rejection reason, null when allowed
 * @param tokensRemaining tokens left in the bucket after the decision
 */
public record AdmitResult(boolean allowed, Duration retryAfter, ErrorType reason, double tokensRemaining) {

    public static AdmitResult allowed(double tokensRemaining) {
        return new AdmitResult(true, Duration.ZERO, null, tokensRemaining);
    }

    public static AdmitResult rejected(ErrorType reason, Duration retryAfter, double tokensRemaining) {
        return new AdmitResult(false, retryAfter, reason, tokensRemaining);
    }
}
