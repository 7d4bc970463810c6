package io.utxoiq.pulse.service.ratelimit;

import java.time.Duration;

/**
 * Outcome of one {@link TokenBucketRateLimiter#allow(ClientIdentity)} call.
 * {@code retryAfter} is zero when permitted.
 */
public record RateLimitDecision(boolean permitted, int remaining, Duration retryAfter) {

    static RateLimitDecision permit(int remaining) {
        return new RateLimitDecision(true, remaining, Duration.ZERO);
    }

    static RateLimitDecision deny(Duration retryAfter) {
        return new RateLimitDecision(false, 0, retryAfter);
    }
}
