package io.utxoiq.pulse.error;

import java.time.Duration;

/**
 * Caller exceeded a rate limit or a backpressure bound.
 * Carries how long the caller should wait before trying again.
 */
public class CapacityExceededException extends RuntimeException {

    private final String resource;
    private final Duration retryAfter;

    public CapacityExceededException(String resource, Duration retryAfter) {
        super(String.format("Capacity exceeded for %s, retry after %d ms", resource, retryAfter.toMillis()));
        this.resource = resource;
        this.retryAfter = retryAfter;
    }

    public String getResource() {
        return resource;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    /**
     * Retry-After header value (whole seconds, at least 1).
     */
    public long retryAfterSeconds() {
        return Math.max(1, (retryAfter.toMillis() + 999) / 1000);
    }
}
