package io.utxoiq.pulse.service.ratelimit;

/**
 * Bucket size and refill rate for one identity kind.
 */
public record RateLimitPolicy(int capacity, double refillPerSecond) {
    public RateLimitPolicy {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        }
        if (!(refillPerSecond > 0) || Double.isInfinite(refillPerSecond)) {
            throw new IllegalArgumentException("refillPerSecond must be positive: " + refillPerSecond);
        }
    }
}
