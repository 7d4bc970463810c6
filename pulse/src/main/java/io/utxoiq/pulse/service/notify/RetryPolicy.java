package io.utxoiq.pulse.service.notify;

import java.time.Duration;

/**
 * Bounded exponential backoff for channel deliveries.
 *
 * Stateless: the attempt count lives on the notification record, so one policy
 * serves every delivery.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .initialDelay(Duration.ofMillis(500))
 *     .maxDelay(Duration.ofSeconds(30))
 *     .multiplier(2.0)
 *     .maxAttempts(3)
 *     .build();
 *
 * if (policy.shouldRetry(record.attemptCount())) {
 *     Instant next = now.plus(policy.delayAfter(record.attemptCount()));
 * }
 * </pre>
 */
public final class RetryPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @param attemptsMade attempts already made, including the one that just failed
     * @return true if another attempt is allowed
     */
    public boolean shouldRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Delay before the next attempt: initial * multiplier^(attemptsMade - 1), capped at max delay.
     */
    public Duration delayAfter(int attemptsMade) {
        if (attemptsMade < 1) {
            return Duration.ZERO;
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attemptsMade - 1);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 3 attempts, 500 ms initial delay, doubling, capped at 30 s.
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private int maxAttempts = 3;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        /**
         * Total attempts including the first. Unbounded retry is not supported.
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0 || maxAttempts == Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Max attempts must be positive and bounded");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
