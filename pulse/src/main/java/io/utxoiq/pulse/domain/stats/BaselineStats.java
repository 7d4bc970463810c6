package io.utxoiq.pulse.domain.stats;

import java.time.Instant;

/**
 * Precomputed baseline statistics for one metric.
 */
public record BaselineStats(
    String metric,
    double mean,
    double median,
    double stdDev,
    double p95,
    double p99,
    long sampleCount,
    Instant computedAt
) {
    /**
     * Percent deviation of a value from the baseline mean.
     *
     * @throws IllegalStateException when the mean is zero
     */
    public double percentDeviation(double value) {
        if (mean == 0.0) {
            throw new IllegalStateException("Baseline mean is zero for " + metric);
        }
        return (value - mean) / Math.abs(mean) * 100.0;
    }
}
