package io.utxoiq.pulse.domain.signal;

import java.time.Instant;
import java.util.Objects;

/**
 * One timestamped observation of a signal or metric, as produced upstream.
 *
 * Identity is the full tuple: two samples with the same type, block height,
 * observation time and value are the same sample.
 */
public record SignalSample(
    String type,
    double value,
    long blockHeight,
    Instant observedAt
) {
    public SignalSample {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(observedAt, "observedAt");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type cannot be blank");
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("value must be finite: " + value);
        }
        if (blockHeight < 0) {
            throw new IllegalArgumentException("blockHeight cannot be negative: " + blockHeight);
        }
    }
}
