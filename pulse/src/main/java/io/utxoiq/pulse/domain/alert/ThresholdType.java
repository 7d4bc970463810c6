package io.utxoiq.pulse.domain.alert;

/**
 * How the compared value is derived from samples.
 */
public enum ThresholdType {
    /** Raw sample value. */
    ABSOLUTE,
    /** Percent deviation of each sample from the baseline mean. */
    PERCENTAGE,
    /** Percent deviation of the trailing-window mean from the baseline mean. */
    RATE;

    public boolean needsBaseline() {
        return this != ABSOLUTE;
    }
}
