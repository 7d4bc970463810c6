package io.utxoiq.pulse.domain.alert;

import java.time.Duration;
import java.util.Objects;

/**
 * Span over which a breach must persist: a sample count or a duration.
 */
public record EvaluationWindow(Kind kind, int samples, Duration duration) {

    public enum Kind {
        SAMPLES,
        DURATION
    }

    public EvaluationWindow {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.SAMPLES && samples < 0) {
            throw new IllegalArgumentException("Sample window cannot be negative: " + samples);
        }
        if (kind == Kind.DURATION) {
            Objects.requireNonNull(duration, "duration");
            if (duration.isNegative()) {
                throw new IllegalArgumentException("Duration window cannot be negative: " + duration);
            }
        }
    }

    public static EvaluationWindow ofSamples(int samples) {
        return new EvaluationWindow(Kind.SAMPLES, samples, null);
    }

    public static EvaluationWindow ofDuration(Duration duration) {
        return new EvaluationWindow(Kind.DURATION, 0, duration);
    }

    /**
     * True when a single breaching sample already spans the whole window.
     */
    public boolean satisfiedByFirstBreach() {
        return kind == Kind.SAMPLES ? samples <= 1 : duration.isZero();
    }

    @Override
    public String toString() {
        return kind == Kind.SAMPLES ? samples + " samples" : duration.toString();
    }
}
