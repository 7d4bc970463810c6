package io.utxoiq.pulse.domain.alert;

import java.time.Instant;
import java.util.Objects;

/**
 * Maintenance window during which an alert ignores samples.
 */
public record SuppressionWindow(Instant start, Instant end) {
    public SuppressionWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Suppression end is before start");
        }
    }

    public boolean covers(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }
}
