package io.utxoiq.pulse.service.intake;

import java.util.List;

/**
 * Outcome of one intake call. Malformed elements of a batch are reported, not fatal.
 */
public record IntakeResult(
    int accepted,
    int unknownMetric,
    List<String> rejected
) {
    public IntakeResult {
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }

    public int received() {
        return accepted + unknownMetric + rejected.size();
    }
}
