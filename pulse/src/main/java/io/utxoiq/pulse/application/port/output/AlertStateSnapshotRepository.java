package io.utxoiq.pulse.application.port.output;

import io.utxoiq.pulse.domain.alert.AlertState;

import java.util.Optional;

/**
 * Read-only snapshots of evaluation state, kept for diagnostics.
 */
public interface AlertStateSnapshotRepository {
    void save(AlertState.Snapshot snapshot);

    Optional<AlertState.Snapshot> find(String alertId);

    void delete(String alertId);
}
