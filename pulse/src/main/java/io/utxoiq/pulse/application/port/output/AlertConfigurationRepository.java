package io.utxoiq.pulse.application.port.output;

import io.utxoiq.pulse.domain.alert.AlertConfiguration;

import java.util.List;
import java.util.Optional;

/**
 * Durable store for alert configurations.
 */
public interface AlertConfigurationRepository {
    Optional<AlertConfiguration> findById(String id);

    List<AlertConfiguration> findByOwner(String owner);

    /**
     * All enabled configurations, used to rebuild the engine registry at startup.
     */
    List<AlertConfiguration> findAllEnabled();

    void insert(AlertConfiguration config);

    /**
     * Write {@code config} only if the stored row still has {@code expectedVersion}.
     *
     * @return false when the stored version moved on
     */
    boolean updateIfVersion(AlertConfiguration config, long expectedVersion);

    void delete(String id);
}
