package io.utxoiq.pulse.application.port.output;

import io.utxoiq.pulse.domain.stats.BaselineStats;

import java.util.Optional;

/**
 * Precomputed baseline statistics, produced by the upstream analytics pipeline.
 */
public interface BaselineStatsSource {
    Optional<BaselineStats> load(String metric);
}
