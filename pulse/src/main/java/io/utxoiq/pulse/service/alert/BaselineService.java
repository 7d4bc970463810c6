package io.utxoiq.pulse.service.alert;

import io.utxoiq.pulse.application.port.output.BaselineStatsSource;
import io.utxoiq.pulse.domain.stats.BaselineStats;
import io.utxoiq.pulse.error.NotFoundException;
import io.utxoiq.pulse.service.cache.ResultCache;

import java.time.Duration;
import java.util.Optional;

/**
 * Baseline lookups through the result cache ({@code baseline:<metric>}).
 * Shared by the evaluation engine and the read API.
 */
public final class BaselineService {
    public static final String KEY_PREFIX = "baseline:";

    private final BaselineStatsSource source;
    private final ResultCache cache;
    private final Duration ttl;

    public BaselineService(BaselineStatsSource source, ResultCache cache, Duration ttl) {
        this.source = source;
        this.cache = cache;
        this.ttl = ttl;
    }

    public Optional<BaselineStats> find(String metric) {
        return cache.getOrCompute(KEY_PREFIX + metric, () -> source.load(metric), ttl);
    }

    public BaselineStats get(String metric) {
        return find(metric).orElseThrow(() -> new NotFoundException("No baseline for metric " + metric));
    }

    public void invalidate(String metric) {
        cache.invalidate(KEY_PREFIX + metric);
    }
}
