package io.utxoiq.pulse.service.cache;

/**
 * Point-in-time counters of a {@link ResultCache}.
 */
public record CacheStats(
    int size,
    long hits,
    long misses,
    long coalescedWaits,
    long loadFailures,
    long evictions,
    long invalidations
) {
    public double hitRatio() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
