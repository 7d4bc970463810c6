package io.utxoiq.pulse.service.cache;

import io.utxoiq.pulse.infrastructure.metrics.PulseMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Single-flight memoization with TTL.
 *
 * At most one computation runs per key. Concurrent callers for the same key wait on
 * that computation and receive its value or its exception. Failed computations are
 * never stored.
 *
 * {@link #invalidate(String)} never cancels a running computation: its waiters still
 * get the result, but the result is not kept once the entry was invalidated.
 */
public final class ResultCache {
    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final PulseMetrics metrics;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong coalescedWaits = new AtomicLong();
    private final AtomicLong loadFailures = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong invalidations = new AtomicLong();

    public ResultCache(Clock clock, PulseMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Return the fresh value for {@code key}, computing it at most once across concurrent callers.
     *
     * @throws RuntimeException whatever {@code compute} threw, unwrapped, for the owner and every waiter
     */
    @SuppressWarnings("unchecked")
    public <V> V getOrCompute(String key, Supplier<V> compute, Duration ttl) {
        while (true) {
            Entry existing = entries.get(key);
            if (existing != null) {
                if (!existing.future.isDone()) {
                    coalescedWaits.incrementAndGet();
                    return (V) await(existing.future);
                }
                if (existing.isFresh(clock.instant())) {
                    hits.incrementAndGet();
                    metrics.recordCacheLookup(namespace(key), true);
                    return (V) await(existing.future);
                }
                // expired: drop it and race for a new computation
                if (entries.remove(key, existing)) {
                    evictions.incrementAndGet();
                }
                continue;
            }

            Entry mine = new Entry();
            if (entries.putIfAbsent(key, mine) != null) {
                continue;
            }

            misses.incrementAndGet();
            metrics.recordCacheLookup(namespace(key), false);
            return (V) compute(key, mine, compute, ttl);
        }
    }

    private Object compute(String key, Entry entry, Supplier<?> compute, Duration ttl) {
        Object value;
        try {
            value = compute.get();
        } catch (RuntimeException | Error e) {
            loadFailures.incrementAndGet();
            entries.remove(key, entry);
            entry.future.completeExceptionally(e);
            log.warn("[CACHE] Computation for {} failed: {}", key, e.getMessage());
            throw e;
        }

        entry.expiresAt = clock.instant().plus(ttl);
        entry.future.complete(value);
        // invalidate() sets the flag before checking isDone, so one side always removes
        if (entry.invalidated) {
            entries.remove(key, entry);
            log.debug("[CACHE] {} invalidated while computing, result not kept", key);
        }
        return value;
    }

    /**
     * Remove a completed entry. An entry still computing stays in place so no second
     * computation starts for the key; its waiters get the result, which is then dropped
     * instead of stored.
     */
    public void invalidate(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return;
        }
        entry.invalidated = true;
        if (entry.future.isDone()) {
            entries.remove(key, entry);
        }
        invalidations.incrementAndGet();
        log.debug("[CACHE] Invalidated {}", key);
    }

    /**
     * Invalidate every key starting with {@code prefix}, e.g. "baseline:".
     */
    public int invalidatePrefix(String prefix) {
        int count = 0;
        for (String key : entries.keySet()) {
            if (key.startsWith(prefix)) {
                invalidate(key);
                count++;
            }
        }
        return count;
    }

    /**
     * Drop completed entries whose TTL has passed. Called periodically.
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int evicted = 0;
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            Entry entry = e.getValue();
            if (entry.future.isDone() && !entry.isFresh(now) && entries.remove(e.getKey(), entry)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            evictions.addAndGet(evicted);
            log.debug("[CACHE] Evicted {} expired entries", evicted);
        }
        return evicted;
    }

    public CacheStats stats() {
        return new CacheStats(entries.size(), hits.get(), misses.get(), coalescedWaits.get(),
            loadFailures.get(), evictions.get(), invalidations.get());
    }

    private static Object await(CompletableFuture<Object> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for cached computation", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new CompletionException(cause);
        }
    }

    private static String namespace(String key) {
        int idx = key.indexOf(':');
        return idx < 0 ? key : key.substring(0, idx);
    }

    private static final class Entry {
        final CompletableFuture<Object> future = new CompletableFuture<>();
        volatile Instant expiresAt;     // set before the future completes
        volatile boolean invalidated;

        boolean isFresh(Instant now) {
            return !invalidated && expiresAt != null && now.isBefore(expiresAt) && !future.isCompletedExceptionally();
        }
    }
}
