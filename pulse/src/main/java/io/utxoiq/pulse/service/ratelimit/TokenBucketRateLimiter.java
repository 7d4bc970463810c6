package io.utxoiq.pulse.service.ratelimit;

import io.utxoiq.pulse.infrastructure.metrics.PulseMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket per identity. Never blocks: every call is an immediate yes/no.
 *
 * Buckets start full and refill continuously at the policy rate up to capacity.
 */
public final class TokenBucketRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private final Map<IdentityKind, RateLimitPolicy> policies;
    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final Clock clock;
    private final PulseMetrics metrics;

    public TokenBucketRateLimiter(Map<IdentityKind, RateLimitPolicy> policies, Clock clock, PulseMetrics metrics) {
        for (IdentityKind kind : IdentityKind.values()) {
            if (!policies.containsKey(kind)) {
                throw new IllegalArgumentException("Missing rate limit policy for " + kind);
            }
        }
        this.policies = new EnumMap<>(policies);
        this.clock = clock;
        this.metrics = metrics;
    }

    public RateLimitDecision allow(ClientIdentity identity) {
        RateLimitPolicy policy = policies.get(identity.kind());
        Instant now = clock.instant();
        Bucket bucket = buckets.computeIfAbsent(identity.bucketKey(), k -> new Bucket(policy, now));

        RateLimitDecision decision = bucket.tryAcquire(now);
        if (!decision.permitted()) {
            metrics.recordRateLimitDenied(identity.kind().name());
            log.debug("[RATE] Denied {} retryAfter={}ms", identity.bucketKey(), decision.retryAfter().toMillis());
        }
        return decision;
    }

    public RateLimitPolicy policyFor(IdentityKind kind) {
        return policies.get(kind);
    }

    /**
     * Drop buckets untouched for at least {@code idle}. A dropped bucket comes back full.
     */
    public int evictIdle(Duration idle) {
        Instant cutoff = clock.instant().minus(idle);
        int before = buckets.size();
        buckets.values().removeIf(bucket -> bucket.lastSeenBefore(cutoff));
        return before - buckets.size();
    }

    public int bucketCount() {
        return buckets.size();
    }

    private static final class Bucket {
        private final RateLimitPolicy policy;
        private double tokens;
        private Instant lastRefill;
        private Instant lastSeen;

        Bucket(RateLimitPolicy policy, Instant now) {
            this.policy = policy;
            this.tokens = policy.capacity();
            this.lastRefill = now;
            this.lastSeen = now;
        }

        synchronized RateLimitDecision tryAcquire(Instant now) {
            refill(now);
            lastSeen = now;
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return RateLimitDecision.permit((int) Math.floor(tokens));
            }
            double secondsToNext = (1.0 - tokens) / policy.refillPerSecond();
            long nanos = (long) Math.ceil(secondsToNext * 1_000_000_000L);
            return RateLimitDecision.deny(Duration.ofNanos(Math.max(1, nanos)));
        }

        synchronized boolean lastSeenBefore(Instant cutoff) {
            return lastSeen.isBefore(cutoff);
        }

        private void refill(Instant now) {
            long elapsedNanos = Duration.between(lastRefill, now).toNanos();
            if (elapsedNanos <= 0) {
                return;
            }
            tokens = Math.min(policy.capacity(), tokens + elapsedNanos * policy.refillPerSecond() / 1_000_000_000.0);
            lastRefill = now;
        }
    }
}
