package io.utxoiq.pulse.infrastructure.metrics;

import io.utxoiq.pulse.domain.alert.ChannelKind;
import io.utxoiq.pulse.domain.alert.TransitionKind;
import io.utxoiq.pulse.domain.notification.NotificationStatus;
import io.utxoiq.pulse.domain.stream.StreamTopic;

import java.time.Duration;

/**
 * Metrics for the alerting core.
 *
 * Key metrics:
 * - Samples evaluated, dropped (unknown metric, missing baseline) and suppressed
 * - Transitions by kind
 * - Delivery outcomes, attempts and outstanding work per channel
 * - Live connections and dropped frames
 * - Cache hits / misses and rate limit denials
 */
public interface PulseMetrics {

    // ═══════════════════════════════════════════════════════════════
    // Evaluation
    // ═══════════════════════════════════════════════════════════════

    void recordSampleEvaluated(String metric, Duration latency);

    void recordUnknownMetric(String metric);

    /**
     * A sample that needed a baseline but none (or a zero mean) was available.
     */
    void recordUnevaluableSample(String metric);

    void recordSuppressedSample(String metric);

    void recordTransition(TransitionKind kind);

    // ═══════════════════════════════════════════════════════════════
    // Delivery
    // ═══════════════════════════════════════════════════════════════

    void recordDeliveryAttempt(ChannelKind channel, boolean success, Duration latency);

    void recordDeliveryOutcome(ChannelKind channel, NotificationStatus status);

    void setOutstandingDeliveries(ChannelKind channel, int outstanding);

    // ═══════════════════════════════════════════════════════════════
    // Live stream
    // ═══════════════════════════════════════════════════════════════

    void recordPublished(StreamTopic topic);

    void setActiveConnections(int connections);

    void recordDroppedFrames(long count);

    // ═══════════════════════════════════════════════════════════════
    // Cache / rate limiting
    // ═══════════════════════════════════════════════════════════════

    /**
     * @param cache key namespace, e.g. "baseline" for "baseline:cpu_usage"
     */
    void recordCacheLookup(String cache, boolean hit);

    void recordRateLimitDenied(String identityKind);
}
