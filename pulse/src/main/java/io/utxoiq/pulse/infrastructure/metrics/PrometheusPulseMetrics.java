package io.utxoiq.pulse.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.utxoiq.pulse.domain.alert.ChannelKind;
import io.utxoiq.pulse.domain.alert.TransitionKind;
import io.utxoiq.pulse.domain.notification.NotificationStatus;
import io.utxoiq.pulse.domain.stream.StreamTopic;

import java.time.Duration;

/**
 * Prometheus implementation of PulseMetrics.
 *
 * Key Metrics:
 * - pulse_samples_total{metric, outcome} - evaluated / unknown_metric / unevaluable / suppressed
 * - pulse_evaluation_latency_seconds - time spent evaluating one sample against all its alerts
 * - pulse_transitions_total{kind}
 * - pulse_delivery_attempts_total{channel, status}
 * - pulse_deliveries_total{channel, status} - terminal record outcomes
 * - pulse_outstanding_deliveries{channel}
 * - pulse_ws_connections, pulse_ws_dropped_frames_total
 * - pulse_cache_lookups_total{cache, result}
 * - pulse_rate_limit_denied_total{kind}
 */
public class PrometheusPulseMetrics implements PulseMetrics {

    private final CollectorRegistry registry;

    private final Counter samples;
    private final Histogram evaluationLatency;
    private final Counter transitions;
    private final Counter deliveryAttempts;
    private final Histogram deliveryLatency;
    private final Counter deliveries;
    private final Gauge outstandingDeliveries;
    private final Counter published;
    private final Gauge connections;
    private final Counter droppedFrames;
    private final Counter cacheLookups;
    private final Counter rateLimitDenied;

    public PrometheusPulseMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusPulseMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.samples = Counter.build()
            .name("pulse_samples_total")
            .help("Signal samples seen by the evaluation engine")
            .labelNames("metric", "outcome")
            .register(registry);

        this.evaluationLatency = Histogram.build()
            .name("pulse_evaluation_latency_seconds")
            .help("Time to evaluate one sample against its alerts")
            .buckets(0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05, 0.1)
            .register(registry);

        this.transitions = Counter.build()
            .name("pulse_transitions_total")
            .help("Alert transitions emitted")
            .labelNames("kind")
            .register(registry);

        this.deliveryAttempts = Counter.build()
            .name("pulse_delivery_attempts_total")
            .help("Channel send attempts")
            .labelNames("channel", "status")
            .register(registry);

        this.deliveryLatency = Histogram.build()
            .name("pulse_delivery_latency_seconds")
            .help("Channel send latency in seconds")
            .labelNames("channel")
            .buckets(0.01, 0.05, 0.1, 0.5, 1.0, 2.0, 5.0, 10.0)
            .register(registry);

        this.deliveries = Counter.build()
            .name("pulse_deliveries_total")
            .help("Notification records reaching a terminal status")
            .labelNames("channel", "status")
            .register(registry);

        this.outstandingDeliveries = Gauge.build()
            .name("pulse_outstanding_deliveries")
            .help("Deliveries admitted but not yet terminal")
            .labelNames("channel")
            .register(registry);

        this.published = Counter.build()
            .name("pulse_stream_events_total")
            .help("Events published into the subscription hub")
            .labelNames("topic")
            .register(registry);

        this.connections = Gauge.build()
            .name("pulse_ws_connections")
            .help("Live WebSocket connections")
            .register(registry);

        this.droppedFrames = Counter.build()
            .name("pulse_ws_dropped_frames_total")
            .help("Frames dropped from slow consumer queues")
            .register(registry);

        this.cacheLookups = Counter.build()
            .name("pulse_cache_lookups_total")
            .help("Result cache lookups")
            .labelNames("cache", "result")
            .register(registry);

        this.rateLimitDenied = Counter.build()
            .name("pulse_rate_limit_denied_total")
            .help("Requests denied by the rate limiter")
            .labelNames("kind")
            .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void recordSampleEvaluated(String metric, Duration latency) {
        samples.labels(metric, "evaluated").inc();
        evaluationLatency.observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordUnknownMetric(String metric) {
        samples.labels(metric, "unknown_metric").inc();
    }

    @Override
    public void recordUnevaluableSample(String metric) {
        samples.labels(metric, "unevaluable").inc();
    }

    @Override
    public void recordSuppressedSample(String metric) {
        samples.labels(metric, "suppressed").inc();
    }

    @Override
    public void recordTransition(TransitionKind kind) {
        transitions.labels(kind.name()).inc();
    }

    @Override
    public void recordDeliveryAttempt(ChannelKind channel, boolean success, Duration latency) {
        deliveryAttempts.labels(channel.name(), success ? "success" : "failure").inc();
        deliveryLatency.labels(channel.name()).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordDeliveryOutcome(ChannelKind channel, NotificationStatus status) {
        deliveries.labels(channel.name(), status.name()).inc();
    }

    @Override
    public void setOutstandingDeliveries(ChannelKind channel, int outstanding) {
        outstandingDeliveries.labels(channel.name()).set(outstanding);
    }

    @Override
    public void recordPublished(StreamTopic topic) {
        published.labels(topic.wireName()).inc();
    }

    @Override
    public void setActiveConnections(int count) {
        connections.set(count);
    }

    @Override
    public void recordDroppedFrames(long count) {
        if (count > 0) {
            droppedFrames.inc(count);
        }
    }

    @Override
    public void recordCacheLookup(String cache, boolean hit) {
        cacheLookups.labels(cache, hit ? "hit" : "miss").inc();
    }

    @Override
    public void recordRateLimitDenied(String identityKind) {
        rateLimitDenied.labels(identityKind).inc();
    }
}
