package io.utxoiq.pulse.service.intake;

import io.utxoiq.pulse.domain.signal.SignalCategory;
import io.utxoiq.pulse.error.UnknownMetricException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics the engine can evaluate, with their signal category.
 */
public final class MetricRegistry {
    private static final Logger log = LoggerFactory.getLogger(MetricRegistry.class);

    private final ConcurrentHashMap<String, SignalCategory> metrics = new ConcurrentHashMap<>();

    public MetricRegistry(Collection<String> known) {
        known.forEach(this::register);
        log.info("[METRICS] {} known metrics", metrics.size());
    }

    public void register(String metric) {
        register(metric, SignalCategory.ofMetric(metric));
    }

    public void register(String metric, SignalCategory category) {
        metrics.put(normalize(metric), category);
    }

    public boolean isKnown(String metric) {
        return metric != null && metrics.containsKey(normalize(metric));
    }

    /**
     * @throws UnknownMetricException when the metric is not registered
     */
    public SignalCategory categoryOf(String metric) {
        SignalCategory category = metric == null ? null : metrics.get(normalize(metric));
        if (category == null) {
            throw new UnknownMetricException(metric);
        }
        return category;
    }

    public Set<String> all() {
        return new TreeSet<>(metrics.keySet());
    }

    public Map<String, SignalCategory> asMap() {
        return Map.copyOf(metrics);
    }

    public static String normalize(String metric) {
        return metric.trim().toLowerCase();
    }
}
