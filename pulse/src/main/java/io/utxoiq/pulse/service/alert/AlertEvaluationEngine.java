package io.utxoiq.pulse.service.alert;

import io.utxoiq.pulse.application.port.output.AlertStateSnapshotRepository;
import io.utxoiq.pulse.domain.alert.AlertConfiguration;
import io.utxoiq.pulse.domain.alert.AlertState;
import io.utxoiq.pulse.domain.alert.TransitionEvent;
import io.utxoiq.pulse.domain.signal.SignalSample;
import io.utxoiq.pulse.domain.stats.BaselineStats;
import io.utxoiq.pulse.error.CapacityExceededException;
import io.utxoiq.pulse.error.UnknownMetricException;
import io.utxoiq.pulse.infrastructure.metrics.PulseMetrics;
import io.utxoiq.pulse.service.intake.MetricRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Evaluates samples against every enabled alert on the sample's metric.
 *
 * Alerts are hashed onto single-thread shards. Each shard owns the {@link AlertState}
 * of its alerts, so evaluation is serialized per alert and parallel across shards.
 * Configuration changes travel through the same shard queue, which keeps them ordered
 * with the samples around them.
 */
public final class AlertEvaluationEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AlertEvaluationEngine.class);

    private final MetricRegistry metricRegistry;
    private final BaselineService baselines;
    private final AlertStateMachine machine;
    private final TransitionListener listener;
    private final AlertStateSnapshotRepository snapshots;
    private final PulseMetrics metrics;

    // Owned registry: alert id -> current immutable configuration
    private final ConcurrentHashMap<String, AlertConfiguration> configs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> alertsByMetric = new ConcurrentHashMap<>();
    private final Shard[] shards;

    private final AtomicLong evaluated = new AtomicLong();
    private final AtomicLong triggered = new AtomicLong();
    private final AtomicLong resolved = new AtomicLong();
    private final AtomicLong renotified = new AtomicLong();
    private final AtomicLong unknownMetricDrops = new AtomicLong();
    private final AtomicLong unevaluableDrops = new AtomicLong();
    private final AtomicLong suppressed = new AtomicLong();

    public AlertEvaluationEngine(MetricRegistry metricRegistry, BaselineService baselines,
                                 AlertStateMachine machine, TransitionListener listener,
                                 AlertStateSnapshotRepository snapshots, PulseMetrics metrics,
                                 int shardCount) {
        if (shardCount < 1) {
            throw new IllegalArgumentException("shardCount must be >= 1");
        }
        this.metricRegistry = metricRegistry;
        this.baselines = baselines;
        this.machine = machine;
        this.listener = listener;
        this.snapshots = snapshots;
        this.metrics = metrics;
        this.shards = new Shard[shardCount];
        for (int i = 0; i < shardCount; i++) {
            shards[i] = new Shard(i);
        }
        log.info("[ENGINE] Started with {} shards", shardCount);
    }

    // ═══════════════════════════════════════════════════════════════
    // REGISTRY
    // ═══════════════════════════════════════════════════════════════

    /**
     * Add or replace an alert. Disabled configurations are unregistered. State survives
     * the update unless metric, operator, threshold, threshold type or window changed.
     */
    public void register(AlertConfiguration config) {
        if (!config.enabled()) {
            unregister(config.id());
            return;
        }
        AlertConfiguration previous = configs.put(config.id(), config);
        if (previous != null && !previous.metric().equals(config.metric())) {
            removeFromIndex(previous);
        }
        alertsByMetric.computeIfAbsent(MetricRegistry.normalize(config.metric()), k -> ConcurrentHashMap.newKeySet())
            .add(config.id());

        boolean reset = config.changesEvaluation(previous);
        Shard shard = shardFor(config.id());
        shard.executor.execute(() -> {
            if (reset || !shard.states.containsKey(config.id())) {
                shard.states.put(config.id(), new AlertState(config.id()));
            }
        });
        log.debug("[ENGINE] Registered alert {} v{} on {} (reset={})", config.id(), config.version(),
            config.metric(), reset);
    }

    /**
     * Remove an alert and drop its state, including any pending accumulation.
     */
    public void unregister(String alertId) {
        AlertConfiguration removed = configs.remove(alertId);
        if (removed != null) {
            removeFromIndex(removed);
        }
        Shard shard = shardFor(alertId);
        shard.executor.execute(() -> shard.states.remove(alertId));
        log.debug("[ENGINE] Unregistered alert {}", alertId);
    }

    public Optional<AlertConfiguration> registered(String alertId) {
        return Optional.ofNullable(configs.get(alertId));
    }

    // ═══════════════════════════════════════════════════════════════
    // EVALUATION
    // ═══════════════════════════════════════════════════════════════

    /**
     * Evaluate one sample against every registered alert on its metric.
     *
     * @return transitions produced, completed once every shard involved has finished
     * @throws UnknownMetricException when the metric is not registered; the sample is dropped and counted
     */
    public CompletableFuture<List<TransitionEvent>> ingest(SignalSample sample) {
        if (!metricRegistry.isKnown(sample.type())) {
            unknownMetricDrops.incrementAndGet();
            metrics.recordUnknownMetric(sample.type());
            throw new UnknownMetricException(sample.type());
        }

        Set<String> alertIds = alertsByMetric.getOrDefault(MetricRegistry.normalize(sample.type()), Set.of());
        if (alertIds.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        Map<Shard, List<String>> byShard = new HashMap<>();
        for (String alertId : alertIds) {
            byShard.computeIfAbsent(shardFor(alertId), s -> new ArrayList<>()).add(alertId);
        }

        List<CompletableFuture<List<TransitionEvent>>> parts = new ArrayList<>();
        for (Map.Entry<Shard, List<String>> entry : byShard.entrySet()) {
            Shard shard = entry.getKey();
            List<String> ids = entry.getValue();
            parts.add(CompletableFuture.supplyAsync(() -> {
                long start = System.nanoTime();
                List<TransitionEvent> out = new ArrayList<>();
                for (String alertId : ids) {
                    evaluateOnShard(shard, alertId, sample).ifPresent(out::add);
                }
                metrics.recordSampleEvaluated(sample.type(), Duration.ofNanos(System.nanoTime() - start));
                return out;
            }, shard.executor));
        }

        return CompletableFuture.allOf(parts.toArray(new CompletableFuture[0]))
            .thenApply(v -> {
                List<TransitionEvent> all = new ArrayList<>();
                parts.forEach(p -> all.addAll(p.join()));
                return all;
            });
    }

    /**
     * Evaluate one sample against one alert, on that alert's shard. The alert must be
     * registered; evaluation always uses the registered version of its configuration.
     */
    public CompletableFuture<Optional<TransitionEvent>> evaluate(AlertConfiguration config, SignalSample sample) {
        if (!metricRegistry.isKnown(sample.type())) {
            unknownMetricDrops.incrementAndGet();
            metrics.recordUnknownMetric(sample.type());
            return CompletableFuture.failedFuture(new UnknownMetricException(sample.type()));
        }
        Shard shard = shardFor(config.id());
        return CompletableFuture.supplyAsync(() -> evaluateOnShard(shard, config.id(), sample), shard.executor);
    }

    // Runs on the shard thread only
    private Optional<TransitionEvent> evaluateOnShard(Shard shard, String alertId, SignalSample sample) {
        AlertConfiguration config = configs.get(alertId);   // copy-on-read: immutable snapshot for this pass
        AlertState state = shard.states.get(alertId);
        if (config == null || state == null
            || !MetricRegistry.normalize(config.metric()).equals(MetricRegistry.normalize(sample.type()))) {
            return Optional.empty();
        }

        if (config.isSuppressedAt(sample.observedAt())) {
            suppressed.incrementAndGet();
            metrics.recordSuppressedSample(sample.type());
            return Optional.empty();
        }

        BaselineStats baseline = null;
        if (config.thresholdType().needsBaseline()) {
            baseline = lookupBaseline(config.metric());
            if (baseline == null) {
                unevaluableDrops.incrementAndGet();
                metrics.recordUnevaluableSample(sample.type());
                return Optional.empty();
            }
        }

        evaluated.incrementAndGet();
        Optional<TransitionEvent> transition = machine.evaluate(config, state, sample, baseline);
        transition.ifPresent(event -> onTransition(event, state));
        return transition;
    }

    private BaselineStats lookupBaseline(String metric) {
        try {
            Optional<BaselineStats> baseline = baselines.find(metric);
            if (baseline.isEmpty() || baseline.get().mean() == 0.0) {
                log.debug("[ENGINE] No usable baseline for {}", metric);
                return null;
            }
            return baseline.get();
        } catch (RuntimeException e) {
            log.warn("[ENGINE] Baseline lookup failed for {}: {}", metric, e.getMessage());
            return null;
        }
    }

    private void onTransition(TransitionEvent event, AlertState state) {
        switch (event.kind()) {
            case TRIGGERED -> triggered.incrementAndGet();
            case RESOLVED -> resolved.incrementAndGet();
            case RENOTIFY -> renotified.incrementAndGet();
        }
        metrics.recordTransition(event.kind());
        log.info("[ENGINE] {}", event.describe());

        try {
            snapshots.save(state.snapshot());
        } catch (RuntimeException e) {
            log.warn("[ENGINE] Failed to persist state snapshot for {}: {}", event.alertId(), e.getMessage());
        }

        try {
            listener.onTransition(event);
        } catch (CapacityExceededException e) {
            log.error("[ENGINE] Interrupted while dispatcher was full, transition {} for alert {} not delivered: {}",
                event.kind(), event.alertId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[ENGINE] Transition listener failed for alert {}: {}", event.alertId(), e.getMessage(), e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // INSPECTION
    // ═══════════════════════════════════════════════════════════════

    public CompletableFuture<Optional<AlertState.Snapshot>> snapshot(String alertId) {
        Shard shard = shardFor(alertId);
        return CompletableFuture.supplyAsync(
            () -> Optional.ofNullable(shard.states.get(alertId)).map(AlertState::snapshot), shard.executor);
    }

    public EngineStats stats() {
        return new EngineStats(configs.size(), evaluated.get(), triggered.get(), resolved.get(),
            renotified.get(), unknownMetricDrops.get(), unevaluableDrops.get(), suppressed.get());
    }

    @Override
    public void close() {
        for (Shard shard : shards) {
            shard.executor.shutdown();
        }
        for (Shard shard : shards) {
            try {
                if (!shard.executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    shard.executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                shard.executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[ENGINE] Stopped");
    }

    private Shard shardFor(String alertId) {
        return shards[Math.floorMod(alertId.hashCode(), shards.length)];
    }

    private void removeFromIndex(AlertConfiguration config) {
        Set<String> ids = alertsByMetric.get(MetricRegistry.normalize(config.metric()));
        if (ids != null) {
            ids.remove(config.id());
        }
    }

    private static final class Shard {
        final ExecutorService executor;
        final Map<String, AlertState> states = new HashMap<>();   // confined to executor thread

        Shard(int index) {
            this.executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "alert-shard-" + index);
                t.setDaemon(true);
                return t;
            });
        }
    }
}
