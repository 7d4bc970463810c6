package io.utxoiq.pulse.service.alert;

import io.prometheus.client.CollectorRegistry;
import io.utxoiq.pulse.application.port.output.AlertStateSnapshotRepository;
import io.utxoiq.pulse.domain.alert.AlertConfiguration;
import io.utxoiq.pulse.domain.alert.AlertState;
import io.utxoiq.pulse.domain.alert.AlertStatus;
import io.utxoiq.pulse.domain.alert.ComparisonOperator;
import io.utxoiq.pulse.domain.alert.EvaluationWindow;
import io.utxoiq.pulse.domain.alert.SuppressionWindow;
import io.utxoiq.pulse.domain.alert.ThresholdType;
import io.utxoiq.pulse.domain.alert.TransitionEvent;
import io.utxoiq.pulse.domain.alert.TransitionKind;
import io.utxoiq.pulse.domain.signal.SignalSample;
import io.utxoiq.pulse.domain.stats.BaselineStats;
import io.utxoiq.pulse.error.UnknownMetricException;
import io.utxoiq.pulse.infrastructure.metrics.PrometheusPulseMetrics;
import io.utxoiq.pulse.service.cache.ResultCache;
import io.utxoiq.pulse.service.intake.MetricRegistry;
import io.utxoiq.pulse.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class AlertEvaluationEngineTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final List<TransitionEvent> delivered = new CopyOnWriteArrayList<>();
    private final Map<String, BaselineStats> baselineRows = new ConcurrentHashMap<>();
    private AlertStateSnapshotRepository snapshots;
    private AlertEvaluationEngine engine;
    private TransitionListener listener = delivered::add;

    @BeforeEach
    void setUp() {
        snapshots = mock(AlertStateSnapshotRepository.class);
        engine = newEngine(event -> listener.onTransition(event));
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private AlertEvaluationEngine newEngine(TransitionListener l) {
        PrometheusPulseMetrics metrics = new PrometheusPulseMetrics(new CollectorRegistry());
        ResultCache cache = new ResultCache(new MutableClock(T0), metrics);
        BaselineService baselines = new BaselineService(
            metric -> Optional.ofNullable(baselineRows.get(metric)), cache, Duration.ofMinutes(1));
        MetricRegistry registry = new MetricRegistry(List.of("mempool_fee_rate", "cpu_usage", "exchange_inflow"));
        return new AlertEvaluationEngine(registry, baselines, new AlertStateMachine(), l, snapshots, metrics, 4);
    }

    private static AlertConfiguration.Builder alert(String id) {
        return AlertConfiguration.builder()
            .id(id)
            .owner("user-1")
            .metric("mempool_fee_rate")
            .operator(ComparisonOperator.GREATER_THAN)
            .threshold(80.0);
    }

    private static SignalSample sample(String metric, double value, int second) {
        return new SignalSample(metric, value, 800_000 + second, T0.plusSeconds(second));
    }

    private List<TransitionEvent> ingest(SignalSample sample) throws Exception {
        return engine.ingest(sample).get(5, TimeUnit.SECONDS);
    }

    @Test
    void testIngestTriggersAndNotifiesListener() throws Exception {
        engine.register(alert("a1").window(EvaluationWindow.ofSamples(2)).build());

        assertTrue(ingest(sample("mempool_fee_rate", 85, 0)).isEmpty());
        List<TransitionEvent> events = ingest(sample("mempool_fee_rate", 90, 1));

        assertEquals(1, events.size());
        assertEquals(TransitionKind.TRIGGERED, events.get(0).kind());
        assertEquals(1, delivered.size(), "Listener sees every transition");
        verify(snapshots, atLeastOnce()).save(any(AlertState.Snapshot.class));
        assertEquals(1, engine.stats().triggered());
        assertEquals(2, engine.stats().evaluated());
    }

    @Test
    void testEveryAlertOnMetricIsEvaluated() throws Exception {
        for (int i = 0; i < 10; i++) {
            engine.register(alert("alert-" + i).build());
        }
        engine.register(alert("other").metric("cpu_usage").build());

        List<TransitionEvent> events = ingest(sample("mempool_fee_rate", 99, 0));

        assertEquals(10, events.size(), "All ten alerts across shards trigger");
        assertTrue(events.stream().noneMatch(e -> e.alertId().equals("other")));
    }

    @Test
    void testUnknownMetricIsRejectedAndCounted() {
        engine.register(alert("a1").build());

        UnknownMetricException ex = assertThrows(UnknownMetricException.class,
            () -> engine.ingest(sample("not_a_metric", 99, 0)));
        assertTrue(ex.getMessage().contains("not_a_metric"));
        assertEquals(1, engine.stats().unknownMetricDrops());
    }

    @Test
    void testMetricNamesAreCaseInsensitive() throws Exception {
        engine.register(alert("a1").metric("Mempool_Fee_Rate").build());

        assertEquals(1, ingest(sample("MEMPOOL_FEE_RATE", 99, 0)).size());
    }

    @Test
    void testSuppressionWindowSkipsSamples() throws Exception {
        SuppressionWindow maintenance = new SuppressionWindow(T0, T0.plusSeconds(60));
        engine.register(alert("a1").suppression(maintenance).build());

        assertTrue(ingest(sample("mempool_fee_rate", 99, 30)).isEmpty(), "Inside maintenance window");
        assertEquals(1, engine.stats().suppressed());
        assertEquals(AlertStatus.OK, engine.snapshot("a1").get(5, TimeUnit.SECONDS).orElseThrow().status());

        assertEquals(1, ingest(sample("mempool_fee_rate", 99, 61)).size(), "After the window ends");
    }

    @Test
    void testMissingBaselineDropsSample() throws Exception {
        engine.register(alert("a1").thresholdType(ThresholdType.PERCENTAGE).threshold(20).build());

        assertTrue(ingest(sample("mempool_fee_rate", 150, 0)).isEmpty());
        assertEquals(1, engine.stats().unevaluableDrops());
        assertEquals(0, engine.stats().evaluated());
    }

    @Test
    void testZeroBaselineMeanDropsSample() throws Exception {
        baselineRows.put("exchange_inflow",
            new BaselineStats("exchange_inflow", 0.0, 0.0, 0.0, 0.0, 0.0, 10, T0));
        engine.register(alert("a1").metric("exchange_inflow").thresholdType(ThresholdType.PERCENTAGE).build());

        assertTrue(ingest(sample("exchange_inflow", 150, 0)).isEmpty());
        assertEquals(1, engine.stats().unevaluableDrops());
    }

    @Test
    void testPercentageThresholdUsesBaseline() throws Exception {
        baselineRows.put("exchange_inflow",
            new BaselineStats("exchange_inflow", 100.0, 95.0, 10.0, 120.0, 140.0, 500, T0));
        engine.register(alert("a1").metric("exchange_inflow").thresholdType(ThresholdType.PERCENTAGE)
            .threshold(25).build());

        assertTrue(ingest(sample("exchange_inflow", 120, 0)).isEmpty(), "20% is under the threshold");
        assertEquals(1, ingest(sample("exchange_inflow", 130, 1)).size(), "30% breaches");
    }

    @Test
    void testCosmeticUpdateKeepsState() throws Exception {
        AlertConfiguration v1 = alert("a1").window(EvaluationWindow.ofSamples(3)).build();
        engine.register(v1);
        ingest(sample("mempool_fee_rate", 85, 0));
        ingest(sample("mempool_fee_rate", 86, 1));

        engine.register(v1.toBuilder().name("renamed").version(2).build());

        List<TransitionEvent> events = ingest(sample("mempool_fee_rate", 87, 2));
        assertEquals(1, events.size(), "Accumulated breaches survive a rename");
        assertEquals("renamed", events.get(0).alertName());
        assertEquals(2, events.get(0).configurationVersion());
    }

    @Test
    void testThresholdChangeResetsState() throws Exception {
        AlertConfiguration v1 = alert("a1").window(EvaluationWindow.ofSamples(3)).build();
        engine.register(v1);
        ingest(sample("mempool_fee_rate", 85, 0));
        ingest(sample("mempool_fee_rate", 86, 1));

        engine.register(v1.toBuilder().threshold(81).version(2).build());

        assertTrue(ingest(sample("mempool_fee_rate", 87, 2)).isEmpty(), "Window restarts after threshold change");
        assertEquals(AlertStatus.PENDING, engine.snapshot("a1").get(5, TimeUnit.SECONDS).orElseThrow().status());
    }

    @Test
    void testDisabledAlertIsUnregistered() throws Exception {
        AlertConfiguration v1 = alert("a1").build();
        engine.register(v1);
        engine.register(v1.withEnabled(false, T0));

        assertTrue(engine.registered("a1").isEmpty());
        assertTrue(ingest(sample("mempool_fee_rate", 99, 0)).isEmpty());
        assertTrue(engine.snapshot("a1").get(5, TimeUnit.SECONDS).isEmpty(), "State dropped with the alert");
    }

    @Test
    void testBlockedListenerHoldsTransitionsUntilReleased() throws Exception {
        CountDownLatch lanesFull = new CountDownLatch(1);
        listener = event -> {
            try {
                lanesFull.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            delivered.add(event);
        };
        engine.register(alert("a1").build());

        CompletableFuture<List<TransitionEvent>> trigger = engine.ingest(sample("mempool_fee_rate", 99, 0));
        CompletableFuture<List<TransitionEvent>> resolve = engine.ingest(sample("mempool_fee_rate", 10, 1));
        Thread.sleep(100);
        assertFalse(trigger.isDone(), "Shard waits for the listener instead of dropping");
        assertTrue(delivered.isEmpty());

        lanesFull.countDown();

        assertEquals(1, trigger.get(5, TimeUnit.SECONDS).size());
        assertEquals(1, resolve.get(5, TimeUnit.SECONDS).size());
        assertEquals(List.of(TransitionKind.TRIGGERED, TransitionKind.RESOLVED),
            delivered.stream().map(TransitionEvent::kind).collect(Collectors.toList()),
            "Every transition delivered, in order");
    }

    @Test
    void testFailingListenerDoesNotStallEvaluation() throws Exception {
        listener = event -> {
            throw new IllegalStateException("listener broken");
        };
        engine.register(alert("a1").build());

        List<TransitionEvent> events = ingest(sample("mempool_fee_rate", 99, 0));
        assertEquals(1, events.size(), "Transition still produced");
        assertEquals(1, ingest(sample("mempool_fee_rate", 10, 1)).size(), "Shard keeps evaluating");
    }

    @Test
    void testEvaluateSingleAlert() throws Exception {
        AlertConfiguration cfg = alert("a1").build();
        engine.register(cfg);

        Optional<TransitionEvent> event = engine.evaluate(cfg, sample("mempool_fee_rate", 99, 0))
            .get(5, TimeUnit.SECONDS);
        assertTrue(event.isPresent());
        assertEquals("a1", event.get().alertId());
    }
}
