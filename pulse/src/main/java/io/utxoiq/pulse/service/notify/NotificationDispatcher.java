package io.utxoiq.pulse.service.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.utxoiq.pulse.application.port.output.NotificationRecordRepository;
import io.utxoiq.pulse.domain.alert.ChannelKind;
import io.utxoiq.pulse.domain.alert.ChannelTarget;
import io.utxoiq.pulse.domain.alert.Severity;
import io.utxoiq.pulse.domain.alert.TransitionEvent;
import io.utxoiq.pulse.domain.alert.TransitionKind;
import io.utxoiq.pulse.domain.notification.NotificationRecord;
import io.utxoiq.pulse.domain.notification.NotificationStatus;
import io.utxoiq.pulse.domain.signal.SignalCategory;
import io.utxoiq.pulse.domain.stream.EventType;
import io.utxoiq.pulse.domain.stream.StreamEvent;
import io.utxoiq.pulse.error.CapacityExceededException;
import io.utxoiq.pulse.error.TransientUpstreamException;
import io.utxoiq.pulse.infrastructure.channel.ChannelPayload;
import io.utxoiq.pulse.infrastructure.channel.ChannelRegistry;
import io.utxoiq.pulse.infrastructure.channel.DeliveryResult;
import io.utxoiq.pulse.infrastructure.metrics.PulseMetrics;
import io.utxoiq.pulse.service.alert.TransitionListener;
import io.utxoiq.pulse.service.stream.StreamPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Turns transitions into channel deliveries.
 *
 * One record per configured channel. Each channel kind has its own lane: a bounded
 * number of outstanding deliveries (dispatch blocks while the lane is full), a ready
 * queue drained by a single worker, and a set of deliveries waiting for a retry
 * deadline. One periodic {@link #sweep()} moves due retries back to the ready queue.
 */
public final class NotificationDispatcher implements TransitionListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    static final String SMS_CRITICAL_ONLY = "sms is only sent for critical alerts";
    static final String SMS_NO_RESOLUTION = "sms is not sent for resolutions";

    private final ChannelRegistry channels;
    private final NotificationRecordRepository records;
    private final RetryPolicy retryPolicy;
    private final CoalescingRule coalescing;
    private final StreamPublisher publisher;
    private final PulseMetrics metrics;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final int capacityPerChannel;
    private final Duration stallWarning;     // null = wait silently

    private final Map<ChannelKind, Lane> lanes = new EnumMap<>(ChannelKind.class);
    private final List<Thread> workers = new ArrayList<>();
    private ScheduledExecutorService sweeper;
    private volatile boolean running;

    public NotificationDispatcher(ChannelRegistry channels,
                                  NotificationRecordRepository records,
                                  RetryPolicy retryPolicy,
                                  CoalescingRule coalescing,
                                  StreamPublisher publisher,
                                  PulseMetrics metrics,
                                  ObjectMapper mapper,
                                  Clock clock,
                                  int capacityPerChannel,
                                  Duration stallWarning) {
        if (capacityPerChannel < 1) {
            throw new IllegalArgumentException("capacityPerChannel must be >= 1");
        }
        this.channels = channels;
        this.records = records;
        this.retryPolicy = retryPolicy;
        this.coalescing = coalescing;
        this.publisher = publisher;
        this.metrics = metrics;
        this.mapper = mapper;
        this.clock = clock;
        this.capacityPerChannel = capacityPerChannel;
        this.stallWarning = stallWarning;
        for (ChannelKind kind : ChannelKind.values()) {
            lanes.put(kind, new Lane(kind, capacityPerChannel));
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Start one delivery worker per channel kind, plus the retry sweep when
     * {@code sweepInterval} is non-null (tests drive {@link #sweep()} themselves).
     */
    public synchronized void start(Duration sweepInterval) {
        if (running) {
            return;
        }
        running = true;
        for (Lane lane : lanes.values()) {
            Thread worker = new Thread(() -> runWorker(lane), "notify-" + lane.kind.name().toLowerCase());
            worker.setDaemon(true);
            worker.start();
            workers.add(worker);
        }
        if (sweepInterval != null) {
            sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "notify-sweep");
                t.setDaemon(true);
                return t;
            });
            long millis = Math.max(10, sweepInterval.toMillis());
            sweeper.scheduleAtFixedRate(this::sweepSafely, millis, millis, TimeUnit.MILLISECONDS);
        }
        log.info("[DISPATCH] Started {} workers, capacity {} per channel", workers.size(), capacityPerChannel);
    }

    @Override
    public synchronized void close() {
        running = false;
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
        for (Thread worker : workers) {
            worker.interrupt();
        }
        for (Thread worker : workers) {
            try {
                worker.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        workers.clear();
        log.info("[DISPATCH] Stopped");
    }

    // ═══════════════════════════════════════════════════════════════
    // DISPATCH
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void onTransition(TransitionEvent event) {
        dispatch(event);
    }

    /**
     * Create one record per channel and queue the deliveries. Blocks for as long as a
     * channel lane is full; nothing is dropped for lack of capacity. A warning is logged
     * each time a wait exceeds the stall warning interval.
     *
     * @throws CapacityExceededException only when the calling thread is interrupted while
     *         waiting; records admitted before that are unaffected
     */
    public List<NotificationRecord> dispatch(TransitionEvent event) {
        List<NotificationRecord> created = new ArrayList<>();
        try {
            for (ChannelTarget target : event.channels()) {
                created.add(admit(event, target));
            }
        } finally {
            publishTransition(event, created);
        }
        return created;
    }

    private NotificationRecord admit(TransitionEvent event, ChannelTarget target) {
        Instant now = clock.instant();
        NotificationRecord record = new NotificationRecord(
            UUID.randomUUID().toString(),
            event.alertId(),
            event.id(),
            event.kind(),
            target.kind(),
            target.target(),
            NotificationStatus.PENDING,
            0,
            event.occurredAt(),
            event.kind() == TransitionKind.RESOLVED ? event.occurredAt() : null,
            now,
            null,
            now
        );
        Lane lane = lanes.get(target.kind());

        String gate = gateReason(event, target.kind());
        if (gate == null && !channels.supports(target.kind())) {
            gate = "no channel registered for " + target.kind();
        }
        // Latest state wins, gated or not; superseding first also frees lane capacity.
        lane.supersedeQueued(record);
        if (gate != null) {
            NotificationRecord suppressed = record.withStatus(NotificationStatus.SUPPRESSED, gate, now);
            insert(suppressed);
            metrics.recordDeliveryOutcome(target.kind(), NotificationStatus.SUPPRESSED);
            log.debug("[DISPATCH] {} for alert {} suppressed: {}", target.kind(), event.alertId(), gate);
            return suppressed;
        }

        acquire(lane);
        insert(record);
        lane.enqueue(new Delivery(record, ChannelPayload.of(event), event.owner()));
        metrics.setOutstandingDeliveries(lane.kind, lane.outstanding());
        return record;
    }

    /**
     * SMS goes out only for critical triggers and re-notifications.
     */
    static String gateReason(TransitionEvent event, ChannelKind kind) {
        if (kind != ChannelKind.SMS) {
            return null;
        }
        if (event.kind() == TransitionKind.RESOLVED) {
            return SMS_NO_RESOLUTION;
        }
        if (event.severity() != Severity.CRITICAL) {
            return SMS_CRITICAL_ONLY;
        }
        return null;
    }

    private void acquire(Lane lane) {
        try {
            if (stallWarning == null) {
                lane.capacity.acquire();
                return;
            }
            long waited = 0;
            while (!lane.capacity.tryAcquire(stallWarning.toMillis(), TimeUnit.MILLISECONDS)) {
                waited += stallWarning.toMillis();
                log.warn("[DISPATCH] {} lane full, dispatch waiting for {} ms", lane.kind, waited);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapacityExceededException("notification channel " + lane.kind, Duration.ofSeconds(1));
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // DELIVERY
    // ═══════════════════════════════════════════════════════════════

    private void runWorker(Lane lane) {
        while (running) {
            Delivery delivery;
            try {
                delivery = lane.ready.poll(200, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (delivery != null && lane.markInFlight(delivery)) {
                attempt(lane, delivery);
            }
        }
    }

    private void attempt(Lane lane, Delivery delivery) {
        NotificationRecord record = delivery.record;
        long start = System.nanoTime();

        DeliveryResult result;
        try {
            result = channels.get(lane.kind).send(record.target(), delivery.payload);
        } catch (TransientUpstreamException e) {
            result = DeliveryResult.failed(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("[DISPATCH] {} channel threw unexpectedly: {}", lane.kind, e.toString());
            result = DeliveryResult.failed(e.toString());
        }
        metrics.recordDeliveryAttempt(lane.kind, result.success(), Duration.ofNanos(System.nanoTime() - start));

        Instant now = clock.instant();
        int attemptsMade = record.attemptCount() + 1;

        if (result.success()) {
            finish(lane, delivery, record.withAttempt(null, null, now).withStatus(NotificationStatus.SENT, null, now));
            log.info("[DISPATCH] {} {} sent to {} for alert {} (attempt {})", record.transitionKind(),
                lane.kind, record.target(), record.alertId(), attemptsMade);
            return;
        }

        if (retryPolicy.shouldRetry(attemptsMade)) {
            Instant next = now.plus(retryPolicy.delayAfter(attemptsMade));
            NotificationRecord retrying = record.withAttempt(next, result.detail(), now);
            if (!lane.awaitRetry(delivery, retrying)) {
                NotificationRecord suppressed = delivery.record;
                update(suppressed);
                metrics.recordDeliveryOutcome(lane.kind, NotificationStatus.SUPPRESSED);
                metrics.setOutstandingDeliveries(lane.kind, lane.outstanding());
                log.info("[DISPATCH] {} {} for alert {} failed and was superseded while in flight; not retried",
                    lane.kind, record.transitionKind(), record.alertId());
                return;
            }
            update(retrying);
            log.warn("[DISPATCH] {} to {} failed (attempt {}/{}), retry at {}: {}", lane.kind, record.target(),
                attemptsMade, retryPolicy.getMaxAttempts(), next, result.detail());
            return;
        }

        NotificationRecord failed = record.withAttempt(null, result.detail(), now)
            .withStatus(NotificationStatus.FAILED, result.detail(), now);
        finish(lane, delivery, failed);
        log.error("[DISPATCH] {} to {} for alert {} FAILED after {} attempts: {}", lane.kind, record.target(),
            record.alertId(), attemptsMade, result.detail());
        publishFailure(delivery, failed);
    }

    private void finish(Lane lane, Delivery delivery, NotificationRecord terminal) {
        lane.complete(delivery, terminal);
        update(terminal);
        metrics.recordDeliveryOutcome(lane.kind, terminal.status());
        metrics.setOutstandingDeliveries(lane.kind, lane.outstanding());
    }

    /**
     * Move deliveries whose retry deadline has passed back to their ready queue.
     */
    public int sweep() {
        Instant now = clock.instant();
        int due = 0;
        for (Lane lane : lanes.values()) {
            due += lane.releaseDue(now);
        }
        return due;
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("[DISPATCH] Retry sweep failed: {}", e.getMessage(), e);
        }
    }

    public int outstanding(ChannelKind kind) {
        return lanes.get(kind).outstanding();
    }

    // ═══════════════════════════════════════════════════════════════
    // PERSISTENCE / HUB
    // ═══════════════════════════════════════════════════════════════

    private void insert(NotificationRecord record) {
        try {
            records.insert(record);
        } catch (RuntimeException e) {
            log.error("[DISPATCH] Failed to persist record {}: {}", record.id(), e.getMessage());
        }
    }

    private void update(NotificationRecord record) {
        try {
            records.update(record);
        } catch (RuntimeException e) {
            log.error("[DISPATCH] Failed to update record {}: {}", record.id(), e.getMessage());
        }
    }

    private void publishTransition(TransitionEvent event, List<NotificationRecord> created) {
        ObjectNode payload = transitionPayload(event);
        ArrayNode deliveries = payload.putArray("notifications");
        for (NotificationRecord record : created) {
            ObjectNode node = deliveries.addObject();
            node.put("id", record.id());
            node.put("channel", record.channel().name());
            node.put("status", record.status().name());
        }
        EventType type = switch (event.kind()) {
            case TRIGGERED -> EventType.ALERT_TRIGGERED;
            case RESOLVED -> EventType.ALERT_RESOLVED;
            case RENOTIFY -> EventType.ALERT_RENOTIFY;
        };
        publish(StreamEvent.alert(type, event.metric(), SignalCategory.ofMetric(event.metric()).wireName(),
            event.severity(), event.owner(), payload, clock.instant()));
    }

    private void publishFailure(Delivery delivery, NotificationRecord failed) {
        ObjectNode payload = mapper.createObjectNode();
        ChannelPayload content = delivery.payload;
        payload.put("alert_id", failed.alertId());
        payload.put("alert_name", content.alertName());
        payload.put("transition_id", failed.transitionId());
        payload.put("transition_kind", failed.transitionKind().name());
        payload.put("notification_id", failed.id());
        payload.put("channel", failed.channel().name());
        payload.put("attempts", failed.attemptCount());
        payload.put("error", failed.lastError());
        publish(StreamEvent.alert(EventType.ALERT_DELIVERY_FAILED, content.metric(),
            SignalCategory.ofMetric(content.metric()).wireName(), content.severity(), delivery.owner,
            payload, clock.instant()));
    }

    private void publish(StreamEvent event) {
        try {
            publisher.publish(event);
        } catch (RuntimeException e) {
            log.error("[DISPATCH] Failed to publish {} to hub: {}", event.type(), e.getMessage());
        }
    }

    private ObjectNode transitionPayload(TransitionEvent event) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("transition_id", event.id());
        payload.put("alert_id", event.alertId());
        payload.put("alert_name", event.alertName());
        payload.put("kind", event.kind().name());
        payload.put("from", event.from().name());
        payload.put("to", event.to().name());
        payload.put("metric", event.metric());
        payload.put("observed_value", event.observedValue());
        payload.put("operator", event.operator().symbol());
        payload.put("threshold", event.threshold());
        payload.put("severity", event.severity().name());
        payload.put("occurred_at", event.occurredAt().toString());
        payload.put("configuration_version", event.configurationVersion());
        return payload;
    }

    // ═══════════════════════════════════════════════════════════════
    // LANES
    // ═══════════════════════════════════════════════════════════════

    private enum Stage { QUEUED, WAITING, IN_FLIGHT, DONE }

    private static final class Delivery {
        final ChannelPayload payload;
        final String owner;
        volatile NotificationRecord record;
        Stage stage = Stage.QUEUED;     // guarded by the lane

        Delivery(NotificationRecord record, ChannelPayload payload, String owner) {
            this.record = record;
            this.payload = payload;
            this.owner = owner;
        }
    }

    private final class Lane {
        final ChannelKind kind;
        final Semaphore capacity;
        final BlockingQueue<Delivery> ready = new LinkedBlockingQueue<>();
        final Set<Delivery> waiting = new LinkedHashSet<>();
        final Map<String, Delivery> latestByKey = new HashMap<>();

        Lane(ChannelKind kind, int capacity) {
            this.kind = kind;
            this.capacity = new Semaphore(capacity, true);
        }

        int outstanding() {
            return capacityPerChannel - capacity.availablePermits();
        }

        synchronized void enqueue(Delivery delivery) {
            supersedeQueued(delivery.record);
            latestByKey.put(coalescing.key(delivery.record), delivery);
            ready.add(delivery);
        }

        /**
         * Apply the coalescing rule to the queued or waiting delivery for the same key.
         */
        synchronized void supersedeQueued(NotificationRecord incoming) {
            Delivery earlier = latestByKey.get(coalescing.key(incoming));
            if (earlier == null || earlier.stage == Stage.DONE) {
                return;
            }
            if (!coalescing.supersedes(incoming, earlier.record, earlier.stage == Stage.IN_FLIGHT)) {
                return;
            }
            Instant now = clock.instant();
            NotificationRecord suppressed = earlier.record.withStatus(NotificationStatus.SUPPRESSED,
                CoalescingRule.SUPERSEDED, now);
            waiting.remove(earlier);
            earlier.stage = Stage.DONE;
            earlier.record = suppressed;
            latestByKey.remove(coalescing.key(incoming), earlier);
            capacity.release();
            update(suppressed);
            metrics.recordDeliveryOutcome(kind, NotificationStatus.SUPPRESSED);
            log.info("[DISPATCH] {} {} for alert {} suppressed by newer {}", kind, earlier.record.transitionKind(),
                incoming.alertId(), incoming.transitionKind());
        }

        synchronized boolean markInFlight(Delivery delivery) {
            if (delivery.stage != Stage.QUEUED) {
                return false;
            }
            delivery.stage = Stage.IN_FLIGHT;
            return true;
        }

        /**
         * Park a failed delivery until its retry deadline. A newer delivery for the same
         * key that arrived while this one was in flight wins instead: this one ends
         * SUPPRESSED and {@code false} is returned.
         */
        synchronized boolean awaitRetry(Delivery delivery, NotificationRecord retrying) {
            String key = coalescing.key(retrying);
            if (latestByKey.get(key) != delivery) {
                delivery.record = retrying.withStatus(NotificationStatus.SUPPRESSED, CoalescingRule.SUPERSEDED,
                    retrying.updatedAt());
                delivery.stage = Stage.DONE;
                capacity.release();
                return false;
            }
            delivery.record = retrying;
            delivery.stage = Stage.WAITING;
            waiting.add(delivery);
            return true;
        }

        synchronized void complete(Delivery delivery, NotificationRecord terminal) {
            delivery.record = terminal;
            delivery.stage = Stage.DONE;
            latestByKey.remove(coalescing.key(terminal), delivery);
            capacity.release();
        }

        synchronized int releaseDue(Instant now) {
            int due = 0;
            Iterator<Delivery> it = waiting.iterator();
            while (it.hasNext()) {
                Delivery delivery = it.next();
                Instant next = delivery.record.nextAttemptAt();
                if (next == null || !now.isBefore(next)) {
                    it.remove();
                    delivery.stage = Stage.QUEUED;
                    ready.add(delivery);
                    due++;
                }
            }
            return due;
        }
    }
}
