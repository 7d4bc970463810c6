package io.utxoiq.pulse.service.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.CollectorRegistry;
import io.utxoiq.pulse.domain.alert.AlertStatus;
import io.utxoiq.pulse.domain.alert.ChannelKind;
import io.utxoiq.pulse.domain.alert.ChannelTarget;
import io.utxoiq.pulse.domain.alert.ComparisonOperator;
import io.utxoiq.pulse.domain.alert.Severity;
import io.utxoiq.pulse.domain.alert.TransitionEvent;
import io.utxoiq.pulse.domain.alert.TransitionKind;
import io.utxoiq.pulse.domain.notification.NotificationRecord;
import io.utxoiq.pulse.domain.notification.NotificationStatus;
import io.utxoiq.pulse.domain.stream.EventType;
import io.utxoiq.pulse.domain.stream.StreamEvent;
import io.utxoiq.pulse.error.TransientUpstreamException;
import io.utxoiq.pulse.infrastructure.channel.ChannelPayload;
import io.utxoiq.pulse.infrastructure.channel.ChannelRegistry;
import io.utxoiq.pulse.infrastructure.channel.DeliveryResult;
import io.utxoiq.pulse.infrastructure.channel.NotificationChannel;
import io.utxoiq.pulse.infrastructure.metrics.PrometheusPulseMetrics;
import io.utxoiq.pulse.testutil.Await;
import io.utxoiq.pulse.testutil.InMemoryNotificationRecordRepository;
import io.utxoiq.pulse.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NotificationDispatcher.
 *
 * Tests:
 * - One record per channel, transition published to the hub
 * - Retry with backoff, then SENT or FAILED
 * - SMS gating and coalescing
 * - Backpressure when a channel lane is full: dispatch blocks, nothing is dropped
 */
class NotificationDispatcherTest {

    private static final Instant T0 = Instant.parse("2026-02-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final InMemoryNotificationRecordRepository records = new InMemoryNotificationRecordRepository();
    private final List<StreamEvent> published = new CopyOnWriteArrayList<>();
    private final AtomicLong seq = new AtomicLong();

    private final ScriptedChannel email = new ScriptedChannel(ChannelKind.EMAIL);
    private final ScriptedChannel chat = new ScriptedChannel(ChannelKind.CHAT_WEBHOOK);
    private final ScriptedChannel sms = new ScriptedChannel(ChannelKind.SMS);

    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = newDispatcher(new ChannelRegistry(List.of(email, chat, sms)), 16, Duration.ofSeconds(1));
    }

    @AfterEach
    void tearDown() {
        email.release();
        chat.release();
        dispatcher.close();
    }

    private NotificationDispatcher newDispatcher(ChannelRegistry registry, int capacity, Duration stallWarning) {
        RetryPolicy policy = RetryPolicy.builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(10))
            .multiplier(2.0)
            .maxAttempts(3)
            .build();
        NotificationDispatcher d = new NotificationDispatcher(registry, records, policy, new CoalescingRule(),
            event -> {
                StreamEvent sequenced = event.withSeq(seq.incrementAndGet());
                published.add(sequenced);
                return sequenced;
            },
            new PrometheusPulseMetrics(new CollectorRegistry()), new ObjectMapper(), clock, capacity, stallWarning);
        d.start(null);
        return d;
    }

    private static TransitionEvent transition(String alertId, TransitionKind kind, Severity severity,
                                              Instant at, ChannelTarget... channels) {
        AlertStatus from = kind == TransitionKind.TRIGGERED ? AlertStatus.PENDING : AlertStatus.TRIGGERED;
        AlertStatus to = kind == TransitionKind.RESOLVED ? AlertStatus.OK : AlertStatus.TRIGGERED;
        return new TransitionEvent(UUID.randomUUID().toString(), alertId, "alice", "Fee spike", kind, from, to,
            "mempool_fee_rate", 120.0, 100.0, ComparisonOperator.GREATER_THAN, severity, List.of(channels), at, 1);
    }

    private NotificationRecord awaitStatus(String id, NotificationStatus status) {
        Await.until(() -> records.get(id).status() == status, "record " + id + " reaches " + status);
        return records.get(id);
    }

    private void awaitAttempts(String id, int attempts) {
        Await.until(() -> records.get(id).attemptCount() == attempts, "record " + id + " has " + attempts + " attempts");
    }

    @Test
    void testOneRecordPerChannelAndAllSent() {
        TransitionEvent event = transition("a1", TransitionKind.TRIGGERED, Severity.WARNING, T0,
            new ChannelTarget(ChannelKind.EMAIL, "ops@example.com"),
            new ChannelTarget(ChannelKind.CHAT_WEBHOOK, "https://hooks.example.com/x"));

        List<NotificationRecord> created = dispatcher.dispatch(event);

        assertEquals(2, created.size());
        assertEquals(NotificationStatus.PENDING, created.get(0).status());
        for (NotificationRecord record : created) {
            NotificationRecord sent = awaitStatus(record.id(), NotificationStatus.SENT);
            assertEquals(1, sent.attemptCount());
            assertEquals(event.id(), sent.transitionId());
            assertEquals(T0, sent.triggeredAt());
            assertNull(sent.resolvedAt());
        }
        assertEquals(List.of("ops@example.com"), email.targets());

        assertEquals(1, published.size());
        StreamEvent alert = published.get(0);
        assertEquals(EventType.ALERT_TRIGGERED, alert.type());
        assertEquals("alice", alert.owner());
        assertEquals(2, alert.payload().get("notifications").size());
        assertEquals("a1", alert.payload().get("alert_id").asText());
    }

    @Test
    void testRetriesAfterBackoffThenSends() {
        email.script(DeliveryResult.failed("smtp 451"), DeliveryResult.delivered("ok"));
        NotificationRecord record = dispatcher.dispatch(transition("a1", TransitionKind.TRIGGERED, Severity.WARNING,
            T0, new ChannelTarget(ChannelKind.EMAIL, "ops@example.com"))).get(0);

        awaitAttempts(record.id(), 1);
        NotificationRecord waiting = records.get(record.id());
        assertEquals(NotificationStatus.PENDING, waiting.status());
        assertEquals(T0.plusSeconds(1), waiting.nextAttemptAt(), "First retry after the initial delay");
        assertEquals("smtp 451", waiting.lastError());

        assertEquals(0, dispatcher.sweep(), "Not due yet");
        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, dispatcher.sweep());

        NotificationRecord sent = awaitStatus(record.id(), NotificationStatus.SENT);
        assertEquals(2, sent.attemptCount());
        assertNull(sent.nextAttemptAt());
        assertEquals(0, dispatcher.outstanding(ChannelKind.EMAIL));
    }

    @Test
    void testThrownUpstreamErrorIsRetried() {
        email.script(new TransientUpstreamException("email", "connection reset"), DeliveryResult.delivered("ok"));
        NotificationRecord record = dispatcher.dispatch(transition("a1", TransitionKind.TRIGGERED, Severity.WARNING,
            T0, new ChannelTarget(ChannelKind.EMAIL, "ops@example.com"))).get(0);

        awaitAttempts(record.id(), 1);
        clock.advance(Duration.ofSeconds(1));
        dispatcher.sweep();

        assertEquals(2, awaitStatus(record.id(), NotificationStatus.SENT).attemptCount());
    }

    @Test
    void testExhaustedRetriesFailAndPublishFailure() {
        email.alwaysFail("mailbox unavailable");
        NotificationRecord record = dispatcher.dispatch(transition("a1", TransitionKind.TRIGGERED, Severity.CRITICAL,
            T0, new ChannelTarget(ChannelKind.EMAIL, "ops@example.com"))).get(0);

        awaitAttempts(record.id(), 1);
        clock.advance(Duration.ofSeconds(1));
        dispatcher.sweep();
        awaitAttempts(record.id(), 2);
        assertEquals(clock.instant().plusSeconds(2), records.get(record.id()).nextAttemptAt(), "Backoff doubles");
        clock.advance(Duration.ofSeconds(2));
        dispatcher.sweep();

        NotificationRecord failed = awaitStatus(record.id(), NotificationStatus.FAILED);
        assertEquals(3, failed.attemptCount(), "Bounded by max attempts");
        assertEquals("mailbox unavailable", failed.lastError());
        assertEquals(3, email.attempts());

        Await.until(() -> published.stream().anyMatch(e -> e.type() == EventType.ALERT_DELIVERY_FAILED),
            "failure event published");
        StreamEvent failure = published.stream()
            .filter(e -> e.type() == EventType.ALERT_DELIVERY_FAILED).findFirst().orElseThrow();
        assertEquals("alice", failure.owner(), "Failure is scoped to the alert owner");
        assertEquals(record.id(), failure.payload().get("notification_id").asText());
        assertEquals(3, failure.payload().get("attempts").asInt());
    }

    @Test
    void testSmsOnlyForCriticalTriggers() {
        ChannelTarget phone = new ChannelTarget(ChannelKind.SMS, "+15550100");

        NotificationRecord warning = dispatcher.dispatch(
            transition("a1", TransitionKind.TRIGGERED, Severity.WARNING, T0, phone)).get(0);
        assertEquals(NotificationStatus.SUPPRESSED, warning.status());
        assertEquals(NotificationDispatcher.SMS_CRITICAL_ONLY, warning.lastError());

        NotificationRecord critical = dispatcher.dispatch(
            transition("a2", TransitionKind.TRIGGERED, Severity.CRITICAL, T0, phone)).get(0);
        awaitStatus(critical.id(), NotificationStatus.SENT);

        NotificationRecord resolved = dispatcher.dispatch(
            transition("a2", TransitionKind.RESOLVED, Severity.CRITICAL, T0.plusSeconds(60), phone)).get(0);
        assertEquals(NotificationStatus.SUPPRESSED, resolved.status());
        assertEquals(NotificationDispatcher.SMS_NO_RESOLUTION, resolved.lastError());
        assertEquals(T0.plusSeconds(60), resolved.resolvedAt());

        assertEquals(1, sms.attempts(), "Only the critical trigger was texted");
    }

    @Test
    void testUnregisteredChannelIsSuppressed() {
        dispatcher.close();
        dispatcher = newDispatcher(new ChannelRegistry(List.of(email)), 16, Duration.ofSeconds(1));

        List<NotificationRecord> created = dispatcher.dispatch(transition("a1", TransitionKind.TRIGGERED,
            Severity.WARNING, T0,
            new ChannelTarget(ChannelKind.CHAT_WEBHOOK, "https://hooks.example.com/x"),
            new ChannelTarget(ChannelKind.EMAIL, "ops@example.com")));

        assertEquals(NotificationStatus.SUPPRESSED, created.get(0).status());
        awaitStatus(created.get(1).id(), NotificationStatus.SENT);
        assertEquals(2, records.all().size(), "Suppressed deliveries are still recorded");
    }

    @Test
    void testNewerTransitionSupersedesPendingRetry() {
        email.script(DeliveryResult.failed("smtp 451"), DeliveryResult.delivered("ok"));
        ChannelTarget target = new ChannelTarget(ChannelKind.EMAIL, "ops@example.com");

        NotificationRecord trigger = dispatcher.dispatch(
            transition("a1", TransitionKind.TRIGGERED, Severity.WARNING, T0, target)).get(0);
        awaitAttempts(trigger.id(), 1);

        NotificationRecord resolve = dispatcher.dispatch(
            transition("a1", TransitionKind.RESOLVED, Severity.WARNING, T0.plusSeconds(30), target)).get(0);

        NotificationRecord superseded = records.get(trigger.id());
        assertEquals(NotificationStatus.SUPPRESSED, superseded.status());
        assertEquals(CoalescingRule.SUPERSEDED, superseded.lastError());

        awaitStatus(resolve.id(), NotificationStatus.SENT);
        clock.advance(Duration.ofSeconds(5));
        assertEquals(0, dispatcher.sweep(), "Superseded retry never resurfaces");
        assertEquals(2, email.attempts());
    }

    @Test
    void testFailedSendSupersededWhileInFlightIsNotRetried() {
        email.script(DeliveryResult.failed("smtp 451"), DeliveryResult.delivered("ok"));
        email.hold();
        ChannelTarget target = new ChannelTarget(ChannelKind.EMAIL, "ops@example.com");

        NotificationRecord trigger = dispatcher.dispatch(
            transition("a1", TransitionKind.TRIGGERED, Severity.WARNING, T0, target)).get(0);
        Await.until(() -> email.entered() == 1, "trigger send in flight");

        NotificationRecord resolve = dispatcher.dispatch(
            transition("a1", TransitionKind.RESOLVED, Severity.WARNING, T0.plusSeconds(30), target)).get(0);
        assertEquals(NotificationStatus.PENDING, records.get(trigger.id()).status(), "In-flight send is not interrupted");

        email.release();

        NotificationRecord superseded = awaitStatus(trigger.id(), NotificationStatus.SUPPRESSED);
        assertEquals(CoalescingRule.SUPERSEDED, superseded.lastError());
        assertEquals(1, superseded.attemptCount());
        assertNull(superseded.nextAttemptAt());
        awaitStatus(resolve.id(), NotificationStatus.SENT);

        clock.advance(Duration.ofSeconds(5));
        assertEquals(0, dispatcher.sweep(), "Stale trigger never follows the resolution");
        assertEquals(2, email.attempts());
        assertEquals(0, dispatcher.outstanding(ChannelKind.EMAIL));
    }

    @Test
    void testFullLaneBlocksDispatchUntilCapacityFrees() throws Exception {
        dispatcher.close();
        dispatcher = newDispatcher(new ChannelRegistry(List.of(email, chat, sms)), 1, Duration.ofMillis(50));
        chat.hold();
        ChannelTarget hook = new ChannelTarget(ChannelKind.CHAT_WEBHOOK, "https://hooks.example.com/x");

        NotificationRecord first = dispatcher.dispatch(
            transition("a1", TransitionKind.TRIGGERED, Severity.WARNING, T0, hook)).get(0);
        assertEquals(1, dispatcher.outstanding(ChannelKind.CHAT_WEBHOOK));

        CompletableFuture<List<NotificationRecord>> second = CompletableFuture.supplyAsync(() -> dispatcher.dispatch(
            transition("a2", TransitionKind.TRIGGERED, Severity.WARNING, T0, hook)));
        Thread.sleep(200);
        assertFalse(second.isDone(), "Dispatch waits past the stall warning instead of giving up");
        assertTrue(records.findByAlertId("a2", 10).isEmpty());

        // other lanes are unaffected
        NotificationRecord mail = dispatcher.dispatch(transition("a3", TransitionKind.TRIGGERED, Severity.WARNING,
            T0, new ChannelTarget(ChannelKind.EMAIL, "ops@example.com"))).get(0);
        awaitStatus(mail.id(), NotificationStatus.SENT);

        chat.release();
        awaitStatus(first.id(), NotificationStatus.SENT);
        NotificationRecord admitted = second.get(5, TimeUnit.SECONDS).get(0);
        awaitStatus(admitted.id(), NotificationStatus.SENT);
        assertEquals(1, records.findByAlertId("a2", 10).size(), "Nothing lost to backpressure");
        assertEquals(0, dispatcher.outstanding(ChannelKind.CHAT_WEBHOOK));
        assertEquals(3, published.size());
    }

    /**
     * Channel whose outcomes are scripted per attempt; defaults to success.
     */
    private static final class ScriptedChannel implements NotificationChannel {
        private final ChannelKind kind;
        private final Queue<Object> script = new ConcurrentLinkedQueue<>();
        private final List<String> targets = Collections.synchronizedList(new ArrayList<>());
        private final AtomicInteger attempts = new AtomicInteger();
        private final AtomicInteger entered = new AtomicInteger();
        private volatile String failAlways;
        private volatile CountDownLatch gate;

        ScriptedChannel(ChannelKind kind) {
            this.kind = kind;
        }

        void script(Object... outcomes) {
            Collections.addAll(script, outcomes);
        }

        void alwaysFail(String error) {
            failAlways = error;
        }

        void hold() {
            gate = new CountDownLatch(1);
        }

        void release() {
            CountDownLatch g = gate;
            if (g != null) {
                g.countDown();
            }
        }

        int attempts() {
            return attempts.get();
        }

        int entered() {
            return entered.get();
        }

        List<String> targets() {
            return new ArrayList<>(targets);
        }

        @Override
        public ChannelKind kind() {
            return kind;
        }

        @Override
        public DeliveryResult send(String target, ChannelPayload payload) {
            entered.incrementAndGet();
            CountDownLatch g = gate;
            if (g != null) {
                try {
                    g.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            attempts.incrementAndGet();
            targets.add(target);
            if (failAlways != null) {
                return DeliveryResult.failed(failAlways);
            }
            Object next = script.poll();
            if (next instanceof RuntimeException) {
                throw (RuntimeException) next;
            }
            return next == null ? DeliveryResult.delivered("ok") : (DeliveryResult) next;
        }
    }
}
