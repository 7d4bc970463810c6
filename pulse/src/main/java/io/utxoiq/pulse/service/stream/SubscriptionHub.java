package io.utxoiq.pulse.service.stream;

import io.utxoiq.pulse.domain.stream.StreamEvent;
import io.utxoiq.pulse.domain.stream.StreamTopic;
import io.utxoiq.pulse.domain.stream.Subscription;
import io.utxoiq.pulse.domain.stream.SubscriptionFilter;
import io.utxoiq.pulse.infrastructure.metrics.PulseMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fan-out of signals, insights and alert events to live subscriptions.
 *
 * Publishing assigns the per-topic sequence number, records the event in the topic's
 * replay buffer and queues it on every interested connection, all under the topic lock,
 * so a connection registering with a cursor sees each event exactly once: either in its
 * replay or live. Publishing never waits on a client.
 */
public final class SubscriptionHub implements StreamPublisher, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionHub.class);

    private final ConcurrentMap<String, ClientConnection> connections;
    private final Executor drainPool;
    private final PulseMetrics metrics;
    private final Clock clock;
    private final int queueCapacity;
    private final Map<StreamTopic, TopicState> topics = new EnumMap<>(StreamTopic.class);
    private final AtomicLong retiredDrops = new AtomicLong();

    private ScheduledExecutorService sweeper;

    /**
     * @param connections registry owned by the caller; the hub adds and removes entries
     * @param drainPool   shared pool running connection drain loops
     */
    public SubscriptionHub(ConcurrentMap<String, ClientConnection> connections,
                           Executor drainPool,
                           PulseMetrics metrics,
                           Clock clock,
                           int queueCapacity,
                           int replayCapacity,
                           Duration replayMaxAge) {
        this.connections = connections;
        this.drainPool = drainPool;
        this.metrics = metrics;
        this.clock = clock;
        this.queueCapacity = queueCapacity;
        for (StreamTopic topic : StreamTopic.values()) {
            topics.put(topic, new TopicState(new ReplayBuffer(replayCapacity, replayMaxAge)));
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // PUBLISH
    // ═══════════════════════════════════════════════════════════════

    @Override
    public StreamEvent publish(StreamEvent event) {
        TopicState state = topics.get(event.topic());
        StreamEvent sequenced;
        state.lock.lock();
        try {
            sequenced = event.withSeq(++state.lastSeq);
            state.buffer.append(sequenced, clock.instant());
            OutboundFrame frame = OutboundFrame.data(sequenced);
            for (ClientConnection connection : connections.values()) {
                if (connection.getSubscription().shouldReceive(sequenced)) {
                    connection.offer(frame);
                }
            }
        } finally {
            state.lock.unlock();
        }
        metrics.recordPublished(event.topic());
        return sequenced;
    }

    // ═══════════════════════════════════════════════════════════════
    // CONNECTIONS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Register a connection and queue its replay ahead of any live event.
     *
     * For each topic in the subscription cursor, buffered events after the presented
     * sequence are replayed through the filter. When the next needed event has aged out
     * a GAP frame precedes whatever is still buffered.
     */
    public ClientConnection register(Subscription subscription, FrameSink sink) {
        return register(subscription, sink, null);
    }

    /**
     * @param greeting control frame queued ahead of the replay, may be null
     */
    public ClientConnection register(Subscription subscription, FrameSink sink, OutboundFrame greeting) {
        ClientConnection connection = new ClientConnection(subscription, sink, queueCapacity, drainPool,
            this::teardown);
        List<TopicState> locked = new ArrayList<>();
        try {
            // Fixed topic order so concurrent registrations cannot deadlock.
            for (StreamTopic topic : StreamTopic.values()) {
                TopicState state = topics.get(topic);
                state.lock.lock();
                locked.add(state);
            }
            Instant now = clock.instant();
            if (greeting != null) {
                connection.offer(greeting);
            }
            for (Map.Entry<StreamTopic, Long> cursor : subscription.getCursor().entrySet()) {
                replay(connection, cursor.getKey(), cursor.getValue(), now);
            }
            ClientConnection previous = connections.put(subscription.getConnectionId(), connection);
            if (previous != null) {
                retire(previous);
            }
        } finally {
            for (int i = locked.size() - 1; i >= 0; i--) {
                locked.get(i).lock.unlock();
            }
        }
        metrics.setActiveConnections(connections.size());
        log.info("Subscription {} registered (identity={}, cursor={})", subscription.getConnectionId(),
            subscription.getIdentity(), subscription.getCursor());
        return connection;
    }

    private void replay(ClientConnection connection, StreamTopic topic, long lastSeen, Instant now) {
        TopicState state = topics.get(topic);
        long requested = lastSeen + 1;
        if (lastSeen > state.lastSeq) {
            // cursor from before a restart: sequences were reset, the client must resync
            connection.offer(OutboundFrame.gap(topic, requested, state.lastSeq + 1, now));
            log.info("Replay cursor for {} on {} is ahead of the stream: requested {}, next {}",
                connection.getConnectionId(), topic.wireName(), requested, state.lastSeq + 1);
            return;
        }
        if (requested > state.lastSeq) {
            return;
        }
        List<StreamEvent> missed = state.buffer.after(lastSeen, now);
        long oldest = missed.isEmpty() ? state.lastSeq + 1 : missed.get(0).seq();
        if (oldest > requested) {
            connection.offer(OutboundFrame.gap(topic, requested, oldest, now));
            log.info("Replay gap for {} on {}: requested {}, oldest {}", connection.getConnectionId(),
                topic.wireName(), requested, oldest);
        }
        Subscription subscription = connection.getSubscription();
        for (StreamEvent event : missed) {
            if (subscription.shouldReceive(event)) {
                connection.offer(OutboundFrame.data(event));
            }
        }
    }

    /**
     * Replace the filter of a live connection. Applies to events published afterwards.
     */
    public boolean updateFilter(String connectionId, SubscriptionFilter filter) {
        ClientConnection connection = connections.get(connectionId);
        if (connection == null) {
            return false;
        }
        connection.getSubscription().replaceFilter(filter, clock.instant());
        return true;
    }

    /**
     * Queue a connection-level control frame (ack, error, pong).
     */
    public boolean sendControl(String connectionId, OutboundFrame frame) {
        ClientConnection connection = connections.get(connectionId);
        return connection != null && connection.offer(frame);
    }

    /**
     * Remove a connection, discard its queue and close its sink. Unknown ids are ignored.
     */
    public void teardown(String connectionId) {
        ClientConnection connection = connections.remove(connectionId);
        if (connection == null) {
            return;
        }
        retire(connection);
        metrics.setActiveConnections(connections.size());
        log.info("Subscription {} closed ({} frames dropped)", connectionId, connection.getDropped());
    }

    private void retire(ClientConnection connection) {
        connection.close();
        long unreported = connection.takeUnreportedDrops();
        if (unreported > 0) {
            metrics.recordDroppedFrames(unreported);
        }
        retiredDrops.addAndGet(connection.getDropped());
    }

    // ═══════════════════════════════════════════════════════════════
    // SWEEP
    // ═══════════════════════════════════════════════════════════════

    /**
     * Report new drops to each affected client, send heartbeats when asked, and tear
     * down connections whose sink has closed.
     */
    public void sweep(boolean heartbeat) {
        Instant now = clock.instant();
        for (ClientConnection connection : connections.values()) {
            if (!connection.isOpen()) {
                teardown(connection.getConnectionId());
                continue;
            }
            long newDrops = connection.takeUnreportedDrops();
            if (newDrops > 0) {
                metrics.recordDroppedFrames(newDrops);
                connection.offer(OutboundFrame.dropped(connection.getDropped(), now));
                log.warn("Connection {} dropped {} frames (slow consumer)", connection.getConnectionId(), newDrops);
            }
            if (heartbeat) {
                connection.offer(OutboundFrame.heartbeat(now));
            }
        }
    }

    public void start(Duration sweepInterval) {
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "hub-sweep");
            t.setDaemon(true);
            return t;
        });
        long millis = Math.max(10, sweepInterval.toMillis());
        sweeper.scheduleAtFixedRate(() -> {
            try {
                sweep(true);
            } catch (RuntimeException e) {
                log.error("Hub sweep failed: {}", e.getMessage(), e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
        log.info("SubscriptionHub started with {}ms sweep interval", millis);
    }

    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
        for (String connectionId : new ArrayList<>(connections.keySet())) {
            teardown(connectionId);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // STATS
    // ═══════════════════════════════════════════════════════════════

    public long lastSequence(StreamTopic topic) {
        TopicState state = topics.get(topic);
        state.lock.lock();
        try {
            return state.lastSeq;
        } finally {
            state.lock.unlock();
        }
    }

    public int getConnectionCount() {
        return connections.size();
    }

    public HubStats stats() {
        long drops = retiredDrops.get();
        for (ClientConnection connection : connections.values()) {
            drops += connection.getDropped();
        }
        Map<StreamTopic, Long> sequences = new EnumMap<>(StreamTopic.class);
        for (StreamTopic topic : StreamTopic.values()) {
            sequences.put(topic, lastSequence(topic));
        }
        return new HubStats(connections.size(), drops, sequences);
    }

    private static final class TopicState {
        final ReentrantLock lock = new ReentrantLock();
        final ReplayBuffer buffer;
        long lastSeq;   // guarded by lock

        TopicState(ReplayBuffer buffer) {
            this.buffer = buffer;
        }
    }
}
