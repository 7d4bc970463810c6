package io.utxoiq.pulse.service.stream;

import io.utxoiq.pulse.domain.stream.Subscription;
import io.utxoiq.pulse.error.ConnectionLostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * One live connection: its subscription, a bounded outbound FIFO and a drain loop.
 *
 * The producer never waits: when the queue is full the oldest frame is dropped and
 * counted. At most one drain runs per connection; drains share the hub's pool.
 */
public final class ClientConnection {
    private static final Logger log = LoggerFactory.getLogger(ClientConnection.class);

    private final Subscription subscription;
    private final FrameSink sink;
    private final int queueCapacity;
    private final Executor drainPool;
    private final Consumer<String> onLost;

    private final Deque<OutboundFrame> queue = new ArrayDeque<>();   // guarded by this
    private boolean draining;                                         // guarded by this
    private boolean closed;                                           // guarded by this
    private long dropped;                                             // guarded by this
    private long reportedDrops;                                       // guarded by this

    ClientConnection(Subscription subscription, FrameSink sink, int queueCapacity, Executor drainPool,
                     Consumer<String> onLost) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1");
        }
        this.subscription = subscription;
        this.sink = sink;
        this.queueCapacity = queueCapacity;
        this.drainPool = drainPool;
        this.onLost = onLost;
    }

    public Subscription getSubscription() {
        return subscription;
    }

    public String getConnectionId() {
        return subscription.getConnectionId();
    }

    /**
     * Queue a frame, dropping the oldest queued frame when full.
     *
     * @return false if the connection is closed
     */
    public boolean offer(OutboundFrame frame) {
        synchronized (this) {
            if (closed) {
                return false;
            }
            if (queue.size() >= queueCapacity) {
                queue.pollFirst();
                dropped++;
            }
            queue.addLast(frame);
            if (draining) {
                return true;
            }
            draining = true;
        }
        scheduleDrain();
        return true;
    }

    private void scheduleDrain() {
        try {
            drainPool.execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.warn("Drain rejected for {}: {}", getConnectionId(), e.getMessage());
            synchronized (this) {
                draining = false;
            }
        }
    }

    private void drain() {
        while (true) {
            OutboundFrame next;
            synchronized (this) {
                next = closed ? null : queue.pollFirst();
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            try {
                sink.send(next);
            } catch (ConnectionLostException e) {
                log.info("Connection {} lost: {}", getConnectionId(), e.getCause() == null
                    ? e.getMessage() : e.getCause().toString());
                synchronized (this) {
                    draining = false;
                }
                onLost.accept(getConnectionId());
                return;
            } catch (RuntimeException e) {
                log.warn("Failed to send {} frame to {}: {}", next.type(), getConnectionId(), e.toString());
            }
        }
    }

    /**
     * Drop count not yet reported to the client; marks it reported.
     */
    synchronized long takeUnreportedDrops() {
        long delta = dropped - reportedDrops;
        reportedDrops = dropped;
        return delta;
    }

    public synchronized long getDropped() {
        return dropped;
    }

    public synchronized int queued() {
        return queue.size();
    }

    public boolean isOpen() {
        synchronized (this) {
            if (closed) {
                return false;
            }
        }
        return sink.isOpen();
    }

    /**
     * Stop draining, discard queued frames and close the sink. Idempotent.
     */
    void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            queue.clear();
        }
        try {
            sink.close();
        } catch (RuntimeException e) {
            log.debug("Sink close failed for {}: {}", getConnectionId(), e.toString());
        }
    }
}
