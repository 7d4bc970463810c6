package io.utxoiq.pulse.testutil;

import io.utxoiq.pulse.domain.stream.EventType;
import io.utxoiq.pulse.error.ConnectionLostException;
import io.utxoiq.pulse.service.stream.FrameSink;
import io.utxoiq.pulse.service.stream.OutboundFrame;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Collects frames; can be made to block (slow consumer) or fail (lost peer).
 */
public final class RecordingFrameSink implements FrameSink {
    private final List<OutboundFrame> frames = new ArrayList<>();
    private final String connectionId;
    private volatile boolean open = true;
    private volatile boolean failing;
    private volatile CountDownLatch gate;

    public RecordingFrameSink(String connectionId) {
        this.connectionId = connectionId;
    }

    @Override
    public void send(OutboundFrame frame) {
        CountDownLatch g = gate;
        if (g != null) {
            try {
                g.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (failing) {
            throw new ConnectionLostException(connectionId, new IllegalStateException("peer gone"));
        }
        synchronized (frames) {
            frames.add(frame);
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }

    /** Block every send until {@link #release()}. */
    public void hold() {
        gate = new CountDownLatch(1);
    }

    public void release() {
        CountDownLatch g = gate;
        gate = null;
        if (g != null) {
            g.countDown();
        }
    }

    public void failNextSends() {
        failing = true;
    }

    public List<OutboundFrame> frames() {
        synchronized (frames) {
            return new ArrayList<>(frames);
        }
    }

    public List<OutboundFrame> dataFrames() {
        return frames().stream().filter(OutboundFrame::isData).toList();
    }

    public List<OutboundFrame> framesOfType(EventType type) {
        return frames().stream().filter(f -> f.type() == type).toList();
    }
}
