package io.utxoiq.pulse.service.stream;

import io.utxoiq.pulse.domain.stream.StreamEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Recent events of one topic, bounded by count and by age since publication.
 * Not thread-safe: the hub guards each buffer with its topic lock.
 */
final class ReplayBuffer {
    private final int capacity;
    private final Duration maxAge;
    private final Deque<Entry> events = new ArrayDeque<>();

    ReplayBuffer(int capacity, Duration maxAge) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.maxAge = maxAge;
    }

    void append(StreamEvent event, Instant now) {
        events.addLast(new Entry(event, now));
        while (events.size() > capacity) {
            events.pollFirst();
        }
        prune(now);
    }

    /**
     * Events with a sequence number greater than {@code afterSeq}, oldest first.
     */
    List<StreamEvent> after(long afterSeq, Instant now) {
        prune(now);
        List<StreamEvent> result = new ArrayList<>();
        for (Entry entry : events) {
            if (entry.event().seq() > afterSeq) {
                result.add(entry.event());
            }
        }
        return result;
    }

    /**
     * @return sequence of the oldest retained event, or -1 when empty
     */
    long oldestSeq() {
        Entry first = events.peekFirst();
        return first == null ? -1 : first.event().seq();
    }

    int size() {
        return events.size();
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(maxAge);
        while (!events.isEmpty() && events.peekFirst().publishedAt().isBefore(cutoff)) {
            events.pollFirst();
        }
    }

    private record Entry(StreamEvent event, Instant publishedAt) {
    }
}
