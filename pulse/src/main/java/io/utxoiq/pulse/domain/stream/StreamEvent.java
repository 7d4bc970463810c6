package io.utxoiq.pulse.domain.stream;

import com.fasterxml.jackson.databind.JsonNode;
import io.utxoiq.pulse.domain.alert.Severity;

import java.time.Instant;

/**
 * Event published into the subscription hub.
 *
 * {@code seq} is 0 until the hub assigns the per-topic sequence number.
 * {@code owner} restricts delivery to one user's connections (alert events);
 * null means visible to every matching subscription.
 */
public record StreamEvent(
    long seq,
    StreamTopic topic,
    EventType type,
    String signalType,
    String category,
    Severity severity,
    String owner,
    JsonNode payload,
    Instant ts
) {
    public static StreamEvent signal(String signalType, String category, JsonNode payload, Instant ts) {
        return new StreamEvent(0, StreamTopic.SIGNALS, EventType.SIGNAL, signalType, category, null, null,
            payload, ts);
    }

    public static StreamEvent insight(String signalType, String category, JsonNode payload, Instant ts) {
        return new StreamEvent(0, StreamTopic.INSIGHTS, EventType.INSIGHT, signalType, category, null, null,
            payload, ts);
    }

    public static StreamEvent alert(EventType type, String metric, String category, Severity severity,
                                    String owner, JsonNode payload, Instant ts) {
        return new StreamEvent(0, StreamTopic.ALERTS, type, metric, category, severity, owner, payload, ts);
    }

    public StreamEvent withSeq(long newSeq) {
        return new StreamEvent(newSeq, topic, type, signalType, category, severity, owner, payload, ts);
    }

    /**
     * Check if this event may be seen by a connection authenticated as {@code identity}.
     */
    public boolean isVisibleTo(String identity) {
        return owner == null || owner.equals(identity);
    }
}
