package io.utxoiq.pulse.domain.stream;

/**
 * Topics carry independent sequence numbers and replay buffers.
 */
public enum StreamTopic {
    SIGNALS,
    INSIGHTS,
    ALERTS;

    public String wireName() {
        return name().toLowerCase();
    }

    public static StreamTopic parse(String raw) {
        return StreamTopic.valueOf(raw.trim().toUpperCase());
    }
}
