package io.utxoiq.pulse.domain.stream;

import java.time.Instant;
import java.util.Map;

/**
 * Live subscription of one client connection.
 */
public final class Subscription {
    private final String connectionId;
    private final String identity;
    private final Map<StreamTopic, Long> cursor;   // last sequence seen per topic at connect time
    private final Instant connectedAt;
    private volatile SubscriptionFilter filter;     // replaced by client "subscribe" messages
    private volatile Instant lastActivity;

    public Subscription(String connectionId, String identity, SubscriptionFilter filter,
                        Map<StreamTopic, Long> cursor, Instant connectedAt) {
        this.connectionId = connectionId;
        this.identity = identity;
        this.filter = filter == null ? SubscriptionFilter.ALL : filter;
        this.cursor = cursor == null ? Map.of() : Map.copyOf(cursor);
        this.connectedAt = connectedAt;
        this.lastActivity = connectedAt;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getIdentity() {
        return identity;
    }

    public SubscriptionFilter getFilter() {
        return filter;
    }

    public Map<StreamTopic, Long> getCursor() {
        return cursor;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public void replaceFilter(SubscriptionFilter newFilter, Instant at) {
        this.filter = newFilter == null ? SubscriptionFilter.ALL : newFilter;
        this.lastActivity = at;
    }

    public void touch(Instant at) {
        this.lastActivity = at;
    }

    /**
     * Check if this subscription should receive an event.
     */
    public boolean shouldReceive(StreamEvent event) {
        return event.isVisibleTo(identity) && filter.matches(event);
    }
}
