package io.utxoiq.pulse.domain.stream;

import io.utxoiq.pulse.domain.alert.Severity;

import java.util.Set;

/**
 * Interest predicate of one subscription.
 *
 * An empty dimension matches everything. A non-empty dimension requires the event
 * to carry a matching value: an event without a signal type never passes a
 * signal-type filter.
 */
public record SubscriptionFilter(
    Set<StreamTopic> topics,
    Set<String> signalTypes,
    Set<String> categories,
    Set<Severity> severities
) {
    public static final SubscriptionFilter ALL = new SubscriptionFilter(Set.of(), Set.of(), Set.of(), Set.of());

    public SubscriptionFilter {
        topics = topics == null ? Set.of() : Set.copyOf(topics);
        signalTypes = signalTypes == null ? Set.of() : Set.copyOf(signalTypes);
        categories = categories == null ? Set.of() : Set.copyOf(categories);
        severities = severities == null ? Set.of() : Set.copyOf(severities);
    }

    public boolean matches(StreamEvent event) {
        if (!topics.isEmpty() && !topics.contains(event.topic())) {
            return false;
        }
        if (!signalTypes.isEmpty()
            && (event.signalType() == null || !signalTypes.contains(event.signalType()))) {
            return false;
        }
        if (!categories.isEmpty()
            && (event.category() == null || !categories.contains(event.category()))) {
            return false;
        }
        return severities.isEmpty()
            || (event.severity() != null && severities.contains(event.severity()));
    }
}
