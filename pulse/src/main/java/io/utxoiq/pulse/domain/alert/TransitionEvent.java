package io.utxoiq.pulse.domain.alert;

import java.time.Instant;
import java.util.List;

/**
 * A trigger, resolve or re-notification produced by the evaluation engine.
 * Carries everything the dispatcher needs so it never re-reads the configuration.
 */
public record TransitionEvent(
    String id,
    String alertId,
    String owner,
    String alertName,
    TransitionKind kind,
    AlertStatus from,
    AlertStatus to,
    String metric,
    double observedValue,
    double threshold,
    ComparisonOperator operator,
    Severity severity,
    List<ChannelTarget> channels,
    Instant occurredAt,
    long configurationVersion
) {
    public TransitionEvent {
        channels = channels == null ? List.of() : List.copyOf(channels);
    }

    public String describe() {
        return String.format("%s %s: %s %.4f %s %.4f", alertName, kind, metric, observedValue,
            operator.symbol(), threshold);
    }
}
