package io.utxoiq.pulse.domain.alert;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * User-defined alert condition.
 *
 * Immutable: every write produces a new instance with a bumped version, so an
 * evaluation pass that captured an instance always sees a complete configuration.
 */
public record AlertConfiguration(
    String id,
    String owner,
    String name,
    String metric,
    ComparisonOperator operator,
    double threshold,
    ThresholdType thresholdType,
    EvaluationWindow window,
    Severity severity,
    List<ChannelTarget> channels,
    boolean enabled,
    boolean renotify,
    SuppressionWindow suppression,   // null when not suppressed
    long version,
    Instant createdAt,
    Instant updatedAt
) {
    public AlertConfiguration {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(metric, "metric");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(thresholdType, "thresholdType");
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(severity, "severity");
        channels = channels == null ? List.of() : List.copyOf(channels);
    }

    public boolean isSuppressedAt(Instant instant) {
        return suppression != null && suppression.covers(instant);
    }

    /**
     * True if the change from {@code previous} invalidates accumulated window state.
     */
    public boolean changesEvaluation(AlertConfiguration previous) {
        return previous == null
            || !metric.equals(previous.metric)
            || operator != previous.operator
            || Double.compare(threshold, previous.threshold) != 0
            || thresholdType != previous.thresholdType
            || !window.equals(previous.window);
    }

    public AlertConfiguration withEnabled(boolean value, Instant at) {
        return toBuilder().enabled(value).version(version + 1).updatedAt(at).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .owner(owner)
            .name(name)
            .metric(metric)
            .operator(operator)
            .threshold(threshold)
            .thresholdType(thresholdType)
            .window(window)
            .severity(severity)
            .channels(channels)
            .enabled(enabled)
            .renotify(renotify)
            .suppression(suppression)
            .version(version)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String owner;
        private String name;
        private String metric;
        private ComparisonOperator operator = ComparisonOperator.GREATER_THAN;
        private double threshold;
        private ThresholdType thresholdType = ThresholdType.ABSOLUTE;
        private EvaluationWindow window = EvaluationWindow.ofSamples(1);
        private Severity severity = Severity.WARNING;
        private List<ChannelTarget> channels = new ArrayList<>();
        private boolean enabled = true;
        private boolean renotify;
        private SuppressionWindow suppression;
        private long version = 1;
        private Instant createdAt = Instant.now();
        private Instant updatedAt = createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder operator(ComparisonOperator operator) {
            this.operator = operator;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder thresholdType(ThresholdType thresholdType) {
            this.thresholdType = thresholdType;
            return this;
        }

        public Builder window(EvaluationWindow window) {
            this.window = window;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder channels(List<ChannelTarget> channels) {
            this.channels = new ArrayList<>(channels);
            return this;
        }

        public Builder channel(ChannelKind kind, String target) {
            this.channels.add(new ChannelTarget(kind, target));
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder renotify(boolean renotify) {
            this.renotify = renotify;
            return this;
        }

        public Builder suppression(SuppressionWindow suppression) {
            this.suppression = suppression;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public AlertConfiguration build() {
            if (id == null || owner == null || metric == null) {
                throw new IllegalStateException("id, owner, and metric are required");
            }
            return new AlertConfiguration(id, owner, name == null ? metric : name, metric, operator,
                threshold, thresholdType, window, severity, channels, enabled, renotify, suppression,
                version, createdAt, updatedAt);
        }
    }
}
