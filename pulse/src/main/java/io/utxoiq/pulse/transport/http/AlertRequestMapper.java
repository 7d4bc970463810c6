package io.utxoiq.pulse.transport.http;

import io.utxoiq.pulse.domain.alert.AlertConfiguration;
import io.utxoiq.pulse.domain.alert.ChannelKind;
import io.utxoiq.pulse.domain.alert.ChannelTarget;
import io.utxoiq.pulse.domain.alert.ComparisonOperator;
import io.utxoiq.pulse.domain.alert.EvaluationWindow;
import io.utxoiq.pulse.domain.alert.Severity;
import io.utxoiq.pulse.domain.alert.SuppressionWindow;
import io.utxoiq.pulse.domain.alert.ThresholdType;
import io.utxoiq.pulse.domain.notification.NotificationRecord;
import io.utxoiq.pulse.error.ConfigurationException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts alert API request bodies to configuration drafts and configurations to responses.
 *
 * Request fields: {@code name, metric, operator, threshold, threshold_type, window_samples
 * | window_seconds, severity, channels[{kind, target}], enabled, renotify,
 * suppression_start, suppression_end}. Every malformed field is reported at once.
 */
final class AlertRequestMapper {

    private AlertRequestMapper() {
    }

    static AlertConfiguration.Builder toDraft(Map<String, Object> request) {
        List<String> violations = new ArrayList<>();
        AlertConfiguration.Builder draft = AlertConfiguration.builder();

        draft.name(getStringOrNull(request, "name"));
        draft.metric(getStringOrNull(request, "metric"));

        String operator = getStringOrNull(request, "operator");
        if (operator == null) {
            operator = getStringOrNull(request, "comparison_operator");
        }
        if (operator != null) {
            try {
                draft.operator(ComparisonOperator.parse(operator));
            } catch (IllegalArgumentException e) {
                violations.add(e.getMessage());
            }
        }

        Object threshold = request.get("threshold");
        if (threshold instanceof Number) {
            draft.threshold(((Number) threshold).doubleValue());
        } else {
            violations.add("threshold must be a number");
        }

        String thresholdType = getStringOrNull(request, "threshold_type");
        if (thresholdType != null) {
            try {
                draft.thresholdType(ThresholdType.valueOf(thresholdType.trim().toUpperCase()));
            } catch (IllegalArgumentException e) {
                violations.add("Unknown threshold_type: " + thresholdType);
            }
        }

        try {
            Object samples = request.get("window_samples");
            Object seconds = request.get("window_seconds");
            if (samples != null && seconds != null) {
                violations.add("window_samples and window_seconds are exclusive");
            } else if (samples instanceof Number) {
                draft.window(EvaluationWindow.ofSamples(((Number) samples).intValue()));
            } else if (seconds instanceof Number) {
                draft.window(EvaluationWindow.ofDuration(
                    Duration.ofMillis(Math.round(((Number) seconds).doubleValue() * 1000))));
            } else if (samples != null || seconds != null) {
                violations.add("window must be a number");
            }
        } catch (IllegalArgumentException e) {
            violations.add(e.getMessage());
        }

        String severity = getStringOrNull(request, "severity");
        if (severity != null) {
            try {
                draft.severity(Severity.parse(severity));
            } catch (IllegalArgumentException e) {
                violations.add("Unknown severity: " + severity);
            }
        }

        Object channels = request.get("channels");
        if (channels instanceof List) {
            for (Object item : (List<?>) channels) {
                if (!(item instanceof Map)) {
                    violations.add("channel must be an object with kind and target");
                    continue;
                }
                Map<?, ?> channel = (Map<?, ?>) item;
                Object kind = channel.get("kind");
                Object target = channel.get("target");
                try {
                    draft.channel(ChannelKind.parse(kind == null ? null : kind.toString()),
                        target == null ? "" : target.toString());
                } catch (IllegalArgumentException e) {
                    violations.add("Unknown channel kind: " + kind);
                }
            }
        } else if (channels != null) {
            violations.add("channels must be a list");
        }

        Object enabled = request.get("enabled");
        if (enabled instanceof Boolean) {
            draft.enabled((Boolean) enabled);
        }
        Object renotify = request.get("renotify");
        if (renotify instanceof Boolean) {
            draft.renotify((Boolean) renotify);
        }

        String suppressionStart = getStringOrNull(request, "suppression_start");
        String suppressionEnd = getStringOrNull(request, "suppression_end");
        if (suppressionStart != null || suppressionEnd != null) {
            try {
                if (suppressionStart == null || suppressionEnd == null) {
                    throw new IllegalArgumentException("suppression_start and suppression_end go together");
                }
                draft.suppression(new SuppressionWindow(Instant.parse(suppressionStart), Instant.parse(suppressionEnd)));
            } catch (RuntimeException e) {
                violations.add("Invalid suppression window: " + e.getMessage());
            }
        }

        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }
        return draft;
    }

    /**
     * @return the expected version from the body of an update
     */
    static long expectedVersion(Map<String, Object> request) {
        Object version = request.get("version");
        if (!(version instanceof Number)) {
            throw new ConfigurationException("version is required for updates");
        }
        return ((Number) version).longValue();
    }

    static Map<String, Object> toResponse(AlertConfiguration config) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", config.id());
        map.put("owner", config.owner());
        map.put("name", config.name());
        map.put("metric", config.metric());
        map.put("operator", config.operator().symbol());
        map.put("threshold", config.threshold());
        map.put("threshold_type", config.thresholdType().name());
        if (config.window().kind() == EvaluationWindow.Kind.SAMPLES) {
            map.put("window_samples", config.window().samples());
        } else {
            map.put("window_seconds", config.window().duration().toMillis() / 1000.0);
        }
        map.put("severity", config.severity().name());
        List<Map<String, Object>> channels = new ArrayList<>();
        for (ChannelTarget channel : config.channels()) {
            channels.add(Map.of("kind", channel.kind().name(), "target", channel.target()));
        }
        map.put("channels", channels);
        map.put("enabled", config.enabled());
        map.put("renotify", config.renotify());
        if (config.suppression() != null) {
            map.put("suppression_start", config.suppression().start().toString());
            map.put("suppression_end", config.suppression().end().toString());
        }
        map.put("version", config.version());
        map.put("created_at", config.createdAt() == null ? null : config.createdAt().toString());
        map.put("updated_at", config.updatedAt() == null ? null : config.updatedAt().toString());
        return map;
    }

    static Map<String, Object> toResponse(NotificationRecord record) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", record.id());
        map.put("alert_id", record.alertId());
        map.put("transition_id", record.transitionId());
        map.put("transition_kind", record.transitionKind().name());
        map.put("channel", record.channel().name());
        map.put("status", record.status().name());
        map.put("attempt_count", record.attemptCount());
        map.put("triggered_at", record.triggeredAt().toString());
        map.put("resolved_at", record.resolvedAt() == null ? null : record.resolvedAt().toString());
        map.put("last_error", record.lastError());
        map.put("updated_at", record.updatedAt().toString());
        return map;
    }

    private static String getStringOrNull(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value != null ? value.toString() : null;
    }
}
