package io.utxoiq.pulse.infrastructure.channel;

import io.utxoiq.pulse.domain.alert.Severity;
import io.utxoiq.pulse.domain.alert.TransitionEvent;
import io.utxoiq.pulse.domain.alert.TransitionKind;

import java.time.Instant;

/**
 * Channel-neutral content of one notification, rendered per channel.
 */
public record ChannelPayload(
    String alertId,
    String alertName,
    TransitionKind kind,
    Severity severity,
    String metric,
    double observedValue,
    String operator,
    double threshold,
    Instant occurredAt
) {
    static final int SMS_LIMIT = 160;

    public static ChannelPayload of(TransitionEvent event) {
        return new ChannelPayload(event.alertId(), event.alertName(), event.kind(), event.severity(),
            event.metric(), event.observedValue(), event.operator().symbol(), event.threshold(),
            event.occurredAt());
    }

    public boolean isResolution() {
        return kind == TransitionKind.RESOLVED;
    }

    public String subject() {
        return isResolution()
            ? "[RESOLVED] " + alertName
            : "[" + severity + "] " + alertName;
    }

    public String text() {
        if (isResolution()) {
            return String.format("%s back to normal: %s = %.2f (threshold %s %.2f)",
                alertName, metric, observedValue, operator, threshold);
        }
        String prefix = kind == TransitionKind.RENOTIFY ? "still firing" : "triggered";
        return String.format("%s %s: %s = %.2f %s %.2f",
            alertName, prefix, metric, observedValue, operator, threshold);
    }

    /**
     * Text limited to one SMS segment.
     */
    public String smsText() {
        String prefix = "[" + severity + "] " + alertName + ": ";
        String details = String.format("%s %.1f %s %.1f", metric, observedValue, operator, threshold);
        String message = prefix + details;
        if (message.length() > SMS_LIMIT) {
            message = message.substring(0, SMS_LIMIT - 3) + "...";
        }
        return message;
    }

    /**
     * Attachment colour used by chat webhooks.
     */
    public String color() {
        if (isResolution()) {
            return "#36a64f";
        }
        return switch (severity) {
            case INFO -> "#36a64f";
            case WARNING -> "#ff9900";
            case CRITICAL -> "#ff0000";
        };
    }
}
