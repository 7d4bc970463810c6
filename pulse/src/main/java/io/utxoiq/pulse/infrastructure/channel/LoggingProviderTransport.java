package io.utxoiq.pulse.infrastructure.channel;

import io.utxoiq.pulse.domain.alert.ChannelKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provider transport used when no email/SMS provider is configured.
 * Writes the notification to the log and reports success.
 */
public final class LoggingProviderTransport implements ProviderTransport {
    private static final Logger log = LoggerFactory.getLogger(LoggingProviderTransport.class);

    @Override
    public void deliver(ChannelKind kind, String target, String subject, String body) {
        if (subject.startsWith("[CRITICAL]")) {
            log.error("[NOTIFY-{}] to={} {} - {}", kind, target, subject, body);
        } else if (subject.startsWith("[WARNING]")) {
            log.warn("[NOTIFY-{}] to={} {} - {}", kind, target, subject, body);
        } else {
            log.info("[NOTIFY-{}] to={} {} - {}", kind, target, subject, body);
        }
    }
}
