package io.utxoiq.pulse.domain.alert;

/**
 * Notification channel variants.
 */
public enum ChannelKind {
    EMAIL,
    CHAT_WEBHOOK,
    SMS;

    public static ChannelKind parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Channel kind is required");
        }
        String normalized = raw.trim().toUpperCase().replace('-', '_');
        if (normalized.equals("SLACK") || normalized.equals("WEBHOOK") || normalized.equals("CHAT")) {
            return CHAT_WEBHOOK;
        }
        return ChannelKind.valueOf(normalized);
    }
}
