package io.utxoiq.pulse.infrastructure.channel;

import io.utxoiq.pulse.domain.alert.ChannelKind;
import io.utxoiq.pulse.error.TransientUpstreamException;

/**
 * Email and SMS variants. Both render the payload and hand it to a provider transport.
 */
public final class ProviderNotificationChannel implements NotificationChannel {

    private final ChannelKind kind;
    private final ProviderTransport transport;

    public ProviderNotificationChannel(ChannelKind kind, ProviderTransport transport) {
        if (kind == ChannelKind.CHAT_WEBHOOK) {
            throw new IllegalArgumentException("Chat webhooks use ChatWebhookChannel");
        }
        this.kind = kind;
        this.transport = transport;
    }

    public static ProviderNotificationChannel email(ProviderTransport transport) {
        return new ProviderNotificationChannel(ChannelKind.EMAIL, transport);
    }

    public static ProviderNotificationChannel sms(ProviderTransport transport) {
        return new ProviderNotificationChannel(ChannelKind.SMS, transport);
    }

    @Override
    public ChannelKind kind() {
        return kind;
    }

    @Override
    public DeliveryResult send(String target, ChannelPayload payload) {
        String body = kind == ChannelKind.SMS ? payload.smsText() : payload.text();
        try {
            transport.deliver(kind, target, payload.subject(), body);
            return DeliveryResult.delivered(kind + " accepted by provider");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientUpstreamException(kind.name().toLowerCase(), "Interrupted", e);
        } catch (Exception e) {
            throw new TransientUpstreamException(kind.name().toLowerCase(), e.getMessage(), e);
        }
    }
}
