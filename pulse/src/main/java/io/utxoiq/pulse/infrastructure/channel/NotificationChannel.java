package io.utxoiq.pulse.infrastructure.channel;

import io.utxoiq.pulse.domain.alert.ChannelKind;

/**
 * One delivery variant. The dispatcher treats every channel through this contract.
 *
 * Implementations report failures either as a failed {@link DeliveryResult} or by
 * throwing {@link io.utxoiq.pulse.error.TransientUpstreamException}; both are retried.
 */
public interface NotificationChannel {

    ChannelKind kind();

    DeliveryResult send(String target, ChannelPayload payload);
}
