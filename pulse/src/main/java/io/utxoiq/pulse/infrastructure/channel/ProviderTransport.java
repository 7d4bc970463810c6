package io.utxoiq.pulse.infrastructure.channel;

import io.utxoiq.pulse.domain.alert.ChannelKind;

/**
 * Hand-off to an external email or SMS provider.
 */
@FunctionalInterface
public interface ProviderTransport {
    void deliver(ChannelKind kind, String target, String subject, String body) throws Exception;
}
