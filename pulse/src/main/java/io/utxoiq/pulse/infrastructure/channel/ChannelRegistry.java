package io.utxoiq.pulse.infrastructure.channel;

import io.utxoiq.pulse.domain.alert.ChannelKind;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Closed set of channel variants, one per kind.
 */
public final class ChannelRegistry {
    private final Map<ChannelKind, NotificationChannel> channels = new EnumMap<>(ChannelKind.class);

    public ChannelRegistry(Collection<? extends NotificationChannel> variants) {
        for (NotificationChannel channel : variants) {
            if (channels.putIfAbsent(channel.kind(), channel) != null) {
                throw new IllegalArgumentException("Duplicate channel for " + channel.kind());
            }
        }
    }

    public NotificationChannel get(ChannelKind kind) {
        NotificationChannel channel = channels.get(kind);
        if (channel == null) {
            throw new IllegalStateException("No channel registered for " + kind);
        }
        return channel;
    }

    public boolean supports(ChannelKind kind) {
        return channels.containsKey(kind);
    }

    public Map<ChannelKind, NotificationChannel> asMap() {
        return Collections.unmodifiableMap(channels);
    }
}
