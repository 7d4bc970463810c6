package io.utxoiq.pulse.domain.alert;

import java.util.Objects;

/**
 * A channel kind plus its address (email, webhook URL, phone number).
 */
public record ChannelTarget(ChannelKind kind, String target) {
    public ChannelTarget {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(target, "target");
    }

    @Override
    public String toString() {
        return kind + ":" + target;
    }
}
