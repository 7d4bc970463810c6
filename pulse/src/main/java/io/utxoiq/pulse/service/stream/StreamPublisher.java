package io.utxoiq.pulse.service.stream;

import io.utxoiq.pulse.domain.stream.StreamEvent;

/**
 * Producer side of the subscription hub. Implementations never block the caller.
 */
@FunctionalInterface
public interface StreamPublisher {
    /**
     * @return the event as published, with its topic sequence number assigned
     */
    StreamEvent publish(StreamEvent event);
}
