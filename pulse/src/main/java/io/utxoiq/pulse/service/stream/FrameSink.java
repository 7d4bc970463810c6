package io.utxoiq.pulse.service.stream;

import io.utxoiq.pulse.error.ConnectionLostException;

/**
 * Transport end of one client connection.
 */
public interface FrameSink {

    /**
     * Write one frame. Called from a single drain at a time per connection.
     *
     * @throws ConnectionLostException when the peer is gone
     */
    void send(OutboundFrame frame);

    boolean isOpen();

    void close();
}
