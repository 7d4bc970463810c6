package io.utxoiq.pulse.transport.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.utxoiq.pulse.error.ConnectionLostException;
import io.utxoiq.pulse.service.stream.FrameSink;
import io.utxoiq.pulse.service.stream.OutboundFrame;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Writes frames to one Undertow WebSocket channel. Runs on the hub's drain pool, so
 * blocking sends are fine and give per-connection backpressure.
 */
final class WebSocketFrameSink implements FrameSink {
    private static final Logger log = LoggerFactory.getLogger(WebSocketFrameSink.class);

    private final String connectionId;
    private final WebSocketChannel channel;
    private final ObjectMapper mapper;

    WebSocketFrameSink(String connectionId, WebSocketChannel channel, ObjectMapper mapper) {
        this.connectionId = connectionId;
        this.channel = channel;
        this.mapper = mapper;
    }

    @Override
    public void send(OutboundFrame frame) {
        if (!channel.isOpen()) {
            return;
        }
        String json;
        try {
            json = mapper.writeValueAsString(frame.toJson(mapper));
        } catch (Exception e) {
            log.warn("Failed to serialize WS frame {}: {}", frame.type(), e.toString());
            return;
        }
        try {
            WebSockets.sendTextBlocking(json, channel);
        } catch (IOException e) {
            throw new ConnectionLostException(connectionId, e);
        }
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("WS close failed for {}: {}", connectionId, e.toString());
        }
    }
}
