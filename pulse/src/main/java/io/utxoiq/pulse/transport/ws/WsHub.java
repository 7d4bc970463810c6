package io.utxoiq.pulse.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.utxoiq.pulse.domain.alert.Severity;
import io.utxoiq.pulse.domain.stream.EventType;
import io.utxoiq.pulse.domain.stream.StreamTopic;
import io.utxoiq.pulse.domain.stream.Subscription;
import io.utxoiq.pulse.domain.stream.SubscriptionFilter;
import io.utxoiq.pulse.service.ratelimit.ClientIdentity;
import io.utxoiq.pulse.service.ratelimit.RateLimitDecision;
import io.utxoiq.pulse.service.ratelimit.TokenBucketRateLimiter;
import io.utxoiq.pulse.service.stream.OutboundFrame;
import io.utxoiq.pulse.service.stream.SubscriptionHub;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Undertow WebSocket binding of the subscription hub.
 *
 * Connect with {@code /ws?token=<jwt>&since=alerts:41,signals:1200&topics=&signal_types=
 * &categories=&severities=} (comma-separated lists). The handshake is rate limited per
 * user. Clients may send {@code {"action":"subscribe", ...filters}} to replace their
 * filter and {@code {"action":"ping","nonce":...}}.
 */
public final class WsHub {
    private static final Logger log = LoggerFactory.getLogger(WsHub.class);

    private final SubscriptionHub hub;
    private final Function<String, String> tokenValidator;
    private final TokenBucketRateLimiter limiter;
    private final ObjectMapper mapper;
    private final Clock clock;

    public WsHub(SubscriptionHub hub, Function<String, String> tokenValidator, TokenBucketRateLimiter limiter,
                 ObjectMapper mapper, Clock clock) {
        this.hub = hub;
        this.tokenValidator = tokenValidator;
        this.limiter = limiter;
        this.mapper = mapper;
        this.clock = clock;
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                accept(exchange.getRequestParameters(), channel);
            }
        });
    }

    private void accept(Map<String, List<String>> params, WebSocketChannel channel) {
        String token = first(params, "token");
        String userId = token == null ? null : tokenValidator.apply(token);
        if (userId == null) {
            log.warn("WS connection rejected: invalid token from {}", channel.getSourceAddress());
            reject(channel, "Invalid or missing token", null);
            return;
        }

        RateLimitDecision decision = limiter.allow(ClientIdentity.user(userId));
        if (!decision.permitted()) {
            log.warn("WS connection rejected: rate limited user {}", userId);
            reject(channel, "Rate limit exceeded", decision.retryAfter().toMillis());
            return;
        }

        SubscriptionFilter filter;
        Map<StreamTopic, Long> cursor;
        try {
            filter = parseFilter(params);
            cursor = parseCursor(first(params, "since"));
        } catch (IllegalArgumentException e) {
            reject(channel, e.getMessage(), null);
            return;
        }

        String connectionId = UUID.randomUUID().toString();
        Subscription subscription = new Subscription(connectionId, userId, filter, cursor, clock.instant());

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                handleClientMessage(connectionId, message.getData());
            }

            @Override
            protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                hub.teardown(connectionId);
                super.onCloseMessage(cm, ch);
            }

            @Override
            protected void onError(WebSocketChannel ch, Throwable error) {
                log.warn("WS error on {}: {}", connectionId, error.toString());
                hub.teardown(connectionId);
            }
        });
        channel.addCloseTask(ch -> hub.teardown(connectionId));

        hub.register(subscription, new WebSocketFrameSink(connectionId, channel, mapper),
            ack("connect", subscription));
        channel.resumeReceives();
        log.info("WS connected: {} (user={}, connection={})", channel.getSourceAddress(), userId, connectionId);
    }

    private void handleClientMessage(String connectionId, String raw) {
        JsonNode msg;
        try {
            msg = mapper.readTree(raw);
        } catch (Exception e) {
            sendError(connectionId, "Invalid JSON: " + e.getMessage());
            return;
        }
        String action = msg.path("action").asText(null);
        if (action == null) {
            sendError(connectionId, "Missing 'action'");
            return;
        }

        switch (action) {
            case "subscribe" -> {
                SubscriptionFilter filter;
                try {
                    filter = new SubscriptionFilter(
                        parseTopics(textList(msg.get("topics"))),
                        lowerCase(textList(msg.get("signal_types"))),
                        lowerCase(textList(msg.get("categories"))),
                        parseSeverities(textList(msg.get("severities"))));
                } catch (IllegalArgumentException e) {
                    sendError(connectionId, e.getMessage());
                    return;
                }
                if (hub.updateFilter(connectionId, filter)) {
                    ObjectNode payload = mapper.createObjectNode();
                    payload.put("action", "subscribe");
                    payload.set("filter", filterJson(filter));
                    hub.sendControl(connectionId, OutboundFrame.control(EventType.ACK, payload, clock.instant()));
                }
            }
            case "ping" -> {
                ObjectNode payload = mapper.createObjectNode();
                payload.put("nonce", msg.path("nonce").asText(""));
                payload.put("pong", true);
                hub.sendControl(connectionId, OutboundFrame.control(EventType.PONG, payload, clock.instant()));
            }
            default -> sendError(connectionId, "Unknown action: " + action);
        }
    }

    private void sendError(String connectionId, String error) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("error", error);
        hub.sendControl(connectionId, OutboundFrame.control(EventType.ERROR, payload, clock.instant()));
    }

    private OutboundFrame ack(String action, Subscription subscription) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("action", action);
        payload.put("connection_id", subscription.getConnectionId());
        payload.put("user_id", subscription.getIdentity());
        payload.set("filter", filterJson(subscription.getFilter()));
        ObjectNode cursor = payload.putObject("since");
        subscription.getCursor().forEach((topic, seq) -> cursor.put(topic.wireName(), seq));
        return OutboundFrame.control(EventType.ACK, payload, clock.instant());
    }

    private ObjectNode filterJson(SubscriptionFilter filter) {
        ObjectNode node = mapper.createObjectNode();
        node.set("topics", mapper.valueToTree(filter.topics().stream().map(StreamTopic::wireName).sorted().toList()));
        node.set("signal_types", mapper.valueToTree(filter.signalTypes()));
        node.set("categories", mapper.valueToTree(filter.categories()));
        node.set("severities", mapper.valueToTree(filter.severities()));
        return node;
    }

    /**
     * Send an error frame directly (no subscription exists yet) and close.
     */
    private void reject(WebSocketChannel channel, String error, Long retryAfterMs) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("error", error);
        if (retryAfterMs != null) {
            payload.put("retry_after_ms", retryAfterMs);
        }
        try {
            String json = mapper.writeValueAsString(
                OutboundFrame.control(EventType.ERROR, payload, clock.instant()).toJson(mapper));
            WebSockets.sendTextBlocking(json, channel);
        } catch (IOException e) {
            log.debug("Failed to send WS rejection: {}", e.toString());
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Failed to close rejected WS: {}", e.toString());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // QUERY PARSING
    // ═══════════════════════════════════════════════════════════════

    static SubscriptionFilter parseFilter(Map<String, List<String>> params) {
        return new SubscriptionFilter(
            parseTopics(split(first(params, "topics"))),
            lowerCase(split(first(params, "signal_types"))),
            lowerCase(split(first(params, "categories"))),
            parseSeverities(split(first(params, "severities"))));
    }

    /**
     * Parse {@code topic:seq,topic:seq}.
     */
    static Map<StreamTopic, Long> parseCursor(String since) {
        Map<StreamTopic, Long> cursor = new EnumMap<>(StreamTopic.class);
        for (String part : split(since)) {
            int colon = part.indexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException("since must look like topic:sequence, got " + part);
            }
            try {
                StreamTopic topic = StreamTopic.parse(part.substring(0, colon));
                long seq = Long.parseLong(part.substring(colon + 1).trim());
                if (seq < 0) {
                    throw new IllegalArgumentException("negative sequence in since: " + part);
                }
                cursor.put(topic, seq);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid sequence in since: " + part);
            }
        }
        return cursor;
    }

    private static Set<StreamTopic> parseTopics(List<String> raw) {
        Set<StreamTopic> topics = new HashSet<>();
        for (String value : raw) {
            try {
                topics.add(StreamTopic.parse(value));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown topic: " + value);
            }
        }
        return topics;
    }

    private static Set<Severity> parseSeverities(List<String> raw) {
        Set<Severity> severities = new HashSet<>();
        for (String value : raw) {
            try {
                severities.add(Severity.parse(value));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown severity: " + value);
            }
        }
        return severities;
    }

    private static Set<String> lowerCase(List<String> raw) {
        Set<String> out = new HashSet<>();
        for (String value : raw) {
            out.add(value.toLowerCase());
        }
        return out;
    }

    private static String first(Map<String, List<String>> params, String name) {
        List<String> values = params == null ? null : params.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static List<String> split(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                out.add(part.trim());
            }
        }
        return out;
    }

    private static List<String> textList(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (node.isArray()) {
            node.forEach(n -> out.add(n.asText().trim()));
        } else {
            out.addAll(split(node.asText()));
        }
        return out;
    }
}
