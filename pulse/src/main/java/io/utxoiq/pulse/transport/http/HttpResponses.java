package io.utxoiq.pulse.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.utxoiq.pulse.error.AccessDeniedException;
import io.utxoiq.pulse.error.CapacityExceededException;
import io.utxoiq.pulse.error.ConfigurationException;
import io.utxoiq.pulse.error.NotFoundException;
import io.utxoiq.pulse.error.UnknownMetricException;
import io.utxoiq.pulse.error.VersionConflictException;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Deque;

/**
 * JSON response helpers and the exception to status mapping shared by all handlers.
 */
final class HttpResponses {
    private static final Logger log = LoggerFactory.getLogger(HttpResponses.class);

    private HttpResponses() {
    }

    static void sendJson(HttpServerExchange exchange, ObjectMapper mapper, Object data) {
        sendJson(exchange, mapper, StatusCodes.OK, data);
    }

    static void sendJson(HttpServerExchange exchange, ObjectMapper mapper, int status, Object data) {
        try {
            String json = mapper.writeValueAsString(data);
            exchange.setStatusCode(status);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.getResponseSender().send(json);
        } catch (Exception e) {
            log.error("Failed to send JSON response: {}", e.getMessage());
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("{\"error\":\"Internal server error\"}");
        }
    }

    static void sendError(HttpServerExchange exchange, ObjectMapper mapper, int status, String message) {
        ObjectNode body = mapper.createObjectNode();
        body.put("error", message);
        sendJson(exchange, mapper, status, body);
    }

    static void sendUnauthorized(HttpServerExchange exchange) {
        exchange.setStatusCode(StatusCodes.UNAUTHORIZED);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send("{\"error\":\"Unauthorized\"}");
    }

    /**
     * Map a service exception to its HTTP status. Unexpected exceptions are logged and become 500.
     */
    static void sendFailure(HttpServerExchange exchange, ObjectMapper mapper, RuntimeException e, String action) {
        ObjectNode body = mapper.createObjectNode();
        body.put("error", e.getMessage());
        int status;
        if (e instanceof ConfigurationException) {
            status = StatusCodes.BAD_REQUEST;
            body.set("violations", mapper.valueToTree(((ConfigurationException) e).getViolations()));
        } else if (e instanceof UnknownMetricException || e instanceof IllegalArgumentException) {
            status = StatusCodes.BAD_REQUEST;
        } else if (e instanceof AccessDeniedException) {
            status = StatusCodes.FORBIDDEN;
        } else if (e instanceof NotFoundException) {
            status = StatusCodes.NOT_FOUND;
        } else if (e instanceof VersionConflictException) {
            VersionConflictException conflict = (VersionConflictException) e;
            status = StatusCodes.CONFLICT;
            body.put("expected_version", conflict.getExpectedVersion());
            body.put("current_version", conflict.getActualVersion());
        } else if (e instanceof CapacityExceededException) {
            status = StatusCodes.TOO_MANY_REQUESTS;
            exchange.getResponseHeaders().put(Headers.RETRY_AFTER,
                String.valueOf(((CapacityExceededException) e).retryAfterSeconds()));
        } else {
            log.error("Failed to {}: {}", action, e.getMessage(), e);
            status = StatusCodes.INTERNAL_SERVER_ERROR;
            body.put("error", "Failed to " + action);
        }
        sendJson(exchange, mapper, status, body);
    }

    static String extractBearer(HttpServerExchange exchange) {
        String authHeader = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            return authHeader.substring(7);
        }
        return null;
    }

    static String pathParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.getFirst();
    }
}
