package io.utxoiq.pulse.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.utxoiq.pulse.domain.alert.AlertConfiguration;
import io.utxoiq.pulse.service.alert.AlertConfigurationService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static io.utxoiq.pulse.transport.http.HttpResponses.extractBearer;
import static io.utxoiq.pulse.transport.http.HttpResponses.pathParam;
import static io.utxoiq.pulse.transport.http.HttpResponses.sendError;
import static io.utxoiq.pulse.transport.http.HttpResponses.sendFailure;
import static io.utxoiq.pulse.transport.http.HttpResponses.sendJson;
import static io.utxoiq.pulse.transport.http.HttpResponses.sendUnauthorized;

/**
 * HTTP handler for alert configuration management.
 * Every operation is scoped to the owner resolved from the bearer token.
 */
public final class AlertConfigHandler {
    private static final Logger log = LoggerFactory.getLogger(AlertConfigHandler.class);

    private static final int DEFAULT_HISTORY_LIMIT = 50;

    private final AlertConfigurationService alertService;
    private final Function<String, String> tokenValidator;
    private final ObjectMapper objectMapper;

    public AlertConfigHandler(AlertConfigurationService alertService, Function<String, String> tokenValidator,
                              ObjectMapper objectMapper) {
        this.alertService = alertService;
        this.tokenValidator = tokenValidator;
        this.objectMapper = objectMapper;
    }

    /**
     * GET /api/alerts - List the caller's alerts
     */
    public void list(HttpServerExchange exchange) {
        String owner = authenticate(exchange);
        if (owner == null) {
            sendUnauthorized(exchange);
            return;
        }

        try {
            List<Map<String, Object>> alerts = alertService.list(owner).stream()
                .map(AlertRequestMapper::toResponse)
                .toList();
            sendJson(exchange, objectMapper, Map.of("alerts", alerts));
        } catch (RuntimeException e) {
            sendFailure(exchange, objectMapper, e, "list alerts");
        }
    }

    /**
     * POST /api/alerts - Create an alert
     */
    public void create(HttpServerExchange exchange) {
        String owner = authenticate(exchange);
        if (owner == null) {
            sendUnauthorized(exchange);
            return;
        }

        exchange.getRequestReceiver().receiveFullBytes((ex, data) -> {
            try {
                Map<String, Object> request = readRequest(data);
                AlertConfiguration created = alertService.create(owner, AlertRequestMapper.toDraft(request));
                sendJson(ex, objectMapper, StatusCodes.CREATED, AlertRequestMapper.toResponse(created));
            } catch (RuntimeException e) {
                log.debug("Create alert rejected for {}: {}", owner, e.getMessage());
                sendFailure(ex, objectMapper, e, "create alert");
            }
        });
    }

    /**
     * GET /api/alerts/{id} - Get one alert
     */
    public void get(HttpServerExchange exchange) {
        String owner = authenticate(exchange);
        if (owner == null) {
            sendUnauthorized(exchange);
            return;
        }

        try {
            AlertConfiguration config = alertService.get(owner, pathParam(exchange, "id"));
            sendJson(exchange, objectMapper, AlertRequestMapper.toResponse(config));
        } catch (RuntimeException e) {
            sendFailure(exchange, objectMapper, e, "get alert");
        }
    }

    /**
     * PUT /api/alerts/{id} - Replace an alert; the body carries the version being replaced
     */
    public void update(HttpServerExchange exchange) {
        String owner = authenticate(exchange);
        if (owner == null) {
            sendUnauthorized(exchange);
            return;
        }

        String alertId = pathParam(exchange, "id");
        exchange.getRequestReceiver().receiveFullBytes((ex, data) -> {
            try {
                Map<String, Object> request = readRequest(data);
                long expectedVersion = AlertRequestMapper.expectedVersion(request);
                AlertConfiguration updated = alertService.update(owner, alertId,
                    AlertRequestMapper.toDraft(request), expectedVersion);
                sendJson(ex, objectMapper, AlertRequestMapper.toResponse(updated));
            } catch (RuntimeException e) {
                sendFailure(ex, objectMapper, e, "update alert");
            }
        });
    }

    /**
     * DELETE /api/alerts/{id}
     */
    public void delete(HttpServerExchange exchange) {
        String owner = authenticate(exchange);
        if (owner == null) {
            sendUnauthorized(exchange);
            return;
        }

        try {
            alertService.delete(owner, pathParam(exchange, "id"));
            sendJson(exchange, objectMapper, Map.of("success", true));
        } catch (RuntimeException e) {
            sendFailure(exchange, objectMapper, e, "delete alert");
        }
    }

    /**
     * POST /api/alerts/{id}/enable
     */
    public void enable(HttpServerExchange exchange) {
        setEnabled(exchange, true);
    }

    /**
     * POST /api/alerts/{id}/disable
     */
    public void disable(HttpServerExchange exchange) {
        setEnabled(exchange, false);
    }

    private void setEnabled(HttpServerExchange exchange, boolean enabled) {
        String owner = authenticate(exchange);
        if (owner == null) {
            sendUnauthorized(exchange);
            return;
        }

        try {
            AlertConfiguration config = alertService.setEnabled(owner, pathParam(exchange, "id"), enabled);
            sendJson(exchange, objectMapper, AlertRequestMapper.toResponse(config));
        } catch (RuntimeException e) {
            sendFailure(exchange, objectMapper, e, enabled ? "enable alert" : "disable alert");
        }
    }

    /**
     * GET /api/alerts/{id}/notifications?limit=N - Delivery history, newest first
     */
    public void notifications(HttpServerExchange exchange) {
        String owner = authenticate(exchange);
        if (owner == null) {
            sendUnauthorized(exchange);
            return;
        }

        int limit = DEFAULT_HISTORY_LIMIT;
        String rawLimit = pathParam(exchange, "limit");
        if (rawLimit != null) {
            try {
                limit = Integer.parseInt(rawLimit);
            } catch (NumberFormatException e) {
                sendError(exchange, objectMapper, StatusCodes.BAD_REQUEST, "limit must be an integer");
                return;
            }
        }

        try {
            List<Map<String, Object>> records = alertService.notifications(owner, pathParam(exchange, "id"), limit)
                .stream()
                .map(AlertRequestMapper::toResponse)
                .toList();
            sendJson(exchange, objectMapper, Map.of("notifications", records));
        } catch (RuntimeException e) {
            sendFailure(exchange, objectMapper, e, "load notification history");
        }
    }

    private String authenticate(HttpServerExchange exchange) {
        String token = extractBearer(exchange);
        return token == null ? null : tokenValidator.apply(token);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> readRequest(byte[] data) {
        Map<String, Object> request;
        try {
            request = objectMapper.readValue(data, Map.class);
        } catch (Exception e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getMessage());
        }
        if (request == null) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
        return request;
    }
}
