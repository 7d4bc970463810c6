package io.utxoiq.pulse.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.utxoiq.pulse.service.intake.IntakeResult;
import io.utxoiq.pulse.service.intake.SignalIntakeAdapter;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static io.utxoiq.pulse.transport.http.HttpResponses.sendError;
import static io.utxoiq.pulse.transport.http.HttpResponses.sendFailure;
import static io.utxoiq.pulse.transport.http.HttpResponses.sendJson;
import static io.utxoiq.pulse.transport.http.HttpResponses.sendUnauthorized;

/**
 * Upstream pipeline entry points. Callers authenticate with {@code X-API-Key}; an empty
 * key set leaves intake open (local runs only, refused in production mode).
 */
public final class IntakeHandler {
    private static final Logger log = LoggerFactory.getLogger(IntakeHandler.class);

    static final String API_KEY_HEADER = "X-API-Key";

    private final SignalIntakeAdapter intake;
    private final Set<String> apiKeys;
    private final ObjectMapper objectMapper;

    public IntakeHandler(SignalIntakeAdapter intake, Set<String> apiKeys, ObjectMapper objectMapper) {
        this.intake = intake;
        this.apiKeys = Set.copyOf(apiKeys);
        this.objectMapper = objectMapper;
    }

    /**
     * POST /api/intake/signals - One signal object or an array of them
     */
    public void signals(HttpServerExchange exchange) {
        receive(exchange, intake::ingestSignals, "ingest signals");
    }

    /**
     * POST /api/intake/insights - One insight object or an array of them
     */
    public void insights(HttpServerExchange exchange) {
        receive(exchange, intake::ingestInsights, "ingest insights");
    }

    private void receive(HttpServerExchange exchange, Function<JsonNode, IntakeResult> sink, String action) {
        if (!isAuthorized(exchange)) {
            sendUnauthorized(exchange);
            return;
        }

        exchange.getRequestReceiver().receiveFullBytes((ex, data) -> {
            JsonNode body;
            try {
                body = objectMapper.readTree(data);
            } catch (Exception e) {
                sendError(ex, objectMapper, StatusCodes.BAD_REQUEST, "Invalid JSON: " + e.getMessage());
                return;
            }

            try {
                IntakeResult result = sink.apply(body);
                Map<String, Object> response = new LinkedHashMap<>();
                response.put("received", result.received());
                response.put("accepted", result.accepted());
                response.put("unknown_metric", result.unknownMetric());
                response.put("rejected", result.rejected());
                int status = result.accepted() + result.unknownMetric() == 0 && !result.rejected().isEmpty()
                    ? StatusCodes.BAD_REQUEST
                    : StatusCodes.ACCEPTED;
                sendJson(ex, objectMapper, status, response);
            } catch (RuntimeException e) {
                sendFailure(ex, objectMapper, e, action);
            }
        });
    }

    private boolean isAuthorized(HttpServerExchange exchange) {
        if (apiKeys.isEmpty()) {
            return true;
        }
        String key = exchange.getRequestHeaders().getFirst(API_KEY_HEADER);
        if (key == null || !apiKeys.contains(key)) {
            log.warn("Intake rejected: invalid API key from {}", exchange.getSourceAddress());
            return false;
        }
        return true;
    }
}
