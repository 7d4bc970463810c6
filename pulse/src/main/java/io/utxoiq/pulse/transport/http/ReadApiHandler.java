package io.utxoiq.pulse.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.utxoiq.pulse.domain.stats.BaselineStats;
import io.utxoiq.pulse.domain.stats.FeedbackStats;
import io.utxoiq.pulse.service.alert.AlertEvaluationEngine;
import io.utxoiq.pulse.service.alert.BaselineService;
import io.utxoiq.pulse.service.alert.EngineStats;
import io.utxoiq.pulse.service.cache.CacheStats;
import io.utxoiq.pulse.service.cache.ResultCache;
import io.utxoiq.pulse.service.feedback.FeedbackService;
import io.utxoiq.pulse.service.intake.MetricRegistry;
import io.utxoiq.pulse.service.stream.HubStats;
import io.utxoiq.pulse.service.stream.SubscriptionHub;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;

import java.time.Clock;
import java.util.Map;
import java.util.function.Function;

import static io.utxoiq.pulse.transport.http.HttpResponses.extractBearer;
import static io.utxoiq.pulse.transport.http.HttpResponses.pathParam;
import static io.utxoiq.pulse.transport.http.HttpResponses.sendError;
import static io.utxoiq.pulse.transport.http.HttpResponses.sendFailure;
import static io.utxoiq.pulse.transport.http.HttpResponses.sendJson;
import static io.utxoiq.pulse.transport.http.HttpResponses.sendUnauthorized;

/**
 * Cached read APIs (baselines, feedback rollups), feedback writes and the health probe.
 */
public final class ReadApiHandler {

    private final BaselineService baselines;
    private final FeedbackService feedback;
    private final MetricRegistry metricRegistry;
    private final AlertEvaluationEngine engine;
    private final SubscriptionHub hub;
    private final ResultCache cache;
    private final Function<String, String> tokenValidator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ReadApiHandler(BaselineService baselines, FeedbackService feedback, MetricRegistry metricRegistry,
                          AlertEvaluationEngine engine, SubscriptionHub hub, ResultCache cache,
                          Function<String, String> tokenValidator, ObjectMapper objectMapper, Clock clock) {
        this.baselines = baselines;
        this.feedback = feedback;
        this.metricRegistry = metricRegistry;
        this.engine = engine;
        this.hub = hub;
        this.cache = cache;
        this.tokenValidator = tokenValidator;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * GET /api/baselines/{metric}
     */
    public void baseline(HttpServerExchange exchange) {
        String metric = pathParam(exchange, "metric");
        try {
            if (!metricRegistry.isKnown(metric)) {
                sendError(exchange, objectMapper, StatusCodes.NOT_FOUND, "Unknown metric: " + metric);
                return;
            }
            BaselineStats stats = baselines.get(MetricRegistry.normalize(metric));
            sendJson(exchange, objectMapper, stats);
        } catch (RuntimeException e) {
            sendFailure(exchange, objectMapper, e, "load baseline");
        }
    }

    /**
     * GET /api/feedback/{insightId}/stats
     */
    public void feedbackStats(HttpServerExchange exchange) {
        try {
            FeedbackStats stats = feedback.stats(pathParam(exchange, "insightId"));
            ObjectNode body = objectMapper.valueToTree(stats);
            body.put("helpful_ratio", stats.helpfulRatio());
            sendJson(exchange, objectMapper, body);
        } catch (RuntimeException e) {
            sendFailure(exchange, objectMapper, e, "load feedback stats");
        }
    }

    /**
     * POST /api/feedback/{insightId} - {@code {"helpful": true|false}}
     */
    public void recordFeedback(HttpServerExchange exchange) {
        String token = extractBearer(exchange);
        String userId = token == null ? null : tokenValidator.apply(token);
        if (userId == null) {
            sendUnauthorized(exchange);
            return;
        }

        String insightId = pathParam(exchange, "insightId");
        exchange.getRequestReceiver().receiveFullBytes((ex, data) -> {
            JsonNode helpful;
            try {
                helpful = objectMapper.readTree(data).path("helpful");
            } catch (Exception e) {
                sendError(ex, objectMapper, StatusCodes.BAD_REQUEST, "Invalid JSON: " + e.getMessage());
                return;
            }
            if (!helpful.isBoolean()) {
                sendError(ex, objectMapper, StatusCodes.BAD_REQUEST, "helpful must be true or false");
                return;
            }
            try {
                feedback.record(insightId, userId, helpful.asBoolean());
                sendJson(ex, objectMapper, Map.of("success", true));
            } catch (RuntimeException e) {
                sendFailure(ex, objectMapper, e, "record feedback");
            }
        });
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode health = objectMapper.createObjectNode();
        health.put("status", "ok");
        health.put("ts", clock.instant().toString());

        EngineStats engineStats = engine.stats();
        health.set("engine", objectMapper.valueToTree(engineStats));

        HubStats hubStats = hub.stats();
        ObjectNode stream = health.putObject("stream");
        stream.put("connections", hubStats.connections());
        stream.put("total_drops", hubStats.totalDrops());
        ObjectNode sequences = stream.putObject("last_sequence");
        hubStats.lastSequence().forEach((topic, seq) -> sequences.put(topic.wireName(), seq));

        CacheStats cacheStats = cache.stats();
        ObjectNode cacheNode = objectMapper.valueToTree(cacheStats);
        cacheNode.put("hit_ratio", cacheStats.hitRatio());
        health.set("cache", cacheNode);

        sendJson(exchange, objectMapper, health);
    }
}
