package io.utxoiq.pulse.service.intake;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.utxoiq.pulse.domain.signal.SignalCategory;
import io.utxoiq.pulse.domain.signal.SignalSample;
import io.utxoiq.pulse.domain.stream.StreamEvent;
import io.utxoiq.pulse.error.UnknownMetricException;
import io.utxoiq.pulse.service.alert.AlertEvaluationEngine;
import io.utxoiq.pulse.service.stream.StreamPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for upstream signal and insight events.
 *
 * Accepts a single JSON object or an array of them. Each signal is normalized into a
 * {@link SignalSample}, published to the live feed, then handed to the evaluation engine.
 * Samples on unknown metrics still reach the feed; the engine drops and counts them.
 */
public final class SignalIntakeAdapter {
    private static final Logger log = LoggerFactory.getLogger(SignalIntakeAdapter.class);

    private static final String[] TYPE_FIELDS = {"type", "metric", "signal_type"};

    private final MetricRegistry metricRegistry;
    private final AlertEvaluationEngine engine;
    private final StreamPublisher publisher;
    private final ObjectMapper mapper;
    private final Clock clock;

    public SignalIntakeAdapter(MetricRegistry metricRegistry, AlertEvaluationEngine engine,
                               StreamPublisher publisher, ObjectMapper mapper, Clock clock) {
        this.metricRegistry = metricRegistry;
        this.engine = engine;
        this.publisher = publisher;
        this.mapper = mapper;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // SIGNALS
    // ═══════════════════════════════════════════════════════════════

    public IntakeResult ingestSignals(JsonNode body) {
        int accepted = 0;
        int unknown = 0;
        List<String> rejected = new ArrayList<>();

        List<JsonNode> elements = elements(body);
        for (int i = 0; i < elements.size(); i++) {
            SignalSample sample;
            try {
                sample = normalize(elements.get(i));
            } catch (IllegalArgumentException e) {
                rejected.add("[" + i + "] " + e.getMessage());
                continue;
            }
            if (ingest(sample)) {
                accepted++;
            } else {
                unknown++;
            }
        }

        if (!rejected.isEmpty()) {
            log.warn("[INTAKE] Rejected {} of {} signals: {}", rejected.size(), elements.size(), rejected);
        }
        return new IntakeResult(accepted, unknown, rejected);
    }

    /**
     * Publish one sample and hand it to the engine.
     *
     * @return false when the engine does not know the metric
     */
    public boolean ingest(SignalSample sample) {
        publisher.publish(StreamEvent.signal(sample.type(), categoryOf(sample.type()).wireName(),
            toPayload(sample), sample.observedAt()));
        try {
            engine.ingest(sample).whenComplete((transitions, error) -> {
                if (error != null) {
                    log.error("[INTAKE] Evaluation failed for {}: {}", sample.type(), error.getMessage());
                } else if (!transitions.isEmpty()) {
                    log.debug("[INTAKE] {} produced {} transitions", sample.type(), transitions.size());
                }
            });
            return true;
        } catch (UnknownMetricException e) {
            log.debug("[INTAKE] {}", e.getMessage());
            return false;
        }
    }

    /**
     * Build a sample from {@code {type|metric|signal_type, value, block_height, observed_at}}.
     * {@code observed_at} is ISO-8601 or epoch seconds; it defaults to now when absent.
     *
     * @throws IllegalArgumentException when a field is missing or malformed
     */
    public SignalSample normalize(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("signal must be a JSON object");
        }
        String type = typeOf(node);
        if (type == null) {
            throw new IllegalArgumentException("missing type, metric or signal_type");
        }
        JsonNode value = node.get("value");
        if (value == null || !value.isNumber()) {
            throw new IllegalArgumentException("value must be a number");
        }
        long blockHeight = 0;
        JsonNode height = node.get("block_height");
        if (height != null && !height.isNull()) {
            if (!height.canConvertToLong() || !height.isIntegralNumber()) {
                throw new IllegalArgumentException("block_height must be an integer");
            }
            blockHeight = height.asLong();
        }
        return new SignalSample(MetricRegistry.normalize(type), value.asDouble(), blockHeight,
            parseInstant(node.get("observed_at")));
    }

    // ═══════════════════════════════════════════════════════════════
    // INSIGHTS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Publish externally generated insights to the live feed. Insights are not evaluated.
     */
    public IntakeResult ingestInsights(JsonNode body) {
        int accepted = 0;
        List<String> rejected = new ArrayList<>();

        List<JsonNode> elements = elements(body);
        for (int i = 0; i < elements.size(); i++) {
            JsonNode node = elements.get(i);
            try {
                if (node == null || !node.isObject()) {
                    throw new IllegalArgumentException("insight must be a JSON object");
                }
                String type = typeOf(node);
                if (type == null) {
                    throw new IllegalArgumentException("missing signal_type");
                }
                String signalType = MetricRegistry.normalize(type);
                String category = node.hasNonNull("category")
                    ? node.get("category").asText().trim().toLowerCase()
                    : categoryOf(signalType).wireName();
                Instant ts = parseInstant(node.get("observed_at"));
                publisher.publish(StreamEvent.insight(signalType, category, node, ts));
                accepted++;
            } catch (IllegalArgumentException e) {
                rejected.add("[" + i + "] " + e.getMessage());
            }
        }
        if (!rejected.isEmpty()) {
            log.warn("[INTAKE] Rejected {} of {} insights: {}", rejected.size(), elements.size(), rejected);
        }
        return new IntakeResult(accepted, 0, rejected);
    }

    // ═══════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════

    private static List<JsonNode> elements(JsonNode body) {
        List<JsonNode> out = new ArrayList<>();
        if (body == null || body.isNull() || body.isMissingNode()) {
            return out;
        }
        if (body.isArray()) {
            body.forEach(out::add);
        } else {
            out.add(body);
        }
        return out;
    }

    private static String typeOf(JsonNode node) {
        for (String field : TYPE_FIELDS) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private SignalCategory categoryOf(String type) {
        return metricRegistry.isKnown(type) ? metricRegistry.categoryOf(type) : SignalCategory.ofMetric(type);
    }

    private Instant parseInstant(JsonNode node) {
        if (node == null || node.isNull()) {
            return clock.instant();
        }
        if (node.isNumber()) {
            BigDecimal seconds = node.decimalValue();
            long whole = seconds.longValue();
            long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
            return Instant.ofEpochSecond(whole, nanos);
        }
        try {
            return Instant.parse(node.asText().trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("observed_at must be ISO-8601 or epoch seconds: " + node.asText());
        }
    }

    private ObjectNode toPayload(SignalSample sample) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("type", sample.type());
        payload.put("value", sample.value());
        payload.put("block_height", sample.blockHeight());
        payload.put("observed_at", sample.observedAt().toString());
        return payload;
    }
}
