package io.utxoiq.pulse.transport.http;

import io.utxoiq.pulse.domain.alert.AlertConfiguration;
import io.utxoiq.pulse.domain.alert.ChannelKind;
import io.utxoiq.pulse.domain.alert.ComparisonOperator;
import io.utxoiq.pulse.domain.alert.EvaluationWindow;
import io.utxoiq.pulse.domain.alert.Severity;
import io.utxoiq.pulse.domain.alert.ThresholdType;
import io.utxoiq.pulse.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AlertRequestMapperTest {

    private static Map<String, Object> request() {
        Map<String, Object> body = new HashMap<>();
        body.put("name", "High fees");
        body.put("metric", "mempool_fee_rate");
        body.put("operator", ">=");
        body.put("threshold", 80);
        body.put("window_samples", 3);
        body.put("severity", "critical");
        body.put("channels", List.of(
            Map.of("kind", "email", "target", "ops@example.com"),
            Map.of("kind", "slack", "target", "https://chat.example.com/hook")));
        return body;
    }

    @Test
    void testDraftFromRequest() {
        AlertConfiguration config = AlertRequestMapper.toDraft(request()).id("a-1").owner("user-1").build();

        assertEquals(ComparisonOperator.GREATER_OR_EQUAL, config.operator());
        assertEquals(80.0, config.threshold());
        assertEquals(ThresholdType.ABSOLUTE, config.thresholdType());
        assertEquals(EvaluationWindow.ofSamples(3), config.window());
        assertEquals(Severity.CRITICAL, config.severity());
        assertEquals(2, config.channels().size());
        assertEquals(ChannelKind.CHAT_WEBHOOK, config.channels().get(1).kind(), "slack is an alias");
    }

    @Test
    void testDurationWindowInSeconds() {
        Map<String, Object> body = request();
        body.remove("window_samples");
        body.put("window_seconds", 1.5);

        AlertConfiguration config = AlertRequestMapper.toDraft(body).id("a-1").owner("user-1").build();

        assertEquals(EvaluationWindow.ofDuration(Duration.ofMillis(1500)), config.window());
        assertEquals(1.5, AlertRequestMapper.toResponse(config).get("window_seconds"));
    }

    @Test
    void testEveryViolationReported() {
        Map<String, Object> body = request();
        body.put("operator", "~");
        body.put("threshold", "eighty");
        body.put("window_seconds", 10);
        body.put("severity", "loud");
        body.put("channels", List.of(Map.of("kind", "pager", "target", "x")));
        body.put("suppression_start", "2026-07-01T00:00:00Z");

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> AlertRequestMapper.toDraft(body));

        assertEquals(6, e.getViolations().size(), e.getViolations().toString());
    }

    @Test
    void testVersionRequiredForUpdates() {
        Map<String, Object> body = request();
        assertThrows(ConfigurationException.class, () -> AlertRequestMapper.expectedVersion(body));

        body.put("version", 4);
        assertEquals(4L, AlertRequestMapper.expectedVersion(body));
    }

    @Test
    void testResponseShape() {
        AlertConfiguration config = AlertRequestMapper.toDraft(request()).id("a-1").owner("user-1").build();

        Map<String, Object> response = AlertRequestMapper.toResponse(config);

        assertEquals(">=", response.get("operator"));
        assertEquals(3, response.get("window_samples"));
        assertFalse(response.containsKey("window_seconds"));
        assertFalse(response.containsKey("suppression_start"));
        assertEquals(1L, response.get("version"));
    }
}
