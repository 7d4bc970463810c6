package io.utxoiq.pulse.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.utxoiq.pulse.domain.alert.ChannelKind;
import io.utxoiq.pulse.domain.alert.TransitionKind;
import io.utxoiq.pulse.domain.notification.NotificationStatus;
import io.utxoiq.pulse.domain.stream.StreamTopic;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 */
class MetricsEndpointTest {

    private static final int TEST_PORT = 19091;
    private Undertow server;
    private PrometheusPulseMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        metrics = new PrometheusPulseMetrics(new CollectorRegistry());

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path()
                .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> scrape() throws Exception {
        return scrape("");
    }

    private HttpResponse<String> scrape(String query) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics" + query))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testMetricsEndpointReturns200() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("text/plain"),
            "Content-Type should be text/plain");
        assertTrue(response.body().contains("# TYPE pulse_transitions counter"));
        assertTrue(response.body().contains("pulse_ws_connections 0.0"));
    }

    @Test
    void testRecordedMetricsAreExported() throws Exception {
        metrics.recordTransition(TransitionKind.TRIGGERED);
        metrics.recordTransition(TransitionKind.TRIGGERED);
        metrics.recordUnknownMetric("bogus");
        metrics.recordDeliveryAttempt(ChannelKind.SMS, false, Duration.ofMillis(40));
        metrics.recordDeliveryOutcome(ChannelKind.SMS, NotificationStatus.FAILED);
        metrics.recordPublished(StreamTopic.ALERTS);
        metrics.recordDroppedFrames(6);
        metrics.recordCacheLookup("feedback", true);

        String body = scrape().body();

        assertTrue(body.contains("pulse_transitions_total{kind=\"TRIGGERED\",} 2.0"), body);
        assertTrue(body.contains("pulse_samples_total{metric=\"bogus\",outcome=\"unknown_metric\",} 1.0"));
        assertTrue(body.contains("pulse_delivery_attempts_total{channel=\"SMS\",status=\"failure\",} 1.0"));
        assertTrue(body.contains("pulse_deliveries_total{channel=\"SMS\",status=\"FAILED\",} 1.0"));
        assertTrue(body.contains("pulse_stream_events_total{topic=\"alerts\",} 1.0"));
        assertTrue(body.contains("pulse_ws_dropped_frames_total 6.0"));
        assertTrue(body.contains("pulse_cache_lookups_total{cache=\"feedback\",result=\"hit\",} 1.0"));
    }

    @Test
    void testDeliveryLatencyHistogram() throws Exception {
        metrics.recordDeliveryAttempt(ChannelKind.EMAIL, true, Duration.ofMillis(30));
        metrics.recordDeliveryAttempt(ChannelKind.EMAIL, true, Duration.ofMillis(700));

        String body = scrape().body();

        assertTrue(body.contains("pulse_delivery_latency_seconds_bucket{channel=\"EMAIL\",le=\"0.05\",} 1.0"));
        assertTrue(body.contains("pulse_delivery_latency_seconds_bucket{channel=\"EMAIL\",le=\"+Inf\",} 2.0"));
        assertTrue(body.contains("pulse_delivery_latency_seconds_count{channel=\"EMAIL\",} 2.0"));
    }

    @Test
    void testNameFilter() throws Exception {
        metrics.recordDroppedFrames(3);

        String body = scrape("?name%5B%5D=pulse_ws_connections").body();

        assertTrue(body.contains("pulse_ws_connections 0.0"));
        assertFalse(body.contains("pulse_ws_dropped_frames_total"), "Only requested samples are exported");
    }
}
