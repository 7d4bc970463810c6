package io.utxoiq.pulse.infrastructure.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.utxoiq.pulse.domain.alert.Severity;
import io.utxoiq.pulse.domain.alert.TransitionKind;
import io.utxoiq.pulse.error.TransientUpstreamException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests:
 * - Attachment rendering
 * - Default URL fallback
 * - Status code and exception mapping
 */
class ChatWebhookChannelTest {

    private static final Instant AT = Instant.parse("2026-07-01T08:30:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<URI> posted = new ArrayList<>();
    private final List<String> bodies = new ArrayList<>();

    private ChannelPayload payload(TransitionKind kind, Severity severity) {
        return new ChannelPayload("a-1", "High fees", kind, severity, "mempool_fee_rate",
            91.5, ">", 80.0, AT);
    }

    private ChatWebhookChannel channel(int status, String defaultUrl) {
        return new ChatWebhookChannel((uri, json) -> {
            posted.add(uri);
            bodies.add(json);
            return status;
        }, mapper, defaultUrl);
    }

    @Test
    void testDeliversAttachment() throws Exception {
        DeliveryResult result = channel(200, "")
            .send("https://chat.example.com/hook/1", payload(TransitionKind.TRIGGERED, Severity.CRITICAL));

        assertTrue(result.success());
        assertEquals(URI.create("https://chat.example.com/hook/1"), posted.get(0));

        JsonNode attachment = mapper.readTree(bodies.get(0)).get("attachments").get(0);
        assertEquals("#ff0000", attachment.get("color").asText());
        assertEquals("[CRITICAL] High fees", attachment.get("title").asText());
        assertEquals(AT.getEpochSecond(), attachment.get("ts").asLong());
        assertEquals(4, attachment.get("fields").size());
        assertEquals("mempool_fee_rate", attachment.get("fields").get(0).get("value").asText());
    }

    @Test
    void testResolutionIsGreen() throws Exception {
        channel(204, "").send("https://chat.example.com/hook/1", payload(TransitionKind.RESOLVED, Severity.CRITICAL));

        JsonNode attachment = mapper.readTree(bodies.get(0)).get("attachments").get(0);
        assertEquals("#36a64f", attachment.get("color").asText());
        assertEquals("[RESOLVED] High fees", attachment.get("title").asText());
    }

    @Test
    void testBlankTargetUsesDefaultUrl() {
        DeliveryResult result = channel(200, "https://chat.example.com/default")
            .send(" ", payload(TransitionKind.TRIGGERED, Severity.WARNING));

        assertTrue(result.success());
        assertEquals("https://chat.example.com/default", posted.get(0).toString());
    }

    @Test
    void testNoUrlAnywhereFails() {
        DeliveryResult result = channel(200, null).send(null, payload(TransitionKind.TRIGGERED, Severity.INFO));

        assertFalse(result.success());
        assertTrue(posted.isEmpty(), "Nothing should be posted without a URL");
    }

    @Test
    void testNon2xxIsFailedResult() {
        DeliveryResult result = channel(500, "")
            .send("https://chat.example.com/hook/1", payload(TransitionKind.TRIGGERED, Severity.INFO));

        assertFalse(result.success());
        assertEquals("HTTP 500", result.detail());
    }

    @Test
    void testTransportErrorIsTransient() {
        ChatWebhookChannel failing = new ChatWebhookChannel((uri, json) -> {
            throw new IOException("connection reset");
        }, mapper, "");

        assertThrows(TransientUpstreamException.class,
            () -> failing.send("https://chat.example.com/hook/1", payload(TransitionKind.TRIGGERED, Severity.INFO)));
    }
}
