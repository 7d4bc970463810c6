package io.utxoiq.pulse.infrastructure.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.utxoiq.pulse.domain.alert.ChannelKind;
import io.utxoiq.pulse.error.TransientUpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

/**
 * Posts an attachment-style JSON message to a chat webhook URL.
 *
 * The target is the webhook URL. A blank target falls back to the default URL
 * configured for the deployment.
 */
public final class ChatWebhookChannel implements NotificationChannel {
    private static final Logger log = LoggerFactory.getLogger(ChatWebhookChannel.class);

    private final WebhookTransport transport;
    private final ObjectMapper mapper;
    private final String defaultUrl;

    public ChatWebhookChannel(WebhookTransport transport, ObjectMapper mapper, String defaultUrl) {
        this.transport = transport;
        this.mapper = mapper;
        this.defaultUrl = defaultUrl == null ? "" : defaultUrl;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.CHAT_WEBHOOK;
    }

    @Override
    public DeliveryResult send(String target, ChannelPayload payload) {
        String url = target == null || target.isBlank() ? defaultUrl : target;
        if (url.isBlank()) {
            return DeliveryResult.failed("No webhook URL configured");
        }

        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return DeliveryResult.failed("Invalid webhook URL: " + e.getMessage());
        }

        int status;
        try {
            status = transport.post(uri, render(payload));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientUpstreamException("chat-webhook", "Interrupted while posting", e);
        } catch (Exception e) {
            throw new TransientUpstreamException("chat-webhook", e.getMessage(), e);
        }

        if (status >= 200 && status < 300) {
            log.debug("[CHAT] Delivered {} for alert {}", payload.kind(), payload.alertId());
            return DeliveryResult.delivered("HTTP " + status);
        }
        log.warn("[CHAT] Webhook returned {} for alert {}", status, payload.alertId());
        return DeliveryResult.failed("HTTP " + status);
    }

    String render(ChannelPayload payload) throws Exception {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode attachments = root.putArray("attachments");
        ObjectNode attachment = attachments.addObject();
        attachment.put("color", payload.color());
        attachment.put("title", payload.subject());
        attachment.put("text", payload.text());

        ArrayNode fields = attachment.putArray("fields");
        addField(fields, "Metric", payload.metric());
        addField(fields, "Current Value", String.format("%.2f", payload.observedValue()));
        addField(fields, "Threshold", String.format("%s %.2f", payload.operator(), payload.threshold()));
        addField(fields, "Severity", payload.severity().name());

        attachment.put("footer", "utxoIQ Alerts");
        attachment.put("ts", payload.occurredAt().getEpochSecond());
        return mapper.writeValueAsString(root);
    }

    private static void addField(ArrayNode fields, String title, String value) {
        ObjectNode field = fields.addObject();
        field.put("title", title);
        field.put("value", value);
        field.put("short", true);
    }
}
