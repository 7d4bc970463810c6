package io.utxoiq.pulse.service.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.utxoiq.pulse.domain.stream.EventType;
import io.utxoiq.pulse.domain.stream.StreamEvent;
import io.utxoiq.pulse.domain.stream.StreamTopic;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One frame on the wire.
 *
 * Data frames render as {@code {type, topic, sequence, payload, ts}}. Control frames
 * carry their fields at the top level ({@code dropped_count}, {@code gap}, ...).
 */
public record OutboundFrame(
    EventType type,
    StreamTopic topic,      // null for connection-level control frames
    long sequence,          // 0 for control frames
    JsonNode payload,
    Map<String, Object> fields,
    Instant ts
) {
    public OutboundFrame {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public static OutboundFrame data(StreamEvent event) {
        return new OutboundFrame(event.type(), event.topic(), event.seq(), event.payload(), null, event.ts());
    }

    public static OutboundFrame dropped(long droppedCount, Instant ts) {
        return control(EventType.DROPPED, null, Map.of("dropped_count", droppedCount), ts);
    }

    public static OutboundFrame gap(StreamTopic topic, long requested, long oldest, Instant ts) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("gap", true);
        fields.put("requested", requested);
        fields.put("oldest", oldest);
        return control(EventType.GAP, topic, fields, ts);
    }

    public static OutboundFrame heartbeat(Instant ts) {
        return control(EventType.HEARTBEAT, null, Map.of(), ts);
    }

    public static OutboundFrame control(EventType type, JsonNode payload, Instant ts) {
        return new OutboundFrame(type, null, 0, payload, null, ts);
    }

    private static OutboundFrame control(EventType type, StreamTopic topic, Map<String, Object> fields, Instant ts) {
        return new OutboundFrame(type, topic, 0, null, fields, ts);
    }

    public boolean isData() {
        return !type.isControl();
    }

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", type.name());
        if (topic != null) {
            node.put("topic", topic.wireName());
        }
        if (isData()) {
            node.put("sequence", sequence);
        }
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            node.set(field.getKey(), mapper.valueToTree(field.getValue()));
        }
        if (payload != null) {
            node.set("payload", payload);
        }
        node.put("ts", ts.toString());
        return node;
    }
}
