package io.utxoiq.pulse.transport.ws;

import io.utxoiq.pulse.domain.alert.Severity;
import io.utxoiq.pulse.domain.stream.StreamTopic;
import io.utxoiq.pulse.domain.stream.SubscriptionFilter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests:
 * - Filter parsing from the WebSocket upgrade query
 * - Resume cursor parsing and rejection of malformed cursors
 */
class WsHubQueryTest {

    @Test
    void testFilterFromQuery() {
        SubscriptionFilter filter = WsHub.parseFilter(Map.of(
            "topics", List.of("alerts, Signals"),
            "signal_types", List.of("Mempool_Fee_Rate"),
            "categories", List.of("MEMPOOL,whale"),
            "severities", List.of("critical")));

        assertEquals(Set.of(StreamTopic.ALERTS, StreamTopic.SIGNALS), filter.topics());
        assertEquals(Set.of("mempool_fee_rate"), filter.signalTypes());
        assertEquals(Set.of("mempool", "whale"), filter.categories());
        assertEquals(Set.of(Severity.CRITICAL), filter.severities());
    }

    @Test
    void testMissingParamsMatchEverything() {
        assertEquals(SubscriptionFilter.ALL, WsHub.parseFilter(Map.of()));
        assertEquals(SubscriptionFilter.ALL, WsHub.parseFilter(null));
    }

    @Test
    void testUnknownTopicRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> WsHub.parseFilter(Map.of("topics", List.of("blocks"))));
        assertTrue(e.getMessage().contains("blocks"));

        assertThrows(IllegalArgumentException.class,
            () -> WsHub.parseFilter(Map.of("severities", List.of("urgent"))));
    }

    @Test
    void testCursorParsing() {
        Map<StreamTopic, Long> cursor = WsHub.parseCursor("signals:41, alerts:7");

        assertEquals(2, cursor.size());
        assertEquals(41L, cursor.get(StreamTopic.SIGNALS));
        assertEquals(7L, cursor.get(StreamTopic.ALERTS));
        assertTrue(WsHub.parseCursor(null).isEmpty());
    }

    @Test
    void testMalformedCursorRejected() {
        assertThrows(IllegalArgumentException.class, () -> WsHub.parseCursor("signals"));
        assertThrows(IllegalArgumentException.class, () -> WsHub.parseCursor("signals:abc"));
        assertThrows(IllegalArgumentException.class, () -> WsHub.parseCursor("signals:-1"));
        assertThrows(IllegalArgumentException.class, () -> WsHub.parseCursor("blocks:3"));
    }
}
