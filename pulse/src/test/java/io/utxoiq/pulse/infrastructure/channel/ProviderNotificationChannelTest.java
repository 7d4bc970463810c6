package io.utxoiq.pulse.infrastructure.channel;

import io.utxoiq.pulse.domain.alert.ChannelKind;
import io.utxoiq.pulse.domain.alert.Severity;
import io.utxoiq.pulse.domain.alert.TransitionKind;
import io.utxoiq.pulse.error.TransientUpstreamException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProviderNotificationChannelTest {

    private static ChannelPayload payload(String name) {
        return new ChannelPayload("a-1", name, TransitionKind.TRIGGERED, Severity.WARNING, "whale_transfer",
            1500, ">=", 1000, Instant.parse("2026-07-01T08:30:00Z"));
    }

    @Test
    void testSmsBodyFitsOneSegment() {
        List<String> bodies = new ArrayList<>();
        ProviderNotificationChannel sms = ProviderNotificationChannel.sms(
            (kind, target, subject, body) -> bodies.add(body));

        DeliveryResult result = sms.send("+15550100", payload("x".repeat(300)));

        assertTrue(result.success());
        assertEquals(ChannelPayload.SMS_LIMIT, bodies.get(0).length());
        assertTrue(bodies.get(0).endsWith("..."));
    }

    @Test
    void testEmailCarriesSubjectAndText() {
        List<String> sent = new ArrayList<>();
        ProviderNotificationChannel email = ProviderNotificationChannel.email(
            (kind, target, subject, body) -> sent.add(kind + "|" + target + "|" + subject + "|" + body));

        email.send("ops@example.com", payload("Whale watch"));

        assertEquals(1, sent.size());
        assertTrue(sent.get(0).startsWith("EMAIL|ops@example.com|[WARNING] Whale watch|Whale watch triggered"));
    }

    @Test
    void testProviderFailureIsTransient() {
        ProviderNotificationChannel email = ProviderNotificationChannel.email((kind, target, subject, body) -> {
            throw new IllegalStateException("provider down");
        });

        TransientUpstreamException e = assertThrows(TransientUpstreamException.class,
            () -> email.send("ops@example.com", payload("Whale watch")));
        assertTrue(e.getMessage().contains("provider down"));
    }

    @Test
    void testChatKindRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new ProviderNotificationChannel(ChannelKind.CHAT_WEBHOOK, (kind, target, subject, body) -> { }));
    }
}
