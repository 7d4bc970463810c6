package io.utxoiq.pulse.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.utxoiq.pulse.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TokenServiceTest {

    private MutableClock clock;
    private TokenService tokens;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-07-01T12:00:00Z"));
        tokens = new TokenService("test-secret-at-least-32-bytes-long!!", 60_000, new ObjectMapper(), clock);
    }

    @Test
    void testIssuedTokenResolvesToOwner() {
        String token = tokens.generateToken("user-1", "USER");

        assertEquals("user-1", tokens.validateAndGetUserId(token));
        assertEquals("user-1", tokens.validateAndGetUserId("Bearer " + token), "Bearer prefix is accepted");

        TokenService.TokenClaims claims = tokens.verify(token);
        assertNotNull(claims);
        assertFalse(claims.isAdmin());
        assertEquals(clock.millis() + 60_000, claims.expiresAt());
    }

    @Test
    void testForgedTokensRejected() {
        String token = tokens.generateToken("user-1", "USER");
        String[] parts = token.split("\\.");

        String otherSecret = new TokenService("another-secret-value-that-differs", 60_000, new ObjectMapper(), clock)
            .generateToken("user-1", "USER");

        assertNull(tokens.validateAndGetUserId(parts[0] + "." + parts[1] + ".AAAA"));
        assertNull(tokens.validateAndGetUserId(otherSecret));
        assertNull(tokens.validateAndGetUserId("not-a-token"));
        assertNull(tokens.validateAndGetUserId(null));
        assertNull(tokens.validateAndGetUserId(""));
    }

    @Test
    void testExpiredTokenRejected() {
        String token = tokens.generateToken("user-1", "USER");

        clock.advance(Duration.ofSeconds(59));
        assertEquals("user-1", tokens.validateAndGetUserId(token));

        clock.advance(Duration.ofSeconds(2));
        assertNull(tokens.validateAndGetUserId(token), "Token should expire after 60s");
    }

    @Test
    void testRevocationAndCleanup() {
        String token = tokens.generateToken("admin-1", "ADMIN");
        assertTrue(tokens.verify(token).isAdmin());

        tokens.revoke("Bearer " + token);
        assertNull(tokens.validateAndGetUserId(token));

        assertEquals(0, tokens.cleanupRevoked(), "Revocation is kept while the token could still be valid");
        clock.advance(Duration.ofSeconds(61));
        assertEquals(1, tokens.cleanupRevoked());
    }
}
