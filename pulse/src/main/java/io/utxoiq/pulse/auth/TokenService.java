package io.utxoiq.pulse.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HS256 bearer tokens resolving to an owner id.
 *
 * Tokens are issued by the account service upstream; this side only needs the
 * shared secret. {@link #generateToken} exists for local runs and tests.
 */
public final class TokenService {
    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    private static final String HEADER = "{\"alg\":\"HS256\",\"typ\":\"JWT\"}";

    private final byte[] secret;
    private final long expirationMs;
    private final ObjectMapper mapper;
    private final Clock clock;

    // Revoked token -> revocation time
    private final Map<String, Instant> revoked = new ConcurrentHashMap<>();

    public TokenService(String secret, long expirationMs, ObjectMapper mapper, Clock clock) {
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.expirationMs = expirationMs;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Issue a token for an owner.
     */
    public String generateToken(String userId, String role) {
        long now = clock.millis();
        ObjectNode claims = mapper.createObjectNode();
        claims.put("sub", userId);
        claims.put("role", role);
        claims.put("iat", now / 1000);
        claims.put("exp", (now + expirationMs) / 1000);

        String header = base64Encode(HEADER.getBytes(StandardCharsets.UTF_8));
        String payload;
        try {
            payload = base64Encode(mapper.writeValueAsBytes(claims));
        } catch (Exception e) {
            throw new RuntimeException("Failed to encode token claims", e);
        }
        return header + "." + payload + "." + sign(header + "." + payload);
    }

    /**
     * Validate a token (with or without the "Bearer " prefix).
     *
     * @return owner id, or null if the token is malformed, forged, expired or revoked
     */
    public String validateAndGetUserId(String token) {
        TokenClaims claims = verify(token);
        return claims == null ? null : claims.userId();
    }

    public TokenClaims verify(String token) {
        token = stripBearer(token);
        if (token == null || token.isEmpty()) {
            return null;
        }

        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            log.debug("Invalid token format");
            return null;
        }

        byte[] expected = sign(parts[0] + "." + parts[1]).getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, parts[2].getBytes(StandardCharsets.UTF_8))) {
            log.debug("Invalid token signature");
            return null;
        }

        TokenClaims claims;
        try {
            JsonNode payload = mapper.readTree(Base64.getUrlDecoder().decode(parts[1]));
            if (!payload.hasNonNull("sub") || !payload.hasNonNull("exp")) {
                log.debug("Missing required claims");
                return null;
            }
            claims = new TokenClaims(
                payload.get("sub").asText(),
                payload.path("role").asText("USER"),
                payload.path("iat").asLong() * 1000,
                payload.get("exp").asLong() * 1000
            );
        } catch (Exception e) {
            log.debug("Token validation error: {}", e.getMessage());
            return null;
        }

        if (clock.millis() > claims.expiresAt()) {
            log.debug("Token expired");
            return null;
        }
        if (revoked.containsKey(token)) {
            log.debug("Token is revoked");
            return null;
        }
        return claims;
    }

    public void revoke(String token) {
        token = stripBearer(token);
        if (token != null) {
            revoked.put(token, clock.instant());
        }
    }

    /**
     * Forget revocations old enough that the token has expired anyway.
     */
    public int cleanupRevoked() {
        long cutoff = clock.millis() - expirationMs;
        int before = revoked.size();
        revoked.entrySet().removeIf(e -> e.getValue().toEpochMilli() < cutoff);
        return before - revoked.size();
    }

    private static String stripBearer(String token) {
        if (token != null && token.startsWith("Bearer ")) {
            return token.substring(7).trim();
        }
        return token;
    }

    private String sign(String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret, "HmacSHA256"));
            return base64Encode(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new RuntimeException("Failed to sign token", e);
        }
    }

    private static String base64Encode(byte[] data) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(data);
    }

    public record TokenClaims(
        String userId,
        String role,
        long issuedAt,
        long expiresAt
    ) {
        public boolean isAdmin() {
            return "ADMIN".equals(role);
        }
    }
}
