package io.utxoiq.pulse.service.ratelimit;

import java.util.Objects;

/**
 * Who a request is counted against: an authenticated user, an API key, or an anonymous address.
 */
public record ClientIdentity(IdentityKind kind, String id) {
    public ClientIdentity {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
    }

    public static ClientIdentity user(String userId) {
        return new ClientIdentity(IdentityKind.USER, userId);
    }

    public static ClientIdentity apiKey(String key) {
        return new ClientIdentity(IdentityKind.API_KEY, key);
    }

    public static ClientIdentity anonymous(String remoteAddress) {
        return new ClientIdentity(IdentityKind.ANONYMOUS, remoteAddress == null ? "unknown" : remoteAddress);
    }

    public String bucketKey() {
        return kind + ":" + id;
    }
}
