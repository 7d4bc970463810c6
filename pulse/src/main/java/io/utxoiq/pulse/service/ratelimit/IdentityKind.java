package io.utxoiq.pulse.service.ratelimit;

public enum IdentityKind {
    USER,
    API_KEY,
    ANONYMOUS
}
