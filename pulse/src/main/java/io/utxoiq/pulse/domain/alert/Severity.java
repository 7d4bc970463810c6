package io.utxoiq.pulse.domain.alert;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    public static Severity parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Severity is required");
        }
        return Severity.valueOf(raw.trim().toUpperCase());
    }
}
