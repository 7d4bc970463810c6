package io.utxoiq.pulse.error;

import java.util.List;

/**
 * Malformed alert configuration, rejected at write time.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> violations;

    public ConfigurationException(List<String> violations) {
        super("Invalid alert configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ConfigurationException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
