package io.utxoiq.pulse.domain.alert;

/**
 * Threshold comparison operators.
 */
public enum ComparisonOperator {
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    EQUAL("==");

    /**
     * Absolute tolerance used by {@link #EQUAL}. Fixed, not configurable.
     */
    public static final double EQUALITY_EPSILON = 0.001;

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(double value, double threshold) {
        return switch (this) {
            case GREATER_THAN -> value > threshold;
            case LESS_THAN -> value < threshold;
            case GREATER_OR_EQUAL -> value >= threshold;
            case LESS_OR_EQUAL -> value <= threshold;
            case EQUAL -> Math.abs(value - threshold) < EQUALITY_EPSILON;
        };
    }

    /**
     * Parse either the symbol ("&gt;=") or the enum name.
     */
    public static ComparisonOperator parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Comparison operator is required");
        }
        String trimmed = raw.trim();
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(trimmed) || op.name().equalsIgnoreCase(trimmed)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + raw);
    }
}
