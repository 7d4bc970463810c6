package io.utxoiq.pulse.error;

/**
 * A sample referenced a metric the registry does not know. The sample is dropped.
 */
public class UnknownMetricException extends RuntimeException {

    private final String metric;

    public UnknownMetricException(String metric) {
        super("Unknown metric: " + metric);
        this.metric = metric;
    }

    public String getMetric() {
        return metric;
    }
}
