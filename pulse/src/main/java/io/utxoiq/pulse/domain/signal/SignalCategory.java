package io.utxoiq.pulse.domain.signal;

/**
 * Signal families produced by the upstream processors.
 */
public enum SignalCategory {
    MEMPOOL,
    EXCHANGE,
    MINER,
    WHALE,
    TREASURY,
    PREDICTIVE,
    SYSTEM;

    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * Category from a metric name prefix, SYSTEM when nothing matches.
     */
    public static SignalCategory ofMetric(String metric) {
        String m = metric.toLowerCase();
        if (m.startsWith("mempool") || m.startsWith("fee_rate")) return MEMPOOL;
        if (m.startsWith("exchange")) return EXCHANGE;
        if (m.startsWith("miner") || m.startsWith("hash_rate")) return MINER;
        if (m.startsWith("whale")) return WHALE;
        if (m.startsWith("treasury")) return TREASURY;
        if (m.startsWith("predictive") || m.startsWith("fee_forecast")) return PREDICTIVE;
        return SYSTEM;
    }
}
