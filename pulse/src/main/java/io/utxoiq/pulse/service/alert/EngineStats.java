package io.utxoiq.pulse.service.alert;

public record EngineStats(
    int registeredAlerts,
    long evaluated,
    long triggered,
    long resolved,
    long renotified,
    long unknownMetricDrops,
    long unevaluableDrops,
    long suppressed
) {}
