package io.utxoiq.pulse.service.stream;

import io.utxoiq.pulse.domain.stream.StreamTopic;

import java.util.Map;

public record HubStats(
    int connections,
    long totalDrops,
    Map<StreamTopic, Long> lastSequence
) {
}
