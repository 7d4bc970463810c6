package io.utxoiq.pulse.application.port.output;

import io.utxoiq.pulse.domain.stats.FeedbackStats;

/**
 * Insight feedback ratings.
 */
public interface FeedbackStore {
    void record(String insightId, String userId, boolean helpful);

    /**
     * Aggregate over every rating of an insight. Expensive; callers go through the result cache.
     */
    FeedbackStats aggregate(String insightId);
}
