package io.utxoiq.pulse.service.feedback;

import io.utxoiq.pulse.application.port.output.FeedbackStore;
import io.utxoiq.pulse.domain.stats.FeedbackStats;
import io.utxoiq.pulse.service.cache.ResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Insight feedback: writes go to the store, rollups are served from the result cache
 * under {@code feedback:<insightId>} and invalidated on every write.
 */
public final class FeedbackService {
    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

    public static final String KEY_PREFIX = "feedback:";

    private final FeedbackStore store;
    private final ResultCache cache;
    private final Duration ttl;

    public FeedbackService(FeedbackStore store, ResultCache cache, Duration ttl) {
        this.store = store;
        this.cache = cache;
        this.ttl = ttl;
    }

    public void record(String insightId, String userId, boolean helpful) {
        if (insightId == null || insightId.isBlank()) {
            throw new IllegalArgumentException("insightId is required");
        }
        store.record(insightId, userId, helpful);
        cache.invalidate(KEY_PREFIX + insightId);
        log.debug("Feedback on {} from {}: helpful={}", insightId, userId, helpful);
    }

    public FeedbackStats stats(String insightId) {
        return cache.getOrCompute(KEY_PREFIX + insightId, () -> store.aggregate(insightId), ttl);
    }
}
