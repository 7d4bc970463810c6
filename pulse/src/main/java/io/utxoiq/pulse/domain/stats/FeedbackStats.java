package io.utxoiq.pulse.domain.stats;

/**
 * Feedback rollup for one insight.
 */
public record FeedbackStats(
    String insightId,
    long total,
    long helpful,
    long notHelpful
) {
    public double helpfulRatio() {
        return total == 0 ? 0.0 : (double) helpful / total;
    }
}
