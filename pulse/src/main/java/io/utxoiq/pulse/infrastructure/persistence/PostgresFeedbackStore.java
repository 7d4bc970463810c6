package io.utxoiq.pulse.infrastructure.persistence;

import io.utxoiq.pulse.application.port.output.FeedbackStore;
import io.utxoiq.pulse.domain.stats.FeedbackStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;

/**
 * PostgreSQL implementation of FeedbackStore. One rating per user and insight; a second rating replaces the first.
 */
public final class PostgresFeedbackStore implements FeedbackStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresFeedbackStore.class);

    private final DataSource dataSource;

    public PostgresFeedbackStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void record(String insightId, String userId, boolean helpful) {
        String sql = """
                INSERT INTO insight_feedback (insight_id, user_id, helpful, created_at)
                VALUES (?, ?, ?, NOW())
                ON CONFLICT (insight_id, user_id) DO UPDATE SET
                    helpful = EXCLUDED.helpful,
                    created_at = NOW()
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, insightId);
            ps.setString(2, userId);
            ps.setBoolean(3, helpful);
            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to record feedback for {}: {}", insightId, e.getMessage());
            throw new RuntimeException("Failed to record feedback", e);
        }
    }

    @Override
    public FeedbackStats aggregate(String insightId) {
        String sql = """
                SELECT COUNT(*) AS total,
                       COUNT(*) FILTER (WHERE helpful) AS helpful,
                       COUNT(*) FILTER (WHERE NOT helpful) AS not_helpful
                FROM insight_feedback
                WHERE insight_id = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, insightId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return new FeedbackStats(insightId, rs.getLong("total"), rs.getLong("helpful"),
                    rs.getLong("not_helpful"));
            }
        } catch (Exception e) {
            log.error("Failed to aggregate feedback for {}: {}", insightId, e.getMessage());
            throw new RuntimeException("Failed to aggregate feedback", e);
        }
    }
}
