package io.utxoiq.pulse.infrastructure.persistence;

import io.utxoiq.pulse.application.port.output.BaselineStatsSource;
import io.utxoiq.pulse.domain.stats.BaselineStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.Optional;

/**
 * Reads baselines from metric_baselines. Rows are written by the analytics pipeline.
 */
public final class PostgresBaselineStatsSource implements BaselineStatsSource {
    private static final Logger log = LoggerFactory.getLogger(PostgresBaselineStatsSource.class);

    private final DataSource dataSource;

    public PostgresBaselineStatsSource(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<BaselineStats> load(String metric) {
        String sql = "SELECT * FROM metric_baselines WHERE metric = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, metric);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new BaselineStats(
                        rs.getString("metric"),
                        rs.getDouble("mean"),
                        rs.getDouble("median"),
                        rs.getDouble("std_dev"),
                        rs.getDouble("p95"),
                        rs.getDouble("p99"),
                        rs.getLong("sample_count"),
                        rs.getTimestamp("computed_at").toInstant()));
                }
            }
        } catch (Exception e) {
            log.error("Failed to load baseline for {}: {}", metric, e.getMessage());
            throw new RuntimeException("Failed to load baseline", e);
        }
        return Optional.empty();
    }
}
