package io.utxoiq.pulse.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.utxoiq.pulse.application.port.output.AlertConfigurationRepository;
import io.utxoiq.pulse.domain.alert.AlertConfiguration;
import io.utxoiq.pulse.domain.alert.ChannelTarget;
import io.utxoiq.pulse.domain.alert.ComparisonOperator;
import io.utxoiq.pulse.domain.alert.EvaluationWindow;
import io.utxoiq.pulse.domain.alert.Severity;
import io.utxoiq.pulse.domain.alert.SuppressionWindow;
import io.utxoiq.pulse.domain.alert.ThresholdType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of AlertConfigurationRepository.
 * Channels are stored as a JSON array in a TEXT column.
 */
public final class PostgresAlertConfigurationRepository implements AlertConfigurationRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresAlertConfigurationRepository.class);
    private static final TypeReference<List<ChannelTarget>> CHANNEL_LIST = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper mapper;

    public PostgresAlertConfigurationRepository(DataSource dataSource, ObjectMapper mapper) {
        this.dataSource = dataSource;
        this.mapper = mapper;
    }

    @Override
    public Optional<AlertConfiguration> findById(String id) {
        String sql = "SELECT * FROM alert_configurations WHERE alert_id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find alert {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to find alert configuration", e);
        }
        return Optional.empty();
    }

    @Override
    public List<AlertConfiguration> findByOwner(String owner) {
        return query("SELECT * FROM alert_configurations WHERE owner_id = ? ORDER BY created_at DESC", owner);
    }

    @Override
    public List<AlertConfiguration> findAllEnabled() {
        return query("SELECT * FROM alert_configurations WHERE enabled = TRUE", null);
    }

    @Override
    public void insert(AlertConfiguration config) {
        String sql = """
                INSERT INTO alert_configurations (
                    alert_id, owner_id, name, metric, comparison_operator, threshold, threshold_type,
                    window_kind, window_samples, window_millis, severity, channels, enabled, renotify,
                    suppression_start, suppression_end, version, created_at, updated_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            ps.setString(idx++, config.id());
            ps.setString(idx++, config.owner());
            idx = bindBody(ps, idx, config);
            ps.setTimestamp(idx++, Timestamp.from(config.createdAt()));
            ps.setTimestamp(idx, Timestamp.from(config.updatedAt()));
            ps.executeUpdate();

            log.info("Inserted alert configuration {} for {}", config.id(), config.owner());
        } catch (Exception e) {
            log.error("Failed to insert alert {}: {}", config.id(), e.getMessage());
            throw new RuntimeException("Failed to insert alert configuration", e);
        }
    }

    @Override
    public boolean updateIfVersion(AlertConfiguration config, long expectedVersion) {
        String sql = """
                UPDATE alert_configurations SET
                    name = ?, metric = ?, comparison_operator = ?, threshold = ?, threshold_type = ?,
                    window_kind = ?, window_samples = ?, window_millis = ?, severity = ?, channels = ?,
                    enabled = ?, renotify = ?, suppression_start = ?, suppression_end = ?,
                    version = ?, updated_at = ?
                WHERE alert_id = ? AND version = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = bindBody(ps, 1, config);
            ps.setTimestamp(idx++, Timestamp.from(config.updatedAt()));
            ps.setString(idx++, config.id());
            ps.setLong(idx, expectedVersion);
            return ps.executeUpdate() == 1;
        } catch (Exception e) {
            log.error("Failed to update alert {}: {}", config.id(), e.getMessage());
            throw new RuntimeException("Failed to update alert configuration", e);
        }
    }

    @Override
    public void delete(String id) {
        String sql = "DELETE FROM alert_configurations WHERE alert_id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to delete alert {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to delete alert configuration", e);
        }
    }

    private List<AlertConfiguration> query(String sql, String param) {
        List<AlertConfiguration> configs = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (param != null) {
                ps.setString(1, param);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    configs.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to query alert configurations: {}", e.getMessage());
            throw new RuntimeException("Failed to query alert configurations", e);
        }
        return configs;
    }

    // name .. version, shared by insert and update
    private int bindBody(PreparedStatement ps, int idx, AlertConfiguration config) throws Exception {
        EvaluationWindow window = config.window();
        ps.setString(idx++, config.name());
        ps.setString(idx++, config.metric());
        ps.setString(idx++, config.operator().symbol());
        ps.setDouble(idx++, config.threshold());
        ps.setString(idx++, config.thresholdType().name());
        ps.setString(idx++, window.kind().name());
        ps.setInt(idx++, window.samples());
        ps.setLong(idx++, window.duration() == null ? 0 : window.duration().toMillis());
        ps.setString(idx++, config.severity().name());
        ps.setString(idx++, mapper.writeValueAsString(config.channels()));
        ps.setBoolean(idx++, config.enabled());
        ps.setBoolean(idx++, config.renotify());
        SuppressionWindow suppression = config.suppression();
        ps.setTimestamp(idx++, suppression == null ? null : Timestamp.from(suppression.start()));
        ps.setTimestamp(idx++, suppression == null ? null : Timestamp.from(suppression.end()));
        ps.setLong(idx++, config.version());
        return idx;
    }

    private AlertConfiguration mapRow(ResultSet rs) throws Exception {
        EvaluationWindow window = EvaluationWindow.Kind.valueOf(rs.getString("window_kind")) == EvaluationWindow.Kind.SAMPLES
            ? EvaluationWindow.ofSamples(rs.getInt("window_samples"))
            : EvaluationWindow.ofDuration(Duration.ofMillis(rs.getLong("window_millis")));

        Instant suppressionStart = getInstantOrNull(rs, "suppression_start");
        Instant suppressionEnd = getInstantOrNull(rs, "suppression_end");

        return AlertConfiguration.builder()
            .id(rs.getString("alert_id"))
            .owner(rs.getString("owner_id"))
            .name(rs.getString("name"))
            .metric(rs.getString("metric"))
            .operator(ComparisonOperator.parse(rs.getString("comparison_operator")))
            .threshold(rs.getDouble("threshold"))
            .thresholdType(ThresholdType.valueOf(rs.getString("threshold_type")))
            .window(window)
            .severity(Severity.valueOf(rs.getString("severity")))
            .channels(mapper.readValue(rs.getString("channels"), CHANNEL_LIST))
            .enabled(rs.getBoolean("enabled"))
            .renotify(rs.getBoolean("renotify"))
            .suppression(suppressionStart != null && suppressionEnd != null
                ? new SuppressionWindow(suppressionStart, suppressionEnd) : null)
            .version(rs.getLong("version"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .updatedAt(rs.getTimestamp("updated_at").toInstant())
            .build();
    }

    static Instant getInstantOrNull(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }
}
