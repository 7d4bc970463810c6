package io.utxoiq.pulse.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.utxoiq.pulse.application.port.output.AlertStateSnapshotRepository;
import io.utxoiq.pulse.domain.alert.AlertState;
import io.utxoiq.pulse.domain.alert.AlertStatus;
import io.utxoiq.pulse.domain.signal.SignalSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static io.utxoiq.pulse.infrastructure.persistence.PostgresAlertConfigurationRepository.getInstantOrNull;

/**
 * PostgreSQL implementation of AlertStateSnapshotRepository (upsert per alert).
 */
public final class PostgresAlertStateSnapshotRepository implements AlertStateSnapshotRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresAlertStateSnapshotRepository.class);
    private static final TypeReference<List<SignalSample>> SAMPLE_LIST = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper mapper;

    public PostgresAlertStateSnapshotRepository(DataSource dataSource, ObjectMapper mapper) {
        this.dataSource = dataSource;
        this.mapper = mapper;
    }

    @Override
    public void save(AlertState.Snapshot snapshot) {
        String sql = """
                INSERT INTO alert_state_snapshots (
                    alert_id, status, window_samples, pending_since, last_transition_at, last_notified_at, updated_at
                ) VALUES (?, ?, ?, ?, ?, ?, NOW())
                ON CONFLICT (alert_id) DO UPDATE SET
                    status = EXCLUDED.status,
                    window_samples = EXCLUDED.window_samples,
                    pending_since = EXCLUDED.pending_since,
                    last_transition_at = EXCLUDED.last_transition_at,
                    last_notified_at = EXCLUDED.last_notified_at,
                    updated_at = NOW()
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, snapshot.alertId());
            ps.setString(2, snapshot.status().name());
            ps.setString(3, mapper.writeValueAsString(snapshot.window()));
            ps.setTimestamp(4, toTimestamp(snapshot.pendingSince()));
            ps.setTimestamp(5, toTimestamp(snapshot.lastTransitionAt()));
            ps.setTimestamp(6, toTimestamp(snapshot.lastNotifiedAt()));
            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to save state snapshot for {}: {}", snapshot.alertId(), e.getMessage());
            throw new RuntimeException("Failed to save alert state snapshot", e);
        }
    }

    @Override
    public Optional<AlertState.Snapshot> find(String alertId) {
        String sql = "SELECT * FROM alert_state_snapshots WHERE alert_id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, alertId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new AlertState.Snapshot(
                        rs.getString("alert_id"),
                        AlertStatus.valueOf(rs.getString("status")),
                        mapper.readValue(rs.getString("window_samples"), SAMPLE_LIST),
                        getInstantOrNull(rs, "pending_since"),
                        getInstantOrNull(rs, "last_transition_at"),
                        getInstantOrNull(rs, "last_notified_at")));
                }
            }
        } catch (Exception e) {
            log.error("Failed to load state snapshot for {}: {}", alertId, e.getMessage());
            throw new RuntimeException("Failed to load alert state snapshot", e);
        }
        return Optional.empty();
    }

    @Override
    public void delete(String alertId) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM alert_state_snapshots WHERE alert_id = ?")) {

            ps.setString(1, alertId);
            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to delete state snapshot for {}: {}", alertId, e.getMessage());
            throw new RuntimeException("Failed to delete alert state snapshot", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
