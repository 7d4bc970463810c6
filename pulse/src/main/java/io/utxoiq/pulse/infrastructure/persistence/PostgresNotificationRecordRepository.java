package io.utxoiq.pulse.infrastructure.persistence;

import io.utxoiq.pulse.application.port.output.NotificationRecordRepository;
import io.utxoiq.pulse.domain.alert.ChannelKind;
import io.utxoiq.pulse.domain.alert.TransitionKind;
import io.utxoiq.pulse.domain.notification.NotificationRecord;
import io.utxoiq.pulse.domain.notification.NotificationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static io.utxoiq.pulse.infrastructure.persistence.PostgresAlertConfigurationRepository.getInstantOrNull;

/**
 * PostgreSQL implementation of NotificationRecordRepository.
 */
public final class PostgresNotificationRecordRepository implements NotificationRecordRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresNotificationRecordRepository.class);

    private final DataSource dataSource;

    public PostgresNotificationRecordRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insert(NotificationRecord record) {
        String sql = """
                INSERT INTO notification_records (
                    record_id, alert_id, transition_id, transition_kind, channel, target, status,
                    attempt_count, triggered_at, resolved_at, next_attempt_at, last_error, updated_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            ps.setString(idx++, record.id());
            ps.setString(idx++, record.alertId());
            ps.setString(idx++, record.transitionId());
            ps.setString(idx++, record.transitionKind().name());
            ps.setString(idx++, record.channel().name());
            ps.setString(idx++, record.target());
            ps.setString(idx++, record.status().name());
            ps.setInt(idx++, record.attemptCount());
            ps.setTimestamp(idx++, Timestamp.from(record.triggeredAt()));
            ps.setTimestamp(idx++, toTimestamp(record.resolvedAt()));
            ps.setTimestamp(idx++, toTimestamp(record.nextAttemptAt()));
            ps.setString(idx++, record.lastError());
            ps.setTimestamp(idx, Timestamp.from(record.updatedAt()));
            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to insert notification record {}: {}", record.id(), e.getMessage());
            throw new RuntimeException("Failed to insert notification record", e);
        }
    }

    @Override
    public void update(NotificationRecord record) {
        String sql = """
                UPDATE notification_records SET
                    status = ?, attempt_count = ?, next_attempt_at = ?, last_error = ?, updated_at = ?
                WHERE record_id = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, record.status().name());
            ps.setInt(2, record.attemptCount());
            ps.setTimestamp(3, toTimestamp(record.nextAttemptAt()));
            ps.setString(4, record.lastError());
            ps.setTimestamp(5, Timestamp.from(record.updatedAt()));
            ps.setString(6, record.id());
            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to update notification record {}: {}", record.id(), e.getMessage());
            throw new RuntimeException("Failed to update notification record", e);
        }
    }

    @Override
    public List<NotificationRecord> findByAlertId(String alertId, int limit) {
        String sql = """
                SELECT * FROM notification_records
                WHERE alert_id = ?
                ORDER BY triggered_at DESC
                LIMIT ?
                """;

        List<NotificationRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, alertId);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find notifications for alert {}: {}", alertId, e.getMessage());
            throw new RuntimeException("Failed to find notification records", e);
        }
        return records;
    }

    private NotificationRecord mapRow(ResultSet rs) throws SQLException {
        return new NotificationRecord(
            rs.getString("record_id"),
            rs.getString("alert_id"),
            rs.getString("transition_id"),
            TransitionKind.valueOf(rs.getString("transition_kind")),
            ChannelKind.valueOf(rs.getString("channel")),
            rs.getString("target"),
            NotificationStatus.valueOf(rs.getString("status")),
            rs.getInt("attempt_count"),
            rs.getTimestamp("triggered_at").toInstant(),
            getInstantOrNull(rs, "resolved_at"),
            getInstantOrNull(rs, "next_attempt_at"),
            rs.getString("last_error"),
            rs.getTimestamp("updated_at").toInstant()
        );
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
