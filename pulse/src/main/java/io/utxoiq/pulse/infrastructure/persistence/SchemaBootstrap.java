package io.utxoiq.pulse.infrastructure.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates the alerting tables on startup when they are missing.
 *
 * Tables:
 * - alert_configurations: user-defined alert conditions (versioned)
 * - alert_state_snapshots: last evaluation state per alert
 * - notification_records: delivery history, never deleted
 * - metric_baselines: baseline statistics written by the analytics pipeline
 * - insight_feedback: per-user helpful / not-helpful ratings
 */
public final class SchemaBootstrap {
    private static final Logger log = LoggerFactory.getLogger(SchemaBootstrap.class);

    private final DataSource dataSource;

    public SchemaBootstrap(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void run() {
        log.info("[SCHEMA] Checking alerting tables");

        try (Connection conn = dataSource.getConnection()) {
            for (Map.Entry<String, String> table : tables().entrySet()) {
                if (tableExists(conn, table.getKey())) {
                    log.info("[SCHEMA] {} already exists", table.getKey());
                    continue;
                }
                log.info("[SCHEMA] Creating {}...", table.getKey());
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute(table.getValue());
                }
                log.info("[SCHEMA] ✓ {} created", table.getKey());
            }
        } catch (Exception e) {
            log.error("[SCHEMA] Bootstrap failed: {}", e.getMessage(), e);
            throw new RuntimeException("Schema bootstrap failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws Exception {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private static Map<String, String> tables() {
        Map<String, String> ddl = new LinkedHashMap<>();
        ddl.put("alert_configurations", """
            CREATE TABLE IF NOT EXISTS alert_configurations (
                alert_id VARCHAR(64) PRIMARY KEY,
                owner_id VARCHAR(128) NOT NULL,
                name VARCHAR(200) NOT NULL,
                metric VARCHAR(100) NOT NULL,
                comparison_operator VARCHAR(4) NOT NULL,
                threshold DOUBLE PRECISION NOT NULL,
                threshold_type VARCHAR(20) NOT NULL DEFAULT 'ABSOLUTE',
                window_kind VARCHAR(20) NOT NULL,
                window_samples INT NOT NULL DEFAULT 0,
                window_millis BIGINT NOT NULL DEFAULT 0,
                severity VARCHAR(20) NOT NULL,
                channels TEXT NOT NULL,
                enabled BOOLEAN NOT NULL DEFAULT TRUE,
                renotify BOOLEAN NOT NULL DEFAULT FALSE,
                suppression_start TIMESTAMPTZ,
                suppression_end TIMESTAMPTZ,
                version BIGINT NOT NULL DEFAULT 1,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            );
            CREATE INDEX IF NOT EXISTS idx_alert_configurations_owner ON alert_configurations(owner_id);
            """);
        ddl.put("alert_state_snapshots", """
            CREATE TABLE IF NOT EXISTS alert_state_snapshots (
                alert_id VARCHAR(64) PRIMARY KEY,
                status VARCHAR(20) NOT NULL,
                window_samples TEXT NOT NULL,
                pending_since TIMESTAMPTZ,
                last_transition_at TIMESTAMPTZ,
                last_notified_at TIMESTAMPTZ,
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);
        ddl.put("notification_records", """
            CREATE TABLE IF NOT EXISTS notification_records (
                record_id VARCHAR(64) PRIMARY KEY,
                alert_id VARCHAR(64) NOT NULL,
                transition_id VARCHAR(64) NOT NULL,
                transition_kind VARCHAR(20) NOT NULL,
                channel VARCHAR(20) NOT NULL,
                target VARCHAR(500) NOT NULL,
                status VARCHAR(20) NOT NULL,
                attempt_count INT NOT NULL DEFAULT 0,
                triggered_at TIMESTAMPTZ NOT NULL,
                resolved_at TIMESTAMPTZ,
                next_attempt_at TIMESTAMPTZ,
                last_error TEXT,
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            );
            CREATE INDEX IF NOT EXISTS idx_notification_records_alert ON notification_records(alert_id, triggered_at DESC);
            """);
        ddl.put("metric_baselines", """
            CREATE TABLE IF NOT EXISTS metric_baselines (
                metric VARCHAR(100) PRIMARY KEY,
                mean DOUBLE PRECISION NOT NULL,
                median DOUBLE PRECISION NOT NULL,
                std_dev DOUBLE PRECISION NOT NULL,
                p95 DOUBLE PRECISION NOT NULL,
                p99 DOUBLE PRECISION NOT NULL,
                sample_count BIGINT NOT NULL,
                computed_at TIMESTAMPTZ NOT NULL
            )
            """);
        ddl.put("insight_feedback", """
            CREATE TABLE IF NOT EXISTS insight_feedback (
                insight_id VARCHAR(64) NOT NULL,
                user_id VARCHAR(128) NOT NULL,
                helpful BOOLEAN NOT NULL,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                PRIMARY KEY (insight_id, user_id)
            )
            """);
        return ddl;
    }
}
