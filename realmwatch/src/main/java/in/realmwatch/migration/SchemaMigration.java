package in.realmwatch.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Schema Migration - Creates the presence tables on startup.
 *
 * Creates four tables:
 * - participant_sessions: one row per (realm, participant), keyed by correlation id
 * - offline_realms: realms currently believed unreachable
 * - destination_configs: subscriber settings
 * - destination_failure_counters: per-destination failure counters by class
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    private final DataSource dataSource;

    public SchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates missing tables, leaves existing ones alone.
     */
    public void migrate() {
        log.info("[MIGRATION] Starting schema migration");

        try (Connection conn = dataSource.getConnection()) {
            createIfMissing(conn, "participant_sessions", """
                CREATE TABLE participant_sessions (
                    correlation_id VARCHAR(64) PRIMARY KEY,
                    realm_id VARCHAR(64) NOT NULL,
                    participant_id VARCHAR(64) NOT NULL,
                    online BOOLEAN NOT NULL DEFAULT FALSE,
                    last_seen TIMESTAMPTZ NOT NULL,
                    CONSTRAINT uq_participant_sessions_realm_participant UNIQUE (realm_id, participant_id)
                );
                CREATE INDEX idx_participant_sessions_online ON participant_sessions (online, last_seen);
                """);

            createIfMissing(conn, "offline_realms", """
                CREATE TABLE offline_realms (
                    realm_id VARCHAR(64) PRIMARY KEY,
                    offline_since TIMESTAMPTZ NOT NULL
                );
                """);

            createIfMissing(conn, "destination_configs", """
                CREATE TABLE destination_configs (
                    destination_id VARCHAR(64) PRIMARY KEY,
                    realm_id VARCHAR(64),
                    channel_id VARCHAR(512),
                    live_updates BOOLEAN NOT NULL DEFAULT FALSE,
                    warning_notifications BOOLEAN NOT NULL DEFAULT TRUE,
                    offline_role_id VARCHAR(64),
                    fetch_devices BOOLEAN NOT NULL DEFAULT FALSE,
                    entitled BOOLEAN NOT NULL DEFAULT FALSE,
                    updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
                );
                CREATE INDEX idx_destination_configs_realm ON destination_configs (realm_id);
                """);

            createIfMissing(conn, "destination_failure_counters", """
                CREATE TABLE destination_failure_counters (
                    destination_id VARCHAR(64) NOT NULL,
                    failure_class VARCHAR(32) NOT NULL,
                    failure_count INT NOT NULL DEFAULT 0,
                    updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                    PRIMARY KEY (destination_id, failure_class)
                );
                """);

            log.info("[MIGRATION] Migration completed successfully");

        } catch (Exception e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Schema migration failed", e);
        }
    }

    private void createIfMissing(Connection conn, String tableName, String ddl) throws Exception {
        if (tableExists(conn, tableName)) {
            log.info("[MIGRATION] {} table already exists", tableName);
            return;
        }

        log.info("[MIGRATION] Creating {} table...", tableName);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(ddl);
        }
        log.info("[MIGRATION] ✓ {} table created", tableName);
    }

    private boolean tableExists(Connection conn, String tableName) throws Exception {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }
}
