package io.rthub.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Creates the rt_events table and its indexes on startup.
 */
public final class EventTableMigration {
    private static final Logger log = LoggerFactory.getLogger(EventTableMigration.class);

    static final String TABLE = "rt_events";

    private final DataSource dataSource;

    public EventTableMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[MIGRATION] Starting {} migration", TABLE);

        try (Connection conn = dataSource.getConnection()) {
            if (!tableExists(conn, TABLE)) {
                log.info("[MIGRATION] Creating {} table...", TABLE);
                createTable(conn);
                log.info("[MIGRATION] {} table created", TABLE);
            } else {
                log.info("[MIGRATION] {} table already exists", TABLE);
            }
            createIndexes(conn);
            log.info("[MIGRATION] Migration completed successfully");
        } catch (Exception e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("rt_events migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws Exception {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createTable(Connection conn) throws Exception {
        String sql = """
            CREATE TABLE rt_events (
                id VARCHAR(32) PRIMARY KEY,
                type VARCHAR(255) NOT NULL,
                source VARCHAR(255) NOT NULL DEFAULT 'unknown',
                payload JSONB,
                priority VARCHAR(16) NOT NULL DEFAULT 'normal',
                status VARCHAR(16) NOT NULL DEFAULT 'pending',
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                processed_at TIMESTAMPTZ,
                retry_count INT NOT NULL DEFAULT 0,
                error_message TEXT,

                CONSTRAINT chk_rt_events_status CHECK (status IN ('pending', 'processed', 'failed', 'retry')),
                CONSTRAINT chk_rt_events_type CHECK (length(trim(type)) > 0)
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    private void createIndexes(Connection conn) throws Exception {
        String[] statements = {
            "CREATE INDEX IF NOT EXISTS idx_rt_events_status ON rt_events (status, created_at)",
            "CREATE INDEX IF NOT EXISTS idx_rt_events_type ON rt_events (type)",
            "CREATE INDEX IF NOT EXISTS idx_rt_events_source ON rt_events (source)",
            "CREATE INDEX IF NOT EXISTS idx_rt_events_created ON rt_events (created_at DESC, id DESC)"
        };
        try (Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        }
    }
}
