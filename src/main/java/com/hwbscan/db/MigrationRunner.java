package com.hwbscan.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent schema migration for the price cache. The DDL is portable between
 * SQLite and PostgreSQL.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);
    static final int TARGET_VERSION = 1;

    public void run(Database database) throws SQLException {
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS schema_info (" +
                    "info_key TEXT PRIMARY KEY," +
                    "info_value TEXT NOT NULL," +
                    "updated_at TEXT NOT NULL" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                writeSchemaVersion(conn, TARGET_VERSION);
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + safe(e.getMessage());
                LOG.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
            if (currentVersion != TARGET_VERSION) {
                LOG.info("schema migrated: {} -> {} ({})", currentVersion, TARGET_VERSION, database.dbType());
            }
        }
    }

    private List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();

        sqls.add("CREATE TABLE IF NOT EXISTS daily_prices (" +
                "symbol TEXT NOT NULL," +
                "date TEXT NOT NULL," +
                "open DOUBLE PRECISION NOT NULL," +
                "high DOUBLE PRECISION NOT NULL," +
                "low DOUBLE PRECISION NOT NULL," +
                "close DOUBLE PRECISION NOT NULL," +
                "volume BIGINT NOT NULL," +
                "sma200 DOUBLE PRECISION NULL," +
                "ema200 DOUBLE PRECISION NULL," +
                "last_updated TEXT NOT NULL," +
                "PRIMARY KEY (symbol, date)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS weekly_prices (" +
                "symbol TEXT NOT NULL," +
                "week_start TEXT NOT NULL," +
                "open DOUBLE PRECISION NOT NULL," +
                "high DOUBLE PRECISION NOT NULL," +
                "low DOUBLE PRECISION NOT NULL," +
                "close DOUBLE PRECISION NOT NULL," +
                "volume BIGINT NOT NULL," +
                "sma200 DOUBLE PRECISION NULL," +
                "last_updated TEXT NOT NULL," +
                "PRIMARY KEY (symbol, week_start)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS metadata (" +
                "symbol TEXT PRIMARY KEY," +
                "first_date TEXT NULL," +
                "last_date TEXT NULL," +
                "last_updated TEXT NOT NULL," +
                "daily_count INTEGER NOT NULL DEFAULT 0," +
                "weekly_count INTEGER NOT NULL DEFAULT 0" +
                ")");

        sqls.add("CREATE INDEX IF NOT EXISTS idx_daily_prices_symbol_date ON daily_prices(symbol, date DESC)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_weekly_prices_symbol_week ON weekly_prices(symbol, week_start DESC)");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT info_value FROM schema_info WHERE info_key='schema_version'")) {
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    String value = rs.getString(1);
                    if (value != null && !value.trim().isEmpty()) {
                        return Integer.parseInt(value.trim());
                    }
                }
            }
        } catch (SQLException | NumberFormatException e) {
            LOG.warn("cannot read schema version, assuming 0: {}", e.getMessage());
            return 0;
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO schema_info(info_key, info_value, updated_at) VALUES('schema_version', ?, ?) " +
                        "ON CONFLICT(info_key) DO UPDATE SET info_value=excluded.info_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.setString(2, Instant.now().toString());
            ps.executeUpdate();
        }
    }

    private String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replace('\n', ' ').replace('\r', ' ').replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
