package com.hwbscan.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * Database connection manager. Embedded SQLite by default, PostgreSQL when
 * {@code db.url} points at one.
 */
public final class Database {
    private static final Logger LOG = LogManager.getLogger(Database.class);
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";
    private static final String POSTGRES_PREFIX = "jdbc:postgresql:";

    private final String jdbcUrl;
    private final String schema;
    private final boolean sqlite;
    private final DataSource dataSource;

    public Database(String jdbcUrl) {
        this(jdbcUrl, null, null, null);
    }

    public Database(String jdbcUrl, String user, String pass, String schema) {
        if (isBlank(jdbcUrl)) {
            throw new IllegalArgumentException("db.url must not be empty");
        }
        this.jdbcUrl = jdbcUrl.trim();
        String lower = this.jdbcUrl.toLowerCase(Locale.ROOT);
        if (lower.startsWith(SQLITE_PREFIX)) {
            this.sqlite = true;
            this.schema = "main";
            this.dataSource = null;
            ensureSqliteDirectory(this.jdbcUrl.substring(SQLITE_PREFIX.length()));
        } else if (lower.startsWith(POSTGRES_PREFIX)) {
            this.sqlite = false;
            this.schema = normalizeSchema(schema);
            PGSimpleDataSource pg = new PGSimpleDataSource();
            pg.setUrl(this.jdbcUrl);
            if (!isBlank(user)) {
                pg.setUser(user.trim());
            }
            if (pass != null) {
                pg.setPassword(pass);
            }
            pg.setCurrentSchema(this.schema);
            pg.setApplicationName("hwb-scan");
            this.dataSource = pg;
        } else {
            throw new IllegalArgumentException("db.url must be a SQLite (jdbc:sqlite:...) or PostgreSQL (jdbc:postgresql://...) JDBC URL");
        }
    }

    public Connection connect() throws SQLException {
        try {
            if (sqlite) {
                Connection c = DriverManager.getConnection(jdbcUrl);
                try (Statement st = c.createStatement()) {
                    st.execute("PRAGMA busy_timeout=5000");
                }
                return c;
            }
            Connection raw = dataSource.getConnection();
            try (Statement st = raw.createStatement()) {
                st.execute("SET search_path TO " + schema + ", public");
            }
            return raw;
        } catch (SQLException e) {
            String cwd = Paths.get(".").toAbsolutePath().normalize().toString();
            String details = "DB connect failed: jdbc_url=" + maskedJdbcUrl()
                    + ", cwd=" + cwd
                    + ", hint=" + classifyConnectFailure(e)
                    + ", cause=" + safe(e.getMessage());
            LOG.error(details);
            throw new SQLException(details, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    public String dbType() {
        return sqlite ? "SQLITE" : "POSTGRES";
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        String out = jdbcUrl;
        out = out.replaceAll("(?i)(password=)[^&]+", "$1***");
        out = out.replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
        return out;
    }

    private void ensureSqliteDirectory(String location) {
        String path = location == null ? "" : location.trim();
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        if (path.isEmpty() || path.startsWith(":memory:") || path.startsWith("file:")) {
            return;
        }
        Path parent = Paths.get(path).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("cannot create database directory " + parent + ": " + e.getMessage(), e);
        }
    }

    private String normalizeSchema(String raw) {
        String value = isBlank(raw) ? "public" : raw.trim();
        if (!value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("invalid db.schema, allowed pattern: [A-Za-z_][A-Za-z0-9_]*");
        }
        return value;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private String classifyConnectFailure(SQLException e) {
        String msg = safe(e == null ? null : e.getMessage()).toLowerCase(Locale.ROOT);
        if (msg.contains("permission denied") || msg.contains("access is denied")) {
            return "permission";
        }
        if (msg.contains("locked") || msg.contains("database is locked")) {
            return "locked";
        }
        if (msg.contains("no such file") || msg.contains("cannot open") || msg.contains("does not exist")) {
            return "missing_dir";
        }
        return "connection_error";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
