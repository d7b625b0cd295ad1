package com.hwbscan.db;

import com.hwbscan.db.mybatis.MyBatisSupport;
import com.hwbscan.db.mybatis.PriceCacheMapper;
import com.hwbscan.db.mybatis.PriceMetadataRow;
import com.hwbscan.db.mybatis.PriceRow;
import com.hwbscan.model.PriceBar;
import com.hwbscan.model.PriceSeries;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and atomically replaces the cached daily/weekly series of a symbol.
 */
public final class PriceCacheDao {
    private static final Logger LOG = LogManager.getLogger(PriceCacheDao.class);

    private final Database database;

    public PriceCacheDao(Database database) {
        this.database = database;
    }

    public Optional<CacheMetadata> loadMetadata(String symbol) throws SQLException {
        try (Connection conn = database.connect(); SqlSession session = MyBatisSupport.openSession(conn)) {
            PriceMetadataRow row = session.getMapper(PriceCacheMapper.class).selectMetadata(symbol);
            if (row == null) {
                return Optional.empty();
            }
            return Optional.of(new CacheMetadata(
                    row.getSymbol(),
                    parseDate(row.getFirstDate()),
                    parseDate(row.getLastDate()),
                    parseInstant(row.getLastUpdated()),
                    row.getDailyCount() == null ? 0 : row.getDailyCount(),
                    row.getWeeklyCount() == null ? 0 : row.getWeeklyCount()
            ));
        }
    }

    public PriceSeries loadDaily(String symbol) throws SQLException {
        try (Connection conn = database.connect(); SqlSession session = MyBatisSupport.openSession(conn)) {
            return toSeries(session.getMapper(PriceCacheMapper.class).selectDaily(symbol));
        }
    }

    public PriceSeries loadWeekly(String symbol) throws SQLException {
        try (Connection conn = database.connect(); SqlSession session = MyBatisSupport.openSession(conn)) {
            return toSeries(session.getMapper(PriceCacheMapper.class).selectWeekly(symbol));
        }
    }

    /**
     * Replaces every stored bar of {@code symbol} and its metadata row in one
     * transaction. On failure nothing changes: SQL errors surface as
     * {@link CacheWriteException}, anything else is rethrown after the rollback.
     * Weekly bars must be dated on the Monday of their week.
     */
    public void replaceSeries(String symbol, PriceSeries daily, PriceSeries weekly, Instant now) throws CacheWriteException {
        String deleteDailySql = "DELETE FROM daily_prices WHERE symbol=?";
        String deleteWeeklySql = "DELETE FROM weekly_prices WHERE symbol=?";
        String insertDailySql = "INSERT INTO daily_prices(symbol, date, open, high, low, close, volume, sma200, ema200, last_updated) " +
                "VALUES(?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        String insertWeeklySql = "INSERT INTO weekly_prices(symbol, week_start, open, high, low, close, volume, sma200, last_updated) " +
                "VALUES(?, ?, ?, ?, ?, ?, ?, ?, ?)";
        String upsertMetaSql = "INSERT INTO metadata(symbol, first_date, last_date, last_updated, daily_count, weekly_count) " +
                "VALUES(?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT(symbol) DO UPDATE SET " +
                "first_date=excluded.first_date, last_date=excluded.last_date, last_updated=excluded.last_updated, " +
                "daily_count=excluded.daily_count, weekly_count=excluded.weekly_count";
        String stamp = now.toString();

        Connection conn = null;
        try {
            conn = database.connect();
            conn.setAutoCommit(false);
            try (PreparedStatement deleteDaily = conn.prepareStatement(deleteDailySql);
                 PreparedStatement deleteWeekly = conn.prepareStatement(deleteWeeklySql)) {
                deleteDaily.setString(1, symbol);
                deleteDaily.executeUpdate();
                deleteWeekly.setString(1, symbol);
                deleteWeekly.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement(insertDailySql)) {
                for (PriceBar bar : daily.bars()) {
                    ps.setString(1, symbol);
                    ps.setString(2, bar.date.toString());
                    ps.setDouble(3, bar.open);
                    ps.setDouble(4, bar.high);
                    ps.setDouble(5, bar.low);
                    ps.setDouble(6, bar.close);
                    ps.setLong(7, bar.volume);
                    setNullableDouble(ps, 8, bar.sma200);
                    setNullableDouble(ps, 9, bar.ema200);
                    ps.setString(10, stamp);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            try (PreparedStatement ps = conn.prepareStatement(insertWeeklySql)) {
                for (PriceBar bar : weekly.bars()) {
                    if (bar.date.getDayOfWeek() != DayOfWeek.MONDAY) {
                        throw new IllegalArgumentException("weekly bar of " + symbol + " not on a week start: " + bar.date);
                    }
                    ps.setString(1, symbol);
                    ps.setString(2, bar.date.toString());
                    ps.setDouble(3, bar.open);
                    ps.setDouble(4, bar.high);
                    ps.setDouble(5, bar.low);
                    ps.setDouble(6, bar.close);
                    ps.setLong(7, bar.volume);
                    setNullableDouble(ps, 8, bar.sma200);
                    ps.setString(9, stamp);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            try (PreparedStatement ps = conn.prepareStatement(upsertMetaSql)) {
                ps.setString(1, symbol);
                ps.setString(2, daily.isEmpty() ? null : daily.first().date.toString());
                ps.setString(3, daily.isEmpty() ? null : daily.last().date.toString());
                ps.setString(4, stamp);
                ps.setInt(5, daily.size());
                ps.setInt(6, weekly.size());
                ps.executeUpdate();
            }
            conn.commit();
        } catch (SQLException e) {
            rollbackQuietly(conn, symbol, e);
            throw new CacheWriteException(symbol, e);
        } catch (RuntimeException e) {
            rollbackQuietly(conn, symbol, e);
            throw e;
        } finally {
            closeQuietly(conn);
        }
    }

    private void setNullableDouble(PreparedStatement ps, int idx, Double value) throws SQLException {
        if (value == null || !Double.isFinite(value)) {
            ps.setNull(idx, Types.DOUBLE);
        } else {
            ps.setDouble(idx, value);
        }
    }

    private void rollbackQuietly(Connection conn, String symbol, Exception cause) {
        if (conn == null) {
            return;
        }
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            LOG.error("rollback failed for {}: {}", symbol, e.getMessage());
        }
    }

    private void closeQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            LOG.warn("connection close failed: {}", e.getMessage());
        }
    }

    private PriceSeries toSeries(List<PriceRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return PriceSeries.empty();
        }
        List<PriceBar> bars = new ArrayList<>(rows.size());
        for (PriceRow row : rows) {
            LocalDate date = parseDate(row.getBarDate());
            if (date == null || row.getClose() == null) {
                continue;
            }
            bars.add(new PriceBar(
                    date,
                    nz(row.getOpen()),
                    nz(row.getHigh()),
                    nz(row.getLow()),
                    row.getClose(),
                    row.getVolume() == null ? 0L : row.getVolume(),
                    row.getSma200(),
                    row.getEma200()
            ));
        }
        return PriceSeries.of(bars);
    }

    private double nz(Double value) {
        return value == null ? 0.0 : value;
    }

    private LocalDate parseDate(String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        return LocalDate.parse(text.trim());
    }

    private Instant parseInstant(String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        return Instant.parse(text.trim());
    }
}
