package com.signalbot.persistence;

import com.signalbot.core.exception.StorageException;
import com.signalbot.core.model.Candle;
import com.signalbot.core.model.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.StampedLock;

/**
 * SQLite storage for OHLCV candles keyed by (instrument, timeframe, open_time).
 *
 * Re-syncing an overlapping window overwrites the stored bar, so the latest
 * (still forming) candle is refreshed on every sync.
 */
public final class CandleDatabase implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CandleDatabase.class);

    private final Connection connection;
    private final StampedLock lock = new StampedLock();

    public CandleDatabase(String dbPath) {
        try {
            connection = SqliteSupport.open(dbPath);
            createTables();
            logger.info("Candle database initialized: {}", dbPath);
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize candle database", e);
        }
    }

    private void createTables() throws SQLException {
        String createSql = """
            CREATE TABLE IF NOT EXISTS candles (
                instrument TEXT NOT NULL,
                timeframe TEXT NOT NULL,
                open_time INTEGER NOT NULL,
                open REAL NOT NULL,
                high REAL NOT NULL,
                low REAL NOT NULL,
                close REAL NOT NULL,
                volume REAL NOT NULL,
                PRIMARY KEY (instrument, timeframe, open_time)
            )
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            stmt.execute(createSql);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * Insert or overwrite candles in a single transaction.
     *
     * @return number of candles written
     */
    public int upsert(List<Candle> candles) {
        if (candles.isEmpty()) {
            return 0;
        }
        String sql = """
            INSERT INTO candles (instrument, timeframe, open_time, open, high, low, close, volume)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (instrument, timeframe, open_time) DO UPDATE SET
                open = excluded.open,
                high = excluded.high,
                low = excluded.low,
                close = excluded.close,
                volume = excluded.volume
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(sql)) {
            connection.setAutoCommit(false);
            for (Candle candle : candles) {
                stmt.setString(1, candle.instrument());
                stmt.setString(2, candle.timeframe().code());
                stmt.setLong(3, candle.openTime().toEpochMilli());
                stmt.setDouble(4, candle.open());
                stmt.setDouble(5, candle.high());
                stmt.setDouble(6, candle.low());
                stmt.setDouble(7, candle.close());
                stmt.setDouble(8, candle.volume());
                stmt.addBatch();
            }
            stmt.executeBatch();
            connection.commit();
            return candles.size();
        } catch (SQLException e) {
            rollbackQuietly();
            throw new StorageException("Failed to store " + candles.size() + " candles", e);
        } finally {
            restoreAutoCommit();
            lock.unlockWrite(stamp);
        }
    }

    public Optional<Instant> latestOpenTime(String instrument, Timeframe timeframe) {
        String sql = "SELECT MAX(open_time) AS latest FROM candles WHERE instrument = ? AND timeframe = ?";

        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, instrument);
            stmt.setString(2, timeframe.code());
            try (var rs = stmt.executeQuery()) {
                if (rs.next()) {
                    long latest = rs.getLong("latest");
                    if (!rs.wasNull()) {
                        return Optional.of(Instant.ofEpochMilli(latest));
                    }
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read latest candle for " + instrument + " " + timeframe, e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    /** The most recent {@code limit} candles in ascending open-time order. */
    public List<Candle> recent(String instrument, Timeframe timeframe, int limit) {
        String sql = """
            SELECT open_time, open, high, low, close, volume FROM candles
            WHERE instrument = ? AND timeframe = ?
            ORDER BY open_time DESC
            LIMIT ?
            """;

        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, instrument);
            stmt.setString(2, timeframe.code());
            stmt.setInt(3, limit);
            List<Candle> candles = new ArrayList<>();
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    candles.add(mapCandle(rs, instrument, timeframe));
                }
            }
            Collections.reverse(candles);
            return candles;
        } catch (SQLException e) {
            throw new StorageException("Failed to read candles for " + instrument + " " + timeframe, e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public long count(String instrument, Timeframe timeframe) {
        String sql = "SELECT COUNT(*) AS count FROM candles WHERE instrument = ? AND timeframe = ?";

        long stamp = lock.tryOptimisticRead();
        long result = queryCount(sql, instrument, timeframe);
        if (!lock.validate(stamp)) {
            stamp = lock.readLock();
            try {
                result = queryCount(sql, instrument, timeframe);
            } finally {
                lock.unlockRead(stamp);
            }
        }
        return result;
    }

    private long queryCount(String sql, String instrument, Timeframe timeframe) {
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, instrument);
            stmt.setString(2, timeframe.code());
            try (var rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong("count") : 0L;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to count candles for " + instrument + " " + timeframe, e);
        }
    }

    private static Candle mapCandle(ResultSet rs, String instrument, Timeframe timeframe) throws SQLException {
        return new Candle(
            instrument,
            timeframe,
            Instant.ofEpochMilli(rs.getLong("open_time")),
            rs.getDouble("open"),
            rs.getDouble("high"),
            rs.getDouble("low"),
            rs.getDouble("close"),
            rs.getDouble("volume"));
    }

    private void rollbackQuietly() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            logger.warn("Candle batch rollback failed: {}", e.getMessage());
        }
    }

    private void restoreAutoCommit() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            logger.warn("Failed to restore auto-commit: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
            logger.info("Candle database closed");
        } catch (SQLException e) {
            logger.error("Error closing candle database", e);
        }
    }
}
