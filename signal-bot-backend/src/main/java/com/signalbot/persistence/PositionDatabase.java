package com.signalbot.persistence;

import com.signalbot.core.exception.DuplicateOpenPositionException;
import com.signalbot.core.exception.StorageException;
import com.signalbot.core.model.CloseReason;
import com.signalbot.core.model.Position;
import com.signalbot.core.model.PositionStatus;
import com.signalbot.core.position.PositionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.StampedLock;

/**
 * SQLite position store.
 *
 * A partial unique index on {@code instrument WHERE status = 'OPEN'} makes the
 * one-open-position-per-instrument rule hold even across processes.
 */
public final class PositionDatabase implements PositionStore, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PositionDatabase.class);

    private static final String SELECT_COLUMNS = """
        SELECT id, instrument, entry_price, size, status, open_time,
               exit_price, pnl, close_time, close_reason
        FROM positions
        """;

    private final Connection connection;
    private final StampedLock lock = new StampedLock();

    public PositionDatabase(String dbPath) {
        try {
            connection = SqliteSupport.open(dbPath);
            createTables();
            logger.info("Position database initialized: {} with StampedLock concurrency", dbPath);
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize position database", e);
        }
    }

    private void createTables() throws SQLException {
        String createSql = """
            CREATE TABLE IF NOT EXISTS positions (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                instrument TEXT NOT NULL,
                entry_price REAL NOT NULL,
                size REAL NOT NULL,
                status TEXT NOT NULL,
                open_time INTEGER NOT NULL,
                exit_price REAL,
                pnl REAL,
                close_time INTEGER,
                close_reason TEXT
            )
            """;

        String createOpenIndexSql = """
            CREATE UNIQUE INDEX IF NOT EXISTS idx_positions_one_open
            ON positions(instrument) WHERE status = 'OPEN'
            """;

        String createHistoryIndexSql = """
            CREATE INDEX IF NOT EXISTS idx_positions_instrument_time
            ON positions(instrument, open_time)
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            stmt.execute(createSql);
            stmt.execute(createOpenIndexSql);
            stmt.execute(createHistoryIndexSql);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public Optional<Position> findOpen(String instrument) {
        String sql = SELECT_COLUMNS + "WHERE instrument = ? AND status = 'OPEN'";

        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, instrument);
            try (var rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapPosition(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read open position for " + instrument, e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public List<Position> findAllOpen() {
        String sql = SELECT_COLUMNS + "WHERE status = 'OPEN' ORDER BY open_time";

        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql);
             var rs = stmt.executeQuery()) {
            List<Position> positions = new ArrayList<>();
            while (rs.next()) {
                positions.add(mapPosition(rs));
            }
            return positions;
        } catch (SQLException e) {
            throw new StorageException("Failed to read open positions", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public Position insertOpen(Position position) {
        if (!position.isOpen()) {
            throw new IllegalArgumentException("Only OPEN positions can be inserted");
        }
        String sql = """
            INSERT INTO positions (instrument, entry_price, size, status, open_time)
            VALUES (?, ?, ?, 'OPEN', ?)
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, position.instrument());
            stmt.setDouble(2, position.entryPrice());
            stmt.setDouble(3, position.size());
            stmt.setLong(4, position.openTime().toEpochMilli());
            stmt.executeUpdate();

            try (var keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new StorageException("No id generated for position " + position.instrument(), null);
                }
                Position stored = position.withId(keys.getLong(1));
                logger.atInfo()
                    .addKeyValue("id", stored.id())
                    .addKeyValue("instrument", stored.instrument())
                    .addKeyValue("entryPrice", stored.entryPrice())
                    .addKeyValue("size", stored.size())
                    .log("Position recorded");
                return stored;
            }
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new DuplicateOpenPositionException(position.instrument(), e);
            }
            logger.error("Failed to record position for {}", position.instrument(), e);
            throw new StorageException("Database write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public boolean close(Position closed) {
        if (closed.isOpen() || closed.id() == null) {
            throw new IllegalArgumentException("Expected a CLOSED position with an id");
        }
        String sql = """
            UPDATE positions
            SET status = 'CLOSED', exit_price = ?, pnl = ?, close_time = ?, close_reason = ?
            WHERE id = ? AND status = 'OPEN'
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setDouble(1, closed.exitPrice());
            stmt.setDouble(2, closed.pnl());
            stmt.setLong(3, closed.closeTime().toEpochMilli());
            stmt.setString(4, closed.closeReason().name());
            stmt.setLong(5, closed.id());
            int updated = stmt.executeUpdate();

            if (updated > 0) {
                logger.atInfo()
                    .addKeyValue("id", closed.id())
                    .addKeyValue("instrument", closed.instrument())
                    .addKeyValue("exitPrice", closed.exitPrice())
                    .addKeyValue("pnl", closed.pnl())
                    .addKeyValue("reason", closed.closeReason())
                    .log("Position closed");
                return true;
            }
            logger.warn("Position {} for {} was not open, close ignored", closed.id(), closed.instrument());
            return false;
        } catch (SQLException e) {
            logger.error("Failed to close position {} for {}", closed.id(), closed.instrument(), e);
            throw new StorageException("Database write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public List<Position> findHistory(String instrument, int limit) {
        String sql = SELECT_COLUMNS + "WHERE instrument = ? ORDER BY open_time DESC, id DESC LIMIT ?";

        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, instrument);
            stmt.setInt(2, limit);
            List<Position> positions = new ArrayList<>();
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    positions.add(mapPosition(rs));
                }
            }
            return positions;
        } catch (SQLException e) {
            throw new StorageException("Failed to read position history for " + instrument, e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    /** Sum of realized PnL over closed positions. */
    public double totalRealizedPnl() {
        String sql = "SELECT COALESCE(SUM(pnl), 0) AS total FROM positions WHERE status = 'CLOSED'";

        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement(sql);
             var rs = stmt.executeQuery()) {
            return rs.next() ? rs.getDouble("total") : 0.0;
        } catch (SQLException e) {
            throw new StorageException("Failed to sum realized PnL", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    private static boolean isConstraintViolation(SQLException e) {
        if (e instanceof SQLiteException sqliteException) {
            SQLiteErrorCode code = sqliteException.getResultCode();
            return code == SQLiteErrorCode.SQLITE_CONSTRAINT
                || code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE;
        }
        return e.getMessage() != null && e.getMessage().contains("UNIQUE constraint failed");
    }

    private static Position mapPosition(ResultSet rs) throws SQLException {
        return new Position(
            rs.getLong("id"),
            rs.getString("instrument"),
            rs.getDouble("entry_price"),
            rs.getDouble("size"),
            PositionStatus.valueOf(rs.getString("status")),
            Instant.ofEpochMilli(rs.getLong("open_time")),
            nullableDouble(rs, "exit_price"),
            nullableDouble(rs, "pnl"),
            nullableInstant(rs, "close_time"),
            rs.getString("close_reason") == null ? null : CloseReason.valueOf(rs.getString("close_reason")));
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static Instant nullableInstant(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    @Override
    public void close() {
        try {
            connection.close();
            logger.info("Position database closed");
        } catch (SQLException e) {
            logger.error("Error closing position database", e);
        }
    }
}
