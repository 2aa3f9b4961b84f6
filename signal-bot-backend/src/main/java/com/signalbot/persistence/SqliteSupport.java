package com.signalbot.persistence;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

final class SqliteSupport {

    private SqliteSupport() {
    }

    /**
     * Candles and positions share one database file through separate connections,
     * so writers wait on each other instead of failing with SQLITE_BUSY.
     */
    static Connection open(String dbPath) throws SQLException {
        Connection connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
        try (var stmt = connection.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA busy_timeout=5000");
        }
        return connection;
    }
}
