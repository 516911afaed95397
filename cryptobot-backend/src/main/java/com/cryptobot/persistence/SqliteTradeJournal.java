package com.cryptobot.persistence;

import com.cryptobot.core.error.TradingException;
import com.cryptobot.core.journal.TradeJournal;
import com.cryptobot.core.model.Direction;
import com.cryptobot.core.model.Trade;
import com.cryptobot.core.model.TradeIntent;
import com.cryptobot.core.model.TradeStatus;
import com.cryptobot.core.model.TradingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.StampedLock;

/**
 * SQLite trade journal. One row per trade id; re-recording a trade id replaces the row,
 * so a PENDING entry is overwritten by its FILLED or FAILED outcome.
 * <p>
 * The connection is shared; writes take the write lock, reads take the read lock.
 */
public final class SqliteTradeJournal implements TradeJournal, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SqliteTradeJournal.class);
    private static final int MAX_LIMIT = 500;

    private final Connection connection;
    private final StampedLock lock = new StampedLock();

    public SqliteTradeJournal(String dbPath) {
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            createTables();
            logger.info("Trade journal initialized: {}", dbPath);
        } catch (SQLException e) {
            throw new TradingException("Failed to initialize trade journal at " + dbPath, e);
        }
    }

    private void createTables() throws SQLException {
        String createSql = """
            CREATE TABLE IF NOT EXISTS trades (
                trade_id TEXT PRIMARY KEY,
                symbol TEXT NOT NULL,
                direction TEXT NOT NULL,
                intent TEXT NOT NULL,
                requested_price REAL NOT NULL,
                executed_price REAL NOT NULL,
                quantity REAL NOT NULL,
                mode TEXT NOT NULL,
                status TEXT NOT NULL,
                timestamp TEXT NOT NULL,
                timestamp_ms INTEGER NOT NULL,
                realized_pnl REAL NOT NULL,
                detail TEXT
            )
            """;
        String createIndexSql = """
            CREATE INDEX IF NOT EXISTS idx_trades_timestamp
            ON trades(timestamp_ms)
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            stmt.execute(createSql);
            stmt.execute(createIndexSql);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public void record(Trade trade) {
        String sql = """
            INSERT OR REPLACE INTO trades (trade_id, symbol, direction, intent, requested_price, executed_price,
                                           quantity, mode, status, timestamp, timestamp_ms, realized_pnl, detail)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        long stamp = lock.writeLock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, trade.tradeId());
            stmt.setString(2, trade.symbol());
            stmt.setString(3, trade.direction().name());
            stmt.setString(4, trade.intent().name());
            stmt.setDouble(5, trade.requestedPrice());
            stmt.setDouble(6, trade.executedPrice());
            stmt.setDouble(7, trade.quantity());
            stmt.setString(8, trade.mode().name());
            stmt.setString(9, trade.status().name());
            stmt.setString(10, trade.timestamp().toString());
            stmt.setLong(11, trade.timestamp().toEpochMilli());
            stmt.setDouble(12, trade.realizedPnl());
            stmt.setString(13, trade.detail());
            stmt.executeUpdate();

            logger.atDebug()
                .addKeyValue("tradeId", trade.tradeId())
                .addKeyValue("symbol", trade.symbol())
                .addKeyValue("status", trade.status())
                .log("Trade journaled");
        } catch (SQLException e) {
            logger.error("Failed to journal trade {}", trade.tradeId(), e);
            throw new TradingException("Trade journal write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public List<Trade> recent(int limit) {
        int bounded = Math.max(0, Math.min(limit, MAX_LIMIT));
        String sql = "SELECT * FROM trades ORDER BY timestamp_ms DESC, rowid DESC LIMIT ?";

        long stamp = lock.readLock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setInt(1, bounded);
            List<Trade> trades = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    trades.add(mapRow(rs));
                }
            }
            return trades;
        } catch (SQLException e) {
            logger.error("Failed to read trade journal", e);
            throw new TradingException("Trade journal read failed", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public int count() {
        long stamp = lock.readLock();
        try (var stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) AS count FROM trades")) {
            return rs.next() ? rs.getInt("count") : 0;
        } catch (SQLException e) {
            throw new TradingException("Trade journal read failed", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    private static Trade mapRow(ResultSet rs) throws SQLException {
        return new Trade(
            rs.getString("trade_id"),
            rs.getString("symbol"),
            Direction.valueOf(rs.getString("direction")),
            TradeIntent.valueOf(rs.getString("intent")),
            rs.getDouble("requested_price"),
            rs.getDouble("executed_price"),
            rs.getDouble("quantity"),
            TradingMode.valueOf(rs.getString("mode")),
            TradeStatus.valueOf(rs.getString("status")),
            Instant.parse(rs.getString("timestamp")),
            rs.getDouble("realized_pnl"),
            rs.getString("detail"));
    }

    @Override
    public void close() {
        long stamp = lock.writeLock();
        try {
            connection.close();
            logger.info("Trade journal closed");
        } catch (SQLException e) {
            logger.warn("Failed to close trade journal: {}", e.getMessage());
        } finally {
            lock.unlockWrite(stamp);
        }
    }
}
