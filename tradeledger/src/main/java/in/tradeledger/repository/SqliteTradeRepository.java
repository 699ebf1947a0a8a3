package in.tradeledger.repository;

import in.tradeledger.domain.common.TradePersistException;
import in.tradeledger.domain.trade.PersistResult;
import in.tradeledger.domain.trade.RawTrade;
import in.tradeledger.domain.trade.Trade;
import in.tradeledger.domain.trade.TradeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite implementation of TradeRepository.
 *
 * Dedup is a single INSERT ... ON CONFLICT DO NOTHING against the primary key,
 * so there is no read-then-write window between concurrent batches. The upsert
 * clause only covers the key: NOT NULL and other failures still abort the batch.
 */
public final class SqliteTradeRepository implements TradeRepository {
    private static final Logger log = LoggerFactory.getLogger(SqliteTradeRepository.class);

    private static final String INSERT_SQL = """
        INSERT INTO trades (
            broker, accountId, contractId, creationTimestamp,
            price, profitAndLoss, fees, side, size, orderId
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT DO NOTHING
        """;

    private final DataSource dataSource;
    private final String broker;

    /**
     * @param dataSource Pooled SQLite data source
     * @param broker Broker code written to every row (part of the key)
     */
    public SqliteTradeRepository(DataSource dataSource, String broker) {
        this.dataSource = dataSource;
        this.broker = broker;
    }

    @Override
    public void initSchema() {
        String sql = """
            CREATE TABLE IF NOT EXISTS trades (
                broker            TEXT    NOT NULL,
                accountId         INTEGER NOT NULL,
                contractId        TEXT    NOT NULL,
                creationTimestamp TEXT    NOT NULL,
                price             REAL    NOT NULL,
                profitAndLoss     REAL    NOT NULL,
                fees              REAL    NOT NULL,
                side              TEXT    NOT NULL CHECK (side IN ('buy', 'sell')),
                size              REAL    NOT NULL,
                orderId           INTEGER NOT NULL,
                PRIMARY KEY (broker, accountId, orderId, creationTimestamp)
            )
            """;

        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_trades_created ON trades (creationTimestamp)");
            log.info("[DB] trades table ready");
        } catch (SQLException e) {
            log.error("[DB] Failed to create trades table: {}", e.getMessage());
            throw new RuntimeException("Failed to create trades table", e);
        }
    }

    @Override
    public PersistResult persist(RawTrade raw) {
        if (!raw.isRealized()) {
            return PersistResult.EMPTY;
        }
        return persistBatch(List.of(raw));
    }

    @Override
    public PersistResult persistBatch(List<RawTrade> raws) {
        List<Trade> candidates = new ArrayList<>(raws.size());
        for (RawTrade raw : raws) {
            if (raw.isRealized()) {
                candidates.add(TradeMapper.fromRemote(broker, raw));
            }
        }
        if (candidates.isEmpty()) {
            return PersistResult.EMPTY;
        }

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
                List<Trade> inserted = new ArrayList<>();
                int skipped = 0;

                for (Trade t : candidates) {
                    bind(ps, t);
                    if (ps.executeUpdate() == 1) {
                        inserted.add(t);
                    } else {
                        skipped++;
                    }
                }

                conn.commit();
                log.debug("[DB] Batch committed: {} inserted, {} skipped", inserted.size(), skipped);
                return new PersistResult(inserted, skipped);
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException | RuntimeException e) {
            log.error("[DB] Error persisting trades, batch rolled back: {}", e.getMessage());
            throw new TradePersistException("Failed to persist trades", candidates.size(), e);
        }
    }

    @Override
    public List<Trade> listAll() {
        String sql = """
            SELECT * FROM trades
            WHERE profitAndLoss IS NOT NULL
            ORDER BY creationTimestamp DESC
            """;

        List<Trade> trades = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                trades.add(mapRow(rs));
            }
        } catch (SQLException e) {
            log.error("[DB] Failed to fetch trades: {}", e.getMessage());
            throw new RuntimeException("Failed to fetch trades", e);
        }
        return trades;
    }

    @Override
    public int clearAll() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            int deleted = stmt.executeUpdate("DELETE FROM trades");
            log.info("[DB] Trades table cleared ({} rows)", deleted);
            return deleted;
        } catch (SQLException e) {
            log.error("[DB] Failed to clear trades table: {}", e.getMessage());
            throw new RuntimeException("Failed to clear trades table", e);
        }
    }

    @Override
    public long count() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM trades")) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            log.error("[DB] Failed to count trades: {}", e.getMessage());
            throw new RuntimeException("Failed to count trades", e);
        }
    }

    // ============================================================

    private static void bind(PreparedStatement ps, Trade t) throws SQLException {
        ps.setString(1, t.broker());
        ps.setLong(2, t.accountId());
        ps.setString(3, t.contractId());
        ps.setString(4, t.creationTimestamp());
        ps.setBigDecimal(5, t.price());
        ps.setBigDecimal(6, t.profitAndLoss());
        ps.setBigDecimal(7, t.fees());
        ps.setString(8, t.side());
        ps.setBigDecimal(9, t.size());
        ps.setLong(10, t.orderId());
    }

    private static Trade mapRow(ResultSet rs) throws SQLException {
        return new Trade(
            rs.getString("broker"),
            rs.getLong("accountId"),
            rs.getString("contractId"),
            rs.getString("creationTimestamp"),
            decimal(rs, "price"),
            decimal(rs, "profitAndLoss"),
            decimal(rs, "fees"),
            rs.getString("side"),
            decimal(rs, "size"),
            rs.getLong("orderId")
        );
    }

    private static BigDecimal decimal(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value == null ? null : new BigDecimal(value);
    }

    private static void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            log.warn("[DB] Rollback failed: {}", rollbackEx.getMessage());
        }
    }
}
