package in.tradeledger.repository;

import in.tradeledger.domain.trade.PersistResult;
import in.tradeledger.domain.trade.RawTrade;
import in.tradeledger.domain.trade.Trade;

import java.util.List;

/**
 * Repository for ingested trades (insert-if-absent ledger).
 */
public interface TradeRepository {

    /**
     * Create the trades table if it does not exist.
     */
    void initSchema();

    /**
     * Store one broker execution unless its key is already present.
     * Unrealized executions (no profitAndLoss) are ignored and not counted.
     */
    PersistResult persist(RawTrade raw);

    /**
     * Store executions in input order inside a single transaction.
     * Duplicates are counted as skipped; any other failure rolls the whole batch back.
     *
     * @throws in.tradeledger.domain.common.TradePersistException on a non-duplicate failure
     */
    PersistResult persistBatch(List<RawTrade> raws);

    /**
     * All realized trades, newest creationTimestamp first.
     */
    List<Trade> listAll();

    /**
     * Delete every row.
     *
     * @return rows deleted
     */
    int clearAll();

    /**
     * Row count.
     */
    long count();
}
