package in.tradeledger.domain.trade;

import java.util.List;

/**
 * Outcome of a committed persist batch. inserted holds the new rows in insertion order.
 */
public record PersistResult(List<Trade> inserted, int skipped) {

    public static final PersistResult EMPTY = new PersistResult(List.of(), 0);

    public PersistResult {
        inserted = List.copyOf(inserted);
    }

    public int insertedCount() {
        return inserted.size();
    }
}
