package in.tradeledger.domain.trade;

import java.time.Instant;

/**
 * Counts of one window sync.
 * inserted + skipped equals the number of fetched records with a profitAndLoss.
 */
public record SyncResult(
    SyncMode mode,
    long accountId,
    Instant start,
    Instant end,
    int fetched,
    int inserted,
    int skipped
) {}
