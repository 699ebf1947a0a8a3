package in.tradeledger.domain.trade;

/**
 * Why a window sync ran.
 */
public enum SyncMode {
    BACKFILL,       // month-to-date, once at startup
    INCREMENTAL,    // last minute, timer driven
    ORDER,          // last minute, after an order placement
    MANUAL          // administrative request
}
