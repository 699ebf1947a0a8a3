package in.tradeledger.domain.trade;

import java.math.BigDecimal;

/**
 * Trade as stored in the ledger and pushed to live subscribers.
 *
 * Identity is (broker, accountId, orderId, creationTimestamp). Rows are never
 * updated in place; profitAndLoss is always present.
 */
public record Trade(
    String broker,
    long accountId,
    String contractId,
    String creationTimestamp,   // broker ISO-8601 string, stored verbatim
    BigDecimal price,
    BigDecimal profitAndLoss,
    BigDecimal fees,            // 2x the broker-reported fee
    String side,                // buy | sell
    BigDecimal size,
    long orderId
) {
    public static final String SIDE_BUY = "buy";
    public static final String SIDE_SELL = "sell";
}
