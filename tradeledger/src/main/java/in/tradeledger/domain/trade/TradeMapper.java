package in.tradeledger.domain.trade;

import java.math.BigDecimal;

/**
 * Maps broker executions to stored trades.
 *
 * Two broker-specific conversions are applied verbatim:
 * - side: the broker reports the resting side that was filled, so side 1 is
 *   stored as "buy" and anything else as "sell".
 * - fees: the reported fee is doubled; a missing fee is stored as 0.
 */
public final class TradeMapper {

    private static final BigDecimal FEE_MULTIPLIER = BigDecimal.valueOf(2);

    public static Trade fromRemote(String broker, RawTrade raw) {
        if (!raw.isRealized()) {
            throw new IllegalArgumentException(
                "Trade " + raw.orderId() + "@" + raw.creationTimestamp() + " has no profitAndLoss");
        }
        return new Trade(
            broker,
            raw.accountId(),
            raw.contractId(),
            raw.creationTimestamp(),
            raw.price(),
            raw.profitAndLoss(),
            feesOf(raw.fees()),
            sideOf(raw.side()),
            raw.size(),
            raw.orderId()
        );
    }

    static BigDecimal feesOf(BigDecimal remoteFees) {
        return remoteFees == null ? BigDecimal.ZERO : remoteFees.multiply(FEE_MULTIPLIER);
    }

    static String sideOf(int remoteSide) {
        return remoteSide == 1 ? Trade.SIDE_BUY : Trade.SIDE_SELL;
    }

    private TradeMapper() {}
}
