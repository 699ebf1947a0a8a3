package in.tradeledger.domain.trade;

import java.math.BigDecimal;

/**
 * Trade execution exactly as returned by the broker's trade search.
 * profitAndLoss is null while the fill has not been realized (half-turn).
 */
public record RawTrade(
    Long id,
    long orderId,
    long accountId,
    String contractId,
    String creationTimestamp,
    BigDecimal price,
    BigDecimal profitAndLoss,
    BigDecimal fees,
    int side,
    BigDecimal size,
    boolean voided
) {
    public boolean isRealized() {
        return profitAndLoss != null;
    }
}
