package in.tradeledger.domain.broker;

import java.math.BigDecimal;

/**
 * Order passed through to the broker unchanged.
 *
 * side and type use the broker's numeric codes (side 0 = bid/buy, 1 = ask/sell;
 * type 1 = limit, 2 = market).
 */
public record OrderRequest(
    String contractId,
    int quantity,
    int side,
    int type,
    BigDecimal limitPrice
) {
    public OrderRequest {
        if (contractId == null || contractId.isBlank()) {
            throw new IllegalArgumentException("Contract id cannot be null or empty");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (side != 0 && side != 1) {
            throw new IllegalArgumentException("Side must be 0 (buy) or 1 (sell)");
        }
    }

    public String sideLabel() {
        return side == 0 ? "buy" : "sell";
    }
}
