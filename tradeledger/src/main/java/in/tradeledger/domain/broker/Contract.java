package in.tradeledger.domain.broker;

import java.math.BigDecimal;

/**
 * Tradable instrument returned by the broker's contract search.
 */
public record Contract(
    String id,
    String name,
    String description,
    BigDecimal tickSize,
    BigDecimal tickValue,
    boolean activeContract
) {}
