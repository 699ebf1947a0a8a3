package in.tradeledger.domain.broker;

/**
 * Broker response to an order placement.
 */
public record OrderResult(
    Long orderId,
    boolean success,
    Integer errorCode,
    String errorMessage
) {}
