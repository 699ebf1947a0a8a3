package in.tradeledger.domain.common;

/**
 * Thrown when a window sync cannot fetch trades from the broker.
 * Nothing was written for the failed window; retrying it is safe.
 */
public class TradeSyncException extends RuntimeException {

    private final String brokerCode;
    private final Long accountId;

    public TradeSyncException(String brokerCode, Long accountId, String message) {
        super(String.format("[%s:%s] %s", brokerCode, accountId, message));
        this.brokerCode = brokerCode;
        this.accountId = accountId;
    }

    public TradeSyncException(String brokerCode, Long accountId, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", brokerCode, accountId, message), cause);
        this.brokerCode = brokerCode;
        this.accountId = accountId;
    }

    public String getBrokerCode() {
        return brokerCode;
    }

    public Long getAccountId() {
        return accountId;
    }
}
