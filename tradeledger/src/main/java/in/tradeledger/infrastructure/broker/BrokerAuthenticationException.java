package in.tradeledger.infrastructure.broker;

/**
 * Exception thrown when the broker rejects or fails a login.
 */
public class BrokerAuthenticationException extends RuntimeException {

    private final String brokerCode;
    private final String username;

    public BrokerAuthenticationException(String brokerCode, String username, String message) {
        super(String.format("[%s:%s] %s", brokerCode, username, message));
        this.brokerCode = brokerCode;
        this.username = username;
    }

    public BrokerAuthenticationException(String brokerCode, String username, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", brokerCode, username, message), cause);
        this.brokerCode = brokerCode;
        this.username = username;
    }

    public String getBrokerCode() {
        return brokerCode;
    }

    public String getUsername() {
        return username;
    }
}
