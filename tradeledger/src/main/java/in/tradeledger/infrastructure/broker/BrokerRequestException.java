package in.tradeledger.infrastructure.broker;

/**
 * Exception thrown when an authenticated broker call fails
 * (transport error, timeout, non-2xx status, success=false or malformed body).
 */
public class BrokerRequestException extends RuntimeException {

    private final String brokerCode;
    private final String endpoint;
    private final int statusCode;   // -1 when no HTTP response was received

    public BrokerRequestException(String brokerCode, String endpoint, int statusCode, String message) {
        super(String.format("[%s:%s] %s", brokerCode, endpoint, message));
        this.brokerCode = brokerCode;
        this.endpoint = endpoint;
        this.statusCode = statusCode;
    }

    public BrokerRequestException(String brokerCode, String endpoint, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", brokerCode, endpoint, message), cause);
        this.brokerCode = brokerCode;
        this.endpoint = endpoint;
        this.statusCode = -1;
    }

    public String getBrokerCode() {
        return brokerCode;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
