package in.tradeledger.domain.common;

/**
 * Thrown when a persist batch fails for a reason other than a duplicate key.
 * The whole batch has been rolled back.
 */
public class TradePersistException extends RuntimeException {

    private final int batchSize;

    public TradePersistException(String message, int batchSize, Throwable cause) {
        super(String.format("[DB] %s (batch of %d)", message, batchSize), cause);
        this.batchSize = batchSize;
    }

    public int getBatchSize() {
        return batchSize;
    }
}
