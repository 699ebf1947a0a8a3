package in.tradeledger.domain.common;

/**
 * Message types on the live trade stream.
 */
public enum EventType {
    // Data
    NEW_TRADE,

    // Connection
    ACK,
    PONG,
    ERROR
}
