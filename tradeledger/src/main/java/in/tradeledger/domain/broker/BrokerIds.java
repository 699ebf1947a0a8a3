package in.tradeledger.domain.broker;

/**
 * Broker identifiers.
 *
 * IMPORTANT: The value is written to the broker column of the trades table and is
 * part of the trade primary key. Changing it makes previously stored rows
 * invisible to dedup.
 */
public final class BrokerIds {

    /** TopstepX (ProjectX gateway) */
    public static final String TOPSTEP = "topstep";

    private BrokerIds() {
        // Prevent instantiation
    }
}
