package in.tradeledger.domain.broker;

import java.util.Locale;

/**
 * Trading account as listed by the broker's account search.
 */
public record BrokerAccount(
    long id,
    String name,
    boolean canTrade
) {
    /**
     * Case-insensitive name prefix match, restricted to tradable accounts.
     */
    public boolean matches(String namePrefix) {
        if (!canTrade || name == null || namePrefix == null) {
            return false;
        }
        return name.toUpperCase(Locale.ROOT).startsWith(namePrefix.toUpperCase(Locale.ROOT));
    }
}
