package in.tradeledger.infrastructure.broker;

import in.tradeledger.domain.broker.BrokerAccount;
import in.tradeledger.domain.broker.Contract;
import in.tradeledger.domain.broker.OrderRequest;
import in.tradeledger.domain.broker.OrderResult;
import in.tradeledger.domain.trade.RawTrade;

import java.time.Instant;
import java.util.List;

/**
 * Remote broker API used by the ledger.
 *
 * All calls block the calling thread until the response arrives or the
 * per-call timeout elapses. Callers must not hold locks across them.
 */
public interface BrokerGateway {

    /**
     * Get broker code written to stored trades.
     */
    String getBrokerCode();

    /**
     * Exchange username + API key for a bearer session token.
     *
     * @throws BrokerAuthenticationException if the broker rejects or the call fails
     */
    String login(String username, String apiKey);

    /**
     * List the accounts visible to the session.
     */
    List<BrokerAccount> searchAccounts(String token);

    /**
     * All executions of an account in [start, end).
     */
    List<RawTrade> searchTrades(String token, long accountId, Instant start, Instant end);

    /**
     * Place an order as-is.
     */
    OrderResult placeOrder(String token, long accountId, OrderRequest request);

    /**
     * Search contracts by free text.
     */
    List<Contract> searchContracts(String token, String searchText);
}
