package in.tradeledger.service.order;

import in.tradeledger.domain.broker.Contract;
import in.tradeledger.domain.broker.OrderRequest;
import in.tradeledger.domain.broker.OrderResult;
import in.tradeledger.domain.common.ConfigException;
import in.tradeledger.infrastructure.broker.BrokerGateway;
import in.tradeledger.service.session.BrokerSession;
import in.tradeledger.service.sync.TradeSyncScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Order pass-through and contract lookup for the session account.
 *
 * A successful placement schedules an incremental sync so the resulting fill
 * reaches the ledger without waiting for the next timer tick.
 */
public final class OrderService {
    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final BrokerGateway gateway;
    private final BrokerSession session;
    private final TradeSyncScheduler syncScheduler;

    public OrderService(BrokerGateway gateway, BrokerSession session, TradeSyncScheduler syncScheduler) {
        this.gateway = gateway;
        this.session = session;
        this.syncScheduler = syncScheduler;
    }

    /**
     * Send the order to the broker unchanged.
     *
     * @return Broker response, including rejections (success=false)
     * @throws ConfigException if there is no token or no resolved account
     */
    public OrderResult placeOrder(OrderRequest request) {
        BrokerSession.SessionState state = session.snapshot();
        if (!state.hasToken()) {
            throw new ConfigException("TOPSTEP_API_KEY", "No session token, authenticate first");
        }
        if (!state.hasAccount()) {
            throw new ConfigException("ACCOUNT_NAME", "No account resolved");
        }

        log.info("[ORDER] {} {} x{} type={} limit={} account={}",
            request.sideLabel(), request.contractId(), request.quantity(),
            request.type(), request.limitPrice(), state.accountId());

        OrderResult result = gateway.placeOrder(state.token(), state.accountId(), request);

        if (result.success()) {
            log.info("[ORDER] Placed: orderId={}", result.orderId());
            syncScheduler.triggerOrderSync();
        } else {
            log.warn("[ORDER] Rejected: code={} message={}", result.errorCode(), result.errorMessage());
        }
        return result;
    }

    /**
     * Contracts whose name equals the symbol, ignoring case. Empty when none match.
     */
    public List<Contract> findContracts(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        String token = session.token()
            .orElseThrow(() -> new ConfigException("TOPSTEP_API_KEY", "No session token, authenticate first"));

        String wanted = symbol.trim().toUpperCase(Locale.ROOT);
        List<Contract> matches = gateway.searchContracts(token, wanted).stream()
            .filter(c -> c.name() != null && c.name().toUpperCase(Locale.ROOT).equals(wanted))
            .toList();

        log.debug("[ORDER] Contract search '{}': {} exact matches", wanted, matches.size());
        return matches;
    }
}
