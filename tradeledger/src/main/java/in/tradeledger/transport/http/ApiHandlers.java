package in.tradeledger.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.tradeledger.domain.broker.BrokerAccount;
import in.tradeledger.domain.broker.Contract;
import in.tradeledger.domain.broker.OrderRequest;
import in.tradeledger.domain.broker.OrderResult;
import in.tradeledger.domain.common.ConfigException;
import in.tradeledger.domain.common.TradePersistException;
import in.tradeledger.domain.common.TradeSyncException;
import in.tradeledger.domain.trade.SyncResult;
import in.tradeledger.domain.trade.Trade;
import in.tradeledger.infrastructure.broker.BrokerAuthenticationException;
import in.tradeledger.infrastructure.broker.BrokerRequestException;
import in.tradeledger.repository.TradeRepository;
import in.tradeledger.service.core.TradeBroadcastHub;
import in.tradeledger.service.order.OrderService;
import in.tradeledger.service.session.BrokerSession;
import in.tradeledger.service.session.SessionTokenManager;
import in.tradeledger.service.startup.OrchestratorState;
import in.tradeledger.service.sync.TradeSyncService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * HTTP API handlers.
 *
 * Handlers block on the broker and the database, so routes are expected to be
 * wrapped in a BlockingHandler (see App).
 */
public final class ApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(ApiHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    // JSON Response Keys
    private static final String JSON_SUCCESS = "success";
    private static final String JSON_MESSAGE = "message";
    private static final String JSON_ERROR = "error";
    private static final String JSON_DETAILS = "details";

    private final TradeRepository tradeRepo;
    private final TradeSyncService syncService;
    private final SessionTokenManager sessionManager;
    private final BrokerSession session;
    private final OrderService orderService;
    private final TradeBroadcastHub hub;
    private final Supplier<OrchestratorState> stateSupplier;

    public ApiHandlers(TradeRepository tradeRepo,
                       TradeSyncService syncService,
                       SessionTokenManager sessionManager,
                       BrokerSession session,
                       OrderService orderService,
                       TradeBroadcastHub hub,
                       Supplier<OrchestratorState> stateSupplier) {
        this.tradeRepo = tradeRepo;
        this.syncService = syncService;
        this.sessionManager = sessionManager;
        this.session = session;
        this.orderService = orderService;
        this.hub = hub;
        this.stateSupplier = stateSupplier;
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        try {
            BrokerSession.SessionState state = session.snapshot();

            ObjectNode health = MAPPER.createObjectNode();
            health.put("status", "ok");
            health.put("ts", Instant.now().toString());
            health.put("state", stateSupplier.get().name());
            health.put("tokenPresent", state.hasToken());
            if (state.tokenAcquiredAt() != null) {
                health.put("tokenAcquiredAt", state.tokenAcquiredAt().toString());
            }
            if (state.hasAccount()) {
                health.put("accountId", state.accountId());
                health.put("accountName", state.accountName());
            }
            health.put("backfillAttempted", syncService.isBackfillAttempted());
            health.put("tradeCount", tradeRepo.count());
            health.put("subscribers", hub.subscriberCount());

            sendJson(exchange, 200, health);
        } catch (Exception e) {
            handleError(exchange, "health check", e);
        }
    }

    /**
     * GET /api/trades
     * All stored trades, newest first.
     */
    public void listTrades(HttpServerExchange exchange) {
        try {
            List<Trade> trades = tradeRepo.listAll();
            sendJson(exchange, 200, MAPPER.valueToTree(trades));
        } catch (Exception e) {
            handleError(exchange, "fetch trades", e);
        }
    }

    /**
     * DELETE /api/trades
     */
    public void clearTrades(HttpServerExchange exchange) {
        try {
            int deleted = tradeRepo.clearAll();

            ObjectNode response = MAPPER.createObjectNode();
            response.put(JSON_SUCCESS, true);
            response.put(JSON_MESSAGE, "Trades table cleared successfully");
            response.put("deleted", deleted);
            sendJson(exchange, 200, response);
        } catch (Exception e) {
            handleError(exchange, "clear trades table", e);
        }
    }

    /**
     * POST /api/trades/sync  {accountId?, startTimestamp?, endTimestamp?}
     * Defaults: session account, month-to-date.
     */
    public void syncTrades(HttpServerExchange exchange) {
        try {
            JsonNode json = readBody(exchange);

            long accountId;
            if (json.hasNonNull("accountId")) {
                accountId = json.get("accountId").asLong();
            } else {
                accountId = session.accountId()
                    .orElseThrow(() -> new ConfigException("ACCOUNT_NAME", "No account resolved"));
            }

            Instant start = json.hasNonNull("startTimestamp")
                ? Instant.parse(json.get("startTimestamp").asText())
                : syncService.monthStart();
            Instant end = json.hasNonNull("endTimestamp")
                ? Instant.parse(json.get("endTimestamp").asText())
                : syncService.now();

            SyncResult result = syncService.syncWindow(accountId, start, end);
            sendJson(exchange, 200, MAPPER.valueToTree(result));
        } catch (Exception e) {
            handleError(exchange, "sync trades", e);
        }
    }

    /**
     * POST /api/session/token
     * Re-authenticate with the configured credentials.
     */
    public void refreshToken(HttpServerExchange exchange) {
        try {
            sessionManager.authenticate();

            ObjectNode response = MAPPER.createObjectNode();
            response.put(JSON_SUCCESS, true);
            response.put("tokenAcquiredAt", String.valueOf(session.snapshot().tokenAcquiredAt()));
            sendJson(exchange, 200, response);
        } catch (Exception e) {
            handleError(exchange, "fetch session token", e);
        }
    }

    /**
     * POST /api/account  {accountName}
     */
    public void resolveAccount(HttpServerExchange exchange) {
        try {
            JsonNode json = readBody(exchange);
            String accountName = json.hasNonNull("accountName") ? json.get("accountName").asText() : null;

            Optional<BrokerAccount> account = sessionManager.resolveAccount(accountName);
            if (account.isEmpty()) {
                sendError(exchange, 404, "No account found for name: " + accountName, null);
                return;
            }

            ObjectNode response = MAPPER.createObjectNode();
            response.set("account", MAPPER.valueToTree(account.get()));
            sendJson(exchange, 200, response);
        } catch (Exception e) {
            handleError(exchange, "resolve account", e);
        }
    }

    /**
     * POST /api/orders  {contractId, quantity, side, type, limitPrice?}
     * Returns the broker's response as-is.
     */
    public void placeOrder(HttpServerExchange exchange) {
        try {
            JsonNode json = readBody(exchange);
            if (!json.hasNonNull("contractId") || !json.hasNonNull("quantity")
                    || !json.hasNonNull("side") || !json.hasNonNull("type")) {
                sendError(exchange, 400, "Missing contractId, quantity, side or type", null);
                return;
            }

            OrderRequest request = new OrderRequest(
                json.get("contractId").asText(),
                json.get("quantity").asInt(),
                json.get("side").asInt(),
                json.get("type").asInt(),
                json.hasNonNull("limitPrice") ? new BigDecimal(json.get("limitPrice").asText()) : null
            );

            OrderResult result = orderService.placeOrder(request);
            sendJson(exchange, 200, MAPPER.valueToTree(result));
        } catch (Exception e) {
            handleError(exchange, "execute order", e);
        }
    }

    /**
     * POST /api/contracts/search  {symbol}
     */
    public void searchContracts(HttpServerExchange exchange) {
        try {
            JsonNode json = readBody(exchange);
            String symbol = json.hasNonNull("symbol") ? json.get("symbol").asText() : null;

            List<Contract> contracts = orderService.findContracts(symbol);
            if (contracts.isEmpty()) {
                sendError(exchange, 404, "No contract found for symbol: " + symbol, null);
                return;
            }

            ObjectNode response = MAPPER.createObjectNode();
            response.set("contracts", MAPPER.valueToTree(contracts));
            sendJson(exchange, 200, response);
        } catch (Exception e) {
            handleError(exchange, "fetch contracts", e);
        }
    }

    // ============================================================

    private static JsonNode readBody(HttpServerExchange exchange) throws IOException {
        if (!exchange.isBlocking()) {
            exchange.startBlocking();
        }
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return MAPPER.createObjectNode();
        }
        JsonNode json = MAPPER.readTree(new String(bytes, StandardCharsets.UTF_8));
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
        return json;
    }

    private void handleError(HttpServerExchange exchange, String action, Exception e) {
        if (e instanceof ConfigException) {
            log.warn("[API] Cannot {}: {}", action, e.getMessage());
            sendError(exchange, 400, "Configuration error", e.getMessage());
        } else if (e instanceof BrokerAuthenticationException) {
            log.warn("[API] Cannot {}: {}", action, e.getMessage());
            sendError(exchange, 502, "Broker authentication failed", e.getMessage());
        } else if (e instanceof TradeSyncException || e instanceof BrokerRequestException) {
            log.warn("[API] Cannot {}: {}", action, e.getMessage());
            sendError(exchange, 502, "Failed to " + action, e.getMessage());
        } else if (e instanceof TradePersistException) {
            log.error("[API] Cannot {}: {}", action, e.getMessage(), e);
            sendError(exchange, 500, "Failed to " + action, e.getMessage());
        } else if (e instanceof IllegalArgumentException
                || e instanceof JsonProcessingException
                || e instanceof DateTimeParseException) {
            sendError(exchange, 400, "Invalid request", e.getMessage());
        } else {
            log.error("[API] Cannot {}: {}", action, e.getMessage(), e);
            sendError(exchange, 500, "Failed to " + action, e.getMessage());
        }
    }

    private static void sendJson(HttpServerExchange exchange, int status, JsonNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }

    private static void sendError(HttpServerExchange exchange, int status, String error, String details) {
        ObjectNode json = MAPPER.createObjectNode();
        json.put(JSON_ERROR, error);
        if (details != null) {
            json.put(JSON_DETAILS, details);
        }
        sendJson(exchange, status, json);
    }
}
