package in.tradeledger.bootstrap;

import com.zaxxer.hikari.HikariDataSource;
import in.tradeledger.config.TradeLedgerConfig;
import in.tradeledger.domain.broker.BrokerIds;
import in.tradeledger.infrastructure.broker.BrokerGateway;
import in.tradeledger.infrastructure.broker.topstep.TopstepClient;
import in.tradeledger.infrastructure.metrics.PrometheusMetricsHandler;
import in.tradeledger.infrastructure.metrics.PrometheusSyncMetrics;
import in.tradeledger.repository.SqliteDataSources;
import in.tradeledger.repository.SqliteTradeRepository;
import in.tradeledger.repository.TradeRepository;
import in.tradeledger.service.core.TradeBroadcastHub;
import in.tradeledger.service.order.OrderService;
import in.tradeledger.service.session.BrokerSession;
import in.tradeledger.service.session.SessionTokenManager;
import in.tradeledger.service.startup.StartupOrchestrator;
import in.tradeledger.service.sync.TradeSyncScheduler;
import in.tradeledger.service.sync.TradeSyncService;
import in.tradeledger.transport.http.ApiHandlers;
import in.tradeledger.transport.ws.WsHub;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Core Java entry point (NO Spring).
 *
 * - SQLite trade ledger behind HikariCP
 * - TopstepX client with periodic token refresh
 * - Month-to-date backfill, then incremental sync on a timer and after orders
 * - Live trade stream over WebSocket
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Trade Ledger Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        TradeLedgerConfig config = TradeLedgerConfig.fromEnv();
        StartupConfigValidator.validate(config);

        // DB
        HikariDataSource dataSource = SqliteDataSources.create(
            Path.of(config.dbPath()), config.dbPoolSize(), config.dbBusyTimeoutMs());
        TradeRepository tradeRepo = new SqliteTradeRepository(dataSource, BrokerIds.TOPSTEP);
        tradeRepo.initSchema();

        // Metrics
        PrometheusSyncMetrics metrics = new PrometheusSyncMetrics();
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        // Broker + session
        Clock clock = Clock.systemUTC();
        BrokerGateway gateway = new TopstepClient(config.brokerBaseUrl(), config.brokerHttpTimeout(), metrics);
        BrokerSession session = new BrokerSession();
        SessionTokenManager sessionManager = new SessionTokenManager(
            gateway, session, config.username(), config.apiKey(), config.tokenRefreshInterval(), clock);

        // Sync + broadcast
        TradeBroadcastHub hub = new TradeBroadcastHub(metrics);
        TradeSyncService syncService = new TradeSyncService(
            gateway, session, tradeRepo, hub, metrics, clock, config.zone(), config.incrementalWindow());
        TradeSyncScheduler syncScheduler = new TradeSyncScheduler(syncService, config.syncInterval());
        OrderService orderService = new OrderService(gateway, session, syncScheduler);

        StartupOrchestrator orchestrator = new StartupOrchestrator(
            tradeRepo, sessionManager, syncService, syncScheduler, config.accountNamePrefix());

        // HTTP + WS
        WsHub wsHub = new WsHub(hub);
        ApiHandlers api = new ApiHandlers(
            tradeRepo, syncService, sessionManager, session, orderService, hub, orchestrator::getState);

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", blocking(api::health))
            .get("/api/trades", blocking(api::listTrades))
            .delete("/api/trades", blocking(api::clearTrades))
            .post("/api/trades/sync", blocking(api::syncTrades))
            .post("/api/session/token", blocking(api::refreshToken))
            .post("/api/account", blocking(api::resolveAccount))
            .post("/api/orders", blocking(api::placeOrder))
            .post("/api/contracts/search", blocking(api::searchContracts))
            .get("/ws", wsHub.websocketHandler())
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "Trade Ledger\n\n" +
                    "API: GET /api/health, GET|DELETE /api/trades, POST /api/trades/sync\n" +
                    "WS:  ws://localhost:" + config.port() + "/ws\n"
                );
            });

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(cors(routes))
            .build();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[SHUTDOWN] Stopping Trade Ledger...");
            syncScheduler.stop();
            sessionManager.shutdown();
            hub.shutdown();
            server.stop();
            dataSource.close();
            log.info("[SHUTDOWN] Stopped");
        }, "shutdown-hook"));

        // Manual syncs accepted once the listener is up must survive startup
        orchestrator.clearStoredTrades();

        server.start();
        log.info("✓ HTTP API server started on http://localhost:{}/", config.port());

        // Runs after the server is up so stored trades and health are served during backfill
        orchestrator.run();
    }

    private static HttpHandler blocking(HttpHandler handler) {
        return new BlockingHandler(handler);
    }

    static HttpHandler cors(HttpHandler next) {
        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, DELETE, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                next.handleRequest(exchange);
            }
        };
    }
}
