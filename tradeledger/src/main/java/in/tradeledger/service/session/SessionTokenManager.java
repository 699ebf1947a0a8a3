package in.tradeledger.service.session;

import in.tradeledger.domain.broker.BrokerAccount;
import in.tradeledger.domain.common.ConfigException;
import in.tradeledger.infrastructure.broker.BrokerGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Broker login and periodic token refresh.
 *
 * Features:
 * - Login with username + API key; token swapped atomically into {@link BrokerSession}
 * - Fixed-interval refresh on a daemon scheduler
 * - A failed refresh keeps the previous token until the next cycle
 * - Account resolution by name prefix
 *
 * Usage:
 * <pre>
 * SessionTokenManager manager = new SessionTokenManager(
 *     gateway, session, "trader", apiKey,
 *     Duration.ofHours(24), Clock.systemUTC()
 * );
 *
 * manager.authenticate();
 * manager.start();          // refresh every 24h
 * manager.shutdown();
 * </pre>
 */
public class SessionTokenManager {

    private static final Logger log = LoggerFactory.getLogger(SessionTokenManager.class);

    private final BrokerGateway gateway;
    private final BrokerSession session;
    private final String username;
    private final String apiKey;
    private final Duration refreshInterval;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> refreshTask;
    private volatile boolean running = false;

    public SessionTokenManager(BrokerGateway gateway, BrokerSession session,
                               String username, String apiKey,
                               Duration refreshInterval, Clock clock) {
        this.gateway = gateway;
        this.session = session;
        this.username = username;
        this.apiKey = apiKey;
        this.refreshInterval = refreshInterval;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "TokenRefresh-" + gateway.getBrokerCode());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Log in with the configured credentials.
     *
     * @return New session token
     * @throws ConfigException if username or API key is missing
     * @throws in.tradeledger.infrastructure.broker.BrokerAuthenticationException if the broker rejects the login
     */
    public String authenticate() {
        return authenticate(username, apiKey);
    }

    /**
     * Log in with explicit credentials. No remote call is made when either is missing.
     * On success the session token is replaced; on failure it is left untouched.
     */
    public String authenticate(String username, String apiKey) {
        if (username == null || username.isBlank()) {
            throw new ConfigException("TOPSTEP_USERNAME", "Username is not configured");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigException("TOPSTEP_API_KEY", "API key is not configured");
        }

        log.debug("[SESSION] Authenticating {} with {}", username, gateway.getBrokerCode());
        String token = gateway.login(username, apiKey);
        session.replaceToken(token, clock.instant());
        log.info("[SESSION] Token acquired for {}", username);
        return token;
    }

    /**
     * Snapshot of the current token. Never blocks.
     */
    public Optional<String> currentToken() {
        return session.token();
    }

    /**
     * Scheduled refresh. Errors are logged and never thrown; the previous token stays in place.
     */
    public void refreshOnSchedule() {
        try {
            authenticate();
        } catch (ConfigException e) {
            log.warn("[SESSION] Scheduled token refresh skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("[SESSION] Scheduled token refresh failed, keeping previous token: {}", e.getMessage());
        }
    }

    /**
     * Pick the first tradable account whose name starts with the prefix (case-insensitive)
     * and bind it to the session. No match leaves the session account unset.
     *
     * @throws ConfigException if the prefix is missing or there is no token
     */
    public Optional<BrokerAccount> resolveAccount(String namePrefix) {
        if (namePrefix == null || namePrefix.isBlank()) {
            throw new ConfigException("ACCOUNT_NAME", "Account name prefix is not configured");
        }
        String token = currentToken()
            .orElseThrow(() -> new ConfigException("TOPSTEP_API_KEY", "No session token, authenticate first"));

        List<BrokerAccount> accounts = gateway.searchAccounts(token);
        Optional<BrokerAccount> match = accounts.stream()
            .filter(a -> a.matches(namePrefix))
            .findFirst();

        if (match.isPresent()) {
            BrokerAccount account = match.get();
            session.bindAccount(account.id(), account.name());
            log.info("[SESSION] Account resolved: {} ({})", account.name(), account.id());
        } else {
            log.warn("[SESSION] No tradable account matches prefix '{}' ({} accounts listed)",
                namePrefix, accounts.size());
        }
        return match;
    }

    /**
     * Arm the fixed-interval refresh. The first refresh runs one interval from now.
     */
    public synchronized void start() {
        if (running) {
            log.warn("[SESSION] Token refresh already running");
            return;
        }

        long periodMillis = refreshInterval.toMillis();
        refreshTask = scheduler.scheduleAtFixedRate(
            this::refreshOnSchedule, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        running = true;
        log.info("[SESSION] Token refresh scheduled every {}", refreshInterval);
    }

    /**
     * Cancel the refresh schedule. The current token is kept.
     */
    public synchronized void shutdown() {
        log.info("[SESSION] Shutting down token refresh");
        running = false;

        if (refreshTask != null) {
            refreshTask.cancel(false);
            refreshTask = null;
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }
}
