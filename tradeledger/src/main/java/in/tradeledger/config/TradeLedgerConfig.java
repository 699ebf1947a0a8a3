package in.tradeledger.config;

import in.tradeledger.util.Env;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Process configuration, read once at startup.
 *
 * Credentials and account prefix may be absent: the service still starts and
 * every operation that needs them fails individually.
 */
public record TradeLedgerConfig(
    int port,
    String dbPath,
    int dbPoolSize,
    int dbBusyTimeoutMs,
    String brokerBaseUrl,
    String username,
    String apiKey,
    String accountNamePrefix,
    Duration brokerHttpTimeout,
    Duration syncInterval,
    Duration incrementalWindow,
    Duration tokenRefreshInterval,
    ZoneId zone
) {
    public static final String DEFAULT_BROKER_BASE_URL = "https://api.topstepx.com";

    public static TradeLedgerConfig fromEnv() {
        return new TradeLedgerConfig(
            Env.getInt("PORT", 4000),
            Env.get("DB_PATH", "trades.db"),
            Env.getInt("DB_POOL_SIZE", 4),
            Env.getInt("DB_BUSY_TIMEOUT_MS", 10_000),
            Env.get("TOPSTEP_BASE_URL", DEFAULT_BROKER_BASE_URL),
            Env.get("TOPSTEP_USERNAME", null),
            Env.get("TOPSTEP_API_KEY", null),
            Env.get("ACCOUNT_NAME", null),
            Duration.ofSeconds(Env.getLong("BROKER_HTTP_TIMEOUT_SECONDS", 30)),
            Duration.ofSeconds(Env.getLong("SYNC_INTERVAL_SECONDS", 60)),
            Duration.ofSeconds(Env.getLong("INCREMENTAL_WINDOW_SECONDS", 60)),
            Duration.ofHours(Env.getLong("TOKEN_REFRESH_HOURS", 24)),
            ZoneId.of(Env.get("SERVICE_TIME_ZONE", ZoneId.systemDefault().getId()))
        );
    }
}
