package in.tradeledger.bootstrap;

import in.tradeledger.config.TradeLedgerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration validator.
 *
 * Out-of-range numeric settings are fatal (IllegalStateException). Missing
 * credentials or account prefix are only warnings: the service still starts,
 * serves stored trades, and the affected operations fail individually.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * Validate configuration before anything is wired.
     *
     * @return Warnings that were logged (empty when fully configured)
     * @throws IllegalStateException if a setting is out of range
     */
    public static List<String> validate(TradeLedgerConfig config) {
        log.info("[INIT] Running startup config validation...");

        if (config.port() < 1 || config.port() > 65535) {
            throw new IllegalStateException("INVALID CONFIG: PORT must be 1-65535, got " + config.port());
        }
        if (config.dbPoolSize() < 1) {
            throw new IllegalStateException("INVALID CONFIG: DB_POOL_SIZE must be at least 1, got " + config.dbPoolSize());
        }
        if (config.dbBusyTimeoutMs() < 0) {
            throw new IllegalStateException("INVALID CONFIG: DB_BUSY_TIMEOUT_MS cannot be negative");
        }
        requirePositive("BROKER_HTTP_TIMEOUT_SECONDS", config.brokerHttpTimeout());
        requirePositive("SYNC_INTERVAL_SECONDS", config.syncInterval());
        requirePositive("INCREMENTAL_WINDOW_SECONDS", config.incrementalWindow());
        requirePositive("TOKEN_REFRESH_HOURS", config.tokenRefreshInterval());

        List<String> warnings = new ArrayList<>();
        if (config.username() == null || config.username().isBlank()) {
            warnings.add("TOPSTEP_USERNAME is not set: broker login disabled");
        }
        if (config.apiKey() == null || config.apiKey().isBlank()) {
            warnings.add("TOPSTEP_API_KEY is not set: broker login disabled");
        }
        if (config.accountNamePrefix() == null || config.accountNamePrefix().isBlank()) {
            warnings.add("ACCOUNT_NAME is not set: no account will be resolved, sync disabled until POST /api/account");
        }

        for (String warning : warnings) {
            log.warn("[INIT] {}", warning);
        }
        log.info("[INIT] Config validation passed ({} warnings)", warnings.size());
        return warnings;
    }

    private static void requirePositive(String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalStateException("INVALID CONFIG: " + key + " must be positive, got " + value);
        }
    }

    private StartupConfigValidator() {}
}
