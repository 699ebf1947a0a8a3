package in.tradeledger.bootstrap;

import in.tradeledger.config.TradeLedgerConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StartupConfigValidator.
 */
class StartupConfigValidatorTest {

    private static TradeLedgerConfig config(int port, String username, String apiKey, String account,
                                            Duration syncInterval) {
        return new TradeLedgerConfig(
            port, "trades.db", 4, 10_000,
            TradeLedgerConfig.DEFAULT_BROKER_BASE_URL,
            username, apiKey, account,
            Duration.ofSeconds(30), syncInterval, Duration.ofSeconds(60), Duration.ofHours(24),
            ZoneId.of("UTC"));
    }

    @Test
    void testFullyConfiguredHasNoWarnings() {
        List<String> warnings = StartupConfigValidator.validate(
            config(4000, "trader", "key", "PRAC", Duration.ofSeconds(60)));

        assertTrue(warnings.isEmpty());
    }

    @Test
    void testMissingCredentialsAreWarningsOnly() {
        TradeLedgerConfig config = config(4000, null, "", null, Duration.ofSeconds(60));

        List<String> warnings = StartupConfigValidator.validate(config);

        assertEquals(3, warnings.size());
        assertTrue(warnings.get(0).contains("TOPSTEP_USERNAME"));
        assertTrue(warnings.get(1).contains("TOPSTEP_API_KEY"));
        assertTrue(warnings.get(2).contains("ACCOUNT_NAME"));
    }

    @Test
    void testInvalidPortIsFatal() {
        assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(config(0, "trader", "key", "PRAC", Duration.ofSeconds(60))));
    }

    @Test
    void testNonPositiveIntervalIsFatal() {
        assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(config(4000, "trader", "key", "PRAC", Duration.ZERO)));
    }
}
