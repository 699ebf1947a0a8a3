package in.tradeledger.repository;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Pooled SQLite data source.
 *
 * Write transactions start as BEGIN IMMEDIATE so concurrent writers queue on the
 * database lock (bounded by busy_timeout) instead of failing on lock upgrade.
 * WAL keeps readers unblocked while a batch is being written.
 */
public final class SqliteDataSources {
    private static final Logger log = LoggerFactory.getLogger(SqliteDataSources.class);

    public static HikariDataSource create(Path dbFile, int maxPool, int busyTimeoutMs) {
        Path parent = dbFile.toAbsolutePath().getParent();
        if (parent != null && !parent.toFile().exists()) {
            parent.toFile().mkdirs();
        }

        String url = "jdbc:sqlite:" + dbFile.toAbsolutePath();

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(Math.max(5000, busyTimeoutMs));
        config.setPoolName("tradeledger-hikari");
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", String.valueOf(busyTimeoutMs));
        config.addDataSourceProperty("transaction_mode", "IMMEDIATE");

        log.info("[DB] url={}, pool={}, busyTimeoutMs={}", url, maxPool, busyTimeoutMs);
        return new HikariDataSource(config);
    }

    private SqliteDataSources() {}
}
