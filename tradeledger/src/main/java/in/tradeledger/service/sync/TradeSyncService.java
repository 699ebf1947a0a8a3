package in.tradeledger.service.sync;

import in.tradeledger.domain.common.ConfigException;
import in.tradeledger.domain.common.TradePersistException;
import in.tradeledger.domain.common.TradeSyncException;
import in.tradeledger.domain.trade.PersistResult;
import in.tradeledger.domain.trade.RawTrade;
import in.tradeledger.domain.trade.SyncMode;
import in.tradeledger.domain.trade.SyncResult;
import in.tradeledger.domain.trade.Trade;
import in.tradeledger.infrastructure.broker.BrokerGateway;
import in.tradeledger.infrastructure.metrics.SyncMetrics;
import in.tradeledger.repository.TradeRepository;
import in.tradeledger.service.core.TradeBroadcastHub;
import in.tradeledger.service.session.BrokerSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Pulls trade windows from the broker into the ledger.
 *
 * Flow per window:
 * 1. One remote trade search for [start, end)
 * 2. Persist-and-dedup of every record in one transaction
 * 3. After commit, publish each inserted trade to the broadcast hub
 *
 * Overlapping windows (timer, order trigger, manual call) may run concurrently.
 * Correctness comes from the store's key constraint, so no lock is held here.
 */
public final class TradeSyncService {
    private static final Logger log = LoggerFactory.getLogger(TradeSyncService.class);

    private final BrokerGateway gateway;
    private final BrokerSession session;
    private final TradeRepository repository;
    private final TradeBroadcastHub hub;
    private final SyncMetrics metrics;
    private final Clock clock;
    private final ZoneId zone;
    private final Duration incrementalWindow;

    private volatile boolean backfillAttempted = false;

    public TradeSyncService(BrokerGateway gateway,
                            BrokerSession session,
                            TradeRepository repository,
                            TradeBroadcastHub hub,
                            SyncMetrics metrics,
                            Clock clock,
                            ZoneId zone,
                            Duration incrementalWindow) {
        this.gateway = gateway;
        this.session = session;
        this.repository = repository;
        this.hub = hub;
        this.metrics = metrics;
        this.clock = clock;
        this.zone = zone;
        this.incrementalWindow = incrementalWindow;
    }

    /**
     * Administrative sync of an explicit window.
     */
    public SyncResult syncWindow(long accountId, Instant start, Instant end) {
        return syncWindow(SyncMode.MANUAL, accountId, start, end);
    }

    /**
     * Fetch [start, end) for the account and store every realized execution.
     *
     * @throws TradeSyncException if there is no token or the remote call fails; nothing is stored
     * @throws TradePersistException if the batch could not be committed; nothing is stored
     */
    public SyncResult syncWindow(SyncMode mode, long accountId, Instant start, Instant end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }

        long startNanos = System.nanoTime();
        String token = session.token().orElseThrow(() -> {
            recordFailure(mode, "CONFIG");
            return new TradeSyncException(gateway.getBrokerCode(), accountId, "No session token",
                new ConfigException("TOPSTEP_API_KEY", "Not authenticated"));
        });

        List<RawTrade> raws;
        try {
            raws = gateway.searchTrades(token, accountId, start, end);
        } catch (Exception e) {
            recordFailure(mode, "REMOTE");
            log.warn("[SYNC] {} window [{}, {}) fetch failed: {}", mode, start, end, e.getMessage());
            throw new TradeSyncException(gateway.getBrokerCode(), accountId,
                "Trade search failed for window [" + start + ", " + end + ")", e);
        }

        long voided = raws.stream().filter(RawTrade::voided).count();
        if (voided > 0) {
            log.info("[SYNC] {} window [{}, {}) contains {} voided executions", mode, start, end, voided);
        }

        PersistResult persisted;
        try {
            persisted = repository.persistBatch(raws);
        } catch (TradePersistException e) {
            recordFailure(mode, "STORAGE");
            throw e;
        }

        for (Trade trade : persisted.inserted()) {
            try {
                hub.publish(trade);
            } catch (Exception e) {
                log.warn("[SYNC] Broadcast of trade {} failed: {}", trade.orderId(), e.getMessage());
            }
        }

        Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
        if (metrics != null) {
            metrics.recordSyncSuccess(mode.name(), persisted.insertedCount(), persisted.skipped(), latency);
        }

        SyncResult result = new SyncResult(mode, accountId, start, end,
            raws.size(), persisted.insertedCount(), persisted.skipped());
        if (result.inserted() > 0 || mode != SyncMode.INCREMENTAL) {
            log.info("[SYNC] {} [{}, {}) fetched={} inserted={} skipped={} in {}ms",
                mode, start, end, result.fetched(), result.inserted(), result.skipped(), latency.toMillis());
        } else {
            log.debug("[SYNC] {} [{}, {}) fetched={} nothing new", mode, start, end, result.fetched());
        }
        return result;
    }

    /**
     * Month-to-date sync for the session account. Marks backfill as attempted
     * whether or not it succeeds.
     */
    public SyncResult syncBackfill() {
        try {
            long accountId = requireAccount(SyncMode.BACKFILL);
            return syncWindow(SyncMode.BACKFILL, accountId, monthStart(), clock.instant());
        } finally {
            backfillAttempted = true;
        }
    }

    /**
     * Sync of the trailing incremental window for the session account.
     *
     * @param mode INCREMENTAL for the timer, ORDER after an order placement
     */
    public SyncResult syncIncremental(SyncMode mode) {
        long accountId = requireAccount(mode);
        Instant end = clock.instant();
        return syncWindow(mode, accountId, end.minus(incrementalWindow), end);
    }

    /**
     * First day of the current month, 00:00 in the service time zone.
     */
    public Instant monthStart() {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        return today.withDayOfMonth(1).atStartOfDay(zone).toInstant();
    }

    public Instant now() {
        return clock.instant();
    }

    public boolean isBackfillAttempted() {
        return backfillAttempted;
    }

    private long requireAccount(SyncMode mode) {
        return session.accountId().orElseThrow(() -> {
            recordFailure(mode, "CONFIG");
            return new TradeSyncException(gateway.getBrokerCode(), null, "No account resolved",
                new ConfigException("ACCOUNT_NAME", "Account not resolved"));
        });
    }

    private void recordFailure(SyncMode mode, String errorType) {
        if (metrics != null) {
            metrics.recordSyncFailure(mode.name(), errorType);
        }
    }
}
