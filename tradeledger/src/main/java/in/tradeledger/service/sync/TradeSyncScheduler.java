package in.tradeledger.service.sync;

import in.tradeledger.domain.trade.SyncMode;
import in.tradeledger.domain.trade.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background triggers for incremental sync.
 *
 * 1. Every syncInterval: trailing-window sync, skipped until backfill has been attempted
 * 2. On demand after an order placement: same window, run asynchronously
 *
 * Failures are logged and the next cycle runs as usual.
 */
public final class TradeSyncScheduler {
    private static final Logger log = LoggerFactory.getLogger(TradeSyncScheduler.class);

    private final TradeSyncService syncService;
    private final Duration syncInterval;
    private final ScheduledExecutorService scheduler;
    private volatile boolean started = false;

    public TradeSyncScheduler(TradeSyncService syncService, Duration syncInterval) {
        this.syncService = syncService;
        this.syncInterval = syncInterval;
        AtomicInteger threadSeq = new AtomicInteger(0);
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "trade-sync-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Arm the recurring incremental sync. The first run is one interval from now.
     */
    public synchronized void start() {
        if (started) {
            log.warn("[SYNC] Scheduler already started");
            return;
        }
        long periodMillis = syncInterval.toMillis();
        scheduler.scheduleAtFixedRate(this::runIncremental, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        started = true;
        log.info("[SYNC] Incremental sync every {}s", syncInterval.toSeconds());
    }

    /**
     * Run an incremental sync after an order placement, off the caller's thread.
     */
    public Future<?> triggerOrderSync() {
        return scheduler.submit(() -> runSafely(SyncMode.ORDER));
    }

    /**
     * One timer tick. Does nothing until backfill has been attempted.
     */
    void runIncremental() {
        if (!syncService.isBackfillAttempted()) {
            log.debug("[SYNC] Backfill not attempted yet, skipping incremental tick");
            return;
        }
        runSafely(SyncMode.INCREMENTAL);
    }

    private void runSafely(SyncMode mode) {
        try {
            SyncResult result = syncService.syncIncremental(mode);
            log.debug("[SYNC] {} tick done: inserted={}", mode, result.inserted());
        } catch (Exception e) {
            log.warn("[SYNC] {} sync failed, will retry next cycle: {}", mode, e.getMessage());
        }
    }

    public boolean isStarted() {
        return started;
    }

    public void stop() {
        log.info("[SYNC] Stopping scheduler...");
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
