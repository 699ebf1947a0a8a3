package in.tradeledger.service.startup;

import in.tradeledger.repository.TradeRepository;
import in.tradeledger.service.session.SessionTokenManager;
import in.tradeledger.service.sync.TradeSyncScheduler;
import in.tradeledger.service.sync.TradeSyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Startup sequence:
 * 1. Clear the trades table (the month is re-ingested by backfill)
 * 2. Authenticate
 * 3. Resolve the trading account
 * 4. Month-to-date backfill
 * 5. Arm token refresh and incremental sync
 *
 * A failing step is logged and the sequence continues, so the process always
 * reaches STEADY_STATE and keeps serving stored trades.
 */
public final class StartupOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(StartupOrchestrator.class);

    private final TradeRepository tradeRepo;
    private final SessionTokenManager sessionManager;
    private final TradeSyncService syncService;
    private final TradeSyncScheduler syncScheduler;
    private final String accountNamePrefix;

    private final AtomicBoolean cleared = new AtomicBoolean(false);
    private final AtomicReference<OrchestratorState> state = new AtomicReference<>(OrchestratorState.IDLE);

    public StartupOrchestrator(TradeRepository tradeRepo,
                               SessionTokenManager sessionManager,
                               TradeSyncService syncService,
                               TradeSyncScheduler syncScheduler,
                               String accountNamePrefix) {
        this.tradeRepo = tradeRepo;
        this.sessionManager = sessionManager;
        this.syncService = syncService;
        this.syncScheduler = syncScheduler;
        this.accountNamePrefix = accountNamePrefix;
    }

    /**
     * Run the startup sequence once. Never throws because of a step failure.
     */
    public OrchestratorState run() {
        if (state.get() != OrchestratorState.IDLE) {
            log.warn("[INIT] Startup already ran (state={})", state.get());
            return state.get();
        }

        clearStoredTrades();

        try {
            sessionManager.authenticate();
            advance(OrchestratorState.TOKEN_ACQUIRED);
        } catch (Exception e) {
            log.error("[INIT] Authentication failed: {}", e.getMessage());
        }

        if (sessionManager.currentToken().isPresent()) {
            try {
                if (sessionManager.resolveAccount(accountNamePrefix).isPresent()) {
                    advance(OrchestratorState.ACCOUNT_RESOLVED);
                }
            } catch (Exception e) {
                log.error("[INIT] Account resolution failed: {}", e.getMessage());
            }
        }

        try {
            syncService.syncBackfill();
            advance(OrchestratorState.BACKFILL_DONE);
        } catch (Exception e) {
            log.error("[INIT] Backfill failed: {}", e.getMessage());
        }

        sessionManager.start();
        syncScheduler.start();
        advance(OrchestratorState.STEADY_STATE);
        log.info("[INIT] Startup complete, incremental sync armed");
        return state.get();
    }

    /**
     * Step 1 on its own. Runs at most once per process, so callers can clear
     * before the HTTP listener accepts manual syncs and run() will not wipe
     * trades stored in between.
     */
    public void clearStoredTrades() {
        if (!cleared.compareAndSet(false, true)) {
            return;
        }
        try {
            int deleted = tradeRepo.clearAll();
            log.info("[INIT] Cleared {} stored trades", deleted);
        } catch (Exception e) {
            log.error("[INIT] Failed to clear trades table: {}", e.getMessage());
        }
    }

    public OrchestratorState getState() {
        return state.get();
    }

    private void advance(OrchestratorState next) {
        OrchestratorState prev = state.getAndUpdate(s -> next.ordinal() > s.ordinal() ? next : s);
        if (next.ordinal() > prev.ordinal()) {
            log.info("[INIT] {} -> {}", prev, next);
        }
    }
}
