package in.tradeledger.service.startup;

import in.tradeledger.domain.broker.BrokerAccount;
import in.tradeledger.domain.common.ConfigException;
import in.tradeledger.domain.common.TradeSyncException;
import in.tradeledger.domain.trade.SyncMode;
import in.tradeledger.domain.trade.SyncResult;
import in.tradeledger.infrastructure.broker.BrokerAuthenticationException;
import in.tradeledger.repository.TradeRepository;
import in.tradeledger.service.session.SessionTokenManager;
import in.tradeledger.service.sync.TradeSyncScheduler;
import in.tradeledger.service.sync.TradeSyncService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for StartupOrchestrator.
 *
 * Tests:
 * - Happy path walks every state in order
 * - Authentication failure still reaches STEADY_STATE
 * - Missing credentials still reach STEADY_STATE
 * - Backfill is attempted before timers are armed
 * - Early clear is not repeated by run()
 */
@ExtendWith(MockitoExtension.class)
class StartupOrchestratorTest {

    @Mock
    private TradeRepository tradeRepo;

    @Mock
    private SessionTokenManager sessionManager;

    @Mock
    private TradeSyncService syncService;

    @Mock
    private TradeSyncScheduler syncScheduler;

    private StartupOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new StartupOrchestrator(tradeRepo, sessionManager, syncService, syncScheduler, "PRAC");
    }

    @Test
    void testHappyPathReachesSteadyState() {
        Instant now = Instant.parse("2024-03-15T10:00:00Z");
        when(sessionManager.authenticate()).thenReturn("tok-1");
        when(sessionManager.currentToken()).thenReturn(Optional.of("tok-1"));
        when(sessionManager.resolveAccount("PRAC"))
            .thenReturn(Optional.of(new BrokerAccount(3L, "PRAC-V2-1", true)));
        when(syncService.syncBackfill())
            .thenReturn(new SyncResult(SyncMode.BACKFILL, 3L, now.minusSeconds(86400), now, 10, 8, 0));

        assertEquals(OrchestratorState.IDLE, orchestrator.getState());
        OrchestratorState state = orchestrator.run();

        assertEquals(OrchestratorState.STEADY_STATE, state);
        InOrder inOrder = inOrder(tradeRepo, sessionManager, syncService, syncScheduler);
        inOrder.verify(tradeRepo).clearAll();
        inOrder.verify(sessionManager).authenticate();
        inOrder.verify(sessionManager).resolveAccount("PRAC");
        inOrder.verify(syncService).syncBackfill();
        inOrder.verify(sessionManager).start();
        inOrder.verify(syncScheduler).start();
    }

    @Test
    void testAuthenticationFailureStillReachesSteadyState() {
        when(sessionManager.authenticate())
            .thenThrow(new BrokerAuthenticationException("topstep", "trader", "Login rejected"));
        when(syncService.syncBackfill())
            .thenThrow(new TradeSyncException("topstep", null, "No session token"));

        OrchestratorState state = orchestrator.run();

        assertEquals(OrchestratorState.STEADY_STATE, state);
        verify(sessionManager, never()).resolveAccount(any());
        verify(syncService).syncBackfill();
        verify(syncScheduler).start();
        verify(sessionManager).start();
    }

    @Test
    void testMissingCredentialsStillReachSteadyState() {
        when(sessionManager.authenticate())
            .thenThrow(new ConfigException("TOPSTEP_API_KEY", "API key is not configured"));
        when(syncService.syncBackfill())
            .thenThrow(new TradeSyncException("topstep", null, "No account resolved"));

        assertEquals(OrchestratorState.STEADY_STATE, orchestrator.run());
        verify(syncScheduler).start();
    }

    @Test
    void testClearFailureDoesNotStopStartup() {
        when(tradeRepo.clearAll()).thenThrow(new RuntimeException("disk I/O error"));
        when(sessionManager.authenticate()).thenReturn("tok-1");
        when(sessionManager.currentToken()).thenReturn(Optional.of("tok-1"));
        when(sessionManager.resolveAccount("PRAC")).thenReturn(Optional.empty());
        when(syncService.syncBackfill())
            .thenThrow(new TradeSyncException("topstep", null, "No account resolved"));

        assertEquals(OrchestratorState.STEADY_STATE, orchestrator.run());
    }

    @Test
    void testSecondRunIsIgnored() {
        when(sessionManager.authenticate())
            .thenThrow(new ConfigException("TOPSTEP_API_KEY", "API key is not configured"));

        orchestrator.run();
        orchestrator.run();

        verify(tradeRepo, times(1)).clearAll();
        verify(syncScheduler, times(1)).start();
    }

    @Test
    void testEarlyClearIsNotRepeatedByRun() {
        when(sessionManager.authenticate())
            .thenThrow(new ConfigException("TOPSTEP_API_KEY", "API key is not configured"));

        orchestrator.clearStoredTrades();
        verify(tradeRepo, times(1)).clearAll();
        assertEquals(OrchestratorState.IDLE, orchestrator.getState());

        assertEquals(OrchestratorState.STEADY_STATE, orchestrator.run());

        verify(tradeRepo, times(1)).clearAll();
        verify(sessionManager).authenticate();
    }
}
