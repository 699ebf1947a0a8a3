package in.tradeledger.service.sync;

import in.tradeledger.domain.common.TradeSyncException;
import in.tradeledger.domain.trade.SyncMode;
import in.tradeledger.domain.trade.SyncResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TradeSyncScheduler.
 *
 * Tests:
 * - Timer tick skipped until backfill has been attempted
 * - Order-triggered sync runs asynchronously in ORDER mode
 * - Failures are swallowed
 */
@ExtendWith(MockitoExtension.class)
class TradeSyncSchedulerTest {

    @Mock
    private TradeSyncService syncService;

    private TradeSyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new TradeSyncScheduler(syncService, Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    private static SyncResult empty(SyncMode mode) {
        Instant now = Instant.parse("2024-03-15T10:00:00Z");
        return new SyncResult(mode, 1L, now.minusSeconds(60), now, 0, 0, 0);
    }

    @Test
    void testTickSkippedBeforeBackfill() {
        when(syncService.isBackfillAttempted()).thenReturn(false);

        scheduler.runIncremental();

        verify(syncService, never()).syncIncremental(any());
    }

    @Test
    void testTickRunsAfterBackfill() {
        when(syncService.isBackfillAttempted()).thenReturn(true);
        when(syncService.syncIncremental(SyncMode.INCREMENTAL)).thenReturn(empty(SyncMode.INCREMENTAL));

        scheduler.runIncremental();

        verify(syncService).syncIncremental(SyncMode.INCREMENTAL);
    }

    @Test
    void testTickFailureIsSwallowed() {
        when(syncService.isBackfillAttempted()).thenReturn(true);
        when(syncService.syncIncremental(SyncMode.INCREMENTAL))
            .thenThrow(new TradeSyncException("topstep", 1L, "HTTP error 500"));

        assertDoesNotThrow(() -> scheduler.runIncremental());
    }

    @Test
    void testOrderSyncRunsInOrderMode() throws Exception {
        when(syncService.syncIncremental(SyncMode.ORDER)).thenReturn(empty(SyncMode.ORDER));

        scheduler.triggerOrderSync().get(5, TimeUnit.SECONDS);

        verify(syncService).syncIncremental(SyncMode.ORDER);
    }

    @Test
    void testStartIsIdempotent() {
        scheduler.start();
        scheduler.start();

        assertTrue(scheduler.isStarted());
    }
}
