package in.tradeledger.service.startup;

/**
 * Startup progress. Transitions only move forward; there is no error state.
 */
public enum OrchestratorState {
    IDLE,
    TOKEN_ACQUIRED,
    ACCOUNT_RESOLVED,
    BACKFILL_DONE,
    STEADY_STATE
}
