package in.tradeledger.infrastructure.metrics;

import java.time.Duration;

/**
 * Ingestion metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Window sync success/failure per mode
 * - Inserted vs skipped (duplicate) trades
 * - Broker login outcomes
 * - Live subscriber deliveries and failures
 */
public interface SyncMetrics {

    /**
     * Record a completed window sync.
     *
     * @param mode BACKFILL, INCREMENTAL, ORDER or MANUAL
     * @param inserted Newly stored trades
     * @param skipped Trades already present
     * @param latency Fetch + persist time
     */
    void recordSyncSuccess(String mode, int inserted, int skipped, Duration latency);

    /**
     * Record a failed window sync.
     *
     * @param mode Sync mode
     * @param errorType CONFIG, REMOTE or STORAGE
     */
    void recordSyncFailure(String mode, String errorType);

    /**
     * Record a broker login attempt.
     */
    void recordAuthentication(String brokerCode, boolean success, Duration latency);

    /**
     * Record a delivery to a live subscriber.
     */
    void recordBroadcast(boolean success);

    /**
     * Update the live subscriber gauge.
     */
    void setSubscribers(int count);
}
