package in.tradeledger.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of SyncMetrics.
 *
 * Metrics are exposed at /metrics:
 * - tradeledger_sync_total{mode, status}
 * - tradeledger_sync_latency_seconds{mode}
 * - tradeledger_trades_total{result}            inserted | skipped
 * - tradeledger_auth_total{broker, status}
 * - tradeledger_auth_latency_seconds{broker}
 * - tradeledger_broadcast_total{status}
 * - tradeledger_subscribers
 */
public class PrometheusSyncMetrics implements SyncMetrics {

    private final CollectorRegistry registry;

    private final Counter syncCounter;
    private final Histogram syncLatency;
    private final Counter tradeCounter;
    private final Counter authCounter;
    private final Histogram authLatency;
    private final Counter broadcastCounter;
    private final Gauge subscribers;

    public PrometheusSyncMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusSyncMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.syncCounter = Counter.build()
            .name("tradeledger_sync_total")
            .help("Window syncs by mode and outcome")
            .labelNames("mode", "status")
            .register(registry);

        this.syncLatency = Histogram.build()
            .name("tradeledger_sync_latency_seconds")
            .help("Window sync latency (fetch + persist) in seconds")
            .labelNames("mode")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0, 30.0)
            .register(registry);

        this.tradeCounter = Counter.build()
            .name("tradeledger_trades_total")
            .help("Realized trades seen by sync, by dedup result")
            .labelNames("result")
            .register(registry);

        this.authCounter = Counter.build()
            .name("tradeledger_auth_total")
            .help("Broker login attempts")
            .labelNames("broker", "status")
            .register(registry);

        this.authLatency = Histogram.build()
            .name("tradeledger_auth_latency_seconds")
            .help("Broker login latency in seconds")
            .labelNames("broker")
            .buckets(0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0)
            .register(registry);

        this.broadcastCounter = Counter.build()
            .name("tradeledger_broadcast_total")
            .help("Deliveries to live subscribers")
            .labelNames("status")
            .register(registry);

        this.subscribers = Gauge.build()
            .name("tradeledger_subscribers")
            .help("Live trade stream subscribers")
            .register(registry);
    }

    @Override
    public void recordSyncSuccess(String mode, int inserted, int skipped, Duration latency) {
        syncCounter.labels(mode, "success").inc();
        syncLatency.labels(mode).observe(latency.toMillis() / 1000.0);
        tradeCounter.labels("inserted").inc(inserted);
        tradeCounter.labels("skipped").inc(skipped);
    }

    @Override
    public void recordSyncFailure(String mode, String errorType) {
        syncCounter.labels(mode, "failure_" + errorType.toLowerCase()).inc();
    }

    @Override
    public void recordAuthentication(String brokerCode, boolean success, Duration latency) {
        authCounter.labels(brokerCode, success ? "success" : "failure").inc();
        authLatency.labels(brokerCode).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordBroadcast(boolean success) {
        broadcastCounter.labels(success ? "success" : "failure").inc();
    }

    @Override
    public void setSubscribers(int count) {
        subscribers.set(count);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
