package in.tradeledger.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 *
 * Tests:
 * - Endpoint returns Prometheus text format
 * - Sync, auth, broadcast and subscriber metrics are exported
 */
public class MetricsEndpointTest {

    private Undertow server;
    private PrometheusSyncMetrics metrics;
    private HttpClient httpClient;
    private String metricsUrl;

    @BeforeEach
    public void setUp() {
        metrics = new PrometheusSyncMetrics(new CollectorRegistry());

        server = Undertow.builder()
            .addHttpListener(0, "localhost")
            .setHandler(Handlers.path()
                .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();

        InetSocketAddress address = (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
        metricsUrl = "http://localhost:" + address.getPort() + "/metrics";
        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> scrape() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(metricsUrl))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointAccessible() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode());
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.contains("text/plain"), "Content-Type should be Prometheus text format");
        assertTrue(response.body().contains("# HELP tradeledger_sync_total"));
    }

    @Test
    public void testRecordedMetricsAreExported() throws Exception {
        metrics.recordSyncSuccess("BACKFILL", 8, 2, Duration.ofMillis(350));
        metrics.recordSyncFailure("INCREMENTAL", "REMOTE");
        metrics.recordAuthentication("topstep", true, Duration.ofMillis(120));
        metrics.recordBroadcast(false);
        metrics.setSubscribers(3);

        String body = scrape().body();

        assertTrue(body.contains("tradeledger_sync_total{mode=\"BACKFILL\",status=\"success\""));
        assertTrue(body.contains("tradeledger_sync_total{mode=\"INCREMENTAL\",status=\"failure_remote\""));
        assertTrue(body.contains("tradeledger_trades_total{result=\"inserted\",} 8.0"));
        assertTrue(body.contains("tradeledger_trades_total{result=\"skipped\",} 2.0"));
        assertTrue(body.contains("tradeledger_auth_total{broker=\"topstep\",status=\"success\""));
        assertTrue(body.contains("tradeledger_broadcast_total{status=\"failure\""));
        assertTrue(body.contains("tradeledger_subscribers 3.0"));
    }
}
