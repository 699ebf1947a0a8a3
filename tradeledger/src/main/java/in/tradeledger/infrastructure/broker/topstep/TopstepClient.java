package in.tradeledger.infrastructure.broker.topstep;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.tradeledger.domain.broker.BrokerAccount;
import in.tradeledger.domain.broker.BrokerIds;
import in.tradeledger.domain.broker.Contract;
import in.tradeledger.domain.broker.OrderRequest;
import in.tradeledger.domain.broker.OrderResult;
import in.tradeledger.domain.trade.RawTrade;
import in.tradeledger.infrastructure.broker.BrokerAuthenticationException;
import in.tradeledger.infrastructure.broker.BrokerGateway;
import in.tradeledger.infrastructure.broker.BrokerRequestException;
import in.tradeledger.infrastructure.metrics.SyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * TopstepX (ProjectX gateway) REST client.
 *
 * Endpoints used:
 * - POST /api/Auth/loginKey     username + API key -> session token
 * - POST /api/Account/search    accounts of the session
 * - POST /api/Trade/search      executions of an account in a time window
 * - POST /api/Order/place       order placement
 * - POST /api/Contract/search   contract lookup
 *
 * Every request carries an explicit timeout. A timed out call fails; it is not
 * retried here.
 */
public class TopstepClient implements BrokerGateway {
    private static final Logger log = LoggerFactory.getLogger(TopstepClient.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final SyncMetrics metrics;

    /**
     * @param baseUrl Gateway base URL, e.g. https://api.topstepx.com
     * @param requestTimeout Per-request timeout
     * @param metrics Metrics collector (nullable)
     */
    public TopstepClient(String baseUrl, Duration requestTimeout, SyncMetrics metrics) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
        this.metrics = metrics;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(requestTimeout)
            .build();
    }

    @Override
    public String getBrokerCode() {
        return BrokerIds.TOPSTEP;
    }

    @Override
    public String login(String username, String apiKey) {
        Instant startTime = Instant.now();
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("username", username);
        payload.put("apiKey", apiKey);

        try {
            HttpResponse<String> response = httpClient.send(
                jsonPost("/api/Auth/loginKey", payload, null),
                HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() / 100 != 2) {
                log.error("[TOPSTEP] Login failed: HTTP {}", response.statusCode());
                throw new BrokerAuthenticationException(getBrokerCode(), username,
                    "Login failed: HTTP " + response.statusCode());
            }

            JsonNode json = objectMapper.readTree(response.body());
            if (json.has("success") && !json.get("success").asBoolean()) {
                throw new BrokerAuthenticationException(getBrokerCode(), username,
                    "Login rejected: " + errorMessage(json));
            }

            String token = json.path("token").asText(null);
            if (token == null || token.isBlank()) {
                throw new BrokerAuthenticationException(getBrokerCode(), username, "No token in login response");
            }

            recordAuth(true, startTime);
            return token;
        } catch (BrokerAuthenticationException e) {
            recordAuth(false, startTime);
            throw e;
        } catch (IOException e) {
            recordAuth(false, startTime);
            throw new BrokerAuthenticationException(getBrokerCode(), username, "Connection error", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordAuth(false, startTime);
            throw new BrokerAuthenticationException(getBrokerCode(), username, "Interrupted", e);
        }
    }

    @Override
    public List<BrokerAccount> searchAccounts(String token) {
        JsonNode json = post("/api/Account/search", objectMapper.createObjectNode(), token);

        JsonNode accounts = json.get("accounts");
        if (accounts == null || !accounts.isArray()) {
            throw new BrokerRequestException(getBrokerCode(), "/api/Account/search", 200,
                "Malformed response: no accounts array");
        }

        List<BrokerAccount> result = new ArrayList<>();
        for (JsonNode a : accounts) {
            result.add(new BrokerAccount(
                a.path("id").asLong(),
                a.path("name").asText(""),
                a.path("canTrade").asBoolean(false)
            ));
        }
        return result;
    }

    @Override
    public List<RawTrade> searchTrades(String token, long accountId, Instant start, Instant end) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("accountId", accountId);
        payload.put("startTimestamp", start.toString());
        payload.put("endTimestamp", end.toString());

        JsonNode json = post("/api/Trade/search", payload, token);

        JsonNode trades = json.get("trades");
        if (trades == null || trades.isNull()) {
            return List.of();
        }
        if (!trades.isArray()) {
            throw new BrokerRequestException(getBrokerCode(), "/api/Trade/search", 200,
                "Malformed response: trades is not an array");
        }

        List<RawTrade> result = new ArrayList<>(trades.size());
        for (JsonNode t : trades) {
            result.add(parseTrade(t));
        }
        log.debug("[TOPSTEP] Trade search {}..{} for account {}: {} trades", start, end, accountId, result.size());
        return result;
    }

    @Override
    public OrderResult placeOrder(String token, long accountId, OrderRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("accountId", accountId);
        payload.put("contractId", request.contractId());
        payload.put("type", request.type());
        payload.put("side", request.side());
        payload.put("size", request.quantity());
        if (request.limitPrice() != null) {
            payload.put("limitPrice", request.limitPrice());
        } else {
            payload.putNull("limitPrice");
        }
        payload.putNull("stopPrice");
        payload.putNull("trailPrice");
        payload.putNull("customTag");
        payload.putNull("linkedOrderId");

        JsonNode json = post("/api/Order/place", payload, token);

        return new OrderResult(
            json.hasNonNull("orderId") ? json.get("orderId").asLong() : null,
            json.path("success").asBoolean(true),
            json.hasNonNull("errorCode") ? json.get("errorCode").asInt() : null,
            json.path("errorMessage").asText(null)
        );
    }

    @Override
    public List<Contract> searchContracts(String token, String searchText) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("searchText", searchText);
        payload.put("live", false);

        JsonNode json = post("/api/Contract/search", payload, token);

        List<Contract> result = new ArrayList<>();
        for (JsonNode c : json.path("contracts")) {
            result.add(new Contract(
                c.path("id").asText(),
                c.path("name").asText(""),
                c.path("description").asText(""),
                decimal(c.get("tickSize")),
                decimal(c.get("tickValue")),
                c.path("activeContract").asBoolean(false)
            ));
        }
        return result;
    }

    // ============================================================

    private JsonNode post(String path, JsonNode payload, String token) {
        try {
            HttpResponse<String> response = httpClient.send(
                jsonPost(path, payload, token),
                HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() / 100 != 2) {
                log.error("[TOPSTEP] {} HTTP {}: {}", path, response.statusCode(), response.body());
                throw new BrokerRequestException(getBrokerCode(), path, response.statusCode(),
                    "HTTP error " + response.statusCode());
            }

            JsonNode json = objectMapper.readTree(response.body());
            if (json == null || json.isMissingNode()) {
                throw new BrokerRequestException(getBrokerCode(), path, response.statusCode(), "Empty response body");
            }
            if (json.has("success") && !json.get("success").asBoolean()) {
                throw new BrokerRequestException(getBrokerCode(), path, response.statusCode(),
                    "API call failed: " + errorMessage(json));
            }
            return json;
        } catch (HttpTimeoutException e) {
            throw new BrokerRequestException(getBrokerCode(), path,
                "Timed out after " + requestTimeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new BrokerRequestException(getBrokerCode(), path, "Connection error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerRequestException(getBrokerCode(), path, "Interrupted", e);
        }
    }

    private HttpRequest jsonPost(String path, JsonNode payload, String token) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)));
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder.build();
    }

    private RawTrade parseTrade(JsonNode t) {
        return new RawTrade(
            t.hasNonNull("id") ? t.get("id").asLong() : null,
            t.path("orderId").asLong(),
            t.path("accountId").asLong(),
            t.path("contractId").asText(null),
            t.path("creationTimestamp").asText(null),
            decimal(t.get("price")),
            decimal(t.get("profitAndLoss")),
            decimal(t.get("fees")),
            t.path("side").asInt(),
            decimal(t.get("size")),
            t.path("voided").asBoolean(false)
        );
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.isNumber() ? node.decimalValue() : new BigDecimal(node.asText());
    }

    private static String errorMessage(JsonNode json) {
        String message = json.path("errorMessage").asText(null);
        if (message == null || message.isBlank()) {
            return "errorCode=" + json.path("errorCode").asText("unknown");
        }
        return message;
    }

    private void recordAuth(boolean success, Instant startTime) {
        if (metrics != null) {
            metrics.recordAuthentication(getBrokerCode(), success, Duration.between(startTime, Instant.now()));
        }
    }
}
