package in.tradeledger.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.tradeledger.domain.common.EventType;
import in.tradeledger.domain.trade.Trade;
import in.tradeledger.service.core.TradeBroadcastHub;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Undertow WebSocket endpoint for the live trade stream.
 *
 * Every connection becomes one broadcast hub subscription and receives
 * NEW_TRADE messages for trades stored after it connected. Clients load
 * history through GET /api/trades.
 */
public final class WsHub {
    private static final Logger log = LoggerFactory.getLogger(WsHub.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TradeBroadcastHub hub;
    private final ConcurrentMap<WebSocketChannel, TradeBroadcastHub.Subscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong wsSeq = new AtomicLong(0);

    public WsHub(TradeBroadcastHub hub) {
        this.hub = hub;
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                String name = "ws:" + channel.getSourceAddress();
                TradeBroadcastHub.Subscription sub = hub.subscribe(name, trade -> sendTrade(channel, trade));
                subscriptions.put(channel, sub);

                log.info("[WS] Connected: {} (subscription={})", channel.getSourceAddress(), sub.id());

                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        handleClientMessage(ch, message.getData());
                    }

                    @Override
                    protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                        cleanup(ch);
                        super.onCloseMessage(cm, ch);
                    }

                    @Override
                    protected void onError(WebSocketChannel ch, Throwable error) {
                        log.warn("[WS] Error: {}", error.toString());
                        cleanup(ch);
                    }
                });
                channel.addCloseTask(ch -> cleanup(ch));

                channel.resumeReceives();
                sendAck(channel, sub);
            }
        });
    }

    private void handleClientMessage(WebSocketChannel channel, String raw) {
        try {
            ClientMessage msg = MAPPER.readValue(raw, ClientMessage.class);
            if (msg.action == null) {
                sendError(channel, "Missing 'action'");
                return;
            }

            if ("ping".equals(msg.action)) {
                ObjectNode payload = MAPPER.createObjectNode();
                payload.put("nonce", msg.nonce == null ? "" : msg.nonce);
                payload.put("pong", true);
                sendDirect(channel, message(EventType.PONG, payload));
            } else {
                sendError(channel, "Unknown action: " + msg.action);
            }
        } catch (Exception e) {
            sendError(channel, "Invalid JSON: " + e.getMessage());
        }
    }

    private void sendTrade(WebSocketChannel channel, Trade trade) {
        if (!channel.isOpen()) {
            cleanup(channel);
            return;
        }
        sendDirect(channel, message(EventType.NEW_TRADE, MAPPER.valueToTree(trade)));
    }

    private void sendAck(WebSocketChannel channel, TradeBroadcastHub.Subscription sub) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("action", "connect");
        payload.put("subscriptionId", sub.id());
        sendDirect(channel, message(EventType.ACK, payload));
    }

    private void sendError(WebSocketChannel channel, String error) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("error", error);
        sendDirect(channel, message(EventType.ERROR, payload));
    }

    private ServerMessage message(EventType type, JsonNode payload) {
        return new ServerMessage(type.name(), payload, Instant.now().toString(), wsSeq.incrementAndGet());
    }

    private void sendDirect(WebSocketChannel channel, ServerMessage msg) {
        try {
            String json = MAPPER.writeValueAsString(msg);
            WebSockets.sendText(json, channel, null);
        } catch (JsonProcessingException e) {
            log.warn("[WS] Failed to serialize message: {}", e.toString());
        }
    }

    private void cleanup(WebSocketChannel channel) {
        TradeBroadcastHub.Subscription sub = subscriptions.remove(channel);
        if (sub == null) {
            return;
        }
        hub.unsubscribe(sub);
        log.info("[WS] Disconnected: {} (subscription={})", channel.getSourceAddress(), sub.id());
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("[WS] Close failed for {}: {}", channel.getSourceAddress(), e.toString());
        }
    }

    // Message models
    public static final class ClientMessage {
        public String action;
        public String nonce;
    }

    public static final class ServerMessage {
        public String type;
        public JsonNode payload;
        public String ts;
        public long seq;

        public ServerMessage() {
        }

        public ServerMessage(String type, JsonNode payload, String ts, long seq) {
            this.type = type;
            this.payload = payload;
            this.ts = ts;
            this.seq = seq;
        }
    }
}
