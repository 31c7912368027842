package com.polymarket.signals.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.polymarket.signals.config.SignalProperties;
import com.polymarket.signals.core.MarketEventRouter;
import com.polymarket.signals.core.MarketStateStore;
import com.polymarket.signals.domain.MarketSnapshot;
import com.polymarket.signals.events.ConnectionExhaustedEvent;
import com.polymarket.signals.events.MarketListedEvent;
import com.polymarket.signals.events.SignalEventPublisher;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the single market-channel socket: connect, subscribe, heartbeat and
 * exponential-backoff reconnect. Socket callbacks arrive on OkHttp threads and
 * are hopped onto the {@link MarketEventLoop}; callbacks from a socket that
 * has since been replaced are ignored.
 */
@Slf4j
@Component
public class MarketConnectionManager {

    static final String PING = "PING";
    static final String PONG = "PONG";
    private static final long STOP_TIMEOUT_MILLIS = 5_000;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final MarketEventRouter router;
    private final MarketStateStore store;
    private final MarketEventLoop eventLoop;
    private final SignalEventPublisher publisher;
    private final Clock clock;
    private final SignalProperties.Connection config;
    private final ReconnectBackoff backoff;

    private final AtomicLong messageIds = new AtomicLong();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean scanning;
    private volatile boolean exhausted;
    private volatile WebSocket socket;
    private volatile ScheduledFuture<?> heartbeat;
    private volatile ScheduledFuture<?> reconnectTimer;

    public MarketConnectionManager(OkHttpClient httpClient, ObjectMapper objectMapper, MarketEventRouter router,
            MarketStateStore store, MarketEventLoop eventLoop, SignalEventPublisher publisher, Clock clock,
            SignalProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.router = router;
        this.store = store;
        this.eventLoop = eventLoop;
        this.publisher = publisher;
        this.clock = clock;
        this.config = properties.connection();
        this.backoff = new ReconnectBackoff(config.reconnectBaseDelayMillis(), config.reconnectMaxDelayMillis(),
                config.maxReconnectAttempts());
    }

    @PostConstruct
    public void init() {
        if (!config.enabled()) {
            log.info("Market socket disabled (signals.connection.enabled=false)");
            return;
        }
        start();
    }

    public void start() {
        eventLoop.execute(() -> {
            if (scanning) {
                return;
            }
            scanning = true;
            exhausted = false;
            backoff.reset();
            connect();
        });
    }

    /**
     * Stops scanning. Runs on the event loop after any queued start or socket
     * callback; heartbeat and reconnect timers are cancelled before this
     * returns, so no reconnect fires afterwards.
     */
    @PreDestroy
    public void stop() {
        eventLoop.runAndWait(this::shutdownSocket, STOP_TIMEOUT_MILLIS);
    }

    private void shutdownSocket() {
        scanning = false;
        cancelHeartbeat();
        cancelReconnect();
        WebSocket current = socket;
        socket = null;
        if (current != null) {
            state = ConnectionState.CLOSING;
            current.close(1000, "shutdown");
        }
        state = ConnectionState.DISCONNECTED;
        log.info("Market socket stopped");
    }

    public ConnectionState getState() {
        return state;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public int getReconnectAttempts() {
        return backoff.attempts();
    }

    /**
     * Requests per-asset quotes for a market's legs. Dropped while the socket
     * is down; the legs are re-subscribed from the store on the next connect.
     */
    public void subscribeAssets(String marketId, Collection<String> assetIds) {
        if (state != ConnectionState.CONNECTED || socket == null || assetIds.isEmpty()) {
            log.debug("Not connected, deferring subscription for {}", marketId);
            return;
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("market", marketId);
        payload.putArray("asset_ids").addAll(assetIds.stream().map(objectMapper.getNodeFactory()::textNode).toList());
        send(subscribeMessage("orderbook", payload));
    }

    @EventListener
    public void onMarketListed(MarketListedEvent event) {
        subscribeAssets(event.marketId(), event.assetIds());
    }

    private void connect() {
        state = ConnectionState.CONNECTING;
        log.info("Connecting to market socket {}", config.wsUrl());
        Request request = new Request.Builder().url(config.wsUrl()).build();
        socket = httpClient.newWebSocket(request, new SocketListener());
    }

    private void onOpen(WebSocket ws) {
        if (ws != socket) {
            return;
        }
        state = ConnectionState.CONNECTED;
        backoff.reset();
        log.info("✅ Market socket connected");

        send(subscribeMessage("markets", objectMapper.createObjectNode()));
        resubscribeKnownLegs();
        startHeartbeat();
    }

    private void onText(WebSocket ws, String text) {
        if (ws != socket) {
            return;
        }
        if (PONG.equals(text.trim())) {
            return;
        }
        try {
            router.route(objectMapper.readTree(text));
        } catch (JsonProcessingException e) {
            log.warn("Malformed frame dropped: {}", e.getOriginalMessage());
        }
    }

    private void onDisconnect(WebSocket ws, boolean failed, String detail) {
        if (ws != socket) {
            return;
        }
        cancelHeartbeat();
        socket = null;
        log.warn("Market socket {}: {}", failed ? "failed" : "closed", detail);
        state = ConnectionState.DISCONNECTED;
        if (scanning) {
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        if (reconnectTimer != null && !reconnectTimer.isDone()) {
            return;
        }
        OptionalLong delay = backoff.nextDelayMillis();
        if (delay.isEmpty()) {
            exhausted = true;
            scanning = false;
            log.error("Max market reconnection attempts reached ({}), giving up", backoff.attempts());
            publisher.publish(new ConnectionExhaustedEvent(backoff.attempts(), Instant.now(clock)));
            return;
        }
        log.warn("Reconnecting in {} ms (attempt {}/{})", delay.getAsLong(), backoff.attempts(),
                config.maxReconnectAttempts());
        reconnectTimer = eventLoop.schedule(() -> {
            reconnectTimer = null;
            if (scanning) {
                connect();
            }
        }, delay.getAsLong());
    }

    private void resubscribeKnownLegs() {
        int count = 0;
        for (MarketSnapshot market : store.getAllMarkets()) {
            if (market.getState() == MarketSnapshot.State.RESOLVED || market.getOutcomes().isEmpty()) {
                continue;
            }
            subscribeAssets(market.getMarketId(), List.copyOf(market.getOutcomes().keySet()));
            count++;
        }
        if (count > 0) {
            log.info("Resubscribed to {} markets", count);
        }
    }

    private void startHeartbeat() {
        cancelHeartbeat();
        heartbeat = eventLoop.scheduleAtFixedRate(() -> {
            WebSocket current = socket;
            if (current != null && state == ConnectionState.CONNECTED) {
                current.send(PING);
            }
        }, config.heartbeatMillis());
    }

    private void cancelHeartbeat() {
        ScheduledFuture<?> current = heartbeat;
        heartbeat = null;
        if (current != null) {
            current.cancel(false);
        }
    }

    private void cancelReconnect() {
        ScheduledFuture<?> current = reconnectTimer;
        reconnectTimer = null;
        if (current != null) {
            current.cancel(false);
        }
    }

    private ObjectNode subscribeMessage(String channel, ObjectNode payload) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("type", "subscribe");
        message.put("channel", channel);
        message.put("id", String.valueOf(messageIds.incrementAndGet()));
        message.set("payload", payload);
        return message;
    }

    private void send(ObjectNode message) {
        WebSocket current = socket;
        if (current == null) {
            return;
        }
        try {
            current.send(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            log.error("Could not encode outbound message", e);
        }
    }

    private final class SocketListener extends WebSocketListener {

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            eventLoop.execute(() -> MarketConnectionManager.this.onOpen(webSocket));
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            eventLoop.execute(() -> onText(webSocket, text));
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            eventLoop.execute(() -> {
                if (webSocket == socket) {
                    state = ConnectionState.CLOSING;
                }
            });
            webSocket.close(1000, null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            eventLoop.execute(() -> onDisconnect(webSocket, false, code + " " + reason));
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            eventLoop.execute(() -> {
                if (webSocket == socket) {
                    state = ConnectionState.ERROR;
                }
                onDisconnect(webSocket, true, String.valueOf(t.getMessage()));
            });
        }
    }
}
