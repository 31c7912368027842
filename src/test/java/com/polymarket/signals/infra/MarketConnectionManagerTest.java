package com.polymarket.signals.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymarket.signals.config.SignalProperties;
import com.polymarket.signals.core.MarketEventRouter;
import com.polymarket.signals.core.MarketStateStore;
import com.polymarket.signals.events.ConnectionExhaustedEvent;
import com.polymarket.signals.events.MarketListedEvent;
import com.polymarket.signals.events.SignalEventPublisher;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class MarketConnectionManagerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private OkHttpClient httpClient;
    private WebSocket socket;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> heartbeatFuture;
    private ScheduledFuture<?> reconnectFuture;
    private MarketEventRouter router;
    private MarketStateStore store;
    private SignalEventPublisher publisher;
    private MarketConnectionManager manager;

    @BeforeEach
    void setUp() {
        httpClient = mock(OkHttpClient.class);
        socket = mock(WebSocket.class);
        when(httpClient.newWebSocket(any(Request.class), any(WebSocketListener.class))).thenReturn(socket);

        scheduler = EventLoopFixtures.inlineScheduler();
        heartbeatFuture = mock(ScheduledFuture.class);
        reconnectFuture = mock(ScheduledFuture.class);
        doReturn(heartbeatFuture).when(scheduler)
                .scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
        doReturn(reconnectFuture).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));

        router = mock(MarketEventRouter.class);
        store = new MarketStateStore(clock);
        publisher = mock(SignalEventPublisher.class);
        manager = new MarketConnectionManager(httpClient, objectMapper, router, store,
                new MarketEventLoop(scheduler), publisher, clock, SignalProperties.defaults());
    }

    @Test
    void openSubscribesToMarketsChannelAndStartsHeartbeat() throws Exception {
        WebSocketListener listener = startAndCaptureListener();

        listener.onOpen(socket, null);

        assertEquals(ConnectionState.CONNECTED, manager.getState());
        List<JsonNode> sent = sentJson();
        assertEquals(1, sent.size());
        JsonNode subscribe = sent.get(0);
        assertEquals("subscribe", subscribe.path("type").asText());
        assertEquals("markets", subscribe.path("channel").asText());
        assertFalse(subscribe.path("id").asText().isEmpty());
        assertTrue(subscribe.path("payload").isObject());
        verify(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(10_000L), eq(10_000L),
                eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void heartbeatSendsPingWhileConnected() {
        WebSocketListener listener = startAndCaptureListener();
        listener.onOpen(socket, null);

        ArgumentCaptor<Runnable> heartbeat = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleAtFixedRate(heartbeat.capture(), anyLong(), anyLong(), any(TimeUnit.class));
        heartbeat.getValue().run();

        verify(socket).send("PING");
    }

    @Test
    void pongIsDiscardedAndJsonIsRouted() {
        WebSocketListener listener = startAndCaptureListener();
        listener.onOpen(socket, null);

        listener.onMessage(socket, "PONG");
        verify(router, never()).route(any());

        listener.onMessage(socket, "[{\"event_type\":\"best_bid_ask\",\"asset_id\":\"a\"}]");
        ArgumentCaptor<JsonNode> frame = ArgumentCaptor.forClass(JsonNode.class);
        verify(router).route(frame.capture());
        assertTrue(frame.getValue().isArray());
        assertEquals("best_bid_ask", frame.getValue().get(0).path("event_type").asText());
    }

    @Test
    void malformedFrameIsDroppedWithoutClosingTheSocket() {
        WebSocketListener listener = startAndCaptureListener();
        listener.onOpen(socket, null);

        listener.onMessage(socket, "{not json");

        verify(router, never()).route(any());
        verify(socket, never()).close(anyInt(), any());
        assertEquals(ConnectionState.CONNECTED, manager.getState());
    }

    @Test
    void closeStopsHeartbeatAndSchedulesReconnect() {
        WebSocketListener listener = startAndCaptureListener();
        listener.onOpen(socket, null);

        listener.onClosed(socket, 1006, "gone");

        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        verify(heartbeatFuture).cancel(false);
        verify(scheduler).schedule(any(Runnable.class), eq(2000L), eq(TimeUnit.MILLISECONDS));
        assertEquals(1, manager.getReconnectAttempts());
    }

    @Test
    void givesUpAfterTenReconnectAttempts() {
        WebSocketListener listener = startAndCaptureListener();
        ArgumentCaptor<Runnable> timer = ArgumentCaptor.forClass(Runnable.class);

        for (int attempt = 1; attempt <= 10; attempt++) {
            listener.onFailure(socket, new IOException("refused"), null);
            verify(scheduler, times(attempt)).schedule(timer.capture(), anyLong(), eq(TimeUnit.MILLISECONDS));
            timer.getValue().run();
            listener = lastListener();
        }
        listener.onFailure(socket, new IOException("refused"), null);

        ArgumentCaptor<Long> delay = ArgumentCaptor.forClass(Long.class);
        verify(scheduler, times(10)).schedule(any(Runnable.class), delay.capture(), eq(TimeUnit.MILLISECONDS));
        assertEquals(List.of(2000L, 4000L, 8000L, 16000L, 30000L, 30000L, 30000L, 30000L, 30000L, 30000L),
                delay.getAllValues());
        assertTrue(manager.isExhausted());
        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(publisher).publish(event.capture());
        assertInstanceOf(ConnectionExhaustedEvent.class, event.getValue());
        assertEquals(10, ((ConnectionExhaustedEvent) event.getValue()).attempts());
    }

    @Test
    void successfulReconnectResetsTheBackoff() {
        WebSocketListener listener = startAndCaptureListener();
        listener.onOpen(socket, null);
        listener.onClosed(socket, 1006, "gone");

        ArgumentCaptor<Runnable> timer = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(timer.capture(), anyLong(), any(TimeUnit.class));
        timer.getValue().run();
        lastListener().onOpen(socket, null);

        assertEquals(ConnectionState.CONNECTED, manager.getState());
        assertEquals(0, manager.getReconnectAttempts());
    }

    @Test
    void callbacksFromAReplacedSocketAreIgnored() {
        WebSocket replacement = mock(WebSocket.class);
        when(httpClient.newWebSocket(any(Request.class), any(WebSocketListener.class)))
                .thenReturn(socket, replacement);
        WebSocketListener first = startAndCaptureListener();
        first.onFailure(socket, new IOException("reset"), null);

        ArgumentCaptor<Runnable> timer = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(timer.capture(), anyLong(), any(TimeUnit.class));
        timer.getValue().run();

        first.onMessage(socket, "{\"event_type\":\"book\"}");
        first.onClosed(socket, 1000, "late");

        verify(router, never()).route(any());
        verify(scheduler, times(1)).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        assertEquals(ConnectionState.CONNECTING, manager.getState());
    }

    @Test
    void listedMarketIsSubscribedOnTheOrderbookChannel() throws Exception {
        WebSocketListener listener = startAndCaptureListener();
        listener.onOpen(socket, null);
        clearInvocations(socket);

        manager.onMarketListed(new MarketListedEvent("m1", List.of("yes", "no")));

        List<JsonNode> sent = sentJson();
        assertEquals(1, sent.size());
        JsonNode subscribe = sent.get(0);
        assertEquals("orderbook", subscribe.path("channel").asText());
        assertEquals("m1", subscribe.path("payload").path("market").asText());
        assertEquals("yes", subscribe.path("payload").path("asset_ids").get(0).asText());
        assertEquals("no", subscribe.path("payload").path("asset_ids").get(1).asText());
    }

    @Test
    void knownLegsAreResubscribedOnConnect() throws Exception {
        store.onNewMarket("m1", "Will BTC close above 70k?", List.of("yes", "no"), List.of("Yes", "No"), null, null);
        WebSocketListener listener = startAndCaptureListener();

        listener.onOpen(socket, null);

        List<JsonNode> sent = sentJson();
        assertEquals(2, sent.size());
        assertEquals("markets", sent.get(0).path("channel").asText());
        assertEquals("orderbook", sent.get(1).path("channel").asText());
        assertNotEquals(sent.get(0).path("id").asText(), sent.get(1).path("id").asText());
    }

    @Test
    void subscriptionWhileDisconnectedIsDeferred() {
        manager.subscribeAssets("m1", List.of("yes"));

        verify(socket, never()).send(anyString());
    }

    @Test
    void stopCancelsTimersAndPreventsReconnect() {
        WebSocketListener listener = startAndCaptureListener();
        listener.onOpen(socket, null);

        manager.stop();
        listener.onClosed(socket, 1000, "shutdown");

        verify(heartbeatFuture).cancel(false);
        verify(socket).close(1000, "shutdown");
        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
    }

    @Test
    void stopIsOrderedAfterAQueuedStart() throws Exception {
        MarketEventLoop realLoop = new MarketEventLoop();
        try {
            manager = new MarketConnectionManager(httpClient, objectMapper, router, store, realLoop, publisher,
                    clock, SignalProperties.defaults());
            CountDownLatch release = new CountDownLatch(1);
            realLoop.execute(() -> {
                try {
                    release.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            manager.start();
            CompletableFuture<Void> stopped = CompletableFuture.runAsync(manager::stop);
            release.countDown();
            stopped.get(5, TimeUnit.SECONDS);

            assertEquals(ConnectionState.DISCONNECTED, manager.getState());
            verify(socket).close(1000, "shutdown");

            lastListener().onOpen(socket, null);
            realLoop.runAndWait(() -> { }, 2_000);

            assertEquals(ConnectionState.DISCONNECTED, manager.getState());
            verify(socket, never()).send(anyString());
        } finally {
            realLoop.shutdown();
        }
    }

    private WebSocketListener startAndCaptureListener() {
        manager.start();
        return lastListener();
    }

    private WebSocketListener lastListener() {
        ArgumentCaptor<WebSocketListener> listener = ArgumentCaptor.forClass(WebSocketListener.class);
        verify(httpClient, atLeastOnce()).newWebSocket(any(Request.class), listener.capture());
        return listener.getValue();
    }

    private List<JsonNode> sentJson() throws Exception {
        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(socket, atLeastOnce()).send(text.capture());
        List<JsonNode> frames = new ArrayList<>();
        for (String value : text.getAllValues()) {
            frames.add(objectMapper.readTree(value));
        }
        return frames;
    }
}
