package com.polymarket.signals.flash;

import com.polymarket.signals.config.SignalProperties;
import com.polymarket.signals.core.MarketStateStore;
import com.polymarket.signals.domain.EnhancedFlashMoveEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class FlashDetectionEngineTest {

    private static final long T0 = Instant.parse("2024-05-01T12:00:00Z").toEpochMilli();

    private final AtomicLong now = new AtomicLong(T0);
    private MarketStateStore store;
    private FlashDetectionEngine engine;

    @BeforeEach
    void setUp() {
        Clock clock = mock(Clock.class);
        when(clock.millis()).thenAnswer(invocation -> now.get());
        when(clock.instant()).thenAnswer(invocation -> Instant.ofEpochMilli(now.get()));
        when(clock.getZone()).thenReturn(ZoneOffset.UTC);
        store = new MarketStateStore(clock);
        engine = new FlashDetectionEngine(store, SignalProperties.defaults(), clock);
    }

    @Test
    void singleSampleNeverTriggers() {
        assertTrue(quote("t1", 0.50).isEmpty());
        assertTrue(quote("t1", 0).isEmpty());
    }

    @Test
    void velocityAcrossTheWindowTriggers() {
        quote("t1", 0.50);
        now.addAndGet(1000);
        assertTrue(quote("t1", 0.50).isEmpty());
        now.addAndGet(1000);
        EnhancedFlashMoveEvent event = quote("t1", 0.525).orElseThrow();

        assertEquals("velocity", event.getTrigger());
        assertEquals(0.05, event.getVelocity(), 1e-9);
        assertEquals(0.50, event.getOldPrice(), 1e-9);
        assertEquals(0.525, event.getNewPrice(), 1e-9);
        assertEquals(0, event.getMomentum(), 1e-9);
        assertEquals(3, event.getSampleCount());
        // (0.3 + 0.2 * 2/3) * (0.5 + 0.5 * 3/10)
        assertEquals(0.281667, event.getConfidence(), 1e-6);
        assertEquals(Instant.ofEpochMilli(T0 + 2000), event.getTimestamp());
    }

    @Test
    void smallMoveIsIgnored() {
        quote("t1", 0.50);
        now.addAndGet(1000);
        assertTrue(quote("t1", 0.51).isEmpty());
    }

    @Test
    void fastTickInsideTheMicroWindowTriggers() {
        quote("t1", 0.50);
        now.addAndGet(200);
        EnhancedFlashMoveEvent event = quote("t1", 0.506).orElseThrow();

        assertEquals("micro-tick", event.getTrigger());
        assertEquals(0.012, event.getMicroVelocity(), 1e-9);
    }

    @Test
    void sameMoveSpreadOverSecondsIsNotAMicroTick() {
        quote("t1", 0.50);
        now.addAndGet(800);
        assertTrue(quote("t1", 0.506).isEmpty());
    }

    @Test
    void consistentDirectionProducesMomentum() {
        quote("t1", 0.50);
        now.addAndGet(1000);
        quote("t1", 0.51);
        now.addAndGet(1000);
        EnhancedFlashMoveEvent event = quote("t1", 0.52).orElseThrow();

        assertEquals(0.01, event.getMomentum(), 1e-9);
        assertEquals(0.04, event.getVelocity(), 1e-9);
    }

    @Test
    void cooldownSuppressesRepeatAlerts() {
        quote("t1", 0.50);
        now.addAndGet(1000);
        assertTrue(quote("t1", 0.53).isPresent());

        now.addAndGet(1000);
        assertTrue(quote("t1", 0.56).isEmpty());

        now.addAndGet(9000);
        assertTrue(quote("t1", 0.60).isPresent());
    }

    @Test
    void tradeVolumeSpikeIsMeasuredAgainstRecentTrades() {
        for (int i = 0; i < 5; i++) {
            engine.detect("t1", 0.50, 10.0, null, null);
            now.addAndGet(1000);
        }

        EnhancedFlashMoveEvent event = engine.detect("t1", 0.55, 100.0, null, null).orElseThrow();

        assertEquals(10.0, event.getVolumeSpike(), 1e-9);
    }

    @Test
    void quoteSidesAreReportedAsImbalance() {
        engine.detect("t1", 0.50, null, 0.49, 0.51);
        now.addAndGet(1000);

        EnhancedFlashMoveEvent event = engine.detect("t1", 0.55, null, 0.54, 0.60).orElseThrow();

        assertEquals(0.9, event.getImbalance(), 1e-9);
        assertEquals(1.0, FlashDetectionEngine.imbalance(null, 0.60), 1e-9);
        assertEquals(1.0, FlashDetectionEngine.imbalance(0.54, 0.0), 1e-9);
    }

    @Test
    void eventIsEnrichedFromTheMarketStore() {
        store.onNewMarket("m1", "Will BTC close above 70k?", List.of("t1", "t2"), List.of("Yes", "No"),
                "btc-70k", "https://img/btc.png");
        quote("t1", 0.50);
        now.addAndGet(1000);
        EnhancedFlashMoveEvent known = quote("t1", 0.55).orElseThrow();

        assertEquals("m1", known.getConditionId());
        assertEquals("Will BTC close above 70k?", known.getQuestion());
        assertEquals("btc-70k", known.getMarketSlug());
        assertEquals("https://img/btc.png", known.getImage());

        quote("t9", 0.50);
        now.addAndGet(1000);
        EnhancedFlashMoveEvent unknown = quote("t9", 0.55).orElseThrow();
        assertEquals(FlashDetectionEngine.UNKNOWN_MARKET, unknown.getQuestion());
        assertEquals("", unknown.getConditionId());
    }

    @Test
    void samplesPastRetentionAreDroppedFromTheWindow() {
        quote("t1", 0.40);
        now.addAndGet(301_000);
        quote("t1", 0.50);
        now.addAndGet(1000);

        assertTrue(quote("t1", 0.51).isEmpty());
    }

    @Test
    void cleanupForgetsIdleAssets() {
        quote("t1", 0.50);
        quote("t2", 0.50);
        assertEquals(2, engine.trackedAssets());

        now.addAndGet(300_000);
        engine.cleanup();

        assertEquals(0, engine.trackedAssets());
    }

    private Optional<EnhancedFlashMoveEvent> quote(String tokenId, double price) {
        return engine.detect(tokenId, price, null, null, null);
    }
}
