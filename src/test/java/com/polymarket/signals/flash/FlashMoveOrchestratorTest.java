package com.polymarket.signals.flash;

import com.polymarket.signals.config.FlashPreset;
import com.polymarket.signals.config.SignalProperties;
import com.polymarket.signals.domain.EnhancedFlashMoveEvent;
import com.polymarket.signals.domain.ExecutionStrategy;
import com.polymarket.signals.domain.FlashMoveResult;
import com.polymarket.signals.domain.FlashMoveStatus;
import com.polymarket.signals.domain.OrderSide;
import com.polymarket.signals.domain.PriceTick;
import com.polymarket.signals.domain.TradeTick;
import com.polymarket.signals.events.FlashMoveDetectedEvent;
import com.polymarket.signals.events.FlashMoveExecutedEvent;
import com.polymarket.signals.events.PositionClosedEvent;
import com.polymarket.signals.events.SignalEventPublisher;
import com.polymarket.signals.infra.EventLoopFixtures;
import com.polymarket.signals.infra.MarketEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class FlashMoveOrchestratorTest {

    private static final Instant NOON = Instant.parse("2024-05-01T12:00:00Z");

    private final Clock clock = Clock.fixed(NOON, ZoneOffset.UTC);
    private final SignalProperties enabled =
            new SignalProperties(null, null, null, SignalProperties.Flash.of(FlashPreset.DEFAULT).withEnabled(true));

    private MarketEventLoop eventLoop;
    private FlashDetectionEngine detectionEngine;
    private FlashRiskManager riskManager;
    private TradeExecutor executor;
    private FlashExecutionEngine executionEngine;
    private InMemoryFlashMoveRepository repository;
    private SignalEventPublisher publisher;
    private FlashMoveOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        eventLoop = EventLoopFixtures.inlineLoop();
        detectionEngine = mock(FlashDetectionEngine.class);
        riskManager = new FlashRiskManager(enabled, clock);
        executor = spy(new WatchOnlyTradeExecutor());
        executionEngine = new FlashExecutionEngine(executor, eventLoop, enabled, clock);
        repository = new InMemoryFlashMoveRepository();
        publisher = mock(SignalEventPublisher.class);
        orchestrator = new FlashMoveOrchestrator(detectionEngine, riskManager, executionEngine, repository,
                publisher, eventLoop, clock, enabled);
    }

    @Test
    void approvedMoveIsExecutedPersistedAndAnnounced() {
        Optional<FlashMoveResult> result = orchestrator.process(event("t1", 0.05, 0.9)).join();

        assertTrue(result.orElseThrow().isSuccess());
        assertEquals("aggressive", result.get().getStrategy());

        List<FlashMoveRecord> records = repository.findRecent(10);
        assertEquals(1, records.size());
        assertTrue(records.get(0).executed());
        assertEquals("adaptive", records.get(0).detectedStrategy());

        List<Object> events = published(2);
        assertInstanceOf(FlashMoveDetectedEvent.class, events.get(0));
        FlashMoveExecutedEvent executed = assertInstanceOf(FlashMoveExecutedEvent.class, events.get(1));
        assertEquals("t1", executed.position().getTokenId());
        assertEquals(OrderSide.BUY, executed.position().getSide());
    }

    @Test
    void vetoedMoveIsDroppedSilently() {
        Optional<FlashMoveResult> result = orchestrator.process(event("t1", 0.05, 0.1)).join();

        assertTrue(result.isEmpty());
        assertTrue(repository.findRecent(10).isEmpty());
        verifyNoInteractions(publisher, executor);
    }

    @Test
    void failedExecutionIsRecordedButNotAnnouncedAsExecuted() {
        doReturn(CompletableFuture.completedFuture(TradeExecution.failed("no liquidity")))
                .when(executor).submit(any());

        FlashMoveResult result = orchestrator.process(event("t1", 0.05, 0.9)).join().orElseThrow();

        assertFalse(result.isSuccess());
        assertFalse(repository.findRecent(1).get(0).executed());
        FlashMoveDetectedEvent detected = assertInstanceOf(FlashMoveDetectedEvent.class, published(1).get(0));
        assertSame(result, detected.result());
    }

    @Test
    void persistenceFailureDoesNotStopNotification() {
        FlashMoveRepository failing = mock(FlashMoveRepository.class);
        doThrow(new IllegalStateException("disk full")).when(failing).save(any());
        orchestrator = new FlashMoveOrchestrator(detectionEngine, riskManager, executionEngine, failing,
                publisher, eventLoop, clock, enabled);

        assertTrue(orchestrator.process(event("t1", 0.05, 0.9)).join().isPresent());

        published(2);
    }

    @Test
    void disabledServiceIgnoresTicks() {
        orchestrator = new FlashMoveOrchestrator(detectionEngine, riskManager, executionEngine, repository,
                publisher, eventLoop, clock, SignalProperties.defaults());

        orchestrator.onPriceTick(priceTick("t1", "0.55"));
        orchestrator.onTradeTick(new TradeTick("t1", new BigDecimal("0.55"), BigDecimal.TEN, OrderSide.BUY, NOON));

        assertFalse(orchestrator.isEnabled());
        verifyNoInteractions(detectionEngine);
    }

    @Test
    void detectedTickRunsThroughThePipeline() {
        when(detectionEngine.detect(eq("t1"), anyDouble(), any(), any(), any()))
                .thenReturn(Optional.of(event("t1", 0.05, 0.9)));

        orchestrator.onPriceTick(priceTick("t1", "0.55"));

        verify(detectionEngine).detect("t1", 0.55, null, 0.54, 0.56);
        assertEquals(1, repository.findRecent(10).size());
        assertTrue(executionEngine.getPosition("t1").isPresent());
    }

    @Test
    void tradeTickPassesItsSizeAsVolume() {
        orchestrator.onTradeTick(new TradeTick("t1", new BigDecimal("0.55"), new BigDecimal("120"), OrderSide.BUY,
                NOON));

        verify(detectionEngine).detect("t1", 0.55, 120.0, null, null);
    }

    @Test
    void tickThroughTheStopClosesThePosition() {
        orchestrator.process(event("t1", 0.05, 0.9)).join();
        clearInvocations(publisher);

        // entry 0.505, stop at 0.4545
        orchestrator.onPriceTick(priceTick("t1", "0.40"));

        assertTrue(executionEngine.getPosition("t1").isEmpty());
        verify(publisher).publish(new PositionClosedEvent("t1", "Stop loss", NOON));
    }

    @Test
    void disablingClosesEveryOpenPosition() {
        orchestrator.process(event("t1", 0.05, 0.9)).join();
        orchestrator.process(event("t2", 0.05, 0.9)).join();
        clearInvocations(publisher);

        orchestrator.setEnabled(false).join();

        assertFalse(orchestrator.isEnabled());
        assertTrue(executionEngine.getActivePositions().isEmpty());
        verify(publisher).publish(new PositionClosedEvent("t1", FlashMoveOrchestrator.SERVICE_DISABLED, NOON));
        verify(publisher).publish(new PositionClosedEvent("t2", FlashMoveOrchestrator.SERVICE_DISABLED, NOON));

        orchestrator.setEnabled(true).join();
        assertTrue(orchestrator.isEnabled());
    }

    @Test
    void positionOpenedAfterDisablingIsUnwound() {
        CompletableFuture<TradeExecution> pending = new CompletableFuture<>();
        doReturn(pending).doCallRealMethod().when(executor).submit(any());
        CompletableFuture<Optional<FlashMoveResult>> result = orchestrator.process(event("t1", 0.05, 0.9));

        orchestrator.setEnabled(false).join();
        pending.complete(TradeExecution.builder()
                .success(true)
                .orderId("late")
                .sharesFilled(100.0)
                .priceFilled(0.505)
                .build());

        assertTrue(result.join().orElseThrow().isSuccess());
        assertTrue(executionEngine.getActivePositions().isEmpty());
        verify(publisher).publish(new PositionClosedEvent("t1", FlashMoveOrchestrator.SERVICE_DISABLED, NOON));
    }

    @Test
    void cleanupRunsEveryStepEvenWhenOneFails() {
        FlashRiskManager risk = mock(FlashRiskManager.class);
        FlashExecutionEngine execution = mock(FlashExecutionEngine.class);
        doThrow(new IllegalStateException("corrupt history")).when(detectionEngine).cleanup();
        orchestrator = new FlashMoveOrchestrator(detectionEngine, risk, execution, repository, publisher,
                eventLoop, clock, enabled);

        orchestrator.scheduledCleanup();

        verify(execution).cleanup();
        verify(risk).cleanup();
    }

    @Test
    void statusReflectsExecutions() {
        orchestrator.process(event("t1", 0.05, 0.9)).join();

        FlashMoveStatus status = orchestrator.getStatus();

        assertTrue(status.isEnabled());
        assertEquals(1, status.getActivePositions());
        assertEquals(1, status.getTotalExecuted());
        assertEquals(100, status.getSuccessRate(), 1e-9);
        assertEquals(NOON, status.getLastDetection());
        assertNotNull(status.getPortfolioRisk());
    }

    private List<Object> published(int count) {
        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(publisher, times(count)).publish(events.capture());
        return events.getAllValues();
    }

    private static PriceTick priceTick(String tokenId, String price) {
        BigDecimal mid = new BigDecimal(price);
        return new PriceTick("m1", tokenId, mid.subtract(new BigDecimal("0.01")), mid.add(new BigDecimal("0.01")),
                mid, NOON);
    }

    private static EnhancedFlashMoveEvent event(String tokenId, double velocity, double confidence) {
        return EnhancedFlashMoveEvent.builder()
                .tokenId(tokenId)
                .conditionId("m1")
                .oldPrice(0.50 / (1 + velocity))
                .newPrice(0.50)
                .velocity(velocity)
                .volumeSpike(1.0)
                .confidence(confidence)
                .sampleCount(10)
                .timestamp(NOON)
                .question("Will it rain in Paris?")
                .image("")
                .marketSlug("")
                .trigger("velocity")
                .strategy(ExecutionStrategy.ADAPTIVE)
                .build();
    }
}
