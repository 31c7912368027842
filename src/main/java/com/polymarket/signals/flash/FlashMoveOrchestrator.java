package com.polymarket.signals.flash;

import com.polymarket.signals.config.SignalProperties;
import com.polymarket.signals.core.MarketDataListener;
import com.polymarket.signals.domain.EnhancedFlashMoveEvent;
import com.polymarket.signals.domain.FlashMoveResult;
import com.polymarket.signals.domain.FlashMoveStatus;
import com.polymarket.signals.domain.PriceTick;
import com.polymarket.signals.domain.RiskAssessment;
import com.polymarket.signals.domain.TradeTick;
import com.polymarket.signals.events.FlashMoveDetectedEvent;
import com.polymarket.signals.events.FlashMoveExecutedEvent;
import com.polymarket.signals.events.PositionClosedEvent;
import com.polymarket.signals.events.SignalEventPublisher;
import com.polymarket.signals.infra.MarketEventLoop;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Wires the flash pipeline to the market feed: detect, assess, execute,
 * persist and publish. Also marks open positions on every tick and unwinds
 * them when a stop-loss or take-profit level is crossed.
 */
@Slf4j
@Service
public class FlashMoveOrchestrator implements MarketDataListener {

    static final String SERVICE_DISABLED = "Service disabled";

    private final FlashDetectionEngine detectionEngine;
    private final FlashRiskManager riskManager;
    private final FlashExecutionEngine executionEngine;
    private final FlashMoveRepository repository;
    private final SignalEventPublisher publisher;
    private final MarketEventLoop eventLoop;
    private final Clock clock;

    private volatile boolean enabled;
    private volatile Instant lastDetection;

    public FlashMoveOrchestrator(FlashDetectionEngine detectionEngine, FlashRiskManager riskManager,
            FlashExecutionEngine executionEngine, FlashMoveRepository repository, SignalEventPublisher publisher,
            MarketEventLoop eventLoop, Clock clock, SignalProperties properties) {
        this.detectionEngine = detectionEngine;
        this.riskManager = riskManager;
        this.executionEngine = executionEngine;
        this.repository = repository;
        this.publisher = publisher;
        this.eventLoop = eventLoop;
        this.clock = clock;
        this.enabled = properties.flash().enabled();
        log.info("🚀 Flash Move Service initialized ({})", enabled ? "ENABLED" : "DISABLED");
    }

    @Override
    public void onPriceTick(PriceTick tick) {
        if (!enabled || tick.price() == null) {
            return;
        }
        double price = tick.price().doubleValue();
        manageOpenPosition(tick.assetId(), price);
        detectionEngine.detect(tick.assetId(), price, null,
                tick.bestBid() != null ? tick.bestBid().doubleValue() : null,
                tick.bestAsk() != null ? tick.bestAsk().doubleValue() : null)
                .ifPresent(this::process);
    }

    @Override
    public void onTradeTick(TradeTick tick) {
        if (!enabled) {
            return;
        }
        double price = tick.price().doubleValue();
        manageOpenPosition(tick.assetId(), price);
        detectionEngine.detect(tick.assetId(), price, tick.size() != null ? tick.size().doubleValue() : null,
                null, null)
                .ifPresent(this::process);
    }

    /**
     * Runs an event through risk and execution. The returned future completes
     * once the outcome is persisted and published; a vetoed event completes
     * with an empty result.
     */
    CompletableFuture<Optional<FlashMoveResult>> process(EnhancedFlashMoveEvent event) {
        lastDetection = event.getTimestamp();
        riskManager.updatePortfolioMetrics(executionEngine.getActivePositions().values());
        RiskAssessment risk = riskManager.assessRisk(event);
        if (risk.isTooRisky()) {
            log.warn("⚠️ Flash move skipped - {}", risk.getReason());
            return CompletableFuture.completedFuture(Optional.empty());
        }

        return executionEngine.executeFlashMove(event, risk)
                .thenApply(result -> {
                    persist(event, result);
                    publisher.publish(new FlashMoveDetectedEvent(event, risk, result));
                    if (result.isSuccess()) {
                        publisher.publish(new FlashMoveExecutedEvent(event, result,
                                executionEngine.getPosition(event.getTokenId()).orElse(null)));
                    }
                    log.info("⚡ Flash move processed: {} strategy - {}", result.getStrategy(),
                            result.isSuccess() ? "SUCCESS" : "FAILED");
                    if (result.isSuccess() && !enabled) {
                        closePosition(event.getTokenId(), SERVICE_DISABLED);
                    }
                    return Optional.of(result);
                })
                .exceptionally(e -> {
                    log.error("❌ Error processing flash move for {}", event.getTokenId(), e);
                    return Optional.empty();
                });
    }

    public CompletableFuture<Boolean> closePosition(String tokenId, String reason) {
        return executionEngine.closePosition(tokenId, reason).thenApply(closed -> {
            if (closed) {
                publisher.publish(new PositionClosedEvent(tokenId, reason, Instant.now(clock)));
            }
            return closed;
        });
    }

    /**
     * Disabling stops tick processing and unwinds every open position. A
     * position opened by an order still in flight is unwound when that order
     * completes.
     */
    public CompletableFuture<Void> setEnabled(boolean value) {
        log.info("🚀 Flash Move Service {}", value ? "ENABLED" : "DISABLED");
        enabled = value;
        if (value) {
            return CompletableFuture.completedFuture(null);
        }
        List<CompletableFuture<Boolean>> closes = new ArrayList<>();
        for (String tokenId : executionEngine.getActivePositions().keySet()) {
            closes.add(closePosition(tokenId, SERVICE_DISABLED));
        }
        return CompletableFuture.allOf(closes.toArray(new CompletableFuture[0]));
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Scheduled(fixedRate = 60_000, initialDelay = 60_000)
    public void scheduledCleanup() {
        eventLoop.execute(this::cleanup);
    }

    /**
     * Prunes detection, execution and risk state. Each step runs even if an
     * earlier one fails.
     */
    public void cleanup() {
        runCleanup("detection", detectionEngine::cleanup);
        runCleanup("execution", executionEngine::cleanup);
        runCleanup("risk", riskManager::cleanup);
        log.debug("🧹 Flash Move Service cleanup completed");
    }

    public FlashMoveStatus getStatus() {
        FlashExecutionEngine.ExecutionStats stats = executionEngine.getStats();
        return FlashMoveStatus.builder()
                .enabled(enabled)
                .activePositions(executionEngine.getActivePositions().size())
                .totalExecuted(stats.total())
                .successRate(stats.successRate())
                .lastDetection(lastDetection)
                .portfolioRisk(riskManager.getPortfolioMetrics())
                .build();
    }

    private void manageOpenPosition(String tokenId, double price) {
        if (executionEngine.getPosition(tokenId).isEmpty()) {
            return;
        }
        executionEngine.markPrice(tokenId, price);
        executionEngine.exitReason(tokenId).ifPresent(reason -> closePosition(tokenId, reason));
    }

    private void persist(EnhancedFlashMoveEvent event, FlashMoveResult result) {
        try {
            repository.save(new FlashMoveRecord(
                    event.getTokenId(),
                    event.getConditionId(),
                    event.getOldPrice(),
                    event.getNewPrice(),
                    event.getVelocity(),
                    event.getConfidence(),
                    event.getQuestion(),
                    event.getImage(),
                    event.getMarketSlug(),
                    event.getStrategy().label(),
                    event.getRiskScore(),
                    result.isSuccess(),
                    result.getStrategy(),
                    result.getExecutionTimeMillis(),
                    result.getSlippage(),
                    event.getTimestamp()));
        } catch (Exception e) {
            log.error("❌ Failed to persist flash move for {}", event.getTokenId(), e);
        }
    }

    private static void runCleanup(String component, Runnable step) {
        try {
            step.run();
        } catch (Exception e) {
            log.error("❌ {} cleanup failed", component, e);
        }
    }
}
