package com.polymarket.signals.flash;

import com.polymarket.signals.config.SignalProperties;
import com.polymarket.signals.domain.ActiveFlashPosition;
import com.polymarket.signals.domain.EnhancedFlashMoveEvent;
import com.polymarket.signals.domain.ExecutionStrategy;
import com.polymarket.signals.domain.FlashMoveResult;
import com.polymarket.signals.domain.OrderSide;
import com.polymarket.signals.domain.OrderType;
import com.polymarket.signals.domain.RiskAssessment;
import com.polymarket.signals.infra.MarketEventLoop;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns approved flash moves into orders and owns the resulting positions.
 * State is mutated on the market event loop only; executor callbacks are
 * hopped back onto it.
 */
@Slf4j
@Service
public class FlashExecutionEngine {

    static final double MIN_LIMIT_PRICE = 0.01;
    static final double MAX_LIMIT_PRICE = 0.99;

    private final TradeExecutor tradeExecutor;
    private final MarketEventLoop eventLoop;
    private final SignalProperties.Flash config;
    private final Clock clock;

    private final Map<String, ActiveFlashPosition> activePositions = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private volatile long executionCount;
    private volatile long successCount;

    public FlashExecutionEngine(TradeExecutor tradeExecutor, MarketEventLoop eventLoop, SignalProperties properties,
            Clock clock) {
        this.tradeExecutor = tradeExecutor;
        this.eventLoop = eventLoop;
        this.config = properties.flash();
        this.clock = clock;
    }

    /**
     * Places the order for an approved flash move. Never completes
     * exceptionally; refusals and failures come back as
     * {@code success == false}.
     */
    public CompletableFuture<FlashMoveResult> executeFlashMove(EnhancedFlashMoveEvent event, RiskAssessment risk) {
        long startedAt = clock.millis();
        String tokenId = event.getTokenId();

        if (activePositions.containsKey(tokenId)) {
            return refuse("duplicate", "Position already open for " + tokenId, startedAt);
        }
        if (inFlight.contains(tokenId)) {
            return refuse("in-flight", "Execution already in flight for " + tokenId, startedAt);
        }
        int committed = activePositions.size() + inFlight.size();
        if (committed >= config.maxConcurrentTrades()) {
            return refuse("limited", "Max concurrent trades reached (" + committed + ")", startedAt);
        }

        ExecutionStrategy strategy = risk.getRecommendedStrategy();
        TradeOrder order = buildOrder(event, risk, strategy);

        inFlight.add(tokenId);
        executionCount++;
        CompletableFuture<TradeExecution> submitted;
        try {
            submitted = tradeExecutor.submit(order);
        } catch (RuntimeException e) {
            inFlight.remove(tokenId);
            log.error("❌ Flash execution failed for {}", tokenId, e);
            return CompletableFuture.completedFuture(
                    FlashMoveResult.refused("error", String.valueOf(e.getMessage()), clock.millis() - startedAt));
        }

        return submitted.handleAsync((execution, error) -> {
            inFlight.remove(tokenId);
            long elapsed = clock.millis() - startedAt;
            if (error != null) {
                log.error("❌ Flash execution failed for {}", tokenId, error);
                return FlashMoveResult.refused("error", String.valueOf(error.getMessage()), elapsed);
            }
            if (execution == null || !execution.isSuccess()) {
                String reason = execution != null ? execution.getError() : "No execution report";
                log.warn("Flash order rejected for {}: {}", tokenId, reason);
                return FlashMoveResult.refused(strategy.label(), reason, elapsed);
            }

            ActiveFlashPosition position = openPosition(event, order, execution, strategy);
            successCount++;
            log.info("⚡ FLASH EXECUTED: {} strategy on {} - Order: {}", strategy.label(), event.getQuestion(),
                    execution.getOrderId());
            return FlashMoveResult.builder()
                    .success(true)
                    .orderId(execution.getOrderId())
                    .sharesFilled(position.getShares())
                    .priceFilled(position.getEntryPrice())
                    .strategy(strategy.label())
                    .executionTimeMillis(elapsed)
                    .slippage(Math.abs(order.getLimitPrice() - position.getEntryPrice()) / order.getLimitPrice())
                    .build();
        }, eventLoop);
    }

    public Map<String, ActiveFlashPosition> getActivePositions() {
        return Map.copyOf(activePositions);
    }

    public Optional<ActiveFlashPosition> getPosition(String tokenId) {
        return Optional.ofNullable(activePositions.get(tokenId));
    }

    public void markPrice(String tokenId, double price) {
        ActiveFlashPosition position = activePositions.get(tokenId);
        if (position != null) {
            position.setCurrentPrice(price);
        }
    }

    /**
     * Whether an open position has crossed its stop-loss or take-profit
     * level at its current mark.
     *
     * @return the close reason, if any
     */
    public Optional<String> exitReason(String tokenId) {
        ActiveFlashPosition position = activePositions.get(tokenId);
        if (position == null || position.getState() != ActiveFlashPosition.State.OPENED) {
            return Optional.empty();
        }
        double mark = position.markPrice();
        boolean longSide = position.getSide() == OrderSide.BUY;
        if (longSide ? mark <= position.getStopLoss() : mark >= position.getStopLoss()) {
            return Optional.of("Stop loss");
        }
        if (longSide ? mark >= position.getTakeProfit() : mark <= position.getTakeProfit()) {
            return Optional.of("Take profit");
        }
        return Optional.empty();
    }

    /**
     * Unwinds a position with an opposite-side order. Completes {@code false}
     * for an unknown position or one already being closed; a failed unwind
     * leaves the position open.
     */
    public CompletableFuture<Boolean> closePosition(String tokenId, String reason) {
        ActiveFlashPosition position = activePositions.get(tokenId);
        if (position == null || position.getState() != ActiveFlashPosition.State.OPENED) {
            return CompletableFuture.completedFuture(false);
        }
        position.setState(ActiveFlashPosition.State.CLOSING);

        TradeOrder unwind = TradeOrder.builder()
                .tokenId(tokenId)
                .conditionId(position.getConditionId())
                .side(position.getSide().opposite())
                .limitPrice(clampLimit(position.markPrice()))
                .sizeUsd(position.exposure())
                .orderType(OrderType.GTC)
                .strategy(position.getStrategy())
                .build();

        CompletableFuture<TradeExecution> submitted;
        try {
            submitted = tradeExecutor.submit(unwind);
        } catch (RuntimeException e) {
            position.setState(ActiveFlashPosition.State.OPENED);
            log.error("❌ Failed to close position {}", tokenId, e);
            return CompletableFuture.completedFuture(false);
        }

        return submitted.handleAsync((execution, error) -> {
            if (error != null || execution == null || !execution.isSuccess()) {
                position.setState(ActiveFlashPosition.State.OPENED);
                log.error("❌ Failed to close position {}: {}", tokenId,
                        error != null ? error.getMessage() : execution != null ? execution.getError() : "no report");
                return false;
            }
            position.setState(ActiveFlashPosition.State.CLOSED);
            activePositions.remove(tokenId, position);
            log.info("🎯 POSITION CLOSED: {} for {}", reason, tokenId);
            return true;
        }, eventLoop);
    }

    public ExecutionStats getStats() {
        double rate = executionCount > 0 ? (double) successCount / executionCount * 100 : 0;
        return new ExecutionStats(executionCount, successCount, rate);
    }

    /**
     * Stops tracking positions older than the configured max age.
     */
    public void cleanup() {
        Instant cutoff = Instant.now(clock).minusMillis(config.positionMaxAgeMillis());
        activePositions.values().removeIf(position -> {
            if (position.getOpenedAt().isBefore(cutoff)) {
                log.warn("🧹 Cleaned up expired position for {}", position.getTokenId());
                return true;
            }
            return false;
        });
    }

    TradeOrder buildOrder(EnhancedFlashMoveEvent event, RiskAssessment risk, ExecutionStrategy strategy) {
        OrderSide side = event.getVelocity() > 0 ? OrderSide.BUY : OrderSide.SELL;
        double slippage = risk.getMaxSlippage();
        double limit = side == OrderSide.BUY
                ? event.getNewPrice() * (1 + slippage)
                : event.getNewPrice() * (1 - slippage);

        OrderType orderType = switch (strategy) {
            case AGGRESSIVE -> OrderType.FAK;
            case CONSERVATIVE -> OrderType.FOK;
            case ADAPTIVE -> event.getConfidence() > 0.7 ? OrderType.FAK : OrderType.FOK;
        };

        return TradeOrder.builder()
                .tokenId(event.getTokenId())
                .conditionId(event.getConditionId())
                .side(side)
                .limitPrice(clampLimit(limit))
                .sizeUsd(risk.getPositionSize())
                .orderType(orderType)
                .strategy(strategy)
                .build();
    }

    private ActiveFlashPosition openPosition(EnhancedFlashMoveEvent event, TradeOrder order, TradeExecution execution,
            ExecutionStrategy strategy) {
        double entry = execution.getPriceFilled() != null ? execution.getPriceFilled() : order.getLimitPrice();
        double shares = execution.getSharesFilled() != null ? execution.getSharesFilled() : order.getSizeUsd() / entry;
        boolean longSide = order.getSide() == OrderSide.BUY;

        ActiveFlashPosition position = ActiveFlashPosition.builder()
                .tokenId(event.getTokenId())
                .conditionId(event.getConditionId())
                .orderId(execution.getOrderId())
                .side(order.getSide())
                .strategy(strategy)
                .entryPrice(entry)
                .shares(shares)
                .sizeUsd(order.getSizeUsd())
                .stopLoss(longSide ? entry * (1 - config.stopLossPercent()) : entry * (1 + config.stopLossPercent()))
                .takeProfit(longSide ? entry * (1 + config.takeProfitPercent()) : entry * (1 - config.takeProfitPercent()))
                .openedAt(Instant.now(clock))
                .state(ActiveFlashPosition.State.OPENED)
                .build();
        activePositions.put(event.getTokenId(), position);
        return position;
    }

    private CompletableFuture<FlashMoveResult> refuse(String code, String message, long startedAt) {
        log.info("Flash move refused: {}", message);
        return CompletableFuture.completedFuture(FlashMoveResult.refused(code, message, clock.millis() - startedAt));
    }

    private static double clampLimit(double price) {
        return Math.max(MIN_LIMIT_PRICE, Math.min(MAX_LIMIT_PRICE, price));
    }

    public record ExecutionStats(long total, long successful, double successRate) {
    }
}
