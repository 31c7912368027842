package com.polymarket.signals.flash;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Paper executor: logs the order and reports a full fill at the limit price.
 */
@Slf4j
@Component
public class WatchOnlyTradeExecutor implements TradeExecutor {

    @Override
    public CompletableFuture<TradeExecution> submit(TradeOrder order) {
        if (order.getLimitPrice() <= 0 || order.getSizeUsd() <= 0) {
            return CompletableFuture.completedFuture(TradeExecution.failed("Invalid order parameters"));
        }
        String orderId = "watch-" + UUID.randomUUID();
        double shares = order.getSizeUsd() / order.getLimitPrice();
        log.info("[WATCH-ONLY] {} {} {} ${} @ {} -> {} shares ({})", order.getOrderType(), order.getSide(),
                order.getTokenId(), String.format("%.2f", order.getSizeUsd()), order.getLimitPrice(),
                String.format("%.4f", shares), orderId);
        return CompletableFuture.completedFuture(TradeExecution.builder()
                .success(true)
                .orderId(orderId)
                .sharesFilled(shares)
                .priceFilled(order.getLimitPrice())
                .build());
    }
}
