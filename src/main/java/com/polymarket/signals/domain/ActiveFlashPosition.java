package com.polymarket.signals.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ActiveFlashPosition {
    private String tokenId;
    private String conditionId;
    private String orderId;
    private OrderSide side;
    private ExecutionStrategy strategy;

    private double entryPrice;
    private Double currentPrice; // null until the first mark after entry
    private double shares;
    private double sizeUsd;
    private double stopLoss;
    private double takeProfit;
    private Instant openedAt;

    private State state;

    public double markPrice() {
        return currentPrice != null ? currentPrice : entryPrice;
    }

    public double exposure() {
        return shares * markPrice();
    }

    public enum State {
        OPENED,
        CLOSING,
        CLOSED
    }
}
