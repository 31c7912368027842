package com.polymarket.signals.flash;

import com.polymarket.signals.domain.ExecutionStrategy;
import com.polymarket.signals.domain.OrderSide;
import com.polymarket.signals.domain.OrderType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TradeOrder {
    String tokenId;
    String conditionId;
    OrderSide side;
    double limitPrice; // clamped to [0.01, 0.99]
    double sizeUsd;
    OrderType orderType;
    ExecutionStrategy strategy;
}
