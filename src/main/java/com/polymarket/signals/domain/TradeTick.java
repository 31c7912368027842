package com.polymarket.signals.domain;

import java.math.BigDecimal;
import java.time.Instant;

public record TradeTick(
        String assetId,
        BigDecimal price,
        BigDecimal size,
        OrderSide side,
        Instant timestamp) {
}
