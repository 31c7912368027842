package com.polymarket.signals.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A quote-derived price for one asset. {@code price} is the mid when both
 * sides are usable, otherwise the last trade or best ask.
 */
public record PriceTick(
        String marketId,
        String assetId,
        BigDecimal bestBid,
        BigDecimal bestAsk,
        BigDecimal price,
        Instant timestamp) {
}
