package com.polymarket.signals.flash;

import java.time.Instant;

/**
 * Flat, storable view of one processed flash move and its execution outcome.
 */
public record FlashMoveRecord(
        String tokenId,
        String conditionId,
        double oldPrice,
        double newPrice,
        double velocity,
        double confidence,
        String question,
        String image,
        String marketSlug,
        String detectedStrategy,
        double riskScore,
        boolean executed,
        String executionStrategy,
        long executionTimeMillis,
        Double slippage,
        Instant timestamp) {
}
