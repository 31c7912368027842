package com.polymarket.signals.config;

import com.polymarket.signals.domain.ExecutionStrategy;

/**
 * Baseline values for the flash-move pipeline. Any {@code signals.flash.*} key
 * left unset falls back to the selected preset.
 */
public enum FlashPreset {

    DEFAULT(0.03, 0.02, 3.0, 50.0, 0.02, 0.10, 0.20, 3, ExecutionStrategy.ADAPTIVE),
    CONSERVATIVE(0.05, 0.03, 4.0, 25.0, 0.01, 0.05, 0.15, 1, ExecutionStrategy.CONSERVATIVE),
    AGGRESSIVE(0.02, 0.015, 2.0, 100.0, 0.03, 0.15, 0.30, 5, ExecutionStrategy.AGGRESSIVE);

    final double velocityThreshold;
    final double momentumThreshold;
    final double volumeSpikeMultiplier;
    final double baseTradeSize;
    final double maxSlippagePercent;
    final double stopLossPercent;
    final double takeProfitPercent;
    final int maxConcurrentTrades;
    final ExecutionStrategy preferredStrategy;

    FlashPreset(double velocityThreshold, double momentumThreshold, double volumeSpikeMultiplier,
            double baseTradeSize, double maxSlippagePercent, double stopLossPercent,
            double takeProfitPercent, int maxConcurrentTrades, ExecutionStrategy preferredStrategy) {
        this.velocityThreshold = velocityThreshold;
        this.momentumThreshold = momentumThreshold;
        this.volumeSpikeMultiplier = volumeSpikeMultiplier;
        this.baseTradeSize = baseTradeSize;
        this.maxSlippagePercent = maxSlippagePercent;
        this.stopLossPercent = stopLossPercent;
        this.takeProfitPercent = takeProfitPercent;
        this.maxConcurrentTrades = maxConcurrentTrades;
        this.preferredStrategy = preferredStrategy;
    }
}
