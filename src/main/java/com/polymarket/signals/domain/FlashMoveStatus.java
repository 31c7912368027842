package com.polymarket.signals.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class FlashMoveStatus {
    boolean enabled;
    int activePositions;
    long totalExecuted;
    double successRate;
    Instant lastDetection;
    PortfolioRiskMetrics portfolioRisk;
}
