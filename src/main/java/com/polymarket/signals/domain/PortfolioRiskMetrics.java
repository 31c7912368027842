package com.polymarket.signals.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PortfolioRiskMetrics {

    public static final PortfolioRiskMetrics EMPTY = PortfolioRiskMetrics.builder().build();

    double totalExposure;
    int concurrentPositions;
    double maxSinglePosition;
    double riskScore;
    double correlationRisk;
}
