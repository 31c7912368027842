package com.polymarket.signals.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RiskAssessment {
    boolean tooRisky;
    String reason;
    double riskScore; // 0..100
    ExecutionStrategy recommendedStrategy;
    double positionSize; // USDC notional
    double maxSlippage; // fraction, capped at 0.05
}
