package com.polymarket.signals.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ArbitrageOpportunity {
    String marketId;
    String question;

    // Summary metrics
    BigDecimal combinedCost;
    BigDecimal potentialProfit; // per full set, 1 - combinedCost
    BigDecimal roi; // percent of combined cost
    BigDecimal capacityUsd;
    Instant detectedAt;

    List<Leg> legs;

    @Value
    @Builder
    public static class Leg {
        String tokenId;
        String outcome;
        BigDecimal price;
        BigDecimal depth;
    }
}
