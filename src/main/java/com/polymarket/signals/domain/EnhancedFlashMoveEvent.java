package com.polymarket.signals.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class EnhancedFlashMoveEvent {
    String tokenId;
    String conditionId;
    double oldPrice;
    double newPrice;
    double velocity; // fractional change across the window
    double microVelocity; // fractional change across the micro window
    double momentum; // per-second rate over the last three samples
    double volumeSpike; // 1.0 is neutral
    double imbalance; // best bid / best ask of the triggering quote, 1.0 when unknown
    double confidence; // 0..1
    int sampleCount;
    Instant timestamp;

    String question;
    String image;
    String marketSlug;

    String trigger; // "velocity" or "micro-tick"
    ExecutionStrategy strategy; // provisional, refined by the risk manager
    double riskScore; // preliminary, detector-side
}
