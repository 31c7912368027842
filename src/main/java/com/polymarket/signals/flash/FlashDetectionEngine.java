package com.polymarket.signals.flash;

import com.polymarket.signals.config.SignalProperties;
import com.polymarket.signals.core.MarketStateStore;
import com.polymarket.signals.domain.EnhancedFlashMoveEvent;
import com.polymarket.signals.domain.ExecutionStrategy;
import com.polymarket.signals.domain.MarketSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Per-asset rolling window analytics: velocity over the window, micro-tick
 * velocity over the last 500 ms, directional momentum and trade volume spike.
 * Runs on the market event loop only.
 */
@Slf4j
@Service
public class FlashDetectionEngine {

    static final String UNKNOWN_MARKET = "Unknown Market";

    private static final int VOLUME_HISTORY = 20;
    private static final int VOLUME_BASELINE = 5;

    private final MarketStateStore store;
    private final SignalProperties.Flash config;
    private final Clock clock;

    private final Map<String, Deque<Sample>> priceHistory = new HashMap<>();
    private final Map<String, Deque<Double>> volumeHistory = new HashMap<>();
    private final Map<String, Long> lastEmittedAt = new HashMap<>();

    public FlashDetectionEngine(MarketStateStore store, SignalProperties properties, Clock clock) {
        this.store = store;
        this.config = properties.flash();
        this.clock = clock;
    }

    /**
     * Records a sample and returns a flash move event if one is detected.
     *
     * @param volume trade size, {@code null} for quote ticks
     * @param bestBid best bid of the quote, {@code null} for trade ticks
     * @param bestAsk best ask of the quote, {@code null} for trade ticks
     */
    public Optional<EnhancedFlashMoveEvent> detect(String tokenId, double price, Double volume, Double bestBid,
            Double bestAsk) {
        if (price <= 0) {
            return Optional.empty();
        }
        long now = clock.millis();

        Deque<Sample> history = priceHistory.computeIfAbsent(tokenId, id -> new ArrayDeque<>());
        history.addLast(new Sample(price, now));
        while (history.size() > config.maxSamples()) {
            history.removeFirst();
        }
        long retentionCutoff = now - config.historyRetentionMillis();
        while (history.size() > 1 && history.peekFirst().timestamp() <= retentionCutoff) {
            history.removeFirst();
        }

        double volumeSpike = volumeSpike(tokenId, volume);

        if (history.size() < 2) {
            return Optional.empty();
        }

        Sample oldest = history.peekFirst();
        double velocity = (price - oldest.price()) / oldest.price();
        double microVelocity = microVelocity(history, price, now);
        double momentum = momentum(history);
        double imbalance = imbalance(bestBid, bestAsk);

        boolean velocityTriggered = Math.abs(velocity) >= config.velocityThreshold();
        boolean microTriggered = Math.abs(microVelocity) >= config.microTickThreshold();
        if (!velocityTriggered && !microTriggered) {
            return Optional.empty();
        }

        Long last = lastEmittedAt.get(tokenId);
        if (last != null && now - last < config.cooldownMillis()) {
            log.debug("Flash move on {} suppressed, still cooling down", tokenId);
            return Optional.empty();
        }

        double confidence = confidence(velocity, microTriggered, momentum, volumeSpike, history.size());
        double riskScore = preliminaryRisk(velocity, momentum, volumeSpike);
        String trigger = microTriggered ? "micro-tick" : "velocity";

        EnhancedFlashMoveEvent.EnhancedFlashMoveEventBuilder event = EnhancedFlashMoveEvent.builder()
                .tokenId(tokenId)
                .oldPrice(oldest.price())
                .newPrice(price)
                .velocity(velocity)
                .microVelocity(microVelocity)
                .momentum(momentum)
                .volumeSpike(volumeSpike)
                .imbalance(imbalance)
                .confidence(confidence)
                .sampleCount(history.size())
                .timestamp(Instant.ofEpochMilli(now))
                .trigger(trigger)
                .strategy(provisionalStrategy(confidence))
                .riskScore(riskScore);
        enrich(tokenId, event);
        EnhancedFlashMoveEvent detected = event.build();

        lastEmittedAt.put(tokenId, now);
        log.info("🔴 FLASH MOVE DETECTED [{}]: {} (Velocity: {}%, Confidence: {}%)", trigger,
                detected.getQuestion(), String.format("%.2f", velocity * 100),
                String.format("%.1f", confidence * 100));
        return Optional.of(detected);
    }

    /**
     * Drops samples past retention, then empty histories and expired
     * cooldowns.
     */
    public void cleanup() {
        long now = clock.millis();
        long cutoff = now - config.historyRetentionMillis();
        Iterator<Map.Entry<String, Deque<Sample>>> it = priceHistory.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Deque<Sample>> entry = it.next();
            entry.getValue().removeIf(s -> s.timestamp() <= cutoff);
            if (entry.getValue().isEmpty()) {
                it.remove();
                volumeHistory.remove(entry.getKey());
            }
        }
        lastEmittedAt.values().removeIf(at -> now - at >= config.cooldownMillis());
    }

    int trackedAssets() {
        return priceHistory.size();
    }

    private double volumeSpike(String tokenId, Double volume) {
        if (volume == null || volume <= 0) {
            return 1.0;
        }
        Deque<Double> volumes = volumeHistory.computeIfAbsent(tokenId, id -> new ArrayDeque<>());
        double spike = 1.0;
        if (volumes.size() >= VOLUME_BASELINE) {
            double sum = 0;
            Iterator<Double> recent = volumes.descendingIterator();
            for (int i = 0; i < VOLUME_BASELINE; i++) {
                sum += recent.next();
            }
            double mean = sum / VOLUME_BASELINE;
            if (mean > 0) {
                spike = volume / mean;
            }
        }
        volumes.addLast(volume);
        while (volumes.size() > VOLUME_HISTORY) {
            volumes.removeFirst();
        }
        return spike;
    }

    /**
     * Bid over ask of the latest quote as a proxy for book pressure; 1.0 when
     * either side is missing.
     */
    static double imbalance(Double bestBid, Double bestAsk) {
        if (bestBid == null || bestAsk == null || bestBid <= 0 || bestAsk <= 0) {
            return 1.0;
        }
        return bestBid / bestAsk;
    }

    private double microVelocity(Deque<Sample> history, double price, long now) {
        for (Sample sample : history) {
            if (now - sample.timestamp() < config.microWindowMillis()) {
                return sample.price() == price ? 0 : (price - sample.price()) / sample.price();
            }
        }
        return 0;
    }

    /**
     * Per-second rate across the last three samples, or 0 when the two
     * most recent changes disagree in direction.
     */
    private static double momentum(Deque<Sample> history) {
        if (history.size() < 3) {
            return 0;
        }
        Iterator<Sample> recent = history.descendingIterator();
        Sample c = recent.next();
        Sample b = recent.next();
        Sample a = recent.next();
        double first = b.price() - a.price();
        double second = c.price() - b.price();
        if (first == 0 || Math.signum(first) != Math.signum(second)) {
            return 0;
        }
        long span = c.timestamp() - a.timestamp();
        if (span <= 0) {
            return 0;
        }
        return (c.price() - a.price()) / span * 1000;
    }

    private double confidence(double velocity, boolean microTriggered, double momentum, double volumeSpike,
            int samples) {
        double clarity = 0;
        double absVelocity = Math.abs(velocity);
        if (absVelocity >= config.velocityThreshold()) {
            clarity += 0.3;
            clarity += 0.2 * Math.min(1.0, absVelocity / config.velocityThreshold() - 1);
        }
        if (microTriggered) {
            clarity += 0.5;
        }
        if (Math.abs(momentum) >= config.momentumThreshold()) {
            clarity += 0.1;
        }
        if (volumeSpike >= config.volumeSpikeMultiplier()) {
            clarity += 0.1;
        }
        clarity = Math.min(clarity, 1.0);
        double depth = Math.min(1.0, (double) samples / config.fullConfidenceSamples());
        return clarity * (0.5 + 0.5 * depth);
    }

    private static ExecutionStrategy provisionalStrategy(double confidence) {
        if (confidence > 0.8) {
            return ExecutionStrategy.AGGRESSIVE;
        }
        if (confidence < 0.5) {
            return ExecutionStrategy.CONSERVATIVE;
        }
        return ExecutionStrategy.ADAPTIVE;
    }

    private static double preliminaryRisk(double velocity, double momentum, double volumeSpike) {
        double risk = Math.abs(velocity) * 2 + Math.abs(momentum) * 1.5;
        if (volumeSpike > 5) {
            risk += volumeSpike * 0.5;
        }
        return Math.min(risk, 100);
    }

    private void enrich(String tokenId, EnhancedFlashMoveEvent.EnhancedFlashMoveEventBuilder event) {
        Optional<MarketSnapshot> market = store.findByToken(tokenId);
        if (market.isPresent()) {
            MarketSnapshot snapshot = market.get();
            event.conditionId(snapshot.getMarketId())
                    .question(snapshot.getQuestion())
                    .image(snapshot.getImage() != null ? snapshot.getImage() : "")
                    .marketSlug(snapshot.getSlug() != null ? snapshot.getSlug() : "");
        } else {
            event.conditionId("").question(UNKNOWN_MARKET).image("").marketSlug("");
        }
    }

    private record Sample(double price, long timestamp) {
    }
}
