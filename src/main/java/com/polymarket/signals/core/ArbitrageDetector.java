package com.polymarket.signals.core;

import com.polymarket.signals.config.SignalProperties;
import com.polymarket.signals.domain.ArbitrageOpportunity;
import com.polymarket.signals.domain.MarketSnapshot;
import com.polymarket.signals.domain.OutcomeLeg;
import com.polymarket.signals.events.ArbitrageOpportunityEvent;
import com.polymarket.signals.events.SignalEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sum-of-asks arbitrage: buying one share of every outcome of a market costs
 * {@code sum(bestAsk)} and pays out exactly 1 at resolution.
 */
@Slf4j
@Service
public class ArbitrageDetector {

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int SCALE = 8;

    private final SignalProperties.Arbitrage config;
    private final SignalEventPublisher publisher;
    private final Clock clock;

    private final Map<String, ArbitrageOpportunity> opportunities = new ConcurrentHashMap<>();

    public ArbitrageDetector(SignalProperties properties, SignalEventPublisher publisher, Clock clock) {
        this.config = properties.arbitrage();
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Evaluates one market and publishes the opportunity when it is new or its
     * ROI improved by more than the hysteresis margin.
     *
     * @return the opportunity that was emitted, if any
     */
    public Optional<ArbitrageOpportunity> analyze(MarketSnapshot market) {
        if (market.getState() == MarketSnapshot.State.RESOLVED) {
            withdraw(market.getMarketId());
            return Optional.empty();
        }
        if (!market.hasAllLegs() || market.getOutcomes().isEmpty()) {
            return Optional.empty();
        }

        BigDecimal cost = BigDecimal.ZERO;
        BigDecimal minSize = null;
        List<ArbitrageOpportunity.Leg> legs = new ArrayList<>();
        for (OutcomeLeg leg : market.getOutcomes().values()) {
            BigDecimal price = leg.getPrice();
            // a leg without a usable ask invalidates the whole set
            if (price == null || price.signum() <= 0 || price.compareTo(BigDecimal.ONE) >= 0) {
                return Optional.empty();
            }
            cost = cost.add(price);
            BigDecimal size = leg.getSize() == null ? BigDecimal.ZERO : leg.getSize();
            minSize = minSize == null ? size : minSize.min(size);
            legs.add(ArbitrageOpportunity.Leg.builder()
                    .tokenId(leg.getTokenId())
                    .outcome(leg.getOutcome())
                    .price(price)
                    .depth(size)
                    .build());
        }

        if (cost.compareTo(config.minCombinedCost()) <= 0 || cost.compareTo(config.maxCombinedCost()) >= 0) {
            return Optional.empty();
        }

        BigDecimal profit = BigDecimal.ONE.subtract(cost);
        BigDecimal roi = profit.multiply(HUNDRED).divide(cost, SCALE, RoundingMode.HALF_UP);
        BigDecimal minRoi = market.isCrypto() ? config.minRoiCryptoPercent() : config.minRoiPercent();
        if (roi.compareTo(minRoi) < 0) {
            return Optional.empty();
        }

        ArbitrageOpportunity opportunity = ArbitrageOpportunity.builder()
                .marketId(market.getMarketId())
                .question(market.getQuestion())
                .combinedCost(cost)
                .potentialProfit(profit)
                .roi(roi)
                .capacityUsd(minSize.multiply(cost))
                .detectedAt(Instant.now(clock))
                .legs(List.copyOf(legs))
                .build();

        ArbitrageOpportunity previous = opportunities.get(market.getMarketId());
        if (previous != null && roi.compareTo(previous.getRoi().add(config.roiHysteresisPercent())) <= 0) {
            // the stored record and its timestamp stay as they are
            log.debug("Opportunity on {} not materially improved (roi {} vs {})",
                    market.getMarketId(), roi, previous.getRoi());
            return Optional.empty();
        }
        opportunities.put(market.getMarketId(), opportunity);

        log.info("💰 ARBITRAGE: [{}] cost={} profit={} roi={}%",
                market.getQuestion(), cost, profit, roi.setScale(2, RoundingMode.HALF_UP));
        publisher.publish(new ArbitrageOpportunityEvent(opportunity));
        return Optional.of(opportunity);
    }

    public void withdraw(String marketId) {
        if (opportunities.remove(marketId) != null) {
            log.info("Withdrew opportunity on resolved market {}", marketId);
        }
    }

    /**
     * Drops opportunities older than the configured max age and returns the
     * survivors by descending ROI.
     */
    public List<ArbitrageOpportunity> getLatestOpportunities() {
        Instant cutoff = Instant.now(clock).minus(Duration.ofMillis(config.maxAgeMillis()));
        opportunities.values().removeIf(o -> !o.getDetectedAt().isAfter(cutoff));
        return opportunities.values().stream()
                .sorted(Comparator.comparing(ArbitrageOpportunity::getRoi).reversed())
                .toList();
    }
}
