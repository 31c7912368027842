package com.polymarket.signals.flash;

import com.polymarket.signals.config.SignalProperties;
import com.polymarket.signals.domain.ActiveFlashPosition;
import com.polymarket.signals.domain.EnhancedFlashMoveEvent;
import com.polymarket.signals.domain.ExecutionStrategy;
import com.polymarket.signals.domain.PortfolioRiskMetrics;
import com.polymarket.signals.domain.RiskAssessment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scores flash move events, applies the hard vetoes and sizes the trade
 * against the current portfolio.
 */
@Slf4j
@Service
public class FlashRiskManager {

    static final double MIN_POSITION_SIZE = 10.0;
    static final double MAX_SLIPPAGE = 0.05;

    private static final int HISTORY_SIZE = 10;
    private static final Duration HISTORY_TTL = Duration.ofHours(1);
    private static final Duration STALE_POSITION_AGE = Duration.ofMinutes(5);
    private static final Duration QUICK_ENTRY_GAP = Duration.ofSeconds(30);

    private final SignalProperties.Flash config;
    private final Clock clock;

    private final Map<String, ScoreHistory> recentAssessments = new ConcurrentHashMap<>();
    private volatile PortfolioRiskMetrics portfolioMetrics = PortfolioRiskMetrics.EMPTY;

    public FlashRiskManager(SignalProperties properties, Clock clock) {
        this.config = properties.flash();
        this.clock = clock;
    }

    public RiskAssessment assessRisk(EnhancedFlashMoveEvent event) {
        double volatilityRisk = Math.abs(event.getVelocity()) * 30;
        double velocityRisk = velocityTier(Math.abs(event.getVelocity()));
        double momentumRisk = momentumTier(Math.abs(event.getMomentum()));
        double volumeRisk = volumeTier(event.getVolumeSpike());
        double timeRisk = timeOfDayRisk(event.getTimestamp());

        double riskScore = Math.min(volatilityRisk + velocityRisk + momentumRisk + volumeRisk + timeRisk, 100);

        String veto = vetoReason(riskScore, event);
        String reason = veto != null
                ? veto
                : riskReason(volatilityRisk, velocityRisk, momentumRisk, volumeRisk, timeRisk);

        RiskAssessment assessment = RiskAssessment.builder()
                .tooRisky(veto != null)
                .reason(reason)
                .riskScore(riskScore)
                .recommendedStrategy(recommendStrategy(riskScore, event.getConfidence()))
                .positionSize(positionSize(riskScore, event.getConfidence()))
                .maxSlippage(maxSlippage(riskScore, event.getConfidence()))
                .build();

        track(event.getTokenId(), riskScore);
        log.debug("🔍 Risk Assessment: {} - Score: {}, Strategy: {}, Size: ${}", event.getTokenId(),
                String.format("%.1f", riskScore), assessment.getRecommendedStrategy().label(),
                String.format("%.2f", assessment.getPositionSize()));
        return assessment;
    }

    /**
     * Recomputes exposure, concentration and correlation from the live
     * position set.
     */
    public void updatePortfolioMetrics(Collection<ActiveFlashPosition> positions) {
        double totalExposure = 0;
        double maxSingle = 0;
        for (ActiveFlashPosition position : positions) {
            double exposure = position.exposure();
            totalExposure += exposure;
            maxSingle = Math.max(maxSingle, exposure);
        }
        portfolioMetrics = PortfolioRiskMetrics.builder()
                .totalExposure(totalExposure)
                .concurrentPositions(positions.size())
                .maxSinglePosition(maxSingle)
                .riskScore(portfolioRiskScore(positions))
                .correlationRisk(correlationRisk(positions))
                .build();
    }

    public PortfolioRiskMetrics getPortfolioMetrics() {
        return portfolioMetrics;
    }

    public boolean wouldExceedLimits(double newPositionSize) {
        PortfolioRiskMetrics metrics = portfolioMetrics;
        double maxExposure = config.maxConcurrentTrades() * config.baseTradeSize() * 2;
        return metrics.getTotalExposure() + newPositionSize > maxExposure
                || metrics.getConcurrentPositions() >= config.maxConcurrentTrades();
    }

    /**
     * Last risk scores recorded for a token, oldest first.
     */
    public List<Double> getRiskTrend(String tokenId) {
        ScoreHistory history = recentAssessments.get(tokenId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return new ArrayList<>(history.scores);
        }
    }

    public void cleanup() {
        Instant cutoff = Instant.now(clock).minus(HISTORY_TTL);
        int before = recentAssessments.size();
        recentAssessments.values().removeIf(h -> h.lastUpdated.isBefore(cutoff));
        int removed = before - recentAssessments.size();
        if (removed > 0) {
            log.debug("Dropped {} idle risk histories", removed);
        }
    }

    private static double velocityTier(double velocity) {
        if (velocity > 0.1) {
            return 40;
        }
        if (velocity > 0.05) {
            return 25;
        }
        if (velocity > 0.03) {
            return 15;
        }
        return 5;
    }

    private static double momentumTier(double momentum) {
        if (momentum > 0.5) {
            return 20;
        }
        if (momentum > 0.2) {
            return 10;
        }
        if (momentum > 0.1) {
            return 5;
        }
        return 2;
    }

    private static double volumeTier(double volumeSpike) {
        if (volumeSpike > 10) {
            return 15;
        }
        if (volumeSpike > 5) {
            return 8;
        }
        if (volumeSpike > 2) {
            return 3;
        }
        return 1;
    }

    private double timeOfDayRisk(Instant timestamp) {
        int hour = (timestamp != null ? timestamp : Instant.now(clock)).atZone(clock.getZone()).getHour();
        if (hour >= 2 && hour <= 6) {
            return 10;
        }
        if (hour >= 22 || hour <= 1) {
            return 8;
        }
        if (hour >= 10 && hour <= 16) {
            return 2;
        }
        return 5;
    }

    private String vetoReason(double riskScore, EnhancedFlashMoveEvent event) {
        if (config.enableVolatilityKillSwitch() && riskScore > 90) {
            return String.format("Kill switch triggered - risk score %.1f", riskScore);
        }
        if (event.getConfidence() < 0.3) {
            return String.format("Low confidence (%.2f)", event.getConfidence());
        }
        if (Math.abs(event.getVelocity()) > 0.5) {
            return String.format("Velocity %.2f looks like manipulation", event.getVelocity());
        }
        return null;
    }

    private ExecutionStrategy recommendStrategy(double riskScore, double confidence) {
        if (config.preferredStrategy() != ExecutionStrategy.ADAPTIVE) {
            return config.preferredStrategy();
        }
        if (confidence > 0.8 && riskScore < 40) {
            return ExecutionStrategy.AGGRESSIVE;
        }
        if (confidence < 0.5 || riskScore > 60) {
            return ExecutionStrategy.CONSERVATIVE;
        }
        return ExecutionStrategy.ADAPTIVE;
    }

    private double positionSize(double riskScore, double confidence) {
        double size = config.baseTradeSize() * (0.5 + 0.5 * confidence);
        if (riskScore > 50) {
            size *= 0.5;
        } else if (riskScore > 30) {
            size *= 0.7;
        }
        if (wouldExceedLimits(size)) {
            size *= 0.5;
        }
        return Math.max(size, MIN_POSITION_SIZE);
    }

    private double maxSlippage(double riskScore, double confidence) {
        double slippage = config.maxSlippagePercent();
        if (confidence > 0.8) {
            slippage *= 0.5;
        }
        if (riskScore > 60) {
            slippage *= 1.5;
        }
        return Math.min(slippage, MAX_SLIPPAGE);
    }

    private static String riskReason(double volatility, double velocity, double momentum, double volume,
            double time) {
        List<String> reasons = new ArrayList<>();
        if (volatility > 20) {
            reasons.add("High volatility");
        }
        if (velocity > 20) {
            reasons.add("Extreme velocity");
        }
        if (momentum > 10) {
            reasons.add("High momentum");
        }
        if (volume > 8) {
            reasons.add("Volume spike");
        }
        if (time > 8) {
            reasons.add("High-risk timing");
        }
        return reasons.isEmpty() ? "Normal market conditions" : String.join(", ", reasons);
    }

    private double portfolioRiskScore(Collection<ActiveFlashPosition> positions) {
        if (positions.isEmpty()) {
            return 0;
        }
        Instant staleBefore = Instant.now(clock).minus(STALE_POSITION_AGE);
        double total = 0;
        for (ActiveFlashPosition position : positions) {
            total += position.getOpenedAt().isBefore(staleBefore) ? 20 : 5;
        }
        return total / positions.size();
    }

    /**
     * 15 when at least three positions were opened in quick succession, each
     * within 30 s of the one before.
     */
    private static double correlationRisk(Collection<ActiveFlashPosition> positions) {
        if (positions.size() < 3) {
            return 0;
        }
        List<Instant> entries = positions.stream()
                .map(ActiveFlashPosition::getOpenedAt)
                .sorted()
                .toList();
        int quickEntries = 0;
        for (int i = 1; i < entries.size(); i++) {
            if (Duration.between(entries.get(i - 1), entries.get(i)).compareTo(QUICK_ENTRY_GAP) < 0) {
                quickEntries++;
            }
        }
        return quickEntries >= 2 ? 15 : 0;
    }

    private void track(String tokenId, double riskScore) {
        ScoreHistory history = recentAssessments.computeIfAbsent(tokenId, id -> new ScoreHistory());
        synchronized (history) {
            history.scores.addLast(riskScore);
            while (history.scores.size() > HISTORY_SIZE) {
                history.scores.removeFirst();
            }
            history.lastUpdated = Instant.now(clock);
        }
    }

    private static final class ScoreHistory {
        private final Deque<Double> scores = new ArrayDeque<>();
        private volatile Instant lastUpdated = Instant.EPOCH;
    }
}
