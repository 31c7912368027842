package com.polymarket.signals.config;

import com.polymarket.signals.domain.ExecutionStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix = "signals")
public record SignalProperties(
        @Valid Connection connection,
        @Valid Polling polling,
        @Valid Arbitrage arbitrage,
        @Valid Flash flash) {

    public SignalProperties {
        if (connection == null) {
            connection = new Connection(null, null, null, null, null, null);
        }
        if (polling == null) {
            polling = new Polling(null, null, null, null, null, null);
        }
        if (arbitrage == null) {
            arbitrage = new Arbitrage(null, null, null, null, null, null);
        }
        if (flash == null) {
            flash = Flash.of(FlashPreset.DEFAULT);
        }
    }

    public static SignalProperties defaults() {
        return new SignalProperties(null, null, null, null);
    }

    public record Connection(
            @NotNull Boolean enabled,
            String wsUrl,
            @NotNull @Positive Long heartbeatMillis,
            @NotNull @Positive Long reconnectBaseDelayMillis,
            @NotNull @Positive Long reconnectMaxDelayMillis,
            @NotNull @Min(0) Integer maxReconnectAttempts) {

        public Connection {
            if (enabled == null) {
                enabled = true;
            }
            if (wsUrl == null || wsUrl.isBlank()) {
                wsUrl = "wss://ws-subscriptions-clob.polymarket.com/ws/market";
            }
            if (heartbeatMillis == null) {
                heartbeatMillis = 10_000L;
            }
            if (reconnectBaseDelayMillis == null) {
                reconnectBaseDelayMillis = 1_000L;
            }
            if (reconnectMaxDelayMillis == null) {
                reconnectMaxDelayMillis = 30_000L;
            }
            if (maxReconnectAttempts == null) {
                maxReconnectAttempts = 10;
            }
        }
    }

    public record Polling(
            @NotNull Boolean enabled,
            String clobRestUrl,
            @NotNull @Min(1) Integer batchSize,
            @NotNull @PositiveOrZero Long batchDelayMillis,
            @NotNull @Positive Long intervalMillis,
            @NotNull @Positive Double requestsPerSecond) {

        public Polling {
            if (enabled == null) {
                enabled = true;
            }
            if (clobRestUrl == null || clobRestUrl.isBlank()) {
                clobRestUrl = "https://clob.polymarket.com";
            }
            if (batchSize == null) {
                batchSize = 5;
            }
            if (batchDelayMillis == null) {
                batchDelayMillis = 250L;
            }
            if (intervalMillis == null) {
                intervalMillis = 15_000L;
            }
            if (requestsPerSecond == null) {
                requestsPerSecond = 4.0;
            }
        }
    }

    public record Arbitrage(
            @NotNull @PositiveOrZero BigDecimal minCombinedCost,
            @NotNull @DecimalMax("1.0") BigDecimal maxCombinedCost,
            @NotNull @PositiveOrZero BigDecimal minRoiCryptoPercent,
            @NotNull @PositiveOrZero BigDecimal minRoiPercent,
            @NotNull @PositiveOrZero BigDecimal roiHysteresisPercent,
            @NotNull @Positive Long maxAgeMillis) {

        public Arbitrage {
            if (minCombinedCost == null) {
                minCombinedCost = new BigDecimal("0.01");
            }
            if (maxCombinedCost == null) {
                maxCombinedCost = new BigDecimal("0.995");
            }
            if (minRoiCryptoPercent == null) {
                minRoiCryptoPercent = new BigDecimal("0.25");
            }
            if (minRoiPercent == null) {
                minRoiPercent = new BigDecimal("0.4");
            }
            if (roiHysteresisPercent == null) {
                roiHysteresisPercent = new BigDecimal("0.1");
            }
            if (maxAgeMillis == null) {
                maxAgeMillis = 120_000L;
            }
        }
    }

    /**
     * Flash-move detection, risk and execution settings. Unset keys take the
     * value of {@link #preset()}.
     */
    public record Flash(
            @NotNull Boolean enabled,
            @NotNull FlashPreset preset,
            // detection
            @NotNull @Positive Double velocityThreshold,
            @NotNull @Positive Double microTickThreshold,
            @NotNull @Positive Long microWindowMillis,
            @NotNull @Positive Double momentumThreshold,
            @NotNull @Positive Double volumeSpikeMultiplier,
            @NotNull @Min(2) Integer maxSamples,
            @NotNull @Positive Long historyRetentionMillis,
            @NotNull @Min(1) Integer fullConfidenceSamples,
            @NotNull @PositiveOrZero Long cooldownMillis,
            // risk
            @NotNull @DecimalMin("10.0") Double baseTradeSize,
            @NotNull @Positive @DecimalMax("0.05") Double maxSlippagePercent,
            @NotNull @Min(1) Integer maxConcurrentTrades,
            @NotNull ExecutionStrategy preferredStrategy,
            @NotNull Boolean enableVolatilityKillSwitch,
            // execution
            @NotNull @Positive Double stopLossPercent,
            @NotNull @Positive Double takeProfitPercent,
            @NotNull @Positive Long positionMaxAgeMillis) {

        public Flash {
            if (enabled == null) {
                enabled = false;
            }
            if (preset == null) {
                preset = FlashPreset.DEFAULT;
            }
            if (velocityThreshold == null) {
                velocityThreshold = preset.velocityThreshold;
            }
            if (microTickThreshold == null) {
                microTickThreshold = 0.01;
            }
            if (microWindowMillis == null) {
                microWindowMillis = 500L;
            }
            if (momentumThreshold == null) {
                momentumThreshold = preset.momentumThreshold;
            }
            if (volumeSpikeMultiplier == null) {
                volumeSpikeMultiplier = preset.volumeSpikeMultiplier;
            }
            if (maxSamples == null) {
                maxSamples = 100;
            }
            if (historyRetentionMillis == null) {
                historyRetentionMillis = 300_000L;
            }
            if (fullConfidenceSamples == null) {
                fullConfidenceSamples = 10;
            }
            if (cooldownMillis == null) {
                cooldownMillis = 10_000L;
            }
            if (baseTradeSize == null) {
                baseTradeSize = preset.baseTradeSize;
            }
            if (maxSlippagePercent == null) {
                maxSlippagePercent = preset.maxSlippagePercent;
            }
            if (maxConcurrentTrades == null) {
                maxConcurrentTrades = preset.maxConcurrentTrades;
            }
            if (preferredStrategy == null) {
                preferredStrategy = preset.preferredStrategy;
            }
            if (enableVolatilityKillSwitch == null) {
                enableVolatilityKillSwitch = true;
            }
            if (stopLossPercent == null) {
                stopLossPercent = preset.stopLossPercent;
            }
            if (takeProfitPercent == null) {
                takeProfitPercent = preset.takeProfitPercent;
            }
            if (positionMaxAgeMillis == null) {
                positionMaxAgeMillis = 300_000L;
            }
        }

        public static Flash of(FlashPreset preset) {
            return new Flash(null, preset, null, null, null, null, null, null, null, null, null,
                    null, null, null, null, null, null, null, null);
        }

        public Flash withEnabled(boolean value) {
            return new Flash(value, preset, velocityThreshold, microTickThreshold, microWindowMillis,
                    momentumThreshold, volumeSpikeMultiplier, maxSamples, historyRetentionMillis,
                    fullConfidenceSamples, cooldownMillis, baseTradeSize, maxSlippagePercent,
                    maxConcurrentTrades, preferredStrategy, enableVolatilityKillSwitch, stopLossPercent,
                    takeProfitPercent, positionMaxAgeMillis);
        }
    }
}
