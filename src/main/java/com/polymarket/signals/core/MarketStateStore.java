package com.polymarket.signals.core;

import com.polymarket.signals.domain.MarketSnapshot;
import com.polymarket.signals.domain.OutcomeLeg;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * In-memory index of market snapshots by market id, plus a reverse index from
 * leg token id to market id. Entries live for the life of the process.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketStateStore {

    static final Pattern CRYPTO_KEYWORDS = Pattern.compile(
            "\\b(BTC|ETH|SOL|LINK|MATIC|DOGE|Price|climb|fall|above|below|closes|resolves)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final String PLACEHOLDER_OUTCOME = "UNK";

    private final Clock clock;

    private final Map<String, MarketSnapshot> markets = new ConcurrentHashMap<>();
    private final Map<String, String> marketIdByToken = new ConcurrentHashMap<>();

    public static boolean isCryptoQuestion(String question) {
        return question != null && CRYPTO_KEYWORDS.matcher(question).find();
    }

    /**
     * Registers (or re-registers) a market announced on the feed. Legs already
     * priced by earlier quotes keep their price and take the announced label.
     */
    public MarketSnapshot onNewMarket(String marketId, String question, List<String> assetIds,
            List<String> outcomeLabels, String slug, String image) {
        String resolvedQuestion = question == null || question.isBlank() ? "New Listing" : question;
        boolean crypto = isCryptoQuestion(resolvedQuestion);
        if (crypto) {
            log.info("✨ HIGH PRIORITY: New Crypto Market: {}", resolvedQuestion);
        }

        MarketSnapshot snapshot = markets.computeIfAbsent(marketId, id -> MarketSnapshot.builder()
                .marketId(id)
                .build());

        Map<String, OutcomeLeg> legs = snapshot.getOutcomes();
        for (int i = 0; i < assetIds.size(); i++) {
            String tokenId = assetIds.get(i);
            String label = i < outcomeLabels.size() && outcomeLabels.get(i) != null
                    ? outcomeLabels.get(i)
                    : "Outcome " + i;
            OutcomeLeg existing = legs.get(tokenId);
            if (existing != null) {
                existing.setOutcome(label);
            } else {
                legs.put(tokenId, OutcomeLeg.builder()
                        .tokenId(tokenId)
                        .outcome(label)
                        .price(BigDecimal.ZERO)
                        .size(BigDecimal.ZERO)
                        .build());
            }
            marketIdByToken.put(tokenId, marketId);
        }

        snapshot.setQuestion(resolvedQuestion);
        snapshot.setCrypto(crypto);
        snapshot.setNegRisk(assetIds.size() == 2);
        snapshot.setTotalLegsExpected(assetIds.size());
        snapshot.setSlug(slug);
        snapshot.setImage(image);
        snapshot.setState(MarketSnapshot.State.POPULATED);
        snapshot.setLastUpdated(Instant.now(clock));
        return snapshot;
    }

    /**
     * Upserts one leg's best ask. An unseen market gets a placeholder snapshot
     * expecting two legs.
     */
    public MarketSnapshot applyBestAsk(String marketId, String tokenId, BigDecimal bestAsk) {
        MarketSnapshot snapshot = markets.computeIfAbsent(marketId, id -> {
            log.debug("Quote for unseen market {}, creating placeholder", id);
            return MarketSnapshot.builder()
                    .marketId(id)
                    .question(MarketSnapshot.PENDING_QUESTION)
                    .negRisk(true)
                    .crypto(false)
                    .totalLegsExpected(2)
                    .state(MarketSnapshot.State.PENDING)
                    .build();
        });

        OutcomeLeg leg = snapshot.getOutcomes().get(tokenId);
        if (leg == null) {
            leg = OutcomeLeg.builder()
                    .tokenId(tokenId)
                    .outcome(PLACEHOLDER_OUTCOME)
                    .size(BigDecimal.ZERO)
                    .build();
            snapshot.getOutcomes().put(tokenId, leg);
            marketIdByToken.put(tokenId, marketId);
        }
        leg.setPrice(bestAsk);
        snapshot.setLastUpdated(Instant.now(clock));

        if (snapshot.getState() == MarketSnapshot.State.PENDING && snapshot.hasAllLegs()) {
            snapshot.setState(MarketSnapshot.State.POPULATED);
        }
        return snapshot;
    }

    public Optional<MarketSnapshot> onMarketResolved(String marketId) {
        MarketSnapshot snapshot = markets.get(marketId);
        if (snapshot == null) {
            return Optional.empty();
        }
        snapshot.setState(MarketSnapshot.State.RESOLVED);
        snapshot.setLastUpdated(Instant.now(clock));
        return Optional.of(snapshot);
    }

    public MarketSnapshot getMarket(String marketId) {
        return markets.get(marketId);
    }

    public Optional<MarketSnapshot> findByToken(String tokenId) {
        String marketId = marketIdByToken.get(tokenId);
        return marketId == null ? Optional.empty() : Optional.ofNullable(markets.get(marketId));
    }

    public Optional<String> marketIdForToken(String tokenId) {
        return Optional.ofNullable(marketIdByToken.get(tokenId));
    }

    public Collection<MarketSnapshot> getAllMarkets() {
        return markets.values();
    }

    /**
     * Token ids of every leg on a market that has not resolved.
     */
    public List<String> getTrackedTokenIds() {
        return markets.values().stream()
                .filter(m -> m.getState() != MarketSnapshot.State.RESOLVED)
                .flatMap(m -> m.getOutcomes().keySet().stream())
                .toList();
    }

    public int size() {
        return markets.size();
    }
}
