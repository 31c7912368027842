package com.polymarket.signals.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.polymarket.signals.domain.MarketSnapshot;
import com.polymarket.signals.domain.OrderSide;
import com.polymarket.signals.domain.PriceTick;
import com.polymarket.signals.domain.TradeTick;
import com.polymarket.signals.events.MarketListedEvent;
import com.polymarket.signals.events.SignalEventPublisher;
import com.polymarket.signals.infra.OrderBookQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Dispatches parsed market-channel frames by {@code event_type} into the
 * market state store, the arbitrage detector and the registered
 * {@link MarketDataListener}s. Runs on the market event loop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketEventRouter {

    private static final BigDecimal TWO = new BigDecimal("2");

    private final MarketStateStore store;
    private final ArbitrageDetector arbitrageDetector;
    private final List<MarketDataListener> listeners;
    private final SignalEventPublisher publisher;
    private final Clock clock;

    /**
     * Routes one decoded frame. The feed batches events into JSON arrays, so
     * an array is routed element by element.
     */
    public void route(JsonNode frame) {
        if (frame == null) {
            return;
        }
        if (frame.isArray()) {
            for (JsonNode element : frame) {
                routeOne(element);
            }
        } else if (frame.isObject()) {
            routeOne(frame);
        }
    }

    /**
     * Applies a best bid/ask pair for one leg, as if a {@code best_bid_ask}
     * frame had arrived. Used by the REST polling fallback.
     */
    public void onQuote(String marketId, String assetId, BigDecimal bestBid, BigDecimal bestAsk) {
        if (assetId == null || assetId.isBlank()) {
            return;
        }
        String resolvedMarket = marketId != null && !marketId.isBlank()
                ? marketId
                : store.marketIdForToken(assetId).orElse(null);
        if (resolvedMarket == null) {
            log.debug("Quote for unmapped asset {} dropped", assetId);
            return;
        }

        MarketSnapshot snapshot = store.applyBestAsk(resolvedMarket, assetId, bestAsk);
        if (snapshot.hasAllLegs()) {
            arbitrageDetector.analyze(snapshot);
        }

        BigDecimal price = tickPrice(bestBid, bestAsk);
        if (price == null) {
            log.debug("Quote for {} has no usable side, no tick fired", assetId);
            return;
        }
        firePriceTick(new PriceTick(resolvedMarket, assetId, bestBid, bestAsk, price, Instant.now(clock)));
    }

    private void routeOne(JsonNode msg) {
        String eventType = msg.path("event_type").asText("");
        try {
            switch (eventType) {
                case "new_market" -> handleNewMarket(msg);
                case "best_bid_ask" -> handleBestBidAsk(msg);
                case "price_change" -> handlePriceChange(msg);
                case "book" -> handleBook(msg);
                case "last_trade_price" -> handleLastTradePrice(msg);
                case "trade", "trades" -> handleTrades(msg);
                case "market_resolved" -> handleMarketResolved(msg);
                default -> log.debug("Unhandled market message type: {}", eventType);
            }
        } catch (NumberFormatException e) {
            log.warn("Dropping {} frame with malformed number: {}", eventType, e.getMessage());
        }
    }

    private void handleNewMarket(JsonNode msg) {
        String marketId = msg.path("market").asText(null);
        if (marketId == null) {
            log.warn("new_market frame without market id dropped");
            return;
        }
        List<String> assetIds = strings(msg.path("assets_ids"));
        List<String> outcomes = strings(msg.path("outcomes"));
        String image = msg.hasNonNull("icon") ? msg.get("icon").asText() : msg.path("image").asText(null);

        MarketSnapshot snapshot = store.onNewMarket(marketId, msg.path("question").asText(null),
                assetIds, outcomes, msg.path("slug").asText(null), image);
        log.info("🆕 New Market: {} ({} legs)", snapshot.getQuestion(), assetIds.size());

        if (!assetIds.isEmpty()) {
            publisher.publish(new MarketListedEvent(marketId, List.copyOf(assetIds)));
        }
        arbitrageDetector.analyze(snapshot);
    }

    private void handleBestBidAsk(JsonNode msg) {
        String assetId = assetId(msg);
        onQuote(msg.path("market").asText(null), assetId,
                decimal(msg, "best_bid", BigDecimal.ZERO),
                decimal(msg, "best_ask", BigDecimal.ONE));
    }

    private void handlePriceChange(JsonNode msg) {
        String marketId = msg.path("market").asText(null);
        for (JsonNode change : msg.path("price_changes")) {
            String changeMarket = change.hasNonNull("market") ? change.get("market").asText() : marketId;
            onQuote(changeMarket, assetId(change),
                    decimal(change, "best_bid", BigDecimal.ZERO),
                    decimal(change, "best_ask", BigDecimal.ONE));
        }
    }

    private void handleBook(JsonNode msg) {
        OrderBookQuote quote = OrderBookQuote.fromBook(msg);
        onQuote(quote.marketId(), quote.assetId(), quote.bestBid(), quote.bestAsk());
    }

    private void handleLastTradePrice(JsonNode msg) {
        String assetId = assetId(msg);
        BigDecimal price = decimal(msg, "price", null);
        if (assetId == null || price == null) {
            return;
        }
        String marketId = msg.hasNonNull("market")
                ? msg.get("market").asText()
                : store.marketIdForToken(assetId).orElse(null);
        PriceTick tick = new PriceTick(marketId, assetId, null, null, price, Instant.now(clock));
        firePriceTick(tick);
    }

    private void handleTrades(JsonNode msg) {
        JsonNode batch = msg.path("trades");
        if (batch.isArray()) {
            for (JsonNode trade : batch) {
                handleTrade(trade);
            }
        } else {
            handleTrade(msg);
        }
    }

    private void handleTrade(JsonNode msg) {
        String assetId = assetId(msg);
        BigDecimal price = decimal(msg, "price", null);
        if (assetId == null || price == null) {
            log.debug("Trade without asset or price dropped");
            return;
        }
        TradeTick tick = new TradeTick(assetId, price, decimal(msg, "size", null),
                side(msg.path("side").asText("")), Instant.now(clock));
        for (MarketDataListener listener : listeners) {
            try {
                listener.onTradeTick(tick);
            } catch (Exception e) {
                log.error("Trade listener {} failed on {}", listener.getClass().getSimpleName(), assetId, e);
            }
        }
    }

    private void handleMarketResolved(JsonNode msg) {
        String marketId = msg.path("market").asText(null);
        if (marketId == null) {
            return;
        }
        store.onMarketResolved(marketId).ifPresent(snapshot -> {
            log.info("🏁 Market resolved: {} (winner {})", snapshot.getQuestion(),
                    msg.path("winning_asset_id").asText("?"));
            arbitrageDetector.analyze(snapshot);
        });
    }

    private void firePriceTick(PriceTick tick) {
        for (MarketDataListener listener : listeners) {
            try {
                listener.onPriceTick(tick);
            } catch (Exception e) {
                log.error("Price listener {} failed on {}", listener.getClass().getSimpleName(), tick.assetId(), e);
            }
        }
    }

    /**
     * Mid price when both sides are inside (0, 1), otherwise the one usable
     * side. Returns null when neither side is usable.
     */
    static BigDecimal tickPrice(BigDecimal bestBid, BigDecimal bestAsk) {
        boolean bidUsable = usable(bestBid);
        boolean askUsable = usable(bestAsk);
        if (bidUsable && askUsable) {
            return bestBid.add(bestAsk).divide(TWO, 6, RoundingMode.HALF_UP);
        }
        if (askUsable) {
            return bestAsk;
        }
        return bidUsable ? bestBid : null;
    }

    private static boolean usable(BigDecimal price) {
        return price != null && price.signum() > 0 && price.compareTo(BigDecimal.ONE) < 0;
    }

    private static String assetId(JsonNode msg) {
        if (msg.hasNonNull("asset_id")) {
            return msg.get("asset_id").asText();
        }
        return msg.hasNonNull("token_id") ? msg.get("token_id").asText() : null;
    }

    private static BigDecimal decimal(JsonNode msg, String field, BigDecimal fallback) {
        JsonNode value = msg.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return fallback;
        }
        return new BigDecimal(value.asText());
    }

    private static OrderSide side(String raw) {
        return switch (raw.toUpperCase()) {
            case "BUY" -> OrderSide.BUY;
            case "SELL" -> OrderSide.SELL;
            default -> null;
        };
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode node : array) {
            values.add(node.isNull() ? null : node.asText());
        }
        return values;
    }
}
