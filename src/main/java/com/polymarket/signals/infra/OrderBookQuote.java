package com.polymarket.signals.infra;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * Top of book for one asset. A missing side reads as bid 0 / ask 1, the
 * values the feed itself uses for an empty side.
 */
public record OrderBookQuote(String marketId, String assetId, BigDecimal bestBid, BigDecimal bestAsk) {

    /**
     * Reads a CLOB book payload ({@code market}, {@code asset_id},
     * {@code bids[]}, {@code asks[]}); works for both the REST response and
     * the socket {@code book} frame.
     *
     * @throws NumberFormatException if a level price is not numeric
     */
    public static OrderBookQuote fromBook(JsonNode book) {
        BigDecimal bestBid = bestLevel(book.path("bids"), true);
        BigDecimal bestAsk = bestLevel(book.path("asks"), false);
        String assetId = book.hasNonNull("asset_id")
                ? book.get("asset_id").asText()
                : book.path("token_id").asText(null);
        return new OrderBookQuote(
                book.path("market").asText(null),
                assetId,
                bestBid != null ? bestBid : BigDecimal.ZERO,
                bestAsk != null ? bestAsk : BigDecimal.ONE);
    }

    private static BigDecimal bestLevel(JsonNode levels, boolean highest) {
        BigDecimal best = null;
        for (JsonNode level : levels) {
            String raw = level.path("price").asText("");
            if (raw.isBlank()) {
                continue;
            }
            BigDecimal price = new BigDecimal(raw);
            if (best == null || (highest ? price.compareTo(best) > 0 : price.compareTo(best) < 0)) {
                best = price;
            }
        }
        return best;
    }
}
