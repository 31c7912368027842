package com.polymarket.signals.events;

import java.util.List;

/**
 * A market was announced on the feed; its legs need per-asset quote
 * subscriptions.
 */
public record MarketListedEvent(String marketId, List<String> assetIds) {
}
