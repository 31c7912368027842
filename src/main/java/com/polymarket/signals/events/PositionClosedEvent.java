package com.polymarket.signals.events;

import java.time.Instant;

public record PositionClosedEvent(String tokenId, String reason, Instant timestamp) {
}
