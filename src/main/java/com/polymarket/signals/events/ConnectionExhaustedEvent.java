package com.polymarket.signals.events;

import java.time.Instant;

/**
 * The market socket gave up reconnecting. Needs an operator to restart it.
 */
public record ConnectionExhaustedEvent(int attempts, Instant timestamp) {
}
