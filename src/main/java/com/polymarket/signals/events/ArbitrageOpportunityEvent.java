package com.polymarket.signals.events;

import com.polymarket.signals.domain.ArbitrageOpportunity;

/**
 * A new or materially improved arbitrage opportunity.
 */
public record ArbitrageOpportunityEvent(ArbitrageOpportunity opportunity) {
}
