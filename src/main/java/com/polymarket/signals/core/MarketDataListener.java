package com.polymarket.signals.core;

import com.polymarket.signals.domain.PriceTick;
import com.polymarket.signals.domain.TradeTick;

/**
 * Receives normalized market data from {@link MarketEventRouter}. Every
 * callback runs on the market event loop.
 */
public interface MarketDataListener {

    default void onPriceTick(PriceTick tick) {
    }

    default void onTradeTick(TradeTick tick) {
    }
}
