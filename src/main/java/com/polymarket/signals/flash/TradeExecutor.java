package com.polymarket.signals.flash;

import java.util.concurrent.CompletableFuture;

/**
 * Places orders on behalf of the flash pipeline. Implementations complete the
 * future off the event loop; order routing and signing live behind this seam.
 */
public interface TradeExecutor {

    CompletableFuture<TradeExecution> submit(TradeOrder order);
}
