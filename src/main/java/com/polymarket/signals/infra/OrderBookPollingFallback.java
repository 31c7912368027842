package com.polymarket.signals.infra;

import com.polymarket.signals.config.SignalProperties;
import com.polymarket.signals.core.MarketEventRouter;
import com.polymarket.signals.core.MarketStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps quotes flowing while the market socket is down by polling the REST
 * book endpoint for every tracked leg. Results are routed on the event loop
 * exactly like socket frames.
 */
@Slf4j
@Service
public class OrderBookPollingFallback {

    private final PolymarketApiClient apiClient;
    private final MarketConnectionManager connectionManager;
    private final MarketStateStore store;
    private final MarketEventRouter router;
    private final MarketEventLoop eventLoop;
    private final SignalProperties.Polling config;

    public OrderBookPollingFallback(PolymarketApiClient apiClient, MarketConnectionManager connectionManager,
            MarketStateStore store, MarketEventRouter router, MarketEventLoop eventLoop,
            SignalProperties properties) {
        this.apiClient = apiClient;
        this.connectionManager = connectionManager;
        this.store = store;
        this.router = router;
        this.eventLoop = eventLoop;
        this.config = properties.polling();
    }

    @Scheduled(fixedDelayString = "${signals.polling.interval-millis:15000}",
            initialDelayString = "${signals.polling.interval-millis:15000}")
    public void poll() {
        if (!config.enabled() || connectionManager.getState() == ConnectionState.CONNECTED) {
            return;
        }
        List<String> tokenIds = CompletableFuture.supplyAsync(store::getTrackedTokenIds, eventLoop).join();
        if (tokenIds.isEmpty()) {
            return;
        }
        log.info("Socket {}, polling {} books over REST", connectionManager.getState(), tokenIds.size());
        int polled = pollBooks(tokenIds);
        log.info("Polling pass complete: {}/{} books refreshed", polled, tokenIds.size());
    }

    /**
     * Fetches books in fixed-size batches with a pause between batches.
     *
     * @return number of books routed
     */
    int pollBooks(List<String> tokenIds) {
        int batchSize = config.batchSize();
        int polled = 0;
        for (int start = 0; start < tokenIds.size(); start += batchSize) {
            if (start > 0 && !pause(config.batchDelayMillis())) {
                log.info("Polling interrupted after {} books", polled);
                break;
            }
            for (String tokenId : tokenIds.subList(start, Math.min(start + batchSize, tokenIds.size()))) {
                try {
                    OrderBookQuote quote = apiClient.getOrderBook(tokenId);
                    eventLoop.execute(() -> router.onQuote(quote.marketId(), quote.assetId(),
                            quote.bestBid(), quote.bestAsk()));
                    polled++;
                } catch (PolymarketApiException | NumberFormatException e) {
                    log.warn("Skipping book for {}: {}", tokenId, e.getMessage());
                }
            }
        }
        return polled;
    }

    private static boolean pause(long millis) {
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
