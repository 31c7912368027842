package com.polymarket.signals.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polymarket.signals.config.SignalProperties;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Read-only CLOB REST client used by the polling fallback. Calls are rate
 * limited globally and retried on 429 and I/O failures.
 */
@Slf4j
@Service
public class PolymarketApiClient {

    private static final String USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private static final int MAX_ATTEMPTS = 3;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String clobApiUrl;
    private final RateLimiter rateLimiter;

    public PolymarketApiClient(OkHttpClient httpClient, ObjectMapper objectMapper, SignalProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clobApiUrl = properties.polling().clobRestUrl();
        this.rateLimiter = new RateLimiter(properties.polling().requestsPerSecond());
    }

    /**
     * Fetches the book for one token and reduces it to its top of book.
     *
     * @throws PolymarketApiException when the call still fails after retries
     */
    public OrderBookQuote getOrderBook(String tokenId) {
        JsonNode book = executeRequest(clobApiUrl + "/book?token_id=" + tokenId);
        OrderBookQuote quote = OrderBookQuote.fromBook(book);
        if (quote.assetId() == null) {
            return new OrderBookQuote(quote.marketId(), tokenId, quote.bestBid(), quote.bestAsk());
        }
        return quote;
    }

    private JsonNode executeRequest(String url) {
        rateLimiter.acquire();

        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .build();

        for (int attempt = 1; ; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    if (response.code() == 429 && attempt < MAX_ATTEMPTS) {
                        log.warn("Rate limited on {}, backing off (attempt {})", url, attempt);
                        pause(1000L * attempt);
                        continue;
                    }
                    throw new PolymarketApiException(
                            "API request failed: " + response.code() + " " + response.message(), response.code());
                }
                ResponseBody body = response.body();
                if (body == null) {
                    throw new PolymarketApiException("Empty response body from " + url, response.code());
                }
                return objectMapper.readTree(body.string());
            } catch (IOException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    throw new PolymarketApiException("Failed to call API after retries: " + url, e);
                }
                log.debug("Transient I/O error on {}, retrying: {}", url, e.getMessage());
                pause(500L);
            }
        }
    }

    private static void pause(long millis) {
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PolymarketApiException("Interrupted while backing off", e);
        }
    }

    /**
     * Token bucket with a burst of one.
     */
    static class RateLimiter {
        private final double permitsPerSecond;
        private long lastSync = System.nanoTime();
        private double storedPermits = 1.0;

        RateLimiter(double permitsPerSecond) {
            this.permitsPerSecond = permitsPerSecond;
        }

        synchronized void acquire() {
            long now = System.nanoTime();
            double newPermits = (now - lastSync) / 1_000_000_000.0 * permitsPerSecond;
            storedPermits = Math.min(1.0, storedPermits + newPermits);
            lastSync = now;

            if (storedPermits >= 1.0) {
                storedPermits -= 1.0;
                return;
            }

            double missing = 1.0 - storedPermits;
            long waitNanos = (long) (missing / permitsPerSecond * 1_000_000_000.0);
            pause(TimeUnit.NANOSECONDS.toMillis(waitNanos) + 1);

            lastSync = System.nanoTime();
            storedPermits = 0;
        }
    }
}
