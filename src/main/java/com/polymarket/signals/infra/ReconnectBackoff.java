package com.polymarket.signals.infra;

import java.util.OptionalLong;

/**
 * Exponential reconnect schedule: {@code min(base * 2^attempt, max)} for
 * attempts {@code 1..maxAttempts}. Once the attempts are spent every further
 * request is refused until {@link #reset()}.
 */
public class ReconnectBackoff {

    private final long baseDelayMillis;
    private final long maxDelayMillis;
    private final int maxAttempts;

    private int attempts;

    public ReconnectBackoff(long baseDelayMillis, long maxDelayMillis, int maxAttempts) {
        this.baseDelayMillis = baseDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
        this.maxAttempts = maxAttempts;
    }

    public OptionalLong nextDelayMillis() {
        if (attempts >= maxAttempts) {
            return OptionalLong.empty();
        }
        attempts++;
        // clamp so the shift cannot overflow
        int exponent = Math.min(attempts, 30);
        long delay = Math.min(baseDelayMillis * (1L << exponent), maxDelayMillis);
        return OptionalLong.of(delay);
    }

    public void reset() {
        attempts = 0;
    }

    public int attempts() {
        return attempts;
    }
}
