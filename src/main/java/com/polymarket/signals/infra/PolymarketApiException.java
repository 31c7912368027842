package com.polymarket.signals.infra;

public class PolymarketApiException extends RuntimeException {

    private final int statusCode;

    public PolymarketApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public PolymarketApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the failed call, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
