package com.polymarket.signals.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FlashMoveResult {
    boolean success;
    String orderId;
    Double sharesFilled;
    Double priceFilled;
    String errorMessage;
    String strategy; // execution strategy label, or the refusal reason code
    long executionTimeMillis;
    Double slippage;

    public static FlashMoveResult refused(String strategy, String errorMessage, long executionTimeMillis) {
        return FlashMoveResult.builder()
                .success(false)
                .strategy(strategy)
                .errorMessage(errorMessage)
                .executionTimeMillis(executionTimeMillis)
                .build();
    }
}
