package com.polymarket.signals.flash;

import lombok.Builder;
import lombok.Value;

/**
 * What the trade executor reports back for one order.
 */
@Value
@Builder
public class TradeExecution {
    boolean success;
    String orderId;
    Double sharesFilled;
    Double priceFilled;
    String error;

    public static TradeExecution failed(String error) {
        return TradeExecution.builder().success(false).error(error).build();
    }
}
