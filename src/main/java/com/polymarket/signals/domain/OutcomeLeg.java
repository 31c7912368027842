package com.polymarket.signals.domain;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class OutcomeLeg {
    private String tokenId;
    private String outcome;
    private BigDecimal price; // best ask
    private BigDecimal size; // quote feed carries no depth, stays 0
}
