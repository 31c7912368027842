package com.polymarket.signals.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Live view of one market's outcome legs, keyed by token id. Mutated in place
 * by the market state store on every quote.
 */
@Data
@Builder
public class MarketSnapshot {

    public static final String PENDING_QUESTION = "Syncing...";

    private String marketId;
    private String question;
    private boolean negRisk;
    private boolean crypto;
    private int totalLegsExpected;
    private State state;
    private String slug;
    private String image;
    private Instant lastUpdated;

    @Builder.Default
    private Map<String, OutcomeLeg> outcomes = new LinkedHashMap<>();

    public boolean hasAllLegs() {
        return outcomes.size() >= totalLegsExpected;
    }

    public enum State {
        PENDING, // created from a quote before the market was announced
        POPULATED,
        RESOLVED
    }
}
