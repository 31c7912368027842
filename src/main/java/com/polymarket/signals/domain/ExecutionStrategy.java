package com.polymarket.signals.domain;

public enum ExecutionStrategy {
    AGGRESSIVE,
    CONSERVATIVE,
    ADAPTIVE;

    public String label() {
        return name().toLowerCase();
    }
}
