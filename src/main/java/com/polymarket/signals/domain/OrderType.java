package com.polymarket.signals.domain;

public enum OrderType {
    FAK, // fill and kill
    FOK, // fill or kill
    GTC
}
