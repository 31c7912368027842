package com.polymarket.signals.infra;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    CLOSING,
    ERROR
}
