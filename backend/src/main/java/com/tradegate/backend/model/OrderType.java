package com.tradegate.backend.model;

public enum OrderType {
    MARKET,
    LIMIT,
    STOP,
    STOP_LIMIT;

    public boolean requiresPrice() {
        return this != MARKET;
    }
}
