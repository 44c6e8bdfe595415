package com.tradegate.backend.model;

public enum TradeSide {
    BUY,
    SELL
}
