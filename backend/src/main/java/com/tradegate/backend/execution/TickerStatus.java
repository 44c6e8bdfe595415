package com.tradegate.backend.execution;

public enum TickerStatus {
    EXECUTED,
    FAILED,
    ERROR,
    SKIPPED
}
