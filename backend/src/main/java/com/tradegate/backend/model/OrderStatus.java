package com.tradegate.backend.model;

public enum OrderStatus {
    PENDING,
    SUBMITTED,
    FILLED,
    PARTIALLY_FILLED,
    CANCELLED,
    REJECTED,
    FAILED;

    public boolean isError() {
        return this == REJECTED || this == FAILED;
    }

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || isError();
    }
}
