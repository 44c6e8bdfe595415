package com.tradegate.backend.model;

public enum ErrorCategory {
    CONNECTION,
    VALIDATION,
    EXECUTION,
    DATA
}
