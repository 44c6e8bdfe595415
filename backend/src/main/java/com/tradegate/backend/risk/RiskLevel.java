package com.tradegate.backend.risk;

/**
 * Severity of a risk evaluation, ordered from least to most severe.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskLevel max(RiskLevel left, RiskLevel right) {
        return left.compareTo(right) >= 0 ? left : right;
    }

    public boolean isAbove(RiskLevel other) {
        return compareTo(other) > 0;
    }
}
