package com.tradegate.backend.risk;

public record RiskCheck(String name, boolean ok, RiskLevel level, String message) {

    public static RiskCheck pass(String name, RiskLevel level, String message) {
        return new RiskCheck(name, true, level, message);
    }

    public static RiskCheck fail(String name, RiskLevel level, String message) {
        return new RiskCheck(name, false, level, message);
    }
}
