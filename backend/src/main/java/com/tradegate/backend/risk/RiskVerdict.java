package com.tradegate.backend.risk;

public record RiskVerdict(boolean approved, String reason, RiskLevel riskLevel) {
}
