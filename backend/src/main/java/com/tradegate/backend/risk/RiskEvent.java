package com.tradegate.backend.risk;

import com.tradegate.backend.model.Order;

import java.time.Instant;

public record RiskEvent(Order order, String message, RiskLevel riskLevel, Instant timestamp) {
}
