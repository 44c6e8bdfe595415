package com.tradegate.backend.risk;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record RiskSummary(
        boolean circuitBreakerActive,
        List<String> activeBreakers,
        Session session,
        List<LimitStatus> limits,
        List<RiskEvent> recentEvents,
        LocalDate lastReset
) {

    public record Session(int tradeCount, BigDecimal totalVolume, BigDecimal dailyPnl, Instant startTime) {
    }

    public record LimitStatus(String name, double maxValue, double currentValue, double utilization, boolean enabled) {
    }
}
