package com.tradegate.backend.execution;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record ExecutionReport(
        int totalTrades,
        int successfulTrades,
        int failedTrades,
        double successRate,
        BigDecimal totalExecutedValue,
        BigDecimal totalCommission,
        List<FailedTrade> recentFailures,
        Instant generatedAt
) {
}
