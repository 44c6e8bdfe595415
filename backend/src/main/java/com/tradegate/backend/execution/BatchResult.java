package com.tradegate.backend.execution;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record BatchResult(List<TickerOutcome> outcomes, Summary summary, PortfolioSnapshot portfolio) {

    public record TickerOutcome(
            String ticker,
            String action,
            int requestedQuantity,
            int executedQuantity,
            BigDecimal price,
            TickerStatus status,
            String message
    ) {
    }

    public record Summary(
            int total,
            int executed,
            int failed,
            int errors,
            int skipped,
            boolean circuitBreakerActive,
            Instant completedAt
    ) {
    }
}
