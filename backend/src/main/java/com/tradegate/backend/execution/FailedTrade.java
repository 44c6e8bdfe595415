package com.tradegate.backend.execution;

import com.tradegate.backend.model.ErrorCategory;

import java.math.BigDecimal;
import java.time.Instant;

public record FailedTrade(
        Instant timestamp,
        String ticker,
        String action,
        int requestedQuantity,
        int executedQuantity,
        BigDecimal price,
        ErrorCategory category,
        String error
) {
}
