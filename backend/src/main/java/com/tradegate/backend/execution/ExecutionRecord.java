package com.tradegate.backend.execution;

import com.tradegate.backend.model.OrderStatus;

import java.math.BigDecimal;
import java.time.Instant;

public record ExecutionRecord(
        Instant timestamp,
        String ticker,
        String action,
        String orderId,
        int requestedQuantity,
        int executedQuantity,
        BigDecimal fillPrice,
        BigDecimal commission,
        OrderStatus status
) {
}
