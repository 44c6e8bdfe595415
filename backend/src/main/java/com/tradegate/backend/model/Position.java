package com.tradegate.backend.model;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * Broker-reported holding. Quantity is signed; negative means short.
 */
@Builder
public record Position(
        String symbol,
        int quantity,
        BigDecimal avgCost,
        BigDecimal marketValue,
        BigDecimal unrealizedPnl,
        BigDecimal marketPrice
) {
}
