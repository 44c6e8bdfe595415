package com.tradegate.backend.model;

import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record AccountInfo(
        String accountId,
        BigDecimal totalAssets,
        BigDecimal cash,
        BigDecimal marketValue,
        BigDecimal unrealizedPnl,
        BigDecimal realizedPnl,
        BigDecimal buyingPower
) {
    public BigDecimal netLiquidation() {
        return totalAssets;
    }
}
