package com.tradegate.backend.execution;

import java.math.BigDecimal;
import java.util.Map;

public record PortfolioSnapshot(
        BigDecimal cash,
        BigDecimal marginUsed,
        double marginRequirement,
        BigDecimal realizedGains,
        Map<String, HoldingView> positions
) {

    public record HoldingView(
            int longQuantity,
            int shortQuantity,
            BigDecimal longCostBasis,
            BigDecimal shortCostBasis,
            BigDecimal shortMarginUsed,
            BigDecimal realizedLongGain,
            BigDecimal realizedShortGain
    ) {
    }
}
