package com.tradegate.backend.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * A decision handed over by the upstream decision engine. Only action and quantity drive execution.
 */
public record TradingDecision(
        @NotBlank String action,
        @PositiveOrZero int quantity,
        @Min(0) @Max(100) Double confidence,
        String reasoning
) {
}
