package com.tradegate.backend.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Action vocabulary produced by the decision engine.
 */
public enum TradeAction {
    BUY,
    SELL,
    SHORT,
    COVER,
    HOLD;

    public static Optional<TradeAction> from(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(TradeAction.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
