package com.tradegate.backend.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A concrete instruction sent to the broker. Quantities are whole shares.
 */
@Builder(toBuilder = true)
public record Order(
        String symbol,
        TradeSide side,
        int quantity,
        OrderType orderType,
        BigDecimal price,
        BigDecimal stopPrice,
        MarketType market,
        String timeInForce
) {
    public static final String DEFAULT_TIME_IN_FORCE = "DAY";

    public Order {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Order symbol is required");
        }
        Objects.requireNonNull(side, "side");
        if (quantity <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive: " + quantity);
        }
        if (orderType == null) {
            orderType = OrderType.MARKET;
        }
        if (orderType.requiresPrice() && (price == null || price.signum() <= 0)) {
            throw new IllegalArgumentException(orderType + " order for " + symbol + " requires a price");
        }
        if (market == null) {
            market = MarketType.detect(symbol);
        }
        if (timeInForce == null || timeInForce.isBlank()) {
            timeInForce = DEFAULT_TIME_IN_FORCE;
        }
    }

    public boolean isBuy() {
        return side == TradeSide.BUY;
    }
}
