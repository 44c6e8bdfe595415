package com.tradegate.backend.model;

import com.tradegate.backend.util.MoneyUtils;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Outcome of an order submission as reported by the broker.
 */
@Builder(toBuilder = true)
public record TradeResult(
        String orderId,
        String symbol,
        TradeSide side,
        int quantity,
        int filledQuantity,
        BigDecimal avgPrice,
        OrderStatus status,
        Instant submitTime,
        Instant updateTime,
        String errorMsg,
        BigDecimal commission
) {
    public TradeResult {
        Objects.requireNonNull(status, "status");
        if (orderId == null || orderId.isBlank()) {
            orderId = LOCAL_ID_PREFIX + UUID.randomUUID();
        }
        if (filledQuantity < 0 || filledQuantity > quantity) {
            throw new IllegalArgumentException("Filled quantity " + filledQuantity + " outside 0.." + quantity);
        }
        if (filledQuantity == 0) {
            avgPrice = null;
        }
        if (status.isError()) {
            if (errorMsg == null || errorMsg.isBlank()) {
                errorMsg = "Unknown error";
            }
        } else {
            errorMsg = null;
        }
        if (submitTime == null) {
            submitTime = Instant.now();
        }
        commission = commission == null ? MoneyUtils.ZERO : MoneyUtils.scale(commission);
    }

    /** Prefix of ids generated here when the broker never assigned one. */
    public static final String LOCAL_ID_PREFIX = "LOCAL_";

    public static TradeResult rejected(Order order, String reason) {
        return failure(order, OrderStatus.REJECTED, reason);
    }

    public static TradeResult failed(Order order, String reason) {
        return failure(order, OrderStatus.FAILED, reason);
    }

    private static TradeResult failure(Order order, OrderStatus status, String reason) {
        return TradeResult.builder()
                .symbol(order.symbol())
                .side(order.side())
                .quantity(order.quantity())
                .filledQuantity(0)
                .status(status)
                .submitTime(Instant.now())
                .errorMsg(reason)
                .build();
    }

    public boolean hasFill() {
        return filledQuantity > 0;
    }
}
