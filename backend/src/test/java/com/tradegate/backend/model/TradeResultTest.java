package com.tradegate.backend.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TradeResultTest {

    private final Order order = Order.builder()
            .symbol("AAPL")
            .side(TradeSide.BUY)
            .quantity(10)
            .build();

    @Test
    void failuresWithoutBrokerIdGetDistinctLocalIds() {
        TradeResult failed = TradeResult.failed(order, "gateway down");
        TradeResult rejected = TradeResult.rejected(order, "lot size");
        TradeResult failedAgain = TradeResult.failed(order, "gateway down");

        assertThat(failed.orderId()).startsWith(TradeResult.LOCAL_ID_PREFIX);
        assertThat(rejected.orderId()).startsWith(TradeResult.LOCAL_ID_PREFIX);
        assertThat(failed.orderId()).isNotEqualTo(rejected.orderId()).isNotEqualTo(failedAgain.orderId());
        assertThat(failed.errorMsg()).isEqualTo("gateway down");
        assertThat(rejected.status()).isEqualTo(OrderStatus.REJECTED);
    }

    @Test
    void brokerAssignedIdIsKept() {
        TradeResult result = TradeResult.builder()
                .orderId("ORD-7")
                .symbol("AAPL")
                .side(TradeSide.BUY)
                .quantity(10)
                .status(OrderStatus.SUBMITTED)
                .build();

        assertThat(result.orderId()).isEqualTo("ORD-7");
    }
}
