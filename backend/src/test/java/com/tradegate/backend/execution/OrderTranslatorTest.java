package com.tradegate.backend.execution;

import com.tradegate.backend.model.MarketType;
import com.tradegate.backend.model.Order;
import com.tradegate.backend.model.OrderType;
import com.tradegate.backend.model.TradeSide;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class OrderTranslatorTest {

    private final OrderTranslator translator = new OrderTranslator();

    @Test
    void buyAndCoverBecomeBuyOrders() {
        Order buy = translator.translate("AAPL", "buy", 10, new BigDecimal("150")).orElseThrow();
        Order cover = translator.translate("AAPL", "COVER", 5, new BigDecimal("150")).orElseThrow();

        assertThat(buy.side()).isEqualTo(TradeSide.BUY);
        assertThat(buy.quantity()).isEqualTo(10);
        assertThat(buy.orderType()).isEqualTo(OrderType.MARKET);
        assertThat(buy.price()).isEqualByComparingTo("150");
        assertThat(cover.side()).isEqualTo(TradeSide.BUY);
    }

    @Test
    void sellAndShortBecomeSellOrders() {
        assertThat(translator.translate("AAPL", "sell", 10, null)).map(Order::side).contains(TradeSide.SELL);
        assertThat(translator.translate("AAPL", "short", 10, null)).map(Order::side).contains(TradeSide.SELL);
    }

    @Test
    void holdUnknownAndNonPositiveQuantitiesProduceNoOrder() {
        assertThat(translator.translate("AAPL", "hold", 10, null)).isEmpty();
        assertThat(translator.translate("AAPL", "liquidate", 10, null)).isEmpty();
        assertThat(translator.translate("AAPL", null, 10, null)).isEmpty();
        assertThat(translator.translate("AAPL", "buy", 0, null)).isEmpty();
        assertThat(translator.translate("AAPL", "buy", -3, null)).isEmpty();
    }

    @Test
    void marketIsDetectedFromSymbolShape() {
        Optional<Order> hk = translator.translate("00700", "buy", 100, null);
        Optional<Order> cn = translator.translate("600519", "buy", 100, null);
        Optional<Order> us = translator.translate("MSFT", "buy", 1, null);

        assertThat(hk).map(Order::market).contains(MarketType.HK);
        assertThat(cn).map(Order::market).contains(MarketType.CN);
        assertThat(us).map(Order::market).contains(MarketType.US);
        assertThat(us).map(Order::timeInForce).contains("DAY");
    }
}
