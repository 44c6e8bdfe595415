package com.tradegate.backend.broker;

import com.tradegate.backend.config.TradingProperties;
import com.tradegate.backend.model.AccountInfo;
import com.tradegate.backend.model.Order;
import com.tradegate.backend.model.OrderStatus;
import com.tradegate.backend.model.Position;
import com.tradegate.backend.model.TradeResult;
import com.tradegate.backend.model.TradeSide;
import com.tradegate.backend.support.MutableClock;
import com.tradegate.backend.support.TestBrokers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SimulatedBrokerPortTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-04T14:30:00Z"));
    private SimulatedBrokerPort broker;

    @BeforeEach
    void setUp() {
        TradingProperties.Simulation simulation = TestBrokers.simulation("100000");
        simulation.getPrices().put("AAPL", new BigDecimal("150.00"));
        broker = new SimulatedBrokerPort(simulation, null, clock);
        broker.connect();
    }

    @Test
    void buyFillsInFullWithSlippageAndCommission() {
        TradeResult result = broker.submitOrder(order("AAPL", TradeSide.BUY, 10));

        assertThat(result.status()).isEqualTo(OrderStatus.FILLED);
        assertThat(result.filledQuantity()).isEqualTo(10);
        assertThat(result.avgPrice()).isEqualByComparingTo("150.15");
        assertThat(result.commission()).isEqualByComparingTo("1.5015");
        assertThat(result.orderId()).startsWith("DRY_RUN_");
        assertThat(result.submitTime()).isEqualTo(clock.instant());

        AccountInfo account = broker.getAccountInfo().value();
        assertThat(account.accountId()).isEqualTo("DRY_RUN");
        assertThat(account.cash()).isEqualByComparingTo("98496.9985");
        assertThat(account.marketValue()).isEqualByComparingTo("1500");
        assertThat(account.buyingPower()).isEqualByComparingTo(account.cash());
    }

    @Test
    void sellClosesPositionAndRealizesSlippageLoss() {
        broker.submitOrder(order("AAPL", TradeSide.BUY, 10));

        TradeResult sell = broker.submitOrder(order("AAPL", TradeSide.SELL, 10));

        assertThat(sell.avgPrice()).isEqualByComparingTo("149.85");
        assertThat(broker.getPositions().value()).isEmpty();
        assertThat(broker.getAccountInfo().value().realizedPnl()).isEqualByComparingTo("-3.00");
    }

    @Test
    void positionsTrackAverageCost() {
        broker.submitOrder(order("AAPL", TradeSide.BUY, 10));
        broker.updateQuote("AAPL", new BigDecimal("160"));
        broker.submitOrder(order("AAPL", TradeSide.BUY, 10));

        List<Position> positions = broker.getPositions().value();

        assertThat(positions).singleElement().satisfies(position -> {
            assertThat(position.symbol()).isEqualTo("AAPL");
            assertThat(position.quantity()).isEqualTo(20);
            assertThat(position.avgCost()).isEqualByComparingTo("155.155");
            assertThat(position.marketPrice()).isEqualByComparingTo("160");
        });
    }

    @Test
    void minimumCommissionApplies() {
        TradeResult result = broker.submitOrder(order("AAPL", TradeSide.BUY, 1));

        assertThat(result.commission()).isEqualByComparingTo("1");
    }

    @Test
    void orderPriceIsUsedWhenNoQuoteExists() {
        Order priced = Order.builder().symbol("MSFT").side(TradeSide.BUY).quantity(2).price(new BigDecimal("300")).build();

        TradeResult result = broker.submitOrder(priced);

        assertThat(result.status()).isEqualTo(OrderStatus.FILLED);
        assertThat(result.avgPrice()).isEqualByComparingTo("300.30");
    }

    @Test
    void missingPriceFailsTheOrder() {
        TradeResult result = broker.submitOrder(order("MSFT", TradeSide.BUY, 2));

        assertThat(result.status()).isEqualTo(OrderStatus.FAILED);
        assertThat(result.filledQuantity()).isZero();
        assertThat(result.errorMsg()).isEqualTo("Unable to get market price for simulation");
        assertThat(broker.getMarketPrice("MSFT").failure()).isEqualTo(BrokerFailure.NO_DATA);
    }

    @Test
    void disconnectedBrokerRejectsAndReportsNotConnected() {
        broker.disconnect();

        assertThat(broker.submitOrder(order("AAPL", TradeSide.BUY, 1)).status()).isEqualTo(OrderStatus.REJECTED);
        assertThat(broker.getAccountInfo().failure()).isEqualTo(BrokerFailure.NOT_CONNECTED);
        assertThat(broker.getPositions().isSuccess()).isFalse();
    }

    @Test
    void externalQuoteSourceIsConsulted() {
        SimulatedBrokerPort withFeed = new SimulatedBrokerPort(TestBrokers.simulation("1000"),
                symbol -> "XYZ".equals(symbol) ? Optional.of(new BigDecimal("42")) : Optional.empty(), clock);
        withFeed.connect();

        assertThat(withFeed.getMarketPrice("XYZ").value()).isEqualByComparingTo("42");
        assertThat(withFeed.getMarketPrice("ABC").isSuccess()).isFalse();
    }

    @Test
    void filledOrdersCannotBeCancelled() {
        TradeResult result = broker.submitOrder(order("AAPL", TradeSide.BUY, 1));

        assertThat(broker.cancelOrder(result.orderId())).isFalse();
        assertThat(broker.cancelOrder("DRY_RUN_999")).isFalse();
        assertThat(broker.getOrderStatus(result.orderId()).value().status()).isEqualTo(OrderStatus.FILLED);
        assertThat(broker.getOrderStatus("DRY_RUN_999").failure()).isEqualTo(BrokerFailure.NO_DATA);
    }

    private static Order order(String symbol, TradeSide side, int quantity) {
        return Order.builder().symbol(symbol).side(side).quantity(quantity).build();
    }
}
