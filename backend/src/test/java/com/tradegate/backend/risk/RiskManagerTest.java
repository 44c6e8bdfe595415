package com.tradegate.backend.risk;

import com.tradegate.backend.config.RiskProperties;
import com.tradegate.backend.model.AccountInfo;
import com.tradegate.backend.model.Order;
import com.tradegate.backend.model.Position;
import com.tradegate.backend.model.TradeSide;
import com.tradegate.backend.support.MutableClock;
import com.tradegate.backend.util.MoneyUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RiskManagerTest {

    private MutableClock clock;
    private RiskManager riskManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-04T10:00:00Z"));
        riskManager = new RiskManager(new RiskProperties(), clock);
    }

    @Test
    void smallBuyIsApproved() {
        RiskVerdict verdict = riskManager.validateOrder(buy("AAPL", 10, "150"), account("1000000", "1000000"), List.of());

        assertThat(verdict.approved()).isTrue();
        assertThat(verdict.riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(riskManager.getRiskEvents()).isEmpty();
    }

    @Test
    void oversizedOrderIsRejectedWithPositionSizeMessage() {
        RiskVerdict verdict = riskManager.validateOrder(buy("AAPL", 1000, "150"), account("1000000", "1000000"), List.of());

        assertThat(verdict.approved()).isFalse();
        assertThat(verdict.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(verdict.reason()).isEqualTo("Position size $150000.00 exceeds limit $100000.00");
        assertThat(riskManager.getRiskEvents()).hasSize(1);
    }

    @Test
    void orderValueEqualToLimitIsRejected() {
        RiskVerdict verdict = riskManager.validateOrder(buy("AAPL", 1000, "100"), account("1000000", "1000000"), List.of());

        assertThat(verdict.approved()).isFalse();
        assertThat(verdict.reason()).startsWith("Position size $100000.00");
    }

    @Test
    void buyThatBreachesCashReserveIsRejected() {
        RiskVerdict verdict = riskManager.validateOrder(buy("AAPL", 100, "150"), account("20000", "1000000"), List.of());

        assertThat(verdict.approved()).isFalse();
        assertThat(verdict.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(verdict.reason()).isEqualTo("Insufficient cash reserve: $5000.00 < $10000.00");
    }

    @Test
    void sellSkipsCashReserveCheck() {
        Order sell = Order.builder().symbol("AAPL").side(TradeSide.SELL).quantity(100).price(new BigDecimal("150")).build();
        Position held = Position.builder().symbol("AAPL").quantity(100).marketPrice(new BigDecimal("150")).build();

        RiskVerdict verdict = riskManager.validateOrder(sell, account("0", "1000000"), List.of(held));

        assertThat(verdict.approved()).isTrue();
    }

    @Test
    void concentrationAboveLimitIsRejectedAsHighRisk() {
        RiskVerdict verdict = riskManager.validateOrder(buy("AAPL", 200, "150"), account("100000", "100000"), List.of());

        assertThat(verdict.approved()).isFalse();
        assertThat(verdict.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(verdict.reason()).isEqualTo("Position concentration 30.0% exceeds limit 20.0%");
    }

    @Test
    void multipleFailuresAreJoined() {
        RiskVerdict verdict = riskManager.validateOrder(buy("AAPL", 1000, "150"), account("100000", "100000"), List.of());

        assertThat(verdict.approved()).isFalse();
        assertThat(verdict.reason()).contains("Position size", "; ", "Insufficient cash reserve", "Position concentration");
        assertThat(verdict.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void priceFallsBackToHeldPositionMark() {
        Order unpriced = Order.builder().symbol("AAPL").side(TradeSide.BUY).quantity(2500).build();
        Position held = Position.builder().symbol("AAPL").quantity(10).marketPrice(new BigDecimal("50")).build();

        RiskVerdict verdict = riskManager.validateOrder(unpriced, account("1000000", "10000000"), List.of(held));

        assertThat(verdict.approved()).isFalse();
        assertThat(verdict.reason()).startsWith("Position size $125000.00");
    }

    @Test
    void priceFallsBackToConfiguredEstimate() {
        Order unpriced = Order.builder().symbol("MSFT").side(TradeSide.BUY).quantity(999).build();

        RiskVerdict verdict = riskManager.validateOrder(unpriced, account("1000000", "10000000"), List.of());

        assertThat(verdict.approved()).isTrue();
        assertThat(riskManager.validateOrder(unpriced.toBuilder().quantity(1001).build(),
                account("1000000", "10000000"), List.of()).approved()).isFalse();
    }

    @Test
    void lossBeyondLimitTripsCircuitBreaker() {
        riskManager.updatePnl(new BigDecimal("-10000"));
        assertThat(riskManager.isCircuitBreakerActive()).isFalse();

        riskManager.updatePnl(new BigDecimal("-0.01"));

        assertThat(riskManager.isCircuitBreakerActive()).isTrue();
        RiskVerdict verdict = riskManager.validateOrder(buy("AAPL", 1, "150"), account("1000000", "1000000"), List.of());
        assertThat(verdict.approved()).isFalse();
        assertThat(verdict.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(verdict.reason()).isEqualTo(RiskManager.CIRCUIT_BREAKER_MESSAGE);
    }

    @Test
    void approachingDailyLossRaisesLevelButApproves() {
        riskManager.updatePnl(new BigDecimal("-8500"));

        RiskVerdict verdict = riskManager.validateOrder(buy("AAPL", 10, "150"), account("1000000", "1000000"), List.of());

        assertThat(verdict.approved()).isTrue();
        assertThat(verdict.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(riskManager.getRiskEvents()).hasSize(1);
    }

    @Test
    void manualResetKeepsDailyPnl() {
        riskManager.updatePnl(new BigDecimal("-12000"));
        riskManager.resetCircuitBreaker();

        assertThat(riskManager.isCircuitBreakerActive()).isFalse();
        assertThat(riskManager.getDailyPnl()).isEqualByComparingTo("-12000");

        RiskVerdict verdict = riskManager.validateOrder(buy("AAPL", 1, "150"), account("1000000", "1000000"), List.of());
        assertThat(verdict.approved()).isFalse();
        assertThat(verdict.reason()).startsWith("Daily loss limit exceeded");
        assertThat(riskManager.isCircuitBreakerActive()).isTrue();
    }

    @Test
    void dailyTradeLimitRejectsOnceReached() {
        riskManager = new RiskManager(RiskProperties.fromMap(Map.of("max_trades_per_day", 2)), clock);
        Order order = buy("AAPL", 1, "150");
        riskManager.recordTrade(order, 1, new BigDecimal("150"));
        riskManager.recordTrade(order, 1, new BigDecimal("150"));

        RiskVerdict verdict = riskManager.validateOrder(order, account("1000000", "1000000"), List.of());

        assertThat(verdict.approved()).isFalse();
        assertThat(verdict.reason()).isEqualTo("Daily trade limit reached: 2");
    }

    @Test
    void newDayResetsCountersAndBreaker() {
        riskManager.recordTrade(buy("AAPL", 5, "150"), 5, new BigDecimal("150"));
        riskManager.updatePnl(new BigDecimal("-20000"));
        assertThat(riskManager.isCircuitBreakerActive()).isTrue();

        clock.advance(Duration.ofDays(1));

        RiskVerdict verdict = riskManager.validateOrder(buy("AAPL", 10, "150"), account("1000000", "1000000"), List.of());
        assertThat(verdict.approved()).isTrue();
        assertThat(riskManager.isCircuitBreakerActive()).isFalse();
        assertThat(riskManager.getDailyTrades()).isZero();
        assertThat(riskManager.getDailyPnl()).isEqualByComparingTo(MoneyUtils.ZERO);
        assertThat(riskManager.getTradeHistory()).hasSize(1);
    }

    @Test
    void sameDayDoesNotReset() {
        riskManager.recordTrade(buy("AAPL", 5, "150"), 5, new BigDecimal("150"));
        clock.advance(Duration.ofHours(10));

        assertThat(riskManager.getDailyTrades()).isEqualTo(1);
    }

    @Test
    void disabledLimitsAreSkipped() {
        riskManager = new RiskManager(RiskProperties.fromMap(Map.of(
                "max_position_size", 0,
                "max_position_concentration", 0)), clock);
        Order sell = Order.builder().symbol("AAPL").side(TradeSide.SELL).quantity(10000).price(new BigDecimal("150")).build();

        RiskVerdict verdict = riskManager.validateOrder(sell, account("1000000", "1000000"), List.of());

        assertThat(verdict.approved()).isTrue();
    }

    @Test
    void summaryKeepsTheLastTenEvents() {
        for (int i = 0; i < 12; i++) {
            riskManager.validateOrder(buy("AAPL", 1000, "150"), account("1000000", "1000000"), List.of());
        }
        riskManager.recordTrade(buy("AAPL", 10, "150"), 10, new BigDecimal("150"));

        RiskSummary summary = riskManager.getRiskSummary();

        assertThat(riskManager.getRiskEvents()).hasSize(12);
        assertThat(summary.recentEvents()).hasSize(10);
        assertThat(summary.session().tradeCount()).isEqualTo(1);
        assertThat(summary.session().totalVolume()).isEqualByComparingTo("1500");
        assertThat(summary.limits()).extracting(RiskSummary.LimitStatus::name)
                .contains("max_position_size", "max_daily_loss", "max_trades_per_day", "min_cash_reserve");
        assertThat(summary.circuitBreakerActive()).isFalse();
    }

    @Test
    void concurrentMutationsAreSerialized() throws Exception {
        int trades = 200;
        RiskProperties properties = new RiskProperties();
        properties.setMaxTradesPerDay(trades * 10);
        RiskManager shared = new RiskManager(properties, clock);
        Order order = buy("AAPL", 1, "150");
        AccountInfo account = account("1000000", "1000000");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<RiskVerdict>> verdicts = new ArrayList<>();

        try {
            for (int i = 0; i < trades; i++) {
                verdicts.add(pool.submit(() -> {
                    start.await();
                    RiskVerdict verdict = shared.validateOrder(order, account, List.of());
                    shared.recordTrade(order, 1, new BigDecimal("150"));
                    shared.updatePnl(new BigDecimal("-50"));
                    return verdict;
                }));
            }
            start.countDown();
            for (Future<RiskVerdict> verdict : verdicts) {
                assertThat(verdict.get(10, TimeUnit.SECONDS).approved()).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(shared.getDailyTrades()).isEqualTo(trades);
        assertThat(shared.getTradeHistory()).hasSize(trades);
        assertThat(shared.getDailyPnl()).isEqualByComparingTo("-10000");
        assertThat(shared.isCircuitBreakerActive()).isFalse();

        shared.updatePnl(new BigDecimal("-0.01"));

        assertThat(shared.isCircuitBreakerActive()).isTrue();
    }

    private static Order buy(String symbol, int quantity, String price) {
        return Order.builder().symbol(symbol).side(TradeSide.BUY).quantity(quantity).price(new BigDecimal(price)).build();
    }

    private static AccountInfo account(String cash, String totalAssets) {
        return AccountInfo.builder()
                .accountId("TEST")
                .cash(new BigDecimal(cash))
                .totalAssets(new BigDecimal(totalAssets))
                .buyingPower(new BigDecimal(cash))
                .build();
    }
}
