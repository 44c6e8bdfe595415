package com.tradegate.backend.execution;

import com.tradegate.backend.broker.BrokerPort;
import com.tradegate.backend.broker.SimulatedBrokerPort;
import com.tradegate.backend.config.RiskProperties;
import com.tradegate.backend.config.TradingProperties;
import com.tradegate.backend.model.TradingDecision;
import com.tradegate.backend.risk.RiskManager;
import com.tradegate.backend.service.MetricsService;
import com.tradegate.backend.support.MutableClock;
import com.tradegate.backend.support.TestBrokers;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TradingSessionServiceTest {

    private MutableClock clock;
    private TradingProperties properties;
    private RiskManager riskManager;
    private SimulatedBrokerPort broker;
    private TradeExecutor executor;
    private TradingSessionService session;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-04T14:30:00Z"));
        properties = new TradingProperties();
        properties.getSimulation().getPrices().put("AAPL", new BigDecimal("150.00"));
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry());
        riskManager = new RiskManager(new RiskProperties(), clock, metricsService);
        broker = new SimulatedBrokerPort(properties.getSimulation(), null, clock);
        executor = new TradeExecutor(broker, riskManager, new OrderTranslator(), TestBrokers.guard(), properties,
                metricsService, clock);
        session = new TradingSessionService(broker, TestBrokers.guard(), executor, riskManager, properties, clock);
    }

    @Test
    void batchReportsEveryTickerInOrder() {
        Map<String, TradingDecision> decisions = new LinkedHashMap<>();
        decisions.put("AAPL", decision("buy", 10));
        decisions.put("MSFT", decision("hold", 0));
        decisions.put("TSLA", decision("buy", 5));
        decisions.put("NVDA", decision("dance", 5));
        decisions.put("GOOG", decision("sell", 10));

        BatchResult result = session.runBatch(decisions, Map.of("GOOG", new BigDecimal("100")));

        assertThat(broker.isConnected()).isTrue();
        assertThat(result.outcomes()).extracting(BatchResult.TickerOutcome::ticker)
                .containsExactly("AAPL", "MSFT", "TSLA", "NVDA", "GOOG");
        assertThat(result.outcomes()).extracting(BatchResult.TickerOutcome::status).containsExactly(
                TickerStatus.EXECUTED, TickerStatus.SKIPPED, TickerStatus.FAILED, TickerStatus.FAILED, TickerStatus.FAILED);
        assertThat(result.outcomes().get(0).executedQuantity()).isEqualTo(10);
        assertThat(result.outcomes().get(0).price()).isEqualByComparingTo("150.00");
        assertThat(result.outcomes().get(2).message()).isEqualTo("Could not get price for TSLA");
        assertThat(result.outcomes().get(3).message()).isEqualTo("Unknown action: dance");
        assertThat(result.outcomes().get(4).message()).startsWith("Insufficient shares to sell");

        BatchResult.Summary summary = result.summary();
        assertThat(summary.total()).isEqualTo(5);
        assertThat(summary.executed()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(3);
        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(summary.errors()).isZero();
        assertThat(result.portfolio().positions().get("AAPL").longQuantity()).isEqualTo(10);
        assertThat(result.portfolio().cash()).isEqualByComparingTo("98496.9985");
    }

    @Test
    void portfolioCarriesOverBetweenBatches() {
        session.runBatch(Map.of("AAPL", decision("buy", 10)), Map.of());

        BatchResult second = session.runBatch(Map.of("AAPL", decision("sell", 10)), Map.of());

        assertThat(second.outcomes()).singleElement()
                .extracting(BatchResult.TickerOutcome::status).isEqualTo(TickerStatus.EXECUTED);
        assertThat(session.portfolio().getLongQuantity("AAPL")).isZero();
        assertThat(riskManager.getDailyTrades()).isEqualTo(2);
    }

    @Test
    void unexpectedExceptionBecomesErrorOutcome() {
        TradeExecutor failing = mock(TradeExecutor.class);
        when(failing.execute(anyString(), anyString(), anyInt(), any(), any()))
                .thenThrow(new IllegalStateException("executor crashed"));
        TradingSessionService crashing = new TradingSessionService(broker, TestBrokers.guard(), failing, riskManager,
                properties, clock);

        BatchResult result = crashing.runBatch(Map.of("AAPL", decision("buy", 1)), Map.of());

        assertThat(result.outcomes()).singleElement().satisfies(outcome -> {
            assertThat(outcome.status()).isEqualTo(TickerStatus.ERROR);
            assertThat(outcome.message()).isEqualTo("executor crashed");
        });
        assertThat(result.summary().errors()).isEqualTo(1);
    }

    @Test
    void portfolioStartsFromBrokerCash() {
        properties.getSimulation().setStartingCash(new BigDecimal("250000"));
        SimulatedBrokerPort richBroker = new SimulatedBrokerPort(properties.getSimulation(), null, clock);
        TradingSessionService richSession = new TradingSessionService(richBroker, TestBrokers.guard(), executor,
                riskManager, properties, clock);
        richSession.ensureConnected();

        assertThat(richSession.portfolio().getCash()).isEqualByComparingTo("250000");

        LocalPortfolio replacement = new LocalPortfolio(new BigDecimal("5"));
        richSession.resetPortfolio(replacement);
        assertThat(richSession.portfolio()).isSameAs(replacement);
    }

    @Test
    void sessionValidationReflectsConnection() {
        SessionStatus ready = session.validateTradingSession();

        assertThat(ready.ready()).isTrue();
        assertThat(ready.dryRun()).isTrue();
        assertThat(ready.broker()).isEqualTo("SIMULATED");
        assertThat(ready.account().buyingPower()).isEqualByComparingTo("100000");

        BrokerPort offline = mock(BrokerPort.class);
        when(offline.connect()).thenReturn(false);
        TradingSessionService offlineSession = new TradingSessionService(offline, TestBrokers.guard(), executor,
                riskManager, properties, clock);
        SessionStatus notReady = offlineSession.validateTradingSession();

        assertThat(notReady.ready()).isFalse();
        assertThat(notReady.message()).isEqualTo("Not connected to trading platform");
    }

    @Test
    void accountSummaryIncludesPositions() {
        session.runBatch(Map.of("AAPL", decision("buy", 10)), Map.of());

        SessionStatus summary = session.getAccountSummary();

        assertThat(summary.ready()).isTrue();
        assertThat(summary.positions()).singleElement().satisfies(position -> {
            assertThat(position.symbol()).isEqualTo("AAPL");
            assertThat(position.quantity()).isEqualTo(10);
        });
        assertThat(summary.execution().successfulTrades()).isEqualTo(1);
        assertThat(summary.risk().session().tradeCount()).isEqualTo(1);
    }

    private static TradingDecision decision(String action, int quantity) {
        return new TradingDecision(action, quantity, 80.0, "test");
    }
}
