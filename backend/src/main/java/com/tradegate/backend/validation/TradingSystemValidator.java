package com.tradegate.backend.validation;

import com.tradegate.backend.broker.BrokerCallGuard;
import com.tradegate.backend.broker.BrokerPort;
import com.tradegate.backend.broker.BrokerPortFactory;
import com.tradegate.backend.broker.BrokerResult;
import com.tradegate.backend.config.RiskProperties;
import com.tradegate.backend.config.TradingProperties;
import com.tradegate.backend.execution.LocalPortfolio;
import com.tradegate.backend.execution.OrderTranslator;
import com.tradegate.backend.execution.TradeExecutor;
import com.tradegate.backend.model.AccountInfo;
import com.tradegate.backend.model.Order;
import com.tradegate.backend.model.OrderStatus;
import com.tradegate.backend.model.Position;
import com.tradegate.backend.model.TradeResult;
import com.tradegate.backend.model.TradeSide;
import com.tradegate.backend.risk.RiskManager;
import com.tradegate.backend.risk.RiskSummary;
import com.tradegate.backend.risk.RiskVerdict;
import com.tradegate.backend.service.MetricsService;
import com.tradegate.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Smoke-tests the trading stack end to end against fresh broker ports, never the live session.
 * Orders are only placed in dry-run mode.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingSystemValidator {

    static final Duration CONNECT_BUDGET = Duration.ofSeconds(10);
    static final Duration DATA_BUDGET = Duration.ofSeconds(5);

    private final TradingProperties tradingProperties;
    private final BrokerPortFactory brokerPortFactory;
    private final BrokerCallGuard brokerCallGuard;
    private final OrderTranslator orderTranslator;
    private final MetricsService metricsService;
    private final Clock clock;

    @Value("${trading.validation.probe-symbol:AAPL}")
    private String probeSymbol = "AAPL";

    @Value("${trading.validation.probe-price:150.00}")
    private BigDecimal probePrice = new BigDecimal("150.00");

    public ValidationReport runFullValidation() {
        log.info("Starting trading system validation (dry run: {})", tradingProperties.isDryRun());
        List<ValidationResult> results = new ArrayList<>();
        validateConfiguration(results);
        validateConnections(results);
        validateApiFunctionality(results);
        validateRiskControls(results);
        validateOrderManagement(results);
        validateIntegration(results);
        validatePerformance(results);
        ValidationReport report = buildReport(results);
        log.info("Validation finished: {}/{} passed", report.summary().passed(), report.summary().totalTests());
        return report;
    }

    /** Configuration and connectivity only. */
    public boolean runQuickValidation() {
        List<ValidationResult> results = new ArrayList<>();
        validateConfiguration(results);
        validateConnections(results);
        return results.stream().allMatch(ValidationResult::passed);
    }

    void validateConfiguration(List<ValidationResult> results) {
        boolean complete = tradingProperties.getHost() != null && !tradingProperties.getHost().isBlank();
        results.add(result("Configuration Completeness", complete,
                complete ? "All required configuration fields present" : "Missing required fields: [host]"));

        int port = tradingProperties.getPort();
        boolean portValid = port > 0 && port <= 65535;
        results.add(result("Port Configuration", portValid,
                portValid ? "Port configuration valid: " + port : "Invalid port number: " + port));

        boolean limitsValid = tradingProperties.getMaxPositionSize() > 0
                && MoneyUtils.isPositive(tradingProperties.getMaxOrderValue());
        results.add(result("Risk Limits", limitsValid,
                limitsValid ? "Risk limits configuration valid" : "Invalid max_position_size or max_order_value"));
    }

    void validateConnections(List<ValidationResult> results) {
        BrokerPort port = brokerPortFactory.create(tradingProperties.isDryRun());
        try {
            boolean connected = brokerCallGuard.connect(port);
            results.add(result("Broker Connection", connected,
                    connected ? "Connected to " + port.name() + " broker" : "Failed to connect to " + port.name() + " broker"));
            if (!connected) {
                return;
            }
            BrokerResult<AccountInfo> account = brokerCallGuard.call("account info", port::getAccountInfo);
            if (account.isSuccess()) {
                results.add(result("Account Info Retrieval", true,
                        "Account " + account.value().accountId() + " retrieved",
                        Map.of("cash", account.value().cash(), "buying_power", account.value().buyingPower())));
            } else {
                results.add(result("Account Info Retrieval", false,
                        "Failed to retrieve account info: " + account.message()));
            }
        } finally {
            port.disconnect();
        }
    }

    void validateApiFunctionality(List<ValidationResult> results) {
        BrokerPort port = brokerPortFactory.create(tradingProperties.isDryRun());
        try {
            if (!brokerCallGuard.connect(port)) {
                results.add(result("API Functionality", false, "Could not connect to broker"));
                return;
            }
            BrokerResult<BigDecimal> price = brokerCallGuard.call("quote", () -> port.getMarketPrice(probeSymbol));
            results.add(price.isSuccess()
                    ? result("Market Data Retrieval", true, "Retrieved " + probeSymbol + " price: " + price.value())
                    : result("Market Data Retrieval", false, "Failed to retrieve valid market price: " + price.message()));

            BrokerResult<List<Position>> positions = brokerCallGuard.call("positions", port::getPositions);
            results.add(positions.isSuccess()
                    ? result("Position Retrieval", true, "Retrieved " + positions.value().size() + " positions")
                    : result("Position Retrieval", false, "Position retrieval error: " + positions.message()));
        } finally {
            port.disconnect();
        }
    }

    void validateRiskControls(List<ValidationResult> results) {
        RiskManager riskManager = new RiskManager(validationRiskProperties(), clock);
        RiskSummary summary = riskManager.getRiskSummary();
        boolean initialised = summary.limits() != null && !summary.limits().isEmpty();
        results.add(result("Risk Limits Initialization", initialised,
                initialised ? "Risk limits initialized successfully" : "Failed to initialize risk limits"));

        Order probe = Order.builder().symbol(probeSymbol).side(TradeSide.BUY).quantity(100).build();
        AccountInfo account = AccountInfo.builder()
                .accountId("validation")
                .totalAssets(MoneyUtils.bd(50000.0))
                .cash(MoneyUtils.bd(25000.0))
                .marketValue(MoneyUtils.bd(25000.0))
                .unrealizedPnl(MoneyUtils.ZERO)
                .realizedPnl(MoneyUtils.ZERO)
                .buyingPower(MoneyUtils.bd(25000.0))
                .build();
        RiskVerdict verdict = riskManager.validateOrder(probe, account, List.of());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("approved", verdict.approved());
        details.put("reason", verdict.reason());
        results.add(result("Trade Risk Validation", true, "Risk validation completed: " + verdict.riskLevel(), details));
    }

    void validateOrderManagement(List<ValidationResult> results) {
        if (!tradingProperties.isDryRun()) {
            results.add(result("Order Management", true, "Skipping order tests in live mode for safety"));
            return;
        }
        BrokerPort port = brokerPortFactory.create(true);
        try {
            if (!brokerCallGuard.connect(port)) {
                results.add(result("Order Management", false, "Could not connect to simulated broker"));
                return;
            }
            Order order = Order.builder().symbol(probeSymbol).side(TradeSide.BUY).quantity(1).price(probePrice).build();
            TradeResult trade = brokerCallGuard.submit(port, order);
            boolean accepted = trade.status() == OrderStatus.FILLED || trade.status() == OrderStatus.SUBMITTED;
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("order_id", trade.orderId());
            details.put("symbol", trade.symbol());
            if (!accepted) {
                details.put("error", trade.errorMsg());
            }
            results.add(result("Order Submission", accepted,
                    (accepted ? "Order submitted successfully: " : "Order submission failed: ") + trade.status(), details));
        } finally {
            port.disconnect();
        }
    }

    void validateIntegration(List<ValidationResult> results) {
        BrokerPort port = brokerPortFactory.create(tradingProperties.isDryRun());
        try {
            if (!brokerCallGuard.connect(port)) {
                results.add(result("Live Executor Integration", false, "Failed to connect live executor"));
                return;
            }
            results.add(result("Live Executor Integration", true, "Live executor connected successfully"));
            if (!tradingProperties.isDryRun()) {
                return;
            }
            TradeExecutor executor = new TradeExecutor(port, new RiskManager(validationRiskProperties(), clock),
                    orderTranslator, brokerCallGuard, tradingProperties, metricsService, clock);
            LocalPortfolio portfolio = new LocalPortfolio(MoneyUtils.bd(10000.0));
            int executed = executor.execute(probeSymbol, "buy", 1, probePrice, portfolio);
            results.add(result("Portfolio Integration", executed > 0,
                    "Portfolio integration test: " + executed + " shares executed"));
        } finally {
            port.disconnect();
        }
    }

    void validatePerformance(List<ValidationResult> results) {
        BrokerPort port = brokerPortFactory.create(tradingProperties.isDryRun());
        try {
            long started = System.nanoTime();
            boolean connected = brokerCallGuard.connect(port);
            Duration connectTime = Duration.ofNanos(System.nanoTime() - started);
            if (!connected) {
                results.add(result("Connection Performance", false, "Could not establish connection for performance test"));
                return;
            }
            results.add(result("Connection Performance", connectTime.compareTo(CONNECT_BUDGET) < 0,
                    String.format(Locale.ROOT, "Connection time: %.2f seconds", connectTime.toMillis() / 1000.0)));

            started = System.nanoTime();
            brokerCallGuard.call("quote", () -> port.getMarketPrice(probeSymbol));
            Duration dataTime = Duration.ofNanos(System.nanoTime() - started);
            results.add(result("Data Retrieval Performance", dataTime.compareTo(DATA_BUDGET) < 0,
                    String.format(Locale.ROOT, "Data retrieval time: %.2f seconds", dataTime.toMillis() / 1000.0)));
        } finally {
            port.disconnect();
        }
    }

    ValidationReport buildReport(List<ValidationResult> results) {
        int total = results.size();
        int passed = (int) results.stream().filter(ValidationResult::passed).count();
        ValidationReport.Summary summary = new ValidationReport.Summary(total, passed, total - passed,
                total == 0 ? 0.0 : (double) passed / total, clock.instant());
        return new ValidationReport(summary, List.copyOf(results), recommendations(results));
    }

    List<String> recommendations(List<ValidationResult> results) {
        List<ValidationResult> failed = results.stream().filter(result -> !result.passed()).toList();
        List<String> recommendations = new ArrayList<>();
        if (failed.isEmpty()) {
            recommendations.add("All validations passed - system ready for trading");
            return recommendations;
        }
        recommendations.add("Address failed validation tests before proceeding with live trading");
        if (failed.stream().anyMatch(result -> result.testName().contains("Connection"))) {
            recommendations.add("Ensure the broker gateway is running and accessible");
        }
        if (failed.stream().anyMatch(result -> result.testName().contains("Configuration"))) {
            recommendations.add("Review and correct trading configuration");
        }
        if (failed.stream().anyMatch(result -> result.testName().contains("Risk"))) {
            recommendations.add("Review risk control settings");
        }
        return recommendations;
    }

    private RiskProperties validationRiskProperties() {
        return RiskProperties.fromMap(Map.of(
                "max_portfolio_value", 100000.0,
                "max_daily_loss", 5000.0,
                "max_position_concentration", 0.20,
                "max_daily_trades", 50,
                "max_leverage", 2.0,
                "max_drawdown", 0.10));
    }

    private ValidationResult result(String name, boolean passed, String message) {
        return result(name, passed, message, Map.of());
    }

    private ValidationResult result(String name, boolean passed, String message, Map<String, Object> details) {
        if (passed) {
            log.info("[PASS] {}: {}", name, message);
        } else {
            log.warn("[FAIL] {}: {}", name, message);
        }
        return new ValidationResult(name, passed, message, details, clock.instant());
    }
}
