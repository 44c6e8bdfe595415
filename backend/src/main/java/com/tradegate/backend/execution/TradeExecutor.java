package com.tradegate.backend.execution;

import com.tradegate.backend.broker.BrokerCallGuard;
import com.tradegate.backend.broker.BrokerPort;
import com.tradegate.backend.broker.BrokerResult;
import com.tradegate.backend.config.TradingProperties;
import com.tradegate.backend.model.AccountInfo;
import com.tradegate.backend.model.ErrorCategory;
import com.tradegate.backend.model.Order;
import com.tradegate.backend.model.Position;
import com.tradegate.backend.model.TradeAction;
import com.tradegate.backend.model.TradeResult;
import com.tradegate.backend.risk.RiskManager;
import com.tradegate.backend.risk.RiskVerdict;
import com.tradegate.backend.service.MetricsService;
import com.tradegate.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Runs one decision through translate, pre-trade checks, risk approval, submission and
 * bookkeeping. Never throws: every outcome is an executed quantity, zero on any failure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeExecutor {

    static final int FAILED_TRADE_CAPACITY = 100;
    static final int RECENT_FAILURES = 10;

    private final BrokerPort brokerPort;
    private final RiskManager riskManager;
    private final OrderTranslator orderTranslator;
    private final BrokerCallGuard brokerCallGuard;
    private final TradingProperties tradingProperties;
    private final MetricsService metricsService;
    private final Clock clock;

    private final Deque<FailedTrade> failedTrades = new ArrayDeque<>();
    private final List<ExecutionRecord> executionHistory = new ArrayList<>();
    private int totalTrades;
    private int successfulTrades;
    private int failedTradeCount;
    private BigDecimal totalExecutedValue = MoneyUtils.ZERO;
    private BigDecimal totalCommission = MoneyUtils.ZERO;

    public int execute(String ticker, String action, int quantity, BigDecimal currentPrice, LocalPortfolio portfolio) {
        MDC.put("ticker", ticker);
        try {
            Optional<Order> translated = orderTranslator.translate(ticker, action, quantity, currentPrice);
            if (translated.isEmpty()) {
                log.debug("No order for {} action={} quantity={}", ticker, action, quantity);
                return 0;
            }
            Order order = translated.get();
            String symbol = order.symbol();
            TradeAction tradeAction = TradeAction.from(action).orElseThrow();
            countAttempt();

            Optional<Rejection> rejection = preTradeCheck(order, tradeAction, currentPrice, portfolio);
            if (rejection.isPresent()) {
                log.warn("Trade validation failed for {} {} {}: {}", action, quantity, symbol, rejection.get().reason());
                recordFailure(symbol, action, quantity, 0, currentPrice, rejection.get().category(), rejection.get().reason());
                return 0;
            }

            log.info("Submitting {} {} {} via {}", order.side(), order.quantity(), symbol, brokerPort.name());
            metricsService.incrementOrdersPlaced();
            TradeResult result = brokerCallGuard.submit(brokerPort, order);

            if (!result.hasFill()) {
                String error = result.errorMsg() != null ? result.errorMsg() : "Order not filled (" + result.status() + ")";
                log.warn("Order for {} produced no fill: {}", symbol, error);
                recordFailure(symbol, action, quantity, 0, currentPrice, ErrorCategory.EXECUTION, error);
                return 0;
            }

            int executed = result.filledQuantity();
            BigDecimal fillPrice = result.avgPrice() != null ? result.avgPrice() : MoneyUtils.scale(currentPrice);
            BigDecimal realized = applyFill(portfolio, tradeAction, symbol, executed, fillPrice, result.commission());
            riskManager.recordTrade(order, executed, fillPrice);
            riskManager.updatePnl(MoneyUtils.subtract(realized, result.commission()));
            metricsService.recordOrderFilled();
            recordSuccess(new ExecutionRecord(clock.instant(), symbol, action, result.orderId(), quantity, executed,
                    fillPrice, result.commission(), result.status()));
            log.info("Executed {} {} of {} {} @ {} (order {}, status {})",
                    action, executed, quantity, symbol, fillPrice, result.orderId(), result.status());
            return executed;
        } catch (RuntimeException e) {
            log.error("Trade execution error for {} {}: {}", action, ticker, e.getMessage(), e);
            recordFailure(ticker == null ? null : ticker.trim(), action, quantity, 0, currentPrice,
                    ErrorCategory.EXECUTION, e.getMessage());
            return 0;
        } finally {
            MDC.remove("ticker");
        }
    }

    public synchronized ExecutionReport getExecutionReport() {
        double successRate = totalTrades == 0 ? 0.0 : (double) successfulTrades / totalTrades;
        return new ExecutionReport(totalTrades, successfulTrades, failedTradeCount, successRate,
                totalExecutedValue, totalCommission, recentFailures(), clock.instant());
    }

    public synchronized List<FailedTrade> recentFailures() {
        List<FailedTrade> all = new ArrayList<>(failedTrades);
        return List.copyOf(all.subList(Math.max(0, all.size() - RECENT_FAILURES), all.size()));
    }

    public synchronized List<ExecutionRecord> getExecutionHistory() {
        return List.copyOf(executionHistory);
    }

    private Optional<Rejection> preTradeCheck(Order order, TradeAction action, BigDecimal currentPrice,
                                              LocalPortfolio portfolio) {
        if (!brokerPort.isConnected()) {
            return reject(ErrorCategory.CONNECTION, "Not connected to trading platform");
        }
        BrokerResult<AccountInfo> account = brokerCallGuard.call("account info", brokerPort::getAccountInfo);
        if (!account.isSuccess()) {
            return reject(account.failure().category(), "Unable to get account information: " + account.message());
        }
        BrokerResult<List<Position>> positions = brokerCallGuard.call("positions", brokerPort::getPositions);
        if (!positions.isSuccess()) {
            return reject(positions.failure().category(), "Unable to get positions: " + positions.message());
        }

        BigDecimal estimatedValue = MoneyUtils.multiply(MoneyUtils.scale(currentPrice), order.quantity());
        AccountInfo info = account.value();
        if (order.isBuy() && estimatedValue.compareTo(MoneyUtils.scale(info.buyingPower())) > 0) {
            return reject(ErrorCategory.VALIDATION, "Insufficient buying power. Required: " + estimatedValue
                    + ", Available: " + MoneyUtils.scale(info.buyingPower()));
        }
        if (action == TradeAction.SHORT && !tradingProperties.isEnableShortSelling()) {
            return reject(ErrorCategory.VALIDATION, "Short selling is disabled");
        }
        if (action == TradeAction.SELL) {
            int held = heldQuantity(order.symbol(), portfolio, positions.value());
            if (held < order.quantity() && !tradingProperties.isEnableShortSelling()) {
                return reject(ErrorCategory.VALIDATION, "Insufficient shares to sell. Required: "
                        + order.quantity() + ", Available: " + held);
            }
        }
        if (estimatedValue.compareTo(MoneyUtils.scale(tradingProperties.getMaxOrderValue())) > 0) {
            return reject(ErrorCategory.VALIDATION, "Order value exceeds limit. Value: " + estimatedValue
                    + ", Limit: " + MoneyUtils.scale(tradingProperties.getMaxOrderValue()));
        }
        if (riskManager.getDailyTrades() >= tradingProperties.getMaxDailyTrades()) {
            return reject(ErrorCategory.VALIDATION, "Daily trade limit reached: " + tradingProperties.getMaxDailyTrades());
        }

        RiskVerdict verdict = riskManager.validateOrder(order, info, positions.value());
        if (!verdict.approved()) {
            return reject(ErrorCategory.VALIDATION, "Risk check failed: " + verdict.reason());
        }
        return Optional.empty();
    }

    /**
     * Held long shares from the local mirror; broker positions only when no mirror is supplied.
     */
    private int heldQuantity(String symbol, LocalPortfolio portfolio, List<Position> positions) {
        if (portfolio != null) {
            return portfolio.getLongQuantity(symbol);
        }
        return positions.stream()
                .filter(position -> symbol.equals(position.symbol()))
                .mapToInt(Position::quantity)
                .findFirst()
                .orElse(0);
    }

    /**
     * Books a fill against the mirror. A sell beyond the long leg opens a short and a cover beyond
     * the short leg buys long, matching what the broker actually did.
     */
    private BigDecimal applyFill(LocalPortfolio portfolio, TradeAction action, String symbol, int quantity,
                                 BigDecimal price, BigDecimal commission) {
        if (portfolio == null) {
            return MoneyUtils.ZERO;
        }
        BigDecimal realized = MoneyUtils.ZERO;
        switch (action) {
            case BUY -> portfolio.applyLongBuy(symbol, quantity, price);
            case SHORT -> portfolio.applyShortOpen(symbol, quantity, price);
            case SELL -> {
                int fromLong = Math.min(quantity, portfolio.getLongQuantity(symbol));
                realized = portfolio.applyLongSell(symbol, fromLong, price);
                if (quantity > fromLong) {
                    portfolio.applyShortOpen(symbol, quantity - fromLong, price);
                }
            }
            case COVER -> {
                int fromShort = Math.min(quantity, portfolio.getShortQuantity(symbol));
                realized = portfolio.applyShortCover(symbol, fromShort, price);
                if (quantity > fromShort) {
                    portfolio.applyLongBuy(symbol, quantity - fromShort, price);
                }
            }
            case HOLD -> {
                return MoneyUtils.ZERO;
            }
        }
        portfolio.deductCommission(commission);
        return realized;
    }

    private synchronized void countAttempt() {
        totalTrades++;
    }

    private synchronized void recordSuccess(ExecutionRecord record) {
        successfulTrades++;
        executionHistory.add(record);
        totalExecutedValue = MoneyUtils.add(totalExecutedValue,
                MoneyUtils.multiply(record.fillPrice(), record.executedQuantity()));
        totalCommission = MoneyUtils.add(totalCommission, record.commission());
    }

    private synchronized void recordFailure(String symbol, String action, int requested, int executed,
                                            BigDecimal price, ErrorCategory category, String error) {
        failedTradeCount++;
        failedTrades.addLast(new FailedTrade(clock.instant(), symbol, action, requested, executed,
                price == null ? null : MoneyUtils.scale(price), category, error == null ? "Unknown error" : error));
        while (failedTrades.size() > FAILED_TRADE_CAPACITY) {
            failedTrades.removeFirst();
        }
    }

    private Optional<Rejection> reject(ErrorCategory category, String reason) {
        return Optional.of(new Rejection(category, reason));
    }

    private record Rejection(ErrorCategory category, String reason) {
    }
}
