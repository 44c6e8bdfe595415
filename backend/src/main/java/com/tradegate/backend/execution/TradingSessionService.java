package com.tradegate.backend.execution;

import com.tradegate.backend.broker.BrokerCallGuard;
import com.tradegate.backend.broker.BrokerPort;
import com.tradegate.backend.broker.BrokerResult;
import com.tradegate.backend.config.TradingProperties;
import com.tradegate.backend.model.AccountInfo;
import com.tradegate.backend.model.Position;
import com.tradegate.backend.model.TradeAction;
import com.tradegate.backend.model.TradingDecision;
import com.tradegate.backend.risk.RiskManager;
import com.tradegate.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Owns the trading session: the broker connection, the local portfolio mirror, and batch
 * execution of decisions. Tickers run one at a time in the batch's iteration order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingSessionService {

    private final BrokerPort brokerPort;
    private final BrokerCallGuard brokerCallGuard;
    private final TradeExecutor tradeExecutor;
    private final RiskManager riskManager;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    private LocalPortfolio portfolio;

    public synchronized boolean ensureConnected() {
        if (brokerPort.isConnected()) {
            return true;
        }
        boolean connected = brokerCallGuard.connect(brokerPort);
        if (!connected) {
            log.error("Unable to connect to broker {}", brokerPort.name());
        }
        return connected;
    }

    public synchronized BatchResult runBatch(Map<String, TradingDecision> decisions, Map<String, BigDecimal> prices) {
        ensureConnected();
        LocalPortfolio book = portfolio();
        List<BatchResult.TickerOutcome> outcomes = new ArrayList<>();
        int executed = 0;
        int failed = 0;
        int errors = 0;
        int skipped = 0;

        for (Map.Entry<String, TradingDecision> entry : decisions.entrySet()) {
            BatchResult.TickerOutcome outcome = runTicker(entry.getKey(), entry.getValue(), prices, book);
            outcomes.add(outcome);
            switch (outcome.status()) {
                case EXECUTED -> executed++;
                case FAILED -> failed++;
                case ERROR -> errors++;
                case SKIPPED -> skipped++;
            }
        }

        boolean halted = riskManager.isCircuitBreakerActive();
        log.info("Batch complete: {} executed, {} failed, {} errors, {} skipped{}",
                executed, failed, errors, skipped, halted ? " (circuit breaker ACTIVE)" : "");
        BatchResult.Summary summary = new BatchResult.Summary(outcomes.size(), executed, failed, errors, skipped,
                halted, clock.instant());
        return new BatchResult(List.copyOf(outcomes), summary, book.snapshot());
    }

    private BatchResult.TickerOutcome runTicker(String ticker, TradingDecision decision, Map<String, BigDecimal> prices,
                                                LocalPortfolio book) {
        String action = decision == null ? null : decision.action();
        int quantity = decision == null ? 0 : decision.quantity();
        try {
            boolean hold = TradeAction.from(action).map(value -> value == TradeAction.HOLD).orElse(false);
            if (hold || quantity <= 0) {
                return new BatchResult.TickerOutcome(ticker, action, quantity, 0, null, TickerStatus.SKIPPED,
                        "No trade required");
            }
            if (TradeAction.from(action).isEmpty()) {
                return new BatchResult.TickerOutcome(ticker, action, quantity, 0, null, TickerStatus.FAILED,
                        "Unknown action: " + action);
            }
            BigDecimal price = prices == null ? null : prices.get(ticker);
            if (!MoneyUtils.isPositive(price)) {
                BrokerResult<BigDecimal> quote = brokerCallGuard.call("quote " + ticker,
                        () -> brokerPort.getMarketPrice(ticker));
                if (!quote.isSuccess()) {
                    log.warn("Could not get price for {}: {}", ticker, quote.message());
                    return new BatchResult.TickerOutcome(ticker, action, quantity, 0, null, TickerStatus.FAILED,
                            "Could not get price for " + ticker);
                }
                price = quote.value();
            }

            int filled = tradeExecutor.execute(ticker, action, quantity, price, book);
            if (filled > 0) {
                return new BatchResult.TickerOutcome(ticker, action, quantity, filled, price, TickerStatus.EXECUTED,
                        "Executed " + filled + " of " + quantity);
            }
            return new BatchResult.TickerOutcome(ticker, action, quantity, 0, price, TickerStatus.FAILED,
                    lastFailureFor(ticker));
        } catch (RuntimeException e) {
            log.error("Unexpected error processing {}: {}", ticker, e.getMessage(), e);
            return new BatchResult.TickerOutcome(ticker, action, quantity, 0, null, TickerStatus.ERROR, e.getMessage());
        }
    }

    public synchronized LocalPortfolio portfolio() {
        if (portfolio == null) {
            BigDecimal cash = tradingProperties.getSimulation().getStartingCash();
            if (brokerPort.isConnected()) {
                BrokerResult<AccountInfo> account = brokerCallGuard.call("account info", brokerPort::getAccountInfo);
                if (account.isSuccess()) {
                    cash = account.value().cash();
                } else {
                    log.warn("Account unavailable ({}); local portfolio starts from configured cash {}",
                            account.message(), cash);
                }
            }
            portfolio = new LocalPortfolio(cash);
            log.info("Local portfolio initialised with cash {}", portfolio.getCash());
        }
        return portfolio;
    }

    /** Replaces the session's mirror, for callers that manage their own portfolio state. */
    public synchronized void resetPortfolio(LocalPortfolio replacement) {
        this.portfolio = replacement;
    }

    public SessionStatus validateTradingSession() {
        if (!ensureConnected()) {
            return status(false, "Not connected to trading platform", null, List.of());
        }
        BrokerResult<AccountInfo> account = brokerCallGuard.call("account info", brokerPort::getAccountInfo);
        if (!account.isSuccess()) {
            return status(false, "Cannot retrieve account information: " + account.message(), null, List.of());
        }
        if (!MoneyUtils.isPositive(account.value().buyingPower())) {
            return status(false, "No buying power available", account.value(), List.of());
        }
        return status(true, "Trading session validated", account.value(), List.of());
    }

    public SessionStatus getAccountSummary() {
        if (!ensureConnected()) {
            return status(false, "Not connected to trading platform", null, List.of());
        }
        BrokerResult<AccountInfo> account = brokerCallGuard.call("account info", brokerPort::getAccountInfo);
        BrokerResult<List<Position>> positions = brokerCallGuard.call("positions", brokerPort::getPositions);
        String message = account.isSuccess() ? "Account summary" : "Account unavailable: " + account.message();
        return status(account.isSuccess(), message, account.orElse(null), positions.orElse(List.of()));
    }

    private SessionStatus status(boolean ready, String message, AccountInfo account, List<Position> positions) {
        return new SessionStatus(ready, message, tradingProperties.isDryRun(), brokerPort.name(), account, positions,
                tradeExecutor.getExecutionReport(), riskManager.getRiskSummary());
    }

    private String lastFailureFor(String ticker) {
        List<FailedTrade> recent = tradeExecutor.recentFailures();
        for (int i = recent.size() - 1; i >= 0; i--) {
            if (ticker.trim().equals(recent.get(i).ticker())) {
                return recent.get(i).error();
            }
        }
        return "Trade not executed";
    }
}
