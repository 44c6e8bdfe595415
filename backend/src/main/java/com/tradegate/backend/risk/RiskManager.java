package com.tradegate.backend.risk;

import com.tradegate.backend.config.RiskProperties;
import com.tradegate.backend.model.AccountInfo;
import com.tradegate.backend.model.Order;
import com.tradegate.backend.model.Position;
import com.tradegate.backend.service.MetricsService;
import com.tradegate.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session-wide gatekeeper for order approval. All counters, the circuit breaker and the
 * histories are guarded by one lock; callers change them only through this API.
 */
@Slf4j
@Service
public class RiskManager {

    public static final String CIRCUIT_BREAKER_MESSAGE = "Circuit breaker active - trading halted";
    private static final int RECENT_EVENTS = 10;

    private final RiskProperties properties;
    private final Clock clock;
    private final MetricsService metricsService;
    private final ReentrantLock lock = new ReentrantLock();

    private final RiskLimit positionSizeLimit;
    private final RiskLimit portfolioValueLimit;
    private final RiskLimit dailyLossLimit;
    private final RiskLimit dailyTradesLimit;
    private final RiskLimit concentrationLimit;
    private final RiskLimit sectorConcentrationLimit;
    private final RiskLimit leverageLimit;
    private final RiskLimit drawdownLimit;
    private final RiskLimit cashReserveLimit;

    private final List<TradeRecord> tradeHistory = new ArrayList<>();
    private final List<RiskEvent> riskEvents = new ArrayList<>();

    private BigDecimal dailyPnl = MoneyUtils.ZERO;
    private BigDecimal sessionVolume = MoneyUtils.ZERO;
    private int dailyTrades;
    private boolean circuitBreakerActive;
    private LocalDate lastReset;
    private Instant sessionStart;

    @Autowired
    public RiskManager(RiskProperties properties, Clock clock, MetricsService metricsService) {
        this.properties = properties;
        this.clock = clock;
        this.metricsService = metricsService;
        double warning = properties.getWarningThreshold();
        this.positionSizeLimit = new RiskLimit("max_position_size", properties.getMaxPositionSize().doubleValue(), warning);
        this.portfolioValueLimit = new RiskLimit("max_portfolio_value", properties.getMaxPortfolioValue().doubleValue(), warning);
        this.dailyLossLimit = new RiskLimit("max_daily_loss", properties.getMaxDailyLoss().doubleValue(), warning);
        this.dailyTradesLimit = new RiskLimit("max_trades_per_day", properties.getMaxTradesPerDay(), 0.9);
        this.concentrationLimit = new RiskLimit("max_position_concentration", properties.getMaxPositionConcentration(), warning);
        this.sectorConcentrationLimit = new RiskLimit("max_sector_concentration", properties.getMaxSectorConcentration(), warning);
        this.leverageLimit = new RiskLimit("max_leverage", properties.getMaxLeverage(), warning);
        this.drawdownLimit = new RiskLimit("max_drawdown", properties.getMaxDrawdown(), warning);
        this.cashReserveLimit = new RiskLimit("min_cash_reserve", properties.getMinCashReserve().doubleValue(), warning);
        this.lastReset = LocalDate.now(clock);
        this.sessionStart = clock.instant();
        log.info("Risk manager initialised: max position {}, max daily loss {}, max trades/day {}, concentration {}",
                properties.getMaxPositionSize(), properties.getMaxDailyLoss(), properties.getMaxTradesPerDay(),
                properties.getMaxPositionConcentration());
    }

    public RiskManager(RiskProperties properties, Clock clock) {
        this(properties, clock, null);
    }

    public RiskVerdict validateOrder(Order order, AccountInfo accountInfo, List<Position> positions) {
        lock.lock();
        try {
            rolloverIfNeeded();
            if (circuitBreakerActive) {
                recordEvent(order, CIRCUIT_BREAKER_MESSAGE, RiskLevel.CRITICAL);
                recordReject("CIRCUIT_BREAKER");
                return new RiskVerdict(false, CIRCUIT_BREAKER_MESSAGE, RiskLevel.CRITICAL);
            }
            List<Position> held = positions == null ? List.of() : positions;
            Position current = held.stream()
                    .filter(position -> order.symbol().equals(position.symbol()))
                    .findFirst()
                    .orElse(null);
            BigDecimal price = estimatePrice(order, current);

            List<RiskCheck> checks = List.of(
                    checkPositionSize(order, price),
                    checkCashReserve(order, accountInfo, price),
                    checkDailyLoss(),
                    checkTradingFrequency(),
                    checkConcentration(order, accountInfo, current, price));

            RiskLevel level = RiskLevel.LOW;
            List<String> failures = new ArrayList<>();
            String firstFailure = null;
            for (RiskCheck check : checks) {
                level = RiskLevel.max(level, check.level());
                if (!check.ok()) {
                    failures.add(check.message());
                    if (firstFailure == null) {
                        firstFailure = check.name();
                    }
                }
            }

            if (!failures.isEmpty()) {
                String reason = String.join("; ", failures);
                recordEvent(order, reason, level);
                recordReject(firstFailure);
                log.warn("Order {} {} {} rejected by risk: {}", order.side(), order.quantity(), order.symbol(), reason);
                return new RiskVerdict(false, reason, level);
            }
            String warnings = checks.stream()
                    .filter(check -> check.level().isAbove(RiskLevel.LOW))
                    .map(RiskCheck::message)
                    .reduce((left, right) -> left + "; " + right)
                    .orElse(null);
            if (warnings != null) {
                recordEvent(order, warnings, level);
                log.info("Order {} {} {} validated with {} risk: {}", order.side(), order.quantity(), order.symbol(), level, warnings);
            }
            return new RiskVerdict(true, "All risk checks passed", level);
        } finally {
            lock.unlock();
        }
    }

    /** Records an executed fill; only the quantity actually executed counts. */
    public void recordTrade(Order order, int executedQuantity, BigDecimal executionPrice) {
        lock.lock();
        try {
            rolloverIfNeeded();
            dailyTrades++;
            dailyTradesLimit.setCurrentValue(dailyTrades);
            BigDecimal price = MoneyUtils.scale(executionPrice);
            sessionVolume = MoneyUtils.add(sessionVolume, MoneyUtils.multiply(price, executedQuantity));
            tradeHistory.add(new TradeRecord(clock.instant(), order.symbol(), order.side(), executedQuantity, price));
        } finally {
            lock.unlock();
        }
    }

    public void updatePnl(BigDecimal delta) {
        lock.lock();
        try {
            rolloverIfNeeded();
            dailyPnl = MoneyUtils.add(dailyPnl, delta);
            dailyLossLimit.setCurrentValue(Math.max(0.0, -dailyPnl.doubleValue()));
            if (metricsService != null) {
                metricsService.updateDailyPnl(dailyPnl.doubleValue());
            }
            if (dailyLossLimit.isEnabled() && dailyPnl.compareTo(properties.getMaxDailyLoss().negate()) < 0
                    && !circuitBreakerActive) {
                tripCircuitBreaker();
            }
        } finally {
            lock.unlock();
        }
    }

    public void resetCircuitBreaker() {
        lock.lock();
        try {
            if (circuitBreakerActive) {
                log.warn("Circuit breaker manually reset (daily P&L {})", dailyPnl);
            }
            circuitBreakerActive = false;
            updateBreakerMetric();
        } finally {
            lock.unlock();
        }
    }

    public boolean isCircuitBreakerActive() {
        lock.lock();
        try {
            return circuitBreakerActive;
        } finally {
            lock.unlock();
        }
    }

    public int getDailyTrades() {
        lock.lock();
        try {
            return dailyTrades;
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal getDailyPnl() {
        lock.lock();
        try {
            return dailyPnl;
        } finally {
            lock.unlock();
        }
    }

    public List<TradeRecord> getTradeHistory() {
        lock.lock();
        try {
            return List.copyOf(tradeHistory);
        } finally {
            lock.unlock();
        }
    }

    public List<RiskEvent> getRiskEvents() {
        lock.lock();
        try {
            return List.copyOf(riskEvents);
        } finally {
            lock.unlock();
        }
    }

    public RiskSummary getRiskSummary() {
        lock.lock();
        try {
            rolloverIfNeeded();
            List<RiskLimit> all = List.of(positionSizeLimit, portfolioValueLimit, dailyLossLimit, dailyTradesLimit,
                    concentrationLimit, sectorConcentrationLimit, leverageLimit, drawdownLimit, cashReserveLimit);
            List<RiskSummary.LimitStatus> limits = all.stream()
                    .map(limit -> new RiskSummary.LimitStatus(limit.getName(), limit.getMaxValue(),
                            limit.getCurrentValue(), limit.utilization(), limit.isEnabled()))
                    .toList();
            List<RiskEvent> recent = riskEvents.subList(Math.max(0, riskEvents.size() - RECENT_EVENTS), riskEvents.size());
            return new RiskSummary(
                    circuitBreakerActive,
                    circuitBreakerActive ? List.of("daily_loss") : List.of(),
                    new RiskSummary.Session(dailyTrades, sessionVolume, dailyPnl, sessionStart),
                    limits,
                    List.copyOf(recent),
                    lastReset);
        } finally {
            lock.unlock();
        }
    }

    private RiskCheck checkPositionSize(Order order, BigDecimal price) {
        BigDecimal value = MoneyUtils.multiply(price, order.quantity());
        RiskCheck check = positionSizeLimit.checkLimit(value.doubleValue());
        if (!check.ok()) {
            return RiskCheck.fail(check.name(), check.level(),
                    String.format(Locale.ROOT, "Position size $%.2f exceeds limit $%.2f",
                            value.doubleValue(), positionSizeLimit.getMaxValue()));
        }
        return check;
    }

    private RiskCheck checkCashReserve(Order order, AccountInfo accountInfo, BigDecimal price) {
        String name = cashReserveLimit.getName();
        if (!order.isBuy()) {
            return RiskCheck.pass(name, RiskLevel.LOW, "Sell order - increases cash");
        }
        if (!cashReserveLimit.isEnabled()) {
            return RiskCheck.pass(name, RiskLevel.LOW, "Cash reserve check disabled");
        }
        BigDecimal cash = accountInfo == null ? MoneyUtils.ZERO : MoneyUtils.scale(accountInfo.cash());
        BigDecimal remaining = MoneyUtils.subtract(cash, MoneyUtils.multiply(price, order.quantity()));
        BigDecimal reserve = MoneyUtils.scale(properties.getMinCashReserve());
        if (remaining.compareTo(reserve) < 0) {
            return RiskCheck.fail(name, RiskLevel.CRITICAL, String.format(Locale.ROOT,
                    "Insufficient cash reserve: $%.2f < $%.2f", remaining.doubleValue(), reserve.doubleValue()));
        }
        if (remaining.compareTo(MoneyUtils.multiply(reserve, 1.5)) < 0) {
            return RiskCheck.pass(name, RiskLevel.MEDIUM, "Cash reserve low");
        }
        return RiskCheck.pass(name, RiskLevel.LOW, "Cash reserve OK");
    }

    private RiskCheck checkDailyLoss() {
        String name = dailyLossLimit.getName();
        if (!dailyLossLimit.isEnabled()) {
            return RiskCheck.pass(name, RiskLevel.LOW, "Daily loss check disabled");
        }
        BigDecimal maxLoss = MoneyUtils.scale(properties.getMaxDailyLoss());
        if (dailyPnl.compareTo(maxLoss.negate()) < 0) {
            if (!circuitBreakerActive) {
                tripCircuitBreaker();
            }
            return RiskCheck.fail(name, RiskLevel.CRITICAL,
                    String.format(Locale.ROOT, "Daily loss limit exceeded: $%.2f", dailyPnl.abs().doubleValue()));
        }
        if (dailyPnl.compareTo(MoneyUtils.multiply(maxLoss, properties.getWarningThreshold()).negate()) < 0) {
            return RiskCheck.pass(name, RiskLevel.HIGH, "Approaching daily loss limit");
        }
        return RiskCheck.pass(name, RiskLevel.LOW, "Daily P&L within limits");
    }

    private RiskCheck checkTradingFrequency() {
        String name = dailyTradesLimit.getName();
        if (!dailyTradesLimit.isEnabled()) {
            return RiskCheck.pass(name, RiskLevel.LOW, "Trade frequency check disabled");
        }
        int maxTrades = properties.getMaxTradesPerDay();
        if (dailyTrades >= maxTrades) {
            return RiskCheck.fail(name, RiskLevel.CRITICAL, "Daily trade limit reached: " + dailyTrades);
        }
        if (dailyTrades >= maxTrades * 0.9) {
            return RiskCheck.pass(name, RiskLevel.MEDIUM, "Approaching daily trade limit");
        }
        return RiskCheck.pass(name, RiskLevel.LOW, "Trading frequency OK");
    }

    private RiskCheck checkConcentration(Order order, AccountInfo accountInfo, Position current, BigDecimal price) {
        String name = concentrationLimit.getName();
        if (!concentrationLimit.isEnabled()) {
            return RiskCheck.pass(name, RiskLevel.LOW, "Concentration check disabled");
        }
        BigDecimal portfolioValue = accountInfo == null ? null : accountInfo.netLiquidation();
        if (!MoneyUtils.isPositive(portfolioValue)) {
            return RiskCheck.pass(name, RiskLevel.LOW, "No portfolio value to check");
        }
        int currentQuantity = current == null ? 0 : current.quantity();
        int newQuantity = order.isBuy() ? currentQuantity + order.quantity() : currentQuantity - order.quantity();
        BigDecimal newValue = MoneyUtils.multiply(price, newQuantity).abs();
        double concentration = MoneyUtils.ratio(newValue, portfolioValue);
        double limit = concentrationLimit.getMaxValue();
        if (concentration > limit) {
            return RiskCheck.fail(name, RiskLevel.HIGH, String.format(Locale.ROOT,
                    "Position concentration %.1f%% exceeds limit %.1f%%", concentration * 100, limit * 100));
        }
        if (concentration >= limit * properties.getWarningThreshold()) {
            return RiskCheck.pass(name, RiskLevel.MEDIUM, "Position concentration approaching limit");
        }
        return RiskCheck.pass(name, RiskLevel.LOW, "Position concentration OK");
    }

    /**
     * Order price when given, else the held position's mark, else the configured per-share estimate.
     */
    private BigDecimal estimatePrice(Order order, Position current) {
        if (MoneyUtils.isPositive(order.price())) {
            return MoneyUtils.scale(order.price());
        }
        if (current != null) {
            if (MoneyUtils.isPositive(current.marketPrice())) {
                return MoneyUtils.scale(current.marketPrice());
            }
            if (current.quantity() != 0 && current.marketValue() != null && current.marketValue().signum() != 0) {
                return MoneyUtils.divide(current.marketValue(), BigDecimal.valueOf(current.quantity())).abs();
            }
        }
        return MoneyUtils.scale(properties.getFallbackPrice());
    }

    private void rolloverIfNeeded() {
        LocalDate today = LocalDate.now(clock);
        if (!today.isAfter(lastReset)) {
            return;
        }
        log.info("Resetting daily risk counters (previous day P&L {}, trades {})", dailyPnl, dailyTrades);
        dailyPnl = MoneyUtils.ZERO;
        dailyTrades = 0;
        sessionVolume = MoneyUtils.ZERO;
        circuitBreakerActive = false;
        dailyTradesLimit.setCurrentValue(0);
        dailyLossLimit.setCurrentValue(0);
        lastReset = today;
        sessionStart = clock.instant();
        if (metricsService != null) {
            metricsService.updateDailyPnl(0.0);
        }
        updateBreakerMetric();
    }

    private void tripCircuitBreaker() {
        circuitBreakerActive = true;
        updateBreakerMetric();
        log.error("Circuit breaker activated! Daily loss {}", dailyPnl.abs());
    }

    private void recordEvent(Order order, String message, RiskLevel level) {
        if (!level.isAbove(RiskLevel.LOW)) {
            return;
        }
        riskEvents.add(new RiskEvent(order, message, level, clock.instant()));
        switch (level) {
            case CRITICAL -> log.error("RISK EVENT: {}", message);
            case HIGH -> log.warn("RISK EVENT: {}", message);
            default -> log.info("RISK EVENT: {}", message);
        }
    }

    private void recordReject(String reason) {
        if (metricsService != null) {
            metricsService.recordReject(reason == null ? "UNKNOWN" : reason.toUpperCase(Locale.ROOT));
        }
    }

    private void updateBreakerMetric() {
        if (metricsService != null) {
            metricsService.updateCircuitBreaker(circuitBreakerActive);
        }
    }
}
