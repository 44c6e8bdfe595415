package com.tradegate.backend.broker;

import com.tradegate.backend.config.TradingProperties;
import com.tradegate.backend.model.AccountInfo;
import com.tradegate.backend.model.Order;
import com.tradegate.backend.model.OrderStatus;
import com.tradegate.backend.model.Position;
import com.tradegate.backend.model.TradeResult;
import com.tradegate.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dry-run broker. Every order fills in full at the quoted price moved against the trader by a
 * fixed slippage fraction, and the account tracks cash and positions from its own fills.
 */
@Slf4j
public class SimulatedBrokerPort implements BrokerPort {

    private final TradingProperties.Simulation settings;
    private final QuoteSource externalQuotes;
    private final Clock clock;
    private final Map<String, BigDecimal> quotes = new ConcurrentHashMap<>();
    private final Map<String, TradeResult> orders = new ConcurrentHashMap<>();
    private final Map<String, Holding> holdings = new LinkedHashMap<>();
    private final AtomicLong orderSequence = new AtomicLong();

    private volatile boolean connected;
    private BigDecimal cash;
    private BigDecimal realizedPnl = MoneyUtils.ZERO;

    public SimulatedBrokerPort(TradingProperties.Simulation settings, QuoteSource externalQuotes, Clock clock) {
        this.settings = settings;
        this.externalQuotes = externalQuotes;
        this.clock = clock;
        this.cash = MoneyUtils.scale(settings.getStartingCash());
        settings.getPrices().forEach(this::updateQuote);
    }

    @Override
    public String name() {
        return "SIMULATED";
    }

    @Override
    public boolean connect() {
        connected = true;
        log.info("[DRY RUN] Connected to simulated broker with cash {}", cash);
        return true;
    }

    @Override
    public boolean disconnect() {
        if (connected) {
            log.info("[DRY RUN] Disconnected from simulated broker");
        }
        connected = false;
        return true;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    public void updateQuote(String symbol, BigDecimal price) {
        if (symbol != null && MoneyUtils.isPositive(price)) {
            quotes.put(symbol, MoneyUtils.scale(price));
        }
    }

    @Override
    public synchronized BrokerResult<AccountInfo> getAccountInfo() {
        if (!connected) {
            return BrokerResult.notConnected();
        }
        BigDecimal marketValue = MoneyUtils.ZERO;
        BigDecimal unrealized = MoneyUtils.ZERO;
        for (Map.Entry<String, Holding> entry : holdings.entrySet()) {
            Holding holding = entry.getValue();
            BigDecimal mark = markPrice(entry.getKey(), holding);
            marketValue = MoneyUtils.add(marketValue, MoneyUtils.multiply(mark, holding.quantity));
            unrealized = MoneyUtils.add(unrealized,
                    MoneyUtils.multiply(MoneyUtils.subtract(mark, holding.avgCost), holding.quantity));
        }
        return BrokerResult.ok(AccountInfo.builder()
                .accountId("DRY_RUN")
                .totalAssets(MoneyUtils.add(cash, marketValue))
                .cash(cash)
                .marketValue(marketValue)
                .unrealizedPnl(unrealized)
                .realizedPnl(realizedPnl)
                .buyingPower(MoneyUtils.max(cash, MoneyUtils.ZERO))
                .build());
    }

    @Override
    public synchronized BrokerResult<List<Position>> getPositions() {
        if (!connected) {
            return BrokerResult.notConnected();
        }
        List<Position> positions = new ArrayList<>();
        holdings.forEach((symbol, holding) -> {
            BigDecimal mark = markPrice(symbol, holding);
            positions.add(Position.builder()
                    .symbol(symbol)
                    .quantity(holding.quantity)
                    .avgCost(holding.avgCost)
                    .marketPrice(mark)
                    .marketValue(MoneyUtils.multiply(mark, holding.quantity))
                    .unrealizedPnl(MoneyUtils.multiply(MoneyUtils.subtract(mark, holding.avgCost), holding.quantity))
                    .build());
        });
        return BrokerResult.ok(positions);
    }

    @Override
    public BrokerResult<BigDecimal> getMarketPrice(String symbol) {
        if (!connected) {
            return BrokerResult.notConnected();
        }
        return lookupQuote(symbol)
                .map(BrokerResult::ok)
                .orElseGet(() -> BrokerResult.fail(BrokerFailure.NO_DATA, "No quote available for " + symbol));
    }

    @Override
    public TradeResult submitOrder(Order order) {
        if (!connected) {
            return TradeResult.rejected(order, "Not connected to broker");
        }
        Optional<BigDecimal> marketPrice = lookupQuote(order.symbol());
        if (marketPrice.isEmpty() && MoneyUtils.isPositive(order.price())) {
            marketPrice = Optional.of(MoneyUtils.scale(order.price()));
        }
        if (marketPrice.isEmpty()) {
            log.warn("[DRY RUN] No price for {}; order not simulated", order.symbol());
            return TradeResult.failed(order, "Unable to get market price for simulation");
        }

        double slippage = order.isBuy() ? settings.getSlippagePct() : -settings.getSlippagePct();
        BigDecimal fillPrice = MoneyUtils.multiply(marketPrice.get(), 1.0 + slippage);
        BigDecimal notional = MoneyUtils.multiply(fillPrice, order.quantity());
        BigDecimal commission = MoneyUtils.max(settings.getMinCommission(),
                MoneyUtils.multiply(notional, settings.getCommissionPct()));
        Instant now = clock.instant();

        synchronized (this) {
            if (order.isBuy()) {
                cash = MoneyUtils.subtract(cash, MoneyUtils.add(notional, commission));
                applyFill(order.symbol(), order.quantity(), fillPrice);
            } else {
                cash = MoneyUtils.subtract(MoneyUtils.add(cash, notional), commission);
                applyFill(order.symbol(), -order.quantity(), fillPrice);
            }
        }

        TradeResult result = TradeResult.builder()
                .orderId("DRY_RUN_" + orderSequence.incrementAndGet())
                .symbol(order.symbol())
                .side(order.side())
                .quantity(order.quantity())
                .filledQuantity(order.quantity())
                .avgPrice(fillPrice)
                .status(OrderStatus.FILLED)
                .submitTime(now)
                .updateTime(now)
                .commission(commission)
                .build();
        orders.put(result.orderId(), result);
        log.info("[DRY RUN] {} {} {} @ {} (commission {})",
                order.side(), order.quantity(), order.symbol(), fillPrice, commission);
        return result;
    }

    @Override
    public boolean cancelOrder(String orderId) {
        if (!connected) {
            return false;
        }
        TradeResult existing = orders.get(orderId);
        if (existing == null || existing.status().isTerminal()) {
            return false;
        }
        orders.put(orderId, existing.toBuilder()
                .status(OrderStatus.CANCELLED)
                .updateTime(clock.instant())
                .build());
        return true;
    }

    @Override
    public BrokerResult<TradeResult> getOrderStatus(String orderId) {
        if (!connected) {
            return BrokerResult.notConnected();
        }
        TradeResult result = orders.get(orderId);
        if (result == null) {
            return BrokerResult.fail(BrokerFailure.NO_DATA, "Unknown order " + orderId);
        }
        return BrokerResult.ok(result);
    }

    private Optional<BigDecimal> lookupQuote(String symbol) {
        BigDecimal local = quotes.get(symbol);
        if (local != null) {
            return Optional.of(local);
        }
        if (externalQuotes == null) {
            return Optional.empty();
        }
        return externalQuotes.quote(symbol).filter(MoneyUtils::isPositive).map(MoneyUtils::scale);
    }

    private BigDecimal markPrice(String symbol, Holding holding) {
        return Optional.ofNullable(quotes.get(symbol)).orElse(holding.avgCost);
    }

    private void applyFill(String symbol, int signedQuantity, BigDecimal price) {
        Holding holding = holdings.computeIfAbsent(symbol, ignored -> new Holding());
        int current = holding.quantity;
        if (current == 0 || Integer.signum(current) == Integer.signum(signedQuantity)) {
            int total = Math.abs(current) + Math.abs(signedQuantity);
            BigDecimal cost = MoneyUtils.add(MoneyUtils.multiply(holding.avgCost, Math.abs(current)),
                    MoneyUtils.multiply(price, Math.abs(signedQuantity)));
            holding.avgCost = cost.divide(BigDecimal.valueOf(total), MoneyUtils.SCALE, RoundingMode.HALF_UP);
            holding.quantity = current + signedQuantity;
        } else {
            int closed = Math.min(Math.abs(current), Math.abs(signedQuantity));
            BigDecimal perShare = MoneyUtils.subtract(price, holding.avgCost);
            BigDecimal pnl = MoneyUtils.multiply(perShare, closed * Integer.signum(current));
            realizedPnl = MoneyUtils.add(realizedPnl, pnl);
            holding.quantity = current + signedQuantity;
            if (holding.quantity != 0 && Integer.signum(holding.quantity) != Integer.signum(current)) {
                holding.avgCost = MoneyUtils.scale(price);
            }
        }
        if (holding.quantity == 0) {
            holdings.remove(symbol);
        }
    }

    private static final class Holding {
        private int quantity;
        private BigDecimal avgCost = MoneyUtils.ZERO;
    }
}
