package com.tradegate.backend.execution;

import com.tradegate.backend.util.MoneyUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decision-facing mirror of the trading account: cash, long and short legs per ticker with
 * their average cost, short margin, and realized gains. Updated only from actual fills.
 */
public class LocalPortfolio {

    public static final double DEFAULT_MARGIN_REQUIREMENT = 0.5;

    private final double marginRequirement;
    private final Map<String, Holding> holdings = new LinkedHashMap<>();
    private BigDecimal cash;
    private BigDecimal marginUsed = MoneyUtils.ZERO;

    public LocalPortfolio(BigDecimal cash) {
        this(cash, DEFAULT_MARGIN_REQUIREMENT);
    }

    public LocalPortfolio(BigDecimal cash, double marginRequirement) {
        this.cash = MoneyUtils.scale(cash);
        this.marginRequirement = marginRequirement;
    }

    public synchronized BigDecimal getCash() {
        return cash;
    }

    public synchronized BigDecimal getMarginUsed() {
        return marginUsed;
    }

    public synchronized int getLongQuantity(String ticker) {
        Holding holding = holdings.get(ticker);
        return holding == null ? 0 : holding.longQuantity;
    }

    public synchronized int getShortQuantity(String ticker) {
        Holding holding = holdings.get(ticker);
        return holding == null ? 0 : holding.shortQuantity;
    }

    /** Long minus short. */
    public synchronized int getNetQuantity(String ticker) {
        Holding holding = holdings.get(ticker);
        return holding == null ? 0 : holding.longQuantity - holding.shortQuantity;
    }

    public synchronized BigDecimal applyLongBuy(String ticker, int quantity, BigDecimal price) {
        Holding holding = holding(ticker);
        BigDecimal cost = MoneyUtils.multiply(price, quantity);
        holding.longCostBasis = weightedAverage(holding.longCostBasis, holding.longQuantity, price, quantity);
        holding.longQuantity += quantity;
        cash = MoneyUtils.subtract(cash, cost);
        return MoneyUtils.ZERO;
    }

    /**
     * Sells up to the held long quantity and returns the realized gain.
     */
    public synchronized BigDecimal applyLongSell(String ticker, int quantity, BigDecimal price) {
        Holding holding = holding(ticker);
        int sold = Math.min(quantity, holding.longQuantity);
        if (sold <= 0) {
            return MoneyUtils.ZERO;
        }
        BigDecimal gain = MoneyUtils.multiply(MoneyUtils.subtract(price, holding.longCostBasis), sold);
        holding.realizedLongGain = MoneyUtils.add(holding.realizedLongGain, gain);
        holding.longQuantity -= sold;
        if (holding.longQuantity == 0) {
            holding.longCostBasis = MoneyUtils.ZERO;
        }
        cash = MoneyUtils.add(cash, MoneyUtils.multiply(price, sold));
        return gain;
    }

    /**
     * Opens or adds to a short: proceeds are credited and the margin share of them is set aside.
     */
    public synchronized BigDecimal applyShortOpen(String ticker, int quantity, BigDecimal price) {
        Holding holding = holding(ticker);
        BigDecimal proceeds = MoneyUtils.multiply(price, quantity);
        BigDecimal margin = MoneyUtils.multiply(proceeds, marginRequirement);
        holding.shortCostBasis = weightedAverage(holding.shortCostBasis, holding.shortQuantity, price, quantity);
        holding.shortQuantity += quantity;
        holding.shortMarginUsed = MoneyUtils.add(holding.shortMarginUsed, margin);
        marginUsed = MoneyUtils.add(marginUsed, margin);
        cash = MoneyUtils.subtract(MoneyUtils.add(cash, proceeds), margin);
        return MoneyUtils.ZERO;
    }

    /**
     * Buys back up to the held short quantity, releasing the proportional margin, and returns
     * the realized gain.
     */
    public synchronized BigDecimal applyShortCover(String ticker, int quantity, BigDecimal price) {
        Holding holding = holding(ticker);
        int covered = Math.min(quantity, holding.shortQuantity);
        if (covered <= 0) {
            return MoneyUtils.ZERO;
        }
        BigDecimal gain = MoneyUtils.multiply(MoneyUtils.subtract(holding.shortCostBasis, price), covered);
        BigDecimal released = MoneyUtils.scale(holding.shortMarginUsed
                .multiply(BigDecimal.valueOf(covered))
                .divide(BigDecimal.valueOf(holding.shortQuantity), MoneyUtils.SCALE, RoundingMode.HALF_UP));
        holding.realizedShortGain = MoneyUtils.add(holding.realizedShortGain, gain);
        holding.shortQuantity -= covered;
        holding.shortMarginUsed = MoneyUtils.subtract(holding.shortMarginUsed, released);
        if (holding.shortQuantity == 0) {
            holding.shortCostBasis = MoneyUtils.ZERO;
            holding.shortMarginUsed = MoneyUtils.ZERO;
        }
        marginUsed = MoneyUtils.subtract(marginUsed, released);
        cash = MoneyUtils.subtract(MoneyUtils.add(cash, released), MoneyUtils.multiply(price, covered));
        return gain;
    }

    public synchronized void deductCommission(BigDecimal commission) {
        cash = MoneyUtils.subtract(cash, commission);
    }

    public synchronized PortfolioSnapshot snapshot() {
        Map<String, PortfolioSnapshot.HoldingView> views = new LinkedHashMap<>();
        BigDecimal realized = MoneyUtils.ZERO;
        for (Map.Entry<String, Holding> entry : holdings.entrySet()) {
            Holding holding = entry.getValue();
            views.put(entry.getKey(), new PortfolioSnapshot.HoldingView(
                    holding.longQuantity, holding.shortQuantity, holding.longCostBasis, holding.shortCostBasis,
                    holding.shortMarginUsed, holding.realizedLongGain, holding.realizedShortGain));
            realized = MoneyUtils.add(realized, MoneyUtils.add(holding.realizedLongGain, holding.realizedShortGain));
        }
        return new PortfolioSnapshot(cash, marginUsed, marginRequirement, realized, views);
    }

    private Holding holding(String ticker) {
        return holdings.computeIfAbsent(ticker, ignored -> new Holding());
    }

    private BigDecimal weightedAverage(BigDecimal currentAvg, int currentQty, BigDecimal price, int quantity) {
        int total = currentQty + quantity;
        if (total <= 0) {
            return MoneyUtils.ZERO;
        }
        BigDecimal cost = MoneyUtils.add(MoneyUtils.multiply(currentAvg, currentQty), MoneyUtils.multiply(price, quantity));
        return MoneyUtils.divide(cost, BigDecimal.valueOf(total));
    }

    private static final class Holding {
        private int longQuantity;
        private int shortQuantity;
        private BigDecimal longCostBasis = MoneyUtils.ZERO;
        private BigDecimal shortCostBasis = MoneyUtils.ZERO;
        private BigDecimal shortMarginUsed = MoneyUtils.ZERO;
        private BigDecimal realizedLongGain = MoneyUtils.ZERO;
        private BigDecimal realizedShortGain = MoneyUtils.ZERO;
    }
}
