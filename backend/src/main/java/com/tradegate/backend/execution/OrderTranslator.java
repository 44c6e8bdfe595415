package com.tradegate.backend.execution;

import com.tradegate.backend.model.MarketType;
import com.tradegate.backend.model.Order;
import com.tradegate.backend.model.OrderType;
import com.tradegate.backend.model.TradeAction;
import com.tradegate.backend.model.TradeSide;
import com.tradegate.backend.util.MoneyUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Turns a decision into a market order. Short and sell both become SELL orders, cover and buy
 * both become BUY orders; only portfolio bookkeeping tells them apart.
 */
@Component
public class OrderTranslator {

    public Optional<Order> translate(String ticker, String action, int quantity, BigDecimal price) {
        if (ticker == null || ticker.isBlank() || quantity <= 0) {
            return Optional.empty();
        }
        return TradeAction.from(action)
                .flatMap(this::sideFor)
                .map(side -> Order.builder()
                        .symbol(ticker.trim())
                        .side(side)
                        .quantity(quantity)
                        .orderType(OrderType.MARKET)
                        .price(MoneyUtils.isPositive(price) ? MoneyUtils.scale(price) : null)
                        .market(MarketType.detect(ticker))
                        .build());
    }

    private Optional<TradeSide> sideFor(TradeAction action) {
        return switch (action) {
            case BUY, COVER -> Optional.of(TradeSide.BUY);
            case SELL, SHORT -> Optional.of(TradeSide.SELL);
            case HOLD -> Optional.empty();
        };
    }
}
