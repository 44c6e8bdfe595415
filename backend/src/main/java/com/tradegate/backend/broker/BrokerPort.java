package com.tradegate.backend.broker;

import com.tradegate.backend.model.AccountInfo;
import com.tradegate.backend.model.Order;
import com.tradegate.backend.model.Position;
import com.tradegate.backend.model.TradeResult;

import java.math.BigDecimal;
import java.util.List;

/**
 * Capability set the execution core needs from a brokerage. Implementations never retry on their
 * own, and every call other than {@link #connect()} fails fast when not connected.
 */
public interface BrokerPort {

    String name();

    boolean connect();

    /** Idempotent. */
    boolean disconnect();

    boolean isConnected();

    BrokerResult<AccountInfo> getAccountInfo();

    BrokerResult<List<Position>> getPositions();

    BrokerResult<BigDecimal> getMarketPrice(String symbol);

    /** Never throws; internal failures come back as a FAILED or REJECTED result. */
    TradeResult submitOrder(Order order);

    boolean cancelOrder(String orderId);

    BrokerResult<TradeResult> getOrderStatus(String orderId);
}
