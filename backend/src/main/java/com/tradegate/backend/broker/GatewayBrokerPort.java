package com.tradegate.backend.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tradegate.backend.config.TradingProperties;
import com.tradegate.backend.exception.GatewayApiException;
import com.tradegate.backend.exception.GatewayCircuitOpenException;
import com.tradegate.backend.model.AccountInfo;
import com.tradegate.backend.model.Order;
import com.tradegate.backend.model.OrderStatus;
import com.tradegate.backend.model.OrderType;
import com.tradegate.backend.model.Position;
import com.tradegate.backend.model.TradeResult;
import com.tradegate.backend.model.TradeSide;
import com.tradegate.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Broker port backed by the brokerage's JSON gateway. Transport faults are converted to
 * {@link BrokerResult} failures or FAILED/REJECTED trade results here and never escape.
 */
@Slf4j
public class GatewayBrokerPort implements BrokerPort {

    private final GatewayHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TradingProperties properties;
    private final Clock clock;

    private volatile boolean connected;
    private volatile String accountId;

    public GatewayBrokerPort(GatewayHttpClient httpClient, ObjectMapper objectMapper,
                             TradingProperties properties, Clock clock) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "GATEWAY";
    }

    @Override
    public boolean connect() {
        try {
            httpClient.get("/health");
            String resolved = resolveAccountId();
            if (resolved == null) {
                log.error("Gateway reachable at {} but no trading account found", properties.gatewayBaseUrl());
                connected = false;
                return false;
            }
            accountId = resolved;
            connected = true;
            log.info("Connected to broker gateway {} (account {})", properties.gatewayBaseUrl(), resolved);
            return true;
        } catch (GatewayApiException | GatewayCircuitOpenException | JsonProcessingException e) {
            log.error("Failed to connect to broker gateway {}: {}", properties.gatewayBaseUrl(), e.getMessage());
            connected = false;
            return false;
        }
    }

    @Override
    public boolean disconnect() {
        if (connected) {
            log.info("Disconnected from broker gateway");
        }
        connected = false;
        return true;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public BrokerResult<AccountInfo> getAccountInfo() {
        if (!connected) {
            return BrokerResult.notConnected();
        }
        try {
            JsonNode funds = firstRecord(readData(httpClient.get(accountPath("/funds"))));
            if (funds == null) {
                return BrokerResult.fail(BrokerFailure.NO_DATA, "Empty account funds response");
            }
            BigDecimal cash = money(funds, "cash");
            BigDecimal buyingPower = funds.hasNonNull("avl_withdrawal_cash") ? money(funds, "avl_withdrawal_cash") : cash;
            return BrokerResult.ok(AccountInfo.builder()
                    .accountId(accountId)
                    .totalAssets(money(funds, "total_assets"))
                    .cash(cash)
                    .marketValue(money(funds, "market_val"))
                    .unrealizedPnl(money(funds, "unrealized_pl"))
                    .realizedPnl(money(funds, "realized_pl"))
                    .buyingPower(buyingPower)
                    .build());
        } catch (GatewayApiException | GatewayCircuitOpenException | JsonProcessingException e) {
            return failure("account info", e);
        }
    }

    @Override
    public BrokerResult<List<Position>> getPositions() {
        if (!connected) {
            return BrokerResult.notConnected();
        }
        try {
            JsonNode data = readData(httpClient.get(accountPath("/positions")));
            List<Position> positions = new ArrayList<>();
            if (data.isArray()) {
                for (JsonNode row : data) {
                    positions.add(Position.builder()
                            .symbol(SymbolFormat.fromGateway(row.path("code").asText()))
                            .quantity(row.path("qty").asInt())
                            .avgCost(money(row, "cost_price"))
                            .marketValue(money(row, "market_val"))
                            .unrealizedPnl(money(row, "unrealized_pl"))
                            .marketPrice(money(row, "nominal_price"))
                            .build());
                }
            }
            return BrokerResult.ok(positions);
        } catch (GatewayApiException | GatewayCircuitOpenException | JsonProcessingException e) {
            return failure("positions", e);
        }
    }

    @Override
    public BrokerResult<BigDecimal> getMarketPrice(String symbol) {
        if (!connected) {
            return BrokerResult.notConnected();
        }
        try {
            return fetchQuote(symbol)
                    .map(BrokerResult::ok)
                    .orElseGet(() -> BrokerResult.fail(BrokerFailure.NO_DATA, "No quote available for " + symbol));
        } catch (GatewayApiException | GatewayCircuitOpenException | JsonProcessingException e) {
            return failure("quote " + symbol, e);
        }
    }

    /**
     * Quote lookup that does not require a trading session, used to price simulated fills.
     */
    public Optional<BigDecimal> quote(String symbol) {
        try {
            return fetchQuote(symbol);
        } catch (GatewayApiException | GatewayCircuitOpenException | JsonProcessingException e) {
            log.debug("Gateway quote for {} unavailable: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public TradeResult submitOrder(Order order) {
        if (!connected) {
            return TradeResult.rejected(order, "Not connected to broker");
        }
        try {
            if (!unlockTrading()) {
                return TradeResult.rejected(order, "Failed to unlock trading");
            }
            JsonNode placed = firstRecord(readData(httpClient.post(accountPath("/orders"), orderBody(order))));
            String orderId = placed == null ? "" : placed.path("order_id").asText("");
            if (orderId.isBlank()) {
                return TradeResult.failed(order, "Gateway did not return an order id");
            }
            log.info("Order {} placed: {} {} {}", orderId, order.side(), order.quantity(), order.symbol());
            Instant submitted = clock.instant();
            awaitStatusPoll();
            BrokerResult<TradeResult> status = getOrderStatus(orderId);
            if (status.isSuccess()) {
                TradeResult reported = status.value();
                return reported.toBuilder()
                        .side(order.side())
                        .quantity(order.quantity())
                        .filledQuantity(Math.min(reported.filledQuantity(), order.quantity()))
                        .submitTime(submitted)
                        .build();
            }
            log.warn("Order {} placed but status unknown: {}", orderId, status.message());
            return TradeResult.builder()
                    .orderId(orderId)
                    .symbol(order.symbol())
                    .side(order.side())
                    .quantity(order.quantity())
                    .filledQuantity(0)
                    .status(OrderStatus.SUBMITTED)
                    .submitTime(submitted)
                    .build();
        } catch (GatewayApiException e) {
            if (e.getStatusCode() >= 400 && e.getStatusCode() < 500) {
                log.warn("Gateway rejected order for {}: {}", order.symbol(), e.getMessage());
                return TradeResult.rejected(order, e.getMessage());
            }
            log.error("Order submission failed for {}: {}", order.symbol(), e.getMessage());
            return TradeResult.failed(order, e.getMessage());
        } catch (GatewayCircuitOpenException | JsonProcessingException e) {
            log.error("Order submission failed for {}: {}", order.symbol(), e.getMessage());
            return TradeResult.failed(order, e.getMessage());
        }
    }

    @Override
    public boolean cancelOrder(String orderId) {
        if (!connected) {
            return false;
        }
        try {
            httpClient.delete(accountPath("/orders/" + orderId));
            log.info("Order {} cancelled", orderId);
            return true;
        } catch (GatewayApiException | GatewayCircuitOpenException e) {
            log.warn("Failed to cancel order {}: {}", orderId, e.getMessage());
            return false;
        }
    }

    @Override
    public BrokerResult<TradeResult> getOrderStatus(String orderId) {
        if (!connected) {
            return BrokerResult.notConnected();
        }
        try {
            JsonNode row = firstRecord(readData(httpClient.get(accountPath("/orders/" + orderId))));
            if (row == null) {
                return BrokerResult.fail(BrokerFailure.NO_DATA, "Order " + orderId + " not found");
            }
            return BrokerResult.ok(toTradeResult(orderId, row));
        } catch (GatewayApiException | GatewayCircuitOpenException | JsonProcessingException e) {
            return failure("order status " + orderId, e);
        }
    }

    static OrderStatus mapStatus(String gatewayStatus) {
        if (gatewayStatus == null) {
            return OrderStatus.SUBMITTED;
        }
        return switch (gatewayStatus.toUpperCase(Locale.ROOT)) {
            case "FILLED_ALL" -> OrderStatus.FILLED;
            case "FILLED_PART" -> OrderStatus.PARTIALLY_FILLED;
            case "CANCELLED_ALL", "CANCELLED_PART" -> OrderStatus.CANCELLED;
            case "FAILED", "DISABLED" -> OrderStatus.FAILED;
            default -> OrderStatus.SUBMITTED;
        };
    }

    private TradeResult toTradeResult(String orderId, JsonNode row) {
        int dealt = Math.max(row.path("dealt_qty").asInt(), 0);
        int quantity = Math.max(row.path("qty").asInt(), dealt);
        BigDecimal dealtPrice = money(row, "dealt_avg_price");
        OrderStatus status = mapStatus(row.path("order_status").asText(null));
        return TradeResult.builder()
                .orderId(orderId)
                .symbol(SymbolFormat.fromGateway(row.path("code").asText()))
                .side("SELL".equalsIgnoreCase(row.path("trd_side").asText()) ? TradeSide.SELL : TradeSide.BUY)
                .quantity(quantity)
                .filledQuantity(dealt)
                .avgPrice(MoneyUtils.isPositive(dealtPrice) ? dealtPrice : null)
                .status(status)
                .updateTime(clock.instant())
                .errorMsg(status.isError() ? "Order " + row.path("order_status").asText() : null)
                .build();
    }

    private Optional<BigDecimal> fetchQuote(String symbol) throws JsonProcessingException {
        String path = "/quote?code=" + SymbolFormat.toGateway(symbol);
        JsonNode quote = firstRecord(readData(httpClient.get(path)));
        if (quote == null) {
            return Optional.empty();
        }
        BigDecimal price = money(quote, "last_price");
        return MoneyUtils.isPositive(price) ? Optional.of(price) : Optional.empty();
    }

    private boolean unlockTrading() throws JsonProcessingException {
        String password = properties.getTradingPassword();
        if (password == null || password.isBlank()) {
            return true;
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.put("password", password);
        body.put("unlock", true);
        try {
            httpClient.post("/trade/unlock", objectMapper.writeValueAsString(body));
            return true;
        } catch (GatewayApiException e) {
            log.error("Failed to unlock trading: {}", e.getMessage());
            return false;
        }
    }

    private String orderBody(Order order) throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("code", SymbolFormat.toGateway(order.symbol()));
        body.put("qty", order.quantity());
        body.put("price", order.price() == null ? BigDecimal.ZERO : order.price());
        body.put("trd_side", order.side().name());
        body.put("order_type", gatewayOrderType(order.orderType()));
        if (order.stopPrice() != null) {
            body.put("aux_price", order.stopPrice());
        }
        body.put("time_in_force", order.timeInForce());
        return objectMapper.writeValueAsString(body);
    }

    private String gatewayOrderType(OrderType type) {
        return switch (type) {
            case MARKET -> "MARKET";
            case LIMIT -> "NORMAL";
            case STOP -> "STOP";
            case STOP_LIMIT -> "STOP_LIMIT";
        };
    }

    private String resolveAccountId() throws JsonProcessingException {
        if (properties.getAccountId() != null && !properties.getAccountId().isBlank()) {
            return properties.getAccountId();
        }
        JsonNode first = firstRecord(readData(httpClient.get("/accounts")));
        if (first == null) {
            return null;
        }
        String id = first.path("acc_id").asText("");
        return id.isBlank() ? null : id;
    }

    private void awaitStatusPoll() {
        long delay = properties.getGateway().getStatusPollDelayMs();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private JsonNode readData(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return objectMapper.missingNode();
        }
        return objectMapper.readTree(body).path("data");
    }

    private JsonNode firstRecord(JsonNode data) {
        if (data.isArray()) {
            return data.size() > 0 ? data.get(0) : null;
        }
        return data.isObject() ? data : null;
    }

    private BigDecimal money(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return MoneyUtils.ZERO;
        }
        return value.isNumber() ? MoneyUtils.scale(value.decimalValue()) : MoneyUtils.bd(value.asDouble());
    }

    private String accountPath(String suffix) {
        return "/accounts/" + accountId + suffix;
    }

    private <T> BrokerResult<T> failure(String operation, Exception e) {
        log.warn("Gateway {} request failed: {}", operation, e.getMessage());
        if (e instanceof JsonProcessingException) {
            return BrokerResult.fail(BrokerFailure.NO_DATA, "Unreadable gateway response for " + operation);
        }
        if (e instanceof GatewayApiException api && api.getStatusCode() == 404) {
            return BrokerResult.fail(BrokerFailure.NO_DATA, e.getMessage());
        }
        return BrokerResult.fail(BrokerFailure.UNAVAILABLE, e.getMessage());
    }
}
