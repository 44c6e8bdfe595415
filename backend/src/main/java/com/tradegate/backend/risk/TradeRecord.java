package com.tradegate.backend.risk;

import com.tradegate.backend.model.TradeSide;

import java.math.BigDecimal;
import java.time.Instant;

public record TradeRecord(Instant timestamp, String symbol, TradeSide side, int quantity, BigDecimal price) {
}
