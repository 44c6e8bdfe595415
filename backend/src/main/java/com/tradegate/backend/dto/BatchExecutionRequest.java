package com.tradegate.backend.dto;

import com.tradegate.backend.model.TradingDecision;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchExecutionRequest {

    @NotEmpty
    private LinkedHashMap<String, @Valid TradingDecision> decisions;

    /** Optional prices per ticker; tickers without one are priced from the broker. */
    private Map<String, BigDecimal> prices;
}
