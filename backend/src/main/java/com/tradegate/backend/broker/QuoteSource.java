package com.tradegate.backend.broker;

import java.math.BigDecimal;
import java.util.Optional;

@FunctionalInterface
public interface QuoteSource {

    Optional<BigDecimal> quote(String symbol);
}
