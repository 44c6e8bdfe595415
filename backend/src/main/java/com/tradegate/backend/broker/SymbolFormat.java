package com.tradegate.backend.broker;

import com.tradegate.backend.model.MarketType;

/**
 * Converts between plain tickers and the gateway's market-prefixed codes.
 */
public final class SymbolFormat {

    private SymbolFormat() {
    }

    public static String toGateway(String symbol) {
        String trimmed = symbol.trim();
        if (trimmed.contains(".")) {
            return trimmed;
        }
        return switch (MarketType.detect(trimmed)) {
            case HK -> "HK." + trimmed;
            case CN -> (trimmed.startsWith("6") ? "SH." : "SZ.") + trimmed;
            case US -> "US." + trimmed;
        };
    }

    public static String fromGateway(String code) {
        if (code == null) {
            return "";
        }
        int dot = code.indexOf('.');
        return dot >= 0 ? code.substring(dot + 1) : code;
    }
}
