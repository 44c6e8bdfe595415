package com.tradegate.backend.model;

public enum MarketType {
    HK,
    US,
    CN;

    /**
     * Best-effort market detection from the symbol shape: 5-digit codes trade in Hong Kong,
     * 6-digit codes on the mainland exchanges, anything else is treated as a US ticker.
     */
    public static MarketType detect(String symbol) {
        if (symbol == null) {
            return US;
        }
        String trimmed = symbol.trim();
        if (isDigits(trimmed) && trimmed.length() == 5) {
            return HK;
        }
        if (isDigits(trimmed) && trimmed.length() == 6) {
            return CN;
        }
        return US;
    }

    private static boolean isDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
