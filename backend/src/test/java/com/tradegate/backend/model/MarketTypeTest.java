package com.tradegate.backend.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MarketTypeTest {

    @Test
    void onlyAsciiDigitCodesMapToAsianMarkets() {
        assertThat(MarketType.detect("00700")).isEqualTo(MarketType.HK);
        assertThat(MarketType.detect(" 600519 ")).isEqualTo(MarketType.CN);
        assertThat(MarketType.detect("００７００")).isEqualTo(MarketType.US);
        assertThat(MarketType.detect("٠١٢٣٤٥")).isEqualTo(MarketType.US);
        assertThat(MarketType.detect(null)).isEqualTo(MarketType.US);
    }
}
