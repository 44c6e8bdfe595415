package com.tradegate.backend.config;

import com.tradegate.backend.model.MarketType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "trading")
@Data
@Validated
public class TradingProperties {

    @NotBlank
    private String host = "127.0.0.1";

    @Min(1)
    @Max(65535)
    private int port = 11111;

    private String accountId;

    private String tradingPassword;

    private boolean dryRun = true;

    @Positive
    private int maxPositionSize = 10000;

    @Positive
    private int maxDailyTrades = 100;

    @NotNull
    @Positive
    private BigDecimal maxOrderValue = new BigDecimal("50000");

    private boolean enableShortSelling = false;

    /** Applied to the com.tradegate.backend loggers through application.yml. */
    @NotBlank
    @Pattern(regexp = "TRACE|DEBUG|INFO|WARN|ERROR", message = "must be one of TRACE, DEBUG, INFO, WARN, ERROR")
    private String logLevel = "INFO";

    @NotNull
    private MarketType defaultMarket = MarketType.HK;

    @Positive
    private long brokerCallTimeoutMs = 10000;

    @Valid
    private Simulation simulation = new Simulation();

    @Valid
    private Gateway gateway = new Gateway();

    @Data
    public static class Simulation {
        @NotNull
        @PositiveOrZero
        private BigDecimal startingCash = new BigDecimal("100000");

        @DecimalMin("0.0")
        private double slippagePct = 0.001;

        @DecimalMin("0.0")
        private double commissionPct = 0.001;

        @NotNull
        @PositiveOrZero
        private BigDecimal minCommission = BigDecimal.ONE;

        /** Seed quotes for the simulated book, keyed by symbol. */
        private Map<String, BigDecimal> prices = new LinkedHashMap<>();

        /** Price simulated fills from the gateway quote feed when reachable. */
        private boolean gatewayQuotes = false;
    }

    @Data
    public static class Gateway {
        private String baseUrl;

        @PositiveOrZero
        private long statusPollDelayMs = 1000;

        @Positive
        private int connectTimeoutMs = 10000;

        @Positive
        private int readTimeoutMs = 10000;
    }

    /** Live trading is the inverse of dry run. */
    public boolean isEnableLiveTrading() {
        return !dryRun;
    }

    public void setEnableLiveTrading(boolean enableLiveTrading) {
        this.dryRun = !enableLiveTrading;
    }

    public String gatewayBaseUrl() {
        if (gateway.getBaseUrl() != null && !gateway.getBaseUrl().isBlank()) {
            return gateway.getBaseUrl();
        }
        return "http://" + host + ":" + port + "/api/v1";
    }
}
