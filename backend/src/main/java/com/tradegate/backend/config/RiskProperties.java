package com.tradegate.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Risk limits. A limit of zero or less disables the corresponding check.
 */
@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    @NotNull
    private BigDecimal maxPositionSize = new BigDecimal("100000");

    @NotNull
    private BigDecimal maxPortfolioValue = new BigDecimal("1000000");

    @NotNull
    private BigDecimal maxDailyLoss = new BigDecimal("10000");

    @DecimalMin("0.0")
    private double maxPositionConcentration = 0.2;

    @DecimalMin("0.0")
    private double maxSectorConcentration = 0.3;

    @PositiveOrZero
    private int maxTradesPerDay = 100;

    @DecimalMin("0.0")
    private double maxLeverage = 1.0;

    @DecimalMin("0.0")
    private double maxDrawdown = 0.1;

    @NotNull
    private BigDecimal minCashReserve = new BigDecimal("10000");

    /** Per-share estimate used when neither the order nor a held position carries a price. */
    @NotNull
    private BigDecimal fallbackPrice = new BigDecimal("100");

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double warningThreshold = 0.8;

    /** Alias used by decision-engine configs. */
    public int getMaxDailyTrades() {
        return maxTradesPerDay;
    }

    public void setMaxDailyTrades(int maxDailyTrades) {
        this.maxTradesPerDay = maxDailyTrades;
    }

    /**
     * Binds a plain mapping such as {@code {"max_daily_loss": 5000}}. Keys may be snake_case or
     * kebab-case; unknown keys are ignored and missing ones keep their defaults.
     */
    public static RiskProperties fromMap(Map<String, ?> values) {
        RiskProperties properties = new RiskProperties();
        if (values == null || values.isEmpty()) {
            return properties;
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key != null && value != null) {
                normalized.put("risk." + key.trim().toLowerCase(Locale.ROOT).replace('_', '-'), value);
            }
        });
        Binder binder = new Binder(new MapConfigurationPropertySource(normalized));
        binder.bind("risk", Bindable.ofInstance(properties));
        return properties;
    }
}
