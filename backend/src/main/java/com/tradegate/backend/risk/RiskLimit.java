package com.tradegate.backend.risk;

import java.util.Locale;

/**
 * A named ceiling with its current utilization. A non-positive maximum disables the limit.
 */
public class RiskLimit {

    public static final double DEFAULT_WARNING_THRESHOLD = 0.8;

    private final String name;
    private final double maxValue;
    private final double warningThreshold;
    private final boolean enabled;
    private volatile double currentValue;

    public RiskLimit(String name, double maxValue, double warningThreshold) {
        this(name, maxValue, warningThreshold, maxValue > 0);
    }

    public RiskLimit(String name, double maxValue, double warningThreshold, boolean enabled) {
        this.name = name;
        this.maxValue = maxValue;
        this.warningThreshold = warningThreshold;
        this.enabled = enabled && maxValue > 0;
    }

    public String getName() {
        return name;
    }

    public double getMaxValue() {
        return maxValue;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public void setCurrentValue(double currentValue) {
        this.currentValue = currentValue;
    }

    public double getWarningThreshold() {
        return warningThreshold;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public double utilization() {
        return utilization(0.0);
    }

    public double utilization(double additional) {
        if (!enabled) {
            return 0.0;
        }
        return (currentValue + additional) / maxValue;
    }

    public RiskLevel levelFor(double utilization) {
        if (utilization >= 1.0) {
            return RiskLevel.CRITICAL;
        }
        if (utilization >= warningThreshold) {
            return RiskLevel.HIGH;
        }
        if (utilization >= 0.5) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    /**
     * Checks whether adding {@code additional} keeps the limit below its maximum.
     */
    public RiskCheck checkLimit(double additional) {
        if (!enabled) {
            return RiskCheck.pass(name, RiskLevel.LOW, name + " disabled");
        }
        double utilization = utilization(additional);
        RiskLevel level = levelFor(utilization);
        String percent = String.format(Locale.ROOT, "%.1f%%", utilization * 100);
        if (level == RiskLevel.CRITICAL) {
            return RiskCheck.fail(name, level, name + " limit exceeded: " + percent);
        }
        if (level == RiskLevel.HIGH) {
            return RiskCheck.pass(name, level, name + " approaching limit: " + percent);
        }
        return RiskCheck.pass(name, level, name + " at " + percent);
    }
}
