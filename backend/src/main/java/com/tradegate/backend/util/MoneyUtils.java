package com.tradegate.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyUtils {

    public static final int SCALE = 4;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);

    private MoneyUtils() {
    }

    public static BigDecimal bd(double value) {
        return scale(BigDecimal.valueOf(value));
    }

    public static BigDecimal scale(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return scale(scale(left).add(scale(right)));
    }

    public static BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return scale(scale(left).subtract(scale(right)));
    }

    public static BigDecimal multiply(BigDecimal left, BigDecimal right) {
        return scale(scale(left).multiply(scale(right)));
    }

    public static BigDecimal multiply(BigDecimal left, int right) {
        return scale(scale(left).multiply(BigDecimal.valueOf(right)));
    }

    public static BigDecimal multiply(BigDecimal left, double factor) {
        return scale(scale(left).multiply(BigDecimal.valueOf(factor)));
    }

    public static BigDecimal divide(BigDecimal left, BigDecimal right) {
        if (right == null || right.signum() == 0) {
            return ZERO;
        }
        return scale(left).divide(scale(right), SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal max(BigDecimal left, BigDecimal right) {
        return scale(left).max(scale(right));
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    /** Ratio of two amounts as a double; zero when the denominator is zero. */
    public static double ratio(BigDecimal numerator, BigDecimal denominator) {
        if (numerator == null || denominator == null || denominator.signum() == 0) {
            return 0.0;
        }
        return numerator.doubleValue() / denominator.doubleValue();
    }
}
