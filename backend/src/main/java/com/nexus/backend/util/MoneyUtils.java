package com.nexus.backend.util;

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

    /**
     * Percentage share of an amount, e.g. {@code percentOf(1000, 1.0) == 10}.
     */
    public static double percentOf(double amount, double pct) {
        return round(amount * pct / 100.0);
    }

    public static double round(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
