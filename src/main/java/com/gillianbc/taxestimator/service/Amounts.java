package com.gillianbc.taxestimator.service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Shared precision and rounding for money and period arithmetic.
 * Intermediate values keep full precision; these roundings are applied only to reported figures.
 */
public final class Amounts {

    public static final MathContext MATH_CONTEXT = new MathContext(20, RoundingMode.HALF_UP);

    private Amounts() {
    }

    public static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal periods(BigDecimal value) {
        return value.setScale(3, RoundingMode.HALF_UP);
    }

    public static String gbp(BigDecimal value) {
        return "£" + money(value).toPlainString();
    }

    public static String percent(BigDecimal rate, int decimals) {
        return rate.movePointRight(2).setScale(decimals, RoundingMode.HALF_UP).toPlainString() + "%";
    }
}
