package com.gillianbc.lifemodel.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Shared arithmetic helpers for currency amounts.
 * All multiplications and divisions go through {@link #MATH_CONTEXT} so that
 * repeated runs produce identical figures.
 */
public final class Money {

    public static final MathContext MATH_CONTEXT = new MathContext(16, RoundingMode.HALF_UP);
    public static final BigDecimal ZERO = BigDecimal.ZERO;
    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    public static final BigDecimal TWELVE = BigDecimal.valueOf(12);

    private Money() {
    }

    /**
     * @return {@code amount * ratePercent / 100}
     */
    public static BigDecimal percentOf(BigDecimal amount, BigDecimal ratePercent) {
        return amount.multiply(ratePercent, MATH_CONTEXT).divide(HUNDRED, MATH_CONTEXT);
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * @return the amount, or zero when it is negative
     */
    public static BigDecimal nonNegative(BigDecimal amount) {
        return amount.signum() < 0 ? ZERO : amount;
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount.signum() > 0;
    }

    public static BigDecimal of(double value) {
        return BigDecimal.valueOf(value);
    }

    /**
     * Rounds to cents for display and logging only.
     */
    public static BigDecimal display(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }
}
