package com.gillianbc.lifemodel.model;

import java.math.BigDecimal;
import java.util.Objects;

import static com.gillianbc.lifemodel.model.Money.HUNDRED;
import static com.gillianbc.lifemodel.model.Money.MATH_CONTEXT;

/**
 * Interest primitives used by every balance-bearing entity.
 * Both functions return the interest earned, not the new balance.
 */
public final class Interest {

    private Interest() {
    }

    /**
     * Discrete compounding: {@code principal * ((1 + (rate/100)/n)^(n*t) - 1)}.
     *
     * @param principal            balance the interest is earned on
     * @param annualRatePercent    annual rate in percent (e.g., 5 for 5%)
     * @param compoundsPerPeriod   number of compounding steps per period (>= 1)
     * @param periodsElapsed       number of periods (>= 0)
     * @return interest earned
     */
    public static BigDecimal compoundInterest(BigDecimal principal, BigDecimal annualRatePercent,
                                              int compoundsPerPeriod, int periodsElapsed) {
        Objects.requireNonNull(principal, "principal must not be null");
        Objects.requireNonNull(annualRatePercent, "annualRatePercent must not be null");
        if (compoundsPerPeriod < 1) {
            throw new IllegalArgumentException("compoundsPerPeriod must be >= 1");
        }
        if (periodsElapsed < 0) {
            throw new IllegalArgumentException("periodsElapsed must be >= 0");
        }

        BigDecimal ratePerStep = annualRatePercent.divide(HUNDRED, MATH_CONTEXT)
                .divide(BigDecimal.valueOf(compoundsPerPeriod), MATH_CONTEXT);
        BigDecimal factor = BigDecimal.ONE.add(ratePerStep, MATH_CONTEXT)
                .pow(compoundsPerPeriod * periodsElapsed, MATH_CONTEXT);
        return principal.multiply(factor.subtract(BigDecimal.ONE), MATH_CONTEXT);
    }

    public static BigDecimal compoundInterest(BigDecimal principal, BigDecimal annualRatePercent, int compoundsPerPeriod) {
        return compoundInterest(principal, annualRatePercent, compoundsPerPeriod, 1);
    }

    public static BigDecimal compoundInterest(BigDecimal principal, BigDecimal annualRatePercent) {
        return compoundInterest(principal, annualRatePercent, 1, 1);
    }

    /**
     * Continuous compounding: {@code principal * (e^(rate/100 * t) - 1)}.
     */
    public static BigDecimal continuousInterest(BigDecimal principal, BigDecimal annualRatePercent, int periodsElapsed) {
        Objects.requireNonNull(principal, "principal must not be null");
        Objects.requireNonNull(annualRatePercent, "annualRatePercent must not be null");
        if (periodsElapsed < 0) {
            throw new IllegalArgumentException("periodsElapsed must be >= 0");
        }
        // BigDecimal has no exp(); expm1 keeps precision for small rates
        double exponent = annualRatePercent.doubleValue() / 100.0 * periodsElapsed;
        BigDecimal growthFactor = new BigDecimal(Math.expm1(exponent), MATH_CONTEXT);
        return principal.multiply(growthFactor, MATH_CONTEXT);
    }

    public static BigDecimal continuousInterest(BigDecimal principal, BigDecimal annualRatePercent) {
        return continuousInterest(principal, annualRatePercent, 1);
    }
}
