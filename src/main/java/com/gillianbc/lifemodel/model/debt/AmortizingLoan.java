package com.gillianbc.lifemodel.model.debt;

import java.math.BigDecimal;

/**
 * A loan repaid in monthly instalments.
 */
public interface AmortizingLoan {

    /**
     * Standard annuity payment {@code P * i(1+i)^n / ((1+i)^n - 1)} with monthly rate {@code i}
     * over {@code n} months; {@code P / n} when the rate is zero.
     */
    BigDecimal calculateMonthlyPayment();

    /**
     * Makes one monthly payment. The month's interest is covered first; a payment that does not
     * cover it adds the unpaid interest to the principal. {@code extraToPrincipal} only reduces the
     * principal once the interest is covered.
     *
     * @return total amount actually paid
     * @throws IllegalArgumentException if either amount is negative
     */
    BigDecimal makePayment(BigDecimal paymentAmount, BigDecimal extraToPrincipal);

    default BigDecimal makePayment(BigDecimal paymentAmount) {
        return makePayment(paymentAmount, BigDecimal.ZERO);
    }
}
