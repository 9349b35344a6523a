package com.gillianbc.lifemodel.model.debt;

import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.simulation.LifeModelAgent;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class for amortizing loans. The owner pays the scheduled instalments for the year
 * during the pre-step phase; the interest paid is reported as a statistic.
 */
@Getter
public abstract class Loan extends LifeModelAgent implements AmortizingLoan {

    private static final int MONTHS_PER_YEAR = 12;
    private static final BigDecimal MONTHLY_RATE_DIVISOR = BigDecimal.valueOf(1200);

    private final Person owner;
    private final BigDecimal loanAmount;
    private final BigDecimal yearlyInterestRate;
    private final int lengthYears;
    protected BigDecimal principal;
    private final BigDecimal monthlyPayment;
    private BigDecimal totalInterestPaid = BigDecimal.ZERO;
    private BigDecimal interestPaidThisYear = BigDecimal.ZERO;
    private final List<BigDecimal> principalHistory = new ArrayList<>();

    protected Loan(Person owner, BigDecimal loanAmount, BigDecimal yearlyInterestRate, int lengthYears) {
        this(owner, loanAmount, yearlyInterestRate, lengthYears, null, null);
    }

    /**
     * @param principal      current principal, defaults to {@code loanAmount}
     * @param monthlyPayment scheduled payment, calculated from the loan terms when null
     */
    protected Loan(Person owner,
                   BigDecimal loanAmount,
                   BigDecimal yearlyInterestRate,
                   int lengthYears,
                   BigDecimal principal,
                   BigDecimal monthlyPayment) {
        super(owner.getModel());
        this.owner = owner;
        this.loanAmount = Objects.requireNonNull(loanAmount, "loanAmount must not be null");
        this.yearlyInterestRate = Objects.requireNonNull(yearlyInterestRate, "yearlyInterestRate must not be null");
        if (loanAmount.signum() < 0 || yearlyInterestRate.signum() < 0 || lengthYears < 0) {
            throw new IllegalArgumentException("loan amount, rate and length must be >= 0");
        }
        this.lengthYears = lengthYears;
        this.principal = principal != null ? principal : loanAmount;
        if (monthlyPayment != null) {
            this.monthlyPayment = monthlyPayment;
        } else {
            this.monthlyPayment = lengthYears > 0 ? calculateMonthlyPayment() : BigDecimal.ZERO;
        }
    }

    @Override
    public BigDecimal calculateMonthlyPayment() {
        int months = lengthYears * MONTHS_PER_YEAR;
        if (months == 0) {
            throw new IllegalStateException("Cannot amortize a loan with no term");
        }
        BigDecimal monthlyRate = yearlyInterestRate.divide(MONTHLY_RATE_DIVISOR, Money.MATH_CONTEXT);
        if (monthlyRate.signum() == 0) {
            return loanAmount.divide(BigDecimal.valueOf(months), Money.MATH_CONTEXT);
        }
        BigDecimal growth = BigDecimal.ONE.add(monthlyRate).pow(months, Money.MATH_CONTEXT);
        return loanAmount.multiply(monthlyRate.multiply(growth, Money.MATH_CONTEXT), Money.MATH_CONTEXT)
                .divide(growth.subtract(BigDecimal.ONE), Money.MATH_CONTEXT);
    }

    public BigDecimal getMonthlyInterest() {
        return principal.multiply(yearlyInterestRate, Money.MATH_CONTEXT).divide(MONTHLY_RATE_DIVISOR, Money.MATH_CONTEXT);
    }

    @Override
    public BigDecimal makePayment(BigDecimal paymentAmount, BigDecimal extraToPrincipal) {
        Objects.requireNonNull(paymentAmount, "paymentAmount must not be null");
        Objects.requireNonNull(extraToPrincipal, "extraToPrincipal must not be null");
        if (paymentAmount.signum() < 0) {
            throw new IllegalArgumentException("paymentAmount must be >= 0");
        }
        if (extraToPrincipal.signum() < 0) {
            throw new IllegalArgumentException("extraToPrincipal must be >= 0");
        }

        BigDecimal interest = getMonthlyInterest();
        BigDecimal available = paymentAmount.add(extraToPrincipal);
        BigDecimal paid;
        BigDecimal interestPaid;
        if (available.compareTo(interest) <= 0) {
            // negative amortization
            principal = principal.add(interest.subtract(available));
            interestPaid = available;
            paid = available;
        } else {
            BigDecimal toPrincipal = Money.min(available.subtract(interest), principal);
            principal = principal.subtract(toPrincipal);
            interestPaid = interest;
            paid = interest.add(toPrincipal);
        }
        totalInterestPaid = totalInterestPaid.add(interestPaid);
        interestPaidThisYear = interestPaidThisYear.add(interestPaid);
        principalHistory.add(principal);
        return paid;
    }

    /**
     * Instalment due each month; the loan's fixed payment unless a subclass says otherwise.
     */
    protected BigDecimal scheduledPayment() {
        return monthlyPayment;
    }

    /**
     * Makes up to twelve scheduled monthly payments, stopping once the loan is paid off.
     *
     * @return total paid this year
     */
    public BigDecimal makeYearlyPayment() {
        interestPaidThisYear = BigDecimal.ZERO;
        BigDecimal total = BigDecimal.ZERO;
        for (int month = 0; month < MONTHS_PER_YEAR && !isPaidOff(); month++) {
            total = total.add(makePayment(scheduledPayment()));
        }
        recordStat(Stat.INTEREST_PAID, interestPaidThisYear);
        return total;
    }

    public BigDecimal getInterestForYear() {
        return interestPaidThisYear;
    }

    public boolean isPaidOff() {
        return principal.signum() <= 0;
    }

    public List<BigDecimal> getPrincipalHistory() {
        return Collections.unmodifiableList(principalHistory);
    }
}
