package com.gillianbc.lifemodel.model.people;

import com.gillianbc.lifemodel.model.Money;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Discretionary yearly spending: a base amount growing by a yearly percentage, plus one-time
 * expenses that are spent once and then cleared.
 */
@Getter
public class Spending {

    private BigDecimal base;
    private final BigDecimal yearlyIncrease;
    private BigDecimal oneTimeExpenses = BigDecimal.ZERO;

    public Spending(BigDecimal base) {
        this(base, BigDecimal.ZERO);
    }

    /**
     * @param yearlyIncrease yearly percentage increase of the base, 10 = 10%
     */
    public Spending(BigDecimal base, BigDecimal yearlyIncrease) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.yearlyIncrease = Objects.requireNonNull(yearlyIncrease, "yearlyIncrease must not be null");
        if (base.signum() < 0) {
            throw new IllegalArgumentException("base must be >= 0");
        }
    }

    public void addExpense(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount must not be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("expense must be >= 0");
        }
        oneTimeExpenses = oneTimeExpenses.add(amount);
    }

    public BigDecimal getYearlySpending() {
        return base.add(oneTimeExpenses);
    }

    /**
     * Returns this year's spending and clears the one-time expenses it includes.
     */
    BigDecimal consumeYearlySpending() {
        BigDecimal spending = getYearlySpending();
        oneTimeExpenses = BigDecimal.ZERO;
        return spending;
    }

    /**
     * Sets the base to {@code basePercent} percent of its current value, 50 = halve.
     */
    public void adjustBase(BigDecimal basePercent) {
        base = Money.percentOf(base, basePercent);
    }

    void advanceYear() {
        base = base.add(Money.percentOf(base, yearlyIncrease));
    }
}
