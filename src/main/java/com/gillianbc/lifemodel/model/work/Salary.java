package com.gillianbc.lifemodel.model.work;

import com.gillianbc.lifemodel.model.Money;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

@Getter
public class Salary {

    private BigDecimal base;
    /** Yearly raise in percent. */
    private final BigDecimal yearlyIncrease;
    /** Yearly bonus as a percentage of the base. */
    private final BigDecimal yearlyBonus;

    public Salary(BigDecimal base, BigDecimal yearlyIncrease, BigDecimal yearlyBonus) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.yearlyIncrease = Objects.requireNonNull(yearlyIncrease, "yearlyIncrease must not be null");
        this.yearlyBonus = Objects.requireNonNull(yearlyBonus, "yearlyBonus must not be null");
        if (base.signum() < 0) {
            throw new IllegalArgumentException("base must be >= 0");
        }
    }

    public BigDecimal getBonus() {
        return Money.percentOf(base, yearlyBonus);
    }

    void advanceYear() {
        base = base.add(Money.percentOf(base, yearlyIncrease));
    }
}
