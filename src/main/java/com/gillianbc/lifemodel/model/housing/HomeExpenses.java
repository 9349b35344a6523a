package com.gillianbc.lifemodel.model.housing;

import com.gillianbc.lifemodel.model.Money;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Running costs of a home. Property tax and insurance follow the home's value; maintenance,
 * improvements and HOA dues grow by their own yearly percentages.
 */
@Getter
public class HomeExpenses {

    private final BigDecimal propertyTaxPercent;
    private final BigDecimal homeInsurancePercent;
    private BigDecimal maintenanceAmount;
    private final BigDecimal maintenanceIncrease;
    private BigDecimal improvementAmount;
    private final BigDecimal improvementIncrease;
    private BigDecimal hoaAmount;
    private final BigDecimal hoaIncrease;

    public HomeExpenses(BigDecimal propertyTaxPercent,
                        BigDecimal homeInsurancePercent,
                        BigDecimal maintenanceAmount,
                        BigDecimal maintenanceIncrease,
                        BigDecimal improvementAmount,
                        BigDecimal improvementIncrease,
                        BigDecimal hoaAmount,
                        BigDecimal hoaIncrease) {
        this.propertyTaxPercent = Objects.requireNonNull(propertyTaxPercent, "propertyTaxPercent must not be null");
        this.homeInsurancePercent = Objects.requireNonNull(homeInsurancePercent, "homeInsurancePercent must not be null");
        this.maintenanceAmount = Objects.requireNonNull(maintenanceAmount, "maintenanceAmount must not be null");
        this.maintenanceIncrease = Objects.requireNonNull(maintenanceIncrease, "maintenanceIncrease must not be null");
        this.improvementAmount = Objects.requireNonNull(improvementAmount, "improvementAmount must not be null");
        this.improvementIncrease = Objects.requireNonNull(improvementIncrease, "improvementIncrease must not be null");
        this.hoaAmount = Objects.requireNonNull(hoaAmount, "hoaAmount must not be null");
        this.hoaIncrease = Objects.requireNonNull(hoaIncrease, "hoaIncrease must not be null");
    }

    /**
     * Expenses with no running costs at all.
     */
    public static HomeExpenses none() {
        BigDecimal zero = BigDecimal.ZERO;
        return new HomeExpenses(zero, zero, zero, zero, zero, zero, zero, zero);
    }

    public BigDecimal getYearlySpending(BigDecimal homeValue) {
        return Money.percentOf(homeValue, propertyTaxPercent)
                .add(Money.percentOf(homeValue, homeInsurancePercent))
                .add(maintenanceAmount)
                .add(improvementAmount)
                .add(hoaAmount);
    }

    void advanceYear() {
        maintenanceAmount = maintenanceAmount.add(Money.percentOf(maintenanceAmount, maintenanceIncrease));
        improvementAmount = improvementAmount.add(Money.percentOf(improvementAmount, improvementIncrease));
        hoaAmount = hoaAmount.add(Money.percentOf(hoaAmount, hoaIncrease));
    }
}
