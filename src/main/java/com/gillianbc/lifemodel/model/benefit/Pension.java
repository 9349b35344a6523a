package com.gillianbc.lifemodel.model.benefit;

import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.simulation.LifeModelAgent;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Defined-benefit pension. Service accrues for every year the owner works; once vested and at
 * the start age the benefit is paid into the bank each pre-step as taxable income.
 */
@Getter
public class Pension extends LifeModelAgent implements PeriodicBenefit {

    private final Person owner;
    private final String company;
    private final int vestingYears;
    private int yearsOfService;
    private final BigDecimal benefitAmount;
    private final int startAge;
    private boolean paying;

    public Pension(Person owner, String company, int vestingYears, int yearsOfService, BigDecimal benefitAmount, int startAge) {
        super(owner.getModel());
        this.owner = owner;
        this.company = Objects.requireNonNull(company, "company must not be null");
        this.benefitAmount = Objects.requireNonNull(benefitAmount, "benefitAmount must not be null");
        if (vestingYears < 0 || yearsOfService < 0 || benefitAmount.signum() < 0) {
            throw new IllegalArgumentException("vestingYears, yearsOfService and benefitAmount must be >= 0");
        }
        this.vestingYears = vestingYears;
        this.yearsOfService = yearsOfService;
        this.startAge = startAge;
        getModel().getRegistries().getPensions().register(owner, this);
    }

    public boolean isVested() {
        return yearsOfService >= vestingYears;
    }

    @Override
    public boolean isEligible() {
        return isVested() && owner.getAge() >= startAge;
    }

    @Override
    public BigDecimal getAnnualBenefit() {
        return isEligible() ? benefitAmount : BigDecimal.ZERO;
    }

    @Override
    public void preStep() {
        BigDecimal benefit = getAnnualBenefit();
        if (!Money.isPositive(benefit)) {
            return;
        }
        owner.depositIntoBankAccount(benefit);
        owner.addTaxableIncome(benefit);
        recordStat(Stat.GROSS_INCOME, benefit);
        if (!paying) {
            paying = true;
            getModel().logEvent(owner.getName() + " started receiving a pension of $" + Money.display(benefit)
                    + " from " + company);
        }
    }

    @Override
    public void postStep() {
        if (!owner.isRetired()) {
            yearsOfService++;
        }
    }
}
