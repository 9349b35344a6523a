package com.gillianbc.lifemodel.model.account;

import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.people.Person;

import java.math.BigDecimal;

/**
 * Pre-tax IRA. Withdrawals are income, early withdrawals are penalised and required minimum
 * distributions are forced out from the RMD start age.
 */
public class TraditionalIra extends IraAccount {

    public TraditionalIra(Person owner, BigDecimal balance, BigDecimal yearlyContribution) {
        this(owner, balance, yearlyContribution, owner.getModel().getConfig().getIraDefaultGrowthRate());
    }

    public TraditionalIra(Person owner, BigDecimal balance, BigDecimal yearlyContribution, BigDecimal averageGrowth) {
        super(owner, balance, yearlyContribution, averageGrowth);
    }

    @Override
    public BigDecimal getPretaxBalance() {
        return balance;
    }

    @Override
    public BigDecimal getRothBalance() {
        return BigDecimal.ZERO;
    }

    @Override
    public BigDecimal deductPretax(BigDecimal amount) {
        return deduct(amount);
    }

    @Override
    public BigDecimal deductRoth(BigDecimal amount) {
        return BigDecimal.ZERO;
    }

    /**
     * Ad hoc withdrawal into the owner's bank account. The amount is taxable income and, before the
     * federal retirement age, also subject to the early-withdrawal penalty.
     */
    @Override
    public BigDecimal withdraw(BigDecimal amount) {
        boolean early = isEarlyWithdrawal();
        BigDecimal withdrawn = deduct(amount);
        if (Money.isPositive(withdrawn)) {
            getOwner().addTaxableIncome(withdrawn);
            if (early) {
                getOwner().addEarlyWithdrawalAmount(withdrawn);
            }
            getOwner().depositIntoBankAccount(withdrawn);
        }
        return withdrawn;
    }

    @Override
    public void preStep() {
        applyGrowth();
        contribute();
        Person owner = getOwner();
        BigDecimal distribution = deduct(getModel().getRetirementRules()
                .requiredMinimumDistribution(owner.getAge(), balance));
        if (Money.isPositive(distribution)) {
            owner.depositIntoBankAccount(distribution);
            owner.addTaxableIncome(distribution);
            recordStat(Stat.REQUIRED_MIN_DISTRIB, distribution);
            if (owner.getAge() == getModel().getConfig().getRmdStartAge()) {
                getModel().logEvent(owner.getName() + " took a first required minimum distribution of $"
                        + Money.display(distribution) + " from a traditional IRA");
            }
        }
    }
}
