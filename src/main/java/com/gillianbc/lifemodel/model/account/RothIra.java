package com.gillianbc.lifemodel.model.account;

import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.people.Person;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * After-tax IRA. Contributions come out first and are never penalised; earnings taken out
 * before the federal retirement age count towards the early-withdrawal penalty.
 * No required minimum distributions.
 */
public class RothIra extends IraAccount {

    @Getter
    private BigDecimal totalContributions = BigDecimal.ZERO;

    public RothIra(Person owner, BigDecimal balance, BigDecimal yearlyContribution) {
        this(owner, balance, yearlyContribution, owner.getModel().getConfig().getIraDefaultGrowthRate());
    }

    public RothIra(Person owner, BigDecimal balance, BigDecimal yearlyContribution, BigDecimal averageGrowth) {
        super(owner, balance, yearlyContribution, averageGrowth);
    }

    @Override
    public BigDecimal getPretaxBalance() {
        return BigDecimal.ZERO;
    }

    @Override
    public BigDecimal getRothBalance() {
        return balance;
    }

    @Override
    public BigDecimal deductPretax(BigDecimal amount) {
        return BigDecimal.ZERO;
    }

    /**
     * Forced deduction while paying bills; draws down the contribution basis first.
     */
    @Override
    public BigDecimal deductRoth(BigDecimal amount) {
        BigDecimal deducted = deduct(amount);
        totalContributions = Money.nonNegative(totalContributions.subtract(deducted));
        return deducted;
    }

    @Override
    public boolean deposit(BigDecimal amount) {
        boolean deposited = super.deposit(amount);
        if (deposited) {
            totalContributions = totalContributions.add(amount);
        }
        return deposited;
    }

    /**
     * Ad hoc withdrawal into the owner's bank account, contributions before earnings.
     */
    @Override
    public BigDecimal withdraw(BigDecimal amount) {
        if (amount.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal fromContributions = Money.min(amount, totalContributions);
        BigDecimal earnings = Money.nonNegative(balance.subtract(totalContributions));
        BigDecimal fromEarnings = Money.min(amount.subtract(fromContributions), earnings);
        BigDecimal withdrawn = fromContributions.add(fromEarnings);

        balance = balance.subtract(withdrawn);
        totalContributions = totalContributions.subtract(fromContributions);
        if (isEarlyWithdrawal() && Money.isPositive(fromEarnings)) {
            getOwner().addEarlyWithdrawalAmount(fromEarnings);
        }
        if (Money.isPositive(withdrawn)) {
            getOwner().depositIntoBankAccount(withdrawn);
        }
        return withdrawn;
    }

    @Override
    public void preStep() {
        applyGrowth();
        BigDecimal contributed = contribute();
        totalContributions = totalContributions.add(contributed);
    }
}
