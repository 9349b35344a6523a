package com.gillianbc.lifemodel.model.account;

import com.gillianbc.lifemodel.model.Interest;
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
 * Common behaviour of traditional and Roth IRAs: continuous growth and a yearly contribution
 * drawn from the owner's bank accounts, capped by the age-dependent contribution limit.
 */
@Getter
public abstract class IraAccount extends LifeModelAgent implements Growable, RetirementGated, RetirementAccount {

    private final Person owner;
    private final BigDecimal yearlyContribution;
    private final BigDecimal averageGrowth;
    protected BigDecimal balance;
    private final List<BigDecimal> growthHistory = new ArrayList<>();

    protected IraAccount(Person owner, BigDecimal balance, BigDecimal yearlyContribution, BigDecimal averageGrowth) {
        super(owner.getModel());
        this.owner = owner;
        this.balance = Objects.requireNonNull(balance, "balance must not be null");
        this.yearlyContribution = Objects.requireNonNull(yearlyContribution, "yearlyContribution must not be null");
        this.averageGrowth = Objects.requireNonNull(averageGrowth, "averageGrowth must not be null");
        if (balance.signum() < 0 || yearlyContribution.signum() < 0) {
            throw new IllegalArgumentException("balance and yearlyContribution must be >= 0");
        }
        getModel().getRegistries().getRetirementAccounts().register(owner, this);
    }

    public BigDecimal getContributionLimit() {
        return getModel().getConfig().getIraContributionLimit(owner.getAge());
    }

    @Override
    public BigDecimal calculateGrowth() {
        return Interest.continuousInterest(balance, averageGrowth);
    }

    @Override
    public BigDecimal applyGrowth() {
        BigDecimal growth = calculateGrowth();
        balance = balance.add(growth);
        growthHistory.add(growth);
        return growth;
    }

    @Override
    public List<BigDecimal> getGrowthHistory() {
        return Collections.unmodifiableList(growthHistory);
    }

    /**
     * Moves this year's contribution from the owner's bank accounts, as far as they can cover it.
     *
     * @return amount actually contributed
     */
    public BigDecimal contribute() {
        BigDecimal target = Money.min(yearlyContribution, getContributionLimit());
        BigDecimal contributed = target.subtract(owner.deductFromBankAccounts(target));
        balance = balance.add(contributed);
        return contributed;
    }

    @Override
    public boolean deposit(BigDecimal amount) {
        if (amount.signum() < 0) {
            return false;
        }
        balance = balance.add(amount);
        return true;
    }

    /**
     * Removes up to {@code amount} with no tax bookkeeping.
     */
    protected BigDecimal deduct(BigDecimal amount) {
        if (amount.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal deducted = Money.min(balance, amount);
        balance = balance.subtract(deducted);
        return deducted;
    }

    public boolean isEarlyWithdrawal() {
        return !isUsable(owner.getAge());
    }

    @Override
    public boolean isUsable(int age) {
        return getModel().getRetirementRules().isUsable(age);
    }

    @Override
    public void postStep() {
        recordStat(Stat.RETIREMENT_BALANCE, balance);
        if (isUsable(owner.getAge())) {
            recordStat(Stat.USABLE_BALANCE, balance);
        }
    }
}
