package com.gillianbc.lifemodel.model.account;

import com.gillianbc.lifemodel.model.Interest;
import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.model.work.Job;
import com.gillianbc.lifemodel.service.RetirementRules;
import com.gillianbc.lifemodel.simulation.LifeModelAgent;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Employer 401k with separate pre-tax and Roth balances.
 * <p>
 * Both balances grow continuously in the pre-step phase, after which the required minimum
 * distribution for the owner's age is forced out of the pre-tax balance into the bank and
 * counted as income. Contributions and the company match are posted by the sponsoring {@link Job}.
 * When the owner retires the account stays with them with no sponsoring job.
 */
@Getter
public class Job401kAccount extends LifeModelAgent implements RetirementAccount {

    private final Person owner;
    private Job job;
    private BigDecimal pretaxBalance;
    private final BigDecimal pretaxContribPercent;
    private BigDecimal rothBalance;
    private final BigDecimal rothContribPercent;
    private final BigDecimal averageGrowth;
    private final BigDecimal companyMatchPercent;

    public Job401kAccount(Job job,
                          BigDecimal pretaxBalance,
                          BigDecimal pretaxContribPercent,
                          BigDecimal rothBalance,
                          BigDecimal rothContribPercent,
                          BigDecimal averageGrowth,
                          BigDecimal companyMatchPercent) {
        super(job.getModel());
        this.job = job;
        this.owner = job.getOwner();
        this.pretaxBalance = requireNonNegative(pretaxBalance, "pretaxBalance");
        this.pretaxContribPercent = requireNonNegative(pretaxContribPercent, "pretaxContribPercent");
        this.rothBalance = requireNonNegative(rothBalance, "rothBalance");
        this.rothContribPercent = requireNonNegative(rothContribPercent, "rothContribPercent");
        this.averageGrowth = Objects.requireNonNull(averageGrowth, "averageGrowth must not be null");
        this.companyMatchPercent = requireNonNegative(companyMatchPercent, "companyMatchPercent");
        job.setRetirementAccount(this);
        getModel().getRegistries().getRetirementAccounts().register(owner, this);
    }

    private static BigDecimal requireNonNegative(BigDecimal value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
        return value;
    }

    public Optional<Job> getJob() {
        return Optional.ofNullable(job);
    }

    public BigDecimal pretaxContribution(BigDecimal salary) {
        return Money.percentOf(salary, pretaxContribPercent);
    }

    public BigDecimal rothContribution(BigDecimal salary) {
        return Money.percentOf(salary, rothContribPercent);
    }

    public BigDecimal companyMatch(BigDecimal contribution) {
        return Money.percentOf(contribution, companyMatchPercent);
    }

    /**
     * Posts a year's contributions; the match always goes to the pre-tax balance.
     */
    public void contribute(BigDecimal pretax, BigDecimal roth, BigDecimal match) {
        pretaxBalance = pretaxBalance.add(pretax).add(match);
        rothBalance = rothBalance.add(roth);
    }

    /**
     * Detaches the account from its job, leaving it with the owner.
     */
    public void orphan() {
        job = null;
    }

    @Override
    public BigDecimal deductPretax(BigDecimal amount) {
        if (amount.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal deducted = Money.min(pretaxBalance, amount);
        pretaxBalance = pretaxBalance.subtract(deducted);
        return deducted;
    }

    @Override
    public BigDecimal deductRoth(BigDecimal amount) {
        if (amount.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal deducted = Money.min(rothBalance, amount);
        rothBalance = rothBalance.subtract(deducted);
        return deducted;
    }

    @Override
    public boolean isUsable(int age) {
        return getModel().getRetirementRules().isUsable(age);
    }

    @Override
    public void preStep() {
        pretaxBalance = pretaxBalance.add(Interest.continuousInterest(pretaxBalance, averageGrowth));
        rothBalance = rothBalance.add(Interest.continuousInterest(rothBalance, averageGrowth));

        RetirementRules rules = getModel().getRetirementRules();
        BigDecimal distribution = deductPretax(rules.requiredMinimumDistribution(owner.getAge(), pretaxBalance));
        if (Money.isPositive(distribution)) {
            owner.depositIntoBankAccount(distribution);
            owner.addTaxableIncome(distribution);
            recordStat(Stat.REQUIRED_MIN_DISTRIB, distribution);
            if (owner.getAge() == getModel().getConfig().getRmdStartAge()) {
                getModel().logEvent(owner.getName() + " took a first required minimum distribution of $"
                        + Money.display(distribution) + " from a 401k");
            }
        }
    }

    @Override
    public void postStep() {
        recordStat(Stat.RETIREMENT_BALANCE, getTotalBalance());
        if (isUsable(owner.getAge())) {
            recordStat(Stat.USABLE_BALANCE, getTotalBalance());
        }
    }
}
