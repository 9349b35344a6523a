package com.gillianbc.lifemodel.model.account;

import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.simulation.LifeModelAgent;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Health savings account.
 * <p>
 * Each pre-step the employer contribution and then the owner's own contribution are added, together
 * capped by the yearly limit for the account's tier. The owner's part is paid from the bank and is
 * deducted from income for the year. Medical withdrawals are tax free. Other withdrawals are income,
 * and before the penalty-free age a penalty is kept back from the proceeds.
 */
@Getter
public class HealthSavingsAccount extends LifeModelAgent implements BalanceBearing {

    private final Person owner;
    private final HsaType hsaType;
    private final BigDecimal yearlyContribution;
    private final BigDecimal employerContribution;
    private BigDecimal balance;
    private BigDecimal contributionsThisYear = BigDecimal.ZERO;
    private BigDecimal deductibleContributionsThisYear = BigDecimal.ZERO;
    private BigDecimal totalPenalties = BigDecimal.ZERO;

    public HealthSavingsAccount(Person owner, HsaType hsaType, BigDecimal balance,
                                BigDecimal yearlyContribution, BigDecimal employerContribution) {
        super(owner.getModel());
        this.owner = owner;
        this.hsaType = Objects.requireNonNull(hsaType, "hsaType must not be null");
        this.balance = Objects.requireNonNull(balance, "balance must not be null");
        this.yearlyContribution = Objects.requireNonNull(yearlyContribution, "yearlyContribution must not be null");
        this.employerContribution = Objects.requireNonNull(employerContribution, "employerContribution must not be null");
        if (balance.signum() < 0 || yearlyContribution.signum() < 0 || employerContribution.signum() < 0) {
            throw new IllegalArgumentException("balance and contributions must be >= 0");
        }
        getModel().getRegistries().getHealthSavingsAccounts().register(owner, this);
    }

    public BigDecimal getContributionLimit() {
        return getModel().getConfig().getHsaContributionLimit(hsaType);
    }

    public BigDecimal getRemainingLimit() {
        return Money.nonNegative(getContributionLimit().subtract(contributionsThisYear));
    }

    /**
     * Adds the owner's own money, up to the remaining yearly limit. The accepted amount is deductible
     * this year; the caller keeps anything above the limit.
     *
     * @return the amount accepted
     */
    public BigDecimal contribute(BigDecimal amount) {
        if (amount.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal accepted = Money.min(amount, getRemainingLimit());
        balance = balance.add(accepted);
        contributionsThisYear = contributionsThisYear.add(accepted);
        deductibleContributionsThisYear = deductibleContributionsThisYear.add(accepted);
        return accepted;
    }

    /**
     * Adds money outside the yearly limit, e.g. a rollover.
     */
    @Override
    public boolean deposit(BigDecimal amount) {
        if (amount.signum() < 0) {
            return false;
        }
        balance = balance.add(amount);
        return true;
    }

    /**
     * Tax-free withdrawal for qualified medical expenses; same as {@link #withdrawMedical(BigDecimal)}.
     */
    @Override
    public BigDecimal withdraw(BigDecimal amount) {
        if (amount.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal withdrawn = Money.min(balance, amount);
        balance = balance.subtract(withdrawn);
        return withdrawn;
    }

    public BigDecimal withdrawMedical(BigDecimal amount) {
        return withdraw(amount);
    }

    /**
     * Withdraws for anything other than medical expenses. The amount taken is taxable income and the
     * proceeds, less any penalty, go to the owner's bank account.
     *
     * @return the amount taken from the account, before any penalty
     */
    public BigDecimal withdrawNonMedical(BigDecimal amount) {
        BigDecimal withdrawn = withdraw(amount);
        if (!Money.isPositive(withdrawn)) {
            return withdrawn;
        }
        BigDecimal penalty = BigDecimal.ZERO;
        if (owner.getAge() < getModel().getConfig().getHsaPenaltyFreeAge()) {
            penalty = Money.percentOf(withdrawn, getModel().getConfig().getHsaNonMedicalPenaltyRate());
            totalPenalties = totalPenalties.add(penalty);
            addToStat(Stat.TAXES_PAID, penalty);
        }
        owner.addTaxableIncome(withdrawn);
        owner.depositIntoBankAccount(withdrawn.subtract(penalty));
        return withdrawn;
    }

    @Override
    public void preStep() {
        BigDecimal employer = Money.min(employerContribution, getRemainingLimit());
        balance = balance.add(employer);
        contributionsThisYear = contributionsThisYear.add(employer);

        BigDecimal wanted = Money.min(yearlyContribution, getRemainingLimit());
        if (Money.isPositive(wanted)) {
            BigDecimal paid = wanted.subtract(owner.deductFromBankAccounts(wanted));
            contribute(paid);
        }
    }

    @Override
    public void postStep() {
        contributionsThisYear = BigDecimal.ZERO;
        deductibleContributionsThisYear = BigDecimal.ZERO;
    }
}
