package com.gillianbc.lifemodel.model.account;

import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.simulation.LifeModelAgent;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 529 education savings plan held by a person for a beneficiary.
 * <p>
 * The yearly contribution is paid from the owner's bank in the pre-step phase when it can be paid
 * in full; the plan grows in the step phase. Education withdrawals are tax free. For any other
 * withdrawal the earnings share is taxable income and subject to the early-withdrawal penalty.
 * The opening balance counts as contributions.
 */
@Getter
public class Plan529 extends LifeModelAgent implements Growable {

    private final Person owner;
    private final String beneficiary;
    private final String state;
    private final BigDecimal growthRate;
    private final BigDecimal yearlyContribution;
    private BigDecimal balance;
    private BigDecimal contributions;
    private final List<BigDecimal> growthHistory = new ArrayList<>();

    public Plan529(Person owner, String beneficiary, String state, BigDecimal balance, BigDecimal yearlyContribution) {
        this(owner, beneficiary, state, balance, yearlyContribution,
                owner.getModel().getConfig().getPlan529DefaultGrowthRate());
    }

    public Plan529(Person owner, String beneficiary, String state, BigDecimal balance,
                   BigDecimal yearlyContribution, BigDecimal growthRate) {
        super(owner.getModel());
        this.owner = owner;
        this.beneficiary = Objects.requireNonNull(beneficiary, "beneficiary must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.balance = Objects.requireNonNull(balance, "balance must not be null");
        this.yearlyContribution = Objects.requireNonNull(yearlyContribution, "yearlyContribution must not be null");
        this.growthRate = Objects.requireNonNull(growthRate, "growthRate must not be null");
        if (balance.signum() < 0 || yearlyContribution.signum() < 0) {
            throw new IllegalArgumentException("balance and yearlyContribution must be >= 0");
        }
        this.contributions = balance;
        getModel().getRegistries().getPlan529s().register(owner, this);
    }

    public BigDecimal getEarnings() {
        return Money.nonNegative(balance.subtract(contributions));
    }

    @Override
    public BigDecimal calculateGrowth() {
        return Money.percentOf(balance, growthRate);
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

    @Override
    public boolean deposit(BigDecimal amount) {
        if (amount.signum() < 0) {
            return false;
        }
        balance = balance.add(amount);
        contributions = contributions.add(amount);
        return true;
    }

    /**
     * Qualified education withdrawal; tax free.
     */
    @Override
    public BigDecimal withdraw(BigDecimal amount) {
        if (amount.signum() <= 0 || balance.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal withdrawn = Money.min(balance, amount);
        BigDecimal fromContributions = contributions.multiply(withdrawn).divide(balance, Money.MATH_CONTEXT);
        contributions = contributions.subtract(fromContributions);
        balance = balance.subtract(withdrawn);
        return withdrawn;
    }

    public BigDecimal withdrawForEducation(BigDecimal amount) {
        return withdraw(amount);
    }

    /**
     * Withdraws for anything other than education into the owner's bank account. Withdrawals take
     * contributions and earnings in proportion; the earnings share is taxed and penalised.
     *
     * @return the amount withdrawn
     */
    public BigDecimal withdrawNonQualified(BigDecimal amount) {
        BigDecimal earningsBefore = getEarnings();
        BigDecimal balanceBefore = balance;
        BigDecimal withdrawn = withdraw(amount);
        if (!Money.isPositive(withdrawn)) {
            return withdrawn;
        }
        BigDecimal fromEarnings = earningsBefore.multiply(withdrawn).divide(balanceBefore, Money.MATH_CONTEXT);
        if (Money.isPositive(fromEarnings)) {
            owner.addTaxableIncome(fromEarnings);
            owner.addEarlyWithdrawalAmount(fromEarnings);
        }
        owner.depositIntoBankAccount(withdrawn);
        return withdrawn;
    }

    @Override
    public void preStep() {
        if (Money.isPositive(yearlyContribution) && owner.payFromBankInFull(yearlyContribution)) {
            deposit(yearlyContribution);
        }
    }

    @Override
    public void step() {
        applyGrowth();
    }
}
