package com.gillianbc.lifemodel.model.benefit;

import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.account.Growable;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.simulation.LifeModelAgent;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Annuity that grows until its payout age and then pays its balance out in equal shares over the
 * remaining payout years. Payouts go to the bank as taxable income in the pre-step phase and growth
 * is applied in the step phase.
 * <p>
 * Surrendering pays out the balance less the surrender charge and makes the annuity inactive. An
 * annuity also becomes inactive once fully paid out. An inactive annuity neither grows nor pays.
 */
@Getter
public class Annuity extends LifeModelAgent implements Growable, PeriodicBenefit {

    private final Person owner;
    private final AnnuityType annuityType;
    private final String company;
    private final BigDecimal interestRate;
    private final int payoutStartAge;
    private final int payoutYears;
    private BigDecimal balance;
    private int yearsPaid;
    private boolean active = true;
    private final List<BigDecimal> growthHistory = new ArrayList<>();

    public Annuity(Person owner, AnnuityType annuityType, String company, BigDecimal balance,
                   BigDecimal interestRate, int payoutStartAge, int payoutYears) {
        super(owner.getModel());
        this.owner = owner;
        this.annuityType = Objects.requireNonNull(annuityType, "annuityType must not be null");
        this.company = Objects.requireNonNull(company, "company must not be null");
        this.balance = Objects.requireNonNull(balance, "balance must not be null");
        this.interestRate = Objects.requireNonNull(interestRate, "interestRate must not be null");
        if (balance.signum() < 0) {
            throw new IllegalArgumentException("balance must be >= 0");
        }
        if (payoutYears <= 0) {
            throw new IllegalArgumentException("payoutYears must be > 0");
        }
        this.payoutStartAge = payoutStartAge;
        this.payoutYears = payoutYears;
        getModel().getRegistries().getAnnuities().register(owner, this);
    }

    @Override
    public boolean isEligible() {
        return active && owner.getAge() >= payoutStartAge && yearsPaid < payoutYears;
    }

    /**
     * @return this year's share of the balance once payouts have started
     */
    @Override
    public BigDecimal getAnnualBenefit() {
        if (!isEligible()) {
            return BigDecimal.ZERO;
        }
        return balance.divide(BigDecimal.valueOf((long) payoutYears - yearsPaid), Money.MATH_CONTEXT);
    }

    @Override
    public BigDecimal calculateGrowth() {
        return active ? Money.percentOf(balance, interestRate) : BigDecimal.ZERO;
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
        return true;
    }

    @Override
    public BigDecimal withdraw(BigDecimal amount) {
        if (amount.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal withdrawn = Money.min(balance, amount);
        balance = balance.subtract(withdrawn);
        return withdrawn;
    }

    /**
     * Cashes the annuity in. The balance less the configured surrender charge goes to the owner's
     * bank as taxable income.
     *
     * @return the amount paid to the owner; zero if already inactive
     */
    public BigDecimal surrender() {
        if (!active) {
            return BigDecimal.ZERO;
        }
        BigDecimal charge = Money.percentOf(balance, getModel().getConfig().getAnnuitySurrenderChargePercent());
        BigDecimal proceeds = withdraw(balance).subtract(charge);
        active = false;
        if (Money.isPositive(proceeds)) {
            owner.depositIntoBankAccount(proceeds);
            owner.addTaxableIncome(proceeds);
        }
        getModel().logEvent(owner.getName() + " surrendered a " + annuityType.label().toLowerCase()
                + " annuity with " + company + " for $" + Money.display(proceeds));
        return proceeds;
    }

    @Override
    public void preStep() {
        BigDecimal payout = withdraw(getAnnualBenefit());
        if (!Money.isPositive(payout)) {
            return;
        }
        if (yearsPaid == 0) {
            getModel().logEvent(owner.getName() + " started receiving annuity payments of $"
                    + Money.display(payout) + " from " + company);
        }
        yearsPaid++;
        owner.depositIntoBankAccount(payout);
        owner.addTaxableIncome(payout);
        recordStat(Stat.GROSS_INCOME, payout);
        if (yearsPaid == payoutYears) {
            active = false;
        }
    }

    @Override
    public void step() {
        if (active) {
            applyGrowth();
        }
    }
}
