package com.gillianbc.lifemodel.model.charity;

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
 * Donor-advised fund. Money moved in from the owner's bank is deductible in the year it goes in;
 * grants out to charities are not. The fund grows at the brokerage rate in the step phase.
 */
@Getter
public class DonorAdvisedFund extends LifeModelAgent implements Growable {

    private final Person owner;
    private final String fundName;
    private final BigDecimal growthRate;
    private BigDecimal balance;
    private BigDecimal contributedThisYear = BigDecimal.ZERO;
    private BigDecimal totalGranted = BigDecimal.ZERO;
    private final List<BigDecimal> growthHistory = new ArrayList<>();

    public DonorAdvisedFund(Person owner, String fundName, BigDecimal balance) {
        this(owner, fundName, balance, owner.getModel().getConfig().getBrokerageDefaultGrowthRate());
    }

    public DonorAdvisedFund(Person owner, String fundName, BigDecimal balance, BigDecimal growthRate) {
        super(owner.getModel());
        this.owner = owner;
        this.fundName = Objects.requireNonNull(fundName, "fundName must not be null");
        this.balance = Objects.requireNonNull(balance, "balance must not be null");
        this.growthRate = Objects.requireNonNull(growthRate, "growthRate must not be null");
        if (balance.signum() < 0) {
            throw new IllegalArgumentException("balance must be >= 0");
        }
        getModel().getRegistries().getDonorAdvisedFunds().register(owner, this);
    }

    /**
     * Moves money from the owner's bank into the fund when the bank can cover all of it.
     *
     * @return whether the contribution was made
     */
    public boolean contribute(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount must not be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
        if (!owner.payFromBankInFull(amount)) {
            return false;
        }
        deposit(amount);
        contributedThisYear = contributedThisYear.add(amount);
        addToStat(Stat.DONATIONS, amount);
        return true;
    }

    /**
     * Grants up to {@code amount} to a charity.
     *
     * @return the amount granted
     */
    public BigDecimal grant(String charity, BigDecimal amount) {
        Objects.requireNonNull(charity, "charity must not be null");
        BigDecimal granted = withdraw(amount);
        if (Money.isPositive(granted)) {
            totalGranted = totalGranted.add(granted);
            getModel().logEvent(fundName + " granted $" + Money.display(granted) + " to " + charity);
        }
        return granted;
    }

    public BigDecimal getDeductibleThisYear() {
        return contributedThisYear;
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

    @Override
    public void step() {
        applyGrowth();
    }

    @Override
    public void postStep() {
        contributedThisYear = BigDecimal.ZERO;
    }
}
