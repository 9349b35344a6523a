package com.gillianbc.lifemodel.model.charity;

import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.simulation.LifeModelAgent;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A gift to a charity, given once a year for a number of years. The gift is part of the giver's
 * obligations for the year, and a deductible gift counts towards their itemized deductions.
 */
@Getter
public class Donation extends LifeModelAgent {

    private final Person donor;
    private final String charity;
    private final BigDecimal amount;
    private final DonationType donationType;
    private final boolean taxDeductible;
    private final int years;
    private int yearsGiven;
    private BigDecimal givenThisYear = BigDecimal.ZERO;

    /**
     * A one-off gift in the next simulated year.
     */
    public Donation(Person donor, String charity, BigDecimal amount, DonationType donationType, boolean taxDeductible) {
        this(donor, charity, amount, donationType, taxDeductible, 1);
    }

    public Donation(Person donor, String charity, BigDecimal amount, DonationType donationType,
                    boolean taxDeductible, int years) {
        super(donor.getModel());
        this.donor = donor;
        this.charity = Objects.requireNonNull(charity, "charity must not be null");
        this.amount = Objects.requireNonNull(amount, "amount must not be null");
        this.donationType = Objects.requireNonNull(donationType, "donationType must not be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
        if (years <= 0) {
            throw new IllegalArgumentException("years must be > 0");
        }
        this.taxDeductible = taxDeductible;
        this.years = years;
        getModel().getRegistries().getDonations().register(donor, this);
    }

    public boolean isComplete() {
        return yearsGiven >= years;
    }

    /**
     * Called by the donor in their pre-step.
     *
     * @return this year's gift, zero once every year has been given
     */
    public BigDecimal makeYearlyGift() {
        if (isComplete()) {
            return BigDecimal.ZERO;
        }
        yearsGiven++;
        givenThisYear = amount;
        recordStat(Stat.DONATIONS, amount);
        if (yearsGiven == 1 && Money.isPositive(amount)) {
            getModel().logEvent(donor.getName() + " gave $" + Money.display(amount) + " ("
                    + donationType.label().toLowerCase() + ") to " + charity);
        }
        return amount;
    }

    /**
     * @return the part of this year's gift that can be itemized
     */
    public BigDecimal getDeductibleThisYear() {
        return taxDeductible ? givenThisYear : BigDecimal.ZERO;
    }

    @Override
    public void postStep() {
        givenThisYear = BigDecimal.ZERO;
    }
}
