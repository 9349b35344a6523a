package com.gillianbc.lifemodel.model.housing;

import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.simulation.LifeModelAgent;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A rented home. Rent rises by a yearly percentage after each year.
 */
@Getter
public class Apartment extends LifeModelAgent {

    private static final BigDecimal DEFAULT_YEARLY_INCREASE = BigDecimal.valueOf(5);

    private final Person owner;
    private final String name;
    private BigDecimal monthlyRent;
    private final BigDecimal yearlyIncrease;

    public Apartment(Person owner, String name, BigDecimal monthlyRent) {
        this(owner, name, monthlyRent, DEFAULT_YEARLY_INCREASE);
    }

    public Apartment(Person owner, String name, BigDecimal monthlyRent, BigDecimal yearlyIncrease) {
        super(owner.getModel());
        this.owner = owner;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.monthlyRent = Objects.requireNonNull(monthlyRent, "monthlyRent must not be null");
        this.yearlyIncrease = Objects.requireNonNull(yearlyIncrease, "yearlyIncrease must not be null");
        getModel().getRegistries().getApartments().register(owner, this);
    }

    public BigDecimal getYearlyRent() {
        return monthlyRent.multiply(Money.TWELVE);
    }

    /**
     * @return this year's rent, reported as rent paid
     */
    public BigDecimal chargeYearlyRent() {
        BigDecimal rent = getYearlyRent();
        recordStat(Stat.RENT_PAID, rent);
        return rent;
    }

    @Override
    public void postStep() {
        monthlyRent = monthlyRent.add(Money.percentOf(monthlyRent, yearlyIncrease));
    }
}
