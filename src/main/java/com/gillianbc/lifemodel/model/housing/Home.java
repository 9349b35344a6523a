package com.gillianbc.lifemodel.model.housing;

import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.simulation.LifeModelAgent;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An owned home. Its value appreciates in the step phase; the owner pays the mortgage and
 * running costs as part of their yearly obligations.
 */
@Getter
public class Home extends LifeModelAgent {

    private final Person owner;
    private final String name;
    private final BigDecimal purchasePrice;
    private final BigDecimal valueYearlyIncrease;
    private final BigDecimal downPayment;
    private final Mortgage mortgage;
    private final HomeExpenses expenses;
    private BigDecimal homeValue;

    public Home(Person owner,
                String name,
                BigDecimal purchasePrice,
                BigDecimal valueYearlyIncrease,
                BigDecimal downPayment,
                Mortgage mortgage,
                HomeExpenses expenses) {
        super(owner.getModel());
        this.owner = owner;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.purchasePrice = Objects.requireNonNull(purchasePrice, "purchasePrice must not be null");
        this.valueYearlyIncrease = Objects.requireNonNull(valueYearlyIncrease, "valueYearlyIncrease must not be null");
        this.downPayment = Objects.requireNonNull(downPayment, "downPayment must not be null");
        this.mortgage = Objects.requireNonNull(mortgage, "mortgage must not be null");
        this.expenses = Objects.requireNonNull(expenses, "expenses must not be null");
        this.homeValue = purchasePrice;
        getModel().getRegistries().getHomes().register(owner, this);
    }

    /**
     * Pays the year's mortgage instalments and running costs.
     *
     * @return total paid
     */
    public BigDecimal makeYearlyPayment() {
        BigDecimal total = expenses.getYearlySpending(homeValue).add(mortgage.makeYearlyPayment());
        recordStat(Stat.HOME_EXPENSES, total);
        return total;
    }

    @Override
    public void step() {
        homeValue = homeValue.add(Money.percentOf(homeValue, valueYearlyIncrease));
    }

    @Override
    public void postStep() {
        expenses.advanceYear();
    }
}
