package com.gillianbc.lifemodel.model.account;

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
 * Taxable investment account growing at a simple yearly rate.
 */
@Getter
public class BrokerageAccount extends LifeModelAgent implements Growable {

    private final Person owner;
    private final String company;
    private final BigDecimal growthRate;
    private BigDecimal balance;
    private final List<BigDecimal> growthHistory = new ArrayList<>();

    public BrokerageAccount(Person owner, String company, BigDecimal balance) {
        this(owner, company, balance, owner.getModel().getConfig().getBrokerageDefaultGrowthRate());
    }

    public BrokerageAccount(Person owner, String company, BigDecimal balance, BigDecimal growthRate) {
        super(owner.getModel());
        this.owner = owner;
        this.company = Objects.requireNonNull(company, "company must not be null");
        this.balance = Objects.requireNonNull(balance, "balance must not be null");
        this.growthRate = Objects.requireNonNull(growthRate, "growthRate must not be null");
        owner.getModel().getRegistries().getInvestments().register(owner, this);
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
        recordStat(Stat.USABLE_BALANCE, balance);
    }
}
