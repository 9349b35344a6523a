package com.gillianbc.lifemodel.model.account;

import com.gillianbc.lifemodel.model.Interest;
import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.simulation.LifeModelAgent;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Checking or savings account. Interest compounds at the configured frequency (monthly by default)
 * and is applied in the step phase.
 */
@Getter
public class BankAccount extends LifeModelAgent implements BalanceBearing {

    private final Person owner;
    private final String company;
    private final String type;
    private final BigDecimal interestRate;
    private final int compoundRate;
    private BigDecimal balance;
    private BigDecimal totalInterest = BigDecimal.ZERO;

    public BankAccount(Person owner, String company, BigDecimal balance) {
        this(owner, company, "Bank", balance, owner.getModel().getConfig().getBankDefaultInterestRate());
    }

    public BankAccount(Person owner, String company, String type, BigDecimal balance, BigDecimal interestRate) {
        super(owner.getModel());
        this.owner = owner;
        this.company = Objects.requireNonNull(company, "company must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.balance = Objects.requireNonNull(balance, "balance must not be null");
        this.interestRate = Objects.requireNonNull(interestRate, "interestRate must not be null");
        if (balance.signum() < 0) {
            throw new IllegalArgumentException("balance must be >= 0");
        }
        this.compoundRate = owner.getModel().getConfig().getBankCompoundRate();
        owner.getModel().getRegistries().getBankAccounts().register(owner, this);
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
        BigDecimal interest = Interest.compoundInterest(balance, interestRate, compoundRate);
        balance = balance.add(interest);
        totalInterest = totalInterest.add(interest);
    }

    @Override
    public void postStep() {
        recordStat(Stat.BANK_BALANCE, balance);
        recordStat(Stat.USABLE_BALANCE, balance);
    }
}
