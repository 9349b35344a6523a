package com.gillianbc.lifemodel.model.people;

import com.gillianbc.lifemodel.model.FilingStatus;
import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.TaxesDue;
import com.gillianbc.lifemodel.service.SettlementResult;
import com.gillianbc.lifemodel.simulation.LifeModel;
import com.gillianbc.lifemodel.simulation.LifeModelAgent;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ordered group of people. When the family files jointly it is settled once as a unit, using the
 * members' combined income, bank balances and obligations; unpaid bills become the first
 * member's debt.
 * <p>
 * The filing status is taken from the first member.
 */
public class Family extends LifeModelAgent implements TaxableEntity {

    private final List<Person> members = new ArrayList<>();
    private SettlementResult lastSettlement;

    public Family(LifeModel model) {
        super(model);
    }

    void addMember(Person person) {
        members.add(person);
    }

    public List<Person> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public Optional<Person> getMember(String name) {
        return members.stream().filter(member -> member.getName().equals(name)).findFirst();
    }

    public Optional<SettlementResult> getLastSettlement() {
        return Optional.ofNullable(lastSettlement);
    }

    @Override
    public String getName() {
        return members.stream().map(Person::getName).collect(Collectors.joining(" & ", "Family(", ")"));
    }

    @Override
    public FilingStatus getFilingStatus() {
        return members.isEmpty() ? FilingStatus.SINGLE : members.get(0).getFilingStatus();
    }

    @Override
    public BigDecimal getTaxableIncome() {
        return sum(Person::getTaxableIncome);
    }

    @Override
    public BigDecimal getEarlyWithdrawalAmount() {
        return sum(Person::getEarlyWithdrawalAmount);
    }

    /**
     * The greater of the joint standard deduction and the members' combined itemized deductions,
     * plus every member's above-the-line deductions.
     */
    @Override
    public BigDecimal getFederalDeductions() {
        BigDecimal standard = getModel().getTaxCalculator().standardDeduction(getFilingStatus());
        return Money.max(standard, sum(Person::getItemizedDeductions)).add(sum(Person::getAboveTheLineDeductions));
    }

    @Override
    public BigDecimal getBankAccountBalance() {
        return sum(Person::getBankAccountBalance);
    }

    @Override
    public BigDecimal getDebt() {
        return sum(Person::getDebt);
    }

    public BigDecimal getCombinedObligations() {
        return sum(Person::getYearlyObligations);
    }

    @Override
    public BigDecimal withdrawFromPretaxRetirement(BigDecimal amount) {
        BigDecimal remaining = amount;
        for (Person member : members) {
            if (remaining.signum() <= 0) {
                break;
            }
            remaining = remaining.subtract(member.withdrawFromPretaxRetirement(remaining));
        }
        return amount.subtract(remaining);
    }

    @Override
    public BigDecimal payBills(BigDecimal amount) {
        BigDecimal remaining = amount;
        for (Person member : members) {
            if (remaining.signum() <= 0) {
                return BigDecimal.ZERO;
            }
            remaining = member.payBills(remaining);
        }
        return remaining;
    }

    @Override
    public void addDebt(BigDecimal amount) {
        if (members.isEmpty()) {
            throw new IllegalStateException("Family has no members to carry debt");
        }
        members.get(0).addDebt(amount);
    }

    /**
     * Pays down each member's debt from the whole family's money, in member order.
     */
    @Override
    public void payDownDebt() {
        for (Person member : members) {
            if (Money.isPositive(member.getDebt())) {
                member.setDebt(payBills(member.getDebt()));
            }
        }
    }

    /**
     * Runs the joint settlement for the year.
     *
     * @throws UnsupportedOperationException unless the family files jointly
     */
    public SettlementResult settle() {
        if (getFilingStatus() != FilingStatus.MARRIED_FILING_JOINTLY) {
            throw new UnsupportedOperationException("Family settlement requires "
                    + FilingStatus.MARRIED_FILING_JOINTLY + " but was " + getFilingStatus());
        }
        lastSettlement = getModel().getSettlementService().settle(this, getCombinedObligations());
        return lastSettlement;
    }

    @Override
    public void step() {
        if (members.isEmpty() || getFilingStatus() != FilingStatus.MARRIED_FILING_JOINTLY) {
            return;
        }
        TaxesDue taxes = settle().getTaxesDue();
        recordStat(Stat.TAXES_PAID, taxes.total());
        recordStat(Stat.TAXES_PAID_FEDERAL, taxes.getFederal());
        recordStat(Stat.TAXES_PAID_STATE, taxes.getState());
        recordStat(Stat.TAXES_PAID_SS, taxes.getSocialSecurity());
        recordStat(Stat.TAXES_PAID_MEDICARE, taxes.getMedicare());
    }

    private BigDecimal sum(Function<Person, BigDecimal> value) {
        return members.stream().map(value).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
