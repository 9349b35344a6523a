package com.gillianbc.lifemodel.model.people;

import com.gillianbc.lifemodel.model.FilingStatus;
import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.TaxesDue;
import com.gillianbc.lifemodel.model.account.BankAccount;
import com.gillianbc.lifemodel.model.account.BrokerageAccount;
import com.gillianbc.lifemodel.model.account.HealthSavingsAccount;
import com.gillianbc.lifemodel.model.account.Plan529;
import com.gillianbc.lifemodel.model.account.RetirementAccount;
import com.gillianbc.lifemodel.model.benefit.Annuity;
import com.gillianbc.lifemodel.model.benefit.Insurance;
import com.gillianbc.lifemodel.model.benefit.Pension;
import com.gillianbc.lifemodel.model.benefit.SocialSecurity;
import com.gillianbc.lifemodel.model.benefit.TermLifeInsurance;
import com.gillianbc.lifemodel.model.charity.Donation;
import com.gillianbc.lifemodel.model.charity.DonorAdvisedFund;
import com.gillianbc.lifemodel.model.debt.Loan;
import com.gillianbc.lifemodel.model.housing.Apartment;
import com.gillianbc.lifemodel.model.housing.Home;
import com.gillianbc.lifemodel.model.work.Job;
import com.gillianbc.lifemodel.service.SettlementResult;
import com.gillianbc.lifemodel.simulation.LifeModelAgent;
import com.gillianbc.lifemodel.simulation.ModelSetupException;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A simulated person.
 * <p>
 * Everything the person owns is found through the model's registries. Each year:
 * <ul>
 *     <li>pre-step: age advances and the year's obligations are worked out (spending, housing, rent, loans, gifts)</li>
 *     <li>step: jobs end at the retirement age and a single filer settles the year</li>
 *     <li>post-step: taxable income and the early-withdrawal amount are reset</li>
 * </ul>
 * Taxable income only ever holds the current year's income.
 */
@Getter
public class Person extends LifeModelAgent implements TaxableEntity {

    private final Family family;
    private final String name;
    private int age;
    private final int retirementAge;
    private final Spending spending;
    private FilingStatus filingStatus = FilingStatus.SINGLE;
    private Person spouse;
    private BigDecimal taxableIncome = BigDecimal.ZERO;
    private BigDecimal earlyWithdrawalAmount = BigDecimal.ZERO;
    private BigDecimal debt = BigDecimal.ZERO;
    private BigDecimal yearlyObligations = BigDecimal.ZERO;
    private BigDecimal discretionarySpending = BigDecimal.ZERO;
    private SettlementResult lastSettlement;

    public Person(Family family, String name, int age, int retirementAge, Spending spending) {
        super(Objects.requireNonNull(family, "family must not be null").getModel());
        this.family = family;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.spending = Objects.requireNonNull(spending, "spending must not be null");
        if (age < 0) {
            throw new IllegalArgumentException("age must be >= 0");
        }
        this.age = age;
        this.retirementAge = retirementAge;
        family.addMember(this);
    }

    public Optional<Person> getSpouse() {
        return Optional.ofNullable(spouse);
    }

    public Optional<SettlementResult> getLastSettlement() {
        return Optional.ofNullable(lastSettlement);
    }

    public List<BankAccount> getBankAccounts() {
        return getModel().getRegistries().getBankAccounts().getItems(this);
    }

    public List<Job> getJobs() {
        return getModel().getRegistries().getJobs().getItems(this);
    }

    public List<RetirementAccount> getRetirementAccounts() {
        return getModel().getRegistries().getRetirementAccounts().getItems(this);
    }

    public List<BrokerageAccount> getInvestments() {
        return getModel().getRegistries().getInvestments().getItems(this);
    }

    public List<Home> getHomes() {
        return getModel().getRegistries().getHomes().getItems(this);
    }

    public List<Apartment> getApartments() {
        return getModel().getRegistries().getApartments().getItems(this);
    }

    public List<Loan> getLoans() {
        return getModel().getRegistries().getLoans().getItems(this);
    }

    public List<Insurance> getInsurancePolicies() {
        return getModel().getRegistries().getInsurancePolicies().getItems(this);
    }

    public List<Pension> getPensions() {
        return getModel().getRegistries().getPensions().getItems(this);
    }

    public Optional<SocialSecurity> getSocialSecurity() {
        return getModel().getRegistries().getSocialSecurity().getItems(this).stream().findFirst();
    }

    public List<Annuity> getAnnuities() {
        return getModel().getRegistries().getAnnuities().getItems(this);
    }

    public List<TermLifeInsurance> getLifeInsurancePolicies() {
        return getModel().getRegistries().getLifeInsurancePolicies().getItems(this);
    }

    public List<HealthSavingsAccount> getHealthSavingsAccounts() {
        return getModel().getRegistries().getHealthSavingsAccounts().getItems(this);
    }

    public List<Plan529> getPlan529s() {
        return getModel().getRegistries().getPlan529s().getItems(this);
    }

    public List<Donation> getDonations() {
        return getModel().getRegistries().getDonations().getItems(this);
    }

    public List<DonorAdvisedFund> getDonorAdvisedFunds() {
        return getModel().getRegistries().getDonorAdvisedFunds().getItems(this);
    }

    public boolean isRetired() {
        return age >= retirementAge;
    }

    public int getYearAtAge(int targetAge) {
        return getModel().yearAtAge(age, targetAge);
    }

    @Override
    public BigDecimal getBankAccountBalance() {
        return getBankAccounts().stream().map(BankAccount::getBalance).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * @return the greater of the standard and itemized deductions, plus this year's HSA contributions
     */
    @Override
    public BigDecimal getFederalDeductions() {
        BigDecimal standard = getModel().getTaxCalculator().standardDeduction(filingStatus);
        return Money.max(standard, getItemizedDeductions()).add(getAboveTheLineDeductions());
    }

    /**
     * @return this year's mortgage interest plus deductible gifts and donor-advised fund contributions
     */
    public BigDecimal getItemizedDeductions() {
        BigDecimal mortgageInterest = getHomes().stream()
                .map(home -> home.getMortgage().getInterestForYear())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal gifts = getDonations().stream()
                .map(Donation::getDeductibleThisYear)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal fundContributions = getDonorAdvisedFunds().stream()
                .map(DonorAdvisedFund::getDeductibleThisYear)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return mortgageInterest.add(gifts).add(fundContributions);
    }

    /**
     * @return deductions taken whether or not the filer itemizes
     */
    public BigDecimal getAboveTheLineDeductions() {
        return getHealthSavingsAccounts().stream()
                .map(HealthSavingsAccount::getDeductibleContributionsThisYear)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public void addTaxableIncome(BigDecimal amount) {
        taxableIncome = taxableIncome.add(amount);
    }

    public void addEarlyWithdrawalAmount(BigDecimal amount) {
        earlyWithdrawalAmount = earlyWithdrawalAmount.add(amount);
    }

    @Override
    public void addDebt(BigDecimal amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("debt increase must be >= 0");
        }
        debt = debt.add(amount);
    }

    void setDebt(BigDecimal debt) {
        this.debt = debt;
    }

    @Override
    public void payDownDebt() {
        if (Money.isPositive(debt)) {
            debt = payBills(debt);
        }
    }

    /**
     * Deposits into the first bank account.
     *
     * @throws ModelSetupException if the person owns no bank account
     */
    public void depositIntoBankAccount(BigDecimal amount) {
        List<BankAccount> accounts = getBankAccounts();
        if (accounts.isEmpty()) {
            throw new ModelSetupException("No bank account for " + name + ". Create a bank account before making deposits.");
        }
        if (!accounts.get(0).deposit(amount)) {
            throw new IllegalArgumentException("Cannot deposit a negative amount: " + amount);
        }
    }

    /**
     * Takes money from bank accounts in registration order.
     *
     * @return amount that could not be deducted
     */
    public BigDecimal deductFromBankAccounts(BigDecimal amount) {
        BigDecimal remaining = amount;
        for (BankAccount account : getBankAccounts()) {
            if (remaining.signum() <= 0) {
                break;
            }
            remaining = remaining.subtract(account.withdraw(remaining));
        }
        return Money.nonNegative(remaining);
    }

    /**
     * Pays {@code amount} from bank accounts only if all of it can be paid. A partial payment is
     * put back into the first bank account.
     *
     * @return whether the amount was paid
     */
    public boolean payFromBankInFull(BigDecimal amount) {
        BigDecimal unpaid = deductFromBankAccounts(amount);
        if (unpaid.signum() > 0) {
            BigDecimal paid = amount.subtract(unpaid);
            if (Money.isPositive(paid)) {
                depositIntoBankAccount(paid);
            }
            return false;
        }
        return true;
    }

    /**
     * Takes money from Roth balances in registration order.
     *
     * @return amount that could not be deducted
     */
    public BigDecimal deductFromRoth(BigDecimal amount) {
        BigDecimal remaining = amount;
        for (RetirementAccount account : getRetirementAccounts()) {
            if (remaining.signum() <= 0) {
                break;
            }
            remaining = remaining.subtract(account.deductRoth(remaining));
        }
        return Money.nonNegative(remaining);
    }

    /**
     * Liquidates pre-tax retirement money into the first bank account. The amount withdrawn is taxable
     * income. Settlement sizes this withdrawal without a penalty, so none is charged on it at any age.
     *
     * @return amount actually withdrawn
     */
    @Override
    public BigDecimal withdrawFromPretaxRetirement(BigDecimal amount) {
        if (amount.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal remaining = amount;
        for (RetirementAccount account : getRetirementAccounts()) {
            if (remaining.signum() <= 0) {
                break;
            }
            remaining = remaining.subtract(account.deductPretax(remaining));
        }
        BigDecimal withdrawn = amount.subtract(remaining);
        if (Money.isPositive(withdrawn)) {
            addTaxableIncome(withdrawn);
            depositIntoBankAccount(withdrawn);
        }
        return withdrawn;
    }

    @Override
    public BigDecimal payBills(BigDecimal amount) {
        return getModel().getPaymentService().payBills(this, amount);
    }

    /**
     * Marries {@code other}: both become joint filers and the family settles for them.
     */
    public void getMarried(Person other) {
        Objects.requireNonNull(other, "spouse must not be null");
        if (other == this) {
            throw new IllegalArgumentException(name + " cannot marry themselves");
        }
        link(other);
        other.link(this);
        getModel().logEvent(name + " and " + other.getName() + " got married at age " + age + " and " + other.getAge());
    }

    private void link(Person other) {
        spouse = other;
        filingStatus = FilingStatus.MARRIED_FILING_JOINTLY;
    }

    /**
     * Settles the year as a single filer.
     *
     * @throws UnsupportedOperationException for any other filing status
     */
    public SettlementResult settle() {
        if (filingStatus != FilingStatus.SINGLE) {
            throw new UnsupportedOperationException("Individual settlement requires "
                    + FilingStatus.SINGLE + " but was " + filingStatus);
        }
        lastSettlement = getModel().getSettlementService().settle(this, yearlyObligations);
        return lastSettlement;
    }

    @Override
    public void preStep() {
        age++;
        discretionarySpending = spending.consumeYearlySpending();
        BigDecimal housing = getHomes().stream().map(Home::makeYearlyPayment).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal rent = getApartments().stream().map(Apartment::chargeYearlyRent).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal loanPayments = getLoans().stream().map(Loan::makeYearlyPayment).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal gifts = getDonations().stream().map(Donation::makeYearlyGift).reduce(BigDecimal.ZERO, BigDecimal::add);
        yearlyObligations = discretionarySpending.add(housing).add(rent).add(loanPayments).add(gifts);
    }

    @Override
    public void step() {
        if (age == retirementAge) {
            getJobs().forEach(Job::retire);
        }

        TaxesDue taxes = TaxesDue.NONE;
        if (filingStatus == FilingStatus.SINGLE) {
            taxes = settle().getTaxesDue();
        }

        if (age == getModel().getRetirementRules().federalRetirementAge().intValue()) {
            getModel().logEvent(name + " reached retirement age (age "
                    + getModel().getRetirementRules().federalRetirementAge().stripTrailingZeros().toPlainString() + ")");
        }

        recordStat(Stat.MONEY_SPENT, discretionarySpending);
        recordStat(Stat.TAXES_PAID, taxes.total());
        recordStat(Stat.TAXES_PAID_FEDERAL, taxes.getFederal());
        recordStat(Stat.TAXES_PAID_STATE, taxes.getState());
        recordStat(Stat.TAXES_PAID_SS, taxes.getSocialSecurity());
        recordStat(Stat.TAXES_PAID_MEDICARE, taxes.getMedicare());
    }

    @Override
    public void postStep() {
        taxableIncome = BigDecimal.ZERO;
        earlyWithdrawalAmount = BigDecimal.ZERO;
        spending.advanceYear();
        recordStat(Stat.DEBT, debt);
    }
}
