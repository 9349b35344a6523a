package com.gillianbc.lifemodel.model.people;

import com.gillianbc.lifemodel.model.FilingStatus;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.account.BankAccount;
import com.gillianbc.lifemodel.model.account.HealthSavingsAccount;
import com.gillianbc.lifemodel.model.account.HsaType;
import com.gillianbc.lifemodel.model.account.Job401kAccount;
import com.gillianbc.lifemodel.model.account.RothIra;
import com.gillianbc.lifemodel.model.charity.Donation;
import com.gillianbc.lifemodel.model.charity.DonationType;
import com.gillianbc.lifemodel.model.work.Job;
import com.gillianbc.lifemodel.model.work.Salary;
import com.gillianbc.lifemodel.simulation.LifeModel;
import com.gillianbc.lifemodel.simulation.ModelSetupException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.gillianbc.lifemodel.MoneyAssertions.assertMoney;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PersonTest {

    private static final BigDecimal ZERO = BigDecimal.ZERO;

    private LifeModel model;
    private Family family;

    @BeforeEach
    void setUp() {
        model = new LifeModel(2024, 2060);
        family = new Family(model);
    }

    @Test
    @DisplayName("Depositing without a bank account throws ModelSetupException")
    void depositIntoBankAccount_noAccount_throws() {
        Person alice = new Person(family, "Alice", 30, 65, new Spending(ZERO));

        ModelSetupException e = assertThrows(ModelSetupException.class,
                () -> alice.depositIntoBankAccount(BigDecimal.TEN));
        assertTrue(e.getMessage().contains("Alice"));
    }

    @Test
    @DisplayName("Negative deposit throws IllegalArgumentException")
    void depositIntoBankAccount_negative_throws() {
        Person alice = new Person(family, "Alice", 30, 65, new Spending(ZERO));
        new BankAccount(alice, "Chase", ZERO);
        assertThrows(IllegalArgumentException.class, () -> alice.depositIntoBankAccount(new BigDecimal("-1")));
    }

    @Test
    @DisplayName("Deposits go to the first bank account; deductions drain accounts in order")
    void bankAccounts_usedInRegistrationOrder() {
        Person alice = new Person(family, "Alice", 30, 65, new Spending(ZERO));
        BankAccount checking = new BankAccount(alice, "Chase", new BigDecimal("100"));
        BankAccount savings = new BankAccount(alice, "Ally", new BigDecimal("200"));

        alice.depositIntoBankAccount(new BigDecimal("50"));
        assertMoney("150", checking.getBalance());

        assertMoney("50", alice.deductFromBankAccounts(new BigDecimal("400")));
        assertMoney("0", checking.getBalance());
        assertMoney("0", savings.getBalance());
    }

    @Test
    @DisplayName("Bills are paid from the bank and then from Roth money, never pre-tax money")
    void payBills_bankThenRoth() {
        Person alice = new Person(family, "Alice", 40, 65, new Spending(ZERO));
        new BankAccount(alice, "Chase", new BigDecimal("100"));
        Job job = new Job(alice, "Acme", "Engineer", new Salary(ZERO, ZERO, ZERO));
        Job401kAccount plan = new Job401kAccount(job, new BigDecimal("1000"), ZERO, new BigDecimal("300"), ZERO,
                ZERO, ZERO);
        RothIra roth = new RothIra(alice, new BigDecimal("200"), ZERO, ZERO);

        assertMoney("100", alice.payBills(new BigDecimal("700")));

        assertMoney("0", plan.getRothBalance());
        assertMoney("0", roth.getBalance());
        assertMoney("1000", plan.getPretaxBalance());
    }

    @Test
    @DisplayName("Pre-tax withdrawals are income but never count towards the early-withdrawal penalty")
    void withdrawFromPretaxRetirement_early_incomeWithoutPenaltyBase() {
        Person alice = new Person(family, "Alice", 40, 65, new Spending(ZERO));
        BankAccount bank = new BankAccount(alice, "Chase", ZERO);
        Job job = new Job(alice, "Acme", "Engineer", new Salary(ZERO, ZERO, ZERO));
        new Job401kAccount(job, new BigDecimal("1000"), ZERO, ZERO, ZERO, ZERO, ZERO);

        assertMoney("1000", alice.withdrawFromPretaxRetirement(new BigDecimal("1500")));

        assertMoney("1000", bank.getBalance());
        assertMoney("1000", alice.getTaxableIncome());
        assertMoney("0", alice.getEarlyWithdrawalAmount());
        assertMoney("0", alice.withdrawFromPretaxRetirement(new BigDecimal("-5")));
    }

    @Test
    @DisplayName("Marriage links both spouses as joint filers and is logged")
    void getMarried_linksSpousesAndLogs() {
        Person alice = new Person(family, "Alice", 30, 65, new Spending(ZERO));
        Person bob = new Person(family, "Bob", 32, 65, new Spending(ZERO));

        alice.getMarried(bob);

        assertSame(bob, alice.getSpouse().orElseThrow());
        assertSame(alice, bob.getSpouse().orElseThrow());
        assertEquals(FilingStatus.MARRIED_FILING_JOINTLY, alice.getFilingStatus());
        assertEquals(FilingStatus.MARRIED_FILING_JOINTLY, bob.getFilingStatus());
        assertEquals("Alice and Bob got married at age 30 and 32",
                model.getEventLog().getEvents().get(0).getMessage());
    }

    @Test
    @DisplayName("Marrying yourself throws IllegalArgumentException")
    void getMarried_self_throws() {
        Person alice = new Person(family, "Alice", 30, 65, new Spending(ZERO));
        assertThrows(IllegalArgumentException.class, () -> alice.getMarried(alice));
        assertFalse(alice.getSpouse().isPresent());
    }

    @Test
    @DisplayName("Age advances each year and income is reset after settlement")
    void modelStep_agesAndResetsIncome() {
        Person alice = new Person(family, "Alice", 30, 65, new Spending(new BigDecimal("1000")));
        new BankAccount(alice, "Chase", new BigDecimal("50000"));
        new Job(alice, "Acme", "Engineer", new Salary(new BigDecimal("40000"), ZERO, ZERO));

        model.step();

        assertEquals(31, alice.getAge());
        assertMoney("0", alice.getTaxableIncome());
        assertMoney("1000", alice.getStat(Stat.MONEY_SPENT));
        assertTrue(alice.getStat(Stat.TAXES_PAID).signum() > 0);
        assertEquals(2054, alice.getYearAtAge(60));
    }

    @Test
    @DisplayName("Reaching the federal retirement age is logged")
    void modelStep_federalRetirementAge_logged() {
        Person alice = new Person(family, "Alice", 58, 70, new Spending(ZERO));
        new BankAccount(alice, "Chase", ZERO);

        model.step();

        assertEquals("Alice reached retirement age (age 59.5)", model.getEventLog().getEvents().get(0).getMessage());
    }

    @Test
    @DisplayName("Existing debt is paid down when money is available")
    void modelStep_debtPaidDown() {
        Person alice = new Person(family, "Alice", 30, 65, new Spending(ZERO));
        BankAccount bank = new BankAccount(alice, "Chase", new BigDecimal("5000"));
        alice.addDebt(new BigDecimal("2000"));

        model.step();

        assertMoney("0", alice.getDebt());
        assertMoney("3000", bank.getBalance());
        assertThrows(IllegalArgumentException.class, () -> alice.addDebt(new BigDecimal("-1")));
    }

    @Test
    @DisplayName("Paying in full refunds a partial payment")
    void payFromBankInFull_shortOfMoney_refunds() {
        Person alice = new Person(family, "Alice", 30, 65, new Spending(ZERO));
        BankAccount bank = new BankAccount(alice, "Chase", new BigDecimal("300"));

        assertFalse(alice.payFromBankInFull(new BigDecimal("500")));
        assertMoney("300", bank.getBalance());

        assertTrue(alice.payFromBankInFull(new BigDecimal("200")));
        assertMoney("100", bank.getBalance());
    }

    @Test
    @DisplayName("Itemized gifts replace the standard deduction and HSA contributions are deducted on top")
    void modelStep_itemizedAndHsaDeductions_lowerFederalTax() {
        Person alice = new Person(family, "Alice", 30, 65, new Spending(ZERO));
        new BankAccount(alice, "Chase", new BigDecimal("50000"));
        new Job(alice, "Acme", "Engineer", new Salary(new BigDecimal("100000"), ZERO, ZERO));
        new HealthSavingsAccount(alice, HsaType.INDIVIDUAL, ZERO, new BigDecimal("2000"), ZERO);
        new Donation(alice, "Red Cross", new BigDecimal("20000"), DonationType.CASH, true);

        model.step();

        BigDecimal expectedFederal = model.getTaxCalculator()
                .computeTaxesDue(new BigDecimal("100000"), new BigDecimal("22000"), FilingStatus.SINGLE)
                .getFederal();
        assertMoney(expectedFederal, alice.getStat(Stat.TAXES_PAID_FEDERAL));
        assertMoney("20000", alice.getLastSettlement().orElseThrow().getObligations());
    }
}
