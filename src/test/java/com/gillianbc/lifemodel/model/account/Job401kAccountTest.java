package com.gillianbc.lifemodel.model.account;

import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.people.Family;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.model.people.Spending;
import com.gillianbc.lifemodel.model.work.Job;
import com.gillianbc.lifemodel.model.work.Salary;
import com.gillianbc.lifemodel.simulation.LifeModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.gillianbc.lifemodel.MoneyAssertions.assertMoney;
import static com.gillianbc.lifemodel.MoneyAssertions.assertMoneyClose;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Job401kAccountTest {

    private static final BigDecimal ZERO = BigDecimal.ZERO;

    @Test
    @DisplayName("Contributions and the match always land in the right balances")
    void contribute_matchGoesToPretax() {
        Job401kAccount account = account(person(40), "1000", "500", "0");

        account.contribute(new BigDecimal("100"), new BigDecimal("50"), new BigDecimal("75"));

        assertMoney("1175", account.getPretaxBalance());
        assertMoney("550", account.getRothBalance());
        assertMoney("1725", account.getTotalBalance());
    }

    @Test
    @DisplayName("Both balances grow continuously in the pre-step phase")
    void preStep_growsBothBalances() {
        Job401kAccount account = account(person(40), "1000", "1000", "5");

        account.preStep();

        assertMoneyClose("1051.271096376024", account.getPretaxBalance(), "0.000001");
        assertMoneyClose("1051.271096376024", account.getRothBalance(), "0.000001");
    }

    @Test
    @DisplayName("Pre-tax deduction is clamped and leaves Roth money alone")
    void deductPretax_clampsToPretaxBalance() {
        Job401kAccount account = account(person(40), "300", "700", "0");

        assertMoney("300", account.deductPretax(new BigDecimal("1000")));
        assertMoney("0", account.getPretaxBalance());
        assertMoney("700", account.getRothBalance());
        assertMoney("200", account.deductRoth(new BigDecimal("200")));
        assertMoney("500", account.getRothBalance());
    }

    @Test
    @DisplayName("No minimum distribution before the RMD start age")
    void preStep_beforeRmdAge_noDistribution() {
        Person owner = person(70);
        new BankAccount(owner, "Chase", ZERO);
        Job401kAccount account = account(owner, "100000", "0", "0");

        account.preStep();

        assertMoney("100000", account.getPretaxBalance());
        assertMoney("0", owner.getTaxableIncome());
    }

    @Test
    @DisplayName("From the RMD start age the distribution is forced into the bank as income")
    void preStep_atRmdAge_forcesDistribution() {
        Person owner = person(72);
        BankAccount bank = new BankAccount(owner, "Chase", ZERO);
        Job401kAccount account = account(owner, "256000", "0", "0");

        account.preStep();

        assertMoney("10000", bank.getBalance());
        assertMoney("10000", owner.getTaxableIncome());
        assertMoney("246000", account.getPretaxBalance());
        assertMoney("10000", account.getStat(Stat.REQUIRED_MIN_DISTRIB));
        assertTrue(owner.getModel().getEventLog().getEvents().get(0).getMessage()
                .contains("first required minimum distribution of $10000.00 from a 401k"));
    }

    @Test
    @DisplayName("The owner ages first in the same pre-step, so the first distribution comes in the year they turn 72")
    void step_ownerTurnsRmdAge_distributesSameYear() {
        Person owner = person(71);
        BankAccount bank = new BankAccount(owner, "Chase", ZERO);
        Job401kAccount account = account(owner, "256000", "0", "0");

        owner.getModel().step();

        assertEquals(72, owner.getAge());
        assertMoney("10000", account.getStat(Stat.REQUIRED_MIN_DISTRIB));
        assertMoney("246000", account.getPretaxBalance());
        // FICA on the distribution; it stays under the standard deduction
        assertMoney("9235", bank.getBalance());
    }

    @Test
    @DisplayName("Usable balance is only reported from the federal retirement age")
    void postStep_usableOnlyAfterRetirementAge() {
        Job401kAccount young = account(person(40), "100", "0", "0");
        Job401kAccount old = account(person(60), "100", "0", "0");

        young.postStep();
        old.postStep();

        assertMoney("100", young.getStat(Stat.RETIREMENT_BALANCE));
        assertMoney("0", young.getStat(Stat.USABLE_BALANCE));
        assertMoney("100", old.getStat(Stat.USABLE_BALANCE));
        assertFalse(young.isUsable(40));
    }

    @Test
    @DisplayName("Linked to its job and registered as the owner's retirement account")
    void constructor_linksJobAndRegisters() {
        Person owner = person(40);
        Job job = new Job(owner, "Acme", "Engineer", new Salary(ZERO, ZERO, ZERO));
        Job401kAccount account = new Job401kAccount(job, ZERO, ZERO, ZERO, ZERO, ZERO, ZERO);

        assertEquals(account, job.getRetirementAccount().orElseThrow());
        assertEquals(job, account.getJob().orElseThrow());
        assertEquals(List.of(account), owner.getRetirementAccounts());
    }

    @Test
    @DisplayName("Negative percentages or balances throw IllegalArgumentException")
    void constructor_negativeValues_throw() {
        Person owner = person(40);
        Job job = new Job(owner, "Acme", "Engineer", new Salary(ZERO, ZERO, ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new Job401kAccount(job, new BigDecimal("-1"), ZERO, ZERO, ZERO, ZERO, ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new Job401kAccount(job, ZERO, ZERO, ZERO, ZERO, ZERO, new BigDecimal("-5")));
    }

    private static Person person(int age) {
        return new Person(new Family(new LifeModel(2024, 2060)), "Alice", age, 80, new Spending(ZERO));
    }

    private static Job401kAccount account(Person owner, String pretax, String roth, String growth) {
        Job job = new Job(owner, "Acme", "Engineer", new Salary(ZERO, ZERO, ZERO));
        return new Job401kAccount(job, new BigDecimal(pretax), ZERO, new BigDecimal(roth), ZERO,
                new BigDecimal(growth), ZERO);
    }
}
