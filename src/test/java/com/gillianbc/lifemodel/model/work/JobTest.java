package com.gillianbc.lifemodel.model.work;

import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.account.BankAccount;
import com.gillianbc.lifemodel.model.account.Job401kAccount;
import com.gillianbc.lifemodel.model.people.Family;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.model.people.Spending;
import com.gillianbc.lifemodel.simulation.LifeModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.gillianbc.lifemodel.MoneyAssertions.assertMoney;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobTest {

    private static final BigDecimal ZERO = BigDecimal.ZERO;

    @Test
    @DisplayName("Pay is split into 401k contributions, take-home pay and taxable income")
    void preStep_withPlan_postsPayAndContributions() {
        Person owner = person(40);
        BankAccount bank = new BankAccount(owner, "Chase", ZERO);
        Job job = new Job(owner, "Acme", "Engineer",
                new Salary(new BigDecimal("100000"), new BigDecimal("2"), new BigDecimal("10")));
        Job401kAccount plan = plan(job, "10", "5", "50");

        job.preStep();

        assertMoney("17500", plan.getPretaxBalance());
        assertMoney("5000", plan.getRothBalance());
        assertMoney("95000", bank.getBalance());
        assertMoney("100000", owner.getTaxableIncome());
        assertMoney("110000", job.getStat(Stat.GROSS_INCOME));
        assertMoney("15000", job.getStat(Stat.RETIREMENT_CONTRIB));
        assertMoney("7500", job.getStat(Stat.RETIREMENT_MATCH));
    }

    @Test
    @DisplayName("Pre-tax contribution fills the yearly limit first and Roth gets the rest")
    void preStep_highEarner_contributionsCappedByLimit() {
        Person owner = person(40);
        new BankAccount(owner, "Chase", ZERO);
        Job job = new Job(owner, "Acme", "Director", new Salary(new BigDecimal("300000"), ZERO, ZERO));
        Job401kAccount plan = plan(job, "10", "5", "0");

        job.preStep();

        assertMoney("20500", plan.getPretaxBalance());
        assertMoney("0", plan.getRothBalance());
        assertMoney("279500", owner.getTaxableIncome());
    }

    @Test
    @DisplayName("Catch-up raises the limit from age 50")
    void preStep_fifty_limitIncludesCatchUp() {
        Person owner = person(50);
        new BankAccount(owner, "Chase", ZERO);
        Job job = new Job(owner, "Acme", "Director", new Salary(new BigDecimal("300000"), ZERO, ZERO));
        Job401kAccount plan = plan(job, "10", "5", "0");

        job.preStep();

        assertMoney("27000", plan.getPretaxBalance());
    }

    @Test
    @DisplayName("Without a 401k all pay is taxable and goes to the bank")
    void preStep_noPlan_allPayToBank() {
        Person owner = person(30);
        BankAccount bank = new BankAccount(owner, "Chase", ZERO);
        Job job = new Job(owner, "Acme", "Analyst", new Salary(new BigDecimal("50000"), ZERO, new BigDecimal("4")));

        job.preStep();

        assertMoney("52000", bank.getBalance());
        assertMoney("52000", owner.getTaxableIncome());
        assertMoney("2000", job.getSalary().getBonus());
    }

    @Test
    @DisplayName("Salary rises after each working year")
    void postStep_raisesSalary() {
        Job job = new Job(person(30), "Acme", "Analyst", new Salary(new BigDecimal("50000"), new BigDecimal("3"), ZERO));
        job.postStep();
        assertMoney("51500", job.getSalary().getBase());
    }

    @Test
    @DisplayName("Retiring orphans the 401k, stops pay and happens only once")
    void retire_orphansPlanAndStopsPay() {
        Person owner = person(64);
        BankAccount bank = new BankAccount(owner, "Chase", ZERO);
        Job job = new Job(owner, "Acme", "Engineer", new Salary(new BigDecimal("80000"), new BigDecimal("3"), ZERO));
        Job401kAccount plan = plan(job, "0", "0", "0");

        job.retire();
        job.retire();
        job.preStep();
        job.postStep();

        assertTrue(job.isRetired());
        assertFalse(job.getRetirementAccount().isPresent());
        assertFalse(plan.getJob().isPresent());
        assertTrue(owner.getRetirementAccounts().contains(plan));
        assertMoney("0", bank.getBalance());
        assertMoney("80000", job.getSalary().getBase());
        assertEquals(1, owner.getModel().getEventLog().size());
        assertEquals("Alice retired from Acme", owner.getModel().getEventLog().getEvents().get(0).getMessage());
    }

    @Test
    @DisplayName("Jobs end in the year the person reaches their retirement age")
    void modelStep_retirementAgeReached_retiresJobs() {
        LifeModel model = new LifeModel(2024, 2025);
        Person owner = new Person(new Family(model), "Alice", 63, 65, new Spending(ZERO));
        new BankAccount(owner, "Chase", new BigDecimal("100000"));
        Job job = new Job(owner, "Acme", "Engineer", new Salary(new BigDecimal("10000"), ZERO, ZERO));

        model.step();
        assertFalse(job.isRetired());
        model.step();
        assertTrue(job.isRetired());
        assertTrue(owner.isRetired());
    }

    private static Person person(int age) {
        return new Person(new Family(new LifeModel(2024, 2060)), "Alice", age, 65, new Spending(ZERO));
    }

    private static Job401kAccount plan(Job job, String pretaxPercent, String rothPercent, String matchPercent) {
        return new Job401kAccount(job, ZERO, new BigDecimal(pretaxPercent), ZERO, new BigDecimal(rothPercent),
                ZERO, new BigDecimal(matchPercent));
    }
}
