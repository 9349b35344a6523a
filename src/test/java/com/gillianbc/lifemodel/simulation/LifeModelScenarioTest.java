package com.gillianbc.lifemodel.simulation;

import com.gillianbc.lifemodel.config.FinancialConfig;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.YearlyStats;
import com.gillianbc.lifemodel.model.account.BankAccount;
import com.gillianbc.lifemodel.model.account.BrokerageAccount;
import com.gillianbc.lifemodel.model.account.Job401kAccount;
import com.gillianbc.lifemodel.model.account.RothIra;
import com.gillianbc.lifemodel.model.account.TraditionalIra;
import com.gillianbc.lifemodel.model.benefit.Insurance;
import com.gillianbc.lifemodel.model.benefit.InsuranceType;
import com.gillianbc.lifemodel.model.benefit.Pension;
import com.gillianbc.lifemodel.model.debt.CarLoan;
import com.gillianbc.lifemodel.model.housing.Home;
import com.gillianbc.lifemodel.model.housing.HomeExpenses;
import com.gillianbc.lifemodel.model.housing.Mortgage;
import com.gillianbc.lifemodel.model.people.Family;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.model.people.Spending;
import com.gillianbc.lifemodel.model.work.Job;
import com.gillianbc.lifemodel.model.work.Salary;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Whole-life runs covering every kind of entity together.
 */
@Slf4j
class LifeModelScenarioTest {

    private static final int START = 2024;
    private static final int END = 2070;

    @Test
    @DisplayName("Two identical runs produce identical yearly statistics and events")
    void run_twice_isDeterministic() {
        LifeModel first = buildCouple(FinancialConfig.defaults());
        LifeModel second = buildCouple(FinancialConfig.defaults());

        first.run();
        second.run();

        assertEquals(first.getYearlyStats(), second.getYearlyStats());
        assertEquals(first.getEventLog().getEvents(), second.getEventLog().getEvents());
        assertEquals(first.currentStats().getValues(), second.currentStats().getValues());
    }

    @Test
    @DisplayName("A whole life keeps every balance non-negative and narrates its milestones")
    void run_wholeLife_balancesNeverNegative() {
        LifeModel model = buildCouple(FinancialConfig.defaults());

        model.run();

        List<YearlyStats> stats = model.getYearlyStats();
        assertEquals(END - START + 1, stats.size());
        for (YearlyStats year : stats) {
            for (Stat stat : Stat.values()) {
                assertTrue(year.get(stat).signum() >= 0, () -> stat + " negative in " + year.getYear());
            }
        }
        for (BankAccount account : model.getRegistries().getBankAccounts().getAllItems()) {
            assertTrue(account.getBalance().signum() >= 0);
        }

        List<String> messages = model.getEventLog().getEvents().stream().map(Event::getMessage).toList();
        messages.forEach(message -> log.info(message));
        assertTrue(messages.stream().anyMatch(m -> m.contains("got married")));
        assertTrue(messages.stream().anyMatch(m -> m.contains("retired from Acme")));
        assertTrue(messages.stream().anyMatch(m -> m.contains("first required minimum distribution")));
        assertTrue(messages.stream().anyMatch(m -> m.contains("started receiving a pension")));
    }

    @Test
    @DisplayName("A different scenario changes the outcome")
    void run_recessionScenario_changesOutcome() {
        LifeModel normal = buildCouple(FinancialConfig.defaults());
        LifeModel recession = buildCouple(FinancialConfig.defaults().withScenario("recession"));

        normal.run();
        recession.run();

        assertFalse(normal.getYearlyStats().equals(recession.getYearlyStats()));
    }

    private static LifeModel buildCouple(FinancialConfig config) {
        LifeModel model = new LifeModel(START, END, config);
        Family family = new Family(model);

        Person alice = new Person(family, "Alice", 35, 62, new Spending(new BigDecimal("40000"), new BigDecimal("2")));
        new BankAccount(alice, "Chase", new BigDecimal("25000"));
        Job acme = new Job(alice, "Acme", "Engineer",
                new Salary(new BigDecimal("120000"), new BigDecimal("3"), new BigDecimal("5")));
        new Job401kAccount(acme, new BigDecimal("80000"), new BigDecimal("8"), new BigDecimal("10000"),
                new BigDecimal("4"), new BigDecimal("6"), new BigDecimal("50"));
        new RothIra(alice, new BigDecimal("15000"), new BigDecimal("6500"));
        new Insurance(alice, InsuranceType.HEALTH, "Aetna", new BigDecimal("3000"), new BigDecimal("50000"),
                new BigDecimal("2000"));
        Mortgage mortgage = new Mortgage(alice, new BigDecimal("320000"), 30, new BigDecimal("6.5"));
        new Home(alice, "Maple St", new BigDecimal("400000"), new BigDecimal("3"), new BigDecimal("80000"), mortgage,
                new HomeExpenses(new BigDecimal("1.1"), new BigDecimal("0.4"), new BigDecimal("2000"),
                        new BigDecimal("3"), BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO));

        Person bob = new Person(family, "Bob", 37, 65, new Spending(new BigDecimal("20000"), new BigDecimal("2")));
        new BankAccount(bob, "Ally", new BigDecimal("10000"));
        new Job(bob, "Globex", "Analyst", new Salary(new BigDecimal("60000"), new BigDecimal("2"), BigDecimal.ZERO));
        new TraditionalIra(bob, new BigDecimal("40000"), new BigDecimal("3000"));
        new BrokerageAccount(bob, "Vanguard", new BigDecimal("20000"));
        new Pension(bob, "Globex", 10, 4, new BigDecimal("18000"), 65);
        new CarLoan(bob, "Outback", new BigDecimal("30000"), 5, new BigDecimal("5.9"));

        LifeEvents events = new LifeEvents(model);
        events.add(2026, "wedding", () -> alice.getMarried(bob))
                .add(2030, "kitchen remodel", () -> alice.getSpending().addExpense(new BigDecimal("35000")));
        return model;
    }
}
