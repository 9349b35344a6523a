package com.gillianbc.lifemodel.model.housing;

import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.account.BankAccount;
import com.gillianbc.lifemodel.model.people.Family;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.model.people.Spending;
import com.gillianbc.lifemodel.simulation.LifeModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.gillianbc.lifemodel.MoneyAssertions.assertMoney;
import static com.gillianbc.lifemodel.MoneyAssertions.assertMoneyClose;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HomeTest {

    private static final BigDecimal ZERO = BigDecimal.ZERO;

    @Test
    @DisplayName("Thirty-year mortgage at 6% has the textbook monthly payment")
    void mortgage_thirtyYears_monthlyPayment() {
        Mortgage mortgage = new Mortgage(person(new LifeModel(2024, 2030)), new BigDecimal("200000"), 30,
                new BigDecimal("6"));

        assertMoneyClose("1199.10", mortgage.getMonthlyPayment(), "0.01");
        assertEquals(2024, mortgage.getStartYear());
    }

    @Test
    @DisplayName("Running costs follow the home value plus fixed amounts")
    void homeExpenses_yearlySpending() {
        HomeExpenses expenses = expenses();

        assertMoney("6700", expenses.getYearlySpending(new BigDecimal("300000")));
        assertMoney("0", HomeExpenses.none().getYearlySpending(new BigDecimal("300000")));
    }

    @Test
    @DisplayName("A year in the home: payments become obligations, value appreciates and costs rise")
    void modelStep_homeOwner_paysAndAppreciates() {
        LifeModel model = new LifeModel(2024, 2024);
        Person owner = person(model);
        BankAccount bank = new BankAccount(owner, "Chase", new BigDecimal("100000"));
        Mortgage mortgage = new Mortgage(owner, new BigDecimal("120000"), 10, ZERO);
        Home home = new Home(owner, "Maple St", new BigDecimal("300000"), new BigDecimal("3"),
                new BigDecimal("60000"), mortgage, expenses());

        model.step();

        // 6,700 running costs plus 12 x 1,000 mortgage
        assertMoney("18700", home.getStat(Stat.HOME_EXPENSES));
        assertMoney("18700", owner.getYearlyObligations());
        assertMoney("81300", bank.getBalance());
        assertMoney("309000", home.getHomeValue());
        assertMoney("1030", home.getExpenses().getMaintenanceAmount());
        assertMoney("108000", mortgage.getPrincipal());
        assertTrue(owner.getLoans().isEmpty());
    }

    @Test
    @DisplayName("Mortgage interest above the standard deduction is itemized")
    void federalDeductions_largeMortgageInterest_itemized() {
        LifeModel model = new LifeModel(2024, 2024);
        Person owner = person(model);
        new BankAccount(owner, "Chase", new BigDecimal("100000"));
        Mortgage mortgage = new Mortgage(owner, new BigDecimal("400000"), 30, new BigDecimal("7"));
        Home home = new Home(owner, "Oak Ave", new BigDecimal("500000"), ZERO, new BigDecimal("100000"),
                mortgage, HomeExpenses.none());

        assertMoney("13850", owner.getFederalDeductions());
        home.makeYearlyPayment();

        assertTrue(mortgage.getInterestForYear().compareTo(new BigDecimal("13850")) > 0);
        assertMoney(mortgage.getInterestForYear(), owner.getFederalDeductions());
    }

    private static HomeExpenses expenses() {
        // 1% tax, 0.5% insurance, 1,000 maintenance +3%/yr, 1,200 HOA
        return new HomeExpenses(new BigDecimal("1"), new BigDecimal("0.5"), new BigDecimal("1000"),
                new BigDecimal("3"), ZERO, ZERO, new BigDecimal("1200"), ZERO);
    }

    private static Person person(LifeModel model) {
        return new Person(new Family(model), "Alice", 40, 65, new Spending(ZERO));
    }
}
