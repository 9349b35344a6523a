package com.gillianbc.lifemodel.model.benefit;

import com.gillianbc.lifemodel.model.account.BankAccount;
import com.gillianbc.lifemodel.model.people.Family;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.model.people.Spending;
import com.gillianbc.lifemodel.simulation.Event;
import com.gillianbc.lifemodel.simulation.LifeModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import static com.gillianbc.lifemodel.MoneyAssertions.assertMoney;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TermLifeInsuranceTest {

    private LifeModel model;
    private Person holder;
    private Person beneficiary;

    @BeforeEach
    void setUp() {
        model = new LifeModel(2024, 2030);
        Family family = new Family(model);
        holder = new Person(family, "Alice", 40, 65, new Spending(BigDecimal.ZERO));
        beneficiary = new Person(family, "Bob", 40, 65, new Spending(BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Premiums are paid for the term and the policy then expires")
    void modelRun_paysPremiumsThenExpires() {
        BankAccount bank = new BankAccount(holder, "Chase", new BigDecimal("5000"));
        new BankAccount(beneficiary, "Chase", BigDecimal.ZERO);
        TermLifeInsurance policy = policy(2);

        model.step();
        assertMoney("4500", bank.getBalance());
        assertEquals(1, policy.getYearsInForce());
        assertTrue(policy.isActive());

        model.step();
        assertMoney("4000", bank.getBalance());
        assertFalse(policy.isActive());
        assertTrue(messages().contains("Alice's term life insurance expired after 2 years"));

        model.step();
        assertMoney("4000", bank.getBalance());
        assertEquals(List.of(policy), holder.getLifeInsurancePolicies());
    }

    @Test
    @DisplayName("An unaffordable premium is refunded and the policy lapses")
    void preStep_notEnoughMoney_lapses() {
        BankAccount bank = new BankAccount(holder, "Chase", new BigDecimal("100"));
        TermLifeInsurance policy = policy(20);

        policy.preStep();

        assertFalse(policy.isActive());
        assertMoney("100", bank.getBalance());
        assertTrue(messages().get(0).startsWith("Alice's term life insurance lapsed"));
    }

    @Test
    @DisplayName("A payout goes to the beneficiary once")
    void payout_paysBeneficiaryOnce() {
        BankAccount bobsBank = new BankAccount(beneficiary, "Chase", BigDecimal.ZERO);
        TermLifeInsurance policy = policy(20);

        assertMoney("250000", policy.payout());
        assertMoney("250000", bobsBank.getBalance());
        assertFalse(policy.isActive());

        assertMoney("0", policy.payout());
        assertMoney("250000", bobsBank.getBalance());
        assertEquals(List.of("Life insurance for Alice paid $250000.00 to Bob",
                "Life insurance for Alice is not active, nothing paid out"), messages());
    }

    @Test
    @DisplayName("The term must be at least one year")
    void constructor_noTerm_throws() {
        assertThrows(IllegalArgumentException.class, () -> new TermLifeInsurance(holder, beneficiary,
                new BigDecimal("250000"), new BigDecimal("500"), 0));
    }

    private TermLifeInsurance policy(int termYears) {
        return new TermLifeInsurance(holder, beneficiary, new BigDecimal("250000"), new BigDecimal("500"), termYears);
    }

    private List<String> messages() {
        return model.getEventLog().getEvents().stream().map(Event::getMessage).collect(Collectors.toList());
    }
}
