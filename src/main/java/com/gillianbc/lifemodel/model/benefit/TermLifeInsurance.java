package com.gillianbc.lifemodel.model.benefit;

import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.simulation.LifeModelAgent;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Term life policy on the holder's life. The premium is paid each pre-step for the length of the term.
 * The policy becomes inactive when the term runs out, when a premium cannot be paid or after it
 * pays out.
 */
@Getter
public class TermLifeInsurance extends LifeModelAgent {

    private final Person policyHolder;
    private final Person beneficiary;
    private final BigDecimal coverageAmount;
    private final BigDecimal annualPremium;
    private final int termYears;
    private int yearsInForce;
    private boolean active = true;

    public TermLifeInsurance(Person policyHolder, Person beneficiary, BigDecimal coverageAmount,
                             BigDecimal annualPremium, int termYears) {
        super(policyHolder.getModel());
        this.policyHolder = policyHolder;
        this.beneficiary = Objects.requireNonNull(beneficiary, "beneficiary must not be null");
        this.coverageAmount = Objects.requireNonNull(coverageAmount, "coverageAmount must not be null");
        this.annualPremium = Objects.requireNonNull(annualPremium, "annualPremium must not be null");
        if (coverageAmount.signum() < 0 || annualPremium.signum() < 0) {
            throw new IllegalArgumentException("coverageAmount and annualPremium must be >= 0");
        }
        if (termYears <= 0) {
            throw new IllegalArgumentException("termYears must be > 0");
        }
        this.termYears = termYears;
        getModel().getRegistries().getLifeInsurancePolicies().register(policyHolder, this);
    }

    /**
     * Pays the coverage into the beneficiary's bank account and ends the policy.
     *
     * @return the amount paid; zero if the policy is not active
     */
    public BigDecimal payout() {
        if (!active) {
            getModel().logEvent("Life insurance for " + policyHolder.getName() + " is not active, nothing paid out");
            return BigDecimal.ZERO;
        }
        active = false;
        beneficiary.depositIntoBankAccount(coverageAmount);
        getModel().logEvent("Life insurance for " + policyHolder.getName() + " paid $"
                + Money.display(coverageAmount) + " to " + beneficiary.getName());
        return coverageAmount;
    }

    @Override
    public void preStep() {
        if (!active) {
            return;
        }
        if (!policyHolder.payFromBankInFull(annualPremium)) {
            active = false;
            getModel().logEvent(policyHolder.getName() + "'s term life insurance lapsed: premium of $"
                    + Money.display(annualPremium) + " could not be paid");
        }
    }

    @Override
    public void postStep() {
        if (!active) {
            return;
        }
        yearsInForce++;
        if (yearsInForce >= termYears) {
            active = false;
            getModel().logEvent(policyHolder.getName() + "'s term life insurance expired after "
                    + termYears + " years");
        }
    }
}
