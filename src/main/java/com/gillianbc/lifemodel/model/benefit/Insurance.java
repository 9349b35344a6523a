package com.gillianbc.lifemodel.model.benefit;

import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.simulation.LifeModelAgent;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * General insurance policy. The premium is paid from the owner's bank accounts in the pre-step
 * phase; if it cannot be paid in full the partial payment is refunded and the policy lapses.
 * A lapsed policy stays registered but pays no claims.
 */
@Getter
public class Insurance extends LifeModelAgent {

    private final Person owner;
    private final InsuranceType insuranceType;
    private final String company;
    private final BigDecimal annualPremium;
    private final BigDecimal coverageAmount;
    private final BigDecimal deductible;
    private boolean active = true;
    private BigDecimal totalPremiumsPaid = BigDecimal.ZERO;
    private BigDecimal totalClaimsPaid = BigDecimal.ZERO;

    public Insurance(Person owner,
                     InsuranceType insuranceType,
                     String company,
                     BigDecimal annualPremium,
                     BigDecimal coverageAmount,
                     BigDecimal deductible) {
        super(owner.getModel());
        this.owner = owner;
        this.insuranceType = Objects.requireNonNull(insuranceType, "insuranceType must not be null");
        this.company = Objects.requireNonNull(company, "company must not be null");
        this.annualPremium = Objects.requireNonNull(annualPremium, "annualPremium must not be null");
        this.coverageAmount = Objects.requireNonNull(coverageAmount, "coverageAmount must not be null");
        this.deductible = Objects.requireNonNull(deductible, "deductible must not be null");
        if (annualPremium.signum() < 0 || coverageAmount.signum() < 0 || deductible.signum() < 0) {
            throw new IllegalArgumentException("premium, coverage and deductible must be >= 0");
        }
        getModel().getRegistries().getInsurancePolicies().register(owner, this);
    }

    /**
     * Files a claim for {@code loss}. The payout, {@code min(loss - deductible, coverage)}, is
     * deposited into the owner's bank account.
     *
     * @return the payout; zero for a lapsed policy or a loss within the deductible
     */
    public BigDecimal claim(BigDecimal loss) {
        Objects.requireNonNull(loss, "loss must not be null");
        if (loss.signum() < 0) {
            throw new IllegalArgumentException("loss must be >= 0");
        }
        if (!active) {
            return BigDecimal.ZERO;
        }
        BigDecimal payout = Money.min(Money.nonNegative(loss.subtract(deductible)), coverageAmount);
        if (Money.isPositive(payout)) {
            owner.depositIntoBankAccount(payout);
            totalClaimsPaid = totalClaimsPaid.add(payout);
        }
        return payout;
    }

    @Override
    public void preStep() {
        if (!active) {
            return;
        }
        if (!owner.payFromBankInFull(annualPremium)) {
            active = false;
            getModel().logEvent(owner.getName() + "'s " + insuranceType.label() + " insurance with " + company
                    + " lapsed: premium of $" + Money.display(annualPremium) + " could not be paid");
            return;
        }
        totalPremiumsPaid = totalPremiumsPaid.add(annualPremium);
    }
}
