package com.gillianbc.lifemodel.model.debt;

import com.gillianbc.lifemodel.config.FinancialConfig;
import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.people.Person;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Revolving credit. Charges are accepted up to the credit limit and each month the minimum
 * payment is made: a percentage of the balance, but never less than the configured floor.
 */
@Getter
public class CreditCard extends Loan {

    private final String cardName;
    private final BigDecimal creditLimit;
    private final BigDecimal minimumPaymentPercent;
    private final BigDecimal minimumPaymentFloor;

    public CreditCard(Person owner, String cardName, BigDecimal creditLimit) {
        this(owner, cardName, creditLimit, BigDecimal.ZERO,
                owner.getModel().getConfig().getCreditCardDefaultInterestRate(),
                owner.getModel().getConfig().getCreditCardDefaultMinimumPaymentPercent());
    }

    public CreditCard(Person owner,
                      String cardName,
                      BigDecimal creditLimit,
                      BigDecimal currentBalance,
                      BigDecimal yearlyInterestRate,
                      BigDecimal minimumPaymentPercent) {
        super(owner, currentBalance, yearlyInterestRate, 0, currentBalance, BigDecimal.ZERO);
        FinancialConfig config = getModel().getConfig();
        this.cardName = Objects.requireNonNull(cardName, "cardName must not be null");
        this.creditLimit = Objects.requireNonNull(creditLimit, "creditLimit must not be null");
        this.minimumPaymentPercent = Objects.requireNonNull(minimumPaymentPercent, "minimumPaymentPercent must not be null");
        this.minimumPaymentFloor = config.getCreditCardMinimumPaymentFloor();
        getModel().getRegistries().getLoans().register(owner, this);
    }

    public BigDecimal getAvailableCredit() {
        return Money.nonNegative(creditLimit.subtract(principal));
    }

    /**
     * @return false, leaving the balance unchanged, if the charge would exceed the limit
     */
    public boolean charge(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount must not be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("charge must be >= 0");
        }
        if (amount.compareTo(getAvailableCredit()) > 0) {
            return false;
        }
        principal = principal.add(amount);
        return true;
    }

    public BigDecimal getMinimumPayment() {
        if (principal.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return Money.max(minimumPaymentFloor, Money.percentOf(principal, minimumPaymentPercent));
    }

    @Override
    protected BigDecimal scheduledPayment() {
        return getMinimumPayment();
    }
}
