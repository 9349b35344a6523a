package com.gillianbc.lifemodel.model.account;

import java.math.BigDecimal;

/**
 * An account holding a single balance.
 */
public interface BalanceBearing {

    BigDecimal getBalance();

    /**
     * @return false only for a negative amount; a zero deposit is a successful no-op
     */
    boolean deposit(BigDecimal amount);

    /**
     * Takes out up to {@code amount}. Never throws for insufficient funds and never leaves the
     * balance negative.
     *
     * @return amount actually withdrawn, {@code min(amount, balance)}; zero for a negative amount
     */
    BigDecimal withdraw(BigDecimal amount);
}
