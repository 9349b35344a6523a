package com.gillianbc.lifemodel.model.account;

import com.gillianbc.lifemodel.model.people.Person;

import java.math.BigDecimal;

/**
 * Any retirement account, whether it holds pre-tax money, Roth money or both.
 * <p>
 * Settlement only ever draws pre-tax money through {@link #deductPretax(BigDecimal)} and only
 * ever pays bills from {@link #deductRoth(BigDecimal)}. Both clamp to the available sub-balance
 * and have no tax side effects; the caller does the tax bookkeeping.
 */
public interface RetirementAccount {

    Person getOwner();

    BigDecimal getPretaxBalance();

    BigDecimal getRothBalance();

    default BigDecimal getTotalBalance() {
        return getPretaxBalance().add(getRothBalance());
    }

    /**
     * @return amount deducted, never more than the pre-tax balance
     */
    BigDecimal deductPretax(BigDecimal amount);

    /**
     * @return amount deducted, never more than the Roth balance
     */
    BigDecimal deductRoth(BigDecimal amount);

    boolean isUsable(int age);
}
