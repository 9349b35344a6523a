package com.gillianbc.lifemodel.model.people;

import com.gillianbc.lifemodel.model.FilingStatus;

import java.math.BigDecimal;

/**
 * Something that files a tax return and settles its own bills: a single {@link Person},
 * or a {@link Family} filing jointly.
 */
public interface TaxableEntity {

    String getName();

    FilingStatus getFilingStatus();

    /**
     * @return income received so far this year
     */
    BigDecimal getTaxableIncome();

    /**
     * @return retirement money taken out before the federal retirement age this year
     */
    BigDecimal getEarlyWithdrawalAmount();

    BigDecimal getFederalDeductions();

    BigDecimal getBankAccountBalance();

    /**
     * Liquidates up to {@code amount} from pre-tax retirement balances into the bank.
     * The amount withdrawn counts as taxable income.
     *
     * @return amount actually withdrawn
     */
    BigDecimal withdrawFromPretaxRetirement(BigDecimal amount);

    /**
     * Pays bills from bank accounts, then Roth balances.
     *
     * @return amount that could not be paid
     */
    BigDecimal payBills(BigDecimal amount);

    BigDecimal getDebt();

    void addDebt(BigDecimal amount);

    /**
     * Uses whatever money is available to reduce outstanding debt.
     */
    void payDownDebt();
}
