package com.gillianbc.lifemodel.model.housing;

import com.gillianbc.lifemodel.model.debt.Loan;
import com.gillianbc.lifemodel.model.people.Person;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Home loan. Paid through its {@link Home}, so it is not listed among the owner's other loans.
 * The interest paid in a year is an itemized deduction.
 */
@Getter
public class Mortgage extends Loan {

    private final int startYear;

    public Mortgage(Person owner, BigDecimal loanAmount, int lengthYears, BigDecimal yearlyInterestRate) {
        this(owner, loanAmount, owner.getModel().getYear(), lengthYears, yearlyInterestRate, null);
    }

    /**
     * @param principal current principal of an existing mortgage, defaults to {@code loanAmount}
     */
    public Mortgage(Person owner,
                    BigDecimal loanAmount,
                    int startYear,
                    int lengthYears,
                    BigDecimal yearlyInterestRate,
                    BigDecimal principal) {
        super(owner, loanAmount, yearlyInterestRate, lengthYears, principal, null);
        this.startYear = startYear;
    }
}
