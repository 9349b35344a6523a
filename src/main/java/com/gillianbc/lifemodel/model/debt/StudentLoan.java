package com.gillianbc.lifemodel.model.debt;

import com.gillianbc.lifemodel.model.people.Person;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

@Getter
public class StudentLoan extends Loan {

    private final StudentLoanType loanType;
    private final String schoolName;

    public StudentLoan(Person owner,
                       StudentLoanType loanType,
                       String schoolName,
                       BigDecimal loanAmount,
                       BigDecimal yearlyInterestRate,
                       int lengthYears) {
        super(owner, loanAmount, yearlyInterestRate, lengthYears);
        this.loanType = Objects.requireNonNull(loanType, "loanType must not be null");
        this.schoolName = Objects.requireNonNull(schoolName, "schoolName must not be null");
        getModel().getRegistries().getLoans().register(owner, this);
    }
}
