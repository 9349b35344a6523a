package com.gillianbc.lifemodel.model.debt;

import com.gillianbc.lifemodel.model.people.Person;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

@Getter
public class CarLoan extends Loan {

    private final String vehicle;

    public CarLoan(Person owner, String vehicle, BigDecimal loanAmount, int lengthYears, BigDecimal yearlyInterestRate) {
        super(owner, loanAmount, yearlyInterestRate, lengthYears);
        this.vehicle = Objects.requireNonNull(vehicle, "vehicle must not be null");
        getModel().getRegistries().getLoans().register(owner, this);
    }
}
