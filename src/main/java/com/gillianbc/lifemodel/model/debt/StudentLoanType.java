package com.gillianbc.lifemodel.model.debt;

public enum StudentLoanType {
    FEDERAL_SUBSIDIZED,
    FEDERAL_UNSUBSIDIZED,
    PRIVATE,
    PLUS
}
