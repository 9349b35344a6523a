package com.gillianbc.lifemodel.service;

import com.gillianbc.lifemodel.model.TaxesDue;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Figures produced by one yearly settlement.
 */
@Getter
@ToString
public class SettlementResult {

    /** Bills excluding taxes. */
    @NonNull private final BigDecimal obligations;
    /** Taxes on income earned before any pre-tax withdrawal. */
    @NonNull private final TaxesDue initialTaxes;
    @NonNull private final BigDecimal shortfall;
    @NonNull private final BigDecimal marginalTax;
    @NonNull private final BigDecimal taxBuffer;
    /** shortfall + marginalTax + taxBuffer */
    @NonNull private final BigDecimal requestedPretaxWithdrawal;
    @NonNull private final BigDecimal pretaxWithdrawn;
    /** Taxes actually charged. */
    @NonNull private final TaxesDue taxesDue;
    /** Part of obligations + taxes that could not be paid and became debt. */
    @NonNull private final BigDecimal unpaid;
    @NonNull private final BigDecimal debtAfterSettlement;

    public SettlementResult(@NonNull BigDecimal obligations,
                            @NonNull TaxesDue initialTaxes,
                            @NonNull BigDecimal shortfall,
                            @NonNull BigDecimal marginalTax,
                            @NonNull BigDecimal taxBuffer,
                            @NonNull BigDecimal requestedPretaxWithdrawal,
                            @NonNull BigDecimal pretaxWithdrawn,
                            @NonNull TaxesDue taxesDue,
                            @NonNull BigDecimal unpaid,
                            @NonNull BigDecimal debtAfterSettlement) {
        this.obligations = obligations;
        this.initialTaxes = initialTaxes;
        this.shortfall = shortfall;
        this.marginalTax = marginalTax;
        this.taxBuffer = taxBuffer;
        this.requestedPretaxWithdrawal = requestedPretaxWithdrawal;
        this.pretaxWithdrawn = pretaxWithdrawn;
        this.taxesDue = taxesDue;
        this.unpaid = unpaid;
        this.debtAfterSettlement = debtAfterSettlement;
    }
}
