package com.gillianbc.lifemodel.service;

import com.gillianbc.lifemodel.config.FinancialConfig;
import com.gillianbc.lifemodel.model.FilingStatus;
import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.TaxBracket;
import com.gillianbc.lifemodel.model.TaxesDue;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Maps a year's income to the taxes due on it.
 * <p>
 * All rates, brackets and thresholds are read from the injected {@link FinancialConfig}
 * at call time, so a scenario overlay only needs a different configuration instance.
 * The calculator holds no other state.
 */
@Service
public class TaxCalculator {

    private final FinancialConfig config;

    public TaxCalculator(FinancialConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public TaxesDue computeTaxesDue(BigDecimal grossIncome, BigDecimal deductions, FilingStatus filingStatus) {
        return computeTaxesDue(grossIncome, deductions, filingStatus, BigDecimal.ZERO);
    }

    /**
     * Computes federal, state, FICA and early-withdrawal taxes for one year.
     * <ul>
     *     <li>Federal and state taxes use AGI = max(gross - deductions, 0).</li>
     *     <li>Social security and medicare use gross income.</li>
     *     <li>The early-withdrawal penalty is its own component.</li>
     * </ul>
     *
     * @param grossIncome            taxable gross income for the year
     * @param deductions             deductions applied to reach AGI (>= 0)
     * @param filingStatus           selects brackets and medicare threshold
     * @param earlyWithdrawalAmount  retirement money taken out early this year (>= 0)
     */
    public TaxesDue computeTaxesDue(BigDecimal grossIncome,
                                    BigDecimal deductions,
                                    FilingStatus filingStatus,
                                    BigDecimal earlyWithdrawalAmount) {
        Objects.requireNonNull(grossIncome, "grossIncome must not be null");
        Objects.requireNonNull(deductions, "deductions must not be null");
        Objects.requireNonNull(filingStatus, "filingStatus must not be null");
        Objects.requireNonNull(earlyWithdrawalAmount, "earlyWithdrawalAmount must not be null");
        if (deductions.signum() < 0) {
            throw new IllegalArgumentException("deductions must be >= 0");
        }
        if (earlyWithdrawalAmount.signum() < 0) {
            throw new IllegalArgumentException("earlyWithdrawalAmount must be >= 0");
        }

        BigDecimal adjustedGrossIncome = Money.nonNegative(grossIncome.subtract(deductions));

        // TODO: state tax reuses the federal deductions; a state-specific deduction table would replace this
        return new TaxesDue(
                federalIncomeTax(adjustedGrossIncome, filingStatus),
                stateIncomeTax(adjustedGrossIncome),
                socialSecurityTax(grossIncome),
                medicareTax(grossIncome, filingStatus),
                earlyWithdrawalPenalty(earlyWithdrawalAmount));
    }

    /**
     * Progressive bracket tax, rounded to the nearest whole currency unit.
     */
    public BigDecimal federalIncomeTax(BigDecimal adjustedGrossIncome, FilingStatus filingStatus) {
        BigDecimal total = BigDecimal.ZERO;
        for (TaxBracket bracket : config.getFederalTaxBrackets(filingStatus)) {
            total = total.add(bracket.taxOn(adjustedGrossIncome));
        }
        return total.setScale(0, RoundingMode.HALF_UP);
    }

    /**
     * Flat-rate state tax.
     */
    public BigDecimal stateIncomeTax(BigDecimal adjustedGrossIncome) {
        return Money.percentOf(adjustedGrossIncome, config.getStateTaxRate());
    }

    public BigDecimal socialSecurityTax(BigDecimal grossIncome) {
        BigDecimal taxable = Money.min(Money.nonNegative(grossIncome), config.getSocialSecurityMaxIncome());
        return Money.percentOf(taxable, config.getSocialSecurityRate());
    }

    public BigDecimal medicareTax(BigDecimal grossIncome, FilingStatus filingStatus) {
        BigDecimal income = Money.nonNegative(grossIncome);
        BigDecimal tax = Money.percentOf(income, config.getMedicareRate());
        BigDecimal threshold = config.getMedicareAdditionalRateThreshold(filingStatus);
        if (income.compareTo(threshold) > 0) {
            tax = tax.add(Money.percentOf(income.subtract(threshold), config.getMedicareAdditionalRate()));
        }
        return tax;
    }

    public BigDecimal earlyWithdrawalPenalty(BigDecimal earlyWithdrawalAmount) {
        return Money.percentOf(earlyWithdrawalAmount, config.getEarlyWithdrawalPenaltyRate());
    }

    /**
     * @return top bracket rate for the filing status, in percent
     */
    public BigDecimal maxTaxRate(FilingStatus filingStatus) {
        return config.getMaxTaxRate(filingStatus);
    }

    public BigDecimal standardDeduction(FilingStatus filingStatus) {
        return config.getStandardDeduction(filingStatus);
    }
}
