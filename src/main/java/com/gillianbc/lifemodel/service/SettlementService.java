package com.gillianbc.lifemodel.service;

import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.TaxesDue;
import com.gillianbc.lifemodel.model.people.TaxableEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Yearly settlement of a {@link TaxableEntity}: works out how much pre-tax retirement money has to be
 * liquidated, charges the taxes and pays the bills, turning whatever cannot be paid into debt.
 * <p>
 * Taxes depend on the withdrawal and the withdrawal depends on the taxes. This is resolved with two
 * passes instead of iterating to a fixed point:
 * <ol>
 *     <li>taxes on the income already earned this year</li>
 *     <li>shortfall = max(0, obligations + taxes - bank balance)</li>
 *     <li>marginal tax = taxes(income + shortfall) - taxes(income)</li>
 *     <li>buffer = marginal tax * top bracket rate / 100</li>
 *     <li>withdraw shortfall + marginal tax + buffer from pre-tax accounts</li>
 *     <li>if anything was withdrawn, recompute taxes once</li>
 * </ol>
 * The buffer deliberately over-withdraws a little; the surplus stays in the bank.
 * Required minimum distributions have already been posted to income by the time this runs.
 */
@Slf4j
@Service
public class SettlementService {

    private final TaxCalculator taxCalculator;

    public SettlementService(TaxCalculator taxCalculator) {
        this.taxCalculator = Objects.requireNonNull(taxCalculator, "taxCalculator must not be null");
    }

    /**
     * Settles one year for {@code entity}.
     *
     * @param obligations the year's bills excluding taxes (spending, housing, loan payments)
     * @return the figures of the settlement
     */
    public SettlementResult settle(TaxableEntity entity, BigDecimal obligations) {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(obligations, "obligations must not be null");
        if (obligations.signum() < 0) {
            throw new IllegalArgumentException("obligations must be >= 0");
        }

        TaxesDue initialTaxes = taxesDue(entity, BigDecimal.ZERO);
        BigDecimal shortfall = Money.nonNegative(
                obligations.add(initialTaxes.total()).subtract(entity.getBankAccountBalance()));

        BigDecimal marginalTax = BigDecimal.ZERO;
        BigDecimal taxBuffer = BigDecimal.ZERO;
        BigDecimal requested = BigDecimal.ZERO;
        BigDecimal withdrawn = BigDecimal.ZERO;
        TaxesDue taxes = initialTaxes;

        if (Money.isPositive(shortfall)) {
            marginalTax = taxesDue(entity, shortfall).total().subtract(initialTaxes.total());
            taxBuffer = Money.percentOf(marginalTax, taxCalculator.maxTaxRate(entity.getFilingStatus()));
            requested = shortfall.add(marginalTax).add(taxBuffer);
            withdrawn = entity.withdrawFromPretaxRetirement(requested);
            if (Money.isPositive(withdrawn)) {
                taxes = taxesDue(entity, BigDecimal.ZERO);
            }
        }

        BigDecimal unpaid = entity.payBills(obligations.add(taxes.total()));
        entity.addDebt(unpaid);
        entity.payDownDebt();

        log.debug("Settled {}: obligations={} shortfall={} marginalTax={} buffer={} withdrawn={} taxes={} unpaid={} debt={}",
                entity.getName(), Money.display(obligations), Money.display(shortfall), Money.display(marginalTax),
                Money.display(taxBuffer), Money.display(withdrawn), Money.display(taxes.total()),
                Money.display(unpaid), Money.display(entity.getDebt()));

        return new SettlementResult(obligations, initialTaxes, shortfall, marginalTax, taxBuffer,
                requested, withdrawn, taxes, unpaid, entity.getDebt());
    }

    private TaxesDue taxesDue(TaxableEntity entity, BigDecimal additionalIncome) {
        return taxCalculator.computeTaxesDue(
                entity.getTaxableIncome().add(additionalIncome),
                entity.getFederalDeductions(),
                entity.getFilingStatus(),
                entity.getEarlyWithdrawalAmount());
    }
}
