package com.gillianbc.lifemodel.service;

import com.gillianbc.lifemodel.config.FinancialConfig;
import com.gillianbc.lifemodel.simulation.LifeModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Creates models wired to the application's configuration and services.
 */
@Slf4j
@Service
public class LifeModelFactory {

    private final FinancialConfig config;
    private final TaxCalculator taxCalculator;
    private final RetirementRules retirementRules;
    private final SettlementService settlementService;
    private final PaymentService paymentService;

    public LifeModelFactory(FinancialConfig config,
                            TaxCalculator taxCalculator,
                            RetirementRules retirementRules,
                            SettlementService settlementService,
                            PaymentService paymentService) {
        this.config = config;
        this.taxCalculator = taxCalculator;
        this.retirementRules = retirementRules;
        this.settlementService = settlementService;
        this.paymentService = paymentService;
    }

    public LifeModel create(int startYear, int endYear) {
        log.debug("Creating life model {}-{}", startYear, endYear);
        return new LifeModel(startYear, endYear, config, taxCalculator, retirementRules,
                settlementService, paymentService);
    }
}
