package com.gillianbc.lifemodel.service;

import com.gillianbc.lifemodel.config.FinancialConfig;
import com.gillianbc.lifemodel.model.Money;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;

/**
 * Age-gated retirement rules: penalty-free access and required minimum distributions.
 */
@Service
public class RetirementRules {

    private final FinancialConfig config;

    public RetirementRules(FinancialConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public BigDecimal federalRetirementAge() {
        return config.getFederalRetirementAge();
    }

    /**
     * @return true once {@code age} has reached the federal retirement age (59.5 by default)
     */
    public boolean isUsable(int age) {
        return BigDecimal.valueOf(age).compareTo(config.getFederalRetirementAge()) >= 0;
    }

    public boolean isRmdAge(int age) {
        return age >= config.getRmdStartAge();
    }

    /**
     * Required minimum distribution for a pre-tax balance at the given age:
     * {@code balance / distributionPeriod(age)}, never more than the balance.
     * Ages past the end of the table use its last period.
     *
     * @return zero below the RMD start age
     */
    public BigDecimal requiredMinimumDistribution(int age, BigDecimal balance) {
        Objects.requireNonNull(balance, "balance must not be null");
        if (!isRmdAge(age) || balance.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal period = distributionPeriod(age);
        return Money.min(balance.divide(period, Money.MATH_CONTEXT), balance);
    }

    public BigDecimal distributionPeriod(int age) {
        NavigableMap<Integer, BigDecimal> table = config.getRmdDistributionPeriods();
        if (table.isEmpty()) {
            throw new IllegalStateException("RMD distribution period table is empty");
        }
        Map.Entry<Integer, BigDecimal> entry = table.floorEntry(age);
        return entry != null ? entry.getValue() : table.firstEntry().getValue();
    }
}
