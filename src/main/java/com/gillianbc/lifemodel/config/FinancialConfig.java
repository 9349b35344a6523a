package com.gillianbc.lifemodel.config;

import com.gillianbc.lifemodel.model.FilingStatus;
import com.gillianbc.lifemodel.model.TaxBracket;
import com.gillianbc.lifemodel.model.account.HsaType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable tree of financial parameters (tax tables, limits, rates) looked up by
 * dotted key path, e.g. {@code tax.federal.standard_deduction.single}.
 * <p>
 * Overlays never mutate an existing instance: {@link #withOverrides(Map)} and
 * {@link #withScenario(String)} return a new configuration.
 */
@Slf4j
public final class FinancialConfig {

    private final Map<String, Object> data;
    @Getter
    private final String scenario;

    private FinancialConfig(Map<String, Object> data, String scenario) {
        this.data = deepCopy(data);
        this.scenario = scenario;
    }

    /**
     * @return configuration holding only the embedded defaults
     */
    public static FinancialConfig defaults() {
        return new FinancialConfig(FinancialDefaults.create(), null);
    }

    /**
     * Returns a new configuration with {@code overrides} deep-merged over this one.
     */
    public FinancialConfig withOverrides(Map<?, ?> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        Map<String, Object> merged = deepCopy(data);
        merge(merged, overrides);
        return new FinancialConfig(merged, scenario);
    }

    /**
     * Returns a new configuration with the named predefined scenario applied.
     *
     * @throws IllegalArgumentException if no scenario has that name
     */
    public FinancialConfig withScenario(String scenarioName) {
        Map<String, Object> overrides = Scenarios.get(scenarioName);
        Map<String, Object> merged = deepCopy(data);
        merge(merged, overrides);
        log.info("Applied scenario '{}' to financial configuration", scenarioName);
        return new FinancialConfig(merged, scenarioName);
    }

    /**
     * Looks up a value by dotted key path.
     *
     * @return the value, or empty if any segment of the path is missing
     */
    public Optional<Object> get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Object current = data;
        for (String part : key.split("\\.")) {
            if (!(current instanceof Map) || !((Map<?, ?>) current).containsKey(part)) {
                return Optional.empty();
            }
            current = ((Map<?, ?>) current).get(part);
        }
        return Optional.ofNullable(current);
    }

    public Object get(String key, Object defaultValue) {
        return get(key).orElse(defaultValue);
    }

    public BigDecimal getDecimal(String key, BigDecimal defaultValue) {
        return get(key).map(v -> toDecimal(key, v)).orElse(defaultValue);
    }

    public BigDecimal getDecimal(String key) {
        return get(key).map(v -> toDecimal(key, v))
                .orElseThrow(() -> new IllegalArgumentException("Missing configuration value: " + key));
    }

    public int getInt(String key, int defaultValue) {
        return get(key).map(v -> toInt(key, v)).orElse(defaultValue);
    }

    private static int toInt(String key, Object value) {
        try {
            return toDecimal(key, value).intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(key + " must be a whole number, got " + value, e);
        }
    }

    // ---- typed helpers ----------------------------------------------------

    public BigDecimal getStandardDeduction(FilingStatus filingStatus) {
        return getDecimal("tax.federal.standard_deduction." + filingStatus.configKey());
    }

    public List<TaxBracket> getFederalTaxBrackets(FilingStatus filingStatus) {
        String key = "tax.federal.tax_brackets." + filingStatus.configKey();
        Object raw = get(key).orElseThrow(() -> new IllegalArgumentException("Missing configuration value: " + key));
        if (!(raw instanceof List)) {
            throw new IllegalArgumentException(key + " must be a list of [start, end, rate] rows");
        }
        List<?> rows = (List<?>) raw;
        List<TaxBracket> brackets = new ArrayList<>(rows.size());
        for (Object row : rows) {
            if (!(row instanceof List) || ((List<?>) row).size() != 3) {
                throw new IllegalArgumentException(key + " contains a malformed bracket row: " + row);
            }
            List<?> cells = (List<?>) row;
            BigDecimal start = toDecimal(key, cells.get(0));
            BigDecimal end = isUnbounded(cells.get(1)) ? null : toDecimal(key, cells.get(1));
            BigDecimal rate = toDecimal(key, cells.get(2));
            brackets.add(new TaxBracket(start, end, rate));
        }
        return Collections.unmodifiableList(brackets);
    }

    /**
     * @return rate of the top bracket for the filing status, in percent
     */
    public BigDecimal getMaxTaxRate(FilingStatus filingStatus) {
        List<TaxBracket> brackets = getFederalTaxBrackets(filingStatus);
        return brackets.isEmpty() ? BigDecimal.ZERO : brackets.get(brackets.size() - 1).getRatePercent();
    }

    public BigDecimal getStateTaxRate() {
        return getDecimal("tax.state.tax_rate", BigDecimal.valueOf(6.0));
    }

    public BigDecimal getSocialSecurityRate() {
        return getDecimal("tax.fica.social_security_rate");
    }

    public BigDecimal getSocialSecurityMaxIncome() {
        return getDecimal("tax.fica.social_security_max_income");
    }

    public BigDecimal getMedicareRate() {
        return getDecimal("tax.fica.medicare_rate");
    }

    public BigDecimal getMedicareAdditionalRate() {
        return getDecimal("tax.fica.medicare_additional_rate");
    }

    public BigDecimal getMedicareAdditionalRateThreshold(FilingStatus filingStatus) {
        return getDecimal("tax.fica.medicare_additional_rate_threshold." + filingStatus.configKey());
    }

    public BigDecimal getEarlyWithdrawalPenaltyRate() {
        return getDecimal("tax.early_withdrawal_penalty_rate", BigDecimal.TEN);
    }

    public BigDecimal getFederalRetirementAge() {
        return getDecimal("retirement.federal_retirement_age", new BigDecimal("59.5"));
    }

    public int getRmdStartAge() {
        return getInt("retirement.rmd_start_age", 72);
    }

    /**
     * @return distribution period (divisor) keyed by age
     */
    public NavigableMap<Integer, BigDecimal> getRmdDistributionPeriods() {
        String key = "retirement.rmd_distribution_periods";
        Object raw = get(key).orElseThrow(() -> new IllegalArgumentException("Missing configuration value: " + key));
        if (!(raw instanceof List)) {
            throw new IllegalArgumentException(key + " must be a list of [age, period] rows");
        }
        List<?> rows = (List<?>) raw;
        NavigableMap<Integer, BigDecimal> table = new TreeMap<>();
        for (Object row : rows) {
            if (!(row instanceof List) || ((List<?>) row).size() != 2) {
                throw new IllegalArgumentException(key + " contains a malformed row: " + row);
            }
            List<?> cells = (List<?>) row;
            BigDecimal period = toDecimal(key, cells.get(1));
            if (period.signum() <= 0) {
                throw new IllegalArgumentException(key + " distribution period must be > 0: " + row);
            }
            table.put(toDecimal(key, cells.get(0)).intValue(), period);
        }
        return Collections.unmodifiableNavigableMap(table);
    }

    public BigDecimal getJob401kContribLimit(int age) {
        BigDecimal base = getDecimal("retirement.job_401k_contrib_limit.base");
        int catchUpAge = getInt("retirement.job_401k_contrib_limit.catch_up_age", 50);
        BigDecimal catchUp = getDecimal("retirement.job_401k_contrib_limit.catch_up_amount", BigDecimal.ZERO);
        return age >= catchUpAge ? base.add(catchUp) : base;
    }

    public BigDecimal getIraContributionLimit(int age) {
        BigDecimal base = getDecimal("retirement.ira.contribution_limit");
        int catchUpAge = getInt("retirement.ira.catch_up_age", 50);
        BigDecimal catchUp = getDecimal("retirement.ira.catch_up_amount", BigDecimal.ZERO);
        return age >= catchUpAge ? base.add(catchUp) : base;
    }

    public BigDecimal getIraDefaultGrowthRate() {
        return getDecimal("retirement.ira.default_growth_rate", BigDecimal.valueOf(5));
    }

    public BigDecimal getBankDefaultInterestRate() {
        return getDecimal("accounts.bank.default_interest_rate", BigDecimal.ZERO);
    }

    public int getBankCompoundRate() {
        return getInt("accounts.bank.compound_rate", 12);
    }

    public BigDecimal getBrokerageDefaultGrowthRate() {
        return getDecimal("accounts.brokerage.default_growth_rate", BigDecimal.valueOf(7));
    }

    public BigDecimal getCreditCardDefaultInterestRate() {
        return getDecimal("debt.credit_card.default_interest_rate", BigDecimal.valueOf(18));
    }

    public BigDecimal getCreditCardDefaultMinimumPaymentPercent() {
        return getDecimal("debt.credit_card.default_minimum_payment_percent", BigDecimal.valueOf(2));
    }

    public BigDecimal getCreditCardMinimumPaymentFloor() {
        return getDecimal("debt.credit_card.minimum_payment_floor", BigDecimal.valueOf(25));
    }

    public BigDecimal getHsaContributionLimit(HsaType hsaType) {
        return getDecimal("accounts.hsa.contribution_limit." + hsaType.configKey());
    }

    public int getHsaPenaltyFreeAge() {
        return getInt("accounts.hsa.penalty_free_age", 65);
    }

    public BigDecimal getHsaNonMedicalPenaltyRate() {
        return getDecimal("accounts.hsa.non_medical_penalty_rate", BigDecimal.valueOf(20));
    }

    public BigDecimal getPlan529DefaultGrowthRate() {
        return getDecimal("accounts.plan529.default_growth_rate", BigDecimal.valueOf(6));
    }

    public BigDecimal getAnnuitySurrenderChargePercent() {
        return getDecimal("accounts.annuity.surrender_charge_percent", BigDecimal.ZERO);
    }

    public SocialSecurityRules getSocialSecurityRules() {
        return new SocialSecurityRules(
                getDecimal("social_security.quarter_of_coverage_earnings"),
                getInt("social_security.max_credits_per_year", 4),
                getInt("social_security.min_eligible_credits", 40),
                getInt("social_security.max_years_of_earnings", 35),
                getInt("social_security.early_claiming_age", 62),
                getInt("social_security.full_retirement_age", 67),
                getInt("social_security.max_delayed_credit_age", 70),
                getDecimal("social_security.delayed_credit_percent"),
                getDecimalList("social_security.bend_points"),
                getDecimalList("social_security.bend_point_rates"),
                getDecimal("social_security.wage_index_growth", BigDecimal.ZERO),
                getDecimal("social_security.cost_of_living_adjustment", BigDecimal.ZERO));
    }

    private List<BigDecimal> getDecimalList(String key) {
        Object raw = get(key).orElseThrow(() -> new IllegalArgumentException("Missing configuration value: " + key));
        if (!(raw instanceof List<?>)) {
            throw new IllegalArgumentException(key + " must be a list of numbers");
        }
        List<BigDecimal> values = new ArrayList<>();
        for (Object item : (List<?>) raw) {
            values.add(toDecimal(key, item));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Reads every typed value once so that a malformed entry fails here rather than part way through a run.
     *
     * @return this configuration
     * @throws IllegalArgumentException naming the first unusable key
     */
    public FinancialConfig validate() {
        for (FilingStatus filingStatus : FilingStatus.values()) {
            getStandardDeduction(filingStatus);
            getFederalTaxBrackets(filingStatus);
            getMedicareAdditionalRateThreshold(filingStatus);
        }
        getStateTaxRate();
        getSocialSecurityRate();
        getSocialSecurityMaxIncome();
        getMedicareRate();
        getMedicareAdditionalRate();
        getEarlyWithdrawalPenaltyRate();
        getFederalRetirementAge();
        getRmdStartAge();
        getRmdDistributionPeriods();
        getJob401kContribLimit(0);
        getIraContributionLimit(0);
        getIraDefaultGrowthRate();
        getBankDefaultInterestRate();
        getBankCompoundRate();
        getBrokerageDefaultGrowthRate();
        getCreditCardDefaultInterestRate();
        getCreditCardDefaultMinimumPaymentPercent();
        getCreditCardMinimumPaymentFloor();
        for (HsaType hsaType : HsaType.values()) {
            getHsaContributionLimit(hsaType);
        }
        getHsaPenaltyFreeAge();
        getHsaNonMedicalPenaltyRate();
        getPlan529DefaultGrowthRate();
        getAnnuitySurrenderChargePercent();
        getSocialSecurityRules();
        return this;
    }

    // ---- internals --------------------------------------------------------

    private static boolean isUnbounded(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double || value instanceof Float) {
            return Double.isInfinite(((Number) value).doubleValue());
        }
        return false;
    }

    private static BigDecimal toDecimal(String key, Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException(key + " must be a finite number, got " + value);
            }
            return BigDecimal.valueOf(d);
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be numeric, got '" + text + "'", e);
            }
        }
        throw new IllegalArgumentException(key + " must be numeric, got " + value);
    }

    private static void merge(Map<String, Object> base, Map<?, ?> update) {
        for (Map.Entry<?, ?> entry : update.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object existing = base.get(key);
            Object value = entry.getValue();
            if (existing instanceof Map<?, ?> && value instanceof Map<?, ?>) {
                Map<String, Object> nested = deepCopy((Map<?, ?>) existing);
                merge(nested, (Map<?, ?>) value);
                base.put(key, nested);
            } else {
                base.put(key, copyValue(value));
            }
        }
    }

    private static Map<String, Object> deepCopy(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), copyValue(entry.getValue()));
        }
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?>) {
            return deepCopy((Map<?, ?>) value);
        }
        if (value instanceof List<?>) {
            List<?> list = (List<?>) value;
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(copyValue(item));
            }
            return copy;
        }
        return value;
    }
}
