package com.gillianbc.lifemodel.config;

import com.gillianbc.lifemodel.model.FilingStatus;
import com.gillianbc.lifemodel.model.TaxBracket;
import com.gillianbc.lifemodel.model.account.HsaType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.gillianbc.lifemodel.MoneyAssertions.assertMoney;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FinancialConfigTest {

    private final FinancialConfig defaults = FinancialConfig.defaults();

    @Test
    @DisplayName("Embedded defaults are available by dotted key path")
    void get_dottedPath_returnsEmbeddedDefault() {
        assertMoney("13850", defaults.getStandardDeduction(FilingStatus.SINGLE));
        assertMoney("27700", defaults.getStandardDeduction(FilingStatus.MARRIED_FILING_JOINTLY));
        assertMoney("6.2", defaults.getSocialSecurityRate());
        assertMoney("59.5", defaults.getFederalRetirementAge());
        assertEquals(72, defaults.getRmdStartAge());
        assertEquals(12, defaults.getBankCompoundRate());
        assertNull(defaults.getScenario());
    }

    @Test
    @DisplayName("Missing keys are empty or fall back to the supplied default")
    void get_missingKey_returnsEmptyOrDefault() {
        assertFalse(defaults.get("tax.federal.no_such_key").isPresent());
        assertEquals("fallback", defaults.get("no.such.path", "fallback"));
        assertMoney("42", defaults.getDecimal("tax.nothing", BigDecimal.valueOf(42)));
        assertThrows(IllegalArgumentException.class, () -> defaults.getDecimal("tax.nothing"));
    }

    @Test
    @DisplayName("Seven single brackets with an unbounded top bracket at 37%")
    void getFederalTaxBrackets_single_topBracketUnbounded() {
        List<TaxBracket> brackets = defaults.getFederalTaxBrackets(FilingStatus.SINGLE);
        assertEquals(7, brackets.size());
        TaxBracket top = brackets.get(6);
        assertFalse(top.getEnd().isPresent());
        assertMoney("37", top.getRatePercent());
        assertMoney("37", defaults.getMaxTaxRate(FilingStatus.SINGLE));
    }

    @Test
    @DisplayName("401k and IRA limits include the catch-up amount from age 50")
    void contributionLimits_catchUpAge_addsCatchUp() {
        assertMoney("20500", defaults.getJob401kContribLimit(49));
        assertMoney("27000", defaults.getJob401kContribLimit(50));
        assertMoney("6500", defaults.getIraContributionLimit(49));
        assertMoney("7500", defaults.getIraContributionLimit(50));
    }

    @Test
    @DisplayName("Overrides deep-merge and leave the original untouched")
    void withOverrides_nestedValue_mergesWithoutMutatingOriginal() {
        FinancialConfig changed = defaults.withOverrides(Map.of("tax", Map.of("state", Map.of("tax_rate", 4.25))));
        assertMoney("4.25", changed.getStateTaxRate());
        assertMoney("6", defaults.getStateTaxRate());
        // siblings survive the merge
        assertMoney("6.2", changed.getSocialSecurityRate());
    }

    @Test
    @DisplayName("Named scenario is applied and remembered")
    void withScenario_recession_appliesOverlay() {
        FinancialConfig recession = defaults.withScenario("recession");
        assertEquals("recession", recession.getScenario());
        assertMoney("3", recession.getBrokerageDefaultGrowthRate());
        assertMoney("0.5", recession.getBankDefaultInterestRate());
        assertMoney("3.5", recession.getIraDefaultGrowthRate());
        assertMoney("7", defaults.getBrokerageDefaultGrowthRate());
    }

    @Test
    @DisplayName("Unknown scenario throws IllegalArgumentException naming the available ones")
    void withScenario_unknown_throws() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> defaults.withScenario("boom"));
        assertTrue(e.getMessage().contains("recession"));
    }

    @Test
    @DisplayName("Non-numeric values are rejected when read as numbers")
    void getDecimal_nonNumeric_throws() {
        FinancialConfig broken = defaults.withOverrides(Map.of("tax", Map.of("state", Map.of("tax_rate", "lots"))));
        assertThrows(IllegalArgumentException.class, broken::getStateTaxRate);
    }

    @Test
    @DisplayName("Malformed bracket rows are rejected")
    void getFederalTaxBrackets_malformedRow_throws() {
        FinancialConfig broken = defaults.withOverrides(Map.of("tax", Map.of("federal",
                Map.of("tax_brackets", Map.of("single", List.of(List.of(0, 10)))))));
        assertThrows(IllegalArgumentException.class, () -> broken.getFederalTaxBrackets(FilingStatus.SINGLE));
    }

    @Test
    @DisplayName("Social Security rules and new account settings come from the defaults")
    void getSocialSecurityRules_defaults() {
        SocialSecurityRules rules = defaults.getSocialSecurityRules();

        assertMoney("1640", rules.getQuarterOfCoverageEarnings());
        assertEquals(40, rules.getMinEligibleCredits());
        assertEquals(67, rules.getFullRetirementAge());
        assertMoney("1115", rules.getBendPoints().get(0));
        assertMoney("6721", rules.getBendPoints().get(1));
        assertEquals(3, rules.getBendPointRates().size());
        assertMoney("4150", defaults.getHsaContributionLimit(HsaType.INDIVIDUAL));
        assertMoney("8300", defaults.getHsaContributionLimit(HsaType.FAMILY));
        assertEquals(65, defaults.getHsaPenaltyFreeAge());
        assertMoney("6", defaults.getPlan529DefaultGrowthRate());
        assertMoney("7", defaults.getAnnuitySurrenderChargePercent());
    }

    @Test
    @DisplayName("Descending bend points are rejected")
    void getSocialSecurityRules_descendingBendPoints_throws() {
        FinancialConfig broken = defaults.withOverrides(Map.of("social_security",
                Map.of("bend_points", List.of(6721, 1115))));

        assertThrows(IllegalArgumentException.class, broken::getSocialSecurityRules);
        assertThrows(IllegalArgumentException.class, broken::validate);
    }
}
