package com.gillianbc.lifemodel.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Embedded default values for every configuration key the model reads.
 * These are used as-is when no overlay file is supplied, and as the base that
 * overlays and scenarios are merged onto.
 */
final class FinancialDefaults {

    private FinancialDefaults() {
    }

    static Map<String, Object> create() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("tax", tax());
        root.put("retirement", retirement());
        root.put("accounts", accounts());
        root.put("social_security", socialSecurity());
        root.put("debt", Map.of("credit_card", Map.of(
                "default_interest_rate", 18.0,
                "default_minimum_payment_percent", 2.0,
                "minimum_payment_floor", 25)));
        return root;
    }

    private static Map<String, Object> tax() {
        // Current brackets are applied to all future years, since future tables cannot be predicted
        Map<String, Object> brackets = new LinkedHashMap<>();
        brackets.put("single", List.of(
                List.of(0, 10275, 10),
                List.of(10276, 41775, 12),
                List.of(41776, 89075, 22),
                List.of(89076, 170050, 24),
                List.of(170051, 215950, 32),
                List.of(215951, 539900, 35),
                List.of(539901, Double.POSITIVE_INFINITY, 37)));
        brackets.put("married_filing_jointly", List.of(
                List.of(0, 20550, 10),
                List.of(20551, 83550, 12),
                List.of(83551, 178150, 22),
                List.of(178151, 340100, 24),
                List.of(340101, 431900, 32),
                List.of(431901, 647850, 35),
                List.of(647851, Double.POSITIVE_INFINITY, 37)));

        Map<String, Object> federal = new LinkedHashMap<>();
        federal.put("standard_deduction", Map.of("single", 13850, "married_filing_jointly", 27700));
        federal.put("tax_brackets", brackets);

        Map<String, Object> fica = new LinkedHashMap<>();
        fica.put("social_security_rate", 6.2);
        fica.put("social_security_max_income", 160200);
        fica.put("medicare_rate", 1.45);
        fica.put("medicare_additional_rate", 0.9);
        fica.put("medicare_additional_rate_threshold", Map.of("single", 200000, "married_filing_jointly", 250000));

        Map<String, Object> tax = new LinkedHashMap<>();
        tax.put("federal", federal);
        tax.put("state", Map.of("tax_rate", 6.0));
        tax.put("fica", fica);
        tax.put("early_withdrawal_penalty_rate", 10.0);
        return tax;
    }

    private static Map<String, Object> retirement() {
        Map<String, Object> retirement = new LinkedHashMap<>();
        retirement.put("federal_retirement_age", 59.5);
        retirement.put("job_401k_contrib_limit", Map.of("base", 20500, "catch_up_age", 50, "catch_up_amount", 6500));
        retirement.put("ira", Map.of("contribution_limit", 6500, "catch_up_age", 50, "catch_up_amount", 1000,
                "default_growth_rate", 5.0));
        retirement.put("rmd_start_age", 72);
        // IRS uniform lifetime table: [age, distribution period]
        retirement.put("rmd_distribution_periods", List.of(
                List.of(70, 27.4), List.of(71, 26.5), List.of(72, 25.6), List.of(73, 24.7),
                List.of(74, 23.8), List.of(75, 22.9), List.of(76, 22.0), List.of(77, 21.2),
                List.of(78, 20.3), List.of(79, 19.5), List.of(80, 18.7), List.of(81, 17.9),
                List.of(82, 17.1), List.of(83, 16.3), List.of(84, 15.5), List.of(85, 14.8),
                List.of(86, 14.1), List.of(87, 13.4), List.of(88, 12.7), List.of(89, 12.0),
                List.of(90, 11.4), List.of(91, 10.8), List.of(92, 10.2), List.of(93, 9.6),
                List.of(94, 9.1), List.of(95, 8.6), List.of(96, 8.1), List.of(97, 7.6),
                List.of(98, 7.1), List.of(99, 6.7), List.of(100, 6.3), List.of(101, 5.9),
                List.of(102, 5.5), List.of(103, 5.2), List.of(104, 4.9), List.of(105, 4.5),
                List.of(106, 4.2), List.of(107, 3.9), List.of(108, 3.7), List.of(109, 3.4),
                List.of(110, 3.1), List.of(111, 2.9), List.of(112, 2.6), List.of(113, 2.4),
                List.of(114, 2.1), List.of(115, 1.9)));
        return retirement;
    }

    private static Map<String, Object> accounts() {
        Map<String, Object> accounts = new LinkedHashMap<>();
        accounts.put("bank", Map.of("default_interest_rate", 0.0, "compound_rate", 12));
        accounts.put("brokerage", Map.of("default_growth_rate", 7.0));
        accounts.put("hsa", Map.of(
                "contribution_limit", Map.of("individual", 4150, "family", 8300),
                "penalty_free_age", 65,
                "non_medical_penalty_rate", 20.0));
        accounts.put("plan529", Map.of("default_growth_rate", 6.0));
        accounts.put("annuity", Map.of("surrender_charge_percent", 7.0));
        return accounts;
    }

    private static Map<String, Object> socialSecurity() {
        Map<String, Object> socialSecurity = new LinkedHashMap<>();
        socialSecurity.put("quarter_of_coverage_earnings", 1640);
        socialSecurity.put("max_credits_per_year", 4);
        socialSecurity.put("min_eligible_credits", 40);
        socialSecurity.put("max_years_of_earnings", 35);
        socialSecurity.put("early_claiming_age", 62);
        socialSecurity.put("full_retirement_age", 67);
        socialSecurity.put("max_delayed_credit_age", 70);
        socialSecurity.put("delayed_credit_percent", 8.0);
        // PIA formula: 90% up to the first bend point, 32% up to the second, 15% above
        socialSecurity.put("bend_points", List.of(1115, 6721));
        socialSecurity.put("bend_point_rates", List.of(90, 32, 15));
        // Projected average wage growth and cost-of-living adjustment, in percent
        socialSecurity.put("wage_index_growth", 3.567);
        socialSecurity.put("cost_of_living_adjustment", 2.4);
        return socialSecurity;
    }
}
