package com.gillianbc.lifemodel.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Predefined configuration overlays for common economic and regulatory conditions.
 */
public final class Scenarios {

    private static final Map<String, Map<String, Object>> PREDEFINED = new LinkedHashMap<>();

    static {
        // Lower growth and interest
        PREDEFINED.put("recession", Map.of(
                "accounts", Map.of(
                        "bank", Map.of("default_interest_rate", 0.5),
                        "brokerage", Map.of("default_growth_rate", 3.0)),
                "retirement", Map.of("ira", Map.of("default_growth_rate", 3.5))));

        PREDEFINED.put("high_inflation", Map.of(
                "accounts", Map.of(
                        "bank", Map.of("default_interest_rate", 4.0),
                        "brokerage", Map.of("default_growth_rate", 9.0)),
                "debt", Map.of("credit_card", Map.of("default_interest_rate", 25.0))));

        PREDEFINED.put("conservative", Map.of(
                "accounts", Map.of("brokerage", Map.of("default_growth_rate", 5.0)),
                "retirement", Map.of("ira", Map.of("default_growth_rate", 5.5))));

        PREDEFINED.put("aggressive", Map.of(
                "accounts", Map.of("brokerage", Map.of("default_growth_rate", 10.0)),
                "retirement", Map.of("ira", Map.of("default_growth_rate", 10.5))));

        PREDEFINED.put("tax_reform", Map.of(
                "tax", Map.of(
                        "federal", Map.of(
                                "standard_deduction", Map.of("single", 15000, "married_filing_jointly", 30000),
                                "tax_brackets", Map.of("single", List.of(
                                        List.of(0, 12000, 10),
                                        List.of(12001, 45000, 12),
                                        List.of(45001, 95000, 22),
                                        List.of(95001, 180000, 24),
                                        List.of(180001, 250000, 32),
                                        List.of(250001, 600000, 35),
                                        List.of(600001, Double.POSITIVE_INFINITY, 39)))),
                        "state", Map.of("tax_rate", 7.5))));

        PREDEFINED.put("low_tax", Map.of(
                "tax", Map.of(
                        "federal", Map.of(
                                "tax_brackets", Map.of("single", List.of(
                                        List.of(0, 15000, 8),
                                        List.of(15001, 50000, 10),
                                        List.of(50001, 100000, 18),
                                        List.of(100001, 200000, 20),
                                        List.of(200001, 500000, 28),
                                        List.of(500001, Double.POSITIVE_INFINITY, 32)))),
                        "state", Map.of("tax_rate", 3.0))));
    }

    private Scenarios() {
    }

    /**
     * @throws IllegalArgumentException if the name is not a predefined scenario
     */
    public static Map<String, Object> get(String name) {
        Map<String, Object> scenario = PREDEFINED.get(name);
        if (scenario == null) {
            throw new IllegalArgumentException("Scenario '" + name + "' not found. Available scenarios: "
                    + String.join(", ", PREDEFINED.keySet()));
        }
        return scenario;
    }

    public static List<String> names() {
        return List.copyOf(PREDEFINED.keySet());
    }
}
