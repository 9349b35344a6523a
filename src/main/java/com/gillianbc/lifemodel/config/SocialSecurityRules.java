package com.gillianbc.lifemodel.config;

import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Parameters of the Social Security benefit formula, read from the {@code social_security} section.
 */
@Getter
@ToString
public final class SocialSecurityRules {

    @NonNull private final BigDecimal quarterOfCoverageEarnings;
    private final int maxCreditsPerYear;
    private final int minEligibleCredits;
    private final int maxYearsOfEarnings;
    private final int earlyClaimingAge;
    private final int fullRetirementAge;
    private final int maxDelayedCreditAge;
    @NonNull private final BigDecimal delayedCreditPercent;
    @NonNull private final List<BigDecimal> bendPoints;
    @NonNull private final List<BigDecimal> bendPointRates;
    @NonNull private final BigDecimal wageIndexGrowth;
    @NonNull private final BigDecimal costOfLivingAdjustment;

    public SocialSecurityRules(BigDecimal quarterOfCoverageEarnings,
                               int maxCreditsPerYear,
                               int minEligibleCredits,
                               int maxYearsOfEarnings,
                               int earlyClaimingAge,
                               int fullRetirementAge,
                               int maxDelayedCreditAge,
                               BigDecimal delayedCreditPercent,
                               List<BigDecimal> bendPoints,
                               List<BigDecimal> bendPointRates,
                               BigDecimal wageIndexGrowth,
                               BigDecimal costOfLivingAdjustment) {
        this.quarterOfCoverageEarnings = Objects.requireNonNull(quarterOfCoverageEarnings, "quarterOfCoverageEarnings must not be null");
        this.delayedCreditPercent = Objects.requireNonNull(delayedCreditPercent, "delayedCreditPercent must not be null");
        this.bendPoints = List.copyOf(Objects.requireNonNull(bendPoints, "bendPoints must not be null"));
        this.bendPointRates = List.copyOf(Objects.requireNonNull(bendPointRates, "bendPointRates must not be null"));
        this.wageIndexGrowth = Objects.requireNonNull(wageIndexGrowth, "wageIndexGrowth must not be null");
        this.costOfLivingAdjustment = Objects.requireNonNull(costOfLivingAdjustment, "costOfLivingAdjustment must not be null");

        if (quarterOfCoverageEarnings.signum() <= 0) {
            throw new IllegalArgumentException("social_security.quarter_of_coverage_earnings must be > 0");
        }
        if (maxCreditsPerYear <= 0 || minEligibleCredits < 0 || maxYearsOfEarnings <= 0) {
            throw new IllegalArgumentException("social_security credit and year counts must be positive");
        }
        if (earlyClaimingAge > fullRetirementAge || fullRetirementAge > maxDelayedCreditAge) {
            throw new IllegalArgumentException("social_security ages must satisfy early <= full <= max delayed, got "
                    + earlyClaimingAge + ", " + fullRetirementAge + ", " + maxDelayedCreditAge);
        }
        if (this.bendPoints.size() != 2 || this.bendPoints.get(0).compareTo(this.bendPoints.get(1)) > 0) {
            throw new IllegalArgumentException("social_security.bend_points must be two ascending amounts: " + bendPoints);
        }
        if (this.bendPointRates.size() != 3) {
            throw new IllegalArgumentException("social_security.bend_point_rates must hold three rates: " + bendPointRates);
        }
        this.maxCreditsPerYear = maxCreditsPerYear;
        this.minEligibleCredits = minEligibleCredits;
        this.maxYearsOfEarnings = maxYearsOfEarnings;
        this.earlyClaimingAge = earlyClaimingAge;
        this.fullRetirementAge = fullRetirementAge;
        this.maxDelayedCreditAge = maxDelayedCreditAge;
    }
}
