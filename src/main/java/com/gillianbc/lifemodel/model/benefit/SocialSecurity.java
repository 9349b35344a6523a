package com.gillianbc.lifemodel.model.benefit;

import com.gillianbc.lifemodel.config.SocialSecurityRules;
import com.gillianbc.lifemodel.model.Money;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.people.Person;
import com.gillianbc.lifemodel.simulation.LifeModelAgent;
import lombok.AccessLevel;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Social Security retirement benefit.
 * <p>
 * Earnings are recorded per year, capped at the taxable maximum. The monthly benefit (PIA) comes from
 * the average of the best years of earnings, indexed to the year the owner turns 60, run through the
 * bend-point formula and truncated to the dime. Cost-of-living adjustments apply from the year the
 * owner turns 62, and the result is reduced for claiming before the full retirement age or increased
 * for claiming after it. Without enough credits nothing is paid.
 */
@Getter
public class SocialSecurity extends LifeModelAgent implements PeriodicBenefit {

    private static final int INDEXING_AGE = 60;
    private static final BigDecimal FIVE = BigDecimal.valueOf(5);

    private final Person owner;
    private final int claimingAge;
    @Getter(AccessLevel.NONE)
    private final SortedMap<Integer, BigDecimal> earnings = new TreeMap<>();
    private boolean paying;

    public SocialSecurity(Person owner, int claimingAge) {
        this(owner, claimingAge, Collections.emptyMap());
    }

    /**
     * @param earningsHistory past earnings keyed by year
     * @throws IllegalArgumentException if the claiming age is before the earliest claiming age
     */
    public SocialSecurity(Person owner, int claimingAge, Map<Integer, BigDecimal> earningsHistory) {
        super(owner.getModel());
        this.owner = owner;
        Objects.requireNonNull(earningsHistory, "earningsHistory must not be null");
        int earliest = rules().getEarlyClaimingAge();
        if (claimingAge < earliest) {
            throw new IllegalArgumentException("Social Security cannot be claimed before age " + earliest
                    + ", got " + claimingAge);
        }
        this.claimingAge = claimingAge;
        earningsHistory.forEach(this::addEarnings);
        getModel().getRegistries().getSocialSecurity().register(owner, this);
    }

    public SortedMap<Integer, BigDecimal> getEarnings() {
        return Collections.unmodifiableSortedMap(earnings);
    }

    /**
     * Adds covered earnings for {@code year}; the year's total is capped at the taxable maximum.
     */
    public void addEarnings(int year, BigDecimal amount) {
        Objects.requireNonNull(amount, "amount must not be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("earnings must be >= 0");
        }
        BigDecimal cap = getModel().getConfig().getSocialSecurityMaxIncome();
        earnings.merge(year, amount, BigDecimal::add);
        earnings.computeIfPresent(year, (y, total) -> Money.min(total, cap));
    }

    public int getCredits() {
        SocialSecurityRules rules = rules();
        int credits = 0;
        for (BigDecimal amount : earnings.values()) {
            int forYear = amount.divide(rules.getQuarterOfCoverageEarnings(), 0, RoundingMode.DOWN).intValue();
            credits += Math.min(rules.getMaxCreditsPerYear(), forYear);
        }
        return credits;
    }

    public boolean isInsured() {
        return getCredits() >= rules().getMinEligibleCredits();
    }

    /**
     * @return average indexed monthly earnings over the best years, in whole dollars; zero if not insured
     */
    public BigDecimal getAime() {
        if (!isInsured()) {
            return BigDecimal.ZERO;
        }
        int years = rules().getMaxYearsOfEarnings();
        int indexingYear = owner.getYearAtAge(INDEXING_AGE);
        BigDecimal best = earnings.entrySet().stream()
                .map(entry -> indexed(entry.getKey(), entry.getValue(), indexingYear))
                .sorted(Comparator.reverseOrder())
                .limit(years)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return best.divide(BigDecimal.valueOf(years * 12L), 0, RoundingMode.HALF_UP);
    }

    /**
     * @return the monthly benefit payable in {@code year} when claimed at {@link #getClaimingAge()}
     */
    public BigDecimal getPia(int year) {
        SocialSecurityRules rules = rules();
        BigDecimal aime = getAime();
        BigDecimal low = rules.getBendPoints().get(0);
        BigDecimal high = rules.getBendPoints().get(1);

        BigDecimal pia = Money.percentOf(Money.min(aime, low), rules.getBendPointRates().get(0))
                .add(Money.percentOf(Money.min(Money.nonNegative(aime.subtract(low)), high.subtract(low)),
                        rules.getBendPointRates().get(1)))
                .add(Money.percentOf(Money.nonNegative(aime.subtract(high)), rules.getBendPointRates().get(2)));
        pia = truncateToDime(pia);

        BigDecimal colaFactor = BigDecimal.ONE.add(rules.getCostOfLivingAdjustment().divide(Money.HUNDRED, Money.MATH_CONTEXT));
        for (int colaYear = owner.getYearAtAge(rules.getEarlyClaimingAge()); colaYear < year; colaYear++) {
            pia = truncateToDime(pia.multiply(colaFactor, Money.MATH_CONTEXT));
        }

        return pia.multiply(claimingAdjustment(rules), Money.MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP);
    }

    @Override
    public boolean isEligible() {
        return owner.getAge() >= claimingAge && isInsured();
    }

    @Override
    public BigDecimal getAnnualBenefit() {
        return isEligible() ? getPia(getModel().getYear()).multiply(Money.TWELVE) : BigDecimal.ZERO;
    }

    // TODO: up to 85% of benefits become taxable income above the provisional-income thresholds
    @Override
    public void preStep() {
        BigDecimal benefit = getAnnualBenefit();
        if (!Money.isPositive(benefit)) {
            return;
        }
        owner.depositIntoBankAccount(benefit);
        recordStat(Stat.SOCIAL_SECURITY_INCOME, benefit);
        if (!paying) {
            paying = true;
            getModel().logEvent(owner.getName() + " started claiming Social Security of $"
                    + Money.display(benefit) + " a year at age " + owner.getAge());
        }
    }

    private SocialSecurityRules rules() {
        return getModel().getConfig().getSocialSecurityRules();
    }

    private BigDecimal indexed(int year, BigDecimal amount, int indexingYear) {
        if (year >= indexingYear) {
            return amount;
        }
        BigDecimal growth = BigDecimal.ONE.add(rules().getWageIndexGrowth().divide(Money.HUNDRED, Money.MATH_CONTEXT));
        return amount.multiply(growth.pow(indexingYear - year, Money.MATH_CONTEXT), Money.MATH_CONTEXT);
    }

    /**
     * Early claiming loses 5/9% per month for the first 36 months and 5/12% per month after that;
     * late claiming earns the delayed credit for each month up to the maximum age.
     */
    private BigDecimal claimingAdjustment(SocialSecurityRules rules) {
        int full = rules.getFullRetirementAge();
        BigDecimal percent;
        if (claimingAge < full) {
            int monthsEarly = (full - claimingAge) * 12;
            percent = FIVE.multiply(BigDecimal.valueOf(Math.min(monthsEarly, 36))).divide(BigDecimal.valueOf(9), Money.MATH_CONTEXT)
                    .add(FIVE.multiply(BigDecimal.valueOf(Math.max(0, monthsEarly - 36))).divide(Money.TWELVE, Money.MATH_CONTEXT))
                    .negate();
        } else {
            int monthsLate = (Math.min(claimingAge, rules.getMaxDelayedCreditAge()) - full) * 12;
            percent = rules.getDelayedCreditPercent().multiply(BigDecimal.valueOf(monthsLate))
                    .divide(Money.TWELVE, Money.MATH_CONTEXT);
        }
        return BigDecimal.ONE.add(percent.divide(Money.HUNDRED, Money.MATH_CONTEXT));
    }

    private static BigDecimal truncateToDime(BigDecimal amount) {
        return amount.setScale(1, RoundingMode.DOWN);
    }
}
