package com.gillianbc.lifemodel.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Immutable value representing the taxes due for one year, split by type of tax.
 */
@Getter
@ToString
@EqualsAndHashCode
public class TaxesDue {

    public static final TaxesDue NONE = new TaxesDue(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
            BigDecimal.ZERO, BigDecimal.ZERO);

    @NonNull private final BigDecimal federal;
    @NonNull private final BigDecimal state;
    @NonNull private final BigDecimal socialSecurity;
    @NonNull private final BigDecimal medicare;
    /**
     * Flat penalty on retirement money taken out before the federal retirement age.
     */
    @NonNull private final BigDecimal earlyWithdrawalPenalty;

    public TaxesDue(BigDecimal federal,
                    BigDecimal state,
                    BigDecimal socialSecurity,
                    BigDecimal medicare,
                    BigDecimal earlyWithdrawalPenalty) {
        this.federal = Objects.requireNonNull(federal, "federal must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.socialSecurity = Objects.requireNonNull(socialSecurity, "socialSecurity must not be null");
        this.medicare = Objects.requireNonNull(medicare, "medicare must not be null");
        this.earlyWithdrawalPenalty = Objects.requireNonNull(earlyWithdrawalPenalty, "earlyWithdrawalPenalty must not be null");
    }

    /**
     * @return sum of all components
     */
    public BigDecimal total() {
        return federal.add(state).add(socialSecurity).add(medicare).add(earlyWithdrawalPenalty);
    }
}
