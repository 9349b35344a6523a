package com.gillianbc.lifemodel.model.benefit;

import java.math.BigDecimal;

/**
 * A benefit paying a yearly amount once its conditions are met.
 */
public interface PeriodicBenefit {

    /**
     * @return the yearly amount payable now, zero when not eligible
     */
    BigDecimal getAnnualBenefit();

    boolean isEligible();
}
