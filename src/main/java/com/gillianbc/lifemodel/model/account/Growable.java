package com.gillianbc.lifemodel.model.account;

import java.math.BigDecimal;
import java.util.List;

/**
 * A balance that grows once per simulated year at a configured rate.
 */
public interface Growable extends BalanceBearing {

    /**
     * @return growth for one year on the current balance; does not change the balance
     */
    BigDecimal calculateGrowth();

    /**
     * Deposits {@link #calculateGrowth()} and appends it to the growth history.
     *
     * @return the growth applied
     */
    BigDecimal applyGrowth();

    List<BigDecimal> getGrowthHistory();
}
