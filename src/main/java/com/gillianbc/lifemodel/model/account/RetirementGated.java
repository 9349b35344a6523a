package com.gillianbc.lifemodel.model.account;

/**
 * A balance that can only be used without penalty from the federal retirement age.
 */
public interface RetirementGated extends BalanceBearing {

    boolean isUsable(int age);
}
