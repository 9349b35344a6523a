package com.gillianbc.lifemodel;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * BigDecimal assertions that ignore scale.
 */
public final class MoneyAssertions {

    private MoneyAssertions() {
    }

    public static void assertMoney(String expected, BigDecimal actual) {
        assertMoney(new BigDecimal(expected), actual);
    }

    public static void assertMoney(BigDecimal expected, BigDecimal actual) {
        assertEquals(0, expected.compareTo(actual), () -> "expected " + expected + " but was " + actual);
    }

    public static void assertMoneyClose(String expected, BigDecimal actual, String tolerance) {
        BigDecimal difference = new BigDecimal(expected).subtract(actual).abs();
        assertTrue(difference.compareTo(new BigDecimal(tolerance)) <= 0,
                () -> "expected " + expected + " +/- " + tolerance + " but was " + actual);
    }
}
