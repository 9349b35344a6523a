package com.gillianbc.lifemodel.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.gillianbc.lifemodel.MoneyAssertions.assertMoney;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TaxBracketTest {

    @Test
    @DisplayName("Only the part of income inside the bracket is taxed")
    void taxOn_incomeAcrossBracket_taxesOnlyBracketWidth() {
        TaxBracket bracket = new TaxBracket(new BigDecimal("10276"), new BigDecimal("41775"), BigDecimal.valueOf(12));
        assertMoney("0", bracket.taxOn(new BigDecimal("10000")));
        assertMoney("120", bracket.taxOn(new BigDecimal("11276")));
        assertMoney("3779.88", bracket.taxOn(new BigDecimal("100000")));
    }

    @Test
    @DisplayName("An unbounded bracket taxes everything above its start")
    void taxOn_unbounded_taxesAllAboveStart() {
        TaxBracket top = new TaxBracket(new BigDecimal("539901"), null, BigDecimal.valueOf(37));
        assertFalse(top.getEnd().isPresent());
        assertMoney("37000", top.taxOn(new BigDecimal("639901")));
    }

    @Test
    @DisplayName("End below start or negative rate throws IllegalArgumentException")
    void constructor_invalidRow_throws() {
        assertThrows(IllegalArgumentException.class,
                () -> new TaxBracket(BigDecimal.TEN, BigDecimal.ONE, BigDecimal.ONE));
        assertThrows(IllegalArgumentException.class,
                () -> new TaxBracket(BigDecimal.ZERO, BigDecimal.TEN, BigDecimal.valueOf(-1)));
    }
}
