package com.gillianbc.lifemodel.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * One row of a progressive bracket table: income from {@code start} up to {@code end}
 * is taxed at {@code ratePercent}. A missing end means the bracket is unbounded.
 */
@Getter
@ToString
@EqualsAndHashCode
public class TaxBracket {

    private final BigDecimal start;
    private final BigDecimal end;
    private final BigDecimal ratePercent;

    public TaxBracket(BigDecimal start, BigDecimal end, BigDecimal ratePercent) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.ratePercent = Objects.requireNonNull(ratePercent, "ratePercent must not be null");
        this.end = end;
        if (start.signum() < 0) {
            throw new IllegalArgumentException("bracket start must be >= 0");
        }
        if (ratePercent.signum() < 0) {
            throw new IllegalArgumentException("bracket rate must be >= 0");
        }
        if (end != null && end.compareTo(start) < 0) {
            throw new IllegalArgumentException("bracket end " + end + " is below start " + start);
        }
    }

    public Optional<BigDecimal> getEnd() {
        return Optional.ofNullable(end);
    }

    /**
     * @return {@code min(max(income - start, 0), end - start) * rate / 100}
     */
    public BigDecimal taxOn(BigDecimal income) {
        BigDecimal above = Money.nonNegative(income.subtract(start));
        BigDecimal taxed = end == null ? above : Money.min(above, end.subtract(start));
        return Money.percentOf(taxed, ratePercent);
    }
}
