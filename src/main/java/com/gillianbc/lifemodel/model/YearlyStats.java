package com.gillianbc.lifemodel.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of the aggregated statistics for one simulated year.
 */
@Getter
@ToString
@EqualsAndHashCode
public class YearlyStats {

    private final int year;
    private final Map<Stat, BigDecimal> values;

    public YearlyStats(int year, Map<Stat, BigDecimal> values) {
        Objects.requireNonNull(values, "values must not be null");
        this.year = year;
        EnumMap<Stat, BigDecimal> copy = new EnumMap<>(Stat.class);
        for (Stat stat : Stat.values()) {
            copy.put(stat, values.getOrDefault(stat, BigDecimal.ZERO));
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public BigDecimal get(Stat stat) {
        return values.get(stat);
    }
}
