package com.gillianbc.lifemodel.simulation;

import com.gillianbc.lifemodel.model.Stat;
import lombok.AccessLevel;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for every simulated entity. Constructing an agent registers it with its model,
 * so the model's schedule order is the construction order.
 */
@Getter
public abstract class LifeModelAgent implements AnnualLifecycle {

    private final int uniqueId;
    private final LifeModel model;
    @Getter(AccessLevel.NONE)
    private final Map<Stat, BigDecimal> stats = new EnumMap<>(Stat.class);

    protected LifeModelAgent(LifeModel model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.uniqueId = model.addAgent(this);
    }

    /**
     * Overwrites the value reported for a statistic this year.
     */
    protected void recordStat(Stat stat, BigDecimal value) {
        stats.put(Objects.requireNonNull(stat, "stat must not be null"),
                Objects.requireNonNull(value, "value must not be null"));
    }

    protected void addToStat(Stat stat, BigDecimal value) {
        recordStat(stat, getStat(stat).add(Objects.requireNonNull(value, "value must not be null")));
    }

    public BigDecimal getStat(Stat stat) {
        return stats.getOrDefault(stat, BigDecimal.ZERO);
    }

    public Map<Stat, BigDecimal> getStats() {
        return Collections.unmodifiableMap(new EnumMap<>(stats));
    }

    void resetStats() {
        stats.clear();
    }
}
