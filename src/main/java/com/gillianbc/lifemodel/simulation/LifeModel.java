package com.gillianbc.lifemodel.simulation;

import com.gillianbc.lifemodel.config.FinancialConfig;
import com.gillianbc.lifemodel.model.Stat;
import com.gillianbc.lifemodel.model.YearlyStats;
import com.gillianbc.lifemodel.service.PaymentService;
import com.gillianbc.lifemodel.service.RetirementRules;
import com.gillianbc.lifemodel.service.SettlementService;
import com.gillianbc.lifemodel.service.TaxCalculator;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Simulation clock and scheduler.
 * <p>
 * The model moves from {@code startYear} through {@code endYear} inclusive. Each {@link #step()}
 * records the current year and a statistics snapshot of the current state, then runs the
 * pre-step, step and post-step phases over every agent in registration order, then advances
 * the year. Once the year passes {@code endYear} the model is finished.
 * <p>
 * Runs are deterministic: the same configuration and construction order always produce the
 * same statistics.
 */
@Slf4j
@Getter
public class LifeModel {

    private final int startYear;
    private final int endYear;
    private int year;

    private final FinancialConfig config;
    private final TaxCalculator taxCalculator;
    private final RetirementRules retirementRules;
    private final SettlementService settlementService;
    private final PaymentService paymentService;

    private final ModelRegistries registries = new ModelRegistries();
    private final EventLog eventLog = new EventLog();

    @Getter(AccessLevel.NONE)
    private final List<LifeModelAgent> agents = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final List<Integer> simulatedYears = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final List<YearlyStats> yearlyStats = new ArrayList<>();

    public LifeModel(int startYear, int endYear) {
        this(startYear, endYear, FinancialConfig.defaults());
    }

    public LifeModel(int startYear, int endYear, FinancialConfig config) {
        this(startYear, endYear, config, new TaxCalculator(config), new RetirementRules(config),
                new PaymentService());
    }

    private LifeModel(int startYear, int endYear, FinancialConfig config, TaxCalculator taxCalculator,
                      RetirementRules retirementRules, PaymentService paymentService) {
        this(startYear, endYear, config, taxCalculator, retirementRules,
                new SettlementService(taxCalculator), paymentService);
    }

    public LifeModel(int startYear,
                     int endYear,
                     FinancialConfig config,
                     TaxCalculator taxCalculator,
                     RetirementRules retirementRules,
                     SettlementService settlementService,
                     PaymentService paymentService) {
        if (endYear < startYear) {
            throw new IllegalArgumentException("endYear (" + endYear + ") must not be before startYear (" + startYear + ")");
        }
        this.startYear = startYear;
        this.endYear = endYear;
        this.year = startYear;
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.taxCalculator = Objects.requireNonNull(taxCalculator, "taxCalculator must not be null");
        this.retirementRules = Objects.requireNonNull(retirementRules, "retirementRules must not be null");
        this.settlementService = Objects.requireNonNull(settlementService, "settlementService must not be null");
        this.paymentService = Objects.requireNonNull(paymentService, "paymentService must not be null");
    }

    /**
     * Adds an agent to the schedule.
     *
     * @return the agent's unique id
     */
    int addAgent(LifeModelAgent agent) {
        agents.add(agent);
        return agents.size();
    }

    public List<LifeModelAgent> getAgents() {
        return Collections.unmodifiableList(agents);
    }

    public List<Integer> getSimulatedYears() {
        return Collections.unmodifiableList(simulatedYears);
    }

    public List<YearlyStats> getYearlyStats() {
        return Collections.unmodifiableList(yearlyStats);
    }

    public boolean isFinished() {
        return year > endYear;
    }

    /**
     * Simulates the current year.
     *
     * @throws IllegalStateException if the model has already simulated {@code endYear}
     */
    public void step() {
        if (isFinished()) {
            throw new IllegalStateException("Simulation already finished at " + endYear);
        }
        simulatedYears.add(year);
        yearlyStats.add(currentStats());

        // agents created during a phase join from the next phase on
        for (LifeModelAgent agent : List.copyOf(agents)) {
            agent.resetStats();
        }
        for (LifeModelAgent agent : List.copyOf(agents)) {
            agent.preStep();
        }
        for (LifeModelAgent agent : List.copyOf(agents)) {
            agent.step();
        }
        for (LifeModelAgent agent : List.copyOf(agents)) {
            agent.postStep();
        }
        year++;
    }

    /**
     * Steps through every remaining year up to and including {@code endYear}.
     */
    public void run() {
        log.info("Running life model {}-{} with {} agents{}", year, endYear, agents.size(),
                config.getScenario() == null ? "" : " (scenario " + config.getScenario() + ")");
        while (!isFinished()) {
            step();
        }
        log.info("Life model finished after {} years, {} events", simulatedYears.size(), eventLog.size());
    }

    /**
     * Sums every agent's statistics as they stand now.
     */
    public YearlyStats currentStats() {
        Map<Stat, BigDecimal> totals = new EnumMap<>(Stat.class);
        for (LifeModelAgent agent : agents) {
            agent.getStats().forEach((stat, value) -> totals.merge(stat, value, BigDecimal::add));
        }
        return new YearlyStats(year, totals);
    }

    public void logEvent(String message) {
        eventLog.add(new Event(year, message));
    }

    /**
     * @return the year in which someone currently {@code currentAge} turns {@code age}
     */
    public int yearAtAge(int currentAge, int age) {
        return year + (age - currentAge);
    }
}
