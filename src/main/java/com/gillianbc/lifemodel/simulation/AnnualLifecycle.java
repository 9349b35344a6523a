package com.gillianbc.lifemodel.simulation;

/**
 * Three-phase yearly contract. The model runs {@link #preStep()} for every entity,
 * then {@link #step()} for every entity, then {@link #postStep()} for every entity.
 * Within a phase entities run in construction order, so an entity may rely on the
 * entities built before it, such as its owner, having already run that phase.
 * An account's required distribution is sized on its owner's age after that year's increment.
 */
public interface AnnualLifecycle {

    /**
     * Ageing, income posting, required distributions, premiums and anything else
     * that must be visible before settlement.
     */
    default void preStep() {
    }

    /**
     * Main yearly business logic, e.g. settlement or growth.
     */
    default void step() {
    }

    /**
     * Resets year-scoped accumulators and records year-end balances.
     */
    default void postStep() {
    }
}
