package com.gillianbc.lifemodel.simulation;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Objects;

/**
 * An action scheduled for a given simulated year.
 */
@Getter
public class LifeEvent {

    private final int year;
    private final String name;
    @Getter(AccessLevel.NONE)
    private final Runnable action;

    public LifeEvent(int year, String name, Runnable action) {
        this.year = year;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.action = Objects.requireNonNull(action, "action must not be null");
    }

    /**
     * Runs the action if it is scheduled for {@code currentYear}.
     *
     * @return true if the action ran
     */
    boolean fireIfDue(int currentYear) {
        if (year != currentYear) {
            return false;
        }
        action.run();
        return true;
    }
}
