package com.gillianbc.lifemodel.simulation;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Agent that fires scheduled {@link LifeEvent}s during the step phase of their year.
 * Each event fires at most once.
 */
@Slf4j
public class LifeEvents extends LifeModelAgent {

    private final List<LifeEvent> pending = new ArrayList<>();

    public LifeEvents(LifeModel model) {
        super(model);
    }

    public LifeEvents add(LifeEvent event) {
        pending.add(Objects.requireNonNull(event, "event must not be null"));
        return this;
    }

    public LifeEvents add(int year, String name, Runnable action) {
        return add(new LifeEvent(year, name, action));
    }

    public List<LifeEvent> getPending() {
        return Collections.unmodifiableList(pending);
    }

    @Override
    public void step() {
        int year = getModel().getYear();
        // actions may schedule further events, so iterate over a copy
        for (LifeEvent event : List.copyOf(pending)) {
            if (event.fireIfDue(year)) {
                pending.remove(event);
                log.debug("Fired life event '{}' in {}", event.getName(), year);
            }
        }
    }
}
