package com.gillianbc.lifemodel.simulation;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Append-only narration of significant occurrences. Nothing reads it for control flow.
 */
@Slf4j
public class EventLog {

    private final List<Event> events = new ArrayList<>();

    public void add(Event event) {
        Objects.requireNonNull(event, "event must not be null");
        events.add(event);
        log.info("[{}] {}", event.getYear(), event.getMessage());
    }

    public List<Event> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public int size() {
        return events.size();
    }
}
