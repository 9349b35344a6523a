package com.gillianbc.lifemodel.simulation;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

@Getter
@ToString
@EqualsAndHashCode
public class Event {

    private final int year;
    private final String message;

    public Event(int year, String message) {
        this.year = year;
        this.message = Objects.requireNonNull(message, "message must not be null");
    }
}
