package com.fleetmind.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status of the single active task held by a worker. {@link #DONE} is terminal.
 */
public enum TaskStatus {
    BLOCKED,
    ASSIGNED,
    DONE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Task status cannot be empty");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    public boolean terminal() {
        return this == DONE;
    }
}
