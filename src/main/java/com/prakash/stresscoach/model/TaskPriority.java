package com.prakash.stresscoach.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskPriority {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup used for JSON and quick-entry input.
     * Unknown values map to {@code null} so the caller applies the default (MEDIUM).
     */
    @JsonCreator
    public static TaskPriority fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (TaskPriority priority : values()) {
            if (priority.name().equalsIgnoreCase(value.trim())) {
                return priority;
            }
        }
        return null;
    }
}
