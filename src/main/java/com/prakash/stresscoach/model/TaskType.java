package com.prakash.stresscoach.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskType {
    DEEP_WORK,
    CREATIVE,
    ADMINISTRATIVE,
    ROUTINE;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
