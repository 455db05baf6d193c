package com.prakash.stresscoach.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CompletionStatus {
    COMPLETE,      // Whole requested duration placed in one window
    PARTIAL,       // Only part of the requested duration fits; needs a follow-up session
    SCALED,        // Full duration placed, but the day is overcommitted overall
    NOT_SCHEDULED; // No window could take the task

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
