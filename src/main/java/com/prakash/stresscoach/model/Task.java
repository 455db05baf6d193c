package com.prakash.stresscoach.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A unit of work to be placed into the caller's time windows.
 * Instances are built fresh for every scheduling call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    private String id;
    private String title;
    private String description;
    private int estimatedDurationMinutes;
    private TaskPriority priority;
    private String category; // Passthrough only, never scored

    // Raw deadline text as supplied; parsed leniently during scoring
    private String deadline;

    private boolean flexible;

    public boolean hasDeadline() {
        return deadline != null && !deadline.isBlank();
    }
}
