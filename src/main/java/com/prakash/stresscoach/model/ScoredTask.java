package com.prakash.stresscoach.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A task decorated with the scores the allocator orders by.
 * All scores are in [0, 1].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoredTask {

    private Task task;
    private double deadlineUrgency;
    private double importance;
    private double complexityScore;
    private TaskType taskType;
    private double stressCompatibility;
    private double finalPriority;
}
