package com.prakash.stresscoach.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The outcome for one input task. Exactly one item exists per task.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleItem {

    private Task task;
    private TimeWindow window; // null while not scheduled
    private int allocatedMinutes;
    private CompletionStatus status;
    private double confidence;
    private double deadlineUrgency;

    @Builder.Default
    private List<String> notes = new ArrayList<>();

    public static ScheduleItem unscheduled(ScoredTask scoredTask, String note) {
        List<String> notes = new ArrayList<>();
        notes.add(note);
        return ScheduleItem.builder()
                .task(scoredTask.getTask())
                .allocatedMinutes(0)
                .status(CompletionStatus.NOT_SCHEDULED)
                .confidence(0.0)
                .deadlineUrgency(scoredTask.getDeadlineUrgency())
                .notes(notes)
                .build();
    }

    public boolean isScheduled() {
        return allocatedMinutes > 0;
    }
}
