package com.prakash.stresscoach.service.agent;

import com.prakash.stresscoach.dto.PostponementSuggestion;
import com.prakash.stresscoach.dto.ScheduleInsights;
import com.prakash.stresscoach.dto.StressAnalysis;
import com.prakash.stresscoach.dto.TaskAnalysis;
import com.prakash.stresscoach.dto.WorkloadAlert;
import com.prakash.stresscoach.model.CompletionStatus;
import com.prakash.stresscoach.model.ScheduleItem;
import com.prakash.stresscoach.model.Task;
import com.prakash.stresscoach.model.TaskPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Reduces a finished schedule into totals, stress guidance and recommendations,
 * and adds per-item guidance notes. Holds no state between calls.
 */
@Service
public class ScheduleSummaryAgent {

    private static final Logger log = LoggerFactory.getLogger(ScheduleSummaryAgent.class);

    static final int HIGH_STRESS = 7;
    static final int POSTPONE_STRESS = 8;
    static final int LONG_TASK_MINUTES = 60;

    public StressAnalysis analyzeStress(int stressLevel) {
        return StressAnalysis.builder()
                .level(stressLevel)
                .impact(stressImpact(stressLevel))
                .recommendedActions(stressActions(stressLevel))
                .build();
    }

    public TaskAnalysis analyzeTasks(List<ScheduleItem> items) {
        return TaskAnalysis.builder()
                .totalTasks(items.size())
                .scheduledTasks(scheduledCount(items))
                .build();
    }

    public ScheduleInsights buildInsights(List<ScheduleItem> items, int stressLevel, String mood) {
        double totalWorkHours = items.stream().mapToLong(ScheduleItem::getAllocatedMinutes).sum() / 60.0;
        double averageConfidence = items.stream().mapToDouble(ScheduleItem::getConfidence).average().orElse(0.0);

        ScheduleInsights insights = ScheduleInsights.builder()
                .totalWorkHours(totalWorkHours)
                .averageConfidence(averageConfidence)
                .moodOptimization("Schedule optimized for " + mood + " mood state")
                .recommendations(recommendations(items, stressLevel))
                .workloadAlerts(workloadAlerts(totalWorkHours, stressLevel))
                .postponementSuggestions(postponementSuggestions(items, stressLevel))
                .build();
        log.debug("Built insights: {} work hours, average confidence {}, {} alerts",
                totalWorkHours, averageConfidence, insights.getWorkloadAlerts().size());
        return insights;
    }

    /**
     * Appends stress, mood and priority guidance to the notes of every item that received time.
     * The allocation note stays first.
     */
    public void addGuidanceNotes(List<ScheduleItem> items, int stressLevel, String mood) {
        for (ScheduleItem item : items) {
            if (item.isScheduled()) {
                item.getNotes().addAll(guidanceNotes(item.getTask(), stressLevel, mood));
            }
        }
    }

    List<String> guidanceNotes(Task task, int stressLevel, String mood) {
        List<String> notes = new ArrayList<>();
        if (stressLevel >= HIGH_STRESS) {
            if (task.getEstimatedDurationMinutes() > LONG_TASK_MINUTES) {
                notes.add("Consider breaking this task into smaller chunks due to high stress");
            }
            notes.add("Take short breaks every 25 minutes to maintain focus");
        }

        String moodKey = mood == null ? "" : mood.trim().toLowerCase(Locale.ROOT);
        switch (moodKey) {
            case "tired":
                notes.add("This might feel challenging given your current energy level");
                break;
            case "energetic":
                notes.add("Good time to tackle this with your current energy");
                break;
            case "scattered":
                notes.add("Try minimizing distractions while working on this task");
                break;
            default:
                break;
        }

        if (task.getPriority() == TaskPriority.HIGH) {
            notes.add("High priority task - focus on completion");
        }
        return notes;
    }

    public String stressImpact(int stressLevel) {
        if (stressLevel >= 8) return "High stress significantly limits task capacity";
        if (stressLevel >= 5) return "Moderate stress affects task selection";
        return "Low stress allows for optimal productivity";
    }

    public List<String> stressActions(int stressLevel) {
        if (stressLevel >= HIGH_STRESS) return List.of("simplify_tasks", "add_breaks", "postpone_non_urgent");
        if (stressLevel >= 4) return List.of("balance_tasks", "moderate_breaks");
        return List.of("challenge_optimal", "minimal_breaks");
    }

    List<String> recommendations(List<ScheduleItem> items, int stressLevel) {
        List<String> recommendations = new ArrayList<>();
        long unscheduled = countByStatus(items, CompletionStatus.NOT_SCHEDULED);
        long partial = countByStatus(items, CompletionStatus.PARTIAL);

        if (scheduledCount(items) == items.size()) {
            recommendations.add("All tasks successfully scheduled!");
        } else {
            if (unscheduled > 0) {
                recommendations.add(unscheduled + " tasks need additional time slots - consider extending your schedule");
            }
            if (partial > 0) {
                recommendations.add(partial + " tasks are partially scheduled - plan follow-up sessions");
            }
        }
        if (stressLevel >= HIGH_STRESS) {
            recommendations.add("High stress detected - take breaks between tasks");
        }
        return recommendations;
    }

    List<WorkloadAlert> workloadAlerts(double totalWorkHours, int stressLevel) {
        List<WorkloadAlert> alerts = new ArrayList<>();
        if (stressLevel >= HIGH_STRESS && totalWorkHours > 6) {
            alerts.add(WorkloadAlert.builder()
                    .type(WorkloadAlert.HIGH_STRESS_HEAVY_WORKLOAD)
                    .message("High stress level combined with heavy workload detected")
                    .suggestedAction("Consider rescheduling non-urgent tasks or adding more breaks")
                    .totalWorkHours(totalWorkHours)
                    .stressLevel(stressLevel)
                    .build());
        }
        if (totalWorkHours > 8) {
            alerts.add(WorkloadAlert.builder()
                    .type(WorkloadAlert.EXCESSIVE_WORKLOAD)
                    .message("Schedule exceeds recommended daily work hours")
                    .suggestedAction("Consider postponing some tasks to maintain productivity and wellbeing")
                    .totalWorkHours(totalWorkHours)
                    .stressLevel(stressLevel)
                    .build());
        }
        return alerts;
    }

    /**
     * Under very high stress, flexible low-priority work that did get time is a candidate for another day.
     */
    List<PostponementSuggestion> postponementSuggestions(List<ScheduleItem> items, int stressLevel) {
        if (stressLevel < POSTPONE_STRESS) {
            return new ArrayList<>();
        }
        return items.stream()
                .filter(ScheduleItem::isScheduled)
                .filter(item -> item.getTask().getPriority() == TaskPriority.LOW && item.getTask().isFlexible())
                .map(item -> PostponementSuggestion.builder()
                        .taskId(item.getTask().getId())
                        .taskTitle(item.getTask().getTitle())
                        .reason("High stress level reduces effectiveness for non-urgent tasks")
                        .suggestedNewTime("Tomorrow or when stress level decreases")
                        .build())
                .collect(Collectors.toList());
    }

    private static int scheduledCount(List<ScheduleItem> items) {
        return (int) items.stream().filter(ScheduleItem::isScheduled).count();
    }

    private static long countByStatus(List<ScheduleItem> items, CompletionStatus status) {
        return items.stream().filter(item -> item.getStatus() == status).count();
    }
}
