package com.prakash.stresscoach.service;

import com.prakash.stresscoach.config.SchedulerProperties;
import com.prakash.stresscoach.dto.QuickScheduleRequest;
import com.prakash.stresscoach.dto.ScheduleMetadata;
import com.prakash.stresscoach.dto.ScheduleRequest;
import com.prakash.stresscoach.dto.ScheduleResult;
import com.prakash.stresscoach.dto.StressAnalysis;
import com.prakash.stresscoach.dto.TaskRequest;
import com.prakash.stresscoach.dto.TimeWindowRequest;
import com.prakash.stresscoach.exception.InvalidScheduleRequestException;
import com.prakash.stresscoach.model.ScheduleItem;
import com.prakash.stresscoach.model.ScoredTask;
import com.prakash.stresscoach.model.Task;
import com.prakash.stresscoach.model.TaskPriority;
import com.prakash.stresscoach.model.TimeWindow;
import com.prakash.stresscoach.service.agent.ScheduleSummaryAgent;
import com.prakash.stresscoach.service.agent.TaskScoringAgent;
import com.prakash.stresscoach.service.allocation.TaskAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry point of the scheduling engine: validates input, scores every task,
 * hands the scored tasks to the allocator and summarizes the outcome.
 * <p>
 * The service keeps no state between calls; each call builds its own task,
 * window and capacity objects.
 */
@Service
public class StressSchedulingService {

    private static final Logger log = LoggerFactory.getLogger(StressSchedulingService.class);

    static final String ANALYSIS_METHOD = "Rule-based greedy allocator";

    private final TaskScoringAgent taskScoringAgent;
    private final TaskAllocator taskAllocator;
    private final ScheduleSummaryAgent scheduleSummaryAgent;
    private final TaskInputParser taskInputParser;
    private final SchedulerProperties properties;
    private final Clock clock;

    @Autowired
    public StressSchedulingService(TaskScoringAgent taskScoringAgent,
                                   TaskAllocator taskAllocator,
                                   ScheduleSummaryAgent scheduleSummaryAgent,
                                   TaskInputParser taskInputParser,
                                   SchedulerProperties properties,
                                   Clock clock) {
        this.taskScoringAgent = taskScoringAgent;
        this.taskAllocator = taskAllocator;
        this.scheduleSummaryAgent = scheduleSummaryAgent;
        this.taskInputParser = taskInputParser;
        this.properties = properties;
        this.clock = clock;
    }

    public ScheduleResult schedule(ScheduleRequest request) {
        return schedule(toTasks(request.getTasks()), toWindows(request.getWindows()),
                request.getStressLevel(), request.getMood());
    }

    public ScheduleResult scheduleQuickEntry(QuickScheduleRequest request) {
        List<Task> tasks = taskInputParser.parseTasks(request.getTasksText());
        List<TimeWindow> windows = taskInputParser.parseWindows(request.getWindowsText());
        return schedule(tasks, windows, request.getStressLevel(), request.getMood());
    }

    /**
     * Produces a schedule with exactly one item per task, in input order.
     *
     * @param tasks       tasks to place; must not be empty
     * @param windows     available time windows; must not be empty and each must have a positive duration
     * @param stressLevel current stress level, 0 to 10
     * @param mood        free-form mood tag, informational only
     * @return the schedule together with stress analysis and insights
     * @throws InvalidScheduleRequestException if the input fails validation; nothing is allocated in that case
     */
    public ScheduleResult schedule(List<Task> tasks, List<TimeWindow> windows, int stressLevel, String mood) {
        validate(tasks, windows, stressLevel);
        String effectiveMood = mood == null || mood.isBlank() ? properties.getDefaultMood() : mood;
        log.info("Scheduling {} tasks into {} windows at stress level {} ({} mood)",
                tasks.size(), windows.size(), stressLevel, effectiveMood);

        List<ScoredTask> scoredTasks = tasks.stream()
                .map(task -> taskScoringAgent.score(task, stressLevel))
                .collect(Collectors.toList());
        List<ScheduleItem> items = taskAllocator.allocate(scoredTasks, windows);
        scheduleSummaryAgent.addGuidanceNotes(items, stressLevel, effectiveMood);

        ScheduleResult result = ScheduleResult.builder()
                .items(items)
                .stressAnalysis(scheduleSummaryAgent.analyzeStress(stressLevel))
                .taskAnalysis(scheduleSummaryAgent.analyzeTasks(items))
                .insights(scheduleSummaryAgent.buildInsights(items, stressLevel, effectiveMood))
                .metadata(ScheduleMetadata.builder()
                        .analysisMethod(ANALYSIS_METHOD)
                        .generatedAt(LocalDateTime.now(clock))
                        .totalRequestedMinutes(tasks.stream().mapToLong(Task::getEstimatedDurationMinutes).sum())
                        .totalAvailableMinutes(windows.stream().mapToLong(TimeWindow::getDurationMinutes).sum())
                        .build())
                .build();
        log.info("Schedule ready: {}/{} tasks scheduled, {} work hours",
                result.getTaskAnalysis().getScheduledTasks(), tasks.size(), result.getInsights().getTotalWorkHours());
        return result;
    }

    /**
     * Scores tasks without placing them.
     *
     * @return scored tasks, highest final priority first; ties keep input order
     */
    public List<ScoredTask> scoreTasks(List<TaskRequest> requests, int stressLevel) {
        validateStressLevel(stressLevel);
        List<Task> tasks = toTasks(requests);
        validateTasks(tasks);
        return tasks.stream()
                .map(task -> taskScoringAgent.score(task, stressLevel))
                .sorted(Comparator.comparingDouble(ScoredTask::getFinalPriority).reversed())
                .collect(Collectors.toList());
    }

    public StressAnalysis stressProfile(int stressLevel) {
        validateStressLevel(stressLevel);
        return scheduleSummaryAgent.analyzeStress(stressLevel);
    }

    // --- Input conversion ---

    List<Task> toTasks(List<TaskRequest> requests) {
        if (requests == null) {
            return new ArrayList<>();
        }
        long stamp = clock.millis();
        List<Task> tasks = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            TaskRequest request = requests.get(i);
            tasks.add(Task.builder()
                    .id(request.getId() != null && !request.getId().isBlank() ? request.getId() : "task_" + stamp + "_" + i)
                    .title(request.getTitle())
                    .description(request.getDescription())
                    .estimatedDurationMinutes(request.getEstimatedDurationMinutes() != null
                            ? request.getEstimatedDurationMinutes() : properties.getDefaultDurationMinutes())
                    .priority(request.getPriority() != null ? request.getPriority() : TaskPriority.MEDIUM)
                    .category(request.getCategory() != null ? request.getCategory() : properties.getDefaultCategory())
                    .deadline(request.getDeadline())
                    .flexible(request.getFlexible() == null || request.getFlexible())
                    .build());
        }
        return tasks;
    }

    List<TimeWindow> toWindows(List<TimeWindowRequest> requests) {
        if (requests == null) {
            return new ArrayList<>();
        }
        List<TimeWindow> windows = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            TimeWindowRequest request = requests.get(i);
            windows.add(TimeWindow.builder()
                    .id(request.getId() != null && !request.getId().isBlank() ? request.getId() : "window_" + (i + 1))
                    .startTime(request.getStartTime())
                    .endTime(request.getEndTime())
                    .label(request.getLabel() != null && !request.getLabel().isBlank() ? request.getLabel() : "Time slot " + (i + 1))
                    .build());
        }
        return windows;
    }

    // --- Validation ---

    private void validate(List<Task> tasks, List<TimeWindow> windows, int stressLevel) {
        validateStressLevel(stressLevel);
        if (windows == null || windows.isEmpty()) {
            reject("Time windows cannot be empty");
        }
        if (windows.size() > properties.getMaxWindows()) {
            reject("Too many time windows: " + windows.size() + " (limit " + properties.getMaxWindows() + ")");
        }
        validateTasks(tasks);
        for (TimeWindow window : windows) {
            if (window.getStartTime() == null || window.getEndTime() == null) {
                reject("Time window " + window.getId() + " needs both a start and an end time");
            }
            if (!window.getEndTime().isAfter(window.getStartTime())) {
                reject("Time window " + window.getId() + " must end after it starts");
            }
            // checked first so getDurationMinutes stays within int range
            if (Duration.between(window.getStartTime(), window.getEndTime()).toMinutes() > properties.getMaxWindowMinutes()) {
                reject("Time window " + window.getId() + " is longer than " + properties.getMaxWindowMinutes() + " minutes");
            }
            if (window.getDurationMinutes() <= 0) {
                reject("Time window " + window.getId() + " is shorter than one minute");
            }
        }
    }

    private void validateTasks(List<Task> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            reject("Task list cannot be empty");
        }
        if (tasks.size() > properties.getMaxTasks()) {
            reject("Too many tasks: " + tasks.size() + " (limit " + properties.getMaxTasks() + ")");
        }
        for (Task task : tasks) {
            if (task.getTitle() == null || task.getTitle().isBlank()) {
                reject("Task " + task.getId() + " needs a title");
            }
            if (task.getEstimatedDurationMinutes() <= 0) {
                reject("Task '" + task.getTitle() + "' must have a positive duration");
            }
            if (task.getEstimatedDurationMinutes() > properties.getMaxTaskMinutes()) {
                reject("Task '" + task.getTitle() + "' is longer than " + properties.getMaxTaskMinutes() + " minutes");
            }
        }
    }

    private void validateStressLevel(int stressLevel) {
        if (stressLevel < 0 || stressLevel > 10) {
            reject("Stress level must be between 0 and 10, got " + stressLevel);
        }
    }

    private void reject(String message) {
        log.warn("Rejecting schedule request: {}", message);
        throw new InvalidScheduleRequestException(message);
    }
}
