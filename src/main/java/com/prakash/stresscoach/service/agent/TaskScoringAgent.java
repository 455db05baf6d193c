package com.prakash.stresscoach.service.agent;

import com.prakash.stresscoach.model.ScoredTask;
import com.prakash.stresscoach.model.Task;
import com.prakash.stresscoach.model.TaskPriority;
import com.prakash.stresscoach.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;

/**
 * Rule-based scoring of tasks against the user's current stress level.
 * Every method is a pure function of its inputs and the injected clock.
 */
@Service
public class TaskScoringAgent {

    private static final Logger log = LoggerFactory.getLogger(TaskScoringAgent.class);

    static final double NO_DEADLINE_URGENCY = 0.2;
    static final double DEFAULT_IMPORTANCE = 0.6;

    private static final double URGENCY_WEIGHT = 0.5;
    private static final double IMPORTANCE_WEIGHT = 0.3;
    private static final double COMPATIBILITY_WEIGHT = 0.2;

    private static final List<String> COMPLEX_KEYWORDS =
            List.of("analysis", "research", "development", "complex", "detailed");
    private static final List<String> SIMPLE_KEYWORDS =
            List.of("update", "check", "review", "simple", "quick");

    private static final List<String> DEEP_WORK_KEYWORDS = List.of("code", "develop", "analysis");
    private static final List<String> CREATIVE_KEYWORDS = List.of("design", "create", "brainstorm");
    private static final List<String> ADMINISTRATIVE_KEYWORDS = List.of("email", "meeting", "plan");

    private final Clock clock;

    @Autowired
    public TaskScoringAgent(Clock clock) {
        this.clock = clock;
    }

    /**
     * Scores a single task.
     *
     * @param task        the task to score
     * @param stressLevel the user's stress level, 0 to 10
     * @return the task decorated with urgency, importance, complexity, type, compatibility and final priority
     */
    public ScoredTask score(Task task, int stressLevel) {
        double urgency = deadlineUrgency(task);
        double importance = importance(task.getPriority());
        double complexity = complexity(task.getTitle());
        double compatibility = stressCompatibility(complexity, stressLevel);
        double finalPriority = urgency * URGENCY_WEIGHT
                + importance * IMPORTANCE_WEIGHT
                + compatibility * COMPATIBILITY_WEIGHT;

        ScoredTask scored = ScoredTask.builder()
                .task(task)
                .deadlineUrgency(urgency)
                .importance(importance)
                .complexityScore(complexity)
                .taskType(classify(task.getTitle()))
                .stressCompatibility(compatibility)
                .finalPriority(finalPriority)
                .build();
        log.debug("Scored task {} '{}': urgency={}, importance={}, complexity={}, compatibility={}, final={}",
                task.getId(), task.getTitle(), urgency, importance, complexity, compatibility, finalPriority);
        return scored;
    }

    /**
     * Stepped urgency by hours until the deadline. Missing or unreadable deadlines score 0.2.
     */
    public double deadlineUrgency(Task task) {
        if (!task.hasDeadline()) {
            return NO_DEADLINE_URGENCY;
        }
        LocalDateTime deadline = parseDeadline(task.getDeadline());
        if (deadline == null) {
            log.warn("Unparseable deadline '{}' for task {}. Treating as no deadline.", task.getDeadline(), task.getId());
            return NO_DEADLINE_URGENCY;
        }
        double hoursUntil = Duration.between(LocalDateTime.now(clock), deadline).toMillis() / 3_600_000.0;
        if (hoursUntil <= 6) return 1.0;
        if (hoursUntil <= 24) return 0.9;
        if (hoursUntil <= 48) return 0.7;
        if (hoursUntil <= 168) return 0.5;
        return 0.3;
    }

    public double importance(TaskPriority priority) {
        if (priority == null) {
            return DEFAULT_IMPORTANCE;
        }
        switch (priority) {
            case HIGH:
                return 1.0;
            case LOW:
                return 0.3;
            default:
                return DEFAULT_IMPORTANCE;
        }
    }

    public double complexity(String title) {
        String lower = lower(title);
        double score = 0.5;
        if (containsAny(lower, COMPLEX_KEYWORDS)) score += 0.2;
        if (containsAny(lower, SIMPLE_KEYWORDS)) score -= 0.2;
        return Math.max(0.1, Math.min(1.0, score));
    }

    public TaskType classify(String title) {
        String lower = lower(title);
        if (containsAny(lower, DEEP_WORK_KEYWORDS)) return TaskType.DEEP_WORK;
        if (containsAny(lower, CREATIVE_KEYWORDS)) return TaskType.CREATIVE;
        if (containsAny(lower, ADMINISTRATIVE_KEYWORDS)) return TaskType.ADMINISTRATIVE;
        return TaskType.ROUTINE;
    }

    public double stressCompatibility(double complexity, int stressLevel) {
        return Math.max(0.1, 1.0 - complexity * stressLevel / 10.0 * 0.7);
    }

    /**
     * Accepts an offset or zoned timestamp, a local date-time, or a plain date (start of day).
     * Timestamps carrying an offset are converted into the clock's zone.
     *
     * @return the deadline as local time in the clock's zone, or {@code null} if unreadable
     */
    LocalDateTime parseDeadline(String raw) {
        String text = raw.trim();
        try {
            if (!text.contains("T")) {
                return LocalDate.parse(text).atStartOfDay();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime) {
                return ((ZonedDateTime) parsed).withZoneSameInstant(clock.getZone()).toLocalDateTime();
            }
            return (LocalDateTime) parsed;
        } catch (DateTimeParseException e) {
            log.debug("Deadline '{}' did not match any accepted format: {}", raw, e.getMessage());
            return null;
        }
    }

    private static String lower(String title) {
        return title == null ? "" : title.toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
