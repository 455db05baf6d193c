package com.prakash.stresscoach.service;

import com.prakash.stresscoach.config.SchedulerProperties;
import com.prakash.stresscoach.exception.InvalidScheduleRequestException;
import com.prakash.stresscoach.model.Task;
import com.prakash.stresscoach.model.TaskPriority;
import com.prakash.stresscoach.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Parses the line-oriented quick-entry format into tasks and time windows.
 * <pre>
 * Write design doc | 90 | high | 2026-10-20T17:00
 * Reply to emails | 30 | low
 * </pre>
 * <pre>
 * 09:00-11:00 Morning focus
 * 14:00-15:30
 * </pre>
 */
@Component
public class TaskInputParser {

    private static final Logger log = LoggerFactory.getLogger(TaskInputParser.class);
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("H:mm");

    private final Clock clock;
    private final SchedulerProperties properties;

    @Autowired
    public TaskInputParser(Clock clock, SchedulerProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Only the title is required on each line. A duration that is not a positive integer
     * falls back to the configured default; an unknown priority becomes MEDIUM.
     */
    public List<Task> parseTasks(String text) {
        List<String> lines = nonBlankLines(text);
        long stamp = clock.millis();
        List<Task> tasks = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String[] parts = Arrays.stream(lines.get(i).split("\\|")).map(String::trim).toArray(String[]::new);
            String title = parts.length > 0 && !parts[0].isEmpty() ? parts[0] : "Task " + (i + 1);
            TaskPriority priority = parts.length > 2 ? TaskPriority.fromValue(parts[2]) : null;

            tasks.add(Task.builder()
                    .id("task_" + stamp + "_" + i)
                    .title(title)
                    .description("Task: " + title)
                    .estimatedDurationMinutes(parts.length > 1 ? parseDuration(parts[1]) : properties.getDefaultDurationMinutes())
                    .priority(priority != null ? priority : TaskPriority.MEDIUM)
                    .category(properties.getDefaultCategory())
                    .deadline(parts.length > 3 && !parts[3].isEmpty() ? parts[3] : null)
                    .flexible(true)
                    .build());
        }
        log.debug("Parsed {} tasks from quick entry", tasks.size());
        return tasks;
    }

    /**
     * Each line is a time range on today's date, optionally followed by a label.
     *
     * @throws InvalidScheduleRequestException if a line has no readable {@code HH:mm-HH:mm} range
     */
    public List<TimeWindow> parseWindows(String text) {
        List<String> lines = nonBlankLines(text);
        LocalDate today = LocalDate.now(clock);
        List<TimeWindow> windows = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            String[] parts = line.split("\\s+", 2);
            String range = parts[0];
            int dash = range.indexOf('-');
            if (dash < 0) {
                throw new InvalidScheduleRequestException("Invalid time slot format on line " + (i + 1)
                        + ": '" + line + "'. Expected e.g. '09:00-11:00 Morning work'");
            }
            LocalTime start = parseTime(range.substring(0, dash), line, i);
            LocalTime end = parseTime(range.substring(dash + 1), line, i);
            String label = parts.length > 1 && !parts[1].isBlank() ? parts[1].trim() : "Time slot " + (i + 1);

            windows.add(TimeWindow.builder()
                    .id("window_" + (i + 1))
                    .startTime(today.atTime(start))
                    .endTime(today.atTime(end))
                    .label(label)
                    .build());
        }
        log.debug("Parsed {} time windows from quick entry", windows.size());
        return windows;
    }

    private int parseDuration(String value) {
        try {
            int minutes = Integer.parseInt(value);
            return minutes > 0 ? minutes : properties.getDefaultDurationMinutes();
        } catch (NumberFormatException e) {
            log.debug("Duration '{}' is not a number, using default", value);
            return properties.getDefaultDurationMinutes();
        }
    }

    private static LocalTime parseTime(String value, String line, int index) {
        try {
            return LocalTime.parse(value.trim(), TIME_FORMATTER);
        } catch (DateTimeParseException e) {
            throw new InvalidScheduleRequestException("Invalid time '" + value + "' on line " + (index + 1)
                    + ": '" + line + "'");
        }
    }

    private static List<String> nonBlankLines(String text) {
        if (text == null) {
            return new ArrayList<>();
        }
        return text.lines().filter(line -> !line.isBlank()).collect(Collectors.toList());
    }
}
