package com.prakash.stresscoach.service.allocation;

import com.prakash.stresscoach.model.CompletionStatus;
import com.prakash.stresscoach.model.ScheduleItem;
import com.prakash.stresscoach.model.ScoredTask;
import com.prakash.stresscoach.model.TaskPriority;
import com.prakash.stresscoach.model.TimeWindow;
import com.prakash.stresscoach.service.allocation.CapacityTracker.WindowCapacity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Three-phase greedy allocator.
 * <ol>
 *     <li>Perfect fit: best-fit placement of the whole task into the window with the smallest
 *     leftover. An exact fit uses the window up.</li>
 *     <li>Partial fit: the largest window with at least 15 minutes takes what it can.</li>
 *     <li>Emergency rescue: unplaced high-priority or urgent tasks squeeze into any window with 10 minutes left.</li>
 * </ol>
 * Tasks are visited in descending final priority; equal priorities keep input order.
 * Placements are never revisited.
 */
@Component
public class GreedyTaskAllocator implements TaskAllocator {

    private static final Logger log = LoggerFactory.getLogger(GreedyTaskAllocator.class);

    static final int PERFECT_FIT_FLOOR = 0;
    static final int PARTIAL_FIT_FLOOR = 15;
    static final int EMERGENCY_FLOOR = 10;
    static final double RESCUE_URGENCY_THRESHOLD = 0.8;

    static final double PERFECT_FIT_CONFIDENCE = 0.9;
    static final double FITTED_CONFIDENCE = 0.8;
    static final double PARTIAL_CONFIDENCE = 0.6;
    static final double EMERGENCY_CONFIDENCE = 0.5;

    static final String NO_SLOT_NOTE = "No available time slots remaining - consider adding more time blocks";

    @Override
    public List<ScheduleItem> allocate(List<ScoredTask> scoredTasks, List<TimeWindow> windows) {
        CapacityTracker tracker = new CapacityTracker(windows);
        ScheduleItem[] items = new ScheduleItem[scoredTasks.size()];

        long totalRequested = scoredTasks.stream()
                .mapToLong(st -> st.getTask().getEstimatedDurationMinutes())
                .sum();
        boolean overcommitted = totalRequested > tracker.totalCapacity();
        log.info("Allocating {} tasks ({} min) into {} windows ({} min). Overcommitted: {}",
                scoredTasks.size(), totalRequested, windows.size(), tracker.totalCapacity(), overcommitted);

        // sorted() is stable on an ordered stream, so ties keep input order
        List<Integer> priorityOrder = IntStream.range(0, scoredTasks.size()).boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> scoredTasks.get(i).getFinalPriority()).reversed())
                .collect(Collectors.toList());

        List<Integer> pending = perfectFitPhase(scoredTasks, priorityOrder, tracker, items);
        partialFitPhase(scoredTasks, pending, tracker, items, overcommitted);
        rescuePhase(scoredTasks, priorityOrder, tracker, items);

        List<ScheduleItem> schedule = List.of(items);
        log.info("Allocation finished: {}/{} tasks received time, {} min left unused",
                schedule.stream().filter(ScheduleItem::isScheduled).count(), schedule.size(), tracker.totalRemaining());
        return schedule;
    }

    /**
     * @return indexes of tasks left unplaced, still in priority order
     */
    private List<Integer> perfectFitPhase(List<ScoredTask> scoredTasks, List<Integer> priorityOrder,
                                          CapacityTracker tracker, ScheduleItem[] items) {
        List<Integer> pending = new ArrayList<>();
        for (int index : priorityOrder) {
            ScoredTask scored = scoredTasks.get(index);
            int duration = scored.getTask().getEstimatedDurationMinutes();

            WindowCapacity best = null;
            int bestLeftover = Integer.MAX_VALUE;
            for (WindowCapacity candidate : tracker.windows()) {
                if (candidate.canTake(duration)) {
                    int leftover = candidate.getRemainingMinutes() - duration;
                    if (leftover < bestLeftover) {
                        bestLeftover = leftover;
                        best = candidate;
                    }
                }
            }

            if (best == null) {
                log.debug("Phase 1: no window fits task {} ({} min) whole", scored.getTask().getId(), duration);
                pending.add(index);
                continue;
            }
            tracker.consume(best, duration, PERFECT_FIT_FLOOR);
            items[index] = placed(scored, best, duration, CompletionStatus.COMPLETE, PERFECT_FIT_CONFIDENCE,
                    "Perfect fit in " + best.getWindow().getDurationMinutes() + "-minute slot");
            log.debug("Phase 1: task {} placed whole in window {}, {} min left",
                    scored.getTask().getId(), best.getWindow().getId(), best.getRemainingMinutes());
        }
        log.info("Phase 1 (perfect fit) placed {} tasks, {} pending",
                priorityOrder.size() - pending.size(), pending.size());
        return pending;
    }

    private void partialFitPhase(List<ScoredTask> scoredTasks, List<Integer> pending, CapacityTracker tracker,
                                 ScheduleItem[] items, boolean overcommitted) {
        int placedCount = 0;
        for (int index : pending) {
            ScoredTask scored = scoredTasks.get(index);
            int duration = scored.getTask().getEstimatedDurationMinutes();

            WindowCapacity largest = null;
            for (WindowCapacity candidate : tracker.windows()) {
                if (candidate.canTake(PARTIAL_FIT_FLOOR)
                        && (largest == null || candidate.getRemainingMinutes() > largest.getRemainingMinutes())) {
                    largest = candidate;
                }
            }

            if (largest == null) {
                items[index] = ScheduleItem.unscheduled(scored, NO_SLOT_NOTE);
                log.debug("Phase 2: no window with {}+ minutes left for task {}", PARTIAL_FIT_FLOOR, scored.getTask().getId());
                continue;
            }

            int allocated = Math.min(duration, largest.getRemainingMinutes());
            boolean partial = allocated < duration;
            CompletionStatus status = partial ? CompletionStatus.PARTIAL
                    : overcommitted ? CompletionStatus.SCALED : CompletionStatus.COMPLETE;
            String note = partial
                    ? "Partial scheduling: " + allocated + " of " + duration + " minutes"
                    : "Scheduled in available " + allocated + "-minute slot";
            tracker.consume(largest, allocated, PARTIAL_FIT_FLOOR);
            items[index] = placed(scored, largest, allocated, status,
                    partial ? PARTIAL_CONFIDENCE : FITTED_CONFIDENCE, note);
            placedCount++;
            log.debug("Phase 2: task {} got {}/{} min in window {} ({})",
                    scored.getTask().getId(), allocated, duration, largest.getWindow().getId(), status);
        }
        log.info("Phase 2 (partial fit) placed {} of {} pending tasks", placedCount, pending.size());
    }

    private void rescuePhase(List<ScoredTask> scoredTasks, List<Integer> priorityOrder,
                             CapacityTracker tracker, ScheduleItem[] items) {
        int candidates = 0;
        int rescued = 0;
        for (int index : priorityOrder) {
            ScheduleItem item = items[index];
            ScoredTask scored = scoredTasks.get(index);
            if (item.getStatus() != CompletionStatus.NOT_SCHEDULED || !qualifiesForRescue(scored)) {
                continue;
            }
            candidates++;

            WindowCapacity window = tracker.windows().stream()
                    .filter(w -> w.canTake(EMERGENCY_FLOOR))
                    .findFirst()
                    .orElse(null);
            if (window == null) {
                log.debug("Phase 3: nothing left to rescue task {}", scored.getTask().getId());
                continue;
            }

            int duration = scored.getTask().getEstimatedDurationMinutes();
            int allocated = Math.min(duration, window.getRemainingMinutes());
            tracker.consume(window, allocated, EMERGENCY_FLOOR);
            items[index] = placed(scored, window, allocated,
                    allocated < duration ? CompletionStatus.PARTIAL : CompletionStatus.SCALED,
                    EMERGENCY_CONFIDENCE,
                    "Emergency scheduling: " + allocated + " minutes for high-priority task");
            rescued++;
            log.debug("Phase 3: rescued task {} with {} min in window {}",
                    scored.getTask().getId(), allocated, window.getWindow().getId());
        }
        if (candidates > 0) {
            log.info("Phase 3 (emergency) rescued {} of {} high-priority/urgent tasks", rescued, candidates);
        }
    }

    private static boolean qualifiesForRescue(ScoredTask scored) {
        return scored.getTask().getPriority() == TaskPriority.HIGH
                || scored.getDeadlineUrgency() > RESCUE_URGENCY_THRESHOLD;
    }

    private static ScheduleItem placed(ScoredTask scored, WindowCapacity window, int minutes,
                                       CompletionStatus status, double confidence, String note) {
        List<String> notes = new ArrayList<>();
        notes.add(note);
        return ScheduleItem.builder()
                .task(scored.getTask())
                .window(window.getWindow())
                .allocatedMinutes(minutes)
                .status(status)
                .confidence(confidence)
                .deadlineUrgency(scored.getDeadlineUrgency())
                .notes(notes)
                .build();
    }
}
