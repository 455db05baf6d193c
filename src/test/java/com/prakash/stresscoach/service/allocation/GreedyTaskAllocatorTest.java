package com.prakash.stresscoach.service.allocation;

import com.prakash.stresscoach.model.CompletionStatus;
import com.prakash.stresscoach.model.ScheduleItem;
import com.prakash.stresscoach.model.ScoredTask;
import com.prakash.stresscoach.model.Task;
import com.prakash.stresscoach.model.TaskPriority;
import com.prakash.stresscoach.model.TimeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class GreedyTaskAllocatorTest {

    private static final LocalDateTime DAY = LocalDateTime.of(2026, 10, 19, 9, 0);

    private GreedyTaskAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = new GreedyTaskAllocator();
    }

    private ScoredTask scored(String id, int minutes, TaskPriority priority, double urgency, double finalPriority) {
        Task task = Task.builder().id(id).title("Task " + id).estimatedDurationMinutes(minutes)
                .priority(priority).flexible(true).build();
        return ScoredTask.builder().task(task).deadlineUrgency(urgency).finalPriority(finalPriority).build();
    }

    private ScoredTask scored(String id, int minutes, double finalPriority) {
        return scored(id, minutes, TaskPriority.MEDIUM, 0.2, finalPriority);
    }

    private List<TimeWindow> windows(int... minutes) {
        List<TimeWindow> windows = new ArrayList<>();
        LocalDateTime start = DAY;
        for (int i = 0; i < minutes.length; i++) {
            windows.add(TimeWindow.builder().id("w" + (i + 1)).startTime(start)
                    .endTime(start.plusMinutes(minutes[i])).label("Slot " + (i + 1)).build());
            start = start.plusMinutes(minutes[i] + 30);
        }
        return windows;
    }

    @Test
    @DisplayName("Phase 1 picks the window with the smallest leftover")
    void bestFitChoosesTightestWindow() {
        List<TimeWindow> windows = windows(120, 45, 60);

        List<ScheduleItem> items = allocator.allocate(List.of(scored("a", 40, 0.5)), windows);

        ScheduleItem item = items.get(0);
        assertEquals("w2", item.getWindow().getId());
        assertEquals(CompletionStatus.COMPLETE, item.getStatus());
        assertEquals(40, item.getAllocatedMinutes());
        assertEquals(0.9, item.getConfidence());
        assertEquals(List.of("Perfect fit in 45-minute slot"), item.getNotes());
    }

    @Test
    @DisplayName("Equal leftovers resolve to the earlier window")
    void bestFitTieGoesToFirstWindow() {
        List<ScheduleItem> items = allocator.allocate(List.of(scored("a", 30, 0.5)), windows(50, 50));

        assertEquals("w1", items.get(0).getWindow().getId());
    }

    @Test
    @DisplayName("Exact fit is a perfect fit and uses the window up")
    void exactFitIsPerfectFit() {
        List<ScheduleItem> items = allocator.allocate(
                List.of(scored("a", 60, 0.9), scored("b", 30, TaskPriority.HIGH, 1.0, 0.1)), windows(60));

        ScheduleItem item = items.get(0);
        assertEquals(CompletionStatus.COMPLETE, item.getStatus());
        assertEquals(60, item.getAllocatedMinutes());
        assertEquals(0.9, item.getConfidence());
        assertEquals(List.of("Perfect fit in 60-minute slot"), item.getNotes());
        // nothing left, not even for a rescue
        assertEquals(CompletionStatus.NOT_SCHEDULED, items.get(1).getStatus());
    }

    @Test
    @DisplayName("Exact fit beats a looser window so the larger window stays free")
    void exactFitPreferredOverLooserWindow() {
        List<ScheduleItem> items = allocator.allocate(List.of(
                scored("short", 60, TaskPriority.HIGH, 0.2, 0.9),
                scored("long", 200, TaskPriority.MEDIUM, 0.2, 0.5)), windows(60, 200));

        assertEquals("w1", items.get(0).getWindow().getId());
        assertEquals(CompletionStatus.COMPLETE, items.get(0).getStatus());
        assertEquals("w2", items.get(1).getWindow().getId());
        assertEquals(CompletionStatus.COMPLETE, items.get(1).getStatus());
        assertEquals(200, items.get(1).getAllocatedMinutes());
        assertEquals(0.9, items.get(1).getConfidence());
    }

    @Test
    @DisplayName("Huge requests do not wrap the demand total")
    void hugeDemandDoesNotOverflow() {
        List<ScheduleItem> items = allocator.allocate(List.of(
                scored("a", 60, TaskPriority.HIGH, 1.0, 0.9),
                scored("b", Integer.MAX_VALUE - 10, TaskPriority.LOW, 0.2, 0.1),
                scored("c", Integer.MAX_VALUE - 10, TaskPriority.LOW, 0.2, 0.05)), windows(90));

        assertEquals(CompletionStatus.COMPLETE, items.get(0).getStatus());
        ScheduleItem b = items.get(1);
        assertEquals(CompletionStatus.PARTIAL, b.getStatus());
        assertEquals(30, b.getAllocatedMinutes());
        assertEquals(CompletionStatus.NOT_SCHEDULED, items.get(2).getStatus());
    }

    @Test
    @DisplayName("Phase 2 gives the largest remaining window to the next task")
    void partialFitUsesLargestWindow() {
        List<ScheduleItem> items = allocator.allocate(List.of(scored("a", 200, 0.5)), windows(30, 90, 60));

        ScheduleItem item = items.get(0);
        assertEquals("w2", item.getWindow().getId());
        assertEquals(CompletionStatus.PARTIAL, item.getStatus());
        assertEquals(90, item.getAllocatedMinutes());
        assertEquals(0.6, item.getConfidence());
        assertEquals(List.of("Partial scheduling: 90 of 200 minutes"), item.getNotes());
    }

    @Test
    @DisplayName("Phase 2 ignores windows with less than 15 minutes")
    void partialFitNeedsFifteenMinutes() {
        // a takes 50 of 64, leaving 14
        List<ScheduleItem> items = allocator.allocate(
                List.of(scored("a", 50, 0.9), scored("b", 30, 0.1)), windows(64));

        assertEquals(CompletionStatus.COMPLETE, items.get(0).getStatus());
        ScheduleItem b = items.get(1);
        assertEquals(CompletionStatus.NOT_SCHEDULED, b.getStatus());
        assertNull(b.getWindow());
        assertEquals(0, b.getAllocatedMinutes());
        assertEquals(0.0, b.getConfidence());
        assertEquals(List.of(GreedyTaskAllocator.NO_SLOT_NOTE), b.getNotes());
    }

    @Test
    @DisplayName("Higher priority wins contested capacity; output stays in input order")
    void priorityOrderDecidesButOutputKeepsInputOrder() {
        List<ScheduleItem> items = allocator.allocate(
                List.of(scored("low", 50, 0.2), scored("high", 50, 0.8)), windows(60));

        assertEquals("low", items.get(0).getTask().getId());
        assertEquals("high", items.get(1).getTask().getId());
        assertEquals(CompletionStatus.COMPLETE, items.get(1).getStatus());
        assertEquals(CompletionStatus.NOT_SCHEDULED, items.get(0).getStatus());
    }

    @Test
    @DisplayName("Equal priorities keep their input order")
    void stableOrderingForTies() {
        List<ScheduleItem> items = allocator.allocate(
                List.of(scored("first", 50, 0.5), scored("second", 50, 0.5)), windows(60));

        assertEquals(CompletionStatus.COMPLETE, items.get(0).getStatus());
        assertEquals(CompletionStatus.NOT_SCHEDULED, items.get(1).getStatus());
    }

    @Test
    @DisplayName("Rescue squeezes an urgent task into a sub-15-minute remainder")
    void rescuePlacesUrgentTask() {
        List<ScheduleItem> items = allocator.allocate(
                List.of(scored("a", 50, 0.9), scored("urgent", 30, TaskPriority.MEDIUM, 0.9, 0.5)), windows(62));

        ScheduleItem urgent = items.get(1);
        assertEquals(CompletionStatus.PARTIAL, urgent.getStatus());
        assertEquals(12, urgent.getAllocatedMinutes());
        assertEquals(0.5, urgent.getConfidence());
        assertEquals("w1", urgent.getWindow().getId());
        assertEquals(List.of("Emergency scheduling: 12 minutes for high-priority task"), urgent.getNotes());
    }

    @Test
    @DisplayName("A remainder left by earlier tasks is filled whole when it matches exactly")
    void exactRemainderIsPerfectFit() {
        // a and b leave exactly 12 minutes in each window
        List<ScheduleItem> items = allocator.allocate(List.of(
                scored("a", 78, TaskPriority.HIGH, 1.0, 0.96),
                scored("b", 48, TaskPriority.HIGH, 1.0, 0.95),
                scored("c", 12, TaskPriority.HIGH, 0.9, 0.90)), windows(90, 60));

        ScheduleItem c = items.get(2);
        assertEquals(CompletionStatus.COMPLETE, c.getStatus());
        assertEquals(12, c.getAllocatedMinutes());
        assertEquals(0.9, c.getConfidence());
        assertEquals("w1", c.getWindow().getId());
    }

    @Test
    @DisplayName("Low-priority, non-urgent tasks are never rescued")
    void noRescueForOrdinaryTasks() {
        List<ScheduleItem> items = allocator.allocate(
                List.of(scored("a", 50, 0.9), scored("b", 30, TaskPriority.LOW, 0.5, 0.1)), windows(62));

        assertEquals(CompletionStatus.NOT_SCHEDULED, items.get(1).getStatus());
        assertEquals(List.of(GreedyTaskAllocator.NO_SLOT_NOTE), items.get(1).getNotes());
    }

    @Test
    @DisplayName("Rescue needs at least 10 minutes")
    void noRescueBelowTenMinutes() {
        List<ScheduleItem> items = allocator.allocate(
                List.of(scored("a", 55, 0.9), scored("b", 30, TaskPriority.HIGH, 1.0, 0.5)), windows(64));

        assertEquals(CompletionStatus.NOT_SCHEDULED, items.get(1).getStatus());
    }

    @Test
    @DisplayName("Invariants hold over many generated workloads")
    void invariantsHoldForGeneratedInputs() {
        Random random = new Random(42);
        TaskPriority[] priorities = TaskPriority.values();
        for (int round = 0; round < 200; round++) {
            List<ScoredTask> tasks = new ArrayList<>();
            int taskCount = 1 + random.nextInt(12);
            for (int i = 0; i < taskCount; i++) {
                tasks.add(scored("t" + i, 5 + random.nextInt(180), priorities[random.nextInt(3)],
                        random.nextDouble(), random.nextDouble()));
            }
            int[] durations = new int[1 + random.nextInt(5)];
            for (int i = 0; i < durations.length; i++) {
                durations[i] = 10 + random.nextInt(150);
            }
            List<TimeWindow> windows = windows(durations);

            List<ScheduleItem> items = allocator.allocate(tasks, windows);

            assertEquals(tasks.size(), items.size());
            Map<String, Integer> usedPerWindow = new HashMap<>();
            for (int i = 0; i < items.size(); i++) {
                ScheduleItem item = items.get(i);
                int requested = tasks.get(i).getTask().getEstimatedDurationMinutes();
                assertSame(tasks.get(i).getTask(), item.getTask());
                assertFalse(item.getNotes().isEmpty());
                boolean notScheduled = item.getStatus() == CompletionStatus.NOT_SCHEDULED;
                assertEquals(notScheduled, item.getWindow() == null);
                assertEquals(notScheduled, item.getAllocatedMinutes() == 0);
                if (item.getStatus() == CompletionStatus.COMPLETE) {
                    assertEquals(requested, item.getAllocatedMinutes());
                }
                if (item.getStatus() == CompletionStatus.PARTIAL) {
                    assertTrue(item.getAllocatedMinutes() > 0 && item.getAllocatedMinutes() < requested);
                }
                if (item.getStatus() == CompletionStatus.SCALED) {
                    assertEquals(requested, item.getAllocatedMinutes());
                }
                assertTrue(item.getConfidence() >= 0.0 && item.getConfidence() <= 1.0);
                if (!notScheduled) {
                    usedPerWindow.merge(item.getWindow().getId(), item.getAllocatedMinutes(), Integer::sum);
                }
            }
            for (TimeWindow window : windows) {
                assertTrue(usedPerWindow.getOrDefault(window.getId(), 0) <= window.getDurationMinutes(),
                        "window " + window.getId() + " overbooked in round " + round);
            }
        }
    }
}
