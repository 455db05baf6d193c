package com.prakash.stresscoach.service.allocation;

import com.prakash.stresscoach.model.ScheduleItem;
import com.prakash.stresscoach.model.ScoredTask;
import com.prakash.stresscoach.model.TimeWindow;

import java.util.List;

/**
 * Assigns scored tasks to time windows.
 * <p>
 * Implementations must return exactly one {@link ScheduleItem} per task, in the same
 * order as {@code scoredTasks}, and must never place more minutes in a window than its duration.
 * Inputs are assumed to be validated already.
 */
public interface TaskAllocator {

    List<ScheduleItem> allocate(List<ScoredTask> scoredTasks, List<TimeWindow> windows);
}
