package com.prakash.stresscoach.service.allocation;

import com.prakash.stresscoach.model.TimeWindow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Remaining capacity of each time window during one allocation pass.
 * <p>
 * A tracker is created per scheduling call and is only touched from that call's
 * sequential allocation pass, so it carries no synchronization. Windows are kept
 * in caller input order, which is also the tie-break order for window selection.
 */
public class CapacityTracker {

    private final List<WindowCapacity> windows;
    private final long totalCapacity;

    public CapacityTracker(List<TimeWindow> timeWindows) {
        List<WindowCapacity> capacities = new ArrayList<>(timeWindows.size());
        long total = 0;
        for (int i = 0; i < timeWindows.size(); i++) {
            TimeWindow window = timeWindows.get(i);
            capacities.add(new WindowCapacity(i, window, window.getDurationMinutes()));
            total += window.getDurationMinutes();
        }
        this.windows = Collections.unmodifiableList(capacities);
        this.totalCapacity = total;
    }

    public List<WindowCapacity> windows() {
        return windows;
    }

    /**
     * Sum of the original durations of all windows.
     */
    public long totalCapacity() {
        return totalCapacity;
    }

    public long totalRemaining() {
        return windows.stream().mapToLong(WindowCapacity::getRemainingMinutes).sum();
    }

    /**
     * Takes {@code minutes} out of a window and marks it exhausted once the remainder
     * is below {@code usableFloor} or nothing is left.
     *
     * @param window      the window to draw from
     * @param minutes     minutes to allocate; callers clamp to the remaining capacity first
     * @param usableFloor smallest remainder still worth offering to later tasks
     * @return the minutes left in the window
     * @throws IllegalArgumentException if {@code minutes} is not positive or exceeds the remainder
     */
    public int consume(WindowCapacity window, int minutes, int usableFloor) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("Allocated minutes must be positive, got " + minutes);
        }
        if (minutes > window.remainingMinutes) {
            throw new IllegalArgumentException("Cannot allocate " + minutes + " minutes from window "
                    + window.getWindow().getId() + " with only " + window.remainingMinutes + " remaining");
        }
        window.remainingMinutes -= minutes;
        if (window.remainingMinutes == 0 || window.remainingMinutes < usableFloor) {
            window.exhausted = true;
        }
        return window.remainingMinutes;
    }

    /**
     * Mutable scheduling state for a single window.
     */
    public static final class WindowCapacity {

        private final int position;
        private final TimeWindow window;
        private int remainingMinutes;
        private boolean exhausted;

        WindowCapacity(int position, TimeWindow window, int remainingMinutes) {
            this.position = position;
            this.window = window;
            this.remainingMinutes = remainingMinutes;
            this.exhausted = remainingMinutes == 0;
        }

        public int getPosition() {
            return position;
        }

        public TimeWindow getWindow() {
            return window;
        }

        public int getRemainingMinutes() {
            return remainingMinutes;
        }

        public boolean isExhausted() {
            return exhausted;
        }

        public boolean canTake(int minutes) {
            return !exhausted && remainingMinutes >= minutes;
        }
    }
}
