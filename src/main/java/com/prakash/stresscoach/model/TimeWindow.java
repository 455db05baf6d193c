package com.prakash.stresscoach.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A block of time the caller has made available for work.
 * Remaining capacity is not stored here; it lives in the per-call
 * {@link com.prakash.stresscoach.service.allocation.CapacityTracker}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeWindow {

    private String id;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private String label;

    /**
     * Length of the window rounded to whole minutes, never negative.
     *
     * @throws ArithmeticException if the window is too long to count in {@code int} minutes
     */
    public int getDurationMinutes() {
        if (startTime == null || endTime == null) {
            return 0;
        }
        long millis = Duration.between(startTime, endTime).toMillis();
        return Math.toIntExact(Math.max(0, Math.round(millis / 60000.0)));
    }
}
