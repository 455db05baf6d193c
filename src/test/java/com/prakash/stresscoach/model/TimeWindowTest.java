package com.prakash.stresscoach.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class TimeWindowTest {

    private static final LocalDateTime NINE = LocalDateTime.of(2026, 10, 19, 9, 0);

    private static TimeWindow window(LocalDateTime start, LocalDateTime end) {
        return TimeWindow.builder().id("w").startTime(start).endTime(end).build();
    }

    @Test
    @DisplayName("Duration rounds to whole minutes and never goes negative")
    void durationRounding() {
        assertEquals(90, window(NINE, NINE.plusMinutes(90)).getDurationMinutes());
        assertEquals(1, window(NINE, NINE.plusSeconds(30)).getDurationMinutes());
        assertEquals(0, window(NINE, NINE.plusSeconds(29)).getDurationMinutes());
        assertEquals(0, window(NINE, NINE.minusHours(1)).getDurationMinutes());
        assertEquals(0, window(null, NINE).getDurationMinutes());
    }

    @Test
    @DisplayName("Windows too long for int minutes fail loudly instead of wrapping")
    void overlongWindowThrows() {
        TimeWindow millennia = window(LocalDateTime.of(1, 1, 1, 0, 0), LocalDateTime.of(9999, 1, 1, 0, 0));

        assertThrows(ArithmeticException.class, millennia::getDurationMinutes);
    }
}
