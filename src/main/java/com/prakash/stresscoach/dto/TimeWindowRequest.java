package com.prakash.stresscoach.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TimeWindowRequest {

    private String id;

    @NotNull(message = "Window start time is required.")
    private LocalDateTime startTime;

    @NotNull(message = "Window end time is required.")
    private LocalDateTime endTime;

    private String label;
}
