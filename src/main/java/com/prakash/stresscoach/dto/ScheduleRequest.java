package com.prakash.stresscoach.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleRequest {

    @NotEmpty(message = "Please provide at least one task.")
    private List<@Valid TaskRequest> tasks;

    @NotEmpty(message = "Please provide at least one time window.")
    private List<@Valid TimeWindowRequest> windows;

    @Min(value = 0, message = "Stress level must be between 0 and 10.")
    @Max(value = 10, message = "Stress level must be between 0 and 10.")
    private int stressLevel;

    private String mood;
}
