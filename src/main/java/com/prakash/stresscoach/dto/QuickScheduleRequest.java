package com.prakash.stresscoach.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

// Free-text entry: one task per line as "Title | Duration(min) | Priority | Deadline",
// one window per line as "09:00-11:00 Morning work"
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QuickScheduleRequest {

    @NotBlank(message = "Please enter at least one task.")
    private String tasksText;

    @NotBlank(message = "Please enter at least one time slot.")
    private String windowsText;

    @Min(value = 0, message = "Stress level must be between 0 and 10.")
    @Max(value = 10, message = "Stress level must be between 0 and 10.")
    private int stressLevel;

    private String mood;
}
