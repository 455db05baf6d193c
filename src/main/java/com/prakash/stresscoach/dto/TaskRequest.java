package com.prakash.stresscoach.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.prakash.stresscoach.model.TaskPriority;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskRequest {

    // Optional; generated as task_<epochMillis>_<index> when absent
    private String id;

    @NotBlank(message = "Task title cannot be blank.")
    @Size(max = 200, message = "Task title cannot exceed 200 characters.")
    private String title;

    @Size(max = 1000, message = "Task description cannot exceed 1000 characters.")
    private String description;

    @Positive(message = "Estimated duration must be a positive number of minutes.")
    @Max(value = 10_080, message = "Estimated duration cannot exceed one week (10080 minutes).")
    private Integer estimatedDurationMinutes;

    private TaskPriority priority;

    private String category;

    // ISO date or date-time; unreadable values are tolerated and scored as "no deadline"
    private String deadline;

    @JsonAlias("isFlexible")
    private Boolean flexible;
}
