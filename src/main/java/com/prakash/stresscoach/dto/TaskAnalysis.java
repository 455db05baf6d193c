package com.prakash.stresscoach.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskAnalysis {

    private int totalTasks;
    private int scheduledTasks;
}
