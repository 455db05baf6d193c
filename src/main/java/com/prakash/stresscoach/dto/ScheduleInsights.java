package com.prakash.stresscoach.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleInsights {

    private double totalWorkHours;
    private double averageConfidence;
    private String moodOptimization;

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Builder.Default
    private List<WorkloadAlert> workloadAlerts = new ArrayList<>();

    @Builder.Default
    private List<PostponementSuggestion> postponementSuggestions = new ArrayList<>();
}
