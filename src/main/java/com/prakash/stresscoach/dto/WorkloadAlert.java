package com.prakash.stresscoach.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

// Raised when the scheduled work is too heavy for the day or for the user's stress level
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkloadAlert {

    public static final String HIGH_STRESS_HEAVY_WORKLOAD = "high_stress_heavy_workload";
    public static final String EXCESSIVE_WORKLOAD = "excessive_workload";

    private String type;
    private String message;
    private String suggestedAction;
    private double totalWorkHours;
    private int stressLevel;
}
