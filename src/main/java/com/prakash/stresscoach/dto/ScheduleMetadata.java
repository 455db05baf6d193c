package com.prakash.stresscoach.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleMetadata {

    private String analysisMethod;
    private LocalDateTime generatedAt;
    private long totalRequestedMinutes;
    private long totalAvailableMinutes;
}
