package com.prakash.stresscoach.dto;

import com.prakash.stresscoach.model.ScheduleItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Full answer to one scheduling call. {@code items} follow the caller's task order,
 * not priority order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleResult {

    private List<ScheduleItem> items;
    private StressAnalysis stressAnalysis;
    private TaskAnalysis taskAnalysis;
    private ScheduleInsights insights;
    private ScheduleMetadata metadata;
}
