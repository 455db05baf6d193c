package com.prakash.stresscoach.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StressAnalysis {

    private int level;
    private String impact;
    private List<String> recommendedActions; // Tags such as "add_breaks"
}
