package com.prakash.stresscoach.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PostponementSuggestion {

    private String taskId;
    private String taskTitle;
    private String reason;
    private String suggestedNewTime;
}
