package com.gymtracker.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 日历格子里展示的训练摘要，只在一次渲染内有效
 */
@Value
@Builder
public class WorkoutSummary {
    Long id;
    String title;
    boolean completed;
    int exerciseCount;
    Integer durationMinutes;
    Integer completionRate;   // 0-100，可为空
}
