package com.gymtracker.dto;

/**
 * 日历单元格的显示状态
 */
public enum WorkoutStatus {
    SCHEDULED,
    COMPLETED,
    REST,
    NONE
}
