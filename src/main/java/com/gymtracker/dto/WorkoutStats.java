package com.gymtracker.dto;

import lombok.Value;

@Value
public class WorkoutStats {
    int totalWorkouts;
    int completedWorkouts;
    double completionRate;
    int totalDuration;
    double averageDuration;
}
