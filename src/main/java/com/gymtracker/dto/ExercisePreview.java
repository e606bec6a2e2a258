package com.gymtracker.dto;

import lombok.Value;

@Value
public class ExercisePreview {
    Long id;
    String slug;
    String name;
    Integer targetSets;
    Integer targetReps;
    Integer completedSets;
}
