package com.gymtracker.dto;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
public class WorkoutPreview {
    Long id;
    String title;
    LocalDate date;
    boolean completed;
    Integer durationMinutes;
    List<ExercisePreview> exercises;
    String notes;
}
