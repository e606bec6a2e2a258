package com.gymtracker.dto;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
public class PlanResult {
    Long planId;
    LocalDate horizonStart;
    List<ScheduleAssignment> assignments;
    List<Long> workoutIds;
}
