package com.gymtracker.dto;

import lombok.Value;

import java.time.LocalDate;

@Value
public class ScheduleAssignment {
    LocalDate date;
    String slotName;
}
