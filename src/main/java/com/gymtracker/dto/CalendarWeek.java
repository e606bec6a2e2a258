package com.gymtracker.dto;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
public class CalendarWeek {
    int weekIndex;
    List<CalendarDay> days;
    LocalDate startDate;
    LocalDate endDate;
}
