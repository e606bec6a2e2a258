package com.gymtracker.dto;

import lombok.Value;

import java.util.List;

@Value
public class CalendarMonth {
    int year;
    int month;          // 0-11
    String monthName;
    int totalDays;
    List<CalendarWeek> weeks;
}
