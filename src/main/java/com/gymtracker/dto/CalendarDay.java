package com.gymtracker.dto;

import lombok.Value;

import java.time.LocalDate;

@Value
public class CalendarDay {
    LocalDate date;
    int dayOfWeek;          // 0 = 周日, 1 = 周一 ... 6 = 周六
    boolean today;
    boolean currentPeriod;  // 周视图全部为 true；月视图表示是否属于当月
    WorkoutSummary workout;
}
