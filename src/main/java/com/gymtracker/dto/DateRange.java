package com.gymtracker.dto;

import lombok.Value;

import java.time.LocalDate;

/**
 * 闭区间 [startDate, endDate]
 */
@Value
public class DateRange {
    LocalDate startDate;
    LocalDate endDate;

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }
}
