package com.gymtracker.dto;

import lombok.Value;

/**
 * 一次导航状态对应的渲染结果，week 和 month 只有一个非空
 */
@Value
public class CalendarView {
    NavigationState navigation;
    DateRange range;
    CalendarWeek week;
    CalendarMonth month;
}
