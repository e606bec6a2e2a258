package com.gymtracker.dto;

import lombok.Value;

import java.time.LocalDate;

/**
 * 日历导航状态。WEEK 模式下 referenceDate 总是周一，MONTH 模式下总是当月 1 号，
 * 由 NavigationController 在每次状态转换时保证。
 */
@Value
public class NavigationState {
    LocalDate referenceDate;
    ViewMode viewMode;
}
