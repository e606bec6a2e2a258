package com.gymtracker.service;

import com.gymtracker.dto.CalendarMonth;
import com.gymtracker.dto.CalendarView;
import com.gymtracker.dto.CalendarWeek;
import com.gymtracker.dto.NavigationAction;
import com.gymtracker.dto.NavigationState;
import com.gymtracker.dto.ViewMode;
import com.gymtracker.dto.WorkoutPreview;
import com.gymtracker.dto.WorkoutStats;
import com.gymtracker.dto.WorkoutStatus;

import java.time.LocalDate;

public interface CalendarService {

    // 获取包含 anchor 的周视图
    CalendarWeek getWeek(Long userId, LocalDate anchor);

    // 获取月视图，month 从 0 开始
    CalendarMonth getMonth(Long userId, int year, int month);

    // 按导航状态获取视图，结果带上该状态作为标记
    CalendarView getView(Long userId, NavigationState state);

    // 执行一次导航动作，返回新状态
    NavigationState navigate(NavigationState state, NavigationAction action, LocalDate targetDate, ViewMode targetMode);

    // 某一天的显示状态
    WorkoutStatus getStatus(Long userId, LocalDate date);

    // 区间统计
    WorkoutStats getStats(Long userId, LocalDate startDate, LocalDate endDate);

    // 训练详情
    WorkoutPreview getWorkoutPreview(Long userId, Long workoutId);
}
