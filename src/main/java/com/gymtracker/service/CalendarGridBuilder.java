package com.gymtracker.service;

import com.gymtracker.dto.CalendarDay;
import com.gymtracker.dto.CalendarMonth;
import com.gymtracker.dto.CalendarWeek;
import com.gymtracker.dto.WorkoutSummary;
import com.gymtracker.exception.BusinessException;
import com.gymtracker.utils.DateMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 由训练数据构建周/月日历网格。每次构建都生成新对象，不修改输入。
 */
@Service
@RequiredArgsConstructor
public class CalendarGridBuilder {

    private final Clock clock;

    /**
     * 构建包含 anchor 的那一周（周一到周日）
     */
    public CalendarWeek buildWeek(LocalDate anchor, Map<LocalDate, WorkoutSummary> workouts) {
        Map<LocalDate, WorkoutSummary> lookup = workouts != null ? workouts : Collections.emptyMap();
        LocalDate today = DateMath.today(clock);
        LocalDate start = DateMath.weekStart(anchor);

        List<CalendarDay> days = new ArrayList<>(DateMath.DAYS_PER_WEEK);
        for (int i = 0; i < DateMath.DAYS_PER_WEEK; i++) {
            LocalDate date = DateMath.addDays(start, i);
            days.add(toDay(date, today, true, lookup));
        }
        return new CalendarWeek(1, Collections.unmodifiableList(days), start, DateMath.weekEnd(anchor));
    }

    /**
     * 构建月视图，month 从 0 开始。首尾两周补齐相邻月份的日期，结果总是 4-6 个完整周。
     */
    public CalendarMonth buildMonth(int year, int month, Map<LocalDate, WorkoutSummary> workouts) {
        if (month < 0 || month > 11) {
            throw new BusinessException(400, "月份必须在0-11之间: " + month);
        }
        Map<LocalDate, WorkoutSummary> lookup = workouts != null ? workouts : Collections.emptyMap();
        LocalDate today = DateMath.today(clock);

        YearMonth yearMonth = YearMonth.of(year, month + 1);
        LocalDate calendarStart = DateMath.weekStart(yearMonth.atDay(1));
        LocalDate calendarEnd = DateMath.weekEnd(yearMonth.atEndOfMonth());

        List<CalendarWeek> weeks = new ArrayList<>();
        int weekIndex = 1;
        LocalDate current = calendarStart;
        while (!current.isAfter(calendarEnd)) {
            LocalDate weekStart = current;
            List<CalendarDay> days = new ArrayList<>(DateMath.DAYS_PER_WEEK);
            for (int i = 0; i < DateMath.DAYS_PER_WEEK; i++) {
                boolean inMonth = current.getMonthValue() == month + 1;
                days.add(toDay(current, today, inMonth, lookup));
                current = DateMath.addDays(current, 1);
            }
            weeks.add(new CalendarWeek(weekIndex++, Collections.unmodifiableList(days),
                    weekStart, DateMath.addDays(current, -1)));
        }

        return new CalendarMonth(
                year,
                month,
                yearMonth.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH),
                yearMonth.lengthOfMonth(),
                Collections.unmodifiableList(weeks)
        );
    }

    private CalendarDay toDay(LocalDate date, LocalDate today, boolean currentPeriod,
                              Map<LocalDate, WorkoutSummary> workouts) {
        return new CalendarDay(
                date,
                DateMath.dayOfWeekIndex(date),
                DateMath.sameDay(date, today),
                currentPeriod,
                workouts.get(date)
        );
    }
}
