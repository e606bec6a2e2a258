package com.gymtracker.service;

import com.gymtracker.dto.DateRange;
import com.gymtracker.dto.NavigationState;
import com.gymtracker.dto.ViewMode;
import com.gymtracker.utils.DateMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * 日历导航状态转换。每个方法接收当前状态并返回新状态，本身不持有状态；
 * 返回的 referenceDate 总是按视图模式归一化（周一 / 当月 1 号）。
 */
@Service
@RequiredArgsConstructor
public class NavigationController {

    private final Clock clock;

    public NavigationState initial(ViewMode mode) {
        return new NavigationState(normalize(DateMath.today(clock), mode), mode);
    }

    public NavigationState goToday(NavigationState state) {
        return goToDate(state, DateMath.today(clock));
    }

    public NavigationState goToPrevious(NavigationState state) {
        LocalDate reference = state.getReferenceDate();
        if (state.getViewMode() == ViewMode.WEEK) {
            return new NavigationState(DateMath.addWeeks(DateMath.weekStart(reference), -1), ViewMode.WEEK);
        }
        YearMonth previous = DateMath.previousMonth(reference.getYear(), reference.getMonthValue() - 1);
        return new NavigationState(previous.atDay(1), ViewMode.MONTH);
    }

    public NavigationState goToNext(NavigationState state) {
        LocalDate reference = state.getReferenceDate();
        if (state.getViewMode() == ViewMode.WEEK) {
            return new NavigationState(DateMath.addWeeks(DateMath.weekStart(reference), 1), ViewMode.WEEK);
        }
        YearMonth next = DateMath.nextMonth(reference.getYear(), reference.getMonthValue() - 1);
        return new NavigationState(next.atDay(1), ViewMode.MONTH);
    }

    public NavigationState goToDate(NavigationState state, LocalDate date) {
        return new NavigationState(normalize(date, state.getViewMode()), state.getViewMode());
    }

    public NavigationState setViewMode(NavigationState state, ViewMode mode) {
        return new NavigationState(normalize(state.getReferenceDate(), mode), mode);
    }

    public LocalDate normalize(LocalDate date, ViewMode mode) {
        return mode == ViewMode.WEEK ? DateMath.weekStart(date) : DateMath.firstOfMonth(date);
    }

    /**
     * 当前状态需要加载数据的区间。月视图包含首尾补齐的相邻月份日期。
     */
    public DateRange visibleRange(NavigationState state) {
        LocalDate reference = state.getReferenceDate();
        if (state.getViewMode() == ViewMode.WEEK) {
            return new DateRange(DateMath.weekStart(reference), DateMath.weekEnd(reference));
        }
        YearMonth month = YearMonth.from(reference);
        return new DateRange(DateMath.weekStart(month.atDay(1)), DateMath.weekEnd(month.atEndOfMonth()));
    }
}
