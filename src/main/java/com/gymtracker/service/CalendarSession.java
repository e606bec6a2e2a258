package com.gymtracker.service;

import com.gymtracker.dto.CalendarMonth;
import com.gymtracker.dto.CalendarWeek;
import com.gymtracker.dto.CalendarView;
import com.gymtracker.dto.NavigationState;
import com.gymtracker.dto.RangeFetch;
import com.gymtracker.dto.ViewMode;
import com.gymtracker.dto.WorkoutSummary;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * 一个日历视图会话：持有当前导航状态，发出带状态标记的区间查询，
 * 并丢弃与当前状态不匹配的过期结果（以最后一次导航为准）。
 * 每个会话一个实例，不在线程间共享。
 * <p>
 * 供进程内的显示层调用方使用。REST 接口不持有会话，客户端用
 * {@link CalendarView#getNavigation()} 与自己的当前状态比较来丢弃过期响应，规则相同。
 */
@Slf4j
public class CalendarSession {

    private final NavigationController navigation;
    private final CalendarGridBuilder gridBuilder;

    private NavigationState state;

    public CalendarSession(NavigationController navigation, CalendarGridBuilder gridBuilder, ViewMode mode) {
        this.navigation = navigation;
        this.gridBuilder = gridBuilder;
        this.state = navigation.initial(mode);
    }

    public NavigationState getState() {
        return state;
    }

    public NavigationState goToday() {
        state = navigation.goToday(state);
        return state;
    }

    public NavigationState goToPrevious() {
        state = navigation.goToPrevious(state);
        return state;
    }

    public NavigationState goToNext() {
        state = navigation.goToNext(state);
        return state;
    }

    public NavigationState goToDate(LocalDate date) {
        state = navigation.goToDate(state, date);
        return state;
    }

    public NavigationState setViewMode(ViewMode mode) {
        state = navigation.setViewMode(state, mode);
        return state;
    }

    /**
     * 为当前状态生成区间查询请求
     */
    public RangeFetch requestRange() {
        return new RangeFetch(state, navigation.visibleRange(state));
    }

    /**
     * 查询返回后构建网格；若期间发生过导航则丢弃结果
     */
    public Optional<CalendarView> accept(RangeFetch fetch, Map<LocalDate, WorkoutSummary> workouts) {
        if (fetch.isStale(state)) {
            log.debug("丢弃过期的日历数据 - tag: {}, current: {}", fetch.getTag(), state);
            return Optional.empty();
        }
        NavigationState tag = fetch.getTag();
        LocalDate reference = tag.getReferenceDate();
        if (tag.getViewMode() == ViewMode.WEEK) {
            CalendarWeek week = gridBuilder.buildWeek(reference, workouts);
            return Optional.of(new CalendarView(tag, fetch.getRange(), week, null));
        }
        CalendarMonth month = gridBuilder.buildMonth(reference.getYear(), reference.getMonthValue() - 1, workouts);
        return Optional.of(new CalendarView(tag, fetch.getRange(), null, month));
    }
}
