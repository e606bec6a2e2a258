package com.gymtracker.service.impl;

import com.gymtracker.dto.CalendarDay;
import com.gymtracker.dto.CalendarMonth;
import com.gymtracker.dto.CalendarView;
import com.gymtracker.dto.CalendarWeek;
import com.gymtracker.dto.DateRange;
import com.gymtracker.dto.ExercisePreview;
import com.gymtracker.dto.NavigationAction;
import com.gymtracker.dto.NavigationState;
import com.gymtracker.dto.ViewMode;
import com.gymtracker.dto.WorkoutPreview;
import com.gymtracker.dto.WorkoutStats;
import com.gymtracker.dto.WorkoutStatus;
import com.gymtracker.dto.WorkoutSummary;
import com.gymtracker.entity.Workout;
import com.gymtracker.exception.BusinessException;
import com.gymtracker.exception.WorkoutNotFoundException;
import com.gymtracker.service.CalendarGridBuilder;
import com.gymtracker.service.CalendarService;
import com.gymtracker.service.NavigationController;
import com.gymtracker.service.WorkoutStatusResolver;
import com.gymtracker.service.WorkoutStore;
import com.gymtracker.utils.DateMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class CalendarServiceImpl implements CalendarService {

    private final WorkoutStore workoutStore;
    private final CalendarGridBuilder calendarGridBuilder;
    private final NavigationController navigationController;
    private final WorkoutStatusResolver workoutStatusResolver;

    @Override
    public CalendarWeek getWeek(Long userId, LocalDate anchor) {
        checkLogin(userId);
        LocalDate start = DateMath.weekStart(anchor);
        LocalDate end = DateMath.weekEnd(anchor);
        Map<LocalDate, WorkoutSummary> workouts = workoutStore.fetchWorkouts(userId, start, end);
        return calendarGridBuilder.buildWeek(anchor, workouts);
    }

    @Override
    public CalendarMonth getMonth(Long userId, int year, int month) {
        checkLogin(userId);
        if (month < 0 || month > 11) {
            throw new BusinessException(400, "月份必须在0-11之间: " + month);
        }
        YearMonth yearMonth = YearMonth.of(year, month + 1);
        LocalDate start = DateMath.weekStart(yearMonth.atDay(1));
        LocalDate end = DateMath.weekEnd(yearMonth.atEndOfMonth());
        Map<LocalDate, WorkoutSummary> workouts = workoutStore.fetchWorkouts(userId, start, end);
        return calendarGridBuilder.buildMonth(year, month, workouts);
    }

    @Override
    public CalendarView getView(Long userId, NavigationState state) {
        checkLogin(userId);
        // 先归一化，保证返回的标记与客户端下一次导航得到的状态可比较
        NavigationState normalized = navigationController.goToDate(state, state.getReferenceDate());
        DateRange range = navigationController.visibleRange(normalized);
        Map<LocalDate, WorkoutSummary> workouts =
                workoutStore.fetchWorkouts(userId, range.getStartDate(), range.getEndDate());

        LocalDate reference = normalized.getReferenceDate();
        if (normalized.getViewMode() == ViewMode.WEEK) {
            return new CalendarView(normalized, range, calendarGridBuilder.buildWeek(reference, workouts), null);
        }
        CalendarMonth month = calendarGridBuilder.buildMonth(
                reference.getYear(), reference.getMonthValue() - 1, workouts);
        return new CalendarView(normalized, range, null, month);
    }

    @Override
    public NavigationState navigate(NavigationState state, NavigationAction action,
                                    LocalDate targetDate, ViewMode targetMode) {
        return switch (action) {
            case TODAY -> navigationController.goToday(state);
            case PREVIOUS -> navigationController.goToPrevious(state);
            case NEXT -> navigationController.goToNext(state);
            case GO_TO_DATE -> {
                if (targetDate == null) {
                    throw new BusinessException(400, "跳转日期不能为空");
                }
                yield navigationController.goToDate(state, targetDate);
            }
            case SET_VIEW_MODE -> {
                if (targetMode == null) {
                    throw new BusinessException(400, "目标视图模式不能为空");
                }
                yield navigationController.setViewMode(state, targetMode);
            }
        };
    }

    @Override
    public WorkoutStatus getStatus(Long userId, LocalDate date) {
        checkLogin(userId);
        WorkoutSummary workout = workoutStore.fetchWorkouts(userId, date, date).get(date);
        CalendarDay day = new CalendarDay(date, DateMath.dayOfWeekIndex(date), false, true, workout);
        return workoutStatusResolver.resolve(day);
    }

    @Override
    public WorkoutStats getStats(Long userId, LocalDate startDate, LocalDate endDate) {
        checkLogin(userId);
        if (endDate.isBefore(startDate)) {
            throw new BusinessException(400, "结束日期不能早于开始日期");
        }

        Map<LocalDate, WorkoutSummary> workouts = workoutStore.fetchWorkouts(userId, startDate, endDate);
        int total = workouts.size();
        int completed = 0;
        int totalDuration = 0;
        for (WorkoutSummary workout : workouts.values()) {
            if (workout.isCompleted()) {
                completed++;
            }
            if (workout.getDurationMinutes() != null) {
                totalDuration += workout.getDurationMinutes();
            }
        }

        double completionRate = total > 0 ? completed * 100.0 / total : 0;
        // 总时长包含全部训练，平均时长按已完成次数计算
        double averageDuration = completed > 0 ? (double) totalDuration / completed : 0;
        return new WorkoutStats(total, completed, completionRate, totalDuration, averageDuration);
    }

    @Override
    public WorkoutPreview getWorkoutPreview(Long userId, Long workoutId) {
        checkLogin(userId);
        Workout workout = workoutStore.findWorkout(userId, workoutId)
                .orElseThrow(() -> new WorkoutNotFoundException(workoutId));

        List<ExercisePreview> exercises = workoutStore.fetchExercises(workoutId).stream()
                .map(e -> new ExercisePreview(e.getId(), e.getSlug(), e.getName(),
                        e.getTargetSets(), e.getTargetReps(), e.getCompletedSets()))
                .collect(Collectors.toList());

        return new WorkoutPreview(
                workout.getId(),
                workout.getTitle(),
                workout.getWorkoutDate(),
                workout.isCompleted(),
                workout.getDurationMinutes(),
                exercises,
                workout.getNotes()
        );
    }

    private void checkLogin(Long userId) {
        if (userId == null) {
            throw new BusinessException(401, "用户未登录");
        }
    }
}
