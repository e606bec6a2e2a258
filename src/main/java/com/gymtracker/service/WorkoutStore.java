package com.gymtracker.service;

import com.gymtracker.dto.ExerciseRequest;
import com.gymtracker.dto.WorkoutSummary;
import com.gymtracker.entity.Workout;
import com.gymtracker.entity.WorkoutExercise;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 训练记录的存储契约。失败时抛出业务异常（DateConflictException / WorkoutNotFoundException /
 * UpstreamFailureException），不向上暴露底层数据访问异常。
 * 实现必须在存储层保证 (userId, date) 唯一。
 */
public interface WorkoutStore {

    // 区间查询（闭区间），按日期索引
    Map<LocalDate, WorkoutSummary> fetchWorkouts(Long userId, LocalDate startDate, LocalDate endDate);

    Optional<Workout> findWorkout(Long userId, Long workoutId);

    // 该日期是否已被除 excludeWorkoutId 以外的训练占用，excludeWorkoutId 可为空
    boolean isDateOccupied(Long userId, LocalDate date, Long excludeWorkoutId);

    Long createWorkout(Long userId, LocalDate date, String title, Long planId, List<ExerciseRequest> exercises);

    void rescheduleWorkout(Long userId, Long workoutId, LocalDate toDate, String note);

    // 返回是否确实删除了记录
    boolean deleteWorkout(Long userId, Long workoutId);

    void markCompleted(Long userId, Long workoutId);

    List<WorkoutExercise> fetchExercises(Long workoutId);
}
