package com.gymtracker.service;

import com.gymtracker.dto.ExerciseRequest;

import java.time.LocalDate;
import java.util.List;

/**
 * 训练的创建、改期、删除与完成。写入前检查"每个用户每天最多一条训练"，
 * 存储层的唯一约束兜底并发冲突。
 */
public interface RescheduleCoordinator {

    // 创建训练，日期已占用时抛出 DateConflictException
    Long create(Long userId, LocalDate date, String title);

    Long create(Long userId, LocalDate date, String title, List<ExerciseRequest> exercises);

    // 改期；fromDate 可为空，不为空时必须与当前日期一致
    void reschedule(Long userId, Long workoutId, LocalDate fromDate, LocalDate toDate, String reason);

    // 删除训练，不存在时抛出 WorkoutNotFoundException
    void delete(Long userId, Long workoutId);

    // 删除训练，允许重复删除
    boolean deleteIfExists(Long userId, Long workoutId);

    void markCompleted(Long userId, Long workoutId);
}
