package com.gymtracker.service.impl;

import com.gymtracker.dto.ExerciseRequest;
import com.gymtracker.entity.Workout;
import com.gymtracker.exception.BusinessException;
import com.gymtracker.exception.DateConflictException;
import com.gymtracker.exception.WorkoutNotFoundException;
import com.gymtracker.service.RescheduleCoordinator;
import com.gymtracker.service.TransactionRunner;
import com.gymtracker.service.WorkoutStore;
import com.gymtracker.utils.DateMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RescheduleCoordinatorImpl implements RescheduleCoordinator {

    private final WorkoutStore workoutStore;
    private final TransactionRunner transactionRunner;

    @Override
    public Long create(Long userId, LocalDate date, String title) {
        return create(userId, date, title, Collections.emptyList());
    }

    @Override
    public Long create(Long userId, LocalDate date, String title, List<ExerciseRequest> exercises) {
        return transactionRunner.call("create", () -> doCreate(userId, date, title, exercises));
    }

    private Long doCreate(Long userId, LocalDate date, String title, List<ExerciseRequest> exercises) {
        log.info("创建训练 - userId: {}, date: {}", userId, date);

        if (userId == null) {
            throw new BusinessException(401, "用户未登录");
        }
        if (!StringUtils.hasText(title)) {
            throw new BusinessException(400, "训练标题不能为空");
        }

        if (workoutStore.isDateOccupied(userId, date, null)) {
            throw new DateConflictException(date);
        }

        Long workoutId = workoutStore.createWorkout(userId, date, title.trim(), null, exercises);
        log.info("训练创建成功 - id: {}, date: {}", workoutId, date);
        return workoutId;
    }

    @Override
    public void reschedule(Long userId, Long workoutId, LocalDate fromDate, LocalDate toDate, String reason) {
        transactionRunner.run("reschedule", () -> doReschedule(userId, workoutId, fromDate, toDate, reason));
    }

    private void doReschedule(Long userId, Long workoutId, LocalDate fromDate, LocalDate toDate, String reason) {
        log.info("训练改期 - userId: {}, workoutId: {}, {} -> {}", userId, workoutId, fromDate, toDate);

        if (userId == null) {
            throw new BusinessException(401, "用户未登录");
        }

        Workout workout = workoutStore.findWorkout(userId, workoutId)
                .orElseThrow(() -> new WorkoutNotFoundException(workoutId));

        LocalDate currentDate = workout.getWorkoutDate();
        // 客户端看到的日期已过期（例如在另一个标签页已改期）
        if (fromDate != null && !DateMath.sameDay(fromDate, currentDate)) {
            throw new DateConflictException(fromDate,
                    "训练已不在 " + DateMath.format(fromDate) + "，当前日期为 " + DateMath.format(currentDate));
        }
        if (DateMath.sameDay(currentDate, toDate)) {
            log.info("目标日期与当前日期相同，无需改期 - workoutId: {}", workoutId);
            return;
        }

        if (workoutStore.isDateOccupied(userId, toDate, workoutId)) {
            throw new DateConflictException(toDate);
        }

        workoutStore.rescheduleWorkout(userId, workoutId, toDate, auditNote(currentDate, toDate, reason));
        log.info("训练改期成功 - workoutId: {}, newDate: {}", workoutId, toDate);
    }

    @Override
    public void delete(Long userId, Long workoutId) {
        if (!deleteIfExists(userId, workoutId)) {
            throw new WorkoutNotFoundException(workoutId);
        }
    }

    @Override
    public boolean deleteIfExists(Long userId, Long workoutId) {
        log.info("删除训练 - userId: {}, workoutId: {}", userId, workoutId);

        if (userId == null) {
            throw new BusinessException(401, "用户未登录");
        }

        boolean deleted = workoutStore.deleteWorkout(userId, workoutId);
        if (deleted) {
            log.info("训练删除成功 - id: {}", workoutId);
        } else {
            log.info("训练不存在，未删除 - id: {}", workoutId);
        }
        return deleted;
    }

    @Override
    public void markCompleted(Long userId, Long workoutId) {
        log.info("标记训练完成 - userId: {}, workoutId: {}", userId, workoutId);

        if (userId == null) {
            throw new BusinessException(401, "用户未登录");
        }

        workoutStore.markCompleted(userId, workoutId);
    }

    private String auditNote(LocalDate fromDate, LocalDate toDate, String reason) {
        String note = "已改期 " + DateMath.format(fromDate) + " -> " + DateMath.format(toDate);
        if (StringUtils.hasText(reason)) {
            note += "，原因: " + reason.trim();
        }
        return note;
    }
}
