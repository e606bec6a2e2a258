package com.gymtracker.service.impl;

import com.gymtracker.dao.WorkoutDao;
import com.gymtracker.dao.WorkoutExerciseDao;
import com.gymtracker.dto.ExerciseRequest;
import com.gymtracker.dto.WorkoutSummary;
import com.gymtracker.entity.Workout;
import com.gymtracker.entity.WorkoutExercise;
import com.gymtracker.exception.DateConflictException;
import com.gymtracker.exception.UpstreamFailureException;
import com.gymtracker.exception.WorkoutNotFoundException;
import com.gymtracker.service.TransactionRunner;
import com.gymtracker.service.WorkoutStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 JPA 的训练存储。唯一约束 uk_workouts_user_date 是"每天一条训练"的最终保障，
 * 写入时立即 flush，让并发冲突在本次调用内以 DateConflictException 返回。
 * 查询和事务本身的失败都以 UpstreamFailureException 返回。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkoutStoreImpl implements WorkoutStore {

    private final WorkoutDao workoutDao;
    private final WorkoutExerciseDao workoutExerciseDao;
    private final TransactionRunner transactionRunner;
    private final Clock clock;

    @Override
    public Map<LocalDate, WorkoutSummary> fetchWorkouts(Long userId, LocalDate startDate, LocalDate endDate) {
        return transactionRunner.read("fetchWorkouts", () -> doFetchWorkouts(userId, startDate, endDate));
    }

    private Map<LocalDate, WorkoutSummary> doFetchWorkouts(Long userId, LocalDate startDate, LocalDate endDate) {
        try {
            List<Workout> workouts = workoutDao.findByUserIdAndWorkoutDateBetweenOrderByWorkoutDateAsc(
                    userId, startDate, endDate);
            Map<Long, Integer> exerciseCounts = countExercises(workouts);

            Map<LocalDate, WorkoutSummary> result = new LinkedHashMap<>();
            for (Workout workout : workouts) {
                result.put(workout.getWorkoutDate(), WorkoutSummary.builder()
                        .id(workout.getId())
                        .title(workout.getTitle())
                        .completed(workout.isCompleted())
                        .exerciseCount(exerciseCounts.getOrDefault(workout.getId(), 0))
                        .durationMinutes(workout.getDurationMinutes())
                        .completionRate(workout.isCompleted() ? 100 : null)
                        .build());
            }
            return result;
        } catch (DataAccessException e) {
            throw upstream("fetchWorkouts", e);
        }
    }

    @Override
    public Optional<Workout> findWorkout(Long userId, Long workoutId) {
        return transactionRunner.read("findWorkout", () -> {
            try {
                return workoutDao.findByIdAndUserId(workoutId, userId);
            } catch (DataAccessException e) {
                throw upstream("findWorkout", e);
            }
        });
    }

    @Override
    public boolean isDateOccupied(Long userId, LocalDate date, Long excludeWorkoutId) {
        return transactionRunner.read("isDateOccupied", () -> {
            try {
                if (excludeWorkoutId == null) {
                    return workoutDao.existsByUserIdAndWorkoutDate(userId, date);
                }
                return workoutDao.existsByUserIdAndWorkoutDateAndIdNot(userId, date, excludeWorkoutId);
            } catch (DataAccessException e) {
                throw upstream("isDateOccupied", e);
            }
        });
    }

    @Override
    public Long createWorkout(Long userId, LocalDate date, String title, Long planId,
                              List<ExerciseRequest> exercises) {
        return transactionRunner.call("createWorkout",
                () -> doCreateWorkout(userId, date, title, planId, exercises));
    }

    private Long doCreateWorkout(Long userId, LocalDate date, String title, Long planId,
                                 List<ExerciseRequest> exercises) {
        Workout workout = new Workout();
        workout.setUserId(userId);
        workout.setPlanId(planId);
        workout.setWorkoutDate(date);
        workout.setTitle(title);
        workout.setCompleted(false);

        Workout saved;
        try {
            saved = workoutDao.saveAndFlush(workout);
        } catch (DataIntegrityViolationException e) {
            throw conflictOrUpstream(date, "createWorkout", e);
        } catch (DataAccessException e) {
            throw upstream("createWorkout", e);
        }

        if (exercises != null && !exercises.isEmpty()) {
            try {
                workoutExerciseDao.saveAll(toExercises(userId, saved.getId(), exercises));
            } catch (DataAccessException e) {
                throw upstream("createWorkout.exercises", e);
            }
        }
        return saved.getId();
    }

    @Override
    public void rescheduleWorkout(Long userId, Long workoutId, LocalDate toDate, String note) {
        transactionRunner.run("rescheduleWorkout", () -> {
            try {
                Workout workout = workoutDao.findByIdAndUserId(workoutId, userId)
                        .orElseThrow(() -> new WorkoutNotFoundException(workoutId));
                workout.setWorkoutDate(toDate);
                workout.setNotes(note);
                workoutDao.saveAndFlush(workout);
            } catch (DataIntegrityViolationException e) {
                throw conflictOrUpstream(toDate, "rescheduleWorkout", e);
            } catch (DataAccessException e) {
                throw upstream("rescheduleWorkout", e);
            }
        });
    }

    @Override
    public boolean deleteWorkout(Long userId, Long workoutId) {
        return transactionRunner.call("deleteWorkout", () -> {
            try {
                if (workoutDao.findByIdAndUserId(workoutId, userId).isEmpty()) {
                    return false;
                }
                workoutExerciseDao.deleteByWorkoutId(workoutId);
                return workoutDao.deleteByIdAndUserId(workoutId, userId) > 0;
            } catch (DataAccessException e) {
                throw upstream("deleteWorkout", e);
            }
        });
    }

    @Override
    public void markCompleted(Long userId, Long workoutId) {
        transactionRunner.run("markCompleted", () -> {
            int updated;
            try {
                updated = workoutDao.markCompleted(workoutId, userId);
            } catch (DataAccessException e) {
                throw upstream("markCompleted", e);
            }
            if (updated == 0) {
                throw new WorkoutNotFoundException(workoutId);
            }
        });
    }

    @Override
    public List<WorkoutExercise> fetchExercises(Long workoutId) {
        return transactionRunner.read("fetchExercises", () -> {
            try {
                return workoutExerciseDao.findByWorkoutIdOrderByOrderIndexAsc(workoutId);
            } catch (DataAccessException e) {
                throw upstream("fetchExercises", e);
            }
        });
    }

    private Map<Long, Integer> countExercises(List<Workout> workouts) {
        if (workouts.isEmpty()) {
            return Map.of();
        }
        List<Long> ids = workouts.stream().map(Workout::getId).toList();
        Map<Long, Integer> counts = new HashMap<>();
        for (Object[] row : workoutExerciseDao.countByWorkoutIds(ids)) {
            counts.put((Long) row[0], ((Number) row[1]).intValue());
        }
        return counts;
    }

    private List<WorkoutExercise> toExercises(Long userId, Long workoutId, List<ExerciseRequest> requests) {
        List<WorkoutExercise> exercises = new ArrayList<>(requests.size());
        LocalDateTime now = LocalDateTime.now(clock);
        for (int i = 0; i < requests.size(); i++) {
            ExerciseRequest request = requests.get(i);
            WorkoutExercise exercise = new WorkoutExercise();
            exercise.setWorkoutId(workoutId);
            exercise.setUserId(userId);
            exercise.setSlug(request.getSlug());
            exercise.setName(request.getName());
            exercise.setOrderIndex(i);
            exercise.setTargetSets(request.getTargetSets());
            exercise.setTargetReps(request.getTargetReps());
            exercise.setCompletedSets(0);
            exercise.setCreatedAt(now);
            exercises.add(exercise);
        }
        return exercises;
    }

    private RuntimeException conflictOrUpstream(LocalDate date, String operation,
                                                DataIntegrityViolationException e) {
        if (isUserDateViolation(e)) {
            log.warn("唯一约束拒绝写入，日期已被占用 - date: {}", date);
            return new DateConflictException(date, e);
        }
        return upstream(operation, e);
    }

    private boolean isUserDateViolation(Throwable e) {
        String constraint = Workout.USER_DATE_CONSTRAINT.toLowerCase(Locale.ROOT);
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof org.hibernate.exception.ConstraintViolationException cve
                    && cve.getConstraintName() != null
                    && cve.getConstraintName().toLowerCase(Locale.ROOT).contains(constraint)) {
                return true;
            }
            if (t.getMessage() != null && t.getMessage().toLowerCase(Locale.ROOT).contains(constraint)) {
                return true;
            }
        }
        return false;
    }

    private UpstreamFailureException upstream(String operation, DataAccessException e) {
        log.error("存储调用失败 - operation: {}", operation, e);
        return new UpstreamFailureException(operation, e);
    }
}
