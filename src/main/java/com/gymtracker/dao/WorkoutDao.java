package com.gymtracker.dao;

import com.gymtracker.entity.Workout;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface WorkoutDao extends JpaRepository<Workout, Long> {

    // 区间查询（闭区间），按日期升序
    List<Workout> findByUserIdAndWorkoutDateBetweenOrderByWorkoutDateAsc(Long userId,
                                                                         LocalDate startDate,
                                                                         LocalDate endDate);

    // 查询单条训练（同时验证用户权限）
    Optional<Workout> findByIdAndUserId(Long id, Long userId);

    Optional<Workout> findByUserIdAndWorkoutDate(Long userId, LocalDate workoutDate);

    boolean existsByUserIdAndWorkoutDate(Long userId, LocalDate workoutDate);

    // 目标日期是否被其他训练占用
    boolean existsByUserIdAndWorkoutDateAndIdNot(Long userId, LocalDate workoutDate, Long id);

    // 删除训练（同时验证用户权限）
    @Modifying
    int deleteByIdAndUserId(Long id, Long userId);

    @Modifying
    @Query("UPDATE Workout w SET w.completed = true, w.completedAt = CURRENT_TIMESTAMP " +
            "WHERE w.id = :id AND w.userId = :userId")
    int markCompleted(@Param("id") Long id, @Param("userId") Long userId);
}
