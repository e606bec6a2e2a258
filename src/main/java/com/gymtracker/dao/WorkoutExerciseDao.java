package com.gymtracker.dao;

import com.gymtracker.entity.WorkoutExercise;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface WorkoutExerciseDao extends JpaRepository<WorkoutExercise, Long> {

    List<WorkoutExercise> findByWorkoutIdOrderByOrderIndexAsc(Long workoutId);

    // 每个训练的动作数量：[workoutId, count]
    @Query("SELECT e.workoutId, COUNT(e) FROM WorkoutExercise e " +
            "WHERE e.workoutId IN :workoutIds GROUP BY e.workoutId")
    List<Object[]> countByWorkoutIds(@Param("workoutIds") Collection<Long> workoutIds);

    @Modifying
    void deleteByWorkoutId(Long workoutId);
}
