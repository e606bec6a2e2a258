package com.gymtracker.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 训练记录。(user_id, workout_date) 唯一：每个用户每天最多一条训练。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "workouts",
        uniqueConstraints = @UniqueConstraint(name = Workout.USER_DATE_CONSTRAINT,
                columnNames = {"user_id", "workout_date"}))
public class Workout {

    public static final String USER_DATE_CONSTRAINT = "uk_workouts_user_date";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull(message = "用户ID不能为空")
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "plan_id")
    private Long planId;

    @NotNull(message = "训练日期不能为空")
    @Column(name = "workout_date", nullable = false)
    private LocalDate workoutDate;

    @NotBlank(message = "训练标题不能为空")
    @Size(max = 200, message = "训练标题不能超过200字符")
    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "is_completed", nullable = false)
    private boolean completed = false;

    @Min(value = 1, message = "训练时长必须大于0")
    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
