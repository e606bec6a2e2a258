package com.gymtracker.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Entity
@Table(name = "workout_plans")
public class WorkoutPlan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Size(max = 200, message = "模板名称不能超过200字符")
    @Column(name = "template_name", nullable = false, length = 200)
    private String templateName;

    @Min(value = 1, message = "每周训练次数不能小于1")
    @Max(value = 7, message = "每周训练次数不能大于7")
    @Column(name = "goal_days_per_week", nullable = false)
    private Integer goalDaysPerWeek;

    @Column(name = "plan_scope", length = 20)
    private String planScope = "weekly";

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
