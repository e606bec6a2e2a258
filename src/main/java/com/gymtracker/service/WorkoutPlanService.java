package com.gymtracker.service;

import com.gymtracker.dto.CreatePlanRequest;
import com.gymtracker.dto.PlanResult;
import com.gymtracker.dto.ScheduleAssignment;
import com.gymtracker.entity.WorkoutPlan;

import java.util.List;

public interface WorkoutPlanService {

    // 预览排期，不写入
    List<ScheduleAssignment> previewPlan(CreatePlanRequest request);

    // 创建计划并生成第一周的训练
    PlanResult createPlan(Long userId, CreatePlanRequest request);

    List<WorkoutPlan> getPlans(Long userId);
}
