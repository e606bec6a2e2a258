package com.gymtracker.controller;

import com.gymtracker.dto.ApiResponse;
import com.gymtracker.dto.CreatePlanRequest;
import com.gymtracker.dto.PlanResult;
import com.gymtracker.dto.ScheduleAssignment;
import com.gymtracker.entity.WorkoutPlan;
import com.gymtracker.service.WorkoutPlanService;
import com.gymtracker.utils.JwtUtil;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/plans")
@RequiredArgsConstructor
public class WorkoutPlanController {

    private final WorkoutPlanService workoutPlanService;
    private final JwtUtil jwtUtil;

    /**
     * 1. 预览排期（不写入）
     * POST /api/plans/preview
     */
    @PostMapping("/preview")
    public ApiResponse<List<ScheduleAssignment>> previewPlan(@Valid @RequestBody CreatePlanRequest request) {
        log.info("预览训练计划 - frequency: {}, slots: {}", request.getFrequency(), request.getSlots().size());
        return ApiResponse.success(workoutPlanService.previewPlan(request));
    }

    /**
     * 2. 创建计划并生成第一周训练
     * POST /api/plans
     */
    @PostMapping
    public ApiResponse<PlanResult> createPlan(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @Valid @RequestBody CreatePlanRequest request) {

        Long userId = jwtUtil.getUserIdFromHeader(authHeader);
        log.info("创建训练计划请求 - userId: {}, template: {}", userId, request.getTemplateName());
        return ApiResponse.success("创建成功", workoutPlanService.createPlan(userId, request));
    }

    /**
     * 3. 计划列表
     * GET /api/plans
     */
    @GetMapping
    public ApiResponse<List<WorkoutPlan>> getPlans(
            @RequestHeader(value = "Authorization", required = false) String authHeader) {

        Long userId = jwtUtil.getUserIdFromHeader(authHeader);
        log.info("获取训练计划列表 - userId: {}", userId);
        return ApiResponse.success(workoutPlanService.getPlans(userId));
    }
}
