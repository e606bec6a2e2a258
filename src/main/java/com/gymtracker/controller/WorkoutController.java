package com.gymtracker.controller;

import com.gymtracker.dto.*;
import com.gymtracker.service.CalendarService;
import com.gymtracker.service.RescheduleCoordinator;
import com.gymtracker.utils.DateMath;
import com.gymtracker.utils.JwtUtil;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@Slf4j
@RestController
@RequestMapping("/api/workouts")
@RequiredArgsConstructor
public class WorkoutController {

    private final RescheduleCoordinator rescheduleCoordinator;
    private final CalendarService calendarService;
    private final JwtUtil jwtUtil;

    /**
     * 1. 在指定日期创建训练
     * POST /api/workouts
     */
    @PostMapping
    public ApiResponse<Long> createWorkout(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @Valid @RequestBody CreateWorkoutRequest request) {

        Long userId = jwtUtil.getUserIdFromHeader(authHeader);
        log.info("创建训练请求 - userId: {}, date: {}", userId, request.getDate());
        Long workoutId = rescheduleCoordinator.create(
                userId, DateMath.parse(request.getDate()), request.getTitle(), request.getExercises());

        return ApiResponse.success("创建成功", workoutId);
    }

    /**
     * 2. 训练详情
     * GET /api/workouts/{id}
     */
    @GetMapping("/{id}")
    public ApiResponse<WorkoutPreview> getWorkout(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @PathVariable Long id) {

        Long userId = jwtUtil.getUserIdFromHeader(authHeader);
        log.info("获取训练详情 - userId: {}, workoutId: {}", userId, id);
        return ApiResponse.success(calendarService.getWorkoutPreview(userId, id));
    }

    /**
     * 3. 改期
     * PATCH /api/workouts/{id}/reschedule
     */
    @PatchMapping("/{id}/reschedule")
    public ApiResponse<Void> rescheduleWorkout(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @PathVariable Long id,
            @Valid @RequestBody RescheduleRequest request) {

        Long userId = jwtUtil.getUserIdFromHeader(authHeader);
        log.info("改期请求 - userId: {}, workoutId: {}, toDate: {}", userId, id, request.getToDate());
        LocalDate fromDate = StringUtils.hasText(request.getFromDate())
                ? DateMath.parse(request.getFromDate()) : null;
        rescheduleCoordinator.reschedule(
                userId, id, fromDate, DateMath.parse(request.getToDate()), request.getReason());

        return ApiResponse.success("改期成功", null);
    }

    /**
     * 4. 删除训练；ignoreMissing=true 时重复删除不报错
     * DELETE /api/workouts/{id}
     */
    @DeleteMapping("/{id}")
    public ApiResponse<Void> deleteWorkout(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @PathVariable Long id,
            @RequestParam(defaultValue = "false") boolean ignoreMissing) {

        Long userId = jwtUtil.getUserIdFromHeader(authHeader);
        log.info("删除训练请求 - userId: {}, workoutId: {}, ignoreMissing: {}", userId, id, ignoreMissing);
        if (ignoreMissing) {
            rescheduleCoordinator.deleteIfExists(userId, id);
        } else {
            rescheduleCoordinator.delete(userId, id);
        }

        return ApiResponse.success("删除成功", null);
    }

    /**
     * 5. 标记完成
     * POST /api/workouts/{id}/complete
     */
    @PostMapping("/{id}/complete")
    public ApiResponse<Void> completeWorkout(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @PathVariable Long id) {

        Long userId = jwtUtil.getUserIdFromHeader(authHeader);
        log.info("完成训练请求 - userId: {}, workoutId: {}", userId, id);
        rescheduleCoordinator.markCompleted(userId, id);

        return ApiResponse.success("训练已完成", null);
    }
}
