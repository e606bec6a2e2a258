package com.gymtracker.controller;

import com.gymtracker.dto.*;
import com.gymtracker.service.CalendarService;
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
@RequestMapping("/api/calendar")
@RequiredArgsConstructor
public class CalendarController {

    private final CalendarService calendarService;
    private final JwtUtil jwtUtil;

    /**
     * 1. 周视图
     * GET /api/calendar/week?date=2024-01-03
     */
    @GetMapping("/week")
    public ApiResponse<CalendarWeek> getWeek(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @RequestParam String date) {

        Long userId = jwtUtil.getUserIdFromHeader(authHeader);
        log.info("获取周视图 - userId: {}, date: {}", userId, date);
        return ApiResponse.success(calendarService.getWeek(userId, DateMath.parse(date)));
    }

    /**
     * 2. 月视图，month 从 0 开始
     * GET /api/calendar/month?year=2024&month=1
     */
    @GetMapping("/month")
    public ApiResponse<CalendarMonth> getMonth(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @RequestParam Integer year,
            @RequestParam Integer month) {

        Long userId = jwtUtil.getUserIdFromHeader(authHeader);
        log.info("获取月视图 - userId: {}, year: {}, month: {}", userId, year, month);
        return ApiResponse.success(calendarService.getMonth(userId, year, month));
    }

    /**
     * 3. 按导航状态获取视图，返回的 navigation 用于客户端丢弃过期响应
     * GET /api/calendar/view?date=2024-01-17&mode=MONTH
     */
    @GetMapping("/view")
    public ApiResponse<CalendarView> getView(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @RequestParam String date,
            @RequestParam(defaultValue = "WEEK") ViewMode mode) {

        Long userId = jwtUtil.getUserIdFromHeader(authHeader);
        log.info("获取日历视图 - userId: {}, date: {}, mode: {}", userId, date, mode);
        NavigationState state = new NavigationState(DateMath.parse(date), mode);
        return ApiResponse.success(calendarService.getView(userId, state));
    }

    /**
     * 4. 导航（上一页/下一页/今天/跳转/切换视图）
     * POST /api/calendar/navigate
     */
    @PostMapping("/navigate")
    public ApiResponse<NavigationState> navigate(@Valid @RequestBody NavigateRequest request) {
        NavigationState current = new NavigationState(
                DateMath.parse(request.getReferenceDate()), request.getViewMode());
        LocalDate targetDate = StringUtils.hasText(request.getTargetDate())
                ? DateMath.parse(request.getTargetDate()) : null;

        NavigationState next = calendarService.navigate(
                current, request.getAction(), targetDate, request.getTargetMode());
        log.debug("日历导航 - action: {}, {} -> {}", request.getAction(), current, next);
        return ApiResponse.success(next);
    }

    /**
     * 5. 某一天的训练状态
     * GET /api/calendar/status?date=2024-01-05
     */
    @GetMapping("/status")
    public ApiResponse<WorkoutStatus> getStatus(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @RequestParam String date) {

        Long userId = jwtUtil.getUserIdFromHeader(authHeader);
        log.info("查询训练状态 - userId: {}, date: {}", userId, date);
        return ApiResponse.success(calendarService.getStatus(userId, DateMath.parse(date)));
    }

    /**
     * 6. 区间统计
     * GET /api/calendar/stats?startDate=2024-01-01&endDate=2024-01-31
     */
    @GetMapping("/stats")
    public ApiResponse<WorkoutStats> getStats(
            @RequestHeader(value = "Authorization", required = false) String authHeader,
            @RequestParam String startDate,
            @RequestParam String endDate) {

        Long userId = jwtUtil.getUserIdFromHeader(authHeader);
        log.info("查询训练统计 - userId: {}, {} ~ {}", userId, startDate, endDate);
        WorkoutStats stats = calendarService.getStats(userId, DateMath.parse(startDate), DateMath.parse(endDate));
        return ApiResponse.success(stats);
    }
}
