package com.gymtracker.service.impl;

import com.gymtracker.dao.WorkoutPlanDao;
import com.gymtracker.dto.CreatePlanRequest;
import com.gymtracker.dto.ExerciseRequest;
import com.gymtracker.dto.PlanResult;
import com.gymtracker.dto.PlanSlotRequest;
import com.gymtracker.dto.ScheduleAssignment;
import com.gymtracker.entity.WorkoutPlan;
import com.gymtracker.exception.BusinessException;
import com.gymtracker.exception.DateConflictException;
import com.gymtracker.exception.UpstreamFailureException;
import com.gymtracker.service.HorizonPolicy;
import com.gymtracker.service.SchedulePlanner;
import com.gymtracker.service.TransactionRunner;
import com.gymtracker.service.WorkoutPlanService;
import com.gymtracker.service.WorkoutStore;
import com.gymtracker.utils.DateMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class WorkoutPlanServiceImpl implements WorkoutPlanService {

    private static final String PLAN_SCOPE_WEEKLY = "weekly";

    private final WorkoutPlanDao workoutPlanDao;
    private final WorkoutStore workoutStore;
    private final SchedulePlanner schedulePlanner;
    private final HorizonPolicy horizonPolicy;
    private final TransactionRunner transactionRunner;

    @Override
    public List<ScheduleAssignment> previewPlan(CreatePlanRequest request) {
        return schedulePlanner.assign(frequency(request), slotNames(request), resolveHorizonStart(request));
    }

    @Override
    public PlanResult createPlan(Long userId, CreatePlanRequest request) {
        // 日期检查与全部写入在同一事务内，任一步失败整个计划回滚
        return transactionRunner.call("createPlan", () -> doCreatePlan(userId, request));
    }

    private PlanResult doCreatePlan(Long userId, CreatePlanRequest request) {
        log.info("创建训练计划 - userId: {}, template: {}, frequency: {}",
                userId, request.getTemplateName(), request.getFrequency());

        if (userId == null) {
            throw new BusinessException(401, "用户未登录");
        }

        LocalDate horizonStart = resolveHorizonStart(request);
        List<ScheduleAssignment> assignments =
                schedulePlanner.assign(frequency(request), slotNames(request), horizonStart);

        // 写入前先检查全部日期，任一日期被占用则整个计划不创建
        for (ScheduleAssignment assignment : assignments) {
            if (workoutStore.isDateOccupied(userId, assignment.getDate(), null)) {
                throw new DateConflictException(assignment.getDate());
            }
        }

        WorkoutPlan plan = new WorkoutPlan();
        plan.setUserId(userId);
        plan.setTemplateName(request.getTemplateName().trim());
        plan.setGoalDaysPerWeek(request.getFrequency());
        plan.setPlanScope(PLAN_SCOPE_WEEKLY);
        plan.setStartDate(horizonStart);

        WorkoutPlan saved;
        try {
            saved = workoutPlanDao.save(plan);
        } catch (DataAccessException e) {
            log.error("保存训练计划失败 - userId: {}", userId, e);
            throw new UpstreamFailureException("createPlan", e);
        }

        Map<String, List<ExerciseRequest>> exercisesBySlot = exercisesBySlot(request);
        List<Long> workoutIds = new ArrayList<>(assignments.size());
        for (ScheduleAssignment assignment : assignments) {
            Long workoutId = workoutStore.createWorkout(
                    userId,
                    assignment.getDate(),
                    assignment.getSlotName(),
                    saved.getId(),
                    exercisesBySlot.getOrDefault(assignment.getSlotName(), Collections.emptyList())
            );
            workoutIds.add(workoutId);
        }

        log.info("训练计划创建成功 - planId: {}, workouts: {}", saved.getId(), workoutIds.size());
        return new PlanResult(saved.getId(), horizonStart, assignments, workoutIds);
    }

    @Override
    public List<WorkoutPlan> getPlans(Long userId) {
        if (userId == null) {
            throw new BusinessException(401, "用户未登录");
        }
        return transactionRunner.read("getPlans", () -> {
            try {
                return workoutPlanDao.findByUserIdOrderByCreatedAtDesc(userId);
            } catch (DataAccessException e) {
                throw new UpstreamFailureException("getPlans", e);
            }
        });
    }

    private LocalDate resolveHorizonStart(CreatePlanRequest request) {
        if (StringUtils.hasText(request.getHorizonStart())) {
            return DateMath.parse(request.getHorizonStart());
        }
        return horizonPolicy.horizonStart();
    }

    private int frequency(CreatePlanRequest request) {
        if (request.getFrequency() == null) {
            throw new BusinessException(400, "每周训练次数不能为空");
        }
        return request.getFrequency();
    }

    private List<String> slotNames(CreatePlanRequest request) {
        if (request.getSlots() == null) {
            return Collections.emptyList();
        }
        return request.getSlots().stream()
                .map(PlanSlotRequest::getName)
                .collect(Collectors.toList());
    }

    // 同名训练位取第一个的动作
    private Map<String, List<ExerciseRequest>> exercisesBySlot(CreatePlanRequest request) {
        Map<String, List<ExerciseRequest>> result = new LinkedHashMap<>();
        for (PlanSlotRequest slot : request.getSlots()) {
            result.putIfAbsent(slot.getName(),
                    slot.getExercises() != null ? slot.getExercises() : Collections.emptyList());
        }
        return result;
    }
}
