package com.gymtracker.exception;

import lombok.Getter;

@Getter
public class WorkoutNotFoundException extends BusinessException {

    private final Long workoutId;

    public WorkoutNotFoundException(Long workoutId) {
        super(404, "训练不存在或无权限操作: " + workoutId);
        this.workoutId = workoutId;
    }
}
