package com.gymtracker.service;

import com.gymtracker.dto.CalendarDay;
import com.gymtracker.dto.WorkoutStatus;
import com.gymtracker.dto.WorkoutSummary;
import org.springframework.stereotype.Service;

@Service
public class WorkoutStatusResolver {

    /**
     * 完成状态优先于休息日判断：已完成的 0 动作训练显示为 COMPLETED
     */
    public WorkoutStatus resolve(CalendarDay day) {
        WorkoutSummary workout = day.getWorkout();
        if (workout == null) {
            return WorkoutStatus.NONE;
        }
        if (workout.isCompleted()) {
            return WorkoutStatus.COMPLETED;
        }
        // 没有动作的训练记录表示休息日
        if (workout.getExerciseCount() == 0) {
            return WorkoutStatus.REST;
        }
        return WorkoutStatus.SCHEDULED;
    }

    public int completionRate(WorkoutSummary workout) {
        if (workout.getCompletionRate() != null) {
            return workout.getCompletionRate();
        }
        return workout.isCompleted() ? 100 : 0;
    }
}
