package com.gymtracker.service;

import com.gymtracker.dto.ScheduleAssignment;
import com.gymtracker.exception.BusinessException;
import com.gymtracker.exception.InvalidFrequencyException;
import com.gymtracker.utils.DateMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 把每周训练模板分配到具体日期。纯函数：相同输入总是得到相同日期。
 */
@Slf4j
@Service
public class SchedulePlanner {

    public static final int MIN_FREQUENCY = 1;
    public static final int MAX_FREQUENCY = 7;
    public static final int HORIZON_DAYS = 7;

    // 下标为每周次数，值为周期内安排训练的天（0 = 周期第一天）
    private static final int[][] DAY_SELECTION = {
            {},
            {1},
            {1, 4},
            {1, 3, 5},
            {1, 2, 4, 5},
            {1, 2, 3, 4, 5},
            {1, 2, 3, 4, 5, 6},
            {0, 1, 2, 3, 4, 5, 6}
    };

    /**
     * 在 horizonStart 开始的 7 天内安排 frequency 次训练，训练位按顺序轮流使用
     */
    public List<ScheduleAssignment> assign(int frequency, List<String> slots, LocalDate horizonStart) {
        if (frequency < MIN_FREQUENCY || frequency > MAX_FREQUENCY) {
            throw new InvalidFrequencyException(frequency);
        }
        if (slots == null || slots.isEmpty()) {
            throw new BusinessException(400, "训练位不能为空");
        }

        List<ScheduleAssignment> assignments = new ArrayList<>(frequency);
        int slotIndex = 0;
        for (int day = 0; day < HORIZON_DAYS; day++) {
            if (!isTrainingDay(frequency, day)) {
                continue;
            }
            String slot = slots.get(slotIndex % slots.size());
            assignments.add(new ScheduleAssignment(DateMath.addDays(horizonStart, day), slot));
            slotIndex++;
        }

        log.debug("训练日期分配完成 - frequency: {}, horizonStart: {}, assignments: {}",
                frequency, horizonStart, assignments.size());
        return Collections.unmodifiableList(assignments);
    }

    public boolean isTrainingDay(int frequency, int dayIndex) {
        for (int selected : DAY_SELECTION[frequency]) {
            if (selected == dayIndex) {
                return true;
            }
        }
        return false;
    }
}
