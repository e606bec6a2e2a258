package com.gymtracker.service;

import com.gymtracker.utils.DateMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 新计划的排期起点：时钟时区内早于截止小时则从今天开始，否则从明天开始
 */
@Slf4j
@Component
public class HorizonPolicy {

    private final Clock clock;
    private final int earlyStartCutoffHour;

    public HorizonPolicy(Clock clock,
                         @Value("${gym.schedule.early-start-cutoff-hour:6}") int earlyStartCutoffHour) {
        if (earlyStartCutoffHour < 0 || earlyStartCutoffHour > 24) {
            throw new IllegalStateException("gym.schedule.early-start-cutoff-hour 必须在0-24之间: "
                    + earlyStartCutoffHour);
        }
        this.clock = clock;
        this.earlyStartCutoffHour = earlyStartCutoffHour;
    }

    public LocalDate horizonStart() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        LocalDate start = now.getHour() < earlyStartCutoffHour ? today : DateMath.addDays(today, 1);
        log.debug("排期起点 - now: {}, cutoffHour: {}, start: {}", now, earlyStartCutoffHour, start);
        return start;
    }
}
