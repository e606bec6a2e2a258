package com.gymtracker.service;

import com.gymtracker.dto.CalendarDay;
import com.gymtracker.dto.WorkoutStatus;
import com.gymtracker.dto.WorkoutSummary;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class WorkoutStatusResolverTest {

    private final WorkoutStatusResolver resolver = new WorkoutStatusResolver();

    @Test
    void shouldReturnNoneWithoutWorkout() {
        assertThat(resolver.resolve(day(null))).isEqualTo(WorkoutStatus.NONE);
    }

    @Test
    void shouldPreferCompletedOverRest() {
        WorkoutSummary workout = WorkoutSummary.builder().id(1L).completed(true).exerciseCount(0).build();

        assertThat(resolver.resolve(day(workout))).isEqualTo(WorkoutStatus.COMPLETED);
    }

    @Test
    void shouldTreatZeroExercisesAsRestDay() {
        WorkoutSummary workout = WorkoutSummary.builder().id(1L).title("Rest").exerciseCount(0).build();

        assertThat(resolver.resolve(day(workout))).isEqualTo(WorkoutStatus.REST);
    }

    @Test
    void shouldReturnScheduledForPendingWorkout() {
        WorkoutSummary workout = WorkoutSummary.builder().id(1L).title("Upper A").exerciseCount(6).build();

        assertThat(resolver.resolve(day(workout))).isEqualTo(WorkoutStatus.SCHEDULED);
    }

    @Test
    void shouldDefaultCompletionRateFromCompletedFlag() {
        assertThat(resolver.completionRate(WorkoutSummary.builder().completed(true).build())).isEqualTo(100);
        assertThat(resolver.completionRate(WorkoutSummary.builder().completed(false).build())).isZero();
        assertThat(resolver.completionRate(WorkoutSummary.builder().completionRate(40).build())).isEqualTo(40);
    }

    private CalendarDay day(WorkoutSummary workout) {
        return new CalendarDay(LocalDate.of(2024, 1, 5), 5, false, true, workout);
    }
}
