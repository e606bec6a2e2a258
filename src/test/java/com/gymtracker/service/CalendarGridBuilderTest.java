package com.gymtracker.service;

import com.gymtracker.dto.CalendarDay;
import com.gymtracker.dto.CalendarMonth;
import com.gymtracker.dto.CalendarWeek;
import com.gymtracker.dto.WorkoutSummary;
import com.gymtracker.exception.BusinessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalendarGridBuilderTest {

    private CalendarGridBuilder builder;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-17T10:00:00Z"), ZoneOffset.UTC);
        builder = new CalendarGridBuilder(clock);
    }

    @Test
    void shouldBuildWeekFromMondayToSundayWithWorkouts() {
        WorkoutSummary legDay = WorkoutSummary.builder()
                .id(1L).title("Lower A").exerciseCount(5).build();

        CalendarWeek week = builder.buildWeek(LocalDate.of(2024, 1, 17),
                Map.of(LocalDate.of(2024, 1, 18), legDay));

        assertThat(week.getDays()).hasSize(7);
        assertThat(week.getStartDate()).isEqualTo(LocalDate.of(2024, 1, 15));
        assertThat(week.getEndDate()).isEqualTo(LocalDate.of(2024, 1, 21));
        assertThat(week.getDays().get(0).getDayOfWeek()).isEqualTo(1);
        assertThat(week.getDays().get(6).getDayOfWeek()).isZero();
        assertThat(week.getDays()).allMatch(CalendarDay::isCurrentPeriod);

        CalendarDay wednesday = week.getDays().get(2);
        assertThat(wednesday.isToday()).isTrue();
        assertThat(wednesday.getWorkout()).isNull();

        CalendarDay thursday = week.getDays().get(3);
        assertThat(thursday.isToday()).isFalse();
        assertThat(thursday.getWorkout()).isSameAs(legDay);
    }

    @Test
    void shouldTolerateNullWorkoutMap() {
        CalendarWeek week = builder.buildWeek(LocalDate.of(2024, 1, 1), null);

        assertThat(week.getDays()).extracting(CalendarDay::getWorkout).containsOnlyNulls();
    }

    @Test
    void shouldBuildLeapFebruaryWithJanuarySpillOver() {
        CalendarMonth february = builder.buildMonth(2024, 1, Collections.emptyMap());

        assertThat(february.getMonthName()).isEqualTo("February");
        assertThat(february.getTotalDays()).isEqualTo(29);
        assertThat(february.getWeeks()).hasSize(5);

        List<CalendarDay> firstWeek = february.getWeeks().get(0).getDays();
        assertThat(firstWeek.get(0).getDate()).isEqualTo(LocalDate.of(2024, 1, 29));
        assertThat(firstWeek.get(0).isCurrentPeriod()).isFalse();

        long currentMonthDays = february.getWeeks().stream()
                .flatMap(w -> w.getDays().stream())
                .filter(CalendarDay::isCurrentPeriod)
                .count();
        assertThat(currentMonthDays).isEqualTo(29);
    }

    @Test
    void shouldAlwaysProduceCompleteContiguousWeeks() {
        for (int year = 2023; year <= 2026; year++) {
            for (int month = 0; month < 12; month++) {
                CalendarMonth grid = builder.buildMonth(year, month, Collections.emptyMap());

                assertThat(grid.getWeeks().size()).isBetween(4, 6);
                LocalDate previous = null;
                for (CalendarWeek week : grid.getWeeks()) {
                    assertThat(week.getDays()).hasSize(7);
                    assertThat(week.getDays().get(0).getDate().getDayOfWeek())
                            .isEqualTo(DayOfWeek.MONDAY);
                    assertThat(week.getStartDate()).isEqualTo(week.getDays().get(0).getDate());
                    assertThat(week.getEndDate()).isEqualTo(week.getDays().get(6).getDate());
                    for (CalendarDay day : week.getDays()) {
                        if (previous != null) {
                            assertThat(day.getDate()).isEqualTo(previous.plusDays(1));
                        }
                        previous = day.getDate();
                    }
                }
            }
        }
    }

    @Test
    void shouldBuildFourWeekFebruaryStartingOnMonday() {
        // 2021 年 2 月 1 日是周一，共 28 天
        CalendarMonth grid = builder.buildMonth(2021, 1, Collections.emptyMap());

        assertThat(grid.getWeeks()).hasSize(4);
        assertThat(grid.getWeeks().stream().flatMap(w -> w.getDays().stream()))
                .allMatch(CalendarDay::isCurrentPeriod);
    }

    @Test
    void shouldAttachWorkoutsOnSpillOverDays() {
        WorkoutSummary workout = WorkoutSummary.builder().id(9L).title("Full Body").exerciseCount(3).build();

        CalendarMonth grid = builder.buildMonth(2024, 1, Map.of(LocalDate.of(2024, 1, 30), workout));

        CalendarDay day = grid.getWeeks().get(0).getDays().get(1);
        assertThat(day.getDate()).isEqualTo(LocalDate.of(2024, 1, 30));
        assertThat(day.getWorkout()).isSameAs(workout);
    }

    @Test
    void shouldRejectMonthOutOfRange() {
        assertThatThrownBy(() -> builder.buildMonth(2024, 12, Collections.emptyMap()))
                .isInstanceOf(BusinessException.class);
    }
}
