package com.gymtracker.service;

import com.gymtracker.dto.DateRange;
import com.gymtracker.dto.NavigationState;
import com.gymtracker.dto.ViewMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class NavigationControllerTest {

    private NavigationController navigation;

    @BeforeEach
    void setUp() {
        // 2024-01-17 周三
        Clock clock = Clock.fixed(Instant.parse("2024-01-17T10:00:00Z"), ZoneOffset.UTC);
        navigation = new NavigationController(clock);
    }

    @Test
    void shouldNormalizeInitialStateToMonday() {
        NavigationState state = navigation.initial(ViewMode.WEEK);

        assertThat(state.getReferenceDate()).isEqualTo(LocalDate.of(2024, 1, 15));
        assertThat(state.getViewMode()).isEqualTo(ViewMode.WEEK);
    }

    @Test
    void shouldSnapToFirstOfMonthWhenSwitchingToMonth() {
        NavigationState state = new NavigationState(LocalDate.of(2024, 1, 17), ViewMode.WEEK);

        NavigationState month = navigation.setViewMode(state, ViewMode.MONTH);

        assertThat(month.getReferenceDate()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(month.getViewMode()).isEqualTo(ViewMode.MONTH);
    }

    @Test
    void shouldSnapToMondayWhenSwitchingToWeek() {
        NavigationState state = new NavigationState(LocalDate.of(2024, 3, 1), ViewMode.MONTH);

        NavigationState week = navigation.setViewMode(state, ViewMode.WEEK);

        assertThat(week.getReferenceDate()).isEqualTo(LocalDate.of(2024, 2, 26));
    }

    @Test
    void shouldShiftWeekByExactlySevenDays() {
        NavigationState state = new NavigationState(LocalDate.of(2024, 1, 1), ViewMode.WEEK);

        assertThat(navigation.goToNext(state).getReferenceDate()).isEqualTo(LocalDate.of(2024, 1, 8));
        assertThat(navigation.goToPrevious(state).getReferenceDate()).isEqualTo(LocalDate.of(2023, 12, 25));
    }

    @Test
    void shouldMoveToAdjacentMonthAcrossYearBoundary() {
        NavigationState january = new NavigationState(LocalDate.of(2024, 1, 1), ViewMode.MONTH);
        NavigationState december = new NavigationState(LocalDate.of(2024, 12, 1), ViewMode.MONTH);

        assertThat(navigation.goToPrevious(january).getReferenceDate()).isEqualTo(LocalDate.of(2023, 12, 1));
        assertThat(navigation.goToNext(december).getReferenceDate()).isEqualTo(LocalDate.of(2025, 1, 1));
    }

    @Test
    void shouldNormalizeOnGoToDateAndToday() {
        NavigationState month = new NavigationState(LocalDate.of(2023, 5, 1), ViewMode.MONTH);

        assertThat(navigation.goToDate(month, LocalDate.of(2024, 8, 20)).getReferenceDate())
                .isEqualTo(LocalDate.of(2024, 8, 1));
        assertThat(navigation.goToday(month).getReferenceDate()).isEqualTo(LocalDate.of(2024, 1, 1));

        NavigationState week = new NavigationState(LocalDate.of(2023, 5, 1), ViewMode.WEEK);
        assertThat(navigation.goToday(week).getReferenceDate()).isEqualTo(LocalDate.of(2024, 1, 15));
    }

    @Test
    void shouldCoverGridSpanForMonthRange() {
        DateRange range = navigation.visibleRange(new NavigationState(LocalDate.of(2024, 2, 1), ViewMode.MONTH));

        assertThat(range.getStartDate()).isEqualTo(LocalDate.of(2024, 1, 29));
        assertThat(range.getEndDate()).isEqualTo(LocalDate.of(2024, 3, 3));
    }

    @Test
    void shouldCoverMondayToSundayForWeekRange() {
        DateRange range = navigation.visibleRange(new NavigationState(LocalDate.of(2024, 1, 15), ViewMode.WEEK));

        assertThat(range.getStartDate()).isEqualTo(LocalDate.of(2024, 1, 15));
        assertThat(range.getEndDate()).isEqualTo(LocalDate.of(2024, 1, 21));
        assertThat(range.contains(LocalDate.of(2024, 1, 21))).isTrue();
        assertThat(range.contains(LocalDate.of(2024, 1, 22))).isFalse();
    }
}
