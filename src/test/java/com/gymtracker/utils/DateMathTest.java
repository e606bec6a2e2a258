package com.gymtracker.utils;

import com.gymtracker.exception.InvalidDateFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DateMathTest {

    @Test
    void shouldBracketWednesdayWithMondayAndSunday() {
        LocalDate wednesday = LocalDate.of(2024, 1, 3);

        assertThat(DateMath.weekStart(wednesday)).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(DateMath.weekEnd(wednesday)).isEqualTo(LocalDate.of(2024, 1, 7));
    }

    @Test
    void shouldTreatSundayAsLastDayOfWeek() {
        LocalDate sunday = LocalDate.of(2024, 1, 7);

        assertThat(DateMath.weekStart(sunday)).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(DateMath.weekEnd(sunday)).isEqualTo(sunday);
    }

    @Test
    void shouldBracketEveryDayOfLeapYear() {
        for (LocalDate d = LocalDate.of(2024, 1, 1); d.getYear() == 2024; d = d.plusDays(1)) {
            LocalDate start = DateMath.weekStart(d);
            LocalDate end = DateMath.weekEnd(d);

            assertThat(start).isBeforeOrEqualTo(d);
            assertThat(end).isAfterOrEqualTo(d);
            assertThat(DateMath.daysBetween(start, end)).isEqualTo(6);
            assertThat(start.getDayOfWeek()).isEqualTo(DayOfWeek.MONDAY);
        }
    }

    @Test
    void shouldCrossYearBoundaryForWeekStart() {
        // 2025-01-01 是周三
        assertThat(DateMath.weekStart(LocalDate.of(2025, 1, 1))).isEqualTo(LocalDate.of(2024, 12, 30));
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-01-01", "2024-02-29", "1999-12-31", "2000-02-29"})
    void shouldRoundTripValidDates(String value) {
        assertThat(DateMath.format(DateMath.parse(value))).isEqualTo(value);
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-13-01", "2024-02-30", "2023-02-29", "2024-1-01", "2024/01/01",
            "20240101", "2024-01-01T00:00", "abcd-ef-gh"})
    void shouldRejectMalformedDates(String value) {
        assertThatThrownBy(() -> DateMath.parse(value))
                .isInstanceOf(InvalidDateFormatException.class);
    }

    @ParameterizedTest
    @NullAndEmptySource
    void shouldRejectMissingDates(String value) {
        assertThatThrownBy(() -> DateMath.parse(value))
                .isInstanceOf(InvalidDateFormatException.class);
    }

    @Test
    void shouldRollMonthsOverYearBoundary() {
        assertThat(DateMath.previousMonth(2024, 0)).isEqualTo(YearMonth.of(2023, 12));
        assertThat(DateMath.nextMonth(2024, 11)).isEqualTo(YearMonth.of(2025, 1));
        assertThat(DateMath.nextMonth(2024, 0)).isEqualTo(YearMonth.of(2024, 2));
    }

    @Test
    void shouldIndexDaysOfWeekFromSunday() {
        assertThat(DateMath.dayOfWeekIndex(LocalDate.of(2024, 1, 7))).isZero();
        assertThat(DateMath.dayOfWeekIndex(LocalDate.of(2024, 1, 1))).isEqualTo(1);
        assertThat(DateMath.dayOfWeekIndex(LocalDate.of(2024, 1, 6))).isEqualTo(6);
    }

    @Test
    void shouldResolveTodayInClockZone() {
        // UTC 2024-01-17 23:30 在东京已是 1 月 18 日
        Instant instant = Instant.parse("2024-01-17T23:30:00Z");
        Clock utc = Clock.fixed(instant, ZoneOffset.UTC);
        Clock tokyo = Clock.fixed(instant, ZoneId.of("Asia/Tokyo"));

        assertThat(DateMath.isToday(LocalDate.of(2024, 1, 17), utc)).isTrue();
        assertThat(DateMath.isToday(LocalDate.of(2024, 1, 18), tokyo)).isTrue();
        assertThat(DateMath.sameDay(LocalDate.of(2024, 1, 17), LocalDate.of(2024, 1, 18))).isFalse();
    }

    @Test
    void shouldAddDaysAndWeeks() {
        LocalDate date = LocalDate.of(2024, 2, 26);

        assertThat(DateMath.addDays(date, 4)).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(DateMath.addWeeks(date, -1)).isEqualTo(LocalDate.of(2024, 2, 19));
        assertThat(DateMath.firstOfMonth(date)).isEqualTo(LocalDate.of(2024, 2, 1));
    }
}
