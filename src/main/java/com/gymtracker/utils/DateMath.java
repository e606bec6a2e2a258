package com.gymtracker.utils;

import com.gymtracker.exception.InvalidDateFormatException;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * 日历日期工具：格式化/解析、周和月的边界计算。
 * 周一为一周的第一天，与系统 Locale 无关。
 */
public final class DateMath {

    public static final DayOfWeek FIRST_DAY_OF_WEEK = DayOfWeek.MONDAY;

    public static final int DAYS_PER_WEEK = 7;

    private static final DateTimeFormatter DATE_FORMATTER =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private DateMath() {
    }

    /**
     * 包含该日期的那一周的周一
     */
    public static LocalDate weekStart(LocalDate date) {
        int offset = date.getDayOfWeek().getValue() - FIRST_DAY_OF_WEEK.getValue();
        return date.minusDays(offset);
    }

    /**
     * 包含该日期的那一周的周日
     */
    public static LocalDate weekEnd(LocalDate date) {
        return weekStart(date).plusDays(DAYS_PER_WEEK - 1);
    }

    public static String format(LocalDate date) {
        return date.format(DATE_FORMATTER);
    }

    /**
     * 严格解析 yyyy-MM-dd，非法日期（如 2024-02-30）同样视为格式错误
     */
    public static LocalDate parse(String value) {
        if (value == null || value.length() != 10) {
            throw new InvalidDateFormatException(value);
        }
        try {
            return LocalDate.parse(value, DATE_FORMATTER);
        } catch (DateTimeParseException e) {
            throw new InvalidDateFormatException(value);
        }
    }

    public static boolean sameDay(LocalDate a, LocalDate b) {
        return Objects.equals(a, b);
    }

    public static LocalDate today(Clock clock) {
        return LocalDate.now(clock);
    }

    public static boolean isToday(LocalDate date, Clock clock) {
        return sameDay(date, today(clock));
    }

    public static LocalDate addDays(LocalDate date, long days) {
        return date.plusDays(days);
    }

    public static LocalDate addWeeks(LocalDate date, long weeks) {
        return date.plusWeeks(weeks);
    }

    public static LocalDate firstOfMonth(LocalDate date) {
        return date.withDayOfMonth(1);
    }

    /**
     * 上一个月，month 从 0 开始（0 = 一月）
     */
    public static YearMonth previousMonth(int year, int month) {
        return YearMonth.of(year, month + 1).minusMonths(1);
    }

    /**
     * 下一个月，month 从 0 开始（0 = 一月）
     */
    public static YearMonth nextMonth(int year, int month) {
        return YearMonth.of(year, month + 1).plusMonths(1);
    }

    /**
     * 0 = 周日, 1 = 周一 ... 6 = 周六
     */
    public static int dayOfWeekIndex(LocalDate date) {
        return date.getDayOfWeek().getValue() % DAYS_PER_WEEK;
    }

    public static long daysBetween(LocalDate from, LocalDate to) {
        return ChronoUnit.DAYS.between(from, to);
    }
}
