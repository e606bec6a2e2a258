package com.gymtracker.exception;

import lombok.Getter;

import java.time.LocalDate;

/**
 * 目标日期已有训练（每个用户每天最多一条训练记录）
 */
@Getter
public class DateConflictException extends BusinessException {

    private final LocalDate date;

    public DateConflictException(LocalDate date) {
        super(409, "该日期已安排训练: " + date);
        this.date = date;
    }

    public DateConflictException(LocalDate date, String message) {
        super(409, message);
        this.date = date;
    }

    public DateConflictException(LocalDate date, Throwable cause) {
        super(409, "该日期已安排训练: " + date, cause);
        this.date = date;
    }
}
