package com.gymtracker.exception;

/**
 * 日期字符串不是合法的 yyyy-MM-dd
 */
public class InvalidDateFormatException extends BusinessException {

    public InvalidDateFormatException(String value) {
        super(400, "日期格式必须是 yyyy-MM-dd: " + value);
    }
}
