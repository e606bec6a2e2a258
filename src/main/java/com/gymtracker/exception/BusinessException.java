package com.gymtracker.exception;


import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 日历和训练操作的业务异常，code 同时作为 HTTP 状态码返回
 */
@Getter
public class BusinessException extends RuntimeException {

    private final Integer code;

    public BusinessException(String message) {
        this(400, message);
    }

    public BusinessException(Integer code, String message) {
        super(message);
        this.code = code;
    }

    public BusinessException(Integer code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    // 无法识别的 code 按 400 处理
    public HttpStatus httpStatus() {
        HttpStatus status = code != null ? HttpStatus.resolve(code) : null;
        return status != null ? status : HttpStatus.BAD_REQUEST;
    }

}
