package com.gymtracker.exception;

/**
 * 存储层调用失败或超时，由调用方自行决定是否重试
 */
public class UpstreamFailureException extends BusinessException {

    public UpstreamFailureException(String operation, Throwable cause) {
        super(503, "数据服务暂不可用: " + operation, cause);
    }
}
