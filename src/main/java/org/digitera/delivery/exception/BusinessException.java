package org.digitera.delivery.exception;

import lombok.Getter;

/**
 * 业务异常
 * 所有可预期的失败都通过错误码表达，由调用方或全局异常处理器决定如何响应
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCategory getCategory() {
        return errorCode.getCategory();
    }
}
