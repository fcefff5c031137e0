package org.digitera.delivery.controller;

import lombok.extern.slf4j.Slf4j;
import org.digitera.delivery.exception.BusinessException;
import org.digitera.delivery.exception.ErrorCategory;
import org.digitera.delivery.util.TraceIdUtil;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * 全局异常处理
 * - BusinessException：按错误码映射 HTTP 状态
 * - 请求参数错误：400
 * - 其他异常：500
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<Map<String, Object>> handleBusinessException(BusinessException e) {
        if (e.getCategory() == ErrorCategory.CONFLICT || e.getCategory() == ErrorCategory.TRANSIENT) {
            log.error("[请求失败] code={}, errorMsg={}, traceId={}",
                    e.getErrorCode(), e.getMessage(), TraceIdUtil.getTraceId());
        } else {
            log.warn("[请求被拒绝] code={}, errorMsg={}, traceId={}",
                    e.getErrorCode(), e.getMessage(), TraceIdUtil.getTraceId());
        }
        return ResponseEntity.status(e.getErrorCode().getHttpStatus())
                .body(ApiResponses.body(e.getErrorCode().name(), e.getMessage(), null));
    }

    @ExceptionHandler({
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        log.warn("[请求参数错误] errorMsg={}, traceId={}", e.getMessage(), TraceIdUtil.getTraceId());
        return ResponseEntity.badRequest()
                .body(ApiResponses.body("PARAM_ERROR", e.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("[系统异常] errorMsg={}, traceId={}", e.getMessage(), TraceIdUtil.getTraceId(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponses.body("ERROR", "系统异常", null));
    }
}
