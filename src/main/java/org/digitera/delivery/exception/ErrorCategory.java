package org.digitera.delivery.exception;

/**
 * 错误分类
 * - CONFLICT: 数据完整性冲突，需人工介入，从不自动处理
 * - POLICY_DENIED: 策略拒绝，面向用户，写入审计日志，不重试
 * - TRANSIENT: 外部依赖不可用，依赖上游重投
 * - INVALID_INPUT: 非法请求，不重试
 * - NOT_FOUND: 资源不存在
 */
public enum ErrorCategory {
    CONFLICT,
    POLICY_DENIED,
    TRANSIENT,
    INVALID_INPUT,
    NOT_FOUND
}
