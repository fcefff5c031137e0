package org.digitera.delivery.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 业务错误码
 */
@Getter
public enum ErrorCode {

    CONFLICTING_PAYMENT_REFERENCE(ErrorCategory.CONFLICT, HttpStatus.CONFLICT, "订单已使用其他支付引用完成支付"),
    ALREADY_CREATOR(ErrorCategory.CONFLICT, HttpStatus.CONFLICT, "用户已是创作者"),
    STORE_SLUG_CONFLICT(ErrorCategory.CONFLICT, HttpStatus.CONFLICT, "店铺标识冲突，请重试"),

    ENTITLEMENT_EXPIRED(ErrorCategory.POLICY_DENIED, HttpStatus.GONE, "下载授权已过期"),
    ENTITLEMENT_EXHAUSTED(ErrorCategory.POLICY_DENIED, HttpStatus.GONE, "下载次数已用完"),
    ENTITLEMENT_REVOKED(ErrorCategory.POLICY_DENIED, HttpStatus.FORBIDDEN, "下载授权已撤销"),
    NOT_ENTITLED(ErrorCategory.POLICY_DENIED, HttpStatus.FORBIDDEN, "无权下载该商品"),
    TOKEN_INVALID(ErrorCategory.POLICY_DENIED, HttpStatus.UNAUTHORIZED, "下载令牌无效或已过期"),

    COLLABORATOR_UNAVAILABLE(ErrorCategory.TRANSIENT, HttpStatus.SERVICE_UNAVAILABLE, "外部服务暂不可用"),

    INVALID_LINE_ITEM(ErrorCategory.INVALID_INPUT, HttpStatus.BAD_REQUEST, "订单行无效"),
    INVALID_TRANSITION(ErrorCategory.INVALID_INPUT, HttpStatus.BAD_REQUEST, "订单状态不允许该操作"),
    INVALID_PAYMENT_EVENT(ErrorCategory.INVALID_INPUT, HttpStatus.BAD_REQUEST, "支付通知参数不完整"),
    INVALID_STORE_METADATA(ErrorCategory.INVALID_INPUT, HttpStatus.BAD_REQUEST, "店铺信息无效"),
    INVALID_ACCOUNT(ErrorCategory.INVALID_INPUT, HttpStatus.BAD_REQUEST, "账户信息无效"),

    UNKNOWN_ORDER(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, "订单不存在"),
    UNKNOWN_USER(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, "用户不存在"),
    ENTITLEMENT_NOT_FOUND(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, "下载授权不存在");

    private final ErrorCategory category;
    private final HttpStatus httpStatus;
    private final String defaultMessage;

    ErrorCode(ErrorCategory category, HttpStatus httpStatus, String defaultMessage) {
        this.category = category;
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }
}
