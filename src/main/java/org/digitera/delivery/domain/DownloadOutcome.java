package org.digitera.delivery.domain;

import org.digitera.delivery.exception.ErrorCode;

/**
 * 下载尝试结果（审计日志）
 */
public enum DownloadOutcome {
    GRANTED,
    DENIED_EXPIRED,
    DENIED_EXHAUSTED,
    DENIED_REVOKED,
    DENIED_TOKEN_INVALID,
    DENIED_NOT_ENTITLED;

    public boolean isDenied() {
        return this != GRANTED;
    }

    /**
     * 将拒绝类错误码映射为审计结果
     */
    public static DownloadOutcome fromDenial(ErrorCode errorCode) {
        switch (errorCode) {
            case ENTITLEMENT_EXPIRED:
                return DENIED_EXPIRED;
            case ENTITLEMENT_EXHAUSTED:
                return DENIED_EXHAUSTED;
            case ENTITLEMENT_REVOKED:
                return DENIED_REVOKED;
            case TOKEN_INVALID:
                return DENIED_TOKEN_INVALID;
            default:
                return DENIED_NOT_ENTITLED;
        }
    }
}
