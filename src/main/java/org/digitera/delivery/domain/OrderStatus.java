package org.digitera.delivery.domain;

/**
 * 订单状态
 *
 * 状态流转：
 * - PENDING_PAYMENT -> PAID | FAILED
 * - PAID -> REFUNDED
 * 其余流转一律拒绝
 */
public enum OrderStatus {
    PENDING_PAYMENT,
    PAID,
    FAILED,
    REFUNDED;

    public boolean isTerminal() {
        return this != PENDING_PAYMENT;
    }

    /**
     * 是否曾经支付成功（PAID 或已退款）
     */
    public boolean wasPaid() {
        return this == PAID || this == REFUNDED;
    }
}
