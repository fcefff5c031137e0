package org.digitera.delivery.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.digitera.delivery.domain.PaymentOutcome;

/**
 * 支付结果通知
 * 由支付服务投递，至少一次语义，可能重复、乱序
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentConfirmationEvent {

    /**
     * 订单号
     */
    private String orderId;

    /**
     * 外部支付引用（幂等键）
     */
    private String paymentRef;

    /**
     * 支付结果
     */
    private PaymentOutcome outcome;

    /**
     * 通知序号（同一订单内单调递增，仅记录）
     */
    private Long sequence;

    /**
     * 追踪ID
     */
    private String traceId;
}
