package org.digitera.delivery.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 订单状态变更历史
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("order_status_history")
public class OrderStatusHistory {

    private Long id;

    private String orderId;

    /**
     * 变更前状态（创建时为空）
     */
    private OrderStatus previousStatus;

    private OrderStatus newStatus;

    private String paymentRef;

    /**
     * 变更原因
     */
    private String reason;

    private String traceId;

    private LocalDateTime createTime;
}
