package org.digitera.delivery.domain;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 订单实体
 *
 * 状态流转：
 * - PENDING_PAYMENT: 待支付
 * - PAID: 已支付（已履约或待履约）
 * - FAILED: 支付失败
 * - REFUNDED: 已退款（其下所有授权已撤销）
 *
 * totalAmount 在创建时由订单行求和得出，之后不再修改
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("purchase_order")
public class PurchaseOrder {

    /**
     * 主键ID
     */
    private Long id;

    /**
     * 订单号（业务唯一标识，ORD-XXXXXXXX）
     */
    private String orderId;

    /**
     * 下单用户
     */
    private Long userId;

    /**
     * 订单总额
     */
    private BigDecimal totalAmount;

    private String currency;

    private OrderStatus status;

    /**
     * 外部支付引用（幂等键），首次进入终态时写入
     */
    private String paymentRef;

    /**
     * 支付通知序号
     */
    private Long paymentSequence;

    /**
     * 追踪ID
     */
    private String traceId;

    private LocalDateTime createTime;

    private LocalDateTime updateTime;

    private LocalDateTime paidTime;

    /**
     * 订单行（内嵌值对象，单独存表）
     */
    @TableField(exist = false)
    private List<OrderLineItem> lineItems;
}
