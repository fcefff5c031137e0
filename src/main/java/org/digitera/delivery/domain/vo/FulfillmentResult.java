package org.digitera.delivery.domain.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.digitera.delivery.domain.Entitlement;
import org.digitera.delivery.domain.OrderStatus;

import java.util.List;

/**
 * 支付通知处理结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FulfillmentResult {

    private String orderId;

    private OrderStatus orderStatus;

    /**
     * 本次通知是否引起了状态变化
     */
    private boolean freshTransition;

    /**
     * 本次新建的授权数量（重放时为0）
     */
    private int entitlementsCreated;

    /**
     * 订单下的全部授权
     */
    private List<Entitlement> entitlements;
}
