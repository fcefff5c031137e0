package org.digitera.delivery.domain.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.digitera.delivery.domain.PurchaseOrder;

/**
 * 订单状态变更结果
 * freshTransition=false 表示本次调用为重放（无状态变化）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerTransition {

    private PurchaseOrder order;

    private boolean freshTransition;
}
