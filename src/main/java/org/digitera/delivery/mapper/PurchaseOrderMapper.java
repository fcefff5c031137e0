package org.digitera.delivery.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;
import org.digitera.delivery.domain.PurchaseOrder;

import java.time.LocalDateTime;

@Mapper
public interface PurchaseOrderMapper extends BaseMapper<PurchaseOrder> {

    @Select("SELECT * FROM purchase_order WHERE order_id = #{orderId}")
    PurchaseOrder selectByOrderId(@Param("orderId") String orderId);

    /**
     * 锁定订单行并读取状态（需在事务内调用）
     * 退款的条件更新持有同一行锁，履约创建授权与退款撤销因此串行执行
     */
    @Select("SELECT status FROM purchase_order WHERE order_id = #{orderId} FOR UPDATE")
    String selectStatusForUpdate(@Param("orderId") String orderId);

    /**
     * 待支付 -> 已支付（条件更新）
     *
     * @return 更新行数（0表示订单不在待支付状态）
     */
    @Update("""
            UPDATE purchase_order
            SET status = 'PAID',
                payment_ref = #{paymentRef},
                payment_sequence = #{sequence},
                paid_time = #{now},
                update_time = #{now}
            WHERE order_id = #{orderId}
              AND status = 'PENDING_PAYMENT'
            """)
    int markPaid(@Param("orderId") String orderId,
                 @Param("paymentRef") String paymentRef,
                 @Param("sequence") Long sequence,
                 @Param("now") LocalDateTime now);

    /**
     * 待支付 -> 支付失败（条件更新）
     */
    @Update("""
            UPDATE purchase_order
            SET status = 'FAILED',
                payment_ref = #{paymentRef},
                payment_sequence = #{sequence},
                update_time = #{now}
            WHERE order_id = #{orderId}
              AND status = 'PENDING_PAYMENT'
            """)
    int markFailed(@Param("orderId") String orderId,
                   @Param("paymentRef") String paymentRef,
                   @Param("sequence") Long sequence,
                   @Param("now") LocalDateTime now);

    /**
     * 已支付 -> 已退款（条件更新）
     */
    @Update("""
            UPDATE purchase_order
            SET status = 'REFUNDED',
                update_time = #{now}
            WHERE order_id = #{orderId}
              AND status = 'PAID'
            """)
    int markRefunded(@Param("orderId") String orderId, @Param("now") LocalDateTime now);
}
