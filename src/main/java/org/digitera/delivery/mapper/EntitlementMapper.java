package org.digitera.delivery.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;
import org.digitera.delivery.domain.Entitlement;

import java.time.LocalDateTime;

@Mapper
public interface EntitlementMapper extends BaseMapper<Entitlement> {

    @Select("SELECT * FROM entitlement WHERE entitlement_id = #{entitlementId}")
    Entitlement selectByEntitlementId(@Param("entitlementId") String entitlementId);

    @Select("SELECT * FROM entitlement WHERE order_id = #{orderId} AND line_no = #{lineNo}")
    Entitlement selectByOrderLine(@Param("orderId") String orderId, @Param("lineNo") Integer lineNo);

    /**
     * 消耗一次下载次数（条件更新）
     * 状态、额度、有效期检查与计数递增在同一条语句中完成，并发下不会超额消耗
     * 最后一次额度被消耗时状态同时置为 EXHAUSTED
     *
     * @param entitlementId 授权ID
     * @param now 当前时间
     * @return 更新行数（0表示不满足消耗条件，未做任何修改）
     */
    @Update("""
            UPDATE entitlement
            SET status = CASE
                    WHEN download_limit IS NOT NULL AND downloads_consumed + 1 >= download_limit THEN 'EXHAUSTED'
                    ELSE status
                END,
                downloads_consumed = downloads_consumed + 1,
                last_access_time = #{now},
                update_time = #{now}
            WHERE entitlement_id = #{entitlementId}
              AND status = 'ACTIVE'
              AND (download_limit IS NULL OR downloads_consumed < download_limit)
              AND (expires_at IS NULL OR expires_at > #{now})
            """)
    int consume(@Param("entitlementId") String entitlementId, @Param("now") LocalDateTime now);

    /**
     * 撤销授权（无条件，可重复执行）
     */
    @Update("""
            UPDATE entitlement
            SET status = 'REVOKED',
                update_time = #{now}
            WHERE entitlement_id = #{entitlementId}
            """)
    int revoke(@Param("entitlementId") String entitlementId, @Param("now") LocalDateTime now);

    /**
     * 撤销订单下的所有授权（退款）
     */
    @Update("""
            UPDATE entitlement
            SET status = 'REVOKED',
                update_time = #{now}
            WHERE order_id = #{orderId}
              AND status <> 'REVOKED'
            """)
    int revokeByOrderId(@Param("orderId") String orderId, @Param("now") LocalDateTime now);
}
