package org.digitera.delivery.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.digitera.delivery.domain.OrderStatusHistory;
import org.digitera.delivery.domain.PurchaseOrder;
import org.digitera.delivery.domain.vo.LedgerTransition;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * 订单账本服务接口
 * 订单状态的唯一写入方，所有流转都通过条件更新完成
 */
public interface IOrderLedgerService extends IService<PurchaseOrder> {

    /**
     * 创建订单（待支付）
     * 价格与币种在创建时从商品目录获取，之后不再修改
     *
     * @param userId 下单用户
     * @param productIds 商品ID列表（每个商品一行）
     * @return 订单（含订单行）
     */
    PurchaseOrder createOrder(Long userId, List<String> productIds);

    /**
     * 标记已支付
     *
     * 幂等性：
     * - 同一 paymentRef 重放：不做修改，返回当前终态
     * - 已支付订单收到不同 paymentRef：CONFLICTING_PAYMENT_REFERENCE
     *
     * @param orderId 订单号
     * @param paymentRef 外部支付引用
     * @param sequence 通知序号（可空）
     * @return 流转结果，freshTransition 表示本次是否真正发生了状态变化
     */
    LedgerTransition markPaid(String orderId, String paymentRef, Long sequence);

    /**
     * 标记支付失败
     */
    LedgerTransition markFailed(String orderId, String paymentRef, Long sequence);

    /**
     * 退款：已支付 -> 已退款，同一事务内撤销该订单产生的全部授权
     *
     * @param orderId 订单号
     * @param reason 退款原因
     * @return 退款后的订单
     */
    PurchaseOrder refund(String orderId, String reason);

    /**
     * 查询订单（含订单行）
     *
     * @throws org.digitera.delivery.exception.BusinessException UNKNOWN_ORDER
     */
    PurchaseOrder getOrder(String orderId);

    /**
     * 订单状态流转记录（按时间顺序）
     */
    List<OrderStatusHistory> listStatusHistory(String orderId);

    /**
     * 用户已支付订单的消费总额，按币种汇总（退款订单不计入）
     */
    Map<String, BigDecimal> totalSpent(Long userId);
}
