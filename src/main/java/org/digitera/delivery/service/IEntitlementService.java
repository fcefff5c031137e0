package org.digitera.delivery.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.digitera.delivery.domain.Entitlement;
import org.digitera.delivery.domain.OrderLineItem;
import org.digitera.delivery.domain.PurchaseOrder;
import org.digitera.delivery.domain.vo.PurchaseSummary;
import org.digitera.delivery.gateway.CatalogProduct;

import java.util.List;

/**
 * 下载授权服务接口
 */
public interface IEntitlementService extends IService<Entitlement> {

    /**
     * 为订单行创建授权（按 订单+订单行 幂等）
     * 并发创建同一订单行时由唯一约束去重；订单已不是已支付状态（例如已退款）时不创建
     *
     * @param order 已支付订单
     * @param lineItem 订单行
     * @param product 履约时重新获取的商品信息
     * @return true: 本次新建；false: 已存在或订单不再是已支付状态
     */
    boolean createForLine(PurchaseOrder order, OrderLineItem lineItem, CatalogProduct product);

    Entitlement findByOrderLine(String orderId, Integer lineNo);

    List<Entitlement> listByOrder(String orderId);

    /**
     * 查询用户对某商品的授权：优先返回最新的有效授权，否则返回最新一条
     *
     * @throws org.digitera.delivery.exception.BusinessException ENTITLEMENT_NOT_FOUND
     */
    Entitlement get(Long userId, String productId);

    /**
     * 按授权ID查询，不存在返回 null
     */
    Entitlement findByEntitlementId(String entitlementId);

    /**
     * @throws org.digitera.delivery.exception.BusinessException ENTITLEMENT_NOT_FOUND
     */
    Entitlement getByEntitlementId(String entitlementId);

    /**
     * 消耗一次下载次数
     *
     * 核心特性：
     * - 检查与递增在同一条条件更新中完成，并发下不会超额
     * - 最后一次消耗时状态同时变为 EXHAUSTED
     * - 失败时不做任何修改，按 撤销 > 过期 > 用完 的优先级返回原因
     *
     * @param entitlementId 授权ID
     * @return 消耗后的授权
     */
    Entitlement consume(String entitlementId);

    /**
     * 撤销授权（可重复执行）
     */
    void revoke(String entitlementId);

    /**
     * 撤销订单下的全部授权
     *
     * @return 本次撤销的数量
     */
    int revokeByOrder(String orderId);

    /**
     * 已购商品列表及汇总
     */
    PurchaseSummary listPurchasedItems(Long userId);
}
