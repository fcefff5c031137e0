package org.digitera.delivery.business;

import lombok.extern.slf4j.Slf4j;
import org.digitera.delivery.domain.OrderLineItem;
import org.digitera.delivery.domain.OrderStatus;
import org.digitera.delivery.domain.PaymentOutcome;
import org.digitera.delivery.domain.PurchaseOrder;
import org.digitera.delivery.domain.vo.FulfillmentResult;
import org.digitera.delivery.domain.vo.LedgerTransition;
import org.digitera.delivery.event.PaymentConfirmationEvent;
import org.digitera.delivery.exception.BusinessException;
import org.digitera.delivery.exception.ErrorCode;
import org.digitera.delivery.gateway.CatalogProduct;
import org.digitera.delivery.gateway.ICatalogGateway;
import org.digitera.delivery.service.IEntitlementService;
import org.digitera.delivery.service.IOrderLedgerService;
import org.digitera.delivery.util.DistributedLockUtil;
import org.digitera.delivery.util.IdempotentUtil;
import org.digitera.delivery.util.TraceIdUtil;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.concurrent.TimeUnit;

/**
 * 履约处理 - 支付通知到下载授权的完整流程
 * <p>
 * 完整流程：
 * 1. 校验通知
 * 2. 幂等快速路径（Redis，可选）
 * 3. 按订单加锁（Redisson，可选）
 * 4. 更新订单状态
 * 5. 订单为已支付时，为每个订单行补齐授权
 * <p>
 * 通知可能重复、乱序、并发到达；正确性只依赖数据库条件更新与唯一约束，
 * Redis 与分布式锁只用于减少重复工作。
 * 本方法不开启外层事务：每个订单行的授权独立提交，失败后重投只会补齐缺失的部分。
 */
@Slf4j
@Service
public class FulfillmentProcessor {

    private static final String OPERATION_TYPE = "PAYMENT_CONFIRMATION";
    private static final String LOCK_KEY_PREFIX = "fulfillment:order:";
    private static final long LOCK_WAIT_SECONDS = 3;
    private static final long LOCK_LEASE_SECONDS = 30;

    private final IOrderLedgerService orderLedgerService;
    private final IEntitlementService entitlementService;
    private final ICatalogGateway catalogGateway;
    private final IdempotentUtil idempotentUtil;
    private final DistributedLockUtil distributedLockUtil;

    public FulfillmentProcessor(IOrderLedgerService orderLedgerService,
                                IEntitlementService entitlementService,
                                ICatalogGateway catalogGateway,
                                IdempotentUtil idempotentUtil,
                                DistributedLockUtil distributedLockUtil) {
        this.orderLedgerService = orderLedgerService;
        this.entitlementService = entitlementService;
        this.catalogGateway = catalogGateway;
        this.idempotentUtil = idempotentUtil;
        this.distributedLockUtil = distributedLockUtil;
    }

    /**
     * 处理支付结果通知
     *
     * @param event 支付通知
     * @return 处理结果（订单状态、本次新建的授权数量、订单下的全部授权）
     * @throws BusinessException INVALID_PAYMENT_EVENT / UNKNOWN_ORDER / CONFLICTING_PAYMENT_REFERENCE /
     *                           INVALID_TRANSITION / COLLABORATOR_UNAVAILABLE
     */
    public FulfillmentResult handlePaymentConfirmation(PaymentConfirmationEvent event) {
        // ==================== 1. 校验通知 ====================
        validate(event);
        String orderId = event.getOrderId();
        String paymentRef = event.getPaymentRef();
        String traceId = TraceIdUtil.getTraceId();
        String idempotentKey = orderId + ":" + paymentRef;

        log.info("[收到支付通知] orderId={}, paymentRef={}, outcome={}, sequence={}, traceId={}",
                orderId, paymentRef, event.getOutcome(), event.getSequence(), traceId);

        // ==================== 2. 幂等快速路径 ====================
        if (idempotentUtil.isOperated(idempotentKey, OPERATION_TYPE)) {
            log.debug("[幂等性] 支付通知已处理过, orderId={}, paymentRef={}, traceId={}",
                    orderId, paymentRef, traceId);
            PurchaseOrder order = orderLedgerService.getOrder(orderId);
            return buildResult(order, false, 0);
        }

        // ==================== 3. 按订单加锁 ====================
        String lockKey = LOCK_KEY_PREFIX + orderId;
        if (!distributedLockUtil.tryLock(lockKey, LOCK_WAIT_SECONDS, LOCK_LEASE_SECONDS, TimeUnit.SECONDS)) {
            log.warn("[获取锁失败] 订单正在处理中, orderId={}, traceId={}", orderId, traceId);
            throw new BusinessException(ErrorCode.COLLABORATOR_UNAVAILABLE, "订单正在处理中，请稍后重试");
        }
        log.debug("[获取锁成功] lockKey={}, traceId={}", lockKey, traceId);

        try {
            // ==================== 4. 更新订单状态 ====================
            orderLedgerService.getOrder(orderId);
            if (event.getOutcome() == PaymentOutcome.FAILED) {
                LedgerTransition transition = orderLedgerService.markFailed(orderId, paymentRef, event.getSequence());
                idempotentUtil.markAsOperated(idempotentKey, OPERATION_TYPE);
                return buildResult(transition.getOrder(), transition.isFreshTransition(), 0);
            }

            LedgerTransition transition = orderLedgerService.markPaid(orderId, paymentRef, event.getSequence());
            PurchaseOrder order = transition.getOrder();

            // ==================== 5. 补齐授权 ====================
            // 重放同样执行：上一次处理可能在创建授权途中失败
            int created = 0;
            if (order.getStatus() == OrderStatus.PAID && paymentRef.equals(order.getPaymentRef())) {
                created = ensureEntitlements(order);
            }

            idempotentUtil.markAsOperated(idempotentKey, OPERATION_TYPE);
            log.info("[履约完成] orderId={}, status={}, freshTransition={}, entitlementsCreated={}, traceId={}",
                    orderId, order.getStatus(), transition.isFreshTransition(), created, traceId);
            return buildResult(order, transition.isFreshTransition(), created);
        } finally {
            distributedLockUtil.unlock(lockKey);
        }
    }

    private int ensureEntitlements(PurchaseOrder order) {
        int created = 0;
        for (OrderLineItem lineItem : order.getLineItems()) {
            if (entitlementService.findByOrderLine(order.getOrderId(), lineItem.getLineNo()) != null) {
                continue;
            }
            // 下载策略以履约时的商品目录为准
            CatalogProduct product = catalogGateway.resolveProduct(lineItem.getProductId());
            if (product == null) {
                log.error("[履约失败] 商品目录中找不到商品, orderId={}, lineNo={}, productId={}, traceId={}",
                        order.getOrderId(), lineItem.getLineNo(), lineItem.getProductId(), TraceIdUtil.getTraceId());
                throw new BusinessException(ErrorCode.COLLABORATOR_UNAVAILABLE,
                        "履约时无法获取商品信息: " + lineItem.getProductId());
            }
            // 可售状态不影响已支付订单的交付，但必须有文件引用
            if (!StringUtils.hasText(product.getFileBlobRef())) {
                log.error("[履约失败] 商品缺少文件引用, orderId={}, lineNo={}, productId={}, traceId={}",
                        order.getOrderId(), lineItem.getLineNo(), lineItem.getProductId(), TraceIdUtil.getTraceId());
                throw new BusinessException(ErrorCode.COLLABORATOR_UNAVAILABLE,
                        "商品目录缺少文件引用: " + lineItem.getProductId());
            }
            if (entitlementService.createForLine(order, lineItem, product)) {
                created++;
            }
        }
        return created;
    }

    private FulfillmentResult buildResult(PurchaseOrder order, boolean freshTransition, int created) {
        return FulfillmentResult.builder()
                .orderId(order.getOrderId())
                .orderStatus(order.getStatus())
                .freshTransition(freshTransition)
                .entitlementsCreated(created)
                .entitlements(entitlementService.listByOrder(order.getOrderId()))
                .build();
    }

    private static void validate(PaymentConfirmationEvent event) {
        if (event == null
                || !StringUtils.hasText(event.getOrderId())
                || !StringUtils.hasText(event.getPaymentRef())
                || event.getOutcome() == null) {
            throw new BusinessException(ErrorCode.INVALID_PAYMENT_EVENT,
                    "支付通知缺少 orderId、paymentRef 或 outcome");
        }
    }
}
