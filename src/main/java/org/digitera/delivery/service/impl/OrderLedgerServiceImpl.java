package org.digitera.delivery.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.digitera.delivery.domain.OrderLineItem;
import org.digitera.delivery.domain.OrderStatus;
import org.digitera.delivery.domain.OrderStatusHistory;
import org.digitera.delivery.domain.PurchaseOrder;
import org.digitera.delivery.domain.vo.LedgerTransition;
import org.digitera.delivery.exception.BusinessException;
import org.digitera.delivery.exception.ErrorCode;
import org.digitera.delivery.gateway.CatalogProduct;
import org.digitera.delivery.gateway.ICatalogGateway;
import org.digitera.delivery.mapper.OrderLineItemMapper;
import org.digitera.delivery.mapper.OrderStatusHistoryMapper;
import org.digitera.delivery.mapper.PurchaseOrderMapper;
import org.digitera.delivery.service.IEntitlementService;
import org.digitera.delivery.service.IOrderLedgerService;
import org.digitera.delivery.service.IUserAccountService;
import org.digitera.delivery.util.BusinessIdUtil;
import org.digitera.delivery.util.TraceIdUtil;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 订单账本服务实现
 *
 * 核心设计思想：
 * 1. 条件更新：所有状态流转都是 UPDATE ... WHERE status = 源状态，并发通知只有一个生效
 * 2. 幂等性：条件更新未命中时重新读取订单，按 paymentRef 判断是重放还是冲突
 * 3. 流转记录：每次真正的状态变化都写入 order_status_history，与状态更新在同一事务
 *
 * 状态流转：
 * - PENDING_PAYMENT -> PAID | FAILED
 * - PAID -> REFUNDED（同时撤销授权）
 */
@Slf4j
@Service
public class OrderLedgerServiceImpl extends ServiceImpl<PurchaseOrderMapper, PurchaseOrder>
        implements IOrderLedgerService {

    private final OrderLineItemMapper orderLineItemMapper;
    private final OrderStatusHistoryMapper orderStatusHistoryMapper;
    private final IUserAccountService userAccountService;
    private final IEntitlementService entitlementService;
    private final ICatalogGateway catalogGateway;
    private final Clock clock;

    public OrderLedgerServiceImpl(OrderLineItemMapper orderLineItemMapper,
                                  OrderStatusHistoryMapper orderStatusHistoryMapper,
                                  IUserAccountService userAccountService,
                                  IEntitlementService entitlementService,
                                  ICatalogGateway catalogGateway,
                                  Clock clock) {
        this.orderLineItemMapper = orderLineItemMapper;
        this.orderStatusHistoryMapper = orderStatusHistoryMapper;
        this.userAccountService = userAccountService;
        this.entitlementService = entitlementService;
        this.catalogGateway = catalogGateway;
        this.clock = clock;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public PurchaseOrder createOrder(Long userId, List<String> productIds) {
        String traceId = TraceIdUtil.getTraceId();
        userAccountService.getUser(userId);
        if (productIds == null || productIds.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_LINE_ITEM, "订单至少包含一个商品");
        }

        // ==================== 1. 从商品目录获取价格 ====================
        List<CatalogProduct> products = new ArrayList<>(productIds.size());
        for (String productId : productIds) {
            if (!StringUtils.hasText(productId)) {
                throw new BusinessException(ErrorCode.INVALID_LINE_ITEM, "商品ID不能为空");
            }
            CatalogProduct product = catalogGateway.resolveProduct(productId);
            if (product == null || !product.isAvailable()) {
                throw new BusinessException(ErrorCode.INVALID_LINE_ITEM, "商品不可售: " + productId);
            }
            if (product.getPrice() == null || product.getPrice().signum() < 0
                    || !StringUtils.hasText(product.getCurrency())) {
                throw new BusinessException(ErrorCode.INVALID_LINE_ITEM, "商品价格缺失: " + productId);
            }
            products.add(product);
        }
        String currency = products.get(0).getCurrency();
        for (CatalogProduct product : products) {
            if (!currency.equals(product.getCurrency())) {
                throw new BusinessException(ErrorCode.INVALID_LINE_ITEM,
                        "订单内商品币种不一致: " + currency + " / " + product.getCurrency());
            }
        }

        // ==================== 2. 保存订单与订单行 ====================
        LocalDateTime now = LocalDateTime.now(clock);
        String orderId = BusinessIdUtil.newOrderId();
        List<OrderLineItem> lineItems = new ArrayList<>(products.size());
        BigDecimal total = BigDecimal.ZERO;
        for (int i = 0; i < products.size(); i++) {
            CatalogProduct product = products.get(i);
            lineItems.add(OrderLineItem.builder()
                    .orderId(orderId)
                    .lineNo(i + 1)
                    .productId(productIds.get(i))
                    .productName(product.getName())
                    .unitPrice(product.getPrice())
                    .currency(currency)
                    .createTime(now)
                    .build());
            total = total.add(product.getPrice());
        }

        PurchaseOrder order = PurchaseOrder.builder()
                .orderId(orderId)
                .userId(userId)
                .totalAmount(total)
                .currency(currency)
                .status(OrderStatus.PENDING_PAYMENT)
                .traceId(traceId)
                .createTime(now)
                .updateTime(now)
                .build();
        this.save(order);
        for (OrderLineItem lineItem : lineItems) {
            orderLineItemMapper.insert(lineItem);
        }
        appendHistory(orderId, null, OrderStatus.PENDING_PAYMENT, null, "订单创建", now);
        order.setLineItems(lineItems);

        log.info("[订单已创建] orderId={}, userId={}, lines={}, totalAmount={}, currency={}, traceId={}",
                orderId, userId, lineItems.size(), total, currency, traceId);
        return order;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public LedgerTransition markPaid(String orderId, String paymentRef, Long sequence) {
        requirePaymentRef(paymentRef);
        LocalDateTime now = LocalDateTime.now(clock);
        String traceId = TraceIdUtil.getTraceId();

        int rows = baseMapper.markPaid(orderId, paymentRef, sequence, now);
        if (rows == 1) {
            appendHistory(orderId, OrderStatus.PENDING_PAYMENT, OrderStatus.PAID, paymentRef, "支付成功", now);
            log.info("[订单已支付] orderId={}, paymentRef={}, sequence={}, traceId={}",
                    orderId, paymentRef, sequence, traceId);
            return LedgerTransition.builder().order(getOrder(orderId)).freshTransition(true).build();
        }

        // 条件更新未命中：判断是重放还是冲突
        PurchaseOrder current = getOrder(orderId);
        boolean sameRef = paymentRef.equals(current.getPaymentRef());
        if (current.getStatus().wasPaid()) {
            if (!sameRef) {
                log.warn("[支付引用冲突] orderId={}, status={}, existingRef={}, incomingRef={}, traceId={}",
                        orderId, current.getStatus(), current.getPaymentRef(), paymentRef, traceId);
                throw new BusinessException(ErrorCode.CONFLICTING_PAYMENT_REFERENCE,
                        "订单 " + orderId + " 已使用其他支付引用完成支付");
            }
        } else if (current.getStatus() == OrderStatus.FAILED && !sameRef) {
            log.warn("[非法状态流转] orderId={}, status=FAILED, incomingRef={}, traceId={}",
                    orderId, paymentRef, traceId);
            throw new BusinessException(ErrorCode.INVALID_TRANSITION, "支付失败的订单不能再标记为已支付");
        }
        log.warn("[支付通知重放] orderId={}, status={}, paymentRef={}, traceId={}",
                orderId, current.getStatus(), paymentRef, traceId);
        return LedgerTransition.builder().order(current).freshTransition(false).build();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public LedgerTransition markFailed(String orderId, String paymentRef, Long sequence) {
        requirePaymentRef(paymentRef);
        LocalDateTime now = LocalDateTime.now(clock);
        String traceId = TraceIdUtil.getTraceId();

        int rows = baseMapper.markFailed(orderId, paymentRef, sequence, now);
        if (rows == 1) {
            appendHistory(orderId, OrderStatus.PENDING_PAYMENT, OrderStatus.FAILED, paymentRef, "支付失败", now);
            log.info("[订单支付失败] orderId={}, paymentRef={}, sequence={}, traceId={}",
                    orderId, paymentRef, sequence, traceId);
            return LedgerTransition.builder().order(getOrder(orderId)).freshTransition(true).build();
        }

        PurchaseOrder current = getOrder(orderId);
        if (current.getStatus().wasPaid() && !paymentRef.equals(current.getPaymentRef())) {
            log.warn("[支付引用冲突] orderId={}, status={}, existingRef={}, incomingRef={}, traceId={}",
                    orderId, current.getStatus(), current.getPaymentRef(), paymentRef, traceId);
            throw new BusinessException(ErrorCode.CONFLICTING_PAYMENT_REFERENCE,
                    "订单 " + orderId + " 已使用其他支付引用完成支付");
        }
        log.warn("[支付失败通知重放] orderId={}, status={}, paymentRef={}, traceId={}",
                orderId, current.getStatus(), paymentRef, traceId);
        return LedgerTransition.builder().order(current).freshTransition(false).build();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public PurchaseOrder refund(String orderId, String reason) {
        LocalDateTime now = LocalDateTime.now(clock);
        String traceId = TraceIdUtil.getTraceId();

        int rows = baseMapper.markRefunded(orderId, now);
        if (rows == 0) {
            PurchaseOrder current = getOrder(orderId);
            log.warn("[退款被拒绝] orderId={}, status={}, traceId={}", orderId, current.getStatus(), traceId);
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                    "订单状态为 " + current.getStatus() + "，不能退款");
        }

        int revoked = entitlementService.revokeByOrder(orderId);
        PurchaseOrder order = getOrder(orderId);
        appendHistory(orderId, OrderStatus.PAID, OrderStatus.REFUNDED, order.getPaymentRef(),
                StringUtils.hasText(reason) ? reason : "退款", now);
        log.info("[订单已退款] orderId={}, revokedEntitlements={}, reason={}, traceId={}",
                orderId, revoked, reason, traceId);
        return order;
    }

    @Override
    public PurchaseOrder getOrder(String orderId) {
        PurchaseOrder order = StringUtils.hasText(orderId) ? baseMapper.selectByOrderId(orderId) : null;
        if (order == null) {
            throw new BusinessException(ErrorCode.UNKNOWN_ORDER, "订单不存在: " + orderId);
        }
        order.setLineItems(orderLineItemMapper.selectByOrderId(orderId));
        return order;
    }

    @Override
    public List<OrderStatusHistory> listStatusHistory(String orderId) {
        getOrder(orderId);
        return orderStatusHistoryMapper.selectList(new LambdaQueryWrapper<OrderStatusHistory>()
                .eq(OrderStatusHistory::getOrderId, orderId)
                .orderByAsc(OrderStatusHistory::getCreateTime)
                .orderByAsc(OrderStatusHistory::getId));
    }

    @Override
    public Map<String, BigDecimal> totalSpent(Long userId) {
        return this.lambdaQuery()
                .eq(PurchaseOrder::getUserId, userId)
                .eq(PurchaseOrder::getStatus, OrderStatus.PAID)
                .list()
                .stream()
                .collect(Collectors.groupingBy(PurchaseOrder::getCurrency, TreeMap::new,
                        Collectors.reducing(BigDecimal.ZERO, PurchaseOrder::getTotalAmount, BigDecimal::add)));
    }

    private void appendHistory(String orderId, OrderStatus previous, OrderStatus next,
                               String paymentRef, String reason, LocalDateTime now) {
        orderStatusHistoryMapper.insert(OrderStatusHistory.builder()
                .orderId(orderId)
                .previousStatus(previous)
                .newStatus(next)
                .paymentRef(paymentRef)
                .reason(reason)
                .traceId(TraceIdUtil.getTraceId())
                .createTime(now)
                .build());
    }

    private static void requirePaymentRef(String paymentRef) {
        if (!StringUtils.hasText(paymentRef)) {
            throw new BusinessException(ErrorCode.INVALID_PAYMENT_EVENT, "paymentRef 不能为空");
        }
    }
}
