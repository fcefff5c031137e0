package org.digitera.delivery.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.digitera.delivery.domain.Entitlement;
import org.digitera.delivery.domain.EntitlementStatus;
import org.digitera.delivery.domain.OrderLineItem;
import org.digitera.delivery.domain.OrderStatus;
import org.digitera.delivery.domain.PurchaseOrder;
import org.digitera.delivery.domain.vo.PurchaseSummary;
import org.digitera.delivery.domain.vo.PurchasedItemView;
import org.digitera.delivery.exception.BusinessException;
import org.digitera.delivery.exception.ErrorCode;
import org.digitera.delivery.gateway.CatalogProduct;
import org.digitera.delivery.mapper.EntitlementMapper;
import org.digitera.delivery.mapper.PurchaseOrderMapper;
import org.digitera.delivery.service.IEntitlementService;
import org.digitera.delivery.util.BusinessIdUtil;
import org.digitera.delivery.util.TraceIdUtil;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 下载授权服务实现
 *
 * 核心设计思想：
 * 1. 防超额：检查与递增合并为一条条件更新，数据库 CHECK 约束兜底
 * 2. 幂等创建：(order_id, line_no) 唯一约束，重复履约不会产生第二条授权
 * 3. 失败不修改：消耗失败时只读取并判断原因
 * 4. 退款互斥：创建授权前锁定订单行，只为仍处于已支付状态的订单创建
 */
@Slf4j
@Service
public class EntitlementServiceImpl extends ServiceImpl<EntitlementMapper, Entitlement>
        implements IEntitlementService {

    private final PurchaseOrderMapper purchaseOrderMapper;
    private final Clock clock;

    public EntitlementServiceImpl(PurchaseOrderMapper purchaseOrderMapper, Clock clock) {
        this.purchaseOrderMapper = purchaseOrderMapper;
        this.clock = clock;
    }

    /**
     * 订单行锁与退款的条件更新互斥：
     * 退款先提交则这里读到 REFUNDED 不再创建；这里先提交则退款的撤销语句能看到新授权
     */
    @Override
    @Transactional(rollbackFor = Exception.class)
    public boolean createForLine(PurchaseOrder order, OrderLineItem lineItem, CatalogProduct product) {
        String orderId = order.getOrderId();
        Integer lineNo = lineItem.getLineNo();
        String currentStatus = purchaseOrderMapper.selectStatusForUpdate(orderId);
        if (!OrderStatus.PAID.name().equals(currentStatus)) {
            log.warn("[跳过授权创建] 订单已不是已支付状态, orderId={}, lineNo={}, status={}, traceId={}",
                    orderId, lineNo, currentStatus, TraceIdUtil.getTraceId());
            return false;
        }
        if (findByOrderLine(orderId, lineNo) != null) {
            return false;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Integer downloadLimit = product.getDownloadLimit();
        Integer expiryDays = product.getDownloadExpiryDays();
        Entitlement entitlement = Entitlement.builder()
                .entitlementId(BusinessIdUtil.newEntitlementId())
                .userId(order.getUserId())
                .productId(lineItem.getProductId())
                .orderId(orderId)
                .lineNo(lineNo)
                .fileBlobRef(product.getFileBlobRef())
                .licenseKey(StringUtils.hasText(product.getLicenseType())
                        ? BusinessIdUtil.newLicenseKey(lineItem.getProductId()) : null)
                .downloadLimit(downloadLimit)
                .downloadsConsumed(0)
                .expiresAt(expiryDays == null ? null : now.plusDays(expiryDays))
                .status(downloadLimit != null && downloadLimit <= 0
                        ? EntitlementStatus.EXHAUSTED : EntitlementStatus.ACTIVE)
                .createTime(now)
                .updateTime(now)
                .build();
        try {
            baseMapper.insert(entitlement);
        } catch (DuplicateKeyException e) {
            log.debug("[授权已存在] 并发履约, orderId={}, lineNo={}, traceId={}",
                    orderId, lineNo, TraceIdUtil.getTraceId());
            return false;
        }

        log.info("[授权已创建] entitlementId={}, orderId={}, lineNo={}, userId={}, productId={}, "
                        + "downloadLimit={}, expiresAt={}, traceId={}",
                entitlement.getEntitlementId(), orderId, lineNo, order.getUserId(), lineItem.getProductId(),
                downloadLimit, entitlement.getExpiresAt(), TraceIdUtil.getTraceId());
        return true;
    }

    @Override
    public Entitlement findByOrderLine(String orderId, Integer lineNo) {
        return baseMapper.selectByOrderLine(orderId, lineNo);
    }

    @Override
    public List<Entitlement> listByOrder(String orderId) {
        return this.lambdaQuery()
                .eq(Entitlement::getOrderId, orderId)
                .orderByAsc(Entitlement::getLineNo)
                .list();
    }

    @Override
    public Entitlement get(Long userId, String productId) {
        List<Entitlement> candidates = this.lambdaQuery()
                .eq(Entitlement::getUserId, userId)
                .eq(Entitlement::getProductId, productId)
                .orderByDesc(Entitlement::getCreateTime)
                .orderByDesc(Entitlement::getId)
                .list();
        if (candidates.isEmpty()) {
            throw new BusinessException(ErrorCode.ENTITLEMENT_NOT_FOUND,
                    "用户 " + userId + " 没有商品 " + productId + " 的下载授权");
        }
        return candidates.stream()
                .filter(e -> e.getStatus() == EntitlementStatus.ACTIVE)
                .findFirst()
                .orElse(candidates.get(0));
    }

    @Override
    public Entitlement findByEntitlementId(String entitlementId) {
        return baseMapper.selectByEntitlementId(entitlementId);
    }

    @Override
    public Entitlement getByEntitlementId(String entitlementId) {
        Entitlement entitlement = findByEntitlementId(entitlementId);
        if (entitlement == null) {
            throw new BusinessException(ErrorCode.ENTITLEMENT_NOT_FOUND, "下载授权不存在: " + entitlementId);
        }
        return entitlement;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public Entitlement consume(String entitlementId) {
        LocalDateTime now = LocalDateTime.now(clock);
        int rows = baseMapper.consume(entitlementId, now);
        if (rows == 1) {
            Entitlement consumed = getByEntitlementId(entitlementId);
            log.info("[下载次数已消耗] entitlementId={}, consumed={}, limit={}, status={}, traceId={}",
                    entitlementId, consumed.getDownloadsConsumed(), consumed.getDownloadLimit(),
                    consumed.getStatus(), TraceIdUtil.getTraceId());
            return consumed;
        }

        // 未命中：只读判断原因，优先级 撤销 > 过期 > 用完
        Entitlement current = getByEntitlementId(entitlementId);
        ErrorCode denial;
        if (current.getStatus() == EntitlementStatus.REVOKED) {
            denial = ErrorCode.ENTITLEMENT_REVOKED;
        } else if (current.isExpiredAt(now)) {
            denial = ErrorCode.ENTITLEMENT_EXPIRED;
        } else {
            denial = ErrorCode.ENTITLEMENT_EXHAUSTED;
        }
        log.warn("[下载次数消耗被拒绝] entitlementId={}, status={}, consumed={}, limit={}, expiresAt={}, "
                        + "reason={}, traceId={}",
                entitlementId, current.getStatus(), current.getDownloadsConsumed(), current.getDownloadLimit(),
                current.getExpiresAt(), denial, TraceIdUtil.getTraceId());
        throw new BusinessException(denial);
    }

    @Override
    public void revoke(String entitlementId) {
        int rows = baseMapper.revoke(entitlementId, LocalDateTime.now(clock));
        if (rows == 0) {
            throw new BusinessException(ErrorCode.ENTITLEMENT_NOT_FOUND, "下载授权不存在: " + entitlementId);
        }
        log.info("[授权已撤销] entitlementId={}, traceId={}", entitlementId, TraceIdUtil.getTraceId());
    }

    @Override
    public int revokeByOrder(String orderId) {
        int rows = baseMapper.revokeByOrderId(orderId, LocalDateTime.now(clock));
        log.info("[订单授权已撤销] orderId={}, revoked={}, traceId={}", orderId, rows, TraceIdUtil.getTraceId());
        return rows;
    }

    @Override
    public PurchaseSummary listPurchasedItems(Long userId) {
        List<PurchasedItemView> items = this.lambdaQuery()
                .eq(Entitlement::getUserId, userId)
                .orderByDesc(Entitlement::getCreateTime)
                .orderByDesc(Entitlement::getId)
                .list()
                .stream()
                .map(e -> PurchasedItemView.builder()
                        .entitlementId(e.getEntitlementId())
                        .productId(e.getProductId())
                        .orderId(e.getOrderId())
                        .status(e.getStatus())
                        .licenseKey(e.getLicenseKey())
                        .remainingDownloads(e.remainingDownloads())
                        .downloadsConsumed(e.getDownloadsConsumed())
                        .expiresAt(e.getExpiresAt())
                        .lastAccessTime(e.getLastAccessTime())
                        .build())
                .collect(Collectors.toList());

        int totalDownloads = items.stream()
                .mapToInt(item -> item.getDownloadsConsumed() == null ? 0 : item.getDownloadsConsumed())
                .sum();
        return PurchaseSummary.builder()
                .userId(userId)
                .totalItems(items.size())
                .totalDownloads(totalDownloads)
                .items(items)
                .build();
    }
}
