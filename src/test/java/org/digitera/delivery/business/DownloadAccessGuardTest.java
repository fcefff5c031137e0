package org.digitera.delivery.business;

import lombok.extern.slf4j.Slf4j;
import org.digitera.delivery.AbstractDeliveryTest;
import org.digitera.delivery.domain.DownloadEvent;
import org.digitera.delivery.domain.DownloadOutcome;
import org.digitera.delivery.domain.Entitlement;
import org.digitera.delivery.domain.EntitlementStatus;
import org.digitera.delivery.domain.PurchaseOrder;
import org.digitera.delivery.domain.vo.DownloadGrant;
import org.digitera.delivery.domain.vo.DownloadToken;
import org.digitera.delivery.domain.vo.DownloadTokenClaims;
import org.digitera.delivery.exception.BusinessException;
import org.digitera.delivery.exception.ErrorCode;
import org.digitera.delivery.gateway.CatalogProduct;
import org.digitera.delivery.service.IDownloadAuditService;
import org.digitera.delivery.service.IEntitlementService;
import org.digitera.delivery.util.DownloadTokenCodec;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 下载访问控制测试
 * - 次数限制与用完
 * - 过期、撤销、令牌篡改、一次性令牌重放
 * - 并发兑换不超额
 */
@Slf4j
class DownloadAccessGuardTest extends AbstractDeliveryTest {

    @Autowired
    private DownloadAccessGuard downloadAccessGuard;

    @Autowired
    private IEntitlementService entitlementService;

    @Autowired
    private IDownloadAuditService downloadAuditService;

    @Autowired
    private DownloadTokenCodec downloadTokenCodec;

    @Test
    void threeDownloadsThenExhaustedWhileOtherItemIsUntouched() {
        Long userId = newBuyer();
        CatalogProduct itemA = product(uniqueId("P"), "10.00", 3, null);
        CatalogProduct itemB = product(uniqueId("P"), "12.00", 3, null);
        PurchaseOrder order = paidOrder(userId, itemA, itemB);
        Entitlement entitlementA = entitlementService.findByOrderLine(order.getOrderId(), 1);
        Entitlement entitlementB = entitlementService.findByOrderLine(order.getOrderId(), 2);

        for (int i = 1; i <= 3; i++) {
            DownloadToken token = downloadAccessGuard.issueToken(userId, entitlementA.getEntitlementId(), false);
            DownloadGrant grant = downloadAccessGuard.redeem(token.getToken(), "client-1");
            assertEquals(3 - i, grant.getRemainingDownloads());
            assertTrue(grant.getUrl().startsWith("https://cdn.test.local/files/"));
            assertTrue(grant.getUrl().contains("signature="));
        }

        // 用完后不能再签发令牌
        BusinessException issueDenied = assertThrows(BusinessException.class,
                () -> downloadAccessGuard.issueToken(userId, entitlementA.getEntitlementId(), false));
        assertEquals(ErrorCode.NOT_ENTITLED, issueDenied.getErrorCode());

        Entitlement exhausted = entitlementService.getByEntitlementId(entitlementA.getEntitlementId());
        assertEquals(EntitlementStatus.EXHAUSTED, exhausted.getStatus());
        assertEquals(3, exhausted.getDownloadsConsumed());
        assertEquals(0, entitlementService.getByEntitlementId(entitlementB.getEntitlementId()).getDownloadsConsumed());
    }

    @Test
    void tokenIssuedBeforeExhaustionIsDeniedAfterwards() {
        Long userId = newBuyer();
        PurchaseOrder order = paidOrder(userId, product(uniqueId("P"), "10.00", 1, null));
        String entitlementId = entitlementService.findByOrderLine(order.getOrderId(), 1).getEntitlementId();

        DownloadToken first = downloadAccessGuard.issueToken(userId, entitlementId, false);
        DownloadToken second = downloadAccessGuard.issueToken(userId, entitlementId, false);
        downloadAccessGuard.redeem(first.getToken(), "client-1");

        BusinessException e = assertThrows(BusinessException.class,
                () -> downloadAccessGuard.redeem(second.getToken(), "client-1"));
        assertEquals(ErrorCode.ENTITLEMENT_EXHAUSTED, e.getErrorCode());
        assertEquals(DownloadOutcome.DENIED_EXHAUSTED, lastOutcome(entitlementId));
    }

    @Test
    void expiredEntitlementIsDeniedWithoutSpendingQuota() {
        Long userId = newBuyer();
        PurchaseOrder order = paidOrder(userId, product(uniqueId("P"), "10.00", 3, 30));
        String entitlementId = entitlementService.findByOrderLine(order.getOrderId(), 1).getEntitlementId();
        DownloadToken token = downloadAccessGuard.issueToken(userId, entitlementId, false);

        entitlementService.lambdaUpdate()
                .set(Entitlement::getExpiresAt, LocalDateTime.now().minusSeconds(1))
                .eq(Entitlement::getEntitlementId, entitlementId)
                .update();

        BusinessException e = assertThrows(BusinessException.class,
                () -> downloadAccessGuard.redeem(token.getToken(), "client-1"));
        assertEquals(ErrorCode.ENTITLEMENT_EXPIRED, e.getErrorCode());
        assertEquals(DownloadOutcome.DENIED_EXPIRED, lastOutcome(entitlementId));
        assertEquals(0, entitlementService.getByEntitlementId(entitlementId).getDownloadsConsumed());
    }

    @Test
    void revokedEntitlementIsDenied() {
        Long userId = newBuyer();
        PurchaseOrder order = paidOrder(userId, product(uniqueId("P"), "10.00", 3, null));
        String entitlementId = entitlementService.findByOrderLine(order.getOrderId(), 1).getEntitlementId();
        DownloadToken token = downloadAccessGuard.issueToken(userId, entitlementId, false);

        orderLedgerService.refund(order.getOrderId(), "chargeback");

        BusinessException e = assertThrows(BusinessException.class,
                () -> downloadAccessGuard.redeem(token.getToken(), "client-1"));
        assertEquals(ErrorCode.ENTITLEMENT_REVOKED, e.getErrorCode());
        assertEquals(DownloadOutcome.DENIED_REVOKED, lastOutcome(entitlementId));
    }

    @Test
    void tamperedTokenIsRejectedAndAudited() {
        Long userId = newBuyer();
        PurchaseOrder order = paidOrder(userId, product(uniqueId("P"), "10.00", 3, null));
        String entitlementId = entitlementService.findByOrderLine(order.getOrderId(), 1).getEntitlementId();
        String token = downloadAccessGuard.issueToken(userId, entitlementId, false).getToken();
        String tampered = token.substring(0, token.length() - 2)
                + (token.endsWith("AA") ? "BB" : "AA");

        BusinessException e = assertThrows(BusinessException.class,
                () -> downloadAccessGuard.redeem(tampered, "client-1"));
        assertEquals(ErrorCode.TOKEN_INVALID, e.getErrorCode());
        assertEquals(DownloadOutcome.DENIED_TOKEN_INVALID, lastOutcome(entitlementId));
        assertEquals(0, entitlementService.getByEntitlementId(entitlementId).getDownloadsConsumed());

        BusinessException garbage = assertThrows(BusinessException.class,
                () -> downloadAccessGuard.redeem("not-a-token", "client-1"));
        assertEquals(ErrorCode.TOKEN_INVALID, garbage.getErrorCode());
    }

    @Test
    void expiredTokenIsRejected() {
        Long userId = newBuyer();
        PurchaseOrder order = paidOrder(userId, product(uniqueId("P"), "10.00", 3, null));
        String entitlementId = entitlementService.findByOrderLine(order.getOrderId(), 1).getEntitlementId();
        long now = System.currentTimeMillis();
        String expired = downloadTokenCodec.encode(DownloadTokenClaims.builder()
                .tokenId("expired-token")
                .entitlementId(entitlementId)
                .userId(userId)
                .issuedAt(now - 600_000)
                .expiresAt(now - 300_000)
                .singleUse(false)
                .build());

        BusinessException e = assertThrows(BusinessException.class,
                () -> downloadAccessGuard.redeem(expired, "client-1"));
        assertEquals(ErrorCode.TOKEN_INVALID, e.getErrorCode());
        assertEquals(0, entitlementService.getByEntitlementId(entitlementId).getDownloadsConsumed());
    }

    @Test
    void singleUseTokenCannotBeReplayed() {
        Long userId = newBuyer();
        PurchaseOrder order = paidOrder(userId, product(uniqueId("P"), "10.00", null, null));
        String entitlementId = entitlementService.findByOrderLine(order.getOrderId(), 1).getEntitlementId();
        DownloadToken token = downloadAccessGuard.issueToken(userId, entitlementId, true);

        DownloadGrant grant = downloadAccessGuard.redeem(token.getToken(), "client-1");
        assertNull(grant.getRemainingDownloads());

        BusinessException e = assertThrows(BusinessException.class,
                () -> downloadAccessGuard.redeem(token.getToken(), "client-1"));
        assertEquals(ErrorCode.TOKEN_INVALID, e.getErrorCode());
        assertEquals(1, entitlementService.getByEntitlementId(entitlementId).getDownloadsConsumed());
    }

    @Test
    void tokenCannotBeIssuedForAnotherUsersEntitlement() {
        Long owner = newBuyer();
        Long stranger = newBuyer();
        PurchaseOrder order = paidOrder(owner, product(uniqueId("P"), "10.00", 3, null));
        String entitlementId = entitlementService.findByOrderLine(order.getOrderId(), 1).getEntitlementId();

        BusinessException e = assertThrows(BusinessException.class,
                () -> downloadAccessGuard.issueToken(stranger, entitlementId, false));
        assertEquals(ErrorCode.NOT_ENTITLED, e.getErrorCode());
        assertEquals(DownloadOutcome.DENIED_NOT_ENTITLED, lastOutcome(entitlementId));

        BusinessException missing = assertThrows(BusinessException.class,
                () -> downloadAccessGuard.issueToken(owner, "ENT-MISSING", false));
        assertEquals(ErrorCode.NOT_ENTITLED, missing.getErrorCode());
    }

    /**
     * 同一授权（上限 5 次）并发兑换 20 个令牌
     * 验证放行次数恰好等于上限
     */
    @Test
    void concurrentRedemptionsNeverExceedTheLimit() throws Exception {
        int limit = 5;
        int threadCount = 20;
        Long userId = newBuyer();
        PurchaseOrder order = paidOrder(userId, product(uniqueId("P"), "10.00", limit, null));
        String entitlementId = entitlementService.findByOrderLine(order.getOrderId(), 1).getEntitlementId();

        ExecutorService executorService = Executors.newFixedThreadPool(10);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger failureCount = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            final int threadNo = i;
            final String token = downloadAccessGuard.issueToken(userId, entitlementId, false).getToken();
            executorService.execute(() -> {
                try {
                    start.await();
                    downloadAccessGuard.redeem(token, "client-" + threadNo);
                    successCount.incrementAndGet();
                } catch (Exception e) {
                    log.debug("线程[{}] 兑换失败: {}", threadNo, e.getMessage());
                    failureCount.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executorService.shutdown();

        log.info("并发兑换结果: success={}, failure={}", successCount.get(), failureCount.get());
        assertEquals(limit, successCount.get());
        assertEquals(threadCount - limit, failureCount.get());

        Entitlement entitlement = entitlementService.getByEntitlementId(entitlementId);
        assertEquals(limit, entitlement.getDownloadsConsumed());
        assertEquals(EntitlementStatus.EXHAUSTED, entitlement.getStatus());

        long granted = downloadAuditService.listForEntitlement(entitlementId).stream()
                .filter(event -> event.getOutcome() == DownloadOutcome.GRANTED)
                .count();
        assertEquals(limit, granted);
    }

    private DownloadOutcome lastOutcome(String entitlementId) {
        List<DownloadEvent> events = downloadAuditService.listForEntitlement(entitlementId);
        return events.get(events.size() - 1).getOutcome();
    }
}
