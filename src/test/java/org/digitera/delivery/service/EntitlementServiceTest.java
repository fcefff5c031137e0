package org.digitera.delivery.service;

import org.digitera.delivery.AbstractDeliveryTest;
import org.digitera.delivery.domain.Entitlement;
import org.digitera.delivery.domain.EntitlementStatus;
import org.digitera.delivery.domain.PurchaseOrder;
import org.digitera.delivery.domain.vo.PurchaseSummary;
import org.digitera.delivery.domain.vo.PurchasedItemView;
import org.digitera.delivery.exception.BusinessException;
import org.digitera.delivery.exception.ErrorCode;
import org.digitera.delivery.gateway.CatalogProduct;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntitlementServiceTest extends AbstractDeliveryTest {

    @Autowired
    private IEntitlementService entitlementService;

    @Test
    void consumeCountsDownAndExhaustsOnLastUnit() {
        CatalogProduct product = product(uniqueId("P"), "4.00", 2, null);
        PurchaseOrder order = paidOrder(newBuyer(), product);
        String entitlementId = entitlementService.listByOrder(order.getOrderId()).get(0).getEntitlementId();

        Entitlement first = entitlementService.consume(entitlementId);
        assertEquals(1, first.getDownloadsConsumed());
        assertEquals(1, first.remainingDownloads());
        assertEquals(EntitlementStatus.ACTIVE, first.getStatus());
        assertNotNull(first.getLastAccessTime());

        Entitlement second = entitlementService.consume(entitlementId);
        assertEquals(2, second.getDownloadsConsumed());
        assertEquals(0, second.remainingDownloads());
        assertEquals(EntitlementStatus.EXHAUSTED, second.getStatus());

        BusinessException e = assertThrows(BusinessException.class, () -> entitlementService.consume(entitlementId));
        assertEquals(ErrorCode.ENTITLEMENT_EXHAUSTED, e.getErrorCode());
        assertEquals(2, entitlementService.getByEntitlementId(entitlementId).getDownloadsConsumed());
    }

    @Test
    void unlimitedEntitlementNeverExhausts() {
        PurchaseOrder order = paidOrder(newBuyer(), product(uniqueId("P"), "4.00", null, null));
        String entitlementId = entitlementService.listByOrder(order.getOrderId()).get(0).getEntitlementId();

        Entitlement consumed = null;
        for (int i = 0; i < 5; i++) {
            consumed = entitlementService.consume(entitlementId);
        }
        assertEquals(5, consumed.getDownloadsConsumed());
        assertNull(consumed.remainingDownloads());
        assertEquals(EntitlementStatus.ACTIVE, consumed.getStatus());
    }

    @Test
    void revokedTakesPrecedenceOverExpiredAndExhausted() {
        PurchaseOrder order = paidOrder(newBuyer(), product(uniqueId("P"), "4.00", 1, null));
        String entitlementId = entitlementService.listByOrder(order.getOrderId()).get(0).getEntitlementId();
        entitlementService.consume(entitlementId);
        expire(entitlementId);

        BusinessException expired = assertThrows(BusinessException.class,
                () -> entitlementService.consume(entitlementId));
        assertEquals(ErrorCode.ENTITLEMENT_EXPIRED, expired.getErrorCode());

        entitlementService.revoke(entitlementId);
        entitlementService.revoke(entitlementId);
        BusinessException revoked = assertThrows(BusinessException.class,
                () -> entitlementService.consume(entitlementId));
        assertEquals(ErrorCode.ENTITLEMENT_REVOKED, revoked.getErrorCode());
        assertEquals(1, entitlementService.getByEntitlementId(entitlementId).getDownloadsConsumed());
    }

    @Test
    void consumeOfUnknownEntitlementFails() {
        BusinessException e = assertThrows(BusinessException.class,
                () -> entitlementService.consume("ENT-DOES-NOT-EXIST"));
        assertEquals(ErrorCode.ENTITLEMENT_NOT_FOUND, e.getErrorCode());
    }

    @Test
    void getPrefersMostRecentActiveEntitlement() {
        Long userId = newBuyer();
        CatalogProduct product = product(uniqueId("P"), "4.00", 1, null);
        PurchaseOrder firstOrder = paidOrder(userId, product);
        String firstId = entitlementService.listByOrder(firstOrder.getOrderId()).get(0).getEntitlementId();

        assertEquals(firstId, entitlementService.get(userId, product.getProductId()).getEntitlementId());

        // 第一条用完后再次购买
        entitlementService.consume(firstId);
        PurchaseOrder secondOrder = paidOrder(userId, product);
        String secondId = entitlementService.listByOrder(secondOrder.getOrderId()).get(0).getEntitlementId();
        assertEquals(secondId, entitlementService.get(userId, product.getProductId()).getEntitlementId());

        entitlementService.revoke(secondId);
        Entitlement fallback = entitlementService.get(userId, product.getProductId());
        assertFalse(fallback.getStatus() == EntitlementStatus.ACTIVE);

        BusinessException e = assertThrows(BusinessException.class,
                () -> entitlementService.get(userId, uniqueId("NOT-BOUGHT")));
        assertEquals(ErrorCode.ENTITLEMENT_NOT_FOUND, e.getErrorCode());
    }

    @Test
    void purchasedItemsReportRemainingDownloadsAndTotals() {
        Long userId = newBuyer();
        CatalogProduct limited = product(uniqueId("P"), "4.00", 3, 30);
        CatalogProduct unlimited = product(uniqueId("P"), "6.00", null, null);
        PurchaseOrder order = paidOrder(userId, limited, unlimited);
        Entitlement limitedEntitlement = entitlementService.findByOrderLine(order.getOrderId(), 1);
        entitlementService.consume(limitedEntitlement.getEntitlementId());
        entitlementService.consume(limitedEntitlement.getEntitlementId());

        PurchaseSummary summary = entitlementService.listPurchasedItems(userId);
        assertEquals(2, summary.getTotalItems());
        assertEquals(2, summary.getTotalDownloads());

        PurchasedItemView limitedView = summary.getItems().stream()
                .filter(item -> item.getProductId().equals(limited.getProductId()))
                .findFirst()
                .orElseThrow();
        assertEquals(1, limitedView.getRemainingDownloads());
        assertNotNull(limitedView.getExpiresAt());
        assertNotNull(limitedView.getLastAccessTime());

        PurchasedItemView unlimitedView = summary.getItems().stream()
                .filter(item -> item.getProductId().equals(unlimited.getProductId()))
                .findFirst()
                .orElseThrow();
        assertNull(unlimitedView.getRemainingDownloads());
        assertNull(unlimitedView.getExpiresAt());
        assertNull(unlimitedView.getLastAccessTime());
    }

    @Test
    void createForLineIsIdempotentPerOrderLine() {
        CatalogProduct product = product(uniqueId("P"), "4.00", 3, null);
        PurchaseOrder order = paidOrder(newBuyer(), product);

        boolean createdAgain = entitlementService.createForLine(order, order.getLineItems().get(0), product);

        assertFalse(createdAgain);
        assertEquals(1, entitlementService.listByOrder(order.getOrderId()).size());
    }

    @Test
    void createForLineSkipsRefundedOrder() {
        CatalogProduct product = product(uniqueId("P"), "4.00", 3, null);
        PurchaseOrder order = createOrder(newBuyer(), product);
        orderLedgerService.markPaid(order.getOrderId(), uniqueId("PAY"), 1L);
        orderLedgerService.refund(order.getOrderId(), "客户申请退款");

        boolean created = entitlementService.createForLine(order, order.getLineItems().get(0), product);

        assertFalse(created);
        assertTrue(entitlementService.listByOrder(order.getOrderId()).isEmpty());
    }

    private void expire(String entitlementId) {
        entitlementService.lambdaUpdate()
                .set(Entitlement::getExpiresAt, LocalDateTime.now().minusMinutes(1))
                .eq(Entitlement::getEntitlementId, entitlementId)
                .update();
    }
}
