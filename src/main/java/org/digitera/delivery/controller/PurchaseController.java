package org.digitera.delivery.controller;

import org.digitera.delivery.domain.vo.PurchaseSummary;
import org.digitera.delivery.domain.vo.PurchasedItemView;
import org.digitera.delivery.service.IEntitlementService;
import org.digitera.delivery.service.IOrderLedgerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 已购商品
 * 剩余次数为空显示 "unlimited"，过期时间为空显示 "never"
 */
@RestController
@RequestMapping("/api/purchases")
public class PurchaseController {

    static final String UNLIMITED = "unlimited";
    static final String NEVER = "never";

    private final IEntitlementService entitlementService;
    private final IOrderLedgerService orderLedgerService;

    public PurchaseController(IEntitlementService entitlementService, IOrderLedgerService orderLedgerService) {
        this.entitlementService = entitlementService;
        this.orderLedgerService = orderLedgerService;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listPurchases(@RequestHeader("X-User-Id") Long userId) {
        PurchaseSummary summary = entitlementService.listPurchasedItems(userId);
        List<Map<String, Object>> items = summary.getItems().stream()
                .map(PurchaseController::render)
                .collect(Collectors.toList());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("userId", summary.getUserId());
        data.put("totalItems", summary.getTotalItems());
        data.put("totalDownloads", summary.getTotalDownloads());
        data.put("totalSpent", orderLedgerService.totalSpent(userId));
        data.put("items", items);
        return ResponseEntity.ok(ApiResponses.success("查询成功", data));
    }

    private static Map<String, Object> render(PurchasedItemView item) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("entitlementId", item.getEntitlementId());
        view.put("productId", item.getProductId());
        view.put("orderId", item.getOrderId());
        view.put("status", item.getStatus());
        view.put("licenseKey", item.getLicenseKey());
        view.put("remainingDownloads", item.getRemainingDownloads() == null ? UNLIMITED : item.getRemainingDownloads());
        view.put("downloadsConsumed", item.getDownloadsConsumed());
        view.put("expiresAt", item.getExpiresAt() == null ? NEVER : item.getExpiresAt().toString());
        view.put("lastAccessTime", item.getLastAccessTime());
        return view;
    }
}
