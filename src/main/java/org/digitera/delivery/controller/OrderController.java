package org.digitera.delivery.controller;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.digitera.delivery.domain.OrderStatusHistory;
import org.digitera.delivery.domain.PurchaseOrder;
import org.digitera.delivery.service.IOrderLedgerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 订单控制器
 *
 * 职责：
 * 1. 接收请求参数
 * 2. 调用订单账本
 * 3. 返回统一响应体
 * orderId 由服务层生成，错误由 GlobalExceptionHandler 统一处理
 *
 * API规范：
 * - POST /api/order/create - 创建订单
 * - GET /api/order/{orderId} - 查询订单
 * - GET /api/order/{orderId}/history - 订单状态流转记录
 * - POST /api/order/refund - 退款（同时撤销授权）
 */
@RestController
@RequestMapping("/api/order")
public class OrderController {

    private final IOrderLedgerService orderLedgerService;

    public OrderController(IOrderLedgerService orderLedgerService) {
        this.orderLedgerService = orderLedgerService;
    }

    /**
     * 请求体：
     * {
     *     "productIds": ["PRD-1", "PRD-2"]
     * }
     */
    @PostMapping("/create")
    public ResponseEntity<Map<String, Object>> createOrder(@RequestHeader("X-User-Id") Long userId,
                                                           @RequestBody CreateOrderRequest request) {
        PurchaseOrder order = orderLedgerService.createOrder(userId, request.getProductIds());
        return ResponseEntity.ok(ApiResponses.success("订单创建成功", order));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<Map<String, Object>> getOrder(@PathVariable String orderId) {
        return ResponseEntity.ok(ApiResponses.success("查询成功", orderLedgerService.getOrder(orderId)));
    }

    @GetMapping("/{orderId}/history")
    public ResponseEntity<Map<String, Object>> getHistory(@PathVariable String orderId) {
        List<OrderStatusHistory> history = orderLedgerService.listStatusHistory(orderId);
        return ResponseEntity.ok(ApiResponses.success("查询成功", history));
    }

    @PostMapping("/refund")
    public ResponseEntity<Map<String, Object>> refund(@RequestBody RefundRequest request) {
        PurchaseOrder order = orderLedgerService.refund(request.getOrderId(), request.getReason());
        return ResponseEntity.ok(ApiResponses.success("退款成功", order));
    }

    @Data
    @NoArgsConstructor
    public static class CreateOrderRequest {
        private List<String> productIds;
    }

    @Data
    @NoArgsConstructor
    public static class RefundRequest {
        private String orderId;
        private String reason;
    }
}
