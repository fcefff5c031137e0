package org.digitera.delivery.controller;

import org.digitera.delivery.business.FulfillmentProcessor;
import org.digitera.delivery.domain.vo.FulfillmentResult;
import org.digitera.delivery.event.PaymentConfirmationEvent;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 支付回调入口
 * 重复回调返回200与当前状态，5xx 表示支付服务应稍后重投
 */
@RestController
@RequestMapping("/api/payment")
public class PaymentController {

    private final FulfillmentProcessor fulfillmentProcessor;

    public PaymentController(FulfillmentProcessor fulfillmentProcessor) {
        this.fulfillmentProcessor = fulfillmentProcessor;
    }

    @PostMapping("/confirmation")
    public ResponseEntity<Map<String, Object>> confirm(@RequestBody PaymentConfirmationEvent event) {
        FulfillmentResult result = fulfillmentProcessor.handlePaymentConfirmation(event);
        return ResponseEntity.ok(ApiResponses.success("支付通知已处理", result));
    }
}
