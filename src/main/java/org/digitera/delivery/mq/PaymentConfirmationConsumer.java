package org.digitera.delivery.mq;

import lombok.extern.slf4j.Slf4j;
import org.digitera.delivery.business.FulfillmentProcessor;
import org.digitera.delivery.config.RabbitMQConfig;
import org.digitera.delivery.domain.vo.FulfillmentResult;
import org.digitera.delivery.event.PaymentConfirmationEvent;
import org.digitera.delivery.exception.BusinessException;
import org.digitera.delivery.exception.ErrorCategory;
import org.digitera.delivery.util.TraceIdUtil;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 支付通知消费者
 * - 与 HTTP 回调共用同一处理流程，重复消息由履约流程自身保证幂等
 * - 外部依赖不可用：抛出异常，消息重新入队
 * - 非法通知、订单不存在、支付引用冲突：拒绝且不重新入队，进入死信队列等待人工处理
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "digitera.delivery.mq", name = "enabled", havingValue = "true")
public class PaymentConfirmationConsumer {

    private final FulfillmentProcessor fulfillmentProcessor;

    public PaymentConfirmationConsumer(FulfillmentProcessor fulfillmentProcessor) {
        this.fulfillmentProcessor = fulfillmentProcessor;
    }

    @RabbitListener(queues = RabbitMQConfig.PAYMENT_CONFIRMATION_QUEUE)
    public void consume(PaymentConfirmationEvent event) {
        String traceId = event != null && StringUtils.hasText(event.getTraceId())
                ? event.getTraceId() : TraceIdUtil.generateTraceId();
        TraceIdUtil.setTraceId(traceId);
        try {
            FulfillmentResult result = fulfillmentProcessor.handlePaymentConfirmation(event);
            log.info("[支付通知消费完成] orderId={}, status={}, entitlementsCreated={}, traceId={}",
                    result.getOrderId(), result.getOrderStatus(), result.getEntitlementsCreated(), traceId);
        } catch (BusinessException e) {
            if (e.getCategory() == ErrorCategory.TRANSIENT) {
                log.warn("[支付通知处理失败，等待重投] orderId={}, code={}, errorMsg={}, traceId={}",
                        event.getOrderId(), e.getErrorCode(), e.getMessage(), traceId);
                throw e;
            }
            log.error("[支付通知无法处理，转入死信队列] code={}, errorMsg={}, traceId={}",
                    e.getErrorCode(), e.getMessage(), traceId);
            throw new AmqpRejectAndDontRequeueException("支付通知无法处理: " + e.getErrorCode(), e);
        } finally {
            TraceIdUtil.clearTraceId();
        }
    }
}
