package org.digitera.delivery.mq;

import org.digitera.delivery.business.FulfillmentProcessor;
import org.digitera.delivery.domain.OrderStatus;
import org.digitera.delivery.domain.PaymentOutcome;
import org.digitera.delivery.domain.vo.FulfillmentResult;
import org.digitera.delivery.event.PaymentConfirmationEvent;
import org.digitera.delivery.exception.BusinessException;
import org.digitera.delivery.exception.ErrorCode;
import org.digitera.delivery.util.TraceIdUtil;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;

import java.util.Collections;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PaymentConfirmationConsumerTest {

    private final FulfillmentProcessor fulfillmentProcessor = mock(FulfillmentProcessor.class);
    private final PaymentConfirmationConsumer consumer = new PaymentConfirmationConsumer(fulfillmentProcessor);

    private final PaymentConfirmationEvent event = PaymentConfirmationEvent.builder()
            .orderId("ORD-1234ABCD")
            .paymentRef("PAY-1")
            .outcome(PaymentOutcome.SUCCEEDED)
            .traceId("trace-from-payment")
            .build();

    @Test
    void handlesEventWithItsTraceId() {
        AtomicReference<String> seenTraceId = new AtomicReference<>();
        when(fulfillmentProcessor.handlePaymentConfirmation(event)).thenAnswer(invocation -> {
            seenTraceId.set(TraceIdUtil.getTraceId());
            return FulfillmentResult.builder()
                    .orderId(event.getOrderId())
                    .orderStatus(OrderStatus.PAID)
                    .entitlements(Collections.emptyList())
                    .build();
        });

        consumer.consume(event);

        assertEquals("trace-from-payment", seenTraceId.get());
        assertNull(TraceIdUtil.getTraceId());
    }

    @Test
    void transientFailureIsRethrownForRedelivery() {
        BusinessException failure = new BusinessException(ErrorCode.COLLABORATOR_UNAVAILABLE, "catalog down");
        when(fulfillmentProcessor.handlePaymentConfirmation(any())).thenThrow(failure);

        BusinessException thrown = assertThrows(BusinessException.class, () -> consumer.consume(event));
        assertSame(failure, thrown);
    }

    @Test
    void permanentFailureIsDeadLettered() {
        when(fulfillmentProcessor.handlePaymentConfirmation(any()))
                .thenThrow(new BusinessException(ErrorCode.CONFLICTING_PAYMENT_REFERENCE));

        assertThrows(AmqpRejectAndDontRequeueException.class, () -> consumer.consume(event));
    }
}
