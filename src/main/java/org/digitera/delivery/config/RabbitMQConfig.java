package org.digitera.delivery.config;

import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ 配置类
 * - 支付结果通知入口：支付方按至少一次语义投递
 * - 处理失败（外部依赖不可用）时消息重新入队；非法/冲突消息进入死信队列等待人工处理
 * - 仅在 digitera.delivery.mq.enabled=true 时启用
 */
@Configuration
@ConditionalOnProperty(prefix = "digitera.delivery.mq", name = "enabled", havingValue = "true")
public class RabbitMQConfig {

    // ==================== 支付结果通知 ====================

    public static final String PAYMENT_CONFIRMATION_EXCHANGE = "payment.confirmation.exchange";
    public static final String PAYMENT_CONFIRMATION_QUEUE = "payment.confirmation.queue";
    public static final String PAYMENT_CONFIRMATION_ROUTING_KEY = "payment.confirmation";

    // ==================== 死信（人工处理） ====================

    public static final String PAYMENT_CONFIRMATION_DLX_EXCHANGE = "payment.confirmation.dlx.exchange";
    public static final String PAYMENT_CONFIRMATION_DLX_QUEUE = "payment.confirmation.dlx.queue";
    public static final String PAYMENT_CONFIRMATION_DLX_ROUTING_KEY = "payment.confirmation.dlx";

    @Bean
    public DirectExchange paymentConfirmationExchange() {
        return new DirectExchange(PAYMENT_CONFIRMATION_EXCHANGE, true, false);
    }

    @Bean
    public Queue paymentConfirmationQueue() {
        return QueueBuilder.durable(PAYMENT_CONFIRMATION_QUEUE)
                .deadLetterExchange(PAYMENT_CONFIRMATION_DLX_EXCHANGE)
                .deadLetterRoutingKey(PAYMENT_CONFIRMATION_DLX_ROUTING_KEY)
                .build();
    }

    @Bean
    public Binding paymentConfirmationBinding(Queue paymentConfirmationQueue,
                                              DirectExchange paymentConfirmationExchange) {
        return BindingBuilder.bind(paymentConfirmationQueue)
                .to(paymentConfirmationExchange)
                .with(PAYMENT_CONFIRMATION_ROUTING_KEY);
    }

    @Bean
    public DirectExchange paymentConfirmationDlxExchange() {
        return new DirectExchange(PAYMENT_CONFIRMATION_DLX_EXCHANGE, true, false);
    }

    @Bean
    public Queue paymentConfirmationDlxQueue() {
        // 死信不设置超时，需要人工处理
        return QueueBuilder.durable(PAYMENT_CONFIRMATION_DLX_QUEUE).build();
    }

    @Bean
    public Binding paymentConfirmationDlxBinding(Queue paymentConfirmationDlxQueue,
                                                 DirectExchange paymentConfirmationDlxExchange) {
        return BindingBuilder.bind(paymentConfirmationDlxQueue)
                .to(paymentConfirmationDlxExchange)
                .with(PAYMENT_CONFIRMATION_DLX_ROUTING_KEY);
    }

    /**
     * 消息体使用 JSON
     */
    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }
}
