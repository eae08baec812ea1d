package com.campuseats.orderservice.config;

import org.springframework.amqp.core.TopicExchange;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Order status events leave through a single topic exchange, routed as
 * {@code order.<status>}. Consumers declare and bind their own queues.
 */
@Configuration
public class AmqpConfig {

    public static final String ORDER_EXCHANGE = "order_events_exchange";

    @Bean
    public TopicExchange orderEventsExchange() {
        return new TopicExchange(ORDER_EXCHANGE);
    }
}
