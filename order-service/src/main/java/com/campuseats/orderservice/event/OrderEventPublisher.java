package com.campuseats.orderservice.event;

import com.campuseats.common.contracts.OrderStatusChangeContract;
import com.campuseats.orderservice.model.Order;
import com.campuseats.orderservice.model.OrderStatus;
import com.campuseats.orderservice.model.OutboxEvent;
import com.campuseats.orderservice.repository.OutboxRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Locale;

/**
 * Writes order events to the outbox. Joins the caller's transaction so the event
 * exists if and only if the status change it describes was committed.
 * {@link com.campuseats.orderservice.job.OutboxPublisher} relays them to RabbitMQ.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderEventPublisher {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public void orderCreated(Order order) {
        save(order, "order.created", null, null);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void statusChanged(Order order, OrderStatus previousStatus, String reason) {
        save(order, routingKey(order.getStatus()), previousStatus, reason);
    }

    public static String routingKey(OrderStatus status) {
        return "order." + status.name().toLowerCase(Locale.ROOT);
    }

    private void save(Order order, String type, OrderStatus previousStatus, String reason) {
        OrderStatusChangeContract contract = OrderStatusChangeContract.builder()
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .userId(order.getUserId())
                .vendorId(order.getVendorId())
                .status(order.getStatus().name())
                .previousStatus(previousStatus != null ? previousStatus.name() : null)
                .orderType(order.getOrderType() != null ? order.getOrderType().name() : null)
                .total(order.getTotal())
                .reason(reason)
                .occurredAt(clock.instant())
                .build();

        String payload;
        try {
            payload = objectMapper.writeValueAsString(contract);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize order event: orderId={}, type={}", order.getId(), type, e);
            throw new IllegalStateException("Failed to serialize order event", e);
        }

        outboxRepository.save(OutboxEvent.builder()
                .aggregateType(OutboxEvent.ORDER_AGGREGATE)
                .aggregateId(order.getId().toString())
                .type(type)
                .payload(payload)
                .createdAt(clock.instant())
                .processed(false)
                .build());
        log.debug("'{}' event saved to outbox: orderId={}", type, order.getId());
    }
}
