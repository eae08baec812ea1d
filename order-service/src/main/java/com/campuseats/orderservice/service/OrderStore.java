package com.campuseats.orderservice.service;

import com.campuseats.orderservice.event.OrderEventPublisher;
import com.campuseats.orderservice.model.Order;
import com.campuseats.orderservice.model.OrderStatus;
import com.campuseats.orderservice.repository.OrderRepository;
import com.campuseats.orderservice.repository.UserAccountRepository;
import com.campuseats.orderservice.repository.VendorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Writes to the order aggregate. Every status change goes through a conditional update
 * on the expected current status, together with its outbox event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderStore {

    private final OrderRepository orderRepository;
    private final UserAccountRepository userAccountRepository;
    private final VendorRepository vendorRepository;
    private final OrderEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public Order createPending(Order order) {
        if (!order.getStatus().isPending()) {
            throw new IllegalArgumentException("New orders must start pending, got " + order.getStatus());
        }
        Order saved = orderRepository.save(order);
        eventPublisher.orderCreated(saved);
        log.info("Order saved: orderId={}, orderNumber={}, status={}",
                saved.getId(), saved.getOrderNumber(), saved.getStatus());
        return saved;
    }

    /**
     * @return the updated order, or empty if it was not in one of the expected statuses
     */
    @Transactional
    public Optional<Order> transition(UUID orderId, Set<OrderStatus> expected, OrderStatus next) {
        return transition(orderId, expected, next, null);
    }

    /**
     * Tries one expected status at a time, so the event carries the status the order
     * actually left.
     */
    @Transactional
    public Optional<Order> transition(UUID orderId, Set<OrderStatus> expected, OrderStatus next, String reason) {
        Instant now = clock.instant();
        for (OrderStatus from : expected) {
            Set<OrderStatus> single = EnumSet.of(from);
            int updated = reason == null
                    ? orderRepository.transition(orderId, single, next, now)
                    : orderRepository.transitionWithReason(orderId, single, next, reason, now);
            if (updated > 0) {
                Order order = orderRepository.findById(orderId).orElseThrow();
                eventPublisher.statusChanged(order, from, reason);
                log.info("Order status changed: orderId={}, from={}, status={}", orderId, from, next);
                return Optional.of(order);
            }
        }
        log.debug("Transition lost: orderId={}, expected={}, next={}", orderId, expected, next);
        return Optional.empty();
    }

    /**
     * Delivery ends the order for the user: it moves from their active list to their
     * past list and leaves the vendor's queue, in the same transaction as the status change.
     */
    @Transactional
    public Optional<Order> markDelivered(UUID orderId, Set<OrderStatus> expected) {
        Optional<Order> delivered = transition(orderId, expected, OrderStatus.DELIVERED);
        delivered.ifPresent(order -> {
            userAccountRepository.pullActiveOrder(order.getUserId(), order.getId());
            userAccountRepository.pushPastOrder(order.getUserId(), order.getId());
            vendorRepository.pullActiveOrder(order.getVendorId(), order.getId());
        });
        return delivered;
    }

    public void attachGatewayOrder(UUID orderId, String gatewayOrderId) {
        orderRepository.attachGatewayOrder(orderId, gatewayOrderId);
    }

    /**
     * Removes an abandoned order and every reference to it. Each step runs and commits on
     * its own; a step that fails is logged and left to the sweeper's repair pass.
     *
     * @return true if every step succeeded
     */
    public boolean unlinkAndDelete(Order order) {
        boolean clean = true;
        try {
            userAccountRepository.pullActiveOrder(order.getUserId(), order.getId());
        } catch (RuntimeException e) {
            clean = false;
            log.warn("Could not unlink order from user: orderId={}, userId={}", order.getId(), order.getUserId(), e);
        }
        try {
            vendorRepository.pullActiveOrder(order.getVendorId(), order.getId());
        } catch (RuntimeException e) {
            clean = false;
            log.warn("Could not unlink order from vendor: orderId={}, vendorId={}",
                    order.getId(), order.getVendorId(), e);
        }
        try {
            orderRepository.deleteById(order.getId());
        } catch (RuntimeException e) {
            clean = false;
            log.warn("Could not delete order: orderId={}", order.getId(), e);
        }
        return clean;
    }
}
