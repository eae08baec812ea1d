package com.campuseats.orderservice.service;

import com.campuseats.common.exception.AccessDeniedException;
import com.campuseats.common.exception.ResourceNotFoundException;
import com.campuseats.orderservice.dto.OrderResponse;
import com.campuseats.orderservice.exception.InvalidOrderStateException;
import com.campuseats.orderservice.mapper.OrderMapper;
import com.campuseats.orderservice.model.Order;
import com.campuseats.orderservice.model.OrderStatus;
import com.campuseats.orderservice.model.OrderType;
import com.campuseats.orderservice.model.PaymentMethod;
import com.campuseats.orderservice.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderServiceImpl implements OrderService {

    // allowed source statuses of each fulfilment step
    static final Set<OrderStatus> READY_FROM = EnumSet.of(OrderStatus.IN_PROGRESS);
    static final Set<OrderStatus> COMPLETE_FROM = EnumSet.of(OrderStatus.IN_PROGRESS, OrderStatus.READY);
    static final Set<OrderStatus> START_DELIVERY_FROM = EnumSet.of(OrderStatus.READY, OrderStatus.COMPLETED);
    static final Set<OrderStatus> PAST = EnumSet.of(OrderStatus.COMPLETED, OrderStatus.DELIVERED,
            OrderStatus.FAILED);
    static final Set<OrderStatus> DELIVER_FROM = EnumSet.of(OrderStatus.IN_PROGRESS, OrderStatus.READY,
            OrderStatus.COMPLETED, OrderStatus.ON_THE_WAY);

    private final OrderRepository orderRepository;
    private final OrderStore orderStore;
    private final OrderMapper orderMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrderById(UUID orderId, UUID userId, UUID vendorId) {
        Order order = findOrder(orderId);

        boolean isCustomer = userId != null && order.getUserId().equals(userId);
        boolean isVendor = vendorId != null && order.getVendorId().equals(vendorId);
        if (!isCustomer && !isVendor) {
            log.warn("Access denied: userId={}, vendorId={} attempted to view order {}", userId, vendorId, orderId);
            throw new AccessDeniedException("Access Denied: You are not allowed to view this order");
        }
        return orderMapper.toOrderResponse(order);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getMyOrders(UUID userId) {
        return orderMapper.toOrderResponses(orderRepository.findByUserIdAndDeletedFalseOrderByCreatedAtDesc(userId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getPendingApprovals(UUID vendorId) {
        return orderMapper.toOrderResponses(orderRepository.findByVendorIdAndStatusInAndDeletedFalseOrderByCreatedAtAsc(
                vendorId, EnumSet.of(OrderStatus.PENDING_VENDOR_APPROVAL)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getActiveOrders(UUID vendorId) {
        return orderMapper.toOrderResponses(orderRepository.findByVendorIdAndStatusInAndDeletedFalseOrderByCreatedAtAsc(
                vendorId, OrderStatus.ACTIVE));
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getAwaitingCashPayment(UUID vendorId) {
        return orderMapper.toOrderResponses(orderRepository
                .findByVendorIdAndStatusAndPaymentMethodAndReservationExpiresAtAfterAndDeletedFalseOrderByCreatedAtAsc(
                        vendorId, OrderStatus.PENDING_PAYMENT, PaymentMethod.CASH, clock.instant()));
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getPastOrders(UUID vendorId) {
        return orderMapper.toOrderResponses(
                orderRepository.findByVendorIdAndStatusInAndDeletedFalseOrderByCreatedAtDesc(vendorId, PAST));
    }

    @Override
    public OrderResponse markReady(UUID orderId, UUID vendorId) {
        findOwnedByVendor(orderId, vendorId, "mark ready");
        return advance(orderId, READY_FROM, OrderStatus.READY, "mark ready");
    }

    @Override
    public OrderResponse completeOrder(UUID orderId, UUID vendorId) {
        findOwnedByVendor(orderId, vendorId, "complete");
        return advance(orderId, COMPLETE_FROM, OrderStatus.COMPLETED, "complete");
    }

    @Override
    public OrderResponse startDelivery(UUID orderId, UUID vendorId) {
        Order order = findOwnedByVendor(orderId, vendorId, "start delivery of");
        if (order.getOrderType() != OrderType.DELIVERY) {
            throw new InvalidOrderStateException("Only delivery orders can go out for delivery");
        }
        return advance(orderId, START_DELIVERY_FROM, OrderStatus.ON_THE_WAY, "start delivery of");
    }

    @Override
    public OrderResponse deliverOrder(UUID orderId, UUID vendorId) {
        findOwnedByVendor(orderId, vendorId, "deliver");
        Order delivered = orderStore.markDelivered(orderId, DELIVER_FROM)
                .orElseThrow(() -> invalidTransition(orderId, DELIVER_FROM, "deliver"));
        log.info("Order delivered: orderId={}", orderId);
        return orderMapper.toOrderResponse(delivered);
    }

    @Override
    public void archiveOrder(UUID orderId, UUID vendorId) {
        findOwnedByVendor(orderId, vendorId, "archive");
        int updated = orderRepository.softDelete(orderId, vendorId, OrderStatus.TERMINAL, clock.instant());
        if (updated == 0) {
            throw invalidTransition(orderId, OrderStatus.TERMINAL, "archive");
        }
        log.info("Order archived: orderId={}", orderId);
    }

    private OrderResponse advance(UUID orderId, Set<OrderStatus> from, OrderStatus next, String action) {
        Optional<Order> updated = orderStore.transition(orderId, from, next);
        return orderMapper.toOrderResponse(updated.orElseThrow(() -> invalidTransition(orderId, from, action)));
    }

    private Order findOrder(UUID orderId) {
        return orderRepository.findByIdAndDeletedFalse(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found: orderId={}", orderId);
                    return new ResourceNotFoundException("Order not found with id: " + orderId);
                });
    }

    private Order findOwnedByVendor(UUID orderId, UUID vendorId, String action) {
        Order order = findOrder(orderId);
        if (!order.getVendorId().equals(vendorId)) {
            log.warn("Access denied: vendor {} attempted to {} order {}", vendorId, action, orderId);
            throw new AccessDeniedException("Access Denied: This order belongs to another vendor");
        }
        return order;
    }

    private InvalidOrderStateException invalidTransition(UUID orderId, Set<OrderStatus> from, String action) {
        OrderStatus current = orderRepository.findById(orderId).map(Order::getStatus).orElse(null);
        log.warn("Invalid state transition: orderId={}, currentStatus={}, attemptedAction={}",
                orderId, current, action);
        return new InvalidOrderStateException(
                "Order status must be one of " + from + " to " + action + ". Current status: " + current);
    }
}
