package com.campuseats.orderservice.service;

import com.campuseats.common.exception.AccessDeniedException;
import com.campuseats.common.exception.InsufficientStockException;
import com.campuseats.common.exception.ResourceNotFoundException;
import com.campuseats.orderservice.config.OrderProperties;
import com.campuseats.orderservice.dto.OrderResponse;
import com.campuseats.orderservice.dto.PaymentVerificationRequest;
import com.campuseats.orderservice.dto.PaymentVerificationResponse;
import com.campuseats.orderservice.exception.InvalidOrderStateException;
import com.campuseats.orderservice.gateway.PaymentSignatureVerifier;
import com.campuseats.orderservice.mapper.OrderMapper;
import com.campuseats.orderservice.model.Order;
import com.campuseats.orderservice.model.OrderStatus;
import com.campuseats.orderservice.model.PaymentMethod;
import com.campuseats.orderservice.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
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
public class OrderCompletionServiceImpl implements OrderCompletionService {

    private static final Set<OrderStatus> AWAITING_PAYMENT = EnumSet.of(OrderStatus.PENDING_PAYMENT);
    private static final Set<OrderStatus> AWAITING_APPROVAL = EnumSet.of(OrderStatus.PENDING_VENDOR_APPROVAL);

    private final OrderRepository orderRepository;
    private final OrderStore orderStore;
    private final InventoryCommitter inventoryCommitter;
    private final OrderReservations orderReservations;
    private final PaymentSignatureVerifier signatureVerifier;
    private final OrderMapper orderMapper;
    private final OrderProperties orderProperties;
    private final Clock clock;

    /**
     * Verifies a gateway payment and commits the order.
     *
     * A payment for an order that is gone or no longer pending (most likely expired by the
     * sweeper) is refused and logged for manual reconciliation; the order is never re-created.
     */
    @Override
    public PaymentVerificationResponse verifyPayment(PaymentVerificationRequest request, UUID userId) {
        UUID orderId = request.getOrderId();
        log.info("Payment verification started: orderId={}, paymentId={}", orderId, request.getGatewayPaymentId());

        Order order = orderRepository.findByIdAndDeletedFalse(orderId)
                .orElseThrow(() -> {
                    log.error("Payment for unknown order, manual reconciliation needed: orderId={}, paymentId={}",
                            orderId, request.getGatewayPaymentId());
                    return new ResourceNotFoundException("Order not found with id: " + orderId);
                });

        if (!order.getUserId().equals(userId)) {
            log.warn("Access denied: user {} attempted to verify payment for order {}", userId, orderId);
            throw new AccessDeniedException("Access Denied: You can only pay for your own orders");
        }

        if (order.getStatus() != OrderStatus.PENDING_PAYMENT) {
            if (order.getStatus() != OrderStatus.FAILED
                    && request.getGatewayPaymentId().equals(order.getPaymentReference())) {
                // same payment verified twice, already committed
                log.info("Payment already verified: orderId={}", orderId);
                return verificationResponse(order, true, "Payment already verified");
            }
            log.error("Payment for order that is not awaiting payment, manual reconciliation needed: " +
                    "orderId={}, status={}, paymentId={}", orderId, order.getStatus(), request.getGatewayPaymentId());
            throw new InvalidOrderStateException(
                    "Order is not awaiting payment. Current status: " + order.getStatus());
        }

        boolean signatureValid = request.getGatewayOrderId().equals(order.getGatewayOrderId())
                && signatureVerifier.verify(request.getGatewayOrderId(), request.getGatewayPaymentId(),
                        request.getSignature());

        if (!signatureValid) {
            log.warn("Payment signature mismatch: orderId={}, gatewayOrderId={}", orderId, request.getGatewayOrderId());
            Optional<Order> failed = orderStore.transition(orderId, AWAITING_PAYMENT, OrderStatus.FAILED,
                    "Payment verification failed");
            failed.ifPresent(orderReservations::release);
            Order current = failed.orElseGet(() -> orderRepository.findById(orderId).orElse(order));
            return verificationResponse(current, false, "Payment verification failed");
        }

        Order committed = commitAndRelease(order, AWAITING_PAYMENT, request.getGatewayPaymentId());
        return verificationResponse(committed, true, "Payment verified");
    }

    @Override
    public OrderResponse confirmCashPayment(UUID orderId, UUID vendorId) {
        Order order = findOwnedByVendor(orderId, vendorId, "confirm payment for");
        if (order.getPaymentMethod() != PaymentMethod.CASH) {
            throw new InvalidOrderStateException("Only cash orders can be confirmed at the counter");
        }
        requireStatus(order, OrderStatus.PENDING_PAYMENT, "confirm payment for");
        // the sweeper may not have reached it yet, the window is closed all the same
        if (order.getReservationExpiresAt() != null && !order.getReservationExpiresAt().isAfter(clock.instant())) {
            log.warn("Cash payment window closed: orderId={}, expiredAt={}", orderId, order.getReservationExpiresAt());
            throw new InvalidOrderStateException("Cash payment window for this order has closed");
        }
        return orderMapper.toOrderResponse(commitAndRelease(order, AWAITING_PAYMENT, null));
    }

    @Override
    public OrderResponse acceptOrder(UUID orderId, UUID vendorId) {
        log.info("Accept order process started: orderId={}", orderId);
        Order order = findOwnedByVendor(orderId, vendorId, "accept");
        requireStatus(order, OrderStatus.PENDING_VENDOR_APPROVAL, "accept");
        return orderMapper.toOrderResponse(commitAndRelease(order, AWAITING_APPROVAL, null));
    }

    @Override
    public OrderResponse denyOrder(UUID orderId, UUID vendorId, String reason) {
        Order order = findOwnedByVendor(orderId, vendorId, "deny");
        String denialReason = reason == null || reason.isBlank() ? orderProperties.getDefaultDenialReason() : reason;

        Order denied = orderStore.transition(orderId, AWAITING_APPROVAL, OrderStatus.DENIED, denialReason)
                .orElseThrow(() -> invalidState(orderId, "deny"));
        orderReservations.release(denied);
        log.info("Order denied: orderId={}, reason={}", orderId, denialReason);
        return orderMapper.toOrderResponse(denied);
    }

    @Override
    public OrderResponse cancelOrder(UUID orderId, UUID userId) {
        Order order = orderRepository.findByIdAndDeletedFalse(orderId)
                .orElseThrow(() -> notFound(orderId));
        if (!order.getUserId().equals(userId)) {
            log.warn("Access denied: user {} attempted to cancel order {}", userId, orderId);
            throw new AccessDeniedException("Access Denied: You can only cancel your own orders");
        }

        Order cancelled = orderStore.transition(orderId, OrderStatus.PENDING, OrderStatus.CANCELLED,
                        "Cancelled by user")
                .orElseThrow(() -> invalidState(orderId, "cancel"));
        orderReservations.release(cancelled);
        log.info("Order cancelled by user: orderId={}", orderId);
        return orderMapper.toOrderResponse(cancelled);
    }

    // Each withdrawal commits on its own, even when the caller runs in a transaction
    @Override
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public int cancelAllPendingApprovals(UUID userId) {
        List<Order> pending = orderRepository.findByUserIdAndStatusAndDeletedFalse(userId,
                OrderStatus.PENDING_VENDOR_APPROVAL);
        int withdrawn = 0;
        for (Order order : pending) {
            try {
                Optional<Order> cancelled = orderStore.transition(order.getId(), AWAITING_APPROVAL,
                        OrderStatus.CANCELLED, "Superseded by a newer request");
                if (cancelled.isEmpty()) {
                    // vendor acted on it in the meantime
                    continue;
                }
                orderReservations.release(cancelled.get());
                orderStore.unlinkAndDelete(cancelled.get());
                withdrawn++;
            } catch (RuntimeException e) {
                log.warn("Could not withdraw pending approval: orderId={}, userId={}", order.getId(), userId, e);
            }
        }
        if (withdrawn > 0) {
            log.info("Withdrew {} pending approval requests: userId={}", withdrawn, userId);
        }
        return withdrawn;
    }

    private Order commitAndRelease(Order order, Set<OrderStatus> expected, String paymentReference) {
        Optional<Order> committed;
        try {
            committed = inventoryCommitter.commit(order.getId(), expected, paymentReference);
        } catch (InsufficientStockException e) {
            // the commit rolled back, the order is still pending
            log.error("Commit failed on stock, manual reconciliation needed: orderId={}, paymentReference={}",
                    order.getId(), paymentReference, e);
            orderStore.transition(order.getId(), expected, OrderStatus.FAILED, e.getMessage())
                    .ifPresent(orderReservations::release);
            throw e;
        }

        if (committed.isEmpty()) {
            throw invalidState(order.getId(), "complete");
        }
        orderReservations.release(committed.get());
        return committed.get();
    }

    private Order findOwnedByVendor(UUID orderId, UUID vendorId, String action) {
        Order order = orderRepository.findByIdAndDeletedFalse(orderId)
                .orElseThrow(() -> notFound(orderId));
        if (!order.getVendorId().equals(vendorId)) {
            log.warn("Access denied: vendor {} attempted to {} order {} of vendor {}",
                    vendorId, action, orderId, order.getVendorId());
            throw new AccessDeniedException("Access Denied: This order belongs to another vendor");
        }
        return order;
    }

    private void requireStatus(Order order, OrderStatus expected, String action) {
        if (order.getStatus() != expected) {
            log.warn("Invalid state transition: orderId={}, currentStatus={}, attemptedAction={}",
                    order.getId(), order.getStatus(), action);
            throw new InvalidOrderStateException(
                    "Order status must be " + expected + " to " + action + ". Current status: " + order.getStatus());
        }
    }

    private InvalidOrderStateException invalidState(UUID orderId, String action) {
        OrderStatus current = orderRepository.findById(orderId).map(Order::getStatus).orElse(null);
        log.warn("Invalid state transition: orderId={}, currentStatus={}, attemptedAction={}",
                orderId, current, action);
        return new InvalidOrderStateException("Unable to " + action + " order in status " + current);
    }

    private ResourceNotFoundException notFound(UUID orderId) {
        log.warn("Order not found: orderId={}", orderId);
        return new ResourceNotFoundException("Order not found with id: " + orderId);
    }

    private PaymentVerificationResponse verificationResponse(Order order, boolean verified, String message) {
        return PaymentVerificationResponse.builder()
                .verified(verified)
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .status(order.getStatus())
                .message(message)
                .build();
    }
}
