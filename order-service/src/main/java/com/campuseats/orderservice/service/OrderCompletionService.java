package com.campuseats.orderservice.service;

import com.campuseats.orderservice.dto.OrderResponse;
import com.campuseats.orderservice.dto.PaymentVerificationRequest;
import com.campuseats.orderservice.dto.PaymentVerificationResponse;

import java.util.UUID;

/**
 * Moves pending orders out of their pending state: into IN_PROGRESS through a durable
 * commit, or into a terminal state with their reservations released.
 */
public interface OrderCompletionService {

    PaymentVerificationResponse verifyPayment(PaymentVerificationRequest request, UUID userId);

    OrderResponse confirmCashPayment(UUID orderId, UUID vendorId);

    OrderResponse acceptOrder(UUID orderId, UUID vendorId);

    OrderResponse denyOrder(UUID orderId, UUID vendorId, String reason);

    OrderResponse cancelOrder(UUID orderId, UUID userId);

    /**
     * Withdraws every approval request the user still has open, deleting the orders.
     * Best effort: failures are logged and the remaining orders are still processed.
     *
     * @return number of orders withdrawn
     */
    int cancelAllPendingApprovals(UUID userId);
}
