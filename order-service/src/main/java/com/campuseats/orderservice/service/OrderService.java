package com.campuseats.orderservice.service;

import com.campuseats.orderservice.dto.OrderResponse;

import java.util.List;
import java.util.UUID;

public interface OrderService {

    /**
     * Visible to the ordering user and to the vendor that fulfils it.
     */
    OrderResponse getOrderById(UUID orderId, UUID userId, UUID vendorId);

    List<OrderResponse> getMyOrders(UUID userId);

    List<OrderResponse> getPendingApprovals(UUID vendorId);

    List<OrderResponse> getActiveOrders(UUID vendorId);

    /**
     * Cash orders placed for pickup whose reservation is still live, oldest first.
     */
    List<OrderResponse> getAwaitingCashPayment(UUID vendorId);

    /**
     * Completed, delivered and failed orders of the vendor, newest first. Archived orders are left out.
     */
    List<OrderResponse> getPastOrders(UUID vendorId);

    OrderResponse markReady(UUID orderId, UUID vendorId);

    OrderResponse completeOrder(UUID orderId, UUID vendorId);

    OrderResponse startDelivery(UUID orderId, UUID vendorId);

    OrderResponse deliverOrder(UUID orderId, UUID vendorId);

    void archiveOrder(UUID orderId, UUID vendorId);
}
