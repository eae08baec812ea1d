package com.campuseats.common.contracts;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Contract for order status change events.
 *
 * Used for events like:
 * - order.created
 * - order.in_progress
 * - order.denied
 * - order.delivered
 *
 * Contains everything a notification consumer needs to tell the user or vendor.
 */
@Data
@Builder
public class OrderStatusChangeContract {
    private UUID orderId;
    private String orderNumber;
    private UUID userId;
    private UUID vendorId;
    private String status;          // PENDING_PAYMENT, IN_PROGRESS, READY, DELIVERED, DENIED ...
    private String previousStatus;  // null for order.created
    private String orderType;
    private BigDecimal total;
    private String reason;          // denial reason or failure cause, nullable
    private Instant occurredAt;
}
