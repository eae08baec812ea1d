package com.campuseats.orderservice.model;

import java.util.EnumSet;
import java.util.Set;

public enum OrderStatus {
    PENDING_PAYMENT,
    PENDING_VENDOR_APPROVAL,
    IN_PROGRESS,
    READY,
    COMPLETED,
    ON_THE_WAY,
    DELIVERED,
    DENIED,
    CANCELLED,
    FAILED,
    EXPIRED;

    public static final Set<OrderStatus> PENDING = EnumSet.of(PENDING_PAYMENT, PENDING_VENDOR_APPROVAL);

    // statuses that keep an order on the vendor's and user's active lists
    public static final Set<OrderStatus> ACTIVE = EnumSet.of(IN_PROGRESS, READY, COMPLETED, ON_THE_WAY);

    public static final Set<OrderStatus> TERMINAL = EnumSet.of(DELIVERED, DENIED, CANCELLED, FAILED, EXPIRED);

    public boolean isPending() {
        return PENDING.contains(this);
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
