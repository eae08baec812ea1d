package com.campuseats.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_user_status", columnList = "user_id, status"),
        @Index(name = "idx_orders_vendor_status", columnList = "vendor_id, status"),
        @Index(name = "idx_orders_status_expiry", columnList = "status, reservation_expires_at")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Order {

    // Assigned by checkout before reservations are taken, the id doubles as the
    // reservation holder for this checkout session
    @Id
    @ToString.Include
    private UUID id;

    @ToString.Include
    @Column(name = "order_number", nullable = false, unique = true)
    private String orderNumber;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "vendor_id", nullable = false)
    private UUID vendorId;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    private List<OrderItem> items = new ArrayList<>();

    @Column(nullable = false)
    private BigDecimal itemsTotal;

    @Column(nullable = false)
    private BigDecimal packagingCharge;

    @Column(nullable = false)
    private BigDecimal deliveryCharge;

    @Column(nullable = false)
    private BigDecimal platformFee;

    @Column(nullable = false)
    private BigDecimal total;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderType orderType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentMethod paymentMethod;

    private String collectorName;

    private String collectorPhone;

    // Only set for DELIVERY orders
    private String address;

    @ToString.Include
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderStatus status;

    private String denialReason;

    // Order id issued by the payment gateway, ONLINE orders only
    @Column(name = "gateway_order_id")
    private String gatewayOrderId;

    // Gateway payment id once verified
    private String paymentReference;

    @Column(name = "reservation_expires_at", nullable = false)
    private Instant reservationExpiresAt;

    // Soft delete, archived orders are hidden from every query
    @Column(nullable = false)
    private boolean deleted;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public void addItem(OrderItem item) {
        item.setOrder(this);
        items.add(item);
    }
}
